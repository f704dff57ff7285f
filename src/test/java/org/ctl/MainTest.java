package org.ctl;

import org.ctl.extraction.InternerScope;
import org.ctl.translation.AtomRenderingPolicy;
import org.ctl.translation.DialectConfig;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * Parsing dei parametri della linea di comando.
 */
public class MainTest {

    @Rule
    public TemporaryFolder temp = new TemporaryFolder();

    private static Main.ExtractionConfiguration parse(String... args) {
        return new Main.ArgumentParser().parse(args);
    }

    @Test
    public void testDefaults() throws Exception {
        File dir = temp.newFolder("INPUTS");

        Main.ExtractionConfiguration config = parse("-d", dir.getPath());

        assertEquals(dir.getPath(), config.inputPath);
        assertNull(config.outputPath);
        assertFalse(config.isFileMode);
        assertEquals(Arrays.asList(DialectConfig.SYMBOLIC, DialectConfig.KEYWORD), config.dialects);
        assertEquals(AtomRenderingPolicy.OPAQUE, config.policy);
        assertEquals(InternerScope.DOCUMENT, config.scope);
        assertEquals(1, config.threads);
        assertFalse(config.exportTable);
        assertFalse(config.validate);
        assertFalse(config.verbose);
    }

    @Test
    public void testAllOptions() throws Exception {
        File file = temp.newFile("CTLCardinality.xml");
        File out = new File(temp.getRoot(), "OUTPUT");

        Main.ExtractionConfiguration config = parse("-f", file.getPath(), "-o", out.getPath(),
                "-dialect=keyword", "-policy=structural", "-scope=batch", "-table", "-validate", "-v");

        assertTrue(config.isFileMode);
        assertEquals(out.getPath(), config.outputPath);
        assertEquals(Collections.singletonList(DialectConfig.KEYWORD), config.dialects);
        assertEquals(AtomRenderingPolicy.STRUCTURAL, config.policy);
        assertEquals(InternerScope.BATCH, config.scope);
        assertTrue(config.exportTable);
        assertTrue(config.validate);
        assertTrue(config.verbose);
    }

    @Test
    public void testThreads() throws Exception {
        File dir = temp.newFolder("INPUTS");
        assertEquals(8, parse("-d", dir.getPath(), "-j", "8").threads);
    }

    @Test
    public void testHelpReturnsNull() {
        assertNull(parse("-h"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingInputRejected() {
        parse("-dialect=symbolic");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFileAndDirectoryExclusive() throws Exception {
        File file = temp.newFile("a.xml");
        File dir = temp.newFolder("INPUTS");
        parse("-f", file.getPath(), "-d", dir.getPath());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBatchScopeWithThreadsRejected() throws Exception {
        File dir = temp.newFolder("INPUTS");
        parse("-d", dir.getPath(), "-scope=batch", "-j", "4");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidThreadCountRejected() throws Exception {
        File dir = temp.newFolder("INPUTS");
        parse("-d", dir.getPath(), "-j", "zero");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownDialectRejected() throws Exception {
        File dir = temp.newFolder("INPUTS");
        parse("-d", dir.getPath(), "-dialect=smv");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownParameterRejected() throws Exception {
        File dir = temp.newFolder("INPUTS");
        parse("-d", dir.getPath(), "-opt=all");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingFileRejected() {
        parse("-f", new File(temp.getRoot(), "missing.xml").getPath());
    }
}
