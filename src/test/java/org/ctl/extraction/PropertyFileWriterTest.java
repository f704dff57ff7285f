package org.ctl.extraction;

import org.ctl.formula.FormulaFixtures;
import org.ctl.translation.DialectConfig;
import org.ctl.translation.PropositionInterner;
import org.ctl.translation.TranslatedProperty;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Formato dei file di output.
 */
public class PropertyFileWriterTest {

    @Rule
    public TemporaryFolder temp = new TemporaryFolder();

    private final PropertyFileWriter writer = new PropertyFileWriter();

    private static List<TranslatedProperty> properties(String... formulas) {
        TranslatedProperty[] result = new TranslatedProperty[formulas.length];
        for (int i = 0; i < formulas.length; i++) {
            result[i] = new TranslatedProperty("P-0" + i, formulas[i]);
        }
        return Arrays.asList(result);
    }

    /**
     * Il terminatore segue ogni formula tranne l'ultima del file.
     */
    @Test
    public void testTerminatorBetweenFormulas() {
        List<String> lines = PropertyFileWriter.renderLines(
                properties("AG (p0)", "EF (p1)", "AX (p2)"), DialectConfig.KEYWORD);

        assertEquals(Arrays.asList("AG (p0):", "EF (p1):", "AX (p2)"), lines);
    }

    @Test
    public void testSingleFormulaHasNoTerminator() {
        assertEquals(Collections.singletonList("AG (p0)"),
                PropertyFileWriter.renderLines(properties("AG (p0)"), DialectConfig.KEYWORD));
    }

    @Test
    public void testSymbolicDialectHasNoTerminator() {
        assertEquals(Arrays.asList("AG (p0)", "EF (p1)"),
                PropertyFileWriter.renderLines(properties("AG (p0)", "EF (p1)"), DialectConfig.SYMBOLIC));
    }

    @Test
    public void testWriteCreatesParentDirectories() throws Exception {
        Path target = temp.getRoot().toPath().resolve("nested/dir/model.ctl");

        assertTrue(writer.write(target, properties("AG (p0)", "EF (p1)"), DialectConfig.KEYWORD));
        assertEquals(Arrays.asList("AG (p0):", "EF (p1)"), Files.readAllLines(target, StandardCharsets.UTF_8));
    }

    @Test
    public void testEmptyResultWritesNothing() throws Exception {
        Path target = temp.getRoot().toPath().resolve("empty.txt");

        assertFalse(writer.write(target, Collections.emptyList(), DialectConfig.SYMBOLIC));
        assertFalse(Files.exists(target));
    }

    @Test
    public void testTableExport() throws Exception {
        PropositionInterner interner = new PropositionInterner();
        Path target = temp.getRoot().toPath().resolve("model.symbolic.props");
        assertFalse(writer.writeTable(target, interner));

        interner.intern(FormulaFixtures.formula("<is-fireable><transition>t1</transition></is-fireable>").getChild(0));
        assertTrue(writer.writeTable(target, interner));
        assertEquals(Collections.singletonList("p0\t<is-fireable><transition>t1</transition></is-fireable>"),
                Files.readAllLines(target, StandardCharsets.UTF_8));
    }
}
