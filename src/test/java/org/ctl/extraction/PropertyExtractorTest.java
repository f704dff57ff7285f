package org.ctl.extraction;

import org.ctl.document.PropertyDocument;
import org.ctl.document.PropertyDocumentParser;
import org.ctl.translation.AtomRenderingPolicy;
import org.ctl.translation.CTLTranslator;
import org.ctl.translation.DialectConfig;
import org.ctl.translation.PropositionInterner;
import org.junit.Test;

import java.io.InputStream;

import static org.junit.Assert.*;

/**
 * Estrazione delle proprietà a livello di documento.
 */
public class PropertyExtractorTest {

    private static PropertyDocument load(String name) throws Exception {
        try (InputStream in = PropertyExtractorTest.class.getResourceAsStream("/fixtures/" + name)) {
            return new PropertyDocumentParser().parse(in, name);
        }
    }

    private static PropertyExtractor extractor(DialectConfig dialect) {
        return new PropertyExtractor(new CTLTranslator(dialect, AtomRenderingPolicy.OPAQUE));
    }

    @Test
    public void testAllPropertiesTranslated() throws Exception {
        PropositionInterner interner = new PropositionInterner();
        ExtractionResult result = extractor(DialectConfig.SYMBOLIC).extract(load("CTLCardinality.xml"), interner);

        assertEquals(3, result.translatedCount());
        assertEquals(0, result.skippedCount());
        assertEquals("Model-CTLCardinality-00", result.properties().get(0).id());
        assertEquals("AG ((p0 & p1))", result.properties().get(0).formula());
        assertEquals("EF (!(p0))", result.properties().get(1).formula());
        assertEquals("A(true U p2)", result.properties().get(2).formula());
        assertEquals(3, interner.size());
    }

    @Test
    public void testKeywordDialect() throws Exception {
        ExtractionResult result = extractor(DialectConfig.KEYWORD)
                .extract(load("CTLCardinality.xml"), new PropositionInterner());

        assertEquals("AG ((p0 AND p1))", result.properties().get(0).formula());
        assertEquals("EF (NOT(p0))", result.properties().get(1).formula());
        assertEquals("A(TRUE U p2)", result.properties().get(2).formula());
    }

    /**
     * Le voci difettose vengono scartate singolarmente; la voce fallita a metà traduzione
     * non lascia simboli nell'interner.
     */
    @Test
    public void testDefectiveEntriesSkipped() throws Exception {
        PropositionInterner interner = new PropositionInterner();
        ExtractionResult result = extractor(DialectConfig.SYMBOLIC).extract(load("partial.xml"), interner);

        assertEquals(1, result.translatedCount());
        assertEquals("Partial-02", result.properties().get(0).id());
        assertEquals("E(false W (p0))", result.properties().get(0).formula());
        assertEquals(1, interner.size());

        assertEquals(3, result.skippedCount());
        assertEquals(SkipReason.MISSING_ID, result.skipped().get(0).reason());
        assertEquals(0, result.skipped().get(0).position());
        assertNull(result.skipped().get(0).id());
        assertEquals(SkipReason.TRANSLATION_ERROR, result.skipped().get(1).reason());
        assertEquals("Partial-01", result.skipped().get(1).id());
        assertEquals(SkipReason.MISSING_FORMULA, result.skipped().get(2).reason());
        assertEquals("Partial-03", result.skipped().get(2).id());
    }

    /**
     * Con un interner condiviso i simboli proseguono da un documento all'altro.
     */
    @Test
    public void testSharedInternerContinuesNumbering() throws Exception {
        PropositionInterner shared = new PropositionInterner();
        PropertyExtractor extractor = extractor(DialectConfig.KEYWORD);

        extractor.extract(load("CTLCardinality.xml"), shared);
        ExtractionResult second = extractor.extract(load("partial.xml"), shared);

        assertEquals("EX (p3)", second.properties().get(0).formula());
        assertEquals(4, shared.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullTranslatorRejected() {
        new PropertyExtractor(null);
    }
}
