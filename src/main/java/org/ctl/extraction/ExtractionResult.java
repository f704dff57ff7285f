package org.ctl.extraction;

import org.ctl.translation.TranslatedProperty;

import java.util.List;

/**
 * Risultato dell'estrazione di un documento: proprietà tradotte nell'ordine del documento
 * e diagnostica delle voci scartate.
 */
public record ExtractionResult(String source, List<TranslatedProperty> properties, List<SkippedProperty> skipped) {

    public ExtractionResult {
        properties = List.copyOf(properties);
        skipped = List.copyOf(skipped);
    }

    public int translatedCount() {
        return properties.size();
    }

    public int skippedCount() {
        return skipped.size();
    }
}
