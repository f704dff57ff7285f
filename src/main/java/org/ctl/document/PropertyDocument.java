package org.ctl.document;

import java.util.List;

/**
 * Documento di proprietà già analizzato: nome della sorgente e voci in ordine di documento.
 */
public record PropertyDocument(String source, List<PropertyEntry> entries) {

    public PropertyDocument {
        entries = List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }
}
