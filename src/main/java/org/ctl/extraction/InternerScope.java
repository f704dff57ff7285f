package org.ctl.extraction;

import java.util.Locale;

/**
 * Ambito di numerazione delle proposizioni in una esecuzione batch.
 * I due ambiti non vengono mai mescolati nella stessa esecuzione.
 */
public enum InternerScope {

    /** Un interner nuovo per ogni documento: simboli locali al file, elaborazione parallelizzabile */
    DOCUMENT,

    /** Un solo interner per tutto il batch: vocabolario globale, elaborazione sequenziale */
    BATCH;

    public static InternerScope byName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Nome ambito null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "document" -> DOCUMENT;
            case "batch" -> BATCH;
            default -> throw new IllegalArgumentException("Ambito non supportato: " + name
                    + ". Supportati: document, batch");
        };
    }
}
