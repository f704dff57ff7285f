package org.ctl.translation;

/**
 * Risultato della traduzione di una proprietà: identificativo e formula nel dialetto attivo.
 * La formula non contiene il terminatore, che appartiene al formato del file di output.
 */
public record TranslatedProperty(String id, String formula) {

    @Override
    public String toString() {
        return id + ": " + formula;
    }
}
