package org.ctl.document;

/**
 * Il documento sorgente non è XML ben formato o non è leggibile.
 * Nessuna proprietà viene estratta da un documento che solleva questa eccezione.
 */
public class MalformedDocumentException extends Exception {

    private final String source;

    public MalformedDocumentException(String source, String message, Throwable cause) {
        super("Documento non valido " + source + ": " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
