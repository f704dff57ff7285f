package org.ctl.translation;

/**
 * Un nodo della formula non è traducibile: foglia con tag non riconosciuto oppure operatore
 * con figli mancanti. La proprietà che lo contiene viene scartata.
 */
public class TranslationException extends Exception {

    private final String tag;

    public TranslationException(String tag, String message) {
        super(message);
        this.tag = tag;
    }

    /**
     * Tag del nodo che ha causato l'errore.
     */
    public String getTag() {
        return tag;
    }
}
