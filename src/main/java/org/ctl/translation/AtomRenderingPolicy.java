package org.ctl.translation;

import java.util.Locale;

/**
 * Politica di resa delle proposizioni atomiche; una sola è attiva per traduttore.
 */
public enum AtomRenderingPolicy {

    /** L'intero sottoalbero atomico diventa un simbolo dell'interner (p0, p1, ...) */
    OPAQUE,

    /** I predicati vengono scomposti: confronti, posti, costanti e transizioni restano leggibili */
    STRUCTURAL;

    public static AtomRenderingPolicy byName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Nome politica null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "opaque" -> OPAQUE;
            case "structural" -> STRUCTURAL;
            default -> throw new IllegalArgumentException("Politica non supportata: " + name
                    + ". Supportate: opaque, structural");
        };
    }
}
