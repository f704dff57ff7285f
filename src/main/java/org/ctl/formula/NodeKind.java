package org.ctl.formula;

import java.util.HashMap;
import java.util.Map;

/**
 * Vocabolario chiuso dei nodi di una formula CTL nel formato XML del Model Checking Contest.
 *
 * La classificazione di un tag avviene una sola volta, alla costruzione del nodo: il traduttore
 * lavora esclusivamente su questo enum con uno switch esaustivo, quindi un tag atomico non può
 * essere scambiato per un wrapper solo perché possiede figli.
 *
 * CATEGORIE:
 * - Connettivi booleani: CONJUNCTION, DISJUNCTION, NEGATION
 * - Quantificatori di cammino: ALL_PATHS, EXISTS_PATH
 * - Operatori temporali (figli di un quantificatore): GLOBALLY, FINALLY, NEXT, UNTIL
 * - Proposizioni atomiche: INTEGER_LE, INTEGER_EQ, IS_FIREABLE, TOKENS_COUNT, PLACE,
 *   INTEGER_CONSTANT, TRANSITION
 * - Costanti: TRUE, FALSE
 * - OTHER: qualsiasi altro elemento (wrapper senza peso semantico o tag sconosciuto)
 */
public enum NodeKind {
    CONJUNCTION("conjunction"),
    DISJUNCTION("disjunction"),
    NEGATION("negation"),

    ALL_PATHS("all-paths"),
    EXISTS_PATH("exists-path"),

    GLOBALLY("globally"),
    FINALLY("finally"),
    NEXT("next"),
    UNTIL("until"),

    INTEGER_LE("integer-le"),
    INTEGER_EQ("integer-eq"),
    IS_FIREABLE("is-fireable"),
    TOKENS_COUNT("tokens-count"),
    PLACE("place"),
    INTEGER_CONSTANT("integer-constant"),
    TRANSITION("transition"),

    TRUE("true"),
    FALSE("false"),

    OTHER(null);

    /** Namespace dei file di proprietà MCC */
    public static final String MCC_NAMESPACE = "http://mcc.lip6.fr/";

    private static final Map<String, NodeKind> BY_TAG = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            if (kind.tag != null) {
                BY_TAG.put(kind.tag, kind);
            }
        }
    }

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    /**
     * Classifica un elemento a partire da namespace e nome locale.
     * Solo gli elementi del namespace MCC appartengono al vocabolario; tutto il resto è OTHER.
     *
     * @param namespace namespace dell'elemento (può essere null)
     * @param localName nome locale dell'elemento
     * @return tipo di nodo, mai null
     */
    public static NodeKind classify(String namespace, String localName) {
        if (!MCC_NAMESPACE.equals(namespace) || localName == null) {
            return OTHER;
        }
        return BY_TAG.getOrDefault(localName, OTHER);
    }
}
