package org.ctl.translation;

import java.util.Locale;

/**
 * Configurazione immutabile di un dialetto di output.
 *
 * Raccoglie le grafie di tutti i token e le scelte strutturali che distinguono una grammatica
 * di destinazione dall'altra. Le due istanze predefinite coprono i formati usati a valle:
 *
 * DIALETTI SUPPORTATI:
 * - SYMBOLIC: {@code & | !}, letterali minuscoli, nessun terminatore, "next" riscritto come
 *   weak until con operando sinistro falso (file .txt)
 * - KEYWORD:  {@code AND OR NOT}, letterali maiuscoli, terminatore {@code :}, operatore
 *   next nativo (file .ctl, compatibile LoLA)
 *
 * @param name nome del dialetto, usato da linea di comando e nei nomi dei file
 * @param and token di congiunzione
 * @param or token di disgiunzione
 * @param not token di negazione
 * @param allPaths quantificatore universale di cammino
 * @param existsPath quantificatore esistenziale di cammino
 * @param globally operatore "globally"
 * @param eventually operatore "finally"
 * @param next operatore "next" (usato solo se nativeNext)
 * @param until operatore "until"
 * @param weakUntil operatore "weak until"
 * @param trueLiteral letterale vero
 * @param falseLiteral letterale falso
 * @param terminator separatore di istruzione tra proprietà consecutive (anche vuoto)
 * @param nativeNext true se la grammatica ammette l'operatore next
 * @param fileExtension estensione dei file di output, punto incluso
 */
public record DialectConfig(String name,
                            String and, String or, String not,
                            String allPaths, String existsPath,
                            String globally, String eventually, String next,
                            String until, String weakUntil,
                            String trueLiteral, String falseLiteral,
                            String terminator, boolean nativeNext,
                            String fileExtension) {

    public static final DialectConfig SYMBOLIC = new DialectConfig("symbolic",
            "&", "|", "!",
            "A", "E",
            "G", "F", "X",
            "U", "W",
            "true", "false",
            "", false,
            ".txt");

    public static final DialectConfig KEYWORD = new DialectConfig("keyword",
            "AND", "OR", "NOT",
            "A", "E",
            "G", "F", "X",
            "U", "W",
            "TRUE", "FALSE",
            ":", true,
            ".ctl");

    public DialectConfig {
        requireToken(name, "name");
        requireToken(and, "and");
        requireToken(or, "or");
        requireToken(not, "not");
        requireToken(allPaths, "allPaths");
        requireToken(existsPath, "existsPath");
        requireToken(globally, "globally");
        requireToken(eventually, "eventually");
        requireToken(next, "next");
        requireToken(until, "until");
        requireToken(weakUntil, "weakUntil");
        requireToken(trueLiteral, "trueLiteral");
        requireToken(falseLiteral, "falseLiteral");
        requireToken(fileExtension, "fileExtension");
        if (terminator == null) {
            throw new IllegalArgumentException("Il terminatore può essere vuoto ma non null");
        }
        if (allPaths.equals(existsPath)) {
            throw new IllegalArgumentException("I due quantificatori di cammino devono essere distinti: " + allPaths);
        }
    }

    /**
     * Risolve un dialetto predefinito dal nome (senza distinzione maiuscole/minuscole).
     * Accetta anche "lola" come sinonimo di keyword.
     *
     * @param name nome del dialetto
     * @return dialetto corrispondente
     * @throws IllegalArgumentException se il nome non corrisponde a nessun dialetto
     */
    public static DialectConfig byName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Nome dialetto null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "symbolic" -> SYMBOLIC;
            case "keyword", "lola" -> KEYWORD;
            default -> throw new IllegalArgumentException("Dialetto non supportato: " + name
                    + ". Supportati: symbolic, keyword");
        };
    }

    private static void requireToken(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Token del dialetto non può essere null o vuoto: " + field);
        }
    }
}
