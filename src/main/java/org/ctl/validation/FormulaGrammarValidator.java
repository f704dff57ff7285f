package org.ctl.validation;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.ctl.parser.CTLFormulaLexer;
import org.ctl.parser.CTLFormulaParser;
import org.ctl.parser.CTLFormulaParser.FormulaContext;
import org.ctl.parser.CTLFormulaParser.IdentifierContext;
import org.ctl.translation.DialectConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * VALIDATORE GRAMMATICALE DELLE FORMULE TRADOTTE
 *
 * Verifica che una formula prodotta dal traduttore sia accettata dalla grammatica dei
 * tool a valle e che usi esclusivamente le grafie del dialetto richiesto. I consumatori
 * delle formule rifiutano qualsiasi deviazione (spazi, terminatore, letterali), quindi il
 * controllo è volutamente rigido.
 *
 * PIPELINE:
 * 1. Rimozione dell'eventuale terminatore finale del dialetto
 * 2. Lexing e parsing ANTLR con raccolta degli errori sintattici
 * 3. Controllo delle grafie dipendenti dal dialetto sulle foglie dell'albero sintattico
 *    (le parole chiave usate come nome di posto o transizione valgono come identificatori)
 * 4. Misura della formula con {@link FormulaInfoCollector}
 */
public class FormulaGrammarValidator {

    private static final Logger LOGGER = Logger.getLogger(FormulaGrammarValidator.class.getName());

    private static final Pattern IDENTIFIER_SHAPE = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_.\\-]*");

    /**
     * Valida una formula rispetto a un dialetto.
     *
     * @param formula formula testuale, con o senza terminatore finale
     * @param dialect dialetto atteso
     * @return esito con errori e misure
     */
    public ValidationReport validate(String formula, DialectConfig dialect) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula null non validabile");
        }
        if (dialect == null) {
            throw new IllegalArgumentException("Dialetto null");
        }

        String body = stripTerminator(formula, dialect);
        List<String> errors = new ArrayList<>();

        // Setup pipeline ANTLR con listener che raccoglie invece di stampare
        CollectingErrorListener listener = new CollectingErrorListener(errors);
        CTLFormulaLexer lexer = new CTLFormulaLexer(CharStreams.fromString(body));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);

        CTLFormulaParser parser = new CTLFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        FormulaContext tree = parser.formula();
        if (!errors.isEmpty()) {
            LOGGER.fine("Formula non conforme alla grammatica: " + body + " " + errors);
            return new ValidationReport(body, errors, null);
        }

        checkDialectSpelling(tree, dialect, errors);

        FormulaInfo info = new FormulaInfoCollector().collect(tree);
        if (!errors.isEmpty()) {
            LOGGER.fine("Formula con grafie estranee al dialetto " + dialect.name() + ": " + body + " " + errors);
        }
        return new ValidationReport(body, errors, info);
    }

    /**
     * Il terminatore appartiene al formato del file: se presente in coda viene ignorato.
     */
    private static String stripTerminator(String formula, DialectConfig dialect) {
        String trimmed = formula.strip();
        String terminator = dialect.terminator();
        if (!terminator.isEmpty() && trimmed.endsWith(terminator)) {
            return trimmed.substring(0, trimmed.length() - terminator.length()).strip();
        }
        return trimmed;
    }

    //region CONTROLLO GRAFIE DEL DIALETTO

    private static void checkDialectSpelling(ParseTree tree, DialectConfig dialect, List<String> errors) {
        if (tree instanceof TerminalNode) {
            TerminalNode leaf = (TerminalNode) tree;
            if (leaf.getParent() instanceof IdentifierContext) {
                checkIdentifier(leaf.getSymbol(), errors);
            } else {
                checkKeyword(leaf.getSymbol(), dialect, errors);
            }
            return;
        }
        for (int i = 0; i < tree.getChildCount(); i++) {
            checkDialectSpelling(tree.getChild(i), dialect, errors);
        }
    }

    private static void checkKeyword(Token token, DialectConfig dialect, List<String> errors) {
        switch (token.getType()) {
            case CTLFormulaLexer.AND -> expect(token, dialect.and(), errors);
            case CTLFormulaLexer.OR -> expect(token, dialect.or(), errors);
            case CTLFormulaLexer.NOT -> expect(token, dialect.not(), errors);
            case CTLFormulaLexer.TRUE -> expect(token, dialect.trueLiteral(), errors);
            case CTLFormulaLexer.FALSE -> expect(token, dialect.falseLiteral(), errors);
            case CTLFormulaLexer.ALL -> expect(token, dialect.allPaths(), errors);
            case CTLFormulaLexer.EXISTS -> expect(token, dialect.existsPath(), errors);
            case CTLFormulaLexer.UNTIL -> expect(token, dialect.until(), errors);
            case CTLFormulaLexer.WEAK_UNTIL -> expect(token, dialect.weakUntil(), errors);
            case CTLFormulaLexer.UNARY_TEMPORAL -> checkUnaryTemporal(token, token.getText(), dialect, errors);
            default -> {
                // costanti, parentesi e confronti non dipendono dal dialetto
            }
        }
    }

    /**
     * Un nome vale in ogni dialetto, ma i simboli degli operatori ({@code &}, {@code |},
     * {@code !}) non sono nomi.
     */
    private static void checkIdentifier(Token token, List<String> errors) {
        if (!IDENTIFIER_SHAPE.matcher(token.getText()).matches()) {
            errors.add(describe(token) + ": identificatore non valido");
        }
    }

    private static void checkUnaryTemporal(Token token, String text, DialectConfig dialect, List<String> errors) {
        String quantifier = text.substring(0, 1);
        String operator = text.substring(1);

        if (!quantifier.equals(dialect.allPaths()) && !quantifier.equals(dialect.existsPath())) {
            errors.add(describe(token) + ": quantificatore estraneo al dialetto " + dialect.name());
        }

        if (operator.equals(dialect.next())) {
            if (!dialect.nativeNext()) {
                errors.add(describe(token) + ": il dialetto " + dialect.name() + " non ammette l'operatore next");
            }
        } else if (!operator.equals(dialect.globally()) && !operator.equals(dialect.eventually())) {
            errors.add(describe(token) + ": operatore temporale estraneo al dialetto " + dialect.name());
        }
    }

    private static void expect(Token token, String expected, List<String> errors) {
        if (!token.getText().equals(expected)) {
            errors.add(describe(token) + ": atteso '" + expected + "'");
        }
    }

    private static String describe(Token token) {
        return "col " + token.getCharPositionInLine() + " '" + token.getText() + "'";
    }

    //endregion

    /**
     * Raccoglie gli errori di lexer e parser come messaggi con posizione.
     */
    private static class CollectingErrorListener extends BaseErrorListener {

        private final List<String> errors;

        CollectingErrorListener(List<String> errors) {
            this.errors = errors;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            errors.add("col " + charPositionInLine + ": " + msg);
        }
    }
}
