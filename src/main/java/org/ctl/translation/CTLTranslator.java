package org.ctl.translation;

import org.ctl.formula.FormulaNode;
import org.ctl.formula.NodeKind;

import java.util.List;
import java.util.logging.Logger;

/**
 * TRADUTTORE DI FORMULE CTL - Da albero XML MCC a formula testuale
 *
 * Discesa ricorsiva sull'albero della formula con dispatch sul tipo di nodo. Il dialetto e la
 * politica di resa degli atomi sono fissati alla costruzione; l'unico stato mutabile, la
 * tabella delle proposizioni, arriva come parametro esplicito di ogni chiamata.
 *
 * REGOLE DI TRADUZIONE (prima corrispondenza vince):
 * 1. Congiunzione:   ( f1 AND f2 ... )
 * 2. Disgiunzione:   ( f1 OR f2 ... )
 * 3. Negazione:      NOT(f)
 * 4. Quantificatore + operatore temporale:
 *    - QG (f), QF (f)
 *    - next nativo: QX (f); altrimenti Q(false W (f))
 *    - until: Q(before U reach), con before/reach un livello sotto i figli di until
 * 5. Proposizioni atomiche: simbolo dell'interner (OPAQUE) oppure scomposizione (STRUCTURAL)
 * 6. Costanti true/false: letterali del dialetto
 * 7. Nodo sconosciuto con figli, oppure operatore temporale fuori da un quantificatore:
 *    wrapper trasparente sul primo figlio
 * 8. Foglia sconosciuta: TranslationException
 *
 * La traduzione è deterministica: stesso albero, stesso dialetto e interner nuovo producono
 * la stessa stringa, byte per byte.
 */
public class CTLTranslator {

    private static final Logger LOGGER = Logger.getLogger(CTLTranslator.class.getName());

    private final DialectConfig dialect;
    private final AtomRenderingPolicy policy;

    public CTLTranslator(DialectConfig dialect, AtomRenderingPolicy policy) {
        if (dialect == null) {
            throw new IllegalArgumentException("Dialetto non può essere null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("Politica atomi non può essere null");
        }
        this.dialect = dialect;
        this.policy = policy;
    }

    public DialectConfig getDialect() {
        return dialect;
    }

    //region PUNTO DI INGRESSO

    /**
     * Traduce il sottoalbero radicato in {@code node}.
     *
     * @param node radice della formula (tipicamente l'elemento {@code <formula>})
     * @param interner sessione delle proposizioni; cresce con i nuovi atomi incontrati
     * @return formula nel dialetto configurato, senza terminatore
     * @throws TranslationException se il sottoalbero contiene una foglia non riconosciuta
     *                              o un operatore malformato
     */
    public String translate(FormulaNode node, PropositionInterner interner) throws TranslationException {
        if (node == null) {
            throw new IllegalArgumentException("Nodo formula null");
        }
        if (interner == null) {
            throw new IllegalArgumentException("Interner null: la sessione deve essere esplicita");
        }

        NodeKind kind = node.getKind();
        return switch (kind) {
            case CONJUNCTION -> translateJunction(node, dialect.and(), interner);
            case DISJUNCTION -> translateJunction(node, dialect.or(), interner);
            case NEGATION -> dialect.not() + "(" + translate(singleChild(node), interner) + ")";

            case ALL_PATHS -> translatePathFormula(dialect.allPaths(), node, interner);
            case EXISTS_PATH -> translatePathFormula(dialect.existsPath(), node, interner);

            // Fuori da un quantificatore l'operatore temporale non ha resa propria
            case GLOBALLY, FINALLY, NEXT, UNTIL -> translateUnrecognized(node, interner);

            case INTEGER_LE, INTEGER_EQ, IS_FIREABLE, TOKENS_COUNT, PLACE, INTEGER_CONSTANT, TRANSITION ->
                    translateAtomic(node, interner);

            case TRUE -> dialect.trueLiteral();
            case FALSE -> dialect.falseLiteral();

            case OTHER -> translateUnrecognized(node, interner);
        };
    }

    //endregion

    //region CONNETTIVI BOOLEANI

    /**
     * Congiunzione e disgiunzione: figli tradotti e uniti dal token, tutto tra parentesi.
     * Un solo figlio produce un passaggio tra parentesi, accettato così com'è.
     */
    private String translateJunction(FormulaNode node, String token, PropositionInterner interner)
            throws TranslationException {
        List<FormulaNode> children = node.getChildren();
        if (children.isEmpty()) {
            throw new TranslationException(node.getTag(), "Nodo '" + node.getTag() + "' senza operandi");
        }

        String separator = " " + token + " ";
        StringBuilder result = new StringBuilder("(");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                result.append(separator);
            }
            result.append(translate(children.get(i), interner));
        }
        return result.append(')').toString();
    }

    //endregion

    //region QUANTIFICATORI E OPERATORI TEMPORALI

    /**
     * Quantificatore di cammino con il suo unico figlio operatore.
     *
     * @param quantifier grafia del quantificatore (A o E nel dialetto)
     * @param node nodo all-paths / exists-path
     */
    private String translatePathFormula(String quantifier, FormulaNode node, PropositionInterner interner)
            throws TranslationException {
        FormulaNode operator = singleChild(node);

        return switch (operator.getKind()) {
            case GLOBALLY -> quantifier + dialect.globally() + " (" + translate(singleChild(operator), interner) + ")";
            case FINALLY -> quantifier + dialect.eventually() + " (" + translate(singleChild(operator), interner) + ")";
            case NEXT -> translateNext(quantifier, operator, interner);
            case UNTIL -> translateUntil(quantifier, operator, interner);
            default -> throw new TranslationException(operator.getTag(),
                    "Operatore temporale non supportato sotto '" + node.getTag() + "': " + operator.getTag());
        };
    }

    /**
     * Next nativo se il dialetto lo ammette, altrimenti la riscrittura equivalente
     * X p == false W p.
     */
    private String translateNext(String quantifier, FormulaNode operator, PropositionInterner interner)
            throws TranslationException {
        String operand = translate(singleChild(operator), interner);
        if (dialect.nativeNext()) {
            return quantifier + dialect.next() + " (" + operand + ")";
        }
        return quantifier + "(" + dialect.falseLiteral() + " " + dialect.weakUntil() + " (" + operand + "))";
    }

    /**
     * Until: i due figli (before, reach) incapsulano ciascuno una sottoformula un livello più in basso.
     */
    private String translateUntil(String quantifier, FormulaNode operator, PropositionInterner interner)
            throws TranslationException {
        List<FormulaNode> children = operator.getChildren();
        if (children.size() != 2) {
            throw new TranslationException(operator.getTag(),
                    "Until richiede esattamente 2 figli, trovati " + children.size());
        }

        String before = translate(firstChild(children.get(0)), interner);
        String reach = translate(firstChild(children.get(1)), interner);
        return quantifier + "(" + before + " " + dialect.until() + " " + reach + ")";
    }

    //endregion

    //region PROPOSIZIONI ATOMICHE

    private String translateAtomic(FormulaNode node, PropositionInterner interner) throws TranslationException {
        return switch (policy) {
            case OPAQUE -> interner.intern(node);
            case STRUCTURAL -> translateStructural(node, interner);
        };
    }

    /**
     * Scomposizione dei predicati atomici in termini di posti, costanti e transizioni.
     */
    private String translateStructural(FormulaNode node, PropositionInterner interner) throws TranslationException {
        return switch (node.getKind()) {
            case INTEGER_LE -> translateComparison(node, "<=", interner);
            case INTEGER_EQ -> translateComparison(node, "=", interner);

            // Più posti nello stesso conteggio indicano la somma dei loro token
            case TOKENS_COUNT -> joinChildren(node, " + ", interner);

            case IS_FIREABLE -> {
                if (node.getChildren().size() == 1) {
                    yield translate(node.getChild(0), interner);
                }
                // Più transizioni: abilitata almeno una
                yield "(" + joinChildren(node, " " + dialect.or() + " ", interner) + ")";
            }

            case PLACE, INTEGER_CONSTANT, TRANSITION -> leafText(node);

            default -> throw new IllegalStateException("Tipo non atomico in resa strutturale: " + node.getKind());
        };
    }

    private String translateComparison(FormulaNode node, String comparator, PropositionInterner interner)
            throws TranslationException {
        List<FormulaNode> children = node.getChildren();
        if (children.size() != 2) {
            throw new TranslationException(node.getTag(),
                    "Confronto '" + node.getTag() + "' richiede 2 operandi, trovati " + children.size());
        }
        return "(" + translate(children.get(0), interner) + " " + comparator + " "
                + translate(children.get(1), interner) + ")";
    }

    private String joinChildren(FormulaNode node, String separator, PropositionInterner interner)
            throws TranslationException {
        List<FormulaNode> children = node.getChildren();
        if (children.isEmpty()) {
            throw new TranslationException(node.getTag(), "Nodo '" + node.getTag() + "' senza operandi");
        }

        StringBuilder result = new StringBuilder();
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                result.append(separator);
            }
            result.append(translate(children.get(i), interner));
        }
        return result.toString();
    }

    private static String leafText(FormulaNode node) throws TranslationException {
        if (!node.isLeaf() || node.getText() == null) {
            throw new TranslationException(node.getTag(), "Nodo '" + node.getTag() + "' privo di testo");
        }
        return node.getText();
    }

    //endregion

    //region NODI NON RICONOSCIUTI

    /**
     * Wrapper senza peso semantico (ad esempio {@code <formula>}): si prosegue sul primo figlio.
     * Una foglia sconosciuta è l'unico caso base senza traduzione.
     */
    private String translateUnrecognized(FormulaNode node, PropositionInterner interner) throws TranslationException {
        if (node.isLeaf()) {
            throw new TranslationException(node.getTag(), "Tag XML sconosciuto o non gestito: " + node.getTag());
        }
        LOGGER.finest("Wrapper trasparente: " + node.getTag());
        return translate(node.getChild(0), interner);
    }

    //endregion

    //region SUPPORTO

    private static FormulaNode singleChild(FormulaNode node) throws TranslationException {
        if (node.getChildren().size() != 1) {
            throw new TranslationException(node.getTag(),
                    "Nodo '" + node.getTag() + "' richiede esattamente un figlio, trovati " + node.getChildren().size());
        }
        return node.getChild(0);
    }

    private static FormulaNode firstChild(FormulaNode node) throws TranslationException {
        if (node.isLeaf()) {
            throw new TranslationException(node.getTag(), "Nodo '" + node.getTag() + "' privo di sottoformula");
        }
        return node.getChild(0);
    }

    //endregion
}
