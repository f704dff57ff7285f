package org.ctl.translation;

import org.ctl.formula.FormulaNode;
import org.ctl.formula.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * INTERNER DELLE PROPOSIZIONI ATOMICHE
 *
 * Associa a ogni sottoalbero atomico un simbolo stabile della sequenza p0, p1, p2, ...
 * usando come chiave la serializzazione canonica del sottoalbero. È l'unico stato mutabile
 * dell'intera traduzione e rappresenta una sessione: il chiamante decide se crearne uno per
 * documento o condividerlo su tutto il batch.
 *
 * PROPRIETÀ GARANTITE:
 * - Sottoalberi con la stessa forma canonica ricevono sempre lo stesso simbolo
 * - Chiavi distinte non condividono mai un simbolo
 * - Il k-esimo sottoalbero distinto incontrato riceve p(k-1)
 * - La tabella cresce in modo monotono e conserva l'ordine di inserimento
 *
 * Non è thread-safe: una sessione appartiene a un solo thread alla volta.
 */
public class PropositionInterner {

    private static final Logger LOGGER = Logger.getLogger(PropositionInterner.class.getName());

    /** Prefisso dei simboli generati */
    private static final String SYMBOL_PREFIX = "p";

    /**
     * Chiave canonica -> simbolo, in ordine di allocazione.
     * Il prossimo indice coincide sempre con la dimensione della tabella.
     */
    private final Map<String, String> table = new LinkedHashMap<>();

    //region INTERFACCIA PUBBLICA

    /**
     * Restituisce il simbolo del sottoalbero, allocandone uno nuovo alla prima occorrenza.
     *
     * @param node radice del sottoalbero atomico (non null)
     * @return simbolo associato
     */
    public String intern(FormulaNode node) {
        if (node == null) {
            throw new IllegalArgumentException("Nodo null non internabile");
        }

        String key = canonicalKey(node);
        String symbol = table.get(key);
        if (symbol == null) {
            symbol = SYMBOL_PREFIX + table.size();
            table.put(key, symbol);
            LOGGER.finest("Nuova proposizione " + symbol + " := " + key);
        }
        return symbol;
    }

    /**
     * Numero di proposizioni distinte registrate.
     */
    public int size() {
        return table.size();
    }

    /**
     * Vista non modificabile della tabella (chiave canonica -> simbolo) in ordine di allocazione.
     */
    public Map<String, String> entries() {
        return Collections.unmodifiableMap(table);
    }

    /**
     * Righe "simbolo TAB chiave" in ordine di allocazione, per l'esportazione della tabella.
     */
    public List<String> toTableLines() {
        List<String> lines = new ArrayList<>(table.size());
        for (Map.Entry<String, String> e : table.entrySet()) {
            lines.add(e.getValue() + "\t" + e.getKey());
        }
        return lines;
    }

    //endregion

    //region PUNTI DI RIPRISTINO

    /**
     * Segna lo stato corrente della tabella.
     * Usato dall'estrattore prima di tradurre una proprietà.
     */
    public int mark() {
        return table.size();
    }

    /**
     * Elimina le proposizioni allocate dopo il punto indicato.
     * Una proprietà scartata non deve consumare simboli.
     *
     * @param mark valore restituito da {@link #mark()}
     */
    public void rollback(int mark) {
        if (mark < 0 || mark > table.size()) {
            throw new IllegalArgumentException("Punto di ripristino non valido: " + mark
                    + " (dimensione tabella " + table.size() + ")");
        }

        int index = 0;
        Iterator<Map.Entry<String, String>> it = table.entrySet().iterator();
        while (it.hasNext()) {
            it.next();
            if (index++ >= mark) {
                it.remove();
            }
        }
    }

    //endregion

    //region SERIALIZZAZIONE CANONICA

    /**
     * Serializzazione canonica di un sottoalbero, indipendente dal contesto in cui compare.
     *
     * Forma: {@code <tag>testo</tag>} per le foglie con testo, {@code <tag/>} per quelle vuote,
     * {@code <tag>figli...</tag>} per i nodi interni. Prefissi di namespace, indentazione e
     * commenti del documento sorgente non influiscono sul risultato.
     *
     * @param node radice del sottoalbero
     * @return chiave canonica
     */
    public static String canonicalKey(FormulaNode node) {
        StringBuilder sb = new StringBuilder();
        appendCanonical(node, sb);
        return sb.toString();
    }

    private static void appendCanonical(FormulaNode node, StringBuilder sb) {
        String tag = qualifiedTag(node);
        if (node.isLeaf() && node.getText() == null) {
            sb.append('<').append(tag).append("/>");
            return;
        }

        sb.append('<').append(tag).append('>');
        if (node.isLeaf()) {
            appendEscaped(node.getText(), sb);
        } else {
            for (FormulaNode child : node.getChildren()) {
                appendCanonical(child, sb);
            }
        }
        sb.append("</").append(tag).append('>');
    }

    /**
     * I tag MCC restano col solo nome locale, gli altri portano il namespace come {@code {uri}nome}.
     */
    private static String qualifiedTag(FormulaNode node) {
        String namespace = node.getNamespace();
        if (NodeKind.MCC_NAMESPACE.equals(namespace)) {
            return node.getTag();
        }
        return "{" + (namespace != null ? namespace : "") + "}" + node.getTag();
    }

    private static void appendEscaped(String text, StringBuilder sb) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                default -> sb.append(c);
            }
        }
    }

    //endregion
}
