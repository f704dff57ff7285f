package org.ctl.formula;

import java.util.List;

/**
 * Vista in sola lettura di un nodo dell'albero della formula.
 *
 * L'albero viene costruito una volta dal documento sorgente ed è immutabile per tutta la
 * traduzione: i figli sono posseduti dal padre, l'albero è finito e aciclico.
 */
public interface FormulaNode {

    /**
     * Nome locale del tag (senza namespace).
     */
    String getTag();

    /**
     * URI del namespace del tag, null se il tag non ne ha.
     */
    String getNamespace();

    /**
     * Tipo del nodo nel vocabolario chiuso, calcolato alla costruzione.
     */
    NodeKind getKind();

    /**
     * Figli nell'ordine del documento; lista vuota per le foglie, mai null.
     */
    List<FormulaNode> getChildren();

    /**
     * Testo della foglia (già ripulito dagli spazi esterni), null se assente o se il nodo ha figli.
     */
    String getText();

    default boolean isLeaf() {
        return getChildren().isEmpty();
    }

    default FormulaNode getChild(int index) {
        return getChildren().get(index);
    }
}
