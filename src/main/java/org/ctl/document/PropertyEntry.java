package org.ctl.document;

import org.ctl.formula.FormulaNode;

/**
 * Voce {@code <property>} di un documento, nell'ordine di apparizione.
 *
 * @param position indice della voce nel documento (da 0)
 * @param id identificativo della proprietà, null se mancante o vuoto
 * @param formula radice {@code <formula>} della proprietà, null se mancante
 */
public record PropertyEntry(int position, String id, FormulaNode formula) {

    public boolean hasId() {
        return id != null;
    }

    public boolean hasFormula() {
        return formula != null;
    }
}
