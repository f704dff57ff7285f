package org.ctl.validation;

import java.util.Set;

/**
 * Misure di una formula validata.
 *
 * @param size numero di nodi dell'albero sintattico (operatori, atomi, letterali)
 * @param temporalOperators numero di operatori temporali (unari e binari)
 * @param atoms identificatori distinti (simboli o nomi di posti/transizioni)
 * @param comparisons numero di atomi di confronto
 */
public record FormulaInfo(int size, int temporalOperators, Set<String> atoms, int comparisons) {

    public FormulaInfo {
        atoms = Set.copyOf(atoms);
    }
}
