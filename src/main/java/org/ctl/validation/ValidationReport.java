package org.ctl.validation;

import java.util.List;

/**
 * Esito della validazione di una formula rispetto alla grammatica di un dialetto.
 *
 * @param formula formula validata (senza terminatore)
 * @param errors errori sintattici e di grafia, vuoto se valida
 * @param info misure della formula, null se il parsing non è riuscito
 */
public record ValidationReport(String formula, List<String> errors, FormulaInfo info) {

    public ValidationReport {
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
