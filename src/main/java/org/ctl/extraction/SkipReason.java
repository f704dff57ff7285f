package org.ctl.extraction;

/**
 * Motivo per cui una voce del documento non ha prodotto una proprietà tradotta.
 */
public enum SkipReason {
    MISSING_ID,
    MISSING_FORMULA,
    TRANSLATION_ERROR
}
