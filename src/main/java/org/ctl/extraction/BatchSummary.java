package org.ctl.extraction;

/**
 * Riepilogo di una esecuzione batch.
 *
 * I conteggi delle proprietà sono sommati su tutti i dialetti richiesti: con due dialetti
 * ogni proprietà tradotta conta due volte.
 *
 * @param documentsFound documenti individuati nell'input
 * @param documentsProcessed documenti analizzati ed estratti
 * @param documentsFailed documenti scartati (XML malformato o scrittura fallita)
 * @param propertiesTranslated formule prodotte
 * @param propertiesSkipped voci scartate
 * @param filesWritten file di output scritti (formule e tabelle)
 * @param invalidFormulas formule respinte dal validatore grammaticale
 */
public record BatchSummary(int documentsFound, int documentsProcessed, int documentsFailed,
                           int propertiesTranslated, int propertiesSkipped,
                           int filesWritten, int invalidFormulas) {

    public static BatchSummary empty() {
        return new BatchSummary(0, 0, 0, 0, 0, 0, 0);
    }

    public boolean hasFailures() {
        return documentsFailed > 0 || invalidFormulas > 0;
    }

    public double successRate() {
        return documentsFound == 0 ? 0.0 : (double) documentsProcessed / documentsFound * 100;
    }
}
