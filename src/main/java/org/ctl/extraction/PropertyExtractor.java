package org.ctl.extraction;

import org.ctl.document.PropertyDocument;
import org.ctl.document.PropertyEntry;
import org.ctl.translation.CTLTranslator;
import org.ctl.translation.PropositionInterner;
import org.ctl.translation.TranslatedProperty;
import org.ctl.translation.TranslationException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * ESTRATTORE DI PROPRIETÀ A LIVELLO DI DOCUMENTO
 *
 * Traduce una per una le voci di un documento con il traduttore configurato e raccoglie
 * le proprietà nell'ordine del documento. Gli errori sono locali alla singola voce:
 *
 * - voce senza id o senza formula: scartata con avviso
 * - TranslationException: registrata, la voce viene omessa, le altre proseguono
 *
 * Ogni voce viene tradotta a partire da un punto di ripristino dell'interner: se la
 * traduzione fallisce le proposizioni allocate nel frattempo vengono rimosse, così una
 * voce scartata non consuma simboli.
 */
public class PropertyExtractor {

    private static final Logger LOGGER = Logger.getLogger(PropertyExtractor.class.getName());

    private final CTLTranslator translator;

    public PropertyExtractor(CTLTranslator translator) {
        if (translator == null) {
            throw new IllegalArgumentException("Traduttore non può essere null");
        }
        this.translator = translator;
    }

    /**
     * Estrae tutte le proprietà del documento.
     *
     * @param document documento analizzato
     * @param interner sessione delle proposizioni (per documento o condivisa, a scelta del chiamante)
     * @return proprietà tradotte e voci scartate
     */
    public ExtractionResult extract(PropertyDocument document, PropositionInterner interner) {
        List<TranslatedProperty> properties = new ArrayList<>();
        List<SkippedProperty> skipped = new ArrayList<>();

        for (PropertyEntry entry : document.entries()) {
            if (!entry.hasId()) {
                skip(document, skipped, new SkippedProperty(entry.position(), null, SkipReason.MISSING_ID,
                        "voce senza <id>"));
                continue;
            }
            if (!entry.hasFormula()) {
                skip(document, skipped, new SkippedProperty(entry.position(), entry.id(), SkipReason.MISSING_FORMULA,
                        "voce senza <formula>"));
                continue;
            }

            int mark = interner.mark();
            try {
                String formula = translator.translate(entry.formula(), interner);
                properties.add(new TranslatedProperty(entry.id(), formula));
                LOGGER.finest(entry.id() + " -> " + formula);
            } catch (TranslationException e) {
                interner.rollback(mark);
                skip(document, skipped, new SkippedProperty(entry.position(), entry.id(), SkipReason.TRANSLATION_ERROR,
                        e.getMessage()));
            }
        }

        LOGGER.fine("Documento " + document.source() + ": " + properties.size() + " proprietà tradotte, "
                + skipped.size() + " scartate (" + translator.getDialect().name() + ")");
        return new ExtractionResult(document.source(), properties, skipped);
    }

    private static void skip(PropertyDocument document, List<SkippedProperty> skipped, SkippedProperty diagnostic) {
        skipped.add(diagnostic);
        String label = diagnostic.id() != null ? diagnostic.id() : "#" + diagnostic.position();
        LOGGER.warning("Proprietà " + label + " in " + document.source() + " scartata ("
                + diagnostic.reason() + "): " + diagnostic.detail());
    }
}
