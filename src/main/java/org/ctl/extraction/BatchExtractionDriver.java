package org.ctl.extraction;

import org.ctl.document.MalformedDocumentException;
import org.ctl.document.PropertyDocument;
import org.ctl.document.PropertyDocumentParser;
import org.ctl.translation.AtomRenderingPolicy;
import org.ctl.translation.CTLTranslator;
import org.ctl.translation.DialectConfig;
import org.ctl.translation.PropositionInterner;
import org.ctl.translation.TranslatedProperty;
import org.ctl.validation.FormulaGrammarValidator;
import org.ctl.validation.ValidationReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * DRIVER DI ESTRAZIONE BATCH
 *
 * Elabora un file o un'intera directory di documenti MCC e scrive, per ogni documento e
 * per ogni dialetto richiesto, un file di formule con il nome del documento e l'estensione
 * del dialetto. La struttura delle sottodirectory dell'input viene riprodotta nell'output.
 *
 * PIPELINE PER DOCUMENTO:
 * 1. Parsing DOM del documento (un documento malformato viene saltato, gli altri proseguono)
 * 2. Per ogni dialetto: estrazione con l'interner dell'ambito configurato
 * 3. Scrittura delle formule (ed eventualmente della tabella delle proposizioni)
 * 4. Validazione grammaticale opzionale delle formule prodotte
 *
 * AMBITI DI NUMERAZIONE:
 * - DOCUMENT: interner nuovo per ogni documento e dialetto; i documenti sono indipendenti e
 *   possono essere elaborati da più thread
 * - BATCH: un interner per dialetto condiviso da tutti i documenti, elaborazione sequenziale
 *   nell'ordine dei file; le tabelle vengono esportate una sola volta alla fine
 */
public class BatchExtractionDriver {

    private static final Logger LOGGER = Logger.getLogger(BatchExtractionDriver.class.getName());

    private static final String XML_EXTENSION = ".xml";
    private static final String TABLE_EXTENSION = ".props";
    private static final String BATCH_TABLE_NAME = "propositions";

    private final List<DialectConfig> dialects;
    private final AtomRenderingPolicy policy;
    private final InternerScope scope;
    private final int threads;
    private final boolean exportTable;
    private final boolean validate;

    private final PropertyDocumentParser parser = new PropertyDocumentParser();
    private final PropertyFileWriter writer = new PropertyFileWriter();
    private final FormulaGrammarValidator validator = new FormulaGrammarValidator();
    private final Map<DialectConfig, PropertyExtractor> extractors = new LinkedHashMap<>();

    /**
     * @param dialects dialetti da produrre, almeno uno e con nomi distinti
     * @param policy resa degli atomi
     * @param scope ambito di numerazione delle proposizioni
     * @param threads thread di lavoro; più di uno solo con ambito DOCUMENT
     * @param exportTable true per esportare le tabelle delle proposizioni
     * @param validate true per validare ogni formula prodotta
     */
    public BatchExtractionDriver(List<DialectConfig> dialects, AtomRenderingPolicy policy, InternerScope scope,
                                 int threads, boolean exportTable, boolean validate) {
        if (dialects == null || dialects.isEmpty()) {
            throw new IllegalArgumentException("Specificare almeno un dialetto");
        }
        if (policy == null || scope == null) {
            throw new IllegalArgumentException("Politica atomi e ambito non possono essere null");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("Numero di thread non valido: " + threads);
        }
        if (threads > 1 && scope == InternerScope.BATCH) {
            throw new IllegalArgumentException("L'ambito batch richiede elaborazione sequenziale (-j 1)");
        }

        Set<String> names = new HashSet<>();
        for (DialectConfig dialect : dialects) {
            if (!names.add(dialect.name())) {
                throw new IllegalArgumentException("Dialetto ripetuto: " + dialect.name());
            }
            extractors.put(dialect, new PropertyExtractor(new CTLTranslator(dialect, policy)));
        }

        this.dialects = List.copyOf(dialects);
        this.policy = policy;
        this.scope = scope;
        this.threads = threads;
        this.exportTable = exportTable;
        this.validate = validate;
    }

    //region ESECUZIONE

    /**
     * Elabora l'input e scrive i risultati sotto la directory di output.
     *
     * @param input file XML singolo o directory da visitare ricorsivamente
     * @param outputRoot directory di output; se null i file vengono scritti accanto all'input
     * @return riepilogo aggregato
     * @throws IOException se l'input non è accessibile
     */
    public BatchSummary run(Path input, Path outputRoot) throws IOException {
        List<Path> documents = findDocuments(input);
        if (documents.isEmpty()) {
            LOGGER.warning("Nessun documento " + XML_EXTENSION + " trovato in " + input);
            return BatchSummary.empty();
        }

        Path inputRoot = Files.isDirectory(input) ? input : input.toAbsolutePath().getParent();
        Path targetRoot = outputRoot != null ? outputRoot : inputRoot;

        LOGGER.info("Trovati " + documents.size() + " documenti, dialetti "
                + dialects.stream().map(DialectConfig::name).collect(Collectors.joining(", "))
                + ", politica " + policy + ", ambito " + scope);

        // Interner condivisi solo in ambito batch
        Map<DialectConfig, PropositionInterner> shared = new LinkedHashMap<>();
        if (scope == InternerScope.BATCH) {
            for (DialectConfig dialect : dialects) {
                shared.put(dialect, new PropositionInterner());
            }
        }

        List<DocumentOutcome> outcomes = threads > 1
                ? runParallel(documents, inputRoot, targetRoot)
                : runSequential(documents, inputRoot, targetRoot, shared);

        int tablesWritten = 0;
        if (scope == InternerScope.BATCH && exportTable) {
            tablesWritten = writeBatchTables(shared, targetRoot);
        }

        return summarize(documents.size(), outcomes, tablesWritten);
    }

    private List<DocumentOutcome> runSequential(List<Path> documents, Path inputRoot, Path targetRoot,
                                                Map<DialectConfig, PropositionInterner> shared) {
        List<DocumentOutcome> outcomes = new ArrayList<>(documents.size());
        for (Path document : documents) {
            outcomes.add(processDocument(document, inputRoot, targetRoot, shared));
        }
        return outcomes;
    }

    /**
     * Elaborazione con pool di thread: ogni documento ha interner propri, i risultati
     * vengono raccolti nell'ordine dei file.
     */
    private List<DocumentOutcome> runParallel(List<Path> documents, Path inputRoot, Path targetRoot) {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<DocumentOutcome>> futures = new ArrayList<>(documents.size());
            for (Path document : documents) {
                Callable<DocumentOutcome> task = () -> processDocument(document, inputRoot, targetRoot, Map.of());
                futures.add(executor.submit(task));
            }

            List<DocumentOutcome> outcomes = new ArrayList<>(documents.size());
            for (Future<DocumentOutcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Elaborazione batch interrotta", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Errore inatteso durante l'elaborazione batch", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    //endregion

    //region ELABORAZIONE DEL SINGOLO DOCUMENTO

    /**
     * Elabora un documento per tutti i dialetti. Gli errori restano confinati al documento.
     *
     * @param shared interner condivisi (ambito batch) oppure mappa vuota
     */
    private DocumentOutcome processDocument(Path document, Path inputRoot, Path targetRoot,
                                            Map<DialectConfig, PropositionInterner> shared) {
        PropertyDocument parsed;
        try {
            parsed = parser.parse(document);
        } catch (MalformedDocumentException e) {
            LOGGER.warning("Documento saltato: " + e.getMessage());
            return DocumentOutcome.failure(document);
        }

        Path relative = inputRoot.toAbsolutePath().relativize(document.toAbsolutePath());
        Path targetDir = relative.getParent() != null ? targetRoot.resolve(relative.getParent()) : targetRoot;
        String baseName = baseName(document);

        int translated = 0;
        int skipped = 0;
        int written = 0;
        int invalid = 0;

        try {
            for (DialectConfig dialect : dialects) {
                PropositionInterner interner = shared.get(dialect);
                boolean documentScoped = interner == null;
                if (documentScoped) {
                    interner = new PropositionInterner();
                }

                ExtractionResult result = extractors.get(dialect).extract(parsed, interner);
                translated += result.translatedCount();
                skipped += result.skippedCount();

                if (writer.write(targetDir.resolve(baseName + dialect.fileExtension()), result.properties(), dialect)) {
                    written++;
                }
                if (exportTable && documentScoped
                        && writer.writeTable(targetDir.resolve(tableFileName(baseName, dialect)), interner)) {
                    written++;
                }
                if (validate) {
                    invalid += validateAll(document, result.properties(), dialect);
                }
            }
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Scrittura dei risultati fallita per " + document, e);
            return DocumentOutcome.failure(document);
        }

        LOGGER.info(document.getFileName() + ": " + translated + " formule, " + skipped + " scartate, "
                + written + " file scritti");
        return new DocumentOutcome(document, false, translated, skipped, written, invalid);
    }

    private int validateAll(Path document, List<TranslatedProperty> properties, DialectConfig dialect) {
        int invalid = 0;
        for (TranslatedProperty property : properties) {
            ValidationReport report = validator.validate(property.formula(), dialect);
            if (!report.isValid()) {
                invalid++;
                LOGGER.warning("Formula " + property.id() + " di " + document.getFileName()
                        + " non valida per il dialetto " + dialect.name() + ": " + report.errors());
            }
        }
        return invalid;
    }

    private int writeBatchTables(Map<DialectConfig, PropositionInterner> shared, Path targetRoot) throws IOException {
        int written = 0;
        for (Map.Entry<DialectConfig, PropositionInterner> entry : shared.entrySet()) {
            Path target = targetRoot.resolve(tableFileName(BATCH_TABLE_NAME, entry.getKey()));
            if (writer.writeTable(target, entry.getValue())) {
                written++;
                LOGGER.info("Tabella delle proposizioni (" + entry.getValue().size() + " voci) salvata: " + target);
            }
        }
        return written;
    }

    //endregion

    //region PERCORSI E RIEPILOGO

    /**
     * Documenti da elaborare, in ordine di percorso. Un file indicato esplicitamente viene
     * accettato così com'è; in una directory si considerano solo i file .xml.
     *
     * @param input file o directory
     * @return lista ordinata dei documenti
     * @throws IOException se la directory non è visitabile
     */
    public static List<Path> findDocuments(Path input) throws IOException {
        if (Files.isRegularFile(input)) {
            return List.of(input);
        }
        if (!Files.isDirectory(input)) {
            throw new IOException("Input non esistente: " + input);
        }

        try (Stream<Path> paths = Files.walk(input)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> !path.getFileName().toString().equals(".DS_Store"))
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(XML_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    static String tableFileName(String baseName, DialectConfig dialect) {
        return baseName + "." + dialect.name() + TABLE_EXTENSION;
    }

    private static String baseName(Path document) {
        String fileName = document.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    private static BatchSummary summarize(int found, List<DocumentOutcome> outcomes, int extraFiles) {
        int processed = 0;
        int failed = 0;
        int translated = 0;
        int skipped = 0;
        int written = extraFiles;
        int invalid = 0;

        for (DocumentOutcome outcome : outcomes) {
            if (outcome.failed()) {
                failed++;
                continue;
            }
            processed++;
            translated += outcome.translated();
            skipped += outcome.skipped();
            written += outcome.filesWritten();
            invalid += outcome.invalid();
        }
        return new BatchSummary(found, processed, failed, translated, skipped, written, invalid);
    }

    //endregion

    /**
     * Esito dell'elaborazione di un singolo documento.
     */
    private record DocumentOutcome(Path document, boolean failed, int translated, int skipped,
                                   int filesWritten, int invalid) {

        static DocumentOutcome failure(Path document) {
            return new DocumentOutcome(document, true, 0, 0, 0, 0);
        }
    }
}
