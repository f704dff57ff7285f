package org.ctl;

import org.ctl.extraction.BatchExtractionDriver;
import org.ctl.extraction.BatchSummary;
import org.ctl.extraction.InternerScope;
import org.ctl.translation.AtomRenderingPolicy;
import org.ctl.translation.DialectConfig;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TRADUTTORE CTL - Estrazione delle proprietà MCC in formato testuale
 *
 * Punto di ingresso da linea di comando: legge uno o più documenti XML di proprietà CTL
 * del Model Checking Contest e scrive le formule nei dialetti richiesti.
 *
 * OUTPUT GENERATO (per ogni documento):
 * - &lt;nome&gt;.txt   formule nel dialetto simbolico
 * - &lt;nome&gt;.ctl   formule nel dialetto a parole chiave (compatibile LoLA)
 * - &lt;nome&gt;.&lt;dialetto&gt;.props   tabella delle proposizioni (con -table)
 *
 * @version 1.0.0
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String THREADS_PARAM = "-j";
    private static final String DIALECT_PARAM = "-dialect=";
    private static final String POLICY_PARAM = "-policy=";
    private static final String SCOPE_PARAM = "-scope=";
    private static final String TABLE_PARAM = "-table";
    private static final String VALIDATE_PARAM = "-validate";
    private static final String VERBOSE_PARAM = "-v";

    /**
     * Valore di -dialect che richiede entrambi i dialetti
     * */
    private static final String DIALECT_BOTH = "both";

    /**
     * Limiti per il pool di thread
     * */
    private static final int DEFAULT_THREADS = 1;
    private static final int MAX_THREADS = 64;

    /**
     * Radice dei logger dell'applicazione
     * */
    private static final String LOGGER_ROOT = "org.ctl";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale del traduttore.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Configurazione del logging
     * 3. Esecuzione del driver batch su file singolo o directory
     * 4. Riepilogo finale e codice di uscita
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO TRADUTTORE CTL <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            ExtractionConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            configureLogging(config.verbose);
            displayConfigurationSummary(config);

            BatchSummary summary = executeMainPipeline(config);
            displayBatchSummary(summary);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE TRADUTTORE CTL <---");
        }
    }

    /**
     * Costruisce il driver dalla configurazione e lo esegue sull'input.
     *
     * @param config configurazione validata
     * @return riepilogo dell'esecuzione
     * @throws IOException se l'input non è accessibile
     */
    static BatchSummary executeMainPipeline(ExtractionConfiguration config) throws IOException {
        System.out.println(config.isFileMode
                ? "[I] Modalità: Elaborazione file singolo"
                : "[I] Modalità: Elaborazione della directory");

        BatchExtractionDriver driver = new BatchExtractionDriver(config.dialects, config.policy, config.scope,
                config.threads, config.exportTable, config.validate);

        Path output = config.outputPath != null ? Paths.get(config.outputPath) : null;
        return driver.run(Paths.get(config.inputPath), output);
    }

    private static void handleGlobalError(Exception e) {
        Logger.getLogger(Main.class.getName()).log(Level.SEVERE, "Errore critico", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * @return configurazione validata, null se è stato mostrato l'help o i parametri non sono validi
     */
    private static ExtractionConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help.");
            return null;
        }
    }

    /**
     * Con -v il logger dell'applicazione e un handler su console scendono a FINE.
     */
    private static void configureLogging(boolean verbose) {
        if (!verbose) {
            return;
        }
        Logger appLogger = Logger.getLogger(LOGGER_ROOT);
        appLogger.setLevel(Level.FINE);

        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        appLogger.addHandler(handler);
        appLogger.setUseParentHandlers(false);
    }

    private static void displayConfigurationSummary(ExtractionConfiguration config) {
        System.out.println("Configurazione:");
        System.out.println("- Input: " + config.inputPath);
        System.out.println("- Output: " + (config.outputPath != null ? config.outputPath : "accanto all'input"));
        System.out.println("- Dialetti: " + String.join(", ", config.dialects.stream().map(DialectConfig::name).toList()));
        System.out.println("- Atomi: " + config.policy.name().toLowerCase(Locale.ROOT));
        System.out.println("- Numerazione proposizioni: " + config.scope.name().toLowerCase(Locale.ROOT));
        System.out.println("- Thread: " + config.threads);
        System.out.println("- Tabelle proposizioni: " + (config.exportTable ? "sì" : "no"));
        System.out.println("- Validazione: " + (config.validate ? "sì" : "no"));
        System.out.println();
    }

    private static void displayBatchSummary(BatchSummary summary) {
        System.out.println("\n-->> RIEPILOGO ESTRAZIONE <<--");
        System.out.println("Documenti trovati: " + summary.documentsFound());
        System.out.println("Documenti elaborati con successo: " + summary.documentsProcessed());
        System.out.println("Documenti con errori: " + summary.documentsFailed());
        System.out.println("Formule tradotte: " + summary.propertiesTranslated());
        System.out.println("Proprietà scartate: " + summary.propertiesSkipped());
        System.out.println("File scritti: " + summary.filesWritten());
        if (summary.hasFailures()) {
            System.out.println("[W] Documenti scartati: " + summary.documentsFailed()
                    + ", formule respinte dal validatore: " + summary.invalidFormulas());
        }

        if (summary.documentsFound() > 0) {
            System.out.printf("Tasso di successo: %.1f%%\n", summary.successRate());
        } else {
            System.out.println("[W] Nessun documento .xml trovato.");
        }
        System.out.println("=========================================\n");
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> TRADUTTORE CTL <<::");
        System.out.println("Traduzione delle proprietà CTL del Model Checking Contest (XML)");
        System.out.println("in formule testuali per i model checker a valle\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar traduttore_CTL.jar [opzioni]\n");

        System.out.println("INPUT E OUTPUT:");
        System.out.println("  -f <file.xml>     Elabora un singolo documento di proprietà");
        System.out.println("  -d <directory>    Elabora tutti i file .xml nella directory (ricorsivamente)");
        System.out.println("  -o <directory>    Directory di output (default: stessa dell'input)");
        System.out.println();

        System.out.println("TRADUZIONE:");
        System.out.println("  -dialect=<d>      symbolic, keyword oppure both (default: both)");
        System.out.println("  -policy=<p>       opaque (simboli p0, p1, ...) oppure structural (default: opaque)");
        System.out.println("  -scope=<s>        document (numerazione per file) oppure batch (default: document)");
        System.out.println("  -j <thread>       Thread di lavoro, solo con -scope=document (default: 1)");
        System.out.println("  -table            Esporta le tabelle delle proposizioni (.props)");
        System.out.println("  -validate         Verifica ogni formula con la grammatica del dialetto");
        System.out.println("  -v                Logging dettagliato");
        System.out.println("  -h                Mostra questa guida\n");

        System.out.println("DIALETTI:");
        System.out.println("  symbolic  & | !, true/false, next riscritto come A(false W (f)), file .txt");
        System.out.println("  keyword   AND OR NOT, TRUE/FALSE, AX/EX nativi, terminatore ':', file .ctl\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  # File singolo, entrambi i dialetti");
        System.out.println("  java -jar traduttore_CTL.jar -f CTLCardinality.xml\n");

        System.out.println("  # Directory con vocabolario globale e tabelle");
        System.out.println("  java -jar traduttore_CTL.jar -d ./INPUTS/ -o ./OUTPUT/ -scope=batch -table\n");

        System.out.println("  # Directory in parallelo con validazione");
        System.out.println("  java -jar traduttore_CTL.jar -d ./INPUTS/ -dialect=keyword -j 8 -validate\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione, in forma immutabile.
     */
    static final class ExtractionConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final List<DialectConfig> dialects;
        final AtomRenderingPolicy policy;
        final InternerScope scope;
        final int threads;
        final boolean exportTable;
        final boolean validate;
        final boolean verbose;

        ExtractionConfiguration(String inputPath, String outputPath, boolean isFileMode,
                                List<DialectConfig> dialects, AtomRenderingPolicy policy, InternerScope scope,
                                int threads, boolean exportTable, boolean validate, boolean verbose) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.dialects = List.copyOf(dialects);
            this.policy = policy;
            this.scope = scope;
            this.threads = threads;
            this.exportTable = exportTable;
            this.validate = validate;
            this.verbose = verbose;
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    static final class ArgumentParser {

        /**
         * PARAMETRI SUPPORTATI:
         * -h: Mostra help e termina
         * -f <file>: Input file singolo (esclusivo con -d)
         * -d <dir>: Input directory (esclusivo con -f)
         * -o <dir>: Directory output personalizzata
         * -dialect=, -policy=, -scope=: scelte di traduzione
         * -j <n>: thread di lavoro
         * -table, -validate, -v: opzioni booleane
         *
         * @param args parametri da linea comando
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri invalidi
         */
        ExtractionConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            List<DialectConfig> dialects = List.of(DialectConfig.SYMBOLIC, DialectConfig.KEYWORD);
            AtomRenderingPolicy policy = AtomRenderingPolicy.OPAQUE;
            InternerScope scope = InternerScope.DOCUMENT;
            int threads = DEFAULT_THREADS;
            boolean exportTable = false;
            boolean validate = false;
            boolean verbose = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }

                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }

                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOutputDirectory(outputPath);
                    }

                    case THREADS_PARAM -> threads = parseThreads(getNextArgument(args, ++i, "numero di thread"));
                    case TABLE_PARAM -> exportTable = true;
                    case VALIDATE_PARAM -> validate = true;
                    case VERBOSE_PARAM -> verbose = true;

                    default -> {
                        if (args[i].startsWith(DIALECT_PARAM)) {
                            dialects = parseDialects(args[i].substring(DIALECT_PARAM.length()));
                        } else if (args[i].startsWith(POLICY_PARAM)) {
                            policy = AtomRenderingPolicy.byName(args[i].substring(POLICY_PARAM.length()));
                        } else if (args[i].startsWith(SCOPE_PARAM)) {
                            scope = InternerScope.byName(args[i].substring(SCOPE_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }
            if (threads > 1 && scope == InternerScope.BATCH) {
                throw new IllegalArgumentException("-scope=batch non può essere combinato con -j maggiore di 1");
            }

            return new ExtractionConfiguration(inputPath, outputPath, isFileMode, dialects, policy, scope,
                    threads, exportTable, validate, verbose);
        }

        private List<DialectConfig> parseDialects(String value) {
            if (DIALECT_BOTH.equalsIgnoreCase(value.trim())) {
                return List.of(DialectConfig.SYMBOLIC, DialectConfig.KEYWORD);
            }
            return List.of(DialectConfig.byName(value));
        }

        private int parseThreads(String value) {
            try {
                int threads = Integer.parseInt(value);
                if (threads < 1 || threads > MAX_THREADS) {
                    throw new IllegalArgumentException("Numero di thread deve essere tra 1 e " + MAX_THREADS
                            + ", ricevuto: " + threads);
                }
                return threads;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Numero di thread non valido: " + value);
            }
        }

        private void validateExclusiveMode(boolean otherMode, String currentMode) {
            if (otherMode) {
                throw new IllegalArgumentException("Modalità " + currentMode
                        + " non può essere combinata con altre modalità (file/directory sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Non è una directory: " + dirPath);
            }
            if (!dir.canRead()) {
                throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
            }
        }

        /**
         * La directory di output viene creata dal driver al primo file scritto;
         * qui si rifiuta solo un percorso che esiste e non è una directory.
         */
        private void validateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (dir.exists() && !dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
        }
    }

    //endregion
}
