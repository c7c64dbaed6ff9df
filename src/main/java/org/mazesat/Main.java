package org.mazesat;

import org.mazesat.backend.BackendKind;
import org.mazesat.encoding.ArborescenceEncoder;
import org.mazesat.encoding.ForestEncoder;
import org.mazesat.encoding.InvalidRequestException;
import org.mazesat.encoding.LoopEncoder;
import org.mazesat.encoding.ProblemEncoder;
import org.mazesat.extract.ArborescenceSolution;
import org.mazesat.extract.ForestSolution;
import org.mazesat.extract.LoopSolution;
import org.mazesat.puzzle.PuzzleDefinition;
import org.mazesat.puzzle.PuzzleFileReader;
import org.mazesat.puzzle.PuzzleSyntaxException;
import org.mazesat.service.SolveOutcome;
import org.mazesat.service.SolvePipeline;
import org.mazesat.service.SolveWorker;
import org.mazesat.support.EncodingSession;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * CODIFICATORE SAT PER ROMPICAPI SU GRAFI
 *
 * PIPELINE DI ELABORAZIONE COMPLETA:
 * 1. INPUT: File di descrizione (.puzzle) con grafo e richieste
 * 2. PARSING: Grammatica ANTLR → foresta, ciclo e/o arborescenza
 * 3. CODIFICA: Ogni richiesta diventa una formula CNF esportata in DIMACS
 * 4. RISOLUZIONE SAT: Motore CDCL interno (default), DPLL o Sat4j
 * 5. OUTPUT: Soluzione decodificata oppure fallimento tipizzato, con statistiche
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f): Elaborazione di un singolo file di descrizione
 * - Directory batch (-d): Elaborazione di tutti i file .puzzle in una cartella
 * - Timeout configurabile per richiesta (-t secondi)
 * - Output directory personalizzabile (-o directory)
 * - Scelta del motore (-backend=cdcl|dpll|sat4j) e restart Luby (-opt=r)
 *
 * ORGANIZZAZIONE DEGLI OUTPUT STRUTTURATI:
 * - CNF/: Formule in formato DIMACS, una per richiesta
 * - RESULT/: Soluzioni decodificate oppure motivo del fallimento
 * - STATS/: Dimensioni delle formule e statistiche del motore
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String CONFLICTS_PARAM = "-c";
    private static final String OPT_PARAM = "-opt=";
    private static final String BACKEND_PARAM = "-backend=";

    private static final String OPT_RESTART = "r";
    private static final String OPT_ALL = "all";

    private static final String PUZZLE_EXTENSION = ".puzzle";

    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 5;

    private Main() {
    }

    //endregion

    //region PUNTO DI INGRESSO E COORDINAMENTO PRINCIPALE

    public static void main(String[] args) {
        System.out.println("---> AVVIO CODIFICATORE SAT <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            SolverConfiguration config = new ArgumentParser().parse(args);
            if (config == null) return; // Help mostrato

            displayConfigurationSummary(config);
            if (config.isFileMode) {
                System.out.println("[I] Modalità: Elaborazione file singolo");
                processSingleFile(config);
            } else {
                System.out.println("[I] Modalità: Elaborazione della directory");
                processDirectoryBatch(config);
            }

        } catch (IllegalArgumentException e) {
            System.out.println("[E] " + e.getMessage());
        } catch (Exception e) {
            System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
            System.out.println("Controllare i log per dettagli completi.");
            System.exit(1);
        } finally {
            System.out.println("---> FINE ESECUZIONE CODIFICATORE SAT <---");
        }
    }

    private static void displayConfigurationSummary(SolverConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE <<--");
        System.out.println("Input: " + config.inputPath);
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "stessa directory dell'input"));
        System.out.println("Motore: " + config.backend.name().toLowerCase(Locale.ROOT)
                + (config.useRestart ? " con restart" : ""));
        System.out.println("Timeout: " + config.timeoutSeconds + " secondi");
        if (config.conflictBudget >= 0) {
            System.out.println("Limite conflitti: " + config.conflictBudget);
        }
        System.out.println("========================\n");
    }

    //endregion

    //region ELABORAZIONE FILE E DIRECTORY

    /**
     * Elabora un file: lettura, poi codifica e risoluzione di ogni richiesta dichiarata.
     * Gli errori di una richiesta non interrompono le successive.
     */
    private static void processSingleFile(SolverConfiguration config) {
        System.out.println("-->> ELABORAZIONE FILE <<--");
        System.out.println("File: " + Paths.get(config.inputPath).getFileName());
        System.out.println("=========================\n");

        PuzzleDefinition definition;
        try {
            definition = PuzzleFileReader.read(Paths.get(config.inputPath));
        } catch (PuzzleSyntaxException e) {
            System.out.println("[E] File di descrizione non valido:");
            e.getErrors().forEach(error -> System.out.println("    " + error));
            return;
        } catch (IOException e) {
            System.out.println("[E] Errore durante la lettura del file: " + e.getMessage());
            return;
        }
        System.out.println("[I] " + definition);

        SolvePipeline pipeline = new SolvePipeline(config.backend, config.useRestart, config.conflictBudget);
        try (SolveWorker worker = new SolveWorker(pipeline)) {
            for (ProblemEncoder<?> encoder : definition.encoders()) {
                processRequest(encoder, pipeline, worker, config);
            }
        }
    }

    private static void processRequest(ProblemEncoder<?> encoder, SolvePipeline pipeline, SolveWorker worker,
                                       SolverConfiguration config) {
        String kind = requestKind(encoder);
        System.out.println("-> Richiesta " + kind + ": " + encoder.describe());

        try {
            exportDimacs(encoder, pipeline, config, kind);
        } catch (InvalidRequestException e) {
            // La pipeline riporta lo stesso errore come INVALID_REQUEST
            System.out.println("[W] Esportazione DIMACS saltata: " + e.getMessage());
        } catch (IOException e) {
            System.out.println("[E] Errore durante il salvataggio CNF: " + e.getMessage());
        }

        SolveOutcome<?> outcome = executeWithTimeout(encoder, worker, config);
        try {
            if (outcome == null) {
                saveTimeoutReport(config, kind);
            } else {
                saveResult(outcome, config, kind);
                saveStats(outcome, config, kind);
            }
        } catch (IOException e) {
            System.out.println("[E] Errore durante il salvataggio dei risultati: " + e.getMessage());
        }
        System.out.println();
    }

    /**
     * Risolve con controllo temporale: allo scadere il task viene interrotto
     * e il motore risponde UNKNOWN al primo controllo utile.
     *
     * @return esito oppure null se il timeout è scaduto
     */
    private static SolveOutcome<?> executeWithTimeout(ProblemEncoder<?> encoder, SolveWorker worker,
                                                      SolverConfiguration config) {
        Future<? extends SolveOutcome<?>> future = worker.submit(encoder,
                (description, stats) -> System.out.println("[I] Formula pronta: " + stats));
        try {
            SolveOutcome<?> outcome = future.get(config.timeoutSeconds, TimeUnit.SECONDS);
            if (outcome.isSuccess()) {
                System.out.println("[I] Soluzione trovata");
            } else {
                System.out.println("[W] " + outcome.failureKind() + ": " + outcome.message());
            }
            return outcome;

        } catch (TimeoutException e) {
            future.cancel(true);
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return null;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            System.out.println("[E] Errore durante la risoluzione: " + e.getCause());
            throw new RuntimeException("Errore nella risoluzione", e.getCause());
        }
    }

    private static void processDirectoryBatch(SolverConfiguration config) {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        List<File> files;
        try (Stream<Path> paths = Files.list(Paths.get(config.inputPath))) {
            files = paths.filter(path -> path.toString().toLowerCase(Locale.ROOT).endsWith(PUZZLE_EXTENSION))
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            System.out.println("[E] Errore durante l'accesso alla directory: " + e.getMessage());
            return;
        }

        if (files.isEmpty()) {
            System.out.println("[W] Nessun file " + PUZZLE_EXTENSION + " trovato nella directory specificata.");
            return;
        }
        System.out.println("Trovati " + files.size() + " file da elaborare.\n");

        int successCount = 0;
        int errorCount = 0;
        for (File file : files) {
            try {
                processSingleFile(config.forFile(file.getAbsolutePath()));
                successCount++;
            } catch (RuntimeException e) {
                System.out.println("[E] Errore nel file " + file.getName() + ": " + e);
                errorCount++;
            }
            System.out.println();
        }

        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("File trovati: " + files.size());
        System.out.println("File elaborati: " + successCount);
        System.out.println("File con errori: " + errorCount);
        System.out.println("=========================================\n");
    }

    //endregion

    //region GESTIONE DELL'OUTPUT E SALVATAGGIO DEI FILE

    private static void exportDimacs(ProblemEncoder<?> encoder, SolvePipeline pipeline, SolverConfiguration config,
                                     String kind) throws InvalidRequestException, IOException {
        EncodingSession session = pipeline.encode(encoder);
        Path file = outputFile(config, "CNF", kind, ".cnf");
        try (FileWriter writer = new FileWriter(file.toFile())) {
            session.writeDimacs(writer);
        }
        System.out.println("[I] Formula CNF salvata: " + file);
    }

    private static void saveResult(SolveOutcome<?> outcome, SolverConfiguration config, String kind)
            throws IOException {
        Path file = outputFile(config, "RESULT", kind, ".result");
        try (FileWriter writer = new FileWriter(file.toFile())) {
            writer.write("=== RISULTATO " + kind.toUpperCase(Locale.ROOT) + " ===\n\n");
            if (!outcome.isSuccess()) {
                writer.write("ESITO: " + outcome.failureKind() + "\n");
                writer.write("MOTIVO: " + outcome.message() + "\n");
            } else {
                writer.write("ESITO: SOLUZIONE TROVATA\n\n");
                writer.write(formatSolution(outcome.result()));
            }
        }
        System.out.println("[I] Risultato salvato: " + file);
    }

    private static void saveStats(SolveOutcome<?> outcome, SolverConfiguration config, String kind)
            throws IOException {
        Path file = outputFile(config, "STATS", kind, ".stats");
        try (FileWriter writer = new FileWriter(file.toFile())) {
            writer.write("=== STATISTICHE " + kind.toUpperCase(Locale.ROOT) + " ===\n\n");
            writer.write("Formula: " + (outcome.stats() != null ? outcome.stats() : "non codificata") + "\n");
            if (outcome.solverReport() != null) {
                writer.write("\n" + outcome.solverReport() + "\n");
            }
        }
        System.out.println("[I] Statistiche salvate: " + file);
    }

    private static void saveTimeoutReport(SolverConfiguration config, String kind) throws IOException {
        Path file = outputFile(config, "RESULT", kind, ".result");
        try (FileWriter writer = new FileWriter(file.toFile())) {
            writer.write("=== RISULTATO " + kind.toUpperCase(Locale.ROOT) + " ===\n\n");
            writer.write("ESITO: TIMEOUT\n");
            writer.write("Limite temporale: " + config.timeoutSeconds + " secondi\n");
            writer.write("Motore: " + config.backend.name().toLowerCase(Locale.ROOT) + "\n");
        }
        System.out.println("[I] Report timeout salvato: " + file);
    }

    private static String formatSolution(Object solution) {
        StringBuilder sb = new StringBuilder();
        if (solution instanceof ForestSolution) {
            ForestSolution forest = (ForestSolution) solution;
            sb.append("RADICI: ").append(new TreeMap<>(forest.rootOf())).append('\n');
            sb.append("GRUPPI: ").append(new TreeMap<>(forest.groupOf())).append('\n');
            sb.append("GENITORI: ").append(new TreeMap<>(forest.parentOf())).append('\n');
            sb.append("DISTANZE: ").append(new TreeMap<>(forest.distanceFromRoot())).append('\n');
            sb.append("MURI (").append(forest.blockedEdges().size()).append("): ")
                    .append(forest.blockedEdges()).append('\n');
            forest.pathLengthDistances().forEach((id, distances) ->
                    sb.append("VINCOLO ").append(id).append(": ").append(new TreeMap<>(distances)).append('\n'));
        } else if (solution instanceof LoopSolution) {
            LoopSolution loop = (LoopSolution) solution;
            sb.append("NODI DISTINTI: ").append(loop.distinctNodes()).append('\n');
            sb.append("PERCORSO: ").append(String.join(" -> ", loop.path())).append('\n');
        } else if (solution instanceof ArborescenceSolution) {
            ArborescenceSolution arborescence = (ArborescenceSolution) solution;
            sb.append("RADICE: ").append(arborescence.root()).append('\n');
            sb.append("ARCHI SCELTI: ").append(new TreeMap<>(arborescence.chosenEdge())).append('\n');
            sb.append("GENITORI: ").append(new TreeMap<>(arborescence.liftedParent())).append('\n');
            sb.append("PROFONDITÀ: ").append(new TreeMap<>(arborescence.depth())).append('\n');
        } else {
            sb.append(solution).append('\n');
        }
        return sb.toString();
    }

    //endregion

    //region GESTIONE DEI PERCORSI

    private static Path outputFile(SolverConfiguration config, String subdirName, String kind, String extension)
            throws IOException {
        Path dir;
        if (config.outputPath != null) {
            dir = Paths.get(config.outputPath).resolve(subdirName);
        } else {
            Path parentDir = Paths.get(config.inputPath).getParent();
            dir = parentDir != null ? parentDir.resolve(subdirName) : Paths.get(subdirName);
        }
        Files.createDirectories(dir);
        return dir.resolve(getBaseFileName(config.inputPath) + "_" + kind + extension);
    }

    private static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    private static String requestKind(ProblemEncoder<?> encoder) {
        if (encoder instanceof ForestEncoder) return "forest";
        if (encoder instanceof LoopEncoder) return "loop";
        if (encoder instanceof ArborescenceEncoder) return "arborescence";
        return encoder.getClass().getSimpleName();
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> CODIFICATORE SAT PER ROMPICAPI SU GRAFI <<::");
        System.out.println("Foreste con muri, cicli e arborescenze su quoziente tradotti in SAT\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar mazesat.jar [opzioni]\n");

        System.out.println("PARAMETRI:");
        System.out.println("  -f <file>            Elabora un singolo file di descrizione");
        System.out.println("  -d <directory>       Elabora tutti i file " + PUZZLE_EXTENSION + " in una directory");
        System.out.println("  -o <directory>       Directory di output (default: stessa di input)");
        System.out.println("  -t <secondi>         Timeout per richiesta (min: " + MIN_TIMEOUT_SECONDS
                + ", default: " + DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("  -c <conflitti>       Limite di conflitti per richiesta (default: nessuno)");
        System.out.println("  -backend=<nome>      Motore SAT: cdcl (default), dpll, sat4j");
        System.out.println("  -opt=r               Restart con sequenza di Luby (solo cdcl)");
        System.out.println("  -h                   Mostra questa guida\n");

        System.out.println("FORMATO FILE DI DESCRIZIONE:");
        System.out.println("  grid 4 by 3 wrap;                    griglia (wrap e diagonal facoltativi)");
        System.out.println("  node a b c;  edge a b, b c;          grafo esplicito");
        System.out.println("  group A root \"0,0\" members \"1,1\";    gruppo con radice e membri fissati");
        System.out.println("  free ...;  exclude ...;              nodi liberi o esclusi");
        System.out.println("  mindist m1 from \"0,0\" to \"2,3\" >= 5; distanza minima sugli archi aperti");
        System.out.println("  depth \"1,1\" >= 2;                    profondità nel proprio albero");
        System.out.println("  loop from \"0,0\" length 9;            ciclo semplice");
        System.out.println("  qnode ...; qedge e a b; lift u of a; lifted u v via e;");
        System.out.println("  arborescence root u target v depth 3 [spanning];\n");

        System.out.println("OUTPUT GENERATO:");
        System.out.println("  CNF/          Formule DIMACS, una per richiesta");
        System.out.println("  RESULT/       Soluzioni decodificate o motivo del fallimento");
        System.out.println("  STATS/        Dimensioni delle formule e statistiche del motore\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class SolverConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final int timeoutSeconds;
        final long conflictBudget;
        final BackendKind backend;
        final boolean useRestart;

        SolverConfiguration(String inputPath, String outputPath, boolean isFileMode, int timeoutSeconds,
                            long conflictBudget, BackendKind backend, boolean useRestart) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.timeoutSeconds = timeoutSeconds;
            this.conflictBudget = conflictBudget;
            this.backend = backend;
            this.useRestart = useRestart;
        }

        SolverConfiguration forFile(String filePath) {
            return new SolverConfiguration(filePath, outputPath, true, timeoutSeconds, conflictBudget,
                    backend, useRestart);
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        SolverConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            boolean useRestart = false;
            BackendKind backend = BackendKind.CDCL;
            long conflictBudget = -1;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        if (isDirectoryMode) {
                            throw new IllegalArgumentException("Le modalità file e directory sono mutualmente esclusive");
                        }
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }
                    case DIR_PARAM -> {
                        if (isFileMode) {
                            throw new IllegalArgumentException("Le modalità file e directory sono mutualmente esclusive");
                        }
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }
                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "directory output");
                    case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(args, ++i);
                    case CONFLICTS_PARAM -> conflictBudget = parseConflictBudget(args, ++i);
                    default -> {
                        if (args[i].startsWith(OPT_PARAM)) {
                            String optValue = args[i].substring(OPT_PARAM.length());
                            if (optValue.isBlank()) {
                                throw new IllegalArgumentException("Valore -opt vuoto");
                            }
                            useRestart = optValue.equals(OPT_ALL) || optValue.contains(OPT_RESTART);
                        } else if (args[i].startsWith(BACKEND_PARAM)) {
                            backend = BackendKind.fromName(args[i].substring(BACKEND_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }
            if (useRestart && backend != BackendKind.CDCL) {
                System.out.println("[W] Restart disponibile solo con il motore cdcl: opzione ignorata");
                useRestart = false;
            }
            return new SolverConfiguration(inputPath, outputPath, isFileMode, timeoutSeconds, conflictBudget,
                    backend, useRestart);
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseAndValidateTimeout(String[] args, int currentIndex) {
            String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");
            try {
                int timeout = Integer.parseInt(timeoutStr);
                if (timeout < MIN_TIMEOUT_SECONDS) {
                    throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
                }
                return timeout;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore timeout non valido: " + timeoutStr);
            }
        }

        private long parseConflictBudget(String[] args, int currentIndex) {
            String budgetStr = getNextArgument(args, currentIndex, "numero conflitti");
            try {
                long budget = Long.parseLong(budgetStr);
                if (budget < 1) {
                    throw new IllegalArgumentException("Limite conflitti deve essere positivo: " + budget);
                }
                return budget;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Limite conflitti non valido: " + budgetStr);
            }
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.isFile()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.canRead()) {
                throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
            }
        }
    }

    //endregion
}
