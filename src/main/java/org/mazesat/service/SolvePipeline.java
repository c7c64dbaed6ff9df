package org.mazesat.service;

import org.mazesat.backend.BackendKind;
import org.mazesat.backend.SatBackend;
import org.mazesat.backend.SolveStatus;
import org.mazesat.cdcl.CDCLSolver;
import org.mazesat.encoding.InvalidRequestException;
import org.mazesat.encoding.ProblemEncoder;
import org.mazesat.support.EncodingSession;
import org.mazesat.support.FormulaStats;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PIPELINE DI RISOLUZIONE - Dalla richiesta all'esito
 *
 * Flusso per ogni richiesta:
 * 1. Validazione (errori del chiamante → INVALID_REQUEST, nessuna clausola costruita)
 * 2. Codifica in una {@link EncodingSession} nuova
 * 3. Un messaggio di avanzamento con le dimensioni della formula
 * 4. Caricamento in un motore nuovo e risoluzione
 * 5. Decodifica oppure fallimento tipizzato
 *
 * Le richieste non vengono mai ritentate e non producono risultati parziali.
 */
public class SolvePipeline {

    private static final Logger LOGGER = Logger.getLogger(SolvePipeline.class.getName());

    static final String RESOURCE_MESSAGE =
            "Risorse esaurite: il problema è troppo grande, ridurre la griglia o i vincoli";

    private final BackendKind backendKind;
    private final boolean enableRestart;
    private final long conflictBudget;

    public SolvePipeline() {
        this(BackendKind.CDCL, false, -1);
    }

    /**
     * @param conflictBudget limite di conflitti per richiesta, negativo per nessun limite
     */
    public SolvePipeline(BackendKind backendKind, boolean enableRestart, long conflictBudget) {
        this.backendKind = backendKind;
        this.enableRestart = enableRestart;
        this.conflictBudget = conflictBudget;
    }

    /**
     * Valida e codifica senza risolvere, per l'esportazione DIMACS.
     */
    public EncodingSession encode(ProblemEncoder<?> encoder) throws InvalidRequestException {
        encoder.validate();
        EncodingSession session = new EncodingSession();
        encoder.encode(session);
        return session;
    }

    public <R> SolveOutcome<R> run(ProblemEncoder<R> encoder) {
        return run(encoder, ProgressListener.none());
    }

    /**
     * Esegue una richiesta completa. Non solleva eccezioni per gli esiti
     * previsti: ogni fallimento diventa un {@link SolveOutcome} tipizzato.
     */
    public <R> SolveOutcome<R> run(ProblemEncoder<R> encoder, ProgressListener listener) {
        try {
            encoder.validate();
        } catch (InvalidRequestException e) {
            LOGGER.warning("Richiesta non valida: " + e.getMessage());
            return SolveOutcome.failure(FailureKind.INVALID_REQUEST, e.getMessage(), null);
        }

        FormulaStats stats = null;
        try {
            EncodingSession session = new EncodingSession();
            encoder.encode(session);
            stats = session.stats();
            listener.onFormulaReady(encoder.describe(), stats);

            if (Thread.currentThread().isInterrupted()) {
                return cancelled(stats);
            }

            SatBackend backend = backendKind.create(enableRestart, conflictBudget);
            session.loadInto(backend);
            SolveStatus status = backend.solve();
            String report = solverReport(backend, status);

            SolveOutcome<R> outcome = switch (status) {
                case SATISFIABLE -> SolveOutcome.success(encoder.decode(session, backend), stats);
                case UNSATISFIABLE -> unsatisfiable(session, stats);
                case UNKNOWN -> Thread.currentThread().isInterrupted()
                        ? cancelled(stats)
                        : SolveOutcome.failure(FailureKind.RESOURCE_EXHAUSTED, RESOURCE_MESSAGE, stats);
            };
            LOGGER.info("Esito: " + outcome);
            return outcome.withSolverReport(report);

        } catch (OutOfMemoryError e) {
            LOGGER.log(Level.SEVERE, "Memoria esaurita durante la risoluzione", e);
            return SolveOutcome.failure(FailureKind.RESOURCE_EXHAUSTED, RESOURCE_MESSAGE, stats);
        }
    }

    private static <R> SolveOutcome<R> unsatisfiable(EncodingSession session, FormulaStats stats) {
        if (session.isProvablyImpossible()) {
            return SolveOutcome.failure(FailureKind.PROVABLY_IMPOSSIBLE,
                    String.join("; ", session.impossibilityReasons()), stats);
        }
        return SolveOutcome.failure(FailureKind.UNSATISFIABLE, "Nessuna soluzione: formula insoddisfacibile", stats);
    }

    private static <R> SolveOutcome<R> cancelled(FormulaStats stats) {
        LOGGER.info("Richiesta annullata");
        return SolveOutcome.failure(FailureKind.CANCELLED, "Richiesta annullata", stats);
    }

    private static String solverReport(SatBackend backend, SolveStatus status) {
        if (backend instanceof CDCLSolver) {
            CDCLSolver cdcl = (CDCLSolver) backend;
            String result = switch (status) {
                case SATISFIABLE -> "SAT";
                case UNSATISFIABLE -> "UNSAT";
                case UNKNOWN -> "UNKNOWN";
            };
            return cdcl.getStatistics().toReport(backend.variableCount(), backend.clauseCount(), result);
        }
        return null;
    }
}
