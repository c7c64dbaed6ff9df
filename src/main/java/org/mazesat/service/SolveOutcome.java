package org.mazesat.service;

import org.mazesat.support.FormulaStats;

import java.util.Objects;

/**
 * ESITO DI UNA RICHIESTA - Successo con soluzione oppure fallimento tipizzato
 *
 * Ogni richiesta produce esattamente un esito. La coerenza è verificata in
 * costruzione: un successo ha una soluzione e nessuna categoria di
 * fallimento, un fallimento ha categoria e messaggio e nessuna soluzione.
 *
 * @param <R> tipo della soluzione
 */
public final class SolveOutcome<R> {

    private final R result;
    private final FailureKind failureKind;
    private final String message;
    private final FormulaStats stats;
    private final String solverReport;

    private SolveOutcome(R result, FailureKind failureKind, String message, FormulaStats stats, String solverReport) {
        if (result != null && failureKind != null) {
            throw new IllegalArgumentException("Un esito non può avere sia soluzione sia fallimento");
        }
        if (result == null && failureKind == null) {
            throw new IllegalArgumentException("Un esito senza soluzione richiede una categoria di fallimento");
        }
        if (failureKind != null && (message == null || message.isBlank())) {
            throw new IllegalArgumentException("Un fallimento richiede un messaggio");
        }
        this.result = result;
        this.failureKind = failureKind;
        this.message = message;
        this.stats = stats;
        this.solverReport = solverReport;
    }

    public static <R> SolveOutcome<R> success(R result, FormulaStats stats) {
        return new SolveOutcome<>(Objects.requireNonNull(result, "Soluzione null"), null, null, stats, null);
    }

    /**
     * @param stats dimensioni della formula, null se la richiesta non è arrivata alla codifica
     */
    public static <R> SolveOutcome<R> failure(FailureKind kind, String message, FormulaStats stats) {
        return new SolveOutcome<>(null, Objects.requireNonNull(kind, "Categoria null"), message, stats, null);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    /**
     * @throws IllegalStateException se l'esito è un fallimento
     */
    public R result() {
        if (!isSuccess()) {
            throw new IllegalStateException("Nessuna soluzione: " + failureKind + " - " + message);
        }
        return result;
    }

    /**
     * @return categoria del fallimento, null in caso di successo
     */
    public FailureKind failureKind() {
        return failureKind;
    }

    public String message() {
        return message;
    }

    /**
     * @return dimensioni della formula, null per le richieste non valide
     */
    public FormulaStats stats() {
        return stats;
    }

    /**
     * @return report del motore SAT (statistiche di ricerca), null se non disponibile
     */
    public String solverReport() {
        return solverReport;
    }

    SolveOutcome<R> withSolverReport(String report) {
        return new SolveOutcome<>(result, failureKind, message, stats, report);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "SolveOutcome{SUCCESSO" + (stats != null ? ", " + stats : "") + "}";
        }
        return "SolveOutcome{" + failureKind + ": " + message + "}";
    }
}
