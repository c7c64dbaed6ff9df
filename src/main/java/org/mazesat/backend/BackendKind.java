package org.mazesat.backend;

import org.mazesat.cdcl.CDCLSolver;

import java.util.Locale;

/**
 * Motori SAT disponibili e loro costruzione.
 *
 * Ogni richiesta riceve un'istanza nuova: i motori non sono condivisi tra
 * richieste diverse.
 */
public enum BackendKind {
    CDCL,
    DPLL,
    SAT4J;

    /**
     * Crea un motore vuoto.
     *
     * @param enableRestart restart di Luby (solo CDCL)
     * @param conflictBudget limite di conflitti, negativo per nessun limite
     */
    public SatBackend create(boolean enableRestart, long conflictBudget) {
        return switch (this) {
            case CDCL -> {
                CDCLSolver solver = new CDCLSolver(enableRestart);
                solver.setConflictBudget(conflictBudget);
                yield solver;
            }
            case DPLL -> new DPLLSolver(conflictBudget);
            case SAT4J -> new Sat4jBackend((int) Math.min(conflictBudget, Integer.MAX_VALUE));
        };
    }

    public SatBackend create() {
        return create(false, -1);
    }

    /**
     * Nome da riga di comando ({@code cdcl}, {@code dpll}, {@code sat4j}), senza distinzione di maiuscole.
     *
     * @throws IllegalArgumentException se il nome non corrisponde a nessun motore
     */
    public static BackendKind fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Motore SAT sconosciuto: " + name
                    + " (disponibili: cdcl, dpll, sat4j)", e);
        }
    }
}
