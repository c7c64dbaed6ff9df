package org.mazesat.backend;

/**
 * CAPACITÀ SAT - Interfaccia minima verso un motore di risoluzione
 *
 * Il codificatore non conosce il motore concreto: crea variabili, aggiunge
 * clausole, chiede la soluzione e legge il valore delle variabili.
 *
 * CONTRATTO:
 * - Variabili numerate da 1 nell'ordine di creazione
 * - Letterali interi con segno in stile DIMACS (0 vietato)
 * - {@link #valueOf(int)} è definito solo dopo un esito {@link SolveStatus#SATISFIABLE}
 * - Ogni istanza serve una sola richiesta
 */
public interface SatBackend {

    /**
     * Alloca una nuova variabile.
     *
     * @return identificatore positivo della variabile
     */
    int newVariable();

    /**
     * Aggiunge una clausola. La clausola vuota rende la formula insoddisfacibile.
     *
     * @throws IllegalArgumentException se un letterale è 0 o nomina una variabile non allocata
     */
    void addClause(int... literals);

    SolveStatus solve();

    /**
     * @throws IllegalStateException se l'ultimo esito non è SATISFIABLE
     */
    boolean valueOf(int variable);

    int variableCount();

    int clauseCount();

    /**
     * Nome leggibile del motore per log e report.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
