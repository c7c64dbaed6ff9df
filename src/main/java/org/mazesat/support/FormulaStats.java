package org.mazesat.support;

/**
 * Dimensioni di una formula appena codificata, usate per il messaggio di
 * avanzamento prima della risoluzione.
 *
 * @param variables numero di variabili allocate
 * @param clauses numero di clausole memorizzate
 * @param literals somma delle lunghezze delle clausole
 */
public record FormulaStats(int variables, int clauses, long literals) {

    public FormulaStats {
        if (variables < 0 || clauses < 0 || literals < 0) {
            throw new IllegalArgumentException("Statistiche formula negative");
        }
    }

    @Override
    public String toString() {
        return String.format("%d variabili, %d clausole, %d letterali", variables, clauses, literals);
    }
}
