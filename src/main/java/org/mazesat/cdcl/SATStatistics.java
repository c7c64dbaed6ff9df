package org.mazesat.cdcl;

/**
 * STATISTICHE SAT - Metriche di esecuzione del motore CDCL
 *
 * Raccoglie i contatori principali della ricerca (decisioni, propagazioni,
 * conflitti, clausole apprese, backjump, restart) e il tempo di esecuzione,
 * e li presenta in forma compatta per i log o estesa per i file di report.
 */
public class SATStatistics {

    //region CONTATORI METRICHE CORE

    /** Decisioni euristiche prese durante la ricerca. */
    private int decisions = 0;

    /** Letterali assegnati per propagazione unitaria. */
    private long propagations = 0;

    /** Conflitti rilevati. */
    private int conflicts = 0;

    /** Clausole apprese dall'analisi dei conflitti (incluse le unitarie). */
    private int learnedClauses = 0;

    /** Backtrack non cronologici che saltano più di un livello. */
    private int backjumps = 0;

    private int restarts = 0;

    //endregion

    //region TIMING

    private long executionTimeMs = 0;
    private long startTime;
    private boolean timerStopped = false;

    //endregion

    /**
     * Inizializza le statistiche e avvia subito il timer.
     */
    public SATStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region OPERAZIONI DI INCREMENTO CONTATORI

    public synchronized void incrementDecisions() {
        decisions++;
    }

    public synchronized void incrementPropagations() {
        propagations++;
    }

    public synchronized void incrementConflicts() {
        conflicts++;
    }

    public synchronized void incrementLearnedClauses() {
        learnedClauses++;
    }

    public synchronized void incrementBackjumps() {
        backjumps++;
    }

    public synchronized void incrementRestarts() {
        restarts++;
    }

    //endregion

    //region GESTIONE TIMING

    /**
     * Ferma la misurazione del tempo. Chiamate ripetute non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    /**
     * @return tempo finale, oppure parziale se il timer è ancora attivo
     */
    public long getExecutionTimeMs() {
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    //endregion

    //region ACCESSORS

    public int getConflicts() {
        return conflicts;
    }

    //endregion

    //region OUTPUT E RAPPRESENTAZIONE

    /**
     * Report esteso usato per i file della cartella STATS/.
     *
     * @param variableCount variabili della formula
     * @param clauseCount clausole della formula
     * @param result esito testuale ("SAT", "UNSAT", "UNKNOWN")
     */
    public String toReport(int variableCount, int clauseCount, String result) {
        StringBuilder output = new StringBuilder();
        output.append("===========================[ EVALUATION COMPLETED: PROBLEM STATS ]===========================\n");
        output.append("    Variabili: ").append(variableCount).append("\n");
        output.append("    Clausole:  ").append(clauseCount).append("\n");
        output.append("======================================[ SEARCH STATS ]=======================================\n");
        output.append("    Decisioni:    ").append(decisions).append("\n");
        output.append("    Propagazioni: ").append(propagations).append("\n");
        output.append("    Conflitti:    ").append(conflicts).append("\n");
        output.append("    Apprese:      ").append(learnedClauses).append("\n");
        output.append("    Backjump:     ").append(backjumps).append("\n");
        if (restarts > 0) {
            output.append("    Restart:      ").append(restarts).append("\n");
        }
        output.append("    Tempo:        ").append(getExecutionTimeMs()).append("ms\n");
        output.append("    Risultato:    ").append(result).append("\n");
        output.append("=============================================================================================\n");
        return output.toString();
    }

    /**
     * Formato su singola linea per i log.
     */
    public String toCompactString() {
        if (restarts > 0) {
            return String.format("Stats[Dec:%d, Conf:%d, Restart:%d, Prop:%d, Learn:%d, Time:%dms]",
                    decisions, conflicts, restarts, propagations, learnedClauses, getExecutionTimeMs());
        }
        return String.format("Stats[Dec:%d, Conf:%d, Prop:%d, Learn:%d, Time:%dms]",
                decisions, conflicts, propagations, learnedClauses, getExecutionTimeMs());
    }

    @Override
    public String toString() {
        return toCompactString();
    }

    //endregion
}
