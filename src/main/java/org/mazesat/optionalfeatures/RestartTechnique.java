package org.mazesat.optionalfeatures;

import java.util.logging.Logger;

/**
 * TECNICA DEL RESTART - Politica di reinizio per il motore CDCL
 *
 * Conta i conflitti e segnala al solutore quando ripartire dal livello 0. Le
 * soglie seguono la sequenza di Luby (1, 1, 2, 1, 1, 2, 4, ...) moltiplicata
 * per un intervallo base: periodi brevi e frequenti alternati a periodi lunghi.
 *
 * INTEGRAZIONE CDCL:
 * • Il solutore chiama {@link #registerConflictAndCheckRestart()} a ogni conflitto
 * • Se la risposta è true torna al livello 0 e chiama {@link #completeRestart()}
 * • Clausole apprese e assegnamenti di livello 0 restano al solutore
 *
 * Attivata da riga di comando con {@code -opt=r}.
 */
public class RestartTechnique {

    private static final Logger LOGGER = Logger.getLogger(RestartTechnique.class.getName());

    //region CONFIGURAZIONE E SOGLIE

    /** Intervallo base in conflitti */
    private static final int DEFAULT_BASE_INTERVAL = 64;

    private final int baseInterval;

    //endregion

    //region STATO E TRACKING

    private int currentConflictCount;
    private int conflictThreshold;
    private int totalRestarts;

    //endregion

    public RestartTechnique() {
        this(DEFAULT_BASE_INTERVAL);
    }

    /**
     * @param baseInterval conflitti dell'unità della sequenza di Luby
     * @throws IllegalArgumentException se l'intervallo è minore di 1
     */
    public RestartTechnique(int baseInterval) {
        if (baseInterval < 1) {
            throw new IllegalArgumentException("Intervallo base deve essere >= 1, ricevuto: " + baseInterval);
        }
        this.baseInterval = baseInterval;
        this.currentConflictCount = 0;
        this.totalRestarts = 0;
        this.conflictThreshold = baseInterval * luby(1);
        LOGGER.fine("RestartTechnique inizializzata con intervallo base " + baseInterval + " conflitti");
    }

    //region INTERFACCIA PUBBLICA PRINCIPALE

    /**
     * Registra un conflitto.
     *
     * @return true se il solutore deve ripartire
     */
    public boolean registerConflictAndCheckRestart() {
        currentConflictCount++;
        LOGGER.finest("Conflitto registrato: " + currentConflictCount + "/" + conflictThreshold);
        return currentConflictCount >= conflictThreshold;
    }

    /**
     * Chiude il restart appena eseguito e calcola la soglia successiva.
     */
    public void completeRestart() {
        totalRestarts++;
        currentConflictCount = 0;
        conflictThreshold = baseInterval * luby(totalRestarts + 1);
        LOGGER.fine("*** RESTART #" + totalRestarts + " - prossima soglia " + conflictThreshold + " conflitti ***");
    }

    public int getTotalRestarts() {
        return totalRestarts;
    }

    public int getConflictThreshold() {
        return conflictThreshold;
    }

    //endregion

    //region SEQUENZA DI LUBY

    /**
     * Elemento i-esimo (1-based) della sequenza di Luby.
     *
     * Se i = 2^k - 1 vale 2^(k-1), altrimenti luby(i - 2^(k-1) + 1) con
     * 2^(k-1) <= i < 2^k - 1.
     */
    public static int luby(int i) {
        if (i < 1) {
            throw new IllegalArgumentException("Indice Luby deve essere >= 1: " + i);
        }
        int k = 1;
        while ((1 << k) - 1 < i) {
            k++;
        }
        if ((1 << k) - 1 == i) {
            return 1 << (k - 1);
        }
        return luby(i - (1 << (k - 1)) + 1);
    }

    //endregion

    @Override
    public String toString() {
        return String.format("RestartTechnique{base=%d, restart=%d, soglia=%d}",
                baseInterval, totalRestarts, conflictThreshold);
    }
}
