package org.mazesat.service;

import org.mazesat.support.FormulaStats;

/**
 * Riceve l'unico messaggio di avanzamento di una richiesta: le dimensioni
 * della formula, dopo la codifica e prima della risoluzione.
 */
@FunctionalInterface
public interface ProgressListener {

    void onFormulaReady(String description, FormulaStats stats);

    static ProgressListener none() {
        return (description, stats) -> {
        };
    }
}
