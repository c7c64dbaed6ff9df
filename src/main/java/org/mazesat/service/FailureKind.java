package org.mazesat.service;

/**
 * Categorie di fallimento riportate al chiamante.
 */
public enum FailureKind {
    /** Richiesta non valida, rilevata prima di costruire qualunque clausola. */
    INVALID_REQUEST,
    /** Impossibilità strutturale riconosciuta in fase di codifica. */
    PROVABLY_IMPOSSIBLE,
    /** Il motore SAT ha dimostrato l'insoddisfacibilità. */
    UNSATISFIABLE,
    /** Memoria, budget di conflitti o motore incapace di concludere. */
    RESOURCE_EXHAUSTED,
    /** Richiesta annullata dal chiamante. */
    CANCELLED
}
