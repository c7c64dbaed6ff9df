package org.mazesat.encoding;

/**
 * Strategia di eliminazione dei cicli negli alberi dei gruppi.
 */
public enum CycleEncoding {
    /** Profondità unaria "distanza ≥ d" con catene monotone: propaga bene, più variabili. */
    UNARY,
    /** Livelli binari con comparatore di ordine stretto: O(log n) bit per nodo. */
    BINARY
}
