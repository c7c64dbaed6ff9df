package org.mazesat.backend;

/**
 * Esito grezzo di una chiamata {@link SatBackend#solve()}.
 */
public enum SolveStatus {
    SATISFIABLE,
    UNSATISFIABLE,
    /** Budget esaurito, interruzione o motore incapace di concludere */
    UNKNOWN
}
