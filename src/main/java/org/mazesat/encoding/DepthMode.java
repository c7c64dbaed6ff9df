package org.mazesat.encoding;

/**
 * Rapporto tra archi aperti e archi dell'albero.
 */
public enum DepthMode {
    /**
     * Gli archi aperti possono essere più di quelli dell'albero: la profondità
     * esatta vincola solo i livelli nel solutore e la distanza BFS riportata
     * può risultare minore.
     */
    LEVEL_ONLY,
    /**
     * Ogni arco aperto è un arco genitore-figlio di qualche gruppo: gli archi
     * aperti formano esattamente la foresta e la distanza BFS coincide con il livello.
     */
    KEPT_EDGE_CONSISTENT
}
