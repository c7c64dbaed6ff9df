package org.mazesat.graph;

import java.util.HashMap;
import java.util.Map;

/**
 * Limite inferiore della distanza tra due nodi, usato dal potatura a palla
 * della raggiungibilità limitata.
 *
 * Il valore restituito non deve mai superare la vera distanza sugli archi del
 * grafo, altrimenti la codifica escluderebbe percorsi ammissibili.
 * {@link Integer#MAX_VALUE} indica un nodo irraggiungibile.
 */
@FunctionalInterface
public interface DistanceLowerBound {

    int lowerBound(int from, int to);

    /**
     * Nessuna potatura: ogni nodo entra in ogni palla.
     */
    static DistanceLowerBound none() {
        return (from, to) -> from == to ? 0 : 1;
    }

    /**
     * Distanza esatta in archi sul grafo completo, calcolata con una BFS per
     * radice e memorizzata. Valida per qualunque forma di adiacenza.
     */
    static DistanceLowerBound hopCount(Graph graph) {
        Map<Integer, int[]> cache = new HashMap<>();
        return (from, to) -> {
            int[] distances = cache.computeIfAbsent(from, graph::hopDistances);
            int d = distances[to];
            return d < 0 ? Integer.MAX_VALUE : d;
        };
    }
}
