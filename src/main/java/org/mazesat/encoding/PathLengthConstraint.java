package org.mazesat.encoding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Limite inferiore sulla lunghezza dei cammini: per ogni bersaglio, il cammino
 * più corto sugli archi aperti dalla radice deve avere almeno la distanza indicata.
 *
 * @param id identificatore del vincolo, riportato nella soluzione
 * @param rootId nodo di partenza
 * @param minDistances bersaglio → distanza minima
 */
public record PathLengthConstraint(String id, String rootId, Map<String, Integer> minDistances) {

    public PathLengthConstraint {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Identificatore vincolo vuoto");
        }
        minDistances = Collections.unmodifiableMap(new LinkedHashMap<>(minDistances));
    }
}
