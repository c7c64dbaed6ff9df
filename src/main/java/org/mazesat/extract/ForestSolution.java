package org.mazesat.extract;

import java.util.List;
import java.util.Map;

/**
 * Foresta decodificata.
 *
 * @param groupOf nodo → gruppo (i nodi esclusi non compaiono)
 * @param rootOf gruppo → radice
 * @param parentOf figlio → genitore (le radici non compaiono)
 * @param keptEdges identificatori degli archi aperti
 * @param blockedEdges identificatori degli archi bloccati (muri)
 * @param distanceFromRoot nodo → distanza BFS sugli archi aperti dalla radice del proprio gruppo
 * @param pathLengthDistances vincolo → (nodo → distanza BFS sugli archi aperti dalla radice del vincolo)
 */
public record ForestSolution(Map<String, String> groupOf,
                             Map<String, String> rootOf,
                             Map<String, String> parentOf,
                             List<String> keptEdges,
                             List<String> blockedEdges,
                             Map<String, Integer> distanceFromRoot,
                             Map<String, Map<String, Integer>> pathLengthDistances) {

    public ForestSolution {
        groupOf = Map.copyOf(groupOf);
        rootOf = Map.copyOf(rootOf);
        parentOf = Map.copyOf(parentOf);
        keptEdges = List.copyOf(keptEdges);
        blockedEdges = List.copyOf(blockedEdges);
        distanceFromRoot = Map.copyOf(distanceFromRoot);
        pathLengthDistances = Map.copyOf(pathLengthDistances);
    }
}
