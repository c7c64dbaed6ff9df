package org.mazesat.extract;

import java.util.Map;

/**
 * Arborescenza decodificata sul grafo sollevato.
 *
 * @param chosenEdge nodo quoziente → arco quoziente scelto come arco genitore
 * @param liftedParent nodo sollevato → genitore (radice e nodi senza genitore non compaiono)
 * @param depth nodo sollevato → numero di passi fino al primo antenato senza genitore
 * @param root radice dell'arborescenza
 */
public record ArborescenceSolution(Map<String, String> chosenEdge,
                                   Map<String, String> liftedParent,
                                   Map<String, Integer> depth,
                                   String root) {

    public ArborescenceSolution {
        chosenEdge = Map.copyOf(chosenEdge);
        liftedParent = Map.copyOf(liftedParent);
        depth = Map.copyOf(depth);
        if (liftedParent.containsKey(root)) {
            throw new IllegalArgumentException("La radice non può avere un genitore: " + root);
        }
    }

    /**
     * @return true se il nodo risale alla radice seguendo i genitori
     */
    public boolean reachesRoot(String node) {
        String current = node;
        for (int steps = 0; steps <= liftedParent.size(); steps++) {
            if (current.equals(root)) {
                return true;
            }
            current = liftedParent.get(current);
            if (current == null) {
                return false;
            }
        }
        return false;
    }
}
