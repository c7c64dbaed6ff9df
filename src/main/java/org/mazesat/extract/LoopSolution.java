package org.mazesat.extract;

import java.util.List;

/**
 * Ciclo semplice decodificato.
 *
 * @param path nodi visitati in ordine, radice in prima e ultima posizione
 * @param edgeIds archi percorsi, uno per ogni coppia consecutiva
 */
public record LoopSolution(List<String> path, List<String> edgeIds) {

    public LoopSolution {
        path = List.copyOf(path);
        edgeIds = List.copyOf(edgeIds);
        if (path.size() < 2 || !path.get(0).equals(path.get(path.size() - 1))) {
            throw new IllegalArgumentException("Il percorso deve iniziare e terminare nella radice: " + path);
        }
        if (edgeIds.size() != path.size() - 1) {
            throw new IllegalArgumentException("Numero di archi incoerente con il percorso");
        }
    }

    /**
     * @return numero di nodi distinti del ciclo
     */
    public int distinctNodes() {
        return path.size() - 1;
    }
}
