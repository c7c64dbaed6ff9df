package org.mazesat.encoding;

/**
 * Vincolo sulla profondità di un nodo nell'albero del proprio gruppo.
 *
 * @param nodeId nodo fissato a un gruppo
 * @param comparison confronto richiesto
 * @param depth profondità di riferimento (archi dalla radice)
 */
public record DepthRequirement(String nodeId, Comparison comparison, int depth) {

    public enum Comparison {
        AT_LEAST,
        EXACTLY
    }

    public static DepthRequirement atLeast(String nodeId, int depth) {
        return new DepthRequirement(nodeId, Comparison.AT_LEAST, depth);
    }

    public static DepthRequirement exactly(String nodeId, int depth) {
        return new DepthRequirement(nodeId, Comparison.EXACTLY, depth);
    }
}
