package org.mazesat.encoding;

import org.mazesat.graph.Graph;

import java.util.*;

/**
 * GRAFO SOLLEVATO - Rivestimento di un grafo quoziente
 *
 * Ogni nodo sollevato proietta su un nodo del quoziente e ogni arco sollevato
 * su un arco del quoziente. Il quoziente è un {@link Graph} ordinario: i cappi
 * (archi che collegano un nodo a se stesso) sono ammessi e il tag dell'arco
 * porta la trasformazione associata, che qui non viene letta.
 *
 * Per ogni nodo sollevato u e arco quoziente e incidente alla sua proiezione,
 * {@link #neighborsVia(int, int)} restituisce i vicini raggiunti tramite e:
 * di solito uno solo, più di uno per i cappi con più "slot".
 */
public final class LiftedGraph {

    private final Graph quotient;
    private final Graph lifted;
    private final int[] quotientNodeOf;
    private final List<Map<Integer, List<Integer>>> neighborsByQuotientEdge;

    private LiftedGraph(Graph quotient, Graph lifted, int[] quotientNodeOf, int[] quotientEdgeOf) {
        this.quotient = quotient;
        this.lifted = lifted;
        this.quotientNodeOf = quotientNodeOf;

        this.neighborsByQuotientEdge = new ArrayList<>();
        for (int i = 0; i < lifted.nodeCount(); i++) {
            neighborsByQuotientEdge.add(new LinkedHashMap<>());
        }
        for (int e = 0; e < lifted.edgeCount(); e++) {
            int a = lifted.edge(e).u();
            int b = lifted.edge(e).v();
            int q = quotientEdgeOf[e];
            neighborsByQuotientEdge.get(a).computeIfAbsent(q, k -> new ArrayList<>()).add(b);
            if (a != b) {
                neighborsByQuotientEdge.get(b).computeIfAbsent(q, k -> new ArrayList<>()).add(a);
            }
        }
    }

    public static Builder builder(Graph quotient) {
        return new Builder(quotient);
    }

    public Graph quotient() {
        return quotient;
    }

    public Graph lifted() {
        return lifted;
    }

    public int quotientNodeOf(int liftedNode) {
        return quotientNodeOf[liftedNode];
    }

    /**
     * Vicini sollevati di {@code liftedNode} raggiunti tramite l'arco quoziente, senza ripetizioni.
     */
    public List<Integer> neighborsVia(int liftedNode, int quotientEdge) {
        List<Integer> neighbors = neighborsByQuotientEdge.get(liftedNode).get(quotientEdge);
        if (neighbors == null) {
            return List.of();
        }
        return List.copyOf(new LinkedHashSet<>(neighbors));
    }

    /**
     * Costruttore del rivestimento: nodi e archi sollevati si dichiarano con il
     * nodo e l'arco quoziente su cui proiettano.
     */
    public static final class Builder {

        private final Graph quotient;
        private final Graph.Builder lifted = Graph.builder();
        private final List<Integer> quotientNodes = new ArrayList<>();
        private final List<Integer> quotientEdges = new ArrayList<>();
        private final Map<String, Integer> projection = new HashMap<>();

        private Builder(Graph quotient) {
            this.quotient = Objects.requireNonNull(quotient);
        }

        public Builder addNode(String liftedId, String quotientNodeId) {
            int q = quotient.indexOf(quotientNodeId);
            lifted.addNode(liftedId);
            projection.put(liftedId, q);
            quotientNodes.add(q);
            return this;
        }

        /**
         * @throws IllegalArgumentException se l'arco quoziente non collega le proiezioni degli estremi
         */
        public Builder addEdge(String a, String b, String quotientEdgeId) {
            int q = quotientEdgeIndex(quotientEdgeId);
            Integer projA = projection.get(a);
            Integer projB = projection.get(b);
            if (projA == null || projB == null) {
                throw new IllegalArgumentException("Arco sollevato con estremo sconosciuto: " + a + ", " + b);
            }
            if (!quotient.edge(q).connects(projA, projB)) {
                throw new IllegalArgumentException("L'arco quoziente " + quotientEdgeId
                        + " non collega le proiezioni di " + a + " e " + b);
            }
            lifted.addEdge(a + "~" + b + "@" + quotientEdgeId + "#" + quotientEdges.size(), a, b,
                    quotient.edge(q).tag());
            quotientEdges.add(q);
            return this;
        }

        private int quotientEdgeIndex(String quotientEdgeId) {
            for (int e = 0; e < quotient.edgeCount(); e++) {
                if (quotient.edge(e).id().equals(quotientEdgeId)) {
                    return e;
                }
            }
            throw new IllegalArgumentException("Arco quoziente sconosciuto: " + quotientEdgeId);
        }

        public LiftedGraph build() {
            return new LiftedGraph(quotient, lifted.build(),
                    quotientNodes.stream().mapToInt(Integer::intValue).toArray(),
                    quotientEdges.stream().mapToInt(Integer::intValue).toArray());
        }
    }
}
