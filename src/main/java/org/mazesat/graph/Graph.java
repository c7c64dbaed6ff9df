package org.mazesat.graph;

import java.util.*;
import java.util.logging.Logger;

/**
 * GRAFO NON ORIENTATO - Dati di input forniti dal chiamante
 *
 * Rappresentazione immutabile di nodi e archi su cui lavorano tutti i codificatori.
 * I nodi hanno un identificatore opaco esterno e un indice denso interno
 * {@code 0..n-1}; ogni accesso dei codificatori avviene tramite indici.
 *
 * INVARIANTI:
 * - Identificatori dei nodi univoci
 * - Liste di vicini senza duplicati e senza il nodo stesso (i cappi restano
 *   visibili solo come archi)
 * - Gli archi multipli tra la stessa coppia sono ammessi e conservati
 */
public final class Graph {

    private static final Logger LOGGER = Logger.getLogger(Graph.class.getName());

    private final List<String> nodeIds;
    private final Map<String, Integer> indexById;
    private final List<Edge> edges;
    private final int[][] neighbors;
    private final int[][] incidentEdges;

    private Graph(List<String> nodeIds, Map<String, Integer> indexById, List<Edge> edges) {
        this.nodeIds = List.copyOf(nodeIds);
        this.indexById = Map.copyOf(indexById);
        this.edges = List.copyOf(edges);

        List<Set<Integer>> neighborSets = new ArrayList<>();
        List<List<Integer>> incident = new ArrayList<>();
        for (int i = 0; i < nodeIds.size(); i++) {
            neighborSets.add(new LinkedHashSet<>());
            incident.add(new ArrayList<>());
        }
        for (Edge edge : edges) {
            incident.get(edge.u()).add(edge.index());
            if (edge.isLoop()) {
                continue;
            }
            incident.get(edge.v()).add(edge.index());
            neighborSets.get(edge.u()).add(edge.v());
            neighborSets.get(edge.v()).add(edge.u());
        }

        this.neighbors = new int[nodeIds.size()][];
        this.incidentEdges = new int[nodeIds.size()][];
        for (int i = 0; i < nodeIds.size(); i++) {
            neighbors[i] = neighborSets.get(i).stream().mapToInt(Integer::intValue).toArray();
            incidentEdges[i] = incident.get(i).stream().mapToInt(Integer::intValue).toArray();
        }

        LOGGER.fine("Grafo costruito: " + nodeIds.size() + " nodi, " + edges.size() + " archi");
    }

    public static Builder builder() {
        return new Builder();
    }

    //region NODI

    public int nodeCount() {
        return nodeIds.size();
    }

    public String nodeId(int index) {
        return nodeIds.get(index);
    }

    public List<String> nodeIds() {
        return nodeIds;
    }

    public boolean contains(String nodeId) {
        return indexById.containsKey(nodeId);
    }

    /**
     * @throws IllegalArgumentException se il nodo non esiste
     */
    public int indexOf(String nodeId) {
        Integer index = indexById.get(nodeId);
        if (index == null) {
            throw new IllegalArgumentException("Nodo sconosciuto: " + nodeId);
        }
        return index;
    }

    /**
     * Vicini distinti del nodo, nell'ordine di inserimento degli archi.
     */
    public int[] neighbors(int node) {
        return neighbors[node].clone();
    }

    public int degree(int node) {
        return neighbors[node].length;
    }

    public boolean areAdjacent(int a, int b) {
        for (int n : neighbors[a]) {
            if (n == b) return true;
        }
        return false;
    }

    //endregion

    //region ARCHI

    public List<Edge> edges() {
        return edges;
    }

    public int edgeCount() {
        return edges.size();
    }

    public Edge edge(int index) {
        return edges.get(index);
    }

    /**
     * Indici degli archi incidenti al nodo (i cappi compaiono una volta sola).
     */
    public int[] incidentEdges(int node) {
        return incidentEdges[node].clone();
    }

    /**
     * Primo arco che collega i due nodi, oppure null.
     */
    public Edge findEdge(int a, int b) {
        for (int index : incidentEdges[a]) {
            Edge edge = edges.get(index);
            if (edge.connects(a, b)) {
                return edge;
            }
        }
        return null;
    }

    //endregion

    //region VISITA

    /**
     * Distanze in numero di archi da {@code root} su tutto il grafo.
     * I nodi non raggiungibili valgono -1.
     */
    public int[] hopDistances(int root) {
        int[] distance = new int[nodeCount()];
        Arrays.fill(distance, -1);
        distance[root] = 0;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int next : neighbors[current]) {
                if (distance[next] == -1) {
                    distance[next] = distance[current] + 1;
                    queue.add(next);
                }
            }
        }
        return distance;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("Graph{nodi=%d, archi=%d}", nodeCount(), edgeCount());
    }

    /**
     * Costruttore incrementale del grafo. Gli archi si possono aggiungere solo
     * tra nodi già dichiarati.
     */
    public static final class Builder {

        private final List<String> nodeIds = new ArrayList<>();
        private final Map<String, Integer> indexById = new HashMap<>();
        private final List<Edge> edges = new ArrayList<>();
        private final Set<String> edgeIds = new HashSet<>();

        private Builder() {
        }

        public Builder addNode(String nodeId) {
            if (nodeId == null || nodeId.isBlank()) {
                throw new IllegalArgumentException("Identificatore nodo vuoto");
            }
            if (indexById.containsKey(nodeId)) {
                throw new IllegalArgumentException("Nodo duplicato: " + nodeId);
            }
            indexById.put(nodeId, nodeIds.size());
            nodeIds.add(nodeId);
            return this;
        }

        public Builder addNodes(String... ids) {
            for (String id : ids) {
                addNode(id);
            }
            return this;
        }

        /**
         * Aggiunge un arco con identificatore derivato dagli estremi.
         */
        public Builder addEdge(String a, String b) {
            String id = a + "--" + b;
            int suffix = 1;
            while (edgeIds.contains(id)) {
                id = a + "--" + b + "#" + (++suffix);
            }
            return addEdge(id, a, b, "");
        }

        public Builder addEdge(String edgeId, String a, String b, String tag) {
            if (edgeIds.contains(edgeId)) {
                throw new IllegalArgumentException("Arco duplicato: " + edgeId);
            }
            Integer u = indexById.get(a);
            Integer v = indexById.get(b);
            if (u == null || v == null) {
                throw new IllegalArgumentException("Arco " + edgeId + " con estremo sconosciuto: " + a + ", " + b);
            }
            edges.add(new Edge(edges.size(), edgeId, u, v, tag));
            edgeIds.add(edgeId);
            return this;
        }

        public Graph build() {
            if (nodeIds.isEmpty()) {
                LOGGER.warning("Costruzione di un grafo senza nodi");
            }
            return new Graph(nodeIds, indexById, edges);
        }
    }
}
