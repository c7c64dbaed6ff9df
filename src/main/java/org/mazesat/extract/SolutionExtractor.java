package org.mazesat.extract;

import org.mazesat.backend.SatBackend;
import org.mazesat.graph.Edge;
import org.mazesat.graph.Graph;
import org.mazesat.support.EncodingSession;
import org.mazesat.support.VariableKey;

import java.util.*;
import java.util.logging.Logger;

/**
 * ESTRATTORE DI SOLUZIONI - Lettura del modello e ricostruzione delle strutture
 *
 * Legge le variabili del modello tramite le chiavi strutturate della sessione
 * e ricostruisce le strutture del grafo: relazione genitore-figlio, partizione
 * degli archi in aperti e bloccati, distanze, percorsi.
 *
 * Le distanze riportate sono sempre calcolate con una BFS sugli archi aperti,
 * mai lette dalle variabili di livello del solutore.
 */
public class SolutionExtractor {

    private static final Logger LOGGER = Logger.getLogger(SolutionExtractor.class.getName());

    private final EncodingSession session;
    private final SatBackend backend;

    public SolutionExtractor(EncodingSession session, SatBackend backend) {
        this.session = Objects.requireNonNull(session);
        this.backend = Objects.requireNonNull(backend);
    }

    //region LETTURA MODELLO

    /**
     * @return valore della variabile legata alla chiave; false se la chiave non è mai stata usata
     */
    public boolean isTrue(VariableKey key) {
        Integer variable = session.lookup(key);
        return variable != null && backend.valueOf(variable);
    }

    /**
     * Archi aperti secondo le variabili {@link VariableKey.EdgeKept}. I cappi sono sempre bloccati.
     */
    public boolean[] keptEdgesFromVariables(Graph graph) {
        boolean[] open = new boolean[graph.edgeCount()];
        for (Edge edge : graph.edges()) {
            open[edge.index()] = !edge.isLoop() && isTrue(new VariableKey.EdgeKept(edge.index()));
        }
        return open;
    }

    //endregion

    //region RICOSTRUZIONE STRUTTURE

    /**
     * Archi aperti dedotti dalla relazione genitore-figlio: ogni arco che unisce
     * un nodo al proprio genitore è aperto.
     *
     * @param parentOf genitore di ciascun nodo, -1 se assente
     */
    public static boolean[] keptEdgesFromParents(Graph graph, int[] parentOf) {
        boolean[] open = new boolean[graph.edgeCount()];
        for (Edge edge : graph.edges()) {
            if (edge.isLoop()) continue;
            open[edge.index()] = parentOf[edge.v()] == edge.u() || parentOf[edge.u()] == edge.v();
        }
        return open;
    }

    /**
     * Distanze BFS da {@code root} usando solo gli archi aperti; -1 se irraggiungibile.
     */
    public static int[] bfsOverOpenEdges(Graph graph, boolean[] open, int root) {
        int[] distance = new int[graph.nodeCount()];
        Arrays.fill(distance, -1);
        distance[root] = 0;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int edgeIndex : graph.incidentEdges(current)) {
                if (!open[edgeIndex]) continue;
                int next = graph.edge(edgeIndex).other(current);
                if (distance[next] == -1) {
                    distance[next] = distance[current] + 1;
                    queue.add(next);
                }
            }
        }
        return distance;
    }

    /**
     * Profondità di ciascun nodo come numero di passi lungo i genitori fino a un
     * nodo senza genitore.
     *
     * @throws IllegalStateException se la relazione contiene un ciclo
     */
    public static int[] depthsAlongParents(int[] parentOf) {
        int n = parentOf.length;
        int[] depth = new int[n];
        for (int node = 0; node < n; node++) {
            int steps = 0;
            int current = node;
            while (parentOf[current] >= 0) {
                current = parentOf[current];
                if (++steps > n) {
                    throw new IllegalStateException("Ciclo nella relazione genitore-figlio dal nodo " + node);
                }
            }
            depth[node] = steps;
        }
        return depth;
    }

    /**
     * Identificatori degli archi aperti o bloccati, nell'ordine del grafo.
     */
    public static List<String> edgeIds(Graph graph, boolean[] open, boolean wanted) {
        List<String> ids = new ArrayList<>();
        for (Edge edge : graph.edges()) {
            if (open[edge.index()] == wanted) {
                ids.add(edge.id());
            }
        }
        return ids;
    }

    /**
     * Percorso chiuso: per ogni passo il nodo visitato e per ogni coppia consecutiva l'arco che la unisce.
     *
     * @param stepNodes nodo visitato a ciascun passo
     */
    public static LoopSolution loopFromSteps(Graph graph, int[] stepNodes) {
        List<String> path = new ArrayList<>();
        List<String> edges = new ArrayList<>();
        for (int t = 0; t < stepNodes.length; t++) {
            path.add(graph.nodeId(stepNodes[t]));
            if (t > 0) {
                Edge edge = graph.findEdge(stepNodes[t - 1], stepNodes[t]);
                if (edge == null) {
                    throw new IllegalStateException("Passi " + (t - 1) + " e " + t + " non adiacenti");
                }
                edges.add(edge.id());
            }
        }
        LOGGER.fine("Ciclo decodificato: " + path);
        return new LoopSolution(path, edges);
    }

    //endregion
}
