package org.mazesat.encoding;

import org.mazesat.graph.DistanceLowerBound;
import org.mazesat.graph.Edge;
import org.mazesat.graph.Graph;
import org.mazesat.support.EncodingSession;
import org.mazesat.support.VariableKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * RAGGIUNGIBILITÀ LIMITATA - Limiti inferiori sulla distanza lungo gli archi aperti
 *
 * Per ogni vincolo di lunghezza dei cammini introduce R(i, v) = "v raggiungibile
 * dalla radice in al più i archi aperti" per i = 0..maxK e vieta
 * R(minDist-1, bersaglio).
 *
 * CODIFICA:
 * - Passo 0: radice vera, ogni altro nodo della palla falso
 * - Avanti: R(i-1, v) ⇒ R(i, v) e R(i-1, n) ∧ aperto(n, v) ⇒ R(i, v), senza variabili di supporto
 * - Indietro: R(i, v) ⇒ R(i-1, v) ∨ ⋁ T(i, e, v), con una variabile di supporto
 *   T = R(i-1, n) ∧ aperto(e) per ogni arco e = (n, v)
 *
 * POTATURA A PALLA:
 * R(i, v) esiste solo se il limite inferiore di distanza tra radice e v è al
 * più i; i nodi fuori dalla palla sono irraggiungibili per costruzione e i
 * bersagli fuori dalla palla soddisfano il vincolo senza clausole.
 *
 * Richiede che le variabili {@link VariableKey.EdgeKept} siano attive.
 */
public class ReachabilityEncoder {

    private static final Logger LOGGER = Logger.getLogger(ReachabilityEncoder.class.getName());

    private final Graph graph;
    private final DistanceLowerBound lowerBound;

    public ReachabilityEncoder(Graph graph, DistanceLowerBound lowerBound) {
        this.graph = graph;
        this.lowerBound = lowerBound;
    }

    /**
     * Codifica un vincolo.
     *
     * @param constraintIndex indice del vincolo, parte delle chiavi delle variabili
     * @param root indice del nodo radice
     * @param minDistances indice del bersaglio → distanza minima
     */
    public void encode(EncodingSession session, int constraintIndex, int root, Map<Integer, Integer> minDistances) {
        int maxK = 0;
        for (int d : minDistances.values()) {
            maxK = Math.max(maxK, d - 1);
        }
        if (maxK == 0) {
            LOGGER.fine("Vincolo " + constraintIndex + ": nessuna distanza > 1, niente da codificare");
            return;
        }

        int n = graph.nodeCount();
        int[] bound = new int[n];
        int ballSize = 0;
        for (int v = 0; v < n; v++) {
            bound[v] = lowerBound.lowerBound(root, v);
            if (bound[v] <= maxK) ballSize++;
        }
        LOGGER.fine(String.format("Vincolo %d: maxK=%d, palla di %d nodi su %d", constraintIndex, maxK, ballSize, n));

        // passo 0
        session.addUnit(reach(session, constraintIndex, 0, root));
        for (int v = 0; v < n; v++) {
            if (v != root && bound[v] <= 0) {
                session.addUnit(-reach(session, constraintIndex, 0, v));
            }
        }

        for (int step = 1; step <= maxK; step++) {
            for (int v = 0; v < n; v++) {
                if (bound[v] > step) continue;
                encodeStep(session, constraintIndex, step, v, bound);
            }
        }

        for (Map.Entry<Integer, Integer> entry : minDistances.entrySet()) {
            int target = entry.getKey();
            int minDist = entry.getValue();
            if (minDist <= 1) continue;
            int forbiddenStep = minDist - 1;
            if (bound[target] > forbiddenStep) {
                LOGGER.finest("Bersaglio " + graph.nodeId(target) + " fuori dalla palla: vincolo già soddisfatto");
                continue;
            }
            session.addUnit(-reach(session, constraintIndex, forbiddenStep, target));
        }
    }

    private void encodeStep(EncodingSession session, int constraint, int step, int v, int[] bound) {
        int current = reach(session, constraint, step, v);
        List<Integer> justifications = new ArrayList<>();

        if (bound[v] <= step - 1) {
            int previous = reach(session, constraint, step - 1, v);
            session.implies(previous, current);
            justifications.add(previous);
        }

        for (int edgeIndex : graph.incidentEdges(v)) {
            Edge edge = graph.edge(edgeIndex);
            if (edge.isLoop()) continue;
            int neighbor = edge.other(v);
            if (bound[neighbor] > step - 1) continue;

            int previousNeighbor = reach(session, constraint, step - 1, neighbor);
            int kept = session.variable(new VariableKey.EdgeKept(edgeIndex));
            session.addClause(-previousNeighbor, -kept, current);

            int through = session.variable(new VariableKey.ReachThrough(constraint, step, edgeIndex, v));
            session.implies(through, previousNeighbor);
            session.implies(through, kept);
            session.addClause(-previousNeighbor, -kept, through);
            justifications.add(through);
        }

        if (justifications.isEmpty()) {
            session.addUnit(-current);
        } else {
            List<Integer> clause = new ArrayList<>(justifications.size() + 1);
            clause.add(-current);
            clause.addAll(justifications);
            session.addClause(clause);
        }
    }

    private static int reach(EncodingSession session, int constraint, int step, int node) {
        return session.variable(new VariableKey.Reach(constraint, step, node));
    }
}
