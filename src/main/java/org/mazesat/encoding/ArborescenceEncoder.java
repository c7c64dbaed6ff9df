package org.mazesat.encoding;

import org.mazesat.backend.SatBackend;
import org.mazesat.extract.ArborescenceSolution;
import org.mazesat.extract.SolutionExtractor;
import org.mazesat.graph.Edge;
import org.mazesat.graph.Graph;
import org.mazesat.support.EncodingSession;
import org.mazesat.support.VariableKey;

import java.util.*;
import java.util.logging.Logger;

/**
 * ARBORESCENZA SU QUOZIENTE - Scelta simmetrica dell'arco genitore
 *
 * Ogni nodo del quoziente sceglie esattamente un arco incidente come "arco
 * genitore" (i cappi sono ammessi); la scelta, sollevata, determina il
 * genitore di ogni nodo del rivestimento. Una profondità unaria sui nodi
 * sollevati esclude i cicli e permette di imporre una profondità minima al
 * bersaglio.
 *
 * CODIFICA:
 * - exactlyOne(Choose(q, e)) sugli archi incidenti a ogni nodo quoziente non isolato
 * - Per ogni nodo sollevato u diverso dalla radice e arco e della sua proiezione:
 *   Choose ⇒ ⋁ LiftedParent(u, p) sui vicini p raggiunti tramite e,
 *   LiftedParent(u, p) ⇒ ⋁ Choose sugli archi che portano a p
 * - Al più un genitore; HasParent(u) ⇔ ⋁ genitori
 * - Depth(u, d) unaria: radice a profondità 0, tetto N-1, HasParent ⇔ Depth(u, 1),
 *   profondità del figlio = profondità del genitore + 1
 *
 * Con {@code requireSpanning} ogni nodo diverso dalla radice deve avere un genitore.
 */
public class ArborescenceEncoder implements ProblemEncoder<ArborescenceSolution> {

    private static final Logger LOGGER = Logger.getLogger(ArborescenceEncoder.class.getName());

    private final LiftedGraph lifted;
    private final String rootId;
    private final String targetId;
    private final int minDepth;
    private final boolean requireSpanning;

    private int root = -1;
    private int target = -1;

    /** Genitori candidati di ciascun nodo sollevato, in ordine di scoperta. */
    private final Map<Integer, List<Integer>> candidates = new HashMap<>();

    public ArborescenceEncoder(LiftedGraph lifted, String rootId, String targetId, int minDepth,
                               boolean requireSpanning) {
        this.lifted = Objects.requireNonNull(lifted);
        this.rootId = rootId;
        this.targetId = targetId;
        this.minDepth = minDepth;
        this.requireSpanning = requireSpanning;
    }

    public ArborescenceEncoder(LiftedGraph lifted, String rootId, String targetId, int minDepth) {
        this(lifted, rootId, targetId, minDepth, false);
    }

    @Override
    public void validate() throws InvalidRequestException {
        Graph graph = lifted.lifted();
        if (graph.nodeCount() == 0) {
            throw new InvalidRequestException("Il grafo sollevato non contiene nodi");
        }
        if (rootId == null || !graph.contains(rootId)) {
            throw new InvalidRequestException("Radice sconosciuta: " + rootId);
        }
        if (targetId == null || !graph.contains(targetId)) {
            throw new InvalidRequestException("Bersaglio sconosciuto: " + targetId);
        }
        if (minDepth < 0) {
            throw new InvalidRequestException("Profondità minima negativa: " + minDepth);
        }
        root = graph.indexOf(rootId);
        target = graph.indexOf(targetId);
    }

    @Override
    public void encode(EncodingSession session) {
        if (root < 0) {
            throw new IllegalStateException("encode() richiede una validazione riuscita");
        }
        LOGGER.info("=== CODIFICA ARBORESCENZA: " + describe() + " ===");

        Graph quotient = lifted.quotient();
        Graph graph = lifted.lifted();
        int n = graph.nodeCount();

        for (int q = 0; q < quotient.nodeCount(); q++) {
            int[] incident = quotient.incidentEdges(q);
            if (incident.length == 0) {
                LOGGER.warning("Nodo quoziente isolato: " + quotient.nodeId(q));
                continue;
            }
            List<Integer> choices = new ArrayList<>(incident.length);
            for (int e : incident) {
                choices.add(choose(session, q, e));
            }
            session.exactlyOne(choices);
        }

        candidates.clear();
        for (int u = 0; u < n; u++) {
            if (u == root) continue;
            encodeParentChoice(session, u);
        }

        encodeDepth(session, n);

        if (minDepth > 0) {
            if (minDepth >= n) {
                session.declareImpossible("Profondità " + minDepth + " irraggiungibile con "
                        + n + " nodi sollevati");
            } else {
                session.addUnit(depth(session, target, minDepth));
            }
        }

        LOGGER.info("Codifica arborescenza completata: " + session.stats());
    }

    private void encodeParentChoice(EncodingSession session, int u) {
        int q = lifted.quotientNodeOf(u);
        Map<Integer, List<Integer>> edgesToParent = new LinkedHashMap<>();

        for (int e : lifted.quotient().incidentEdges(q)) {
            List<Integer> neighbors = lifted.neighborsVia(u, e);
            if (neighbors.isEmpty()) continue;

            int chosen = choose(session, q, e);
            List<Integer> clause = new ArrayList<>(neighbors.size() + 1);
            clause.add(-chosen);
            for (int p : neighbors) {
                clause.add(parent(session, u, p));
                edgesToParent.computeIfAbsent(p, k -> new ArrayList<>()).add(chosen);
            }
            session.addClause(clause);
        }

        List<Integer> parentLiterals = new ArrayList<>();
        for (Map.Entry<Integer, List<Integer>> entry : edgesToParent.entrySet()) {
            int parentLiteral = parent(session, u, entry.getKey());
            List<Integer> clause = new ArrayList<>(entry.getValue().size() + 1);
            clause.add(-parentLiteral);
            clause.addAll(entry.getValue());
            session.addClause(clause);
            parentLiterals.add(parentLiteral);
        }
        candidates.put(u, new ArrayList<>(edgesToParent.keySet()));

        int hasParent = session.variable(new VariableKey.HasParent(u));
        if (parentLiterals.isEmpty()) {
            session.addUnit(-hasParent);
        } else {
            session.atMostOne(parentLiterals);
            List<Integer> clause = new ArrayList<>(parentLiterals.size() + 1);
            clause.add(-hasParent);
            clause.addAll(parentLiterals);
            session.addClause(clause);
            for (int parentLiteral : parentLiterals) {
                session.implies(parentLiteral, hasParent);
            }
        }
        if (requireSpanning) {
            session.addUnit(hasParent);
        }
    }

    private void encodeDepth(EncodingSession session, int n) {
        session.addUnit(-depth(session, root, 1));
        for (int u = 0; u < n; u++) {
            for (int d = 2; d <= n; d++) {
                session.implies(depth(session, u, d), depth(session, u, d - 1));
            }
            session.addUnit(-depth(session, u, n));
        }

        for (Map.Entry<Integer, List<Integer>> entry : candidates.entrySet()) {
            int u = entry.getKey();
            session.equivalent(session.variable(new VariableKey.HasParent(u)), depth(session, u, 1));
            for (int p : entry.getValue()) {
                int parent = parent(session, u, p);
                for (int d = 1; d < n; d++) {
                    session.addClause(-parent, -depth(session, p, d), depth(session, u, d + 1));
                }
                for (int d = 2; d <= n; d++) {
                    session.addClause(-parent, -depth(session, u, d), depth(session, p, d - 1));
                }
            }
        }
    }

    @Override
    public ArborescenceSolution decode(EncodingSession session, SatBackend backend) {
        SolutionExtractor extractor = new SolutionExtractor(session, backend);
        Graph quotient = lifted.quotient();
        Graph graph = lifted.lifted();

        Map<String, String> chosenEdge = new LinkedHashMap<>();
        for (int q = 0; q < quotient.nodeCount(); q++) {
            for (int e : quotient.incidentEdges(q)) {
                if (extractor.isTrue(new VariableKey.Choose(q, e))) {
                    Edge edge = quotient.edge(e);
                    chosenEdge.put(quotient.nodeId(q), edge.id());
                    break;
                }
            }
        }

        int[] parentOf = new int[graph.nodeCount()];
        Arrays.fill(parentOf, -1);
        Map<String, String> liftedParent = new LinkedHashMap<>();
        for (Map.Entry<Integer, List<Integer>> entry : candidates.entrySet()) {
            for (int p : entry.getValue()) {
                if (extractor.isTrue(new VariableKey.LiftedParent(entry.getKey(), p))) {
                    parentOf[entry.getKey()] = p;
                    liftedParent.put(graph.nodeId(entry.getKey()), graph.nodeId(p));
                }
            }
        }

        int[] depths = SolutionExtractor.depthsAlongParents(parentOf);
        Map<String, Integer> depth = new LinkedHashMap<>();
        for (int u = 0; u < depths.length; u++) {
            depth.put(graph.nodeId(u), depths[u]);
        }
        return new ArborescenceSolution(chosenEdge, liftedParent, depth, rootId);
    }

    private static int choose(EncodingSession session, int quotientNode, int quotientEdge) {
        return session.variable(new VariableKey.Choose(quotientNode, quotientEdge));
    }

    private static int parent(EncodingSession session, int node, int parent) {
        return session.variable(new VariableKey.LiftedParent(node, parent));
    }

    private static int depth(EncodingSession session, int node, int d) {
        return session.variable(new VariableKey.Depth(node, d));
    }

    @Override
    public String describe() {
        return String.format("arborescenza su %d nodi sollevati (%d nel quoziente), radice %s, %s a profondità >= %d",
                lifted.lifted().nodeCount(), lifted.quotient().nodeCount(), rootId, targetId, minDepth);
    }
}
