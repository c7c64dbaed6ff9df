package org.mazesat.encoding;

import org.mazesat.backend.SatBackend;
import org.mazesat.extract.ForestSolution;
import org.mazesat.extract.SolutionExtractor;
import org.mazesat.graph.Edge;
import org.mazesat.graph.Graph;
import org.mazesat.support.EncodingSession;
import org.mazesat.support.VariableKey;

import java.util.*;
import java.util.logging.Logger;

/**
 * CODIFICATORE DI FORESTE - Alberi ricoprenti radicati per gruppi di nodi
 *
 * Traduce un {@link ForestProblem} in CNF: ogni gruppo attivo (con almeno un
 * nodo fissato) forma un albero radicato sui nodi che gli appartengono, i
 * nodi liberi scelgono esattamente un gruppo attivo, gli archi tra gruppi
 * diversi sono muri.
 *
 * CODIFICA PER GRUPPO g:
 * - Parent(g, u, v) per ogni vicino u di v che può stare in g
 * - Parent ⇒ appartenenza di entrambi gli estremi, Parent ⇒ arco aperto
 * - Radice senza genitore; ogni altro membro ha esattamente un genitore
 * - Mai genitori reciproci
 * - Eliminazione dei cicli con profondità unaria o livelli binari
 *
 * INVARIANTI MANTENUTE:
 * - Una sola radice per gruppo attivo
 * - Il genitore di un nodo è un vicino dello stesso gruppo che risale alla radice
 * - Un nodo fissato senza vicini candidati rende il problema impossibile
 *
 * I vincoli di lunghezza dei cammini sono delegati a {@link ReachabilityEncoder}.
 */
public class ForestEncoder implements ProblemEncoder<ForestSolution> {

    private static final Logger LOGGER = Logger.getLogger(ForestEncoder.class.getName());

    static final int FREE = -1;
    static final int EXCLUDED = -2;

    private final ForestProblem problem;
    private final Graph graph;

    //region STATO RISOLTO IN VALIDAZIONE

    private int[] placement;
    private final List<GroupLayout> groups = new ArrayList<>();
    private final Map<Integer, GroupLayout> groupByIndex = new HashMap<>();
    private final List<ResolvedDepth> depthRequirements = new ArrayList<>();
    private final List<ResolvedPath> pathConstraints = new ArrayList<>();
    private boolean validated = false;

    /** Nodi potenziali, radice e dimensione dell'albero di un gruppo attivo. */
    private record GroupLayout(int group, int root, int[] potential, boolean[] isPotential) {
        int size() {
            return potential.length;
        }
    }

    private record ResolvedDepth(int node, int group, DepthRequirement.Comparison comparison, int depth) {
    }

    private record ResolvedPath(int index, String id, int root, Map<Integer, Integer> minDistances) {
    }

    //endregion

    public ForestEncoder(ForestProblem problem) {
        this.problem = Objects.requireNonNull(problem, "Problema null");
        this.graph = problem.graph();
    }

    //region VALIDAZIONE

    @Override
    public void validate() throws InvalidRequestException {
        if (graph.nodeCount() == 0) {
            throw new InvalidRequestException("Il grafo non contiene nodi");
        }

        List<String> groupNames = problem.groupNames();
        placement = new int[graph.nodeCount()];
        Arrays.fill(placement, FREE);
        for (Map.Entry<String, String> entry : problem.fixedGroup().entrySet()) {
            placement[resolveNode(entry.getKey(), "nodo fissato")] = groupNames.indexOf(entry.getValue());
        }
        for (String nodeId : problem.excluded()) {
            placement[resolveNode(nodeId, "nodo escluso")] = EXCLUDED;
        }

        groups.clear();
        groupByIndex.clear();
        for (int g = 0; g < groupNames.size(); g++) {
            String name = groupNames.get(g);
            int firstFixed = -1;
            for (int v = 0; v < placement.length && firstFixed < 0; v++) {
                if (placement[v] == g) firstFixed = v;
            }

            String explicitRoot = problem.explicitRoots().get(name);
            if (firstFixed < 0) {
                if (explicitRoot != null) {
                    throw new InvalidRequestException("La radice " + explicitRoot
                            + " del gruppo " + name + " non è un nodo fissato del gruppo");
                }
                LOGGER.warning("Gruppo " + name + " senza nodi fissati: inattivo");
                continue;
            }

            int root = firstFixed;
            if (explicitRoot != null) {
                root = resolveNode(explicitRoot, "radice del gruppo " + name);
                if (placement[root] != g) {
                    throw new InvalidRequestException("La radice " + explicitRoot
                            + " non è un nodo fissato del gruppo " + name);
                }
            }

            List<Integer> potential = new ArrayList<>();
            boolean[] isPotential = new boolean[placement.length];
            for (int v = 0; v < placement.length; v++) {
                if (placement[v] == g || placement[v] == FREE) {
                    potential.add(v);
                    isPotential[v] = true;
                }
            }
            GroupLayout layout = new GroupLayout(g, root,
                    potential.stream().mapToInt(Integer::intValue).toArray(), isPotential);
            groups.add(layout);
            groupByIndex.put(g, layout);
        }

        if (groups.isEmpty()) {
            throw new InvalidRequestException("Nessun gruppo ha nodi fissati");
        }

        depthRequirements.clear();
        for (DepthRequirement requirement : problem.depthRequirements()) {
            int node = resolveNode(requirement.nodeId(), "vincolo di profondità");
            if (placement[node] < 0) {
                throw new InvalidRequestException("Il vincolo di profondità richiede un nodo fissato: "
                        + requirement.nodeId());
            }
            if (requirement.depth() < 0) {
                throw new InvalidRequestException("Profondità negativa per " + requirement.nodeId());
            }
            depthRequirements.add(new ResolvedDepth(node, placement[node], requirement.comparison(), requirement.depth()));
        }

        pathConstraints.clear();
        Set<String> ids = new HashSet<>();
        for (PathLengthConstraint constraint : problem.pathLengthConstraints()) {
            if (!ids.add(constraint.id())) {
                throw new InvalidRequestException("Vincolo di cammino duplicato: " + constraint.id());
            }
            int root = resolveNode(constraint.rootId(), "radice del vincolo " + constraint.id());
            Map<Integer, Integer> targets = new LinkedHashMap<>();
            for (Map.Entry<String, Integer> entry : constraint.minDistances().entrySet()) {
                int target = resolveNode(entry.getKey(), "bersaglio del vincolo " + constraint.id());
                if (entry.getValue() == null || entry.getValue() < 0) {
                    throw new InvalidRequestException("Distanza minima non valida per " + entry.getKey());
                }
                targets.merge(target, entry.getValue(), Math::max);
            }
            pathConstraints.add(new ResolvedPath(pathConstraints.size(), constraint.id(), root, targets));
        }

        validated = true;
        LOGGER.fine("Richiesta valida: " + describe());
    }

    private int resolveNode(String nodeId, String role) throws InvalidRequestException {
        if (nodeId == null || !graph.contains(nodeId)) {
            throw new InvalidRequestException("Nodo sconosciuto (" + role + "): " + nodeId);
        }
        return graph.indexOf(nodeId);
    }

    //endregion

    //region CODIFICA

    @Override
    public void encode(EncodingSession session) {
        if (!validated) {
            throw new IllegalStateException("encode() richiede una validazione riuscita");
        }
        LOGGER.info("=== CODIFICA FORESTA: " + describe() + " ===");

        encodeFreeNodeChoice(session);
        if (problem.keptEdges()) {
            encodeWalls(session);
        }

        CycleEncoding cycles = problem.cycleEncoding();
        if (!depthRequirements.isEmpty() && cycles != CycleEncoding.UNARY) {
            LOGGER.warning("Vincoli di profondità presenti: uso della profondità unaria al posto dei livelli binari");
            cycles = CycleEncoding.UNARY;
        }

        for (GroupLayout layout : groups) {
            encodeGroupTree(session, layout, cycles);
        }

        if (problem.keptEdges() && problem.depthMode() == DepthMode.KEPT_EDGE_CONSISTENT) {
            encodeKeptEdgeConsistency(session);
        }

        for (ResolvedDepth requirement : depthRequirements) {
            encodeDepthRequirement(session, requirement);
        }

        ReachabilityEncoder reachability = new ReachabilityEncoder(graph, problem.lowerBound());
        for (ResolvedPath constraint : pathConstraints) {
            if (checkPathImpossibility(session, constraint)) {
                continue;
            }
            reachability.encode(session, constraint.index(), constraint.root(), constraint.minDistances());
        }

        LOGGER.info("Codifica foresta completata: " + session.stats());
    }

    /**
     * Ogni nodo libero sceglie esattamente un gruppo attivo.
     */
    private void encodeFreeNodeChoice(EncodingSession session) {
        for (int v = 0; v < placement.length; v++) {
            if (placement[v] != FREE) continue;
            List<Integer> choices = new ArrayList<>();
            for (GroupLayout layout : groups) {
                choices.add(session.variable(new VariableKey.Member(v, layout.group())));
            }
            session.exactlyOne(choices);
        }
    }

    /**
     * Un arco i cui estremi hanno etichette diverse è bloccato. Gli esclusi
     * contano come etichetta a sé.
     */
    private void encodeWalls(EncodingSession session) {
        for (Edge edge : graph.edges()) {
            if (edge.isLoop()) continue;
            int kept = session.variable(new VariableKey.EdgeKept(edge.index()));
            for (int[] labelU : labelOptions(session, edge.u())) {
                for (int[] labelV : labelOptions(session, edge.v())) {
                    if (labelU[0] == labelV[0]) continue;
                    List<Integer> clause = new ArrayList<>(3);
                    clause.add(-kept);
                    if (labelU[1] != 0) clause.add(-labelU[1]);
                    if (labelV[1] != 0) clause.add(-labelV[1]);
                    session.addClause(clause);
                }
            }
        }
    }

    /**
     * Coppie (etichetta, letterale) possibili per un nodo; letterale 0 se l'etichetta è certa.
     */
    private List<int[]> labelOptions(EncodingSession session, int node) {
        if (placement[node] != FREE) {
            return List.of(new int[]{placement[node], 0});
        }
        List<int[]> options = new ArrayList<>();
        for (GroupLayout layout : groups) {
            options.add(new int[]{layout.group(), session.variable(new VariableKey.Member(node, layout.group()))});
        }
        return options;
    }

    /**
     * @return 0 se il nodo è fissato al gruppo, altrimenti la variabile di appartenenza
     */
    private int memberLiteral(EncodingSession session, int node, int group) {
        return placement[node] == group ? 0 : session.variable(new VariableKey.Member(node, group));
    }

    private void encodeGroupTree(EncodingSession session, GroupLayout layout, CycleEncoding cycles) {
        int g = layout.group();
        if (layout.size() <= 1) {
            LOGGER.fine("Gruppo " + groupName(g) + " con un solo nodo potenziale: nessuna clausola di albero");
            return;
        }

        Map<Integer, List<Integer>> parentsOf = new LinkedHashMap<>();
        for (int v : layout.potential()) {
            List<Integer> parents = new ArrayList<>();
            for (int u : graph.neighbors(v)) {
                if (!layout.isPotential()[u]) continue;
                int parent = session.variable(new VariableKey.Parent(g, u, v));
                parents.add(parent);

                if (problem.keptEdges()) {
                    for (int edgeIndex : graph.incidentEdges(v)) {
                        Edge edge = graph.edge(edgeIndex);
                        if (!edge.isLoop() && edge.connects(u, v)) {
                            session.implies(parent, session.variable(new VariableKey.EdgeKept(edgeIndex)));
                        }
                    }
                }
                int memberU = memberLiteral(session, u, g);
                int memberV = memberLiteral(session, v, g);
                if (memberU != 0) session.implies(parent, memberU);
                if (memberV != 0) session.implies(parent, memberV);
            }
            parentsOf.put(v, parents);
        }

        for (int v : layout.potential()) {
            List<Integer> parents = parentsOf.get(v);
            if (v == layout.root()) {
                for (int parent : parents) {
                    session.addUnit(-parent);
                }
                continue;
            }
            if (parents.size() > 1) {
                session.atMostOne(parents);
            }
            int member = memberLiteral(session, v, g);
            if (!parents.isEmpty()) {
                if (member == 0) {
                    session.atLeastOne(parents);
                } else {
                    List<Integer> clause = new ArrayList<>(parents.size() + 1);
                    clause.add(-member);
                    clause.addAll(parents);
                    session.addClause(clause);
                }
            } else if (member == 0) {
                session.declareImpossible("Il nodo " + graph.nodeId(v) + " del gruppo " + groupName(g)
                        + " non ha vicini che possano collegarlo alla radice");
            } else {
                session.addUnit(-member);
            }
        }

        // mai genitori reciproci
        for (int v : layout.potential()) {
            for (int u : graph.neighbors(v)) {
                if (u < v && layout.isPotential()[u]) {
                    session.addClause(-session.variable(new VariableKey.Parent(g, u, v)),
                            -session.variable(new VariableKey.Parent(g, v, u)));
                }
            }
        }

        if (cycles == CycleEncoding.UNARY) {
            encodeUnaryDepth(session, layout);
        } else {
            encodeBinaryLevels(session, layout);
        }
    }

    /**
     * DistAtLeast(g, v, d) per d = 1..N: catena monotona, radice a profondità 0,
     * tetto N-1, e per ogni arco genitore u → v la profondità di v è esattamente
     * quella di u più uno.
     */
    private void encodeUnaryDepth(EncodingSession session, GroupLayout layout) {
        int g = layout.group();
        int n = layout.size();

        for (int v : layout.potential()) {
            for (int d = 2; d <= n; d++) {
                session.implies(dist(session, g, v, d), dist(session, g, v, d - 1));
            }
            session.addUnit(-dist(session, g, v, n));
        }
        session.addUnit(-dist(session, g, layout.root(), 1));

        for (int v : layout.potential()) {
            for (int u : graph.neighbors(v)) {
                if (!layout.isPotential()[u]) continue;
                int parent = session.variable(new VariableKey.Parent(g, u, v));
                session.implies(parent, dist(session, g, v, 1));
                for (int d = 1; d < n; d++) {
                    session.addClause(-parent, -dist(session, g, u, d), dist(session, g, v, d + 1));
                }
                for (int d = 2; d <= n; d++) {
                    session.addClause(-parent, -dist(session, g, v, d), dist(session, g, u, d - 1));
                }
            }
        }
    }

    /**
     * Livelli binari con ⌈log₂N⌉ bit, radice a livello 0, e per ogni arco
     * genitore u → v il vincolo livello(u) &lt; livello(v) tramite un confronto
     * lessicografico dal bit più significativo.
     */
    private void encodeBinaryLevels(EncodingSession session, GroupLayout layout) {
        int g = layout.group();
        int bits = Math.max(1, 32 - Integer.numberOfLeadingZeros(layout.size() - 1));

        for (int b = 0; b < bits; b++) {
            session.addUnit(-session.variable(new VariableKey.LevelBit(g, layout.root(), b)));
        }

        for (int v : layout.potential()) {
            for (int u : graph.neighbors(v)) {
                if (!layout.isPotential()[u]) continue;
                int parent = session.variable(new VariableKey.Parent(g, u, v));

                // strict[i]: bit i è il primo (dall'alto) in cui u ha 0 e v ha 1
                List<Integer> clause = new ArrayList<>(bits + 1);
                clause.add(-parent);
                for (int i = 0; i < bits; i++) {
                    int strict = session.freshVariable("lt");
                    int bitU = session.variable(new VariableKey.LevelBit(g, u, i));
                    int bitV = session.variable(new VariableKey.LevelBit(g, v, i));
                    session.addClause(-strict, -bitU);
                    session.addClause(-strict, bitV);
                    for (int j = i + 1; j < bits; j++) {
                        int highU = session.variable(new VariableKey.LevelBit(g, u, j));
                        int highV = session.variable(new VariableKey.LevelBit(g, v, j));
                        session.addClause(-strict, -highU, highV);
                        session.addClause(-strict, highU, -highV);
                    }
                    clause.add(strict);
                }
                session.addClause(clause);
            }
        }
    }

    /**
     * Ogni arco aperto è un arco genitore-figlio di qualche gruppo.
     */
    private void encodeKeptEdgeConsistency(EncodingSession session) {
        for (Edge edge : graph.edges()) {
            if (edge.isLoop()) continue;
            List<Integer> clause = new ArrayList<>();
            clause.add(-session.variable(new VariableKey.EdgeKept(edge.index())));
            for (GroupLayout layout : groups) {
                Integer forward = session.lookup(new VariableKey.Parent(layout.group(), edge.u(), edge.v()));
                Integer backward = session.lookup(new VariableKey.Parent(layout.group(), edge.v(), edge.u()));
                if (forward != null) clause.add(forward);
                if (backward != null) clause.add(backward);
            }
            session.addClause(clause);
        }
    }

    private void encodeDepthRequirement(EncodingSession session, ResolvedDepth requirement) {
        GroupLayout layout = groupByIndex.get(requirement.group());
        int n = layout.size();
        int node = requirement.node();
        int d = requirement.depth();
        String nodeId = graph.nodeId(node);

        if (d == 0) {
            if (requirement.comparison() == DepthRequirement.Comparison.EXACTLY && node != layout.root()) {
                session.declareImpossible("Solo la radice può avere profondità 0, non " + nodeId);
            }
            return;
        }
        if (d >= n) {
            session.declareImpossible("Profondità " + d + " irraggiungibile per " + nodeId
                    + ": il gruppo " + groupName(layout.group()) + " ha al più " + n + " nodi");
            return;
        }
        session.addUnit(dist(session, layout.group(), node, d));
        if (requirement.comparison() == DepthRequirement.Comparison.EXACTLY) {
            session.addUnit(-dist(session, layout.group(), node, d + 1));
        }
    }

    /**
     * Impossibilità evidenti di un vincolo di cammino.
     *
     * @return true se il vincolo è stato dichiarato impossibile
     */
    private boolean checkPathImpossibility(EncodingSession session, ResolvedPath constraint) {
        int root = constraint.root();
        for (Map.Entry<Integer, Integer> entry : constraint.minDistances().entrySet()) {
            int target = entry.getKey();
            int minDist = entry.getValue();
            if (target == root && minDist >= 1) {
                session.declareImpossible("Vincolo " + constraint.id() + ": la radice dista 0 da se stessa");
                return true;
            }
            if (placement[root] >= 0 && placement[root] == placement[target]) {
                int size = groupByIndex.get(placement[root]).size();
                if (minDist >= size) {
                    session.declareImpossible("Vincolo " + constraint.id() + ": " + graph.nodeId(target)
                            + " è nello stesso gruppo della radice, distanza massima " + (size - 1)
                            + " < " + minDist);
                    return true;
                }
            }
        }
        return false;
    }

    private static int dist(EncodingSession session, int group, int node, int d) {
        return session.variable(new VariableKey.DistAtLeast(group, node, d));
    }

    //endregion

    //region DECODIFICA

    @Override
    public ForestSolution decode(EncodingSession session, SatBackend backend) {
        SolutionExtractor extractor = new SolutionExtractor(session, backend);
        List<String> groupNames = problem.groupNames();

        Map<String, String> groupOf = new LinkedHashMap<>();
        int[] groupIndex = new int[placement.length];
        for (int v = 0; v < placement.length; v++) {
            groupIndex[v] = placement[v];
            if (placement[v] == FREE) {
                for (GroupLayout layout : groups) {
                    if (extractor.isTrue(new VariableKey.Member(v, layout.group()))) {
                        groupIndex[v] = layout.group();
                        break;
                    }
                }
            }
            if (groupIndex[v] >= 0) {
                groupOf.put(graph.nodeId(v), groupNames.get(groupIndex[v]));
            }
        }

        int[] parentOf = new int[placement.length];
        Arrays.fill(parentOf, -1);
        Map<String, String> parentIds = new LinkedHashMap<>();
        for (GroupLayout layout : groups) {
            for (int v : layout.potential()) {
                for (int u : graph.neighbors(v)) {
                    if (extractor.isTrue(new VariableKey.Parent(layout.group(), u, v))) {
                        parentOf[v] = u;
                        parentIds.put(graph.nodeId(v), graph.nodeId(u));
                    }
                }
            }
        }

        boolean[] open = problem.keptEdges()
                ? extractor.keptEdgesFromVariables(graph)
                : SolutionExtractor.keptEdgesFromParents(graph, parentOf);

        Map<String, String> rootOf = new LinkedHashMap<>();
        Map<String, Integer> distanceFromRoot = new LinkedHashMap<>();
        for (GroupLayout layout : groups) {
            rootOf.put(groupNames.get(layout.group()), graph.nodeId(layout.root()));
            int[] distances = SolutionExtractor.bfsOverOpenEdges(graph, open, layout.root());
            for (int v = 0; v < distances.length; v++) {
                if (distances[v] >= 0 && groupIndex[v] == layout.group()) {
                    distanceFromRoot.put(graph.nodeId(v), distances[v]);
                }
            }
        }

        Map<String, Map<String, Integer>> pathDistances = new LinkedHashMap<>();
        for (ResolvedPath constraint : pathConstraints) {
            int[] distances = SolutionExtractor.bfsOverOpenEdges(graph, open, constraint.root());
            Map<String, Integer> byNode = new LinkedHashMap<>();
            for (int v = 0; v < distances.length; v++) {
                if (distances[v] >= 0) {
                    byNode.put(graph.nodeId(v), distances[v]);
                }
            }
            pathDistances.put(constraint.id(), byNode);
        }

        return new ForestSolution(groupOf, rootOf, parentIds,
                SolutionExtractor.edgeIds(graph, open, true),
                SolutionExtractor.edgeIds(graph, open, false),
                distanceFromRoot, pathDistances);
    }

    //endregion

    private String groupName(int group) {
        return problem.groupNames().get(group);
    }

    @Override
    public String describe() {
        return String.format("foresta su %d nodi e %d archi, %d gruppi, %d vincoli di cammino",
                graph.nodeCount(), graph.edgeCount(), problem.groupNames().size(),
                problem.pathLengthConstraints().size());
    }
}
