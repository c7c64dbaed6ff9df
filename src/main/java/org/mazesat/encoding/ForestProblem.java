package org.mazesat.encoding;

import org.mazesat.graph.DistanceLowerBound;
import org.mazesat.graph.Graph;

import java.util.*;

/**
 * PROBLEMA DI FORESTA - Richiesta di partizione in alberi radicati
 *
 * Ogni nodo del grafo ha una collocazione: fissato a un gruppo, libero (il
 * solutore sceglie tra i gruppi attivi) oppure escluso (non appartiene a
 * nessun albero). Ogni gruppo attivo deve formare un albero ricoprente dei
 * propri nodi, radicato nella radice esplicita o nel primo nodo fissato.
 *
 * La richiesta conserva gli identificatori così come forniti dal chiamante:
 * la verifica avviene in {@link ForestEncoder#validate()}.
 */
public final class ForestProblem {

    /** Collocazione di un nodo. */
    public enum PlacementKind {
        FIXED,
        FREE,
        EXCLUDED
    }

    private final Graph graph;
    private final List<String> groupNames;
    private final Map<String, String> fixedGroup;
    private final Set<String> excluded;
    private final Map<String, String> explicitRoots;
    private final CycleEncoding cycleEncoding;
    private final boolean keptEdges;
    private final DepthMode depthMode;
    private final DistanceLowerBound lowerBound;
    private final List<DepthRequirement> depthRequirements;
    private final List<PathLengthConstraint> pathLengthConstraints;

    private ForestProblem(Builder builder) {
        this.graph = builder.graph;
        this.groupNames = List.copyOf(builder.groupNames);
        this.fixedGroup = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fixedGroup));
        this.excluded = Collections.unmodifiableSet(new LinkedHashSet<>(builder.excluded));
        this.explicitRoots = Collections.unmodifiableMap(new LinkedHashMap<>(builder.explicitRoots));
        this.cycleEncoding = builder.cycleEncoding;
        this.keptEdges = builder.keptEdges;
        this.depthMode = builder.depthMode;
        this.lowerBound = builder.lowerBound != null ? builder.lowerBound : DistanceLowerBound.hopCount(graph);
        this.depthRequirements = List.copyOf(builder.depthRequirements);
        this.pathLengthConstraints = List.copyOf(builder.pathLengthConstraints);
    }

    public static Builder builder(Graph graph) {
        return new Builder(graph);
    }

    //region ACCESSORS

    public Graph graph() {
        return graph;
    }

    /** Gruppi dichiarati, nell'ordine di dichiarazione (l'indice è l'identificatore interno). */
    public List<String> groupNames() {
        return groupNames;
    }

    /** Nodo → gruppo per i nodi fissati. */
    public Map<String, String> fixedGroup() {
        return fixedGroup;
    }

    public Set<String> excluded() {
        return excluded;
    }

    public Map<String, String> explicitRoots() {
        return explicitRoots;
    }

    /**
     * Collocazione di un nodo: i nodi non menzionati sono liberi.
     */
    public PlacementKind placementOf(String nodeId) {
        if (fixedGroup.containsKey(nodeId)) return PlacementKind.FIXED;
        if (excluded.contains(nodeId)) return PlacementKind.EXCLUDED;
        return PlacementKind.FREE;
    }

    public CycleEncoding cycleEncoding() {
        return cycleEncoding;
    }

    /**
     * @return true se si usano variabili di arco aperto (sempre vero in presenza di vincoli di cammino)
     */
    public boolean keptEdges() {
        return keptEdges || !pathLengthConstraints.isEmpty();
    }

    public DepthMode depthMode() {
        return depthMode;
    }

    public DistanceLowerBound lowerBound() {
        return lowerBound;
    }

    public List<DepthRequirement> depthRequirements() {
        return depthRequirements;
    }

    public List<PathLengthConstraint> pathLengthConstraints() {
        return pathLengthConstraints;
    }

    //endregion

    /**
     * Costruttore della richiesta. Non verifica gli identificatori: gli errori
     * del chiamante emergono in validazione come {@link InvalidRequestException}.
     */
    public static final class Builder {

        private final Graph graph;
        private final List<String> groupNames = new ArrayList<>();
        private final Map<String, String> fixedGroup = new LinkedHashMap<>();
        private final Set<String> excluded = new LinkedHashSet<>();
        private final Map<String, String> explicitRoots = new LinkedHashMap<>();
        private CycleEncoding cycleEncoding = CycleEncoding.UNARY;
        private boolean keptEdges = true;
        private DepthMode depthMode = DepthMode.KEPT_EDGE_CONSISTENT;
        private DistanceLowerBound lowerBound;
        private final List<DepthRequirement> depthRequirements = new ArrayList<>();
        private final List<PathLengthConstraint> pathLengthConstraints = new ArrayList<>();

        private Builder(Graph graph) {
            this.graph = Objects.requireNonNull(graph, "Grafo null");
        }

        /**
         * Dichiara un gruppo; dichiarazioni ripetute non hanno effetto.
         */
        public Builder group(String name) {
            if (!groupNames.contains(name)) {
                groupNames.add(name);
            }
            return this;
        }

        /**
         * Fissa il nodo al gruppo, dichiarando il gruppo se necessario.
         */
        public Builder fix(String nodeId, String group) {
            group(group);
            excluded.remove(nodeId);
            fixedGroup.put(nodeId, group);
            return this;
        }

        public Builder free(String nodeId) {
            fixedGroup.remove(nodeId);
            excluded.remove(nodeId);
            return this;
        }

        public Builder exclude(String nodeId) {
            fixedGroup.remove(nodeId);
            excluded.add(nodeId);
            return this;
        }

        public Builder root(String group, String nodeId) {
            group(group);
            explicitRoots.put(group, nodeId);
            return this;
        }

        public Builder cycleEncoding(CycleEncoding cycleEncoding) {
            this.cycleEncoding = Objects.requireNonNull(cycleEncoding);
            return this;
        }

        public Builder keptEdges(boolean keptEdges) {
            this.keptEdges = keptEdges;
            return this;
        }

        public Builder depthMode(DepthMode depthMode) {
            this.depthMode = Objects.requireNonNull(depthMode);
            return this;
        }

        public Builder lowerBound(DistanceLowerBound lowerBound) {
            this.lowerBound = lowerBound;
            return this;
        }

        public Builder requireDepth(DepthRequirement requirement) {
            depthRequirements.add(Objects.requireNonNull(requirement));
            return this;
        }

        public Builder pathLength(PathLengthConstraint constraint) {
            pathLengthConstraints.add(Objects.requireNonNull(constraint));
            return this;
        }

        public ForestProblem build() {
            return new ForestProblem(this);
        }
    }
}
