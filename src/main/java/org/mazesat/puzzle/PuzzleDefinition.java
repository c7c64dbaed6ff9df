package org.mazesat.puzzle;

import org.mazesat.encoding.ArborescenceEncoder;
import org.mazesat.encoding.ForestEncoder;
import org.mazesat.encoding.ForestProblem;
import org.mazesat.encoding.LoopEncoder;
import org.mazesat.encoding.ProblemEncoder;
import org.mazesat.graph.Graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Contenuto di un file di descrizione: il grafo e le richieste dichiarate su di esso.
 *
 * Un file può dichiarare una foresta, un ciclo e un'arborescenza; ciascuna
 * richiesta diventa un codificatore indipendente.
 */
public final class PuzzleDefinition {

    private final String name;
    private final Graph graph;
    private final ForestProblem forest;
    private final LoopEncoder loop;
    private final ArborescenceEncoder arborescence;

    PuzzleDefinition(String name, Graph graph, ForestProblem forest, LoopEncoder loop,
                     ArborescenceEncoder arborescence) {
        this.name = name;
        this.graph = graph;
        this.forest = forest;
        this.loop = loop;
        this.arborescence = arborescence;
    }

    public String name() {
        return name;
    }

    public Graph graph() {
        return graph;
    }

    public Optional<ForestProblem> forest() {
        return Optional.ofNullable(forest);
    }

    public Optional<LoopEncoder> loop() {
        return Optional.ofNullable(loop);
    }

    public Optional<ArborescenceEncoder> arborescence() {
        return Optional.ofNullable(arborescence);
    }

    /**
     * @return codificatori nell'ordine foresta, ciclo, arborescenza
     */
    public List<ProblemEncoder<?>> encoders() {
        List<ProblemEncoder<?>> encoders = new ArrayList<>();
        if (forest != null) encoders.add(new ForestEncoder(forest));
        if (loop != null) encoders.add(loop);
        if (arborescence != null) encoders.add(arborescence);
        return encoders;
    }

    @Override
    public String toString() {
        return String.format("%s: %d nodi, %d archi, %d richieste",
                name, graph.nodeCount(), graph.edgeCount(), encoders().size());
    }
}
