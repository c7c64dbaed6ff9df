package org.mazesat.encoding;

import org.mazesat.backend.SatBackend;
import org.mazesat.extract.LoopSolution;
import org.mazesat.extract.SolutionExtractor;
import org.mazesat.graph.Graph;
import org.mazesat.support.EncodingSession;
import org.mazesat.support.VariableKey;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * CODIFICATORE DI CICLI - Cammino chiuso semplice di lunghezza fissata attraverso la radice
 *
 * Visit(t, v) = "al passo t il cammino si trova in v", per t = 0..L-1.
 *
 * CODIFICA:
 * - Radice al passo 0 e al passo L-1, nessun altro nodo in quei passi
 * - Passi intermedi: esattamente un nodo, mai la radice
 * - Adiacenza: Visit(t, v) ⇒ ⋁ Visit(t-1, n) sui vicini n di v
 * - Ogni nodo diverso dalla radice compare al più una volta nei passi intermedi
 *
 * Un ciclo con k nodi distinti ha L = k + 1 passi.
 */
public class LoopEncoder implements ProblemEncoder<LoopSolution> {

    private static final Logger LOGGER = Logger.getLogger(LoopEncoder.class.getName());

    /** Lunghezza minima: radice, almeno un nodo intermedio, radice. */
    public static final int MIN_LENGTH = 3;

    private final Graph graph;
    private final String rootId;
    private final int length;
    private int root = -1;

    /**
     * @param length numero di passi L, radice ripetuta all'inizio e alla fine inclusa
     */
    public LoopEncoder(Graph graph, String rootId, int length) {
        this.graph = graph;
        this.rootId = rootId;
        this.length = length;
    }

    /**
     * Ciclo che visita {@code distinctNodes} nodi distinti, radice inclusa.
     */
    public static LoopEncoder forDistinctNodes(Graph graph, String rootId, int distinctNodes) {
        return new LoopEncoder(graph, rootId, distinctNodes + 1);
    }

    @Override
    public void validate() throws InvalidRequestException {
        if (length < MIN_LENGTH) {
            throw new InvalidRequestException("Lunghezza del ciclo " + length + " minore di " + MIN_LENGTH);
        }
        if (rootId == null || !graph.contains(rootId)) {
            throw new InvalidRequestException("Radice del ciclo sconosciuta: " + rootId);
        }
        root = graph.indexOf(rootId);
    }

    @Override
    public void encode(EncodingSession session) {
        if (root < 0) {
            throw new IllegalStateException("encode() richiede una validazione riuscita");
        }
        LOGGER.info("=== CODIFICA CICLO: " + describe() + " ===");

        int n = graph.nodeCount();
        int last = length - 1;
        if (length - 1 > n) {
            session.declareImpossible("Un ciclo semplice di " + (length - 1)
                    + " nodi distinti non entra in un grafo di " + n + " nodi");
        }

        session.addUnit(visit(session, 0, root));
        session.addUnit(visit(session, last, root));
        for (int v = 0; v < n; v++) {
            if (v == root) continue;
            session.addUnit(-visit(session, 0, v));
            session.addUnit(-visit(session, last, v));
        }

        for (int t = 1; t < last; t++) {
            List<Integer> step = new ArrayList<>(n);
            for (int v = 0; v < n; v++) {
                if (v == root) {
                    session.addUnit(-visit(session, t, v));
                } else {
                    step.add(visit(session, t, v));
                }
            }
            session.exactlyOne(step);
        }

        for (int t = 1; t <= last; t++) {
            for (int v = 0; v < n; v++) {
                List<Integer> clause = new ArrayList<>();
                clause.add(-visit(session, t, v));
                for (int neighbor : graph.neighbors(v)) {
                    clause.add(visit(session, t - 1, neighbor));
                }
                session.addClause(clause);
            }
        }

        for (int v = 0; v < n; v++) {
            if (v == root) continue;
            List<Integer> occurrences = new ArrayList<>(length - 2);
            for (int t = 1; t < last; t++) {
                occurrences.add(visit(session, t, v));
            }
            session.atMostOne(occurrences);
        }

        LOGGER.info("Codifica ciclo completata: " + session.stats());
    }

    @Override
    public LoopSolution decode(EncodingSession session, SatBackend backend) {
        SolutionExtractor extractor = new SolutionExtractor(session, backend);
        int[] steps = new int[length];
        for (int t = 0; t < length; t++) {
            steps[t] = -1;
            for (int v = 0; v < graph.nodeCount() && steps[t] < 0; v++) {
                if (extractor.isTrue(new VariableKey.Visit(t, v))) {
                    steps[t] = v;
                }
            }
            if (steps[t] < 0) {
                throw new IllegalStateException("Nessun nodo visitato al passo " + t);
            }
        }
        return SolutionExtractor.loopFromSteps(graph, steps);
    }

    private static int visit(EncodingSession session, int step, int node) {
        return session.variable(new VariableKey.Visit(step, node));
    }

    public int length() {
        return length;
    }

    @Override
    public String describe() {
        return String.format("ciclo di %d passi da %s su %d nodi", length, rootId, graph.nodeCount());
    }
}
