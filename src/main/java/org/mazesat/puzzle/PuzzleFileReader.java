package org.mazesat.puzzle;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.mazesat.antlr.PuzzleFileBaseVisitor;
import org.mazesat.antlr.PuzzleFileLexer;
import org.mazesat.antlr.PuzzleFileParser;
import org.mazesat.antlr.PuzzleFileParser.ArborescenceStatementContext;
import org.mazesat.antlr.PuzzleFileParser.CyclesStatementContext;
import org.mazesat.antlr.PuzzleFileParser.DepthModeStatementContext;
import org.mazesat.antlr.PuzzleFileParser.DepthStatementContext;
import org.mazesat.antlr.PuzzleFileParser.DistanceBoundContext;
import org.mazesat.antlr.PuzzleFileParser.EdgePairContext;
import org.mazesat.antlr.PuzzleFileParser.EdgeStatementContext;
import org.mazesat.antlr.PuzzleFileParser.ExcludeStatementContext;
import org.mazesat.antlr.PuzzleFileParser.FreeStatementContext;
import org.mazesat.antlr.PuzzleFileParser.GridStatementContext;
import org.mazesat.antlr.PuzzleFileParser.GroupStatementContext;
import org.mazesat.antlr.PuzzleFileParser.IdentContext;
import org.mazesat.antlr.PuzzleFileParser.LiftStatementContext;
import org.mazesat.antlr.PuzzleFileParser.LiftedEdgeStatementContext;
import org.mazesat.antlr.PuzzleFileParser.LoopStatementContext;
import org.mazesat.antlr.PuzzleFileParser.MinDistStatementContext;
import org.mazesat.antlr.PuzzleFileParser.NodeStatementContext;
import org.mazesat.antlr.PuzzleFileParser.QuotientEdgeStatementContext;
import org.mazesat.antlr.PuzzleFileParser.QuotientNodeStatementContext;
import org.mazesat.encoding.ArborescenceEncoder;
import org.mazesat.encoding.CycleEncoding;
import org.mazesat.encoding.DepthMode;
import org.mazesat.encoding.DepthRequirement;
import org.mazesat.encoding.ForestProblem;
import org.mazesat.encoding.LiftedGraph;
import org.mazesat.encoding.LoopEncoder;
import org.mazesat.encoding.PathLengthConstraint;
import org.mazesat.graph.Graph;
import org.mazesat.graph.GridGraphs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * LETTORE FILE DI DESCRIZIONE - Dall'albero sintattico ANTLR alle richieste di codifica
 *
 * Visita l'albero generato dalla grammatica PuzzleFile raccogliendo le
 * dichiarazioni, poi costruisce grafo e richieste in un passo finale: l'ordine
 * delle dichiarazioni nel file non conta, tranne che per i nodi che devono
 * precedere gli archi nello stesso file.
 *
 * DICHIARAZIONI SUPPORTATE:
 * - Grafo: {@code grid W by H [wrap] [diagonal];} oppure {@code node ...;} e {@code edge a b, c d;}
 * - Foresta: {@code group}, {@code free}, {@code exclude}, {@code mindist}, {@code depth},
 *   {@code cycles}, {@code depthmode}
 * - Ciclo: {@code loop from R length L;}
 * - Arborescenza: {@code qnode}, {@code qedge}, {@code lift}, {@code lifted},
 *   {@code arborescence root R target T depth D [spanning];}
 *
 * GESTIONE ERRORI:
 * - Errori lessicali e sintattici raccolti da un listener dedicato, con riga e colonna
 * - Errori di dichiarazione (nodi duplicati, archi verso nodi sconosciuti, richieste ripetute)
 *   raccolti con la riga della dichiarazione
 * - Tutti gli errori vengono riportati insieme in una {@link PuzzleSyntaxException}
 *
 * I riferimenti a nodi non dichiarati nelle richieste non sono errori di lettura:
 * emergono come richieste non valide in validazione.
 */
public class PuzzleFileReader extends PuzzleFileBaseVisitor<Void> {

    private static final Logger LOGGER = Logger.getLogger(PuzzleFileReader.class.getName());

    private final List<String> errors = new ArrayList<>();

    //region STATO RACCOLTO DURANTE LA VISITA

    private GridStatementContext grid;
    private final List<IdentContext> nodes = new ArrayList<>();
    private final List<EdgePairContext> edges = new ArrayList<>();

    private final List<Consumer<ForestProblem.Builder>> forestSteps = new ArrayList<>();
    private boolean forestDeclared;

    private LoopStatementContext loop;

    private final List<IdentContext> quotientNodes = new ArrayList<>();
    private final List<QuotientEdgeStatementContext> quotientEdges = new ArrayList<>();
    private final Map<IdentContext, IdentContext> lifts = new LinkedHashMap<>();
    private final List<LiftedEdgeStatementContext> liftedEdges = new ArrayList<>();
    private ArborescenceStatementContext arborescence;

    //endregion

    private PuzzleFileReader() {
    }

    //region PUNTI DI INGRESSO

    public static PuzzleDefinition read(Path file) throws IOException, PuzzleSyntaxException {
        String fileName = file.getFileName().toString();
        return parse(fileName, Files.readString(file));
    }

    /**
     * Lexing, parsing, visita e costruzione delle richieste.
     *
     * @param name nome riportato nella definizione (di solito il nome del file)
     * @param text contenuto del file
     * @throws PuzzleSyntaxException con tutti gli errori trovati
     */
    public static PuzzleDefinition parse(String name, String text) throws PuzzleSyntaxException {
        LOGGER.fine("Lettura file di descrizione: " + name);
        PuzzleFileReader reader = new PuzzleFileReader();
        CollectingErrorListener listener = new CollectingErrorListener(reader.errors);

        PuzzleFileLexer lexer = new PuzzleFileLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
        PuzzleFileParser parser = new PuzzleFileParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        PuzzleFileParser.PuzzleContext tree = parser.puzzle();
        if (!reader.errors.isEmpty()) {
            throw new PuzzleSyntaxException(reader.errors);
        }

        reader.visit(tree);
        PuzzleDefinition definition = reader.build(name);
        if (!reader.errors.isEmpty()) {
            throw new PuzzleSyntaxException(reader.errors);
        }
        LOGGER.info("File letto: " + definition);
        return definition;
    }

    //endregion

    //region GRAFO

    @Override
    public Void visitGridStatement(GridStatementContext ctx) {
        if (grid != null) {
            error(ctx, "griglia già dichiarata alla riga " + grid.getStart().getLine());
        } else {
            grid = ctx;
        }
        return null;
    }

    @Override
    public Void visitNodeStatement(NodeStatementContext ctx) {
        nodes.addAll(ctx.ident());
        return null;
    }

    @Override
    public Void visitEdgeStatement(EdgeStatementContext ctx) {
        edges.addAll(ctx.edgePair());
        return null;
    }

    //endregion

    //region FORESTA

    @Override
    public Void visitGroupStatement(GroupStatementContext ctx) {
        forestDeclared = true;
        String group = text(ctx.ident(0));
        List<String> members = new ArrayList<>();
        String root = null;
        // ident(0) è il nome; se c'è ROOT, ident(1) è la radice e il resto sono membri
        int firstMember = 1;
        if (ctx.ROOT() != null) {
            root = text(ctx.ident(1));
            firstMember = 2;
        }
        for (int i = firstMember; i < ctx.ident().size(); i++) {
            members.add(text(ctx.ident(i)));
        }
        String explicitRoot = root;
        forestSteps.add(builder -> {
            builder.group(group);
            if (explicitRoot != null) {
                builder.fix(explicitRoot, group).root(group, explicitRoot);
            }
            for (String member : members) {
                builder.fix(member, group);
            }
        });
        return null;
    }

    @Override
    public Void visitFreeStatement(FreeStatementContext ctx) {
        forestDeclared = true;
        List<String> ids = texts(ctx.ident());
        forestSteps.add(builder -> ids.forEach(builder::free));
        return null;
    }

    @Override
    public Void visitExcludeStatement(ExcludeStatementContext ctx) {
        forestDeclared = true;
        List<String> ids = texts(ctx.ident());
        forestSteps.add(builder -> ids.forEach(builder::exclude));
        return null;
    }

    @Override
    public Void visitMinDistStatement(MinDistStatementContext ctx) {
        forestDeclared = true;
        String id = text(ctx.ident(0));
        String root = text(ctx.ident(1));
        Map<String, Integer> bounds = new LinkedHashMap<>();
        for (DistanceBoundContext bound : ctx.distanceBound()) {
            Integer distance = integer(bound, bound.INT().getText());
            if (distance != null) {
                bounds.put(text(bound.ident()), distance);
            }
        }
        try {
            PathLengthConstraint constraint = new PathLengthConstraint(id, root, bounds);
            forestSteps.add(builder -> builder.pathLength(constraint));
        } catch (IllegalArgumentException e) {
            error(ctx, e.getMessage());
        }
        return null;
    }

    @Override
    public Void visitDepthStatement(DepthStatementContext ctx) {
        forestDeclared = true;
        String node = text(ctx.ident());
        Integer depth = integer(ctx, ctx.INT().getText());
        if (depth == null) return null;
        DepthRequirement requirement = ctx.comparison().EQ() != null
                ? DepthRequirement.exactly(node, depth)
                : DepthRequirement.atLeast(node, depth);
        forestSteps.add(builder -> builder.requireDepth(requirement));
        return null;
    }

    @Override
    public Void visitCyclesStatement(CyclesStatementContext ctx) {
        CycleEncoding encoding = ctx.cycleMode().BINARY() != null ? CycleEncoding.BINARY : CycleEncoding.UNARY;
        forestSteps.add(builder -> builder.cycleEncoding(encoding));
        return null;
    }

    @Override
    public Void visitDepthModeStatement(DepthModeStatementContext ctx) {
        DepthMode mode = ctx.depthModeName().LEVEL() != null ? DepthMode.LEVEL_ONLY : DepthMode.KEPT_EDGE_CONSISTENT;
        forestSteps.add(builder -> builder.depthMode(mode));
        return null;
    }

    //endregion

    //region CICLO E ARBORESCENZA

    @Override
    public Void visitLoopStatement(LoopStatementContext ctx) {
        if (loop != null) {
            error(ctx, "ciclo già dichiarato alla riga " + loop.getStart().getLine());
        } else {
            loop = ctx;
        }
        return null;
    }

    @Override
    public Void visitQuotientNodeStatement(QuotientNodeStatementContext ctx) {
        quotientNodes.addAll(ctx.ident());
        return null;
    }

    @Override
    public Void visitQuotientEdgeStatement(QuotientEdgeStatementContext ctx) {
        quotientEdges.add(ctx);
        return null;
    }

    @Override
    public Void visitLiftStatement(LiftStatementContext ctx) {
        for (int i = 0; i + 1 < ctx.ident().size(); i += 2) {
            lifts.put(ctx.ident(i), ctx.ident(i + 1));
        }
        return null;
    }

    @Override
    public Void visitLiftedEdgeStatement(LiftedEdgeStatementContext ctx) {
        liftedEdges.add(ctx);
        return null;
    }

    @Override
    public Void visitArborescenceStatement(ArborescenceStatementContext ctx) {
        if (arborescence != null) {
            error(ctx, "arborescenza già dichiarata alla riga " + arborescence.getStart().getLine());
        } else {
            arborescence = ctx;
        }
        return null;
    }

    //endregion

    //region COSTRUZIONE FINALE

    private PuzzleDefinition build(String name) {
        if (!forestDeclared && loop == null && arborescence == null) {
            errors.add("nessuna richiesta dichiarata (group, loop o arborescence)");
            return null;
        }

        Graph graph = buildGraph();
        if (graph == null) return null;

        ForestProblem forest = null;
        if (forestDeclared) {
            ForestProblem.Builder builder = ForestProblem.builder(graph);
            if (grid != null) {
                builder.lowerBound(GridGraphs.metric(graph, gridWidth(), gridHeight(), gridAdjacency(),
                        grid.WRAP() != null));
            }
            forestSteps.forEach(step -> step.accept(builder));
            forest = builder.build();
        } else if (!forestSteps.isEmpty()) {
            LOGGER.warning("Opzioni della foresta ignorate: nessun gruppo dichiarato");
        }

        LoopEncoder loopEncoder = null;
        if (loop != null) {
            Integer length = integer(loop, loop.INT().getText());
            if (length != null) {
                loopEncoder = new LoopEncoder(graph, text(loop.ident()), length);
            }
        }

        ArborescenceEncoder arborescenceEncoder = null;
        if (arborescence != null) {
            arborescenceEncoder = buildArborescence();
        } else if (!quotientNodes.isEmpty() || !lifts.isEmpty()) {
            LOGGER.warning("Grafo sollevato ignorato: nessuna arborescenza dichiarata");
        }

        return new PuzzleDefinition(name, graph, forest, loopEncoder, arborescenceEncoder);
    }

    private Graph buildGraph() {
        if (grid != null) {
            if (!nodes.isEmpty() || !edges.isEmpty()) {
                error(grid, "una griglia non si combina con dichiarazioni node o edge");
                return null;
            }
            if (gridWidth() < 1 || gridHeight() < 1) {
                error(grid, "dimensioni della griglia non valide");
                return null;
            }
            return GridGraphs.square(gridWidth(), gridHeight(), gridAdjacency(), grid.WRAP() != null);
        }

        Graph.Builder builder = Graph.builder();
        for (IdentContext node : nodes) {
            try {
                builder.addNode(text(node));
            } catch (IllegalArgumentException e) {
                error(node, e.getMessage());
            }
        }
        for (EdgePairContext edge : edges) {
            try {
                builder.addEdge(text(edge.ident(0)), text(edge.ident(1)));
            } catch (IllegalArgumentException e) {
                error(edge, e.getMessage());
            }
        }
        return builder.build();
    }

    private ArborescenceEncoder buildArborescence() {
        Graph.Builder quotientBuilder = Graph.builder();
        for (IdentContext node : quotientNodes) {
            try {
                quotientBuilder.addNode(text(node));
            } catch (IllegalArgumentException e) {
                error(node, e.getMessage());
            }
        }
        for (QuotientEdgeStatementContext edge : quotientEdges) {
            String tag = edge.STRING() != null ? unquote(edge.STRING().getText()) : "";
            try {
                quotientBuilder.addEdge(text(edge.ident(0)), text(edge.ident(1)), text(edge.ident(2)), tag);
            } catch (IllegalArgumentException e) {
                error(edge, e.getMessage());
            }
        }

        LiftedGraph.Builder liftedBuilder = LiftedGraph.builder(quotientBuilder.build());
        for (Map.Entry<IdentContext, IdentContext> lift : lifts.entrySet()) {
            try {
                liftedBuilder.addNode(text(lift.getKey()), text(lift.getValue()));
            } catch (IllegalArgumentException e) {
                error(lift.getKey(), e.getMessage());
            }
        }
        for (LiftedEdgeStatementContext edge : liftedEdges) {
            try {
                liftedBuilder.addEdge(text(edge.ident(0)), text(edge.ident(1)), text(edge.ident(2)));
            } catch (IllegalArgumentException e) {
                error(edge, e.getMessage());
            }
        }

        Integer depth = integer(arborescence, arborescence.INT().getText());
        if (depth == null) return null;
        return new ArborescenceEncoder(liftedBuilder.build(), text(arborescence.ident(0)),
                text(arborescence.ident(1)), depth, arborescence.SPANNING() != null);
    }

    //endregion

    //region SUPPORTO

    private int gridWidth() {
        Integer value = integer(grid, grid.INT(0).getText());
        return value == null ? 0 : value;
    }

    private int gridHeight() {
        Integer value = integer(grid, grid.INT(1).getText());
        return value == null ? 0 : value;
    }

    private GridGraphs.Adjacency gridAdjacency() {
        return grid.DIAGONAL() != null ? GridGraphs.Adjacency.EIGHT : GridGraphs.Adjacency.FOUR;
    }

    private Integer integer(ParserRuleContext ctx, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            error(ctx, "numero fuori intervallo: " + digits);
            return null;
        }
    }

    private void error(ParserRuleContext ctx, String message) {
        errors.add("riga " + ctx.getStart().getLine() + ": " + message);
    }

    private static List<String> texts(List<IdentContext> idents) {
        List<String> result = new ArrayList<>(idents.size());
        for (IdentContext ident : idents) {
            result.add(text(ident));
        }
        return result;
    }

    private static String text(IdentContext ident) {
        return ident.STRING() != null ? unquote(ident.STRING().getText()) : ident.getText();
    }

    private static String unquote(String quoted) {
        return quoted.substring(1, quoted.length() - 1);
    }

    /**
     * Raccoglie gli errori di lexer e parser invece di stamparli su console.
     */
    private static final class CollectingErrorListener extends BaseErrorListener {

        private final List<String> errors;

        CollectingErrorListener(List<String> errors) {
            this.errors = errors;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            errors.add("riga " + line + ":" + charPositionInLine + " " + msg);
        }
    }

    //endregion
}
