package org.mazesat.encoding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mazesat.backend.BackendKind;
import org.mazesat.backend.SatBackend;
import org.mazesat.extract.ForestSolution;
import org.mazesat.graph.Edge;
import org.mazesat.graph.Graph;
import org.mazesat.graph.GridGraphs;
import org.mazesat.service.FailureKind;
import org.mazesat.service.SolveOutcome;
import org.mazesat.service.SolvePipeline;
import org.mazesat.support.EncodingSession;
import org.mazesat.support.VariableKey;

public class ForestEncoderTest {

	private static SolveOutcome<ForestSolution> solve(ForestProblem problem) {
		return new SolvePipeline().run(new ForestEncoder(problem));
	}

	/**
	 * Foresta con tutti gli archi del grafo forzati aperti, anche quelli fuori dagli alberi.
	 */
	private static final class AllEdgesKept implements ProblemEncoder<ForestSolution> {

		private final ForestEncoder forest;
		private final Graph graph;

		AllEdgesKept(ForestProblem problem) {
			this.forest = new ForestEncoder(problem);
			this.graph = problem.graph();
		}

		@Override
		public void validate() throws InvalidRequestException {
			forest.validate();
		}

		@Override
		public void encode(EncodingSession session) {
			forest.encode(session);
			for (Edge edge : graph.edges()) {
				session.addUnit(session.variable(new VariableKey.EdgeKept(edge.index())));
			}
		}

		@Override
		public ForestSolution decode(EncodingSession session, SatBackend backend) {
			return forest.decode(session, backend);
		}

		@Override
		public String describe() {
			return forest.describe() + ", tutti gli archi aperti";
		}
	}

	/** Griglia 3x2 con "0,1" a profondità esatta 3: il cammino nell'albero gira attorno alla griglia. */
	private static ForestProblem detourDepth(Graph graph, DepthMode mode) {
		return ForestProblem.builder(graph)
				.fix("0,0", "A").fix("0,1", "A")
				.depthMode(mode)
				.requireDepth(DepthRequirement.exactly("0,1", 3))
				.build();
	}

	private static Set<String> parentEdgeIds(Graph graph, ForestSolution solution) {
		Set<String> ids = new HashSet<>();
		for (Map.Entry<String, String> entry : solution.parentOf().entrySet()) {
			ids.add(graph.findEdge(graph.indexOf(entry.getKey()), graph.indexOf(entry.getValue())).id());
		}
		return ids;
	}

	private static Graph grid(int width, int height) {
		return GridGraphs.square(width, height, GridGraphs.Adjacency.FOUR, false);
	}

	/**
	 * Ogni catena di genitori termina nella radice del proprio gruppo e la
	 * distanza BFS di un figlio è quella del genitore più uno.
	 */
	private static void assertValidForest(ForestSolution solution, int nodeCount) {
		for (Map.Entry<String, String> entry : solution.parentOf().entrySet()) {
			String child = entry.getKey();
			String group = solution.groupOf().get(child);
			assertEquals(group, solution.groupOf().get(entry.getValue()), "Genitore in un altro gruppo: " + child);
			assertEquals(solution.distanceFromRoot().get(entry.getValue()) + 1,
					(int) solution.distanceFromRoot().get(child), "Distanza incoerente per " + child);

			String current = child;
			int steps = 0;
			while (solution.parentOf().containsKey(current)) {
				current = solution.parentOf().get(current);
				assertTrue(++steps <= nodeCount, "Ciclo tra i genitori da " + child);
			}
			assertEquals(solution.rootOf().get(group), current);
		}
		for (String root : solution.rootOf().values()) {
			assertFalse(solution.parentOf().containsKey(root));
			assertEquals(0, solution.distanceFromRoot().get(root));
		}
	}

	@ParameterizedTest
	@EnumSource(BackendKind.class)
	public void testSingleGroupSpansGrid(BackendKind backend) {
		ForestProblem problem = ForestProblem.builder(grid(2, 2))
				.root("A", "0,0").fix("0,0", "A").fix("1,1", "A")
				.build();
		SolveOutcome<ForestSolution> outcome = new SolvePipeline(backend, false, -1).run(new ForestEncoder(problem));

		assertTrue(outcome.isSuccess(), outcome.toString());
		ForestSolution solution = outcome.result();
		assertEquals(4, solution.groupOf().size());
		assertEquals(3, solution.parentOf().size());
		assertEquals(3, solution.keptEdges().size());
		assertEquals(1, solution.blockedEdges().size());
		assertEquals("0,0", solution.rootOf().get("A"));
		assertEquals(2, solution.distanceFromRoot().get("1,1"));
		assertValidForest(solution, 4);
	}

	@Test
	public void testTwoGroupsAreSeparatedByWall() {
		Graph path = Graph.builder().addNodes("a", "b", "c").addEdge("a", "b").addEdge("b", "c").build();
		ForestProblem problem = ForestProblem.builder(path).fix("a", "A").fix("c", "B").build();
		SolveOutcome<ForestSolution> outcome = solve(problem);

		assertTrue(outcome.isSuccess(), outcome.toString());
		ForestSolution solution = outcome.result();
		assertEquals(1, solution.keptEdges().size());
		assertEquals(1, solution.blockedEdges().size());
		assertNotNull(solution.groupOf().get("b"));
		assertEquals(Map.of("A", "a", "B", "c"), solution.rootOf());
		assertValidForest(solution, 3);
	}

	@Test
	public void testExcludedNodeHasNoGroup() {
		ForestProblem problem = ForestProblem.builder(grid(3, 3))
				.fix("0,0", "A").exclude("1,1")
				.build();
		SolveOutcome<ForestSolution> outcome = solve(problem);

		assertTrue(outcome.isSuccess(), outcome.toString());
		assertFalse(outcome.result().groupOf().containsKey("1,1"));
		assertEquals(8, outcome.result().groupOf().size());
		// i quattro archi verso il nodo escluso sono muri
		assertTrue(outcome.result().blockedEdges().size() >= 4);
		assertValidForest(outcome.result(), 9);
	}

	@Test
	public void testBinaryLevelsProduceAcyclicForest() {
		ForestProblem problem = ForestProblem.builder(grid(3, 3))
				.fix("0,0", "A").fix("2,2", "B").fix("0,2", "A")
				.cycleEncoding(CycleEncoding.BINARY)
				.build();
		SolveOutcome<ForestSolution> outcome = solve(problem);

		assertTrue(outcome.isSuccess(), outcome.toString());
		assertEquals("A", outcome.result().groupOf().get("0,2"));
		assertEquals("B", outcome.result().groupOf().get("2,2"));
		assertValidForest(outcome.result(), 9);
	}

	@Test
	public void testParentsWithoutKeptEdgeVariables() {
		ForestProblem problem = ForestProblem.builder(grid(2, 2)).fix("0,0", "A").keptEdges(false).build();
		SolveOutcome<ForestSolution> outcome = solve(problem);

		assertTrue(outcome.isSuccess(), outcome.toString());
		assertEquals(3, outcome.result().keptEdges().size());
		assertEquals(1, outcome.result().blockedEdges().size());
	}

	//region ERRORI DEL CHIAMANTE E IMPOSSIBILITÀ

	@Test
	public void testIsolatedFixedNodeIsProvablyImpossible() {
		Graph graph = Graph.builder().addNodes("a", "b", "c").addEdge("a", "b").build();
		ForestProblem problem = ForestProblem.builder(graph).fix("a", "A").fix("c", "A").build();
		SolveOutcome<ForestSolution> outcome = solve(problem);

		assertEquals(FailureKind.PROVABLY_IMPOSSIBLE, outcome.failureKind());
		assertTrue(outcome.message().contains("c"));
	}

	@Test
	public void testRootMustBeFixedInItsGroup() {
		ForestProblem problem = ForestProblem.builder(grid(2, 2))
				.fix("0,0", "A").fix("1,1", "B").root("A", "1,1")
				.build();
		assertEquals(FailureKind.INVALID_REQUEST, solve(problem).failureKind());
	}

	@Test
	public void testUnknownNodeIsInvalid() {
		ForestProblem problem = ForestProblem.builder(grid(2, 2)).fix("7,7", "A").build();
		assertEquals(FailureKind.INVALID_REQUEST, solve(problem).failureKind());
	}

	@Test
	public void testRequestWithoutFixedGroupIsInvalid() {
		ForestProblem problem = ForestProblem.builder(grid(2, 2)).group("A").build();
		assertEquals(FailureKind.INVALID_REQUEST, solve(problem).failureKind());

		ForestProblem blank = ForestProblem.builder(Graph.builder().build()).build();
		assertEquals(FailureKind.INVALID_REQUEST, solve(blank).failureKind());
	}

	//endregion

	//region VINCOLI DI PROFONDITÀ

	@Test
	public void testExactDepthIsHonoured() {
		ForestProblem problem = ForestProblem.builder(grid(2, 2))
				.fix("0,0", "A").fix("1,1", "A")
				.requireDepth(DepthRequirement.exactly("1,1", 2))
				.build();
		SolveOutcome<ForestSolution> outcome = solve(problem);

		assertTrue(outcome.isSuccess(), outcome.toString());
		assertEquals(2, outcome.result().distanceFromRoot().get("1,1"));
	}

	@Test
	public void testDepthTooLargeForGroupIsProvablyImpossible() {
		ForestProblem problem = ForestProblem.builder(grid(2, 2))
				.fix("0,0", "A").fix("1,1", "A")
				.requireDepth(DepthRequirement.atLeast("1,1", 4))
				.build();
		assertEquals(FailureKind.PROVABLY_IMPOSSIBLE, solve(problem).failureKind());
	}

	@Test
	public void testUnreachableExactDepthIsUnsatisfiable() {
		ForestProblem problem = ForestProblem.builder(grid(2, 2))
				.fix("0,0", "A").fix("1,1", "A")
				.requireDepth(DepthRequirement.exactly("1,1", 1))
				.build();
		assertEquals(FailureKind.UNSATISFIABLE, solve(problem).failureKind());
	}

	@Test
	public void testDepthOnFreeNodeIsInvalid() {
		ForestProblem problem = ForestProblem.builder(grid(2, 2))
				.fix("0,0", "A")
				.requireDepth(DepthRequirement.atLeast("1,1", 1))
				.build();
		assertEquals(FailureKind.INVALID_REQUEST, solve(problem).failureKind());
	}

	@Test
	public void testLongPathWithDepthRequirement() {
		ForestProblem problem = ForestProblem.builder(grid(3, 3))
				.fix("0,0", "A").fix("0,1", "A")
				.requireDepth(DepthRequirement.atLeast("0,1", 7))
				.build();
		SolveOutcome<ForestSolution> outcome = solve(problem);

		assertTrue(outcome.isSuccess(), outcome.toString());
		assertTrue(outcome.result().distanceFromRoot().get("0,1") >= 7);
		assertValidForest(outcome.result(), 9);
	}

	@Test
	public void testKeptEdgesMatchTreeUnderConsistentDepth() {
		Graph graph = grid(3, 2);
		SolveOutcome<ForestSolution> outcome = solve(detourDepth(graph, DepthMode.KEPT_EDGE_CONSISTENT));

		assertTrue(outcome.isSuccess(), outcome.toString());
		ForestSolution solution = outcome.result();
		assertEquals(parentEdgeIds(graph, solution), new HashSet<>(solution.keptEdges()));
		assertEquals(3, solution.distanceFromRoot().get("0,1"));
		assertValidForest(solution, 6);
	}

	@Test
	public void testConsistentDepthRejectsKeptEdgesOutsideTree() {
		Graph graph = grid(3, 2);
		SolveOutcome<ForestSolution> outcome = new SolvePipeline()
				.run(new AllEdgesKept(detourDepth(graph, DepthMode.KEPT_EDGE_CONSISTENT)));
		assertEquals(FailureKind.UNSATISFIABLE, outcome.failureKind());
	}

	@Test
	public void testLevelOnlyDepthAllowsShortcutThroughKeptEdge() {
		Graph graph = grid(3, 2);
		SolveOutcome<ForestSolution> outcome = new SolvePipeline()
				.run(new AllEdgesKept(detourDepth(graph, DepthMode.LEVEL_ONLY)));

		assertTrue(outcome.isSuccess(), outcome.toString());
		ForestSolution solution = outcome.result();
		assertEquals(graph.edgeCount(), solution.keptEdges().size());
		assertEquals(5, parentEdgeIds(graph, solution).size());
		// livello 3 nell'albero, ma l'arco diretto "0,0"-"0,1" è aperto
		assertEquals(1, solution.distanceFromRoot().get("0,1"));

		String current = "0,1";
		int depth = 0;
		while (solution.parentOf().containsKey(current)) {
			current = solution.parentOf().get(current);
			depth++;
		}
		assertEquals("0,0", current);
		assertEquals(3, depth);
	}

	//endregion

	//region VINCOLI DI LUNGHEZZA DEI CAMMINI

	@Test
	public void testTrivialMinimumDistance() {
		ForestProblem problem = ForestProblem.builder(grid(2, 2))
				.fix("0,0", "A")
				.pathLength(new PathLengthConstraint("m", "0,0", Map.of("1,1", 1)))
				.build();
		SolveOutcome<ForestSolution> outcome = solve(problem);

		assertTrue(outcome.isSuccess(), outcome.toString());
		assertTrue(outcome.result().pathLengthDistances().get("m").get("1,1") >= 1);
	}

	@Test
	public void testMinimumDistanceForcesDetour() {
		Graph graph = grid(3, 3);
		ForestProblem problem = ForestProblem.builder(graph)
				.fix("0,0", "A")
				.lowerBound(GridGraphs.metric(graph, 3, 3, GridGraphs.Adjacency.FOUR, false))
				.pathLength(new PathLengthConstraint("m", "0,0", Map.of("0,1", 3, "2,2", 6)))
				.build();
		SolveOutcome<ForestSolution> outcome = solve(problem);

		assertTrue(outcome.isSuccess(), outcome.toString());
		Map<String, Integer> distances = outcome.result().pathLengthDistances().get("m");
		assertTrue(distances.get("0,1") >= 3);
		assertTrue(distances.get("2,2") >= 6);
		assertValidForest(outcome.result(), 9);
	}

	@Test
	public void testMinimumDistanceBeyondTreeIsUnsatisfiable() {
		ForestProblem problem = ForestProblem.builder(grid(2, 2))
				.fix("0,0", "A")
				.pathLength(new PathLengthConstraint("m", "0,0", Map.of("1,1", 4)))
				.build();
		assertEquals(FailureKind.UNSATISFIABLE, solve(problem).failureKind());
	}

	@Test
	public void testMinimumDistanceBeyondGroupSizeIsProvablyImpossible() {
		ForestProblem problem = ForestProblem.builder(grid(2, 2))
				.fix("0,0", "A").fix("1,1", "A")
				.pathLength(new PathLengthConstraint("m", "0,0", Map.of("1,1", 5)))
				.build();
		assertEquals(FailureKind.PROVABLY_IMPOSSIBLE, solve(problem).failureKind());
	}

	@Test
	public void testDistanceFromRootToItselfIsProvablyImpossible() {
		ForestProblem problem = ForestProblem.builder(grid(2, 2))
				.fix("0,0", "A")
				.pathLength(new PathLengthConstraint("m", "0,0", Map.of("0,0", 1)))
				.build();
		assertEquals(FailureKind.PROVABLY_IMPOSSIBLE, solve(problem).failureKind());
	}

	@Test
	public void testMinimumDistanceOnDiagonalGrid() {
		Graph graph = GridGraphs.square(3, 3, GridGraphs.Adjacency.EIGHT, false);
		ForestProblem problem = ForestProblem.builder(graph)
				.fix("0,0", "A")
				.lowerBound(GridGraphs.metric(graph, 3, 3, GridGraphs.Adjacency.EIGHT, false))
				.pathLength(new PathLengthConstraint("m", "0,0", Map.of("2,2", 4)))
				.build();
		SolveOutcome<ForestSolution> outcome = solve(problem);

		assertTrue(outcome.isSuccess(), outcome.toString());
		assertTrue(outcome.result().pathLengthDistances().get("m").get("2,2") >= 4);
		assertValidForest(outcome.result(), 9);
	}

	@Test
	public void testDiagonalRootWithoutCloseNeighboursIsUnsatisfiable() {
		Graph graph = GridGraphs.square(3, 3, GridGraphs.Adjacency.EIGHT, false);
		ForestProblem problem = ForestProblem.builder(graph)
				.fix("0,0", "A")
				.lowerBound(GridGraphs.metric(graph, 3, 3, GridGraphs.Adjacency.EIGHT, false))
				.pathLength(new PathLengthConstraint("m", "0,0", Map.of("0,1", 2, "1,0", 2, "1,1", 2)))
				.build();
		assertEquals(FailureKind.UNSATISFIABLE, solve(problem).failureKind());
	}

	@Test
	public void testDuplicateConstraintIdIsInvalid() {
		ForestProblem problem = ForestProblem.builder(grid(2, 2))
				.fix("0,0", "A")
				.pathLength(new PathLengthConstraint("m", "0,0", Map.of("1,1", 2)))
				.pathLength(new PathLengthConstraint("m", "0,0", Map.of("0,1", 1)))
				.build();
		assertEquals(FailureKind.INVALID_REQUEST, solve(problem).failureKind());
	}

	//endregion
}
