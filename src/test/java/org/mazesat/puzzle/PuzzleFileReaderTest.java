package org.mazesat.puzzle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.mazesat.encoding.ArborescenceEncoder;
import org.mazesat.encoding.CycleEncoding;
import org.mazesat.encoding.DepthMode;
import org.mazesat.encoding.DepthRequirement;
import org.mazesat.encoding.ForestEncoder;
import org.mazesat.encoding.ForestProblem;
import org.mazesat.encoding.LoopEncoder;
import org.mazesat.extract.ArborescenceSolution;
import org.mazesat.extract.ForestSolution;
import org.mazesat.extract.LoopSolution;
import org.mazesat.service.SolveOutcome;
import org.mazesat.service.SolvePipeline;

public class PuzzleFileReaderTest {

	private static Path fixture(String name) throws Exception {
		return Path.of(PuzzleFileReaderTest.class.getResource("/puzzles/" + name).toURI());
	}

	private static List<String> errorsOf(String text) {
		PuzzleSyntaxException e = assertThrows(PuzzleSyntaxException.class, () -> PuzzleFileReader.parse("test", text));
		assertFalse(e.getErrors().isEmpty());
		return e.getErrors();
	}

	@Test
	public void testMazeFile() throws Exception {
		PuzzleDefinition definition = PuzzleFileReader.read(fixture("maze.puzzle"));

		assertEquals("maze.puzzle", definition.name());
		assertEquals(9, definition.graph().nodeCount());
		assertTrue(definition.forest().isPresent());
		assertTrue(definition.loop().isEmpty());
		assertEquals(1, definition.encoders().size());

		ForestProblem forest = definition.forest().get();
		assertEquals(ForestProblem.PlacementKind.FIXED, forest.placementOf("0,0"));
		assertEquals(ForestProblem.PlacementKind.EXCLUDED, forest.placementOf("1,1"));
		assertEquals(ForestProblem.PlacementKind.FREE, forest.placementOf("2,2"));
		assertEquals(1, forest.pathLengthConstraints().size());

		SolveOutcome<ForestSolution> outcome = new SolvePipeline().run(new ForestEncoder(forest));
		assertTrue(outcome.isSuccess(), outcome.toString());
		assertFalse(outcome.result().groupOf().containsKey("1,1"));
	}

	@Test
	public void testLoopFile() throws Exception {
		PuzzleDefinition definition = PuzzleFileReader.read(fixture("loop.puzzle"));

		assertEquals(18, definition.graph().edgeCount());
		LoopEncoder loop = definition.loop().orElseThrow();
		assertEquals(10, loop.length());

		SolveOutcome<LoopSolution> outcome = new SolvePipeline().run(loop);
		assertTrue(outcome.isSuccess(), outcome.toString());
		assertEquals(9, outcome.result().distinctNodes());
	}

	@Test
	public void testArborescenceFile() throws Exception {
		PuzzleDefinition definition = PuzzleFileReader.read(fixture("arborescence.puzzle"));

		assertEquals(0, definition.graph().nodeCount());
		assertEquals(1, definition.encoders().size());
		ArborescenceEncoder encoder = definition.arborescence().orElseThrow();

		SolveOutcome<ArborescenceSolution> outcome = new SolvePipeline().run(encoder);
		assertTrue(outcome.isSuccess(), outcome.toString());
		assertEquals("b1", outcome.result().liftedParent().get("c1"));
	}

	@Test
	public void testBrokenFileReportsLines() throws Exception {
		PuzzleSyntaxException e = assertThrows(PuzzleSyntaxException.class,
				() -> PuzzleFileReader.read(fixture("broken.puzzle")));
		assertTrue(e.getErrors().stream().allMatch(error -> error.startsWith("riga ")), e.getErrors().toString());
		assertTrue(e.getErrors().stream().anyMatch(error -> error.startsWith("riga 3")), e.getErrors().toString());
	}

	@Test
	public void testExplicitGraphWithQuotedAndNumericIds() throws Exception {
		PuzzleDefinition definition = PuzzleFileReader.parse("inline", String.join("\n",
				"node 1 2 \"nodo tre\" quattro;",
				"edge 1 2, 2 \"nodo tre\", \"nodo tre\" quattro, quattro 1;",
				"group G root 1 members quattro;",
				"depth quattro = 1;",
				"cycles binary;",
				"depthmode level;"));

		assertEquals(4, definition.graph().nodeCount());
		assertEquals(4, definition.graph().edgeCount());
		assertTrue(definition.graph().contains("nodo tre"));

		ForestProblem forest = definition.forest().orElseThrow();
		assertEquals(CycleEncoding.BINARY, forest.cycleEncoding());
		assertEquals(DepthMode.LEVEL_ONLY, forest.depthMode());
		assertEquals(List.of(DepthRequirement.exactly("quattro", 1)), forest.depthRequirements());
		assertEquals("1", forest.explicitRoots().get("G"));
		assertInstanceOf(ForestEncoder.class, definition.encoders().get(0));
	}

	@Test
	public void testDeclarationErrors() {
		List<String> errors = errorsOf("grid 2 by 2;\nnode a;\nloop from \"0,0\" length 4;");
		assertEquals(1, errors.size());
		assertTrue(errors.get(0).startsWith("riga 1:"));

		errors = errorsOf("grid 2 by 2;\ngrid 3 by 3;\nloop from \"0,0\" length 4;");
		assertTrue(errors.get(0).startsWith("riga 2:"));

		errors = errorsOf("node a b;\nedge a b, a c;\nloop from a length 3;");
		assertEquals(1, errors.size());
		assertTrue(errors.get(0).startsWith("riga 2:"));

		errors = errorsOf("grid 0 by 3;\nloop from \"0,0\" length 4;");
		assertTrue(errors.get(0).contains("dimensioni"));

		errors = errorsOf("grid 2 by 2;\nloop from \"0,0\" length 99999999999;");
		assertTrue(errors.get(0).contains("fuori intervallo"));
	}

	@Test
	public void testFileWithoutRequests() {
		List<String> errors = errorsOf("# solo il grafo\ngrid 2 by 2;\n");
		assertEquals(List.of("nessuna richiesta dichiarata (group, loop o arborescence)"), errors);
	}

	@Test
	public void testSyntaxErrorsStopBeforeBuilding() {
		List<String> errors = errorsOf("grid 2 by 2\nloop from \"0,0\" length 4;");
		assertTrue(errors.get(0).startsWith("riga 2:0"), errors.toString());
		errors = errorsOf("grid 2 by 2;\nloop from @ length 4;");
		assertTrue(errors.get(0).startsWith("riga 2:"), errors.toString());
	}
}
