package org.mazesat.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.mazesat.backend.BackendKind;
import org.mazesat.backend.SatBackend;
import org.mazesat.encoding.ForestEncoder;
import org.mazesat.encoding.ForestProblem;
import org.mazesat.encoding.InvalidRequestException;
import org.mazesat.encoding.ProblemEncoder;
import org.mazesat.graph.Graph;
import org.mazesat.graph.GridGraphs;
import org.mazesat.support.EncodingSession;
import org.mazesat.support.FormulaStats;
import org.mazesat.support.VariableKey;

public class SolvePipelineTest {

	/** Piccioni in buche come richiesta: insoddisfacibile con più piccioni che buche. */
	static final class PigeonholeEncoder implements ProblemEncoder<Integer> {

		private final int pigeons;
		private final int holes;

		PigeonholeEncoder(int pigeons, int holes) {
			this.pigeons = pigeons;
			this.holes = holes;
		}

		@Override
		public void validate() throws InvalidRequestException {
			if (pigeons < 1 || holes < 1) {
				throw new InvalidRequestException("Istanza vuota");
			}
		}

		@Override
		public void encode(EncodingSession session) {
			for (int p = 0; p < pigeons; p++) {
				List<Integer> choices = new ArrayList<>();
				for (int h = 0; h < holes; h++) {
					choices.add(session.variable(new VariableKey.Member(p, h)));
				}
				session.atLeastOne(choices);
			}
			for (int h = 0; h < holes; h++) {
				List<Integer> occupants = new ArrayList<>();
				for (int p = 0; p < pigeons; p++) {
					occupants.add(session.variable(new VariableKey.Member(p, h)));
				}
				session.atMostOnePairwise(occupants);
			}
		}

		@Override
		public Integer decode(EncodingSession session, SatBackend backend) {
			int placed = 0;
			for (int p = 0; p < pigeons; p++) {
				for (int h = 0; h < holes; h++) {
					if (backend.valueOf(session.variable(new VariableKey.Member(p, h)))) {
						placed++;
						break;
					}
				}
			}
			return placed;
		}

		@Override
		public String describe() {
			return pigeons + " piccioni in " + holes + " buche";
		}
	}

	private static ForestEncoder smallForest() {
		return new ForestEncoder(ForestProblem.builder(GridGraphs.square(2, 2, GridGraphs.Adjacency.FOUR, false))
				.fix("0,0", "A")
				.build());
	}

	@Test
	public void testSuccessCarriesStatsAndReport() {
		SolveOutcome<Integer> outcome = new SolvePipeline().run(new PigeonholeEncoder(3, 3));

		assertTrue(outcome.isSuccess());
		assertEquals(3, outcome.result());
		assertEquals(9, outcome.stats().variables());
		assertNull(outcome.failureKind());
		assertNotNull(outcome.solverReport());
	}

	@Test
	public void testUnsatisfiableIsNotProvablyImpossible() {
		SolveOutcome<Integer> outcome = new SolvePipeline(BackendKind.SAT4J, false, -1).run(new PigeonholeEncoder(4, 3));

		assertEquals(FailureKind.UNSATISFIABLE, outcome.failureKind());
		assertThrows(IllegalStateException.class, outcome::result);
		assertNull(outcome.solverReport());
	}

	@Test
	public void testConflictBudgetExhaustionIsResourceFailure() {
		SolveOutcome<Integer> outcome = new SolvePipeline(BackendKind.CDCL, false, 1).run(new PigeonholeEncoder(6, 5));

		assertEquals(FailureKind.RESOURCE_EXHAUSTED, outcome.failureKind());
		assertEquals(SolvePipeline.RESOURCE_MESSAGE, outcome.message());
		assertNotNull(outcome.stats());
	}

	@Test
	public void testInvalidRequestNeverReachesEncoding() {
		List<FormulaStats> progress = new ArrayList<>();
		SolveOutcome<Integer> outcome = new SolvePipeline().run(new PigeonholeEncoder(0, 3),
				(description, stats) -> progress.add(stats));

		assertEquals(FailureKind.INVALID_REQUEST, outcome.failureKind());
		assertNull(outcome.stats());
		assertTrue(progress.isEmpty());
	}

	@Test
	public void testBlankInputIsRejected() {
		ForestEncoder blank = new ForestEncoder(ForestProblem.builder(Graph.builder().build()).build());
		assertEquals(FailureKind.INVALID_REQUEST, new SolvePipeline().run(blank).failureKind());
	}

	@Test
	public void testProgressReportedOnceBeforeSolving() {
		List<String> progress = new ArrayList<>();
		SolveOutcome<?> outcome = new SolvePipeline().run(smallForest(),
				(description, stats) -> progress.add(description + ": " + stats));

		assertTrue(outcome.isSuccess());
		assertEquals(1, progress.size());
		assertTrue(progress.get(0).contains(outcome.stats().toString()));
	}

	@Test
	public void testInterruptedCallerGetsCancellation() {
		Thread.currentThread().interrupt();
		try {
			SolveOutcome<?> outcome = new SolvePipeline().run(smallForest());
			assertEquals(FailureKind.CANCELLED, outcome.failureKind());
		} finally {
			Thread.interrupted();
		}
	}

	@Test
	public void testEncodeOnlyForExport() throws InvalidRequestException {
		EncodingSession session = new SolvePipeline().encode(new PigeonholeEncoder(2, 2));
		assertEquals(4, session.variableCount());
		assertEquals(4, session.clauseCount());
		assertThrows(InvalidRequestException.class, () -> new SolvePipeline().encode(new PigeonholeEncoder(0, 0)));
	}
}
