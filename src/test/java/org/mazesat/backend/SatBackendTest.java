package org.mazesat.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mazesat.cdcl.CDCLSolver;

/**
 * Stesse formule su tutti i motori: gli esiti devono coincidere e i modelli
 * devono soddisfare ogni clausola.
 */
public class SatBackendTest {

	/** Piccioni in buche: ogni piccione in una buca, nessuna buca condivisa. */
	private static int[][] pigeonhole(SatBackend backend, int pigeons, int holes) {
		int[][] variable = new int[pigeons][holes];
		for (int p = 0; p < pigeons; p++) {
			for (int h = 0; h < holes; h++) {
				variable[p][h] = backend.newVariable();
			}
		}
		int[][] clauses = new int[pigeons + holes * pigeons * (pigeons - 1) / 2][];
		int next = 0;
		for (int p = 0; p < pigeons; p++) {
			clauses[next++] = variable[p].clone();
		}
		for (int h = 0; h < holes; h++) {
			for (int p = 0; p < pigeons; p++) {
				for (int q = p + 1; q < pigeons; q++) {
					clauses[next++] = new int[]{-variable[p][h], -variable[q][h]};
				}
			}
		}
		for (int[] clause : clauses) {
			backend.addClause(clause);
		}
		return clauses;
	}

	private static void assertModelSatisfies(SatBackend backend, int[][] clauses) {
		for (int[] clause : clauses) {
			boolean satisfied = false;
			for (int literal : clause) {
				satisfied |= backend.valueOf(Math.abs(literal)) == literal > 0;
			}
			assertTrue(satisfied, "Clausola non soddisfatta dal modello di " + backend.name());
		}
	}

	@ParameterizedTest
	@EnumSource(BackendKind.class)
	public void testPigeonholeUnsatisfiable(BackendKind kind) {
		SatBackend backend = kind.create();
		pigeonhole(backend, 4, 3);
		assertEquals(SolveStatus.UNSATISFIABLE, backend.solve());
	}

	@ParameterizedTest
	@EnumSource(BackendKind.class)
	public void testPigeonholeSatisfiableWithEnoughHoles(BackendKind kind) {
		SatBackend backend = kind.create();
		int[][] clauses = pigeonhole(backend, 4, 4);
		assertEquals(SolveStatus.SATISFIABLE, backend.solve());
		assertModelSatisfies(backend, clauses);
	}

	@ParameterizedTest
	@EnumSource(BackendKind.class)
	public void testEmptyClauseIsUnsatisfiable(BackendKind kind) {
		SatBackend backend = kind.create();
		int a = backend.newVariable();
		backend.addClause(a);
		backend.addClause();
		assertEquals(SolveStatus.UNSATISFIABLE, backend.solve());
	}

	@ParameterizedTest
	@EnumSource(BackendKind.class)
	public void testUnitPropagationChain(BackendKind kind) {
		SatBackend backend = kind.create();
		int a = backend.newVariable();
		int b = backend.newVariable();
		int c = backend.newVariable();
		int[][] clauses = {{a}, {-a, b}, {-b, c}, {-c, -a, b}};
		for (int[] clause : clauses) {
			backend.addClause(clause);
		}
		assertEquals(SolveStatus.SATISFIABLE, backend.solve());
		assertTrue(backend.valueOf(a) && backend.valueOf(b) && backend.valueOf(c));
		assertEquals(3, backend.variableCount());
		assertEquals(4, backend.clauseCount());
	}

	@ParameterizedTest
	@EnumSource(BackendKind.class)
	public void testInvalidLiteralRejected(BackendKind kind) {
		SatBackend backend = kind.create();
		backend.newVariable();
		assertThrows(IllegalArgumentException.class, () -> backend.addClause(1, 2));
		assertThrows(IllegalArgumentException.class, () -> backend.addClause(0));
	}

	@ParameterizedTest
	@EnumSource(BackendKind.class)
	public void testNoModelBeforeSolve(BackendKind kind) {
		SatBackend backend = kind.create();
		backend.newVariable();
		assertThrows(IllegalStateException.class, () -> backend.valueOf(1));
	}

	@Test
	public void testRestartVariantSolvesHarderInstance() {
		CDCLSolver solver = new CDCLSolver(true);
		pigeonhole(solver, 6, 5);
		assertEquals(SolveStatus.UNSATISFIABLE, solver.solve());
		assertEquals("cdcl+restart", solver.name());
		assertTrue(solver.getStatistics().getConflicts() > 0);
	}

	@ParameterizedTest
	@EnumSource(BackendKind.class)
	public void testConflictBudgetGivesUnknown(BackendKind kind) {
		SatBackend backend = kind.create(false, 1);
		pigeonhole(backend, 6, 5);
		assertEquals(SolveStatus.UNKNOWN, backend.solve());
	}

	@Test
	public void testDpllBudgetLeavesEasyFormulasSolvable() {
		SatBackend backend = new DPLLSolver(1);
		pigeonhole(backend, 3, 3);
		assertEquals(SolveStatus.SATISFIABLE, backend.solve());
	}

	@Test
	public void testInterruptedThreadGivesUnknown() {
		SatBackend backend = BackendKind.DPLL.create();
		pigeonhole(backend, 5, 4);
		Thread.currentThread().interrupt();
		try {
			assertEquals(SolveStatus.UNKNOWN, backend.solve());
		} finally {
			Thread.interrupted();
		}
	}

	@Test
	public void testBackendNames() {
		assertEquals(BackendKind.SAT4J, BackendKind.fromName(" Sat4j "));
		assertEquals("dpll", BackendKind.DPLL.create().name());
		assertThrows(IllegalArgumentException.class, () -> BackendKind.fromName("minisat"));
	}
}
