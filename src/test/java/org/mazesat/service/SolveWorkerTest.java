package org.mazesat.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.mazesat.backend.BackendKind;
import org.mazesat.encoding.LoopEncoder;
import org.mazesat.extract.LoopSolution;
import org.mazesat.graph.GridGraphs;

public class SolveWorkerTest {

	@Test
	public void testIndependentRequestsInParallel() throws Exception {
		try (SolveWorker worker = new SolveWorker(new SolvePipeline(), 2)) {
			List<Future<SolveOutcome<Integer>>> futures = new ArrayList<>();
			for (int n = 2; n <= 5; n++) {
				futures.add(worker.submit(new SolvePipelineTest.PigeonholeEncoder(n, n)));
			}
			futures.add(worker.submit(new SolvePipelineTest.PigeonholeEncoder(4, 3)));

			for (int i = 0; i < 4; i++) {
				SolveOutcome<Integer> outcome = futures.get(i).get(30, TimeUnit.SECONDS);
				assertTrue(outcome.isSuccess());
				assertEquals(i + 2, outcome.result());
			}
			assertEquals(FailureKind.UNSATISFIABLE, futures.get(4).get(30, TimeUnit.SECONDS).failureKind());
		}
	}

	@Test
	public void testLoopThroughWorker() throws Exception {
		try (SolveWorker worker = new SolveWorker(new SolvePipeline())) {
			Future<SolveOutcome<LoopSolution>> future = worker.submit(LoopEncoder.forDistinctNodes(
					GridGraphs.square(4, 4, GridGraphs.Adjacency.FOUR, false), "0,0", 8));
			SolveOutcome<LoopSolution> outcome = future.get(30, TimeUnit.SECONDS);
			assertTrue(outcome.isSuccess(), outcome.toString());
			assertEquals(8, outcome.result().distinctNodes());
		}
	}

	@Test
	public void testCancelledRequest() throws Exception {
		try (SolveWorker worker = new SolveWorker(new SolvePipeline())) {
			Future<SolveOutcome<Integer>> future = worker.submit(new SolvePipelineTest.PigeonholeEncoder(11, 10));
			future.cancel(true);
			assertTrue(future.isCancelled());
			assertThrows(CancellationException.class, future::get);
		}
	}

	@Test
	public void testCancelledSat4jRequestReleasesTheWorker() throws Exception {
		try (SolveWorker worker = new SolveWorker(new SolvePipeline(BackendKind.SAT4J, false, -1))) {
			Future<SolveOutcome<Integer>> hard = worker.submit(new SolvePipelineTest.PigeonholeEncoder(13, 12));
			Thread.sleep(300);
			hard.cancel(true);

			Future<SolveOutcome<Integer>> easy = worker.submit(new SolvePipelineTest.PigeonholeEncoder(2, 2));
			SolveOutcome<Integer> outcome = easy.get(10, TimeUnit.SECONDS);
			assertTrue(outcome.isSuccess());
			assertEquals(2, outcome.result());
		}
	}

	@Test
	public void testInvalidThreadCount() {
		assertThrows(IllegalArgumentException.class, () -> new SolveWorker(new SolvePipeline(), 0));
	}
}
