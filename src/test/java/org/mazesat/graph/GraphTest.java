package org.mazesat.graph;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class GraphTest {

	private static Graph pathWithIsolatedNode() {
		return Graph.builder()
				.addNodes("a", "b", "c", "d")
				.addEdge("a", "b")
				.addEdge("b", "c")
				.build();
	}

	@Test
	public void testNodesKeepInsertionOrder() {
		Graph graph = pathWithIsolatedNode();
		assertEquals(4, graph.nodeCount());
		assertEquals("c", graph.nodeId(2));
		assertEquals(2, graph.indexOf("c"));
		assertTrue(graph.contains("d"));
		assertFalse(graph.contains("z"));
	}

	@Test
	public void testUnknownNodeIsRejected() {
		Graph graph = pathWithIsolatedNode();
		assertThrows(IllegalArgumentException.class, () -> graph.indexOf("z"));
		assertThrows(IllegalArgumentException.class, () -> Graph.builder().addNode("a").addEdge("a", "z"));
		assertThrows(IllegalArgumentException.class, () -> Graph.builder().addNode("a").addNode("a"));
	}

	@Test
	public void testAdjacency() {
		Graph graph = pathWithIsolatedNode();
		int b = graph.indexOf("b");
		assertEquals(2, graph.degree(b));
		assertTrue(graph.areAdjacent(graph.indexOf("a"), b));
		assertFalse(graph.areAdjacent(graph.indexOf("a"), graph.indexOf("c")));
		assertEquals(0, graph.degree(graph.indexOf("d")));
		assertNotNull(graph.findEdge(b, graph.indexOf("c")));
		assertNull(graph.findEdge(graph.indexOf("a"), graph.indexOf("d")));
	}

	@Test
	public void testParallelEdgesGetDistinctIds() {
		Graph graph = Graph.builder().addNodes("a", "b").addEdge("a", "b").addEdge("a", "b").build();
		assertEquals(2, graph.edgeCount());
		assertFalse(graph.edge(0).id().equals(graph.edge(1).id()));
		// i vicini non si ripetono anche con archi paralleli
		assertEquals(1, graph.neighbors(0).length);
		assertEquals(2, graph.incidentEdges(0).length);
	}

	@Test
	public void testSelfLoopCountedOnce() {
		Graph graph = Graph.builder().addNode("q").addEdge("x", "q", "q", "").build();
		assertTrue(graph.edge(0).isLoop());
		assertEquals(1, graph.incidentEdges(0).length);
		assertEquals(0, graph.neighbors(0).length);
	}

	@Test
	public void testHopDistances() {
		Graph graph = pathWithIsolatedNode();
		assertArrayEquals(new int[]{0, 1, 2, -1}, graph.hopDistances(0));
	}

	@Test
	public void testHopCountLowerBound() {
		Graph graph = pathWithIsolatedNode();
		DistanceLowerBound bound = DistanceLowerBound.hopCount(graph);
		assertEquals(2, bound.lowerBound(0, 2));
		assertEquals(Integer.MAX_VALUE, bound.lowerBound(0, 3));
		assertEquals(0, DistanceLowerBound.none().lowerBound(1, 1));
		assertEquals(1, DistanceLowerBound.none().lowerBound(0, 3));
	}
}
