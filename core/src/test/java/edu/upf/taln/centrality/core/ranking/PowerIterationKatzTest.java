package edu.upf.taln.centrality.core.ranking;

import edu.upf.taln.centrality.core.structures.Bias;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.*;
import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class PowerIterationKatzTest
{
	private static final double DELTA = 1.0e-5;

	static Graph<Integer, DefaultEdge> createPath(int n)
	{
		Graph<Integer, DefaultEdge> g = new SimpleGraph<>(DefaultEdge.class);
		g.addVertex(0);
		for (int i = 1; i < n; ++i)
			Graphs.addEdgeWithVertices(g, i - 1, i);
		return g;
	}

	@Test
	public void emptyGraph()
	{
		Graph<Integer, DefaultEdge> g = new SimpleGraph<>(DefaultEdge.class);
		final Map<Integer, Double> scores = new PowerIterationKatz(0.1, 1, 1.0e-6, true).rank(g, Bias.of(1.0));
		assertTrue(scores.isEmpty());

		// Callers may add to the result as with any other graph
		scores.put(1, 1.0);
		assertEquals(1, scores.size());
	}

	@Test
	public void pathGraph()
	{
		PowerIterationKatz alg = new PowerIterationKatz(0.1, 1000, 1.0e-6, false);
		final Map<Integer, Double> scores = alg.rank(createPath(4), Bias.of(1.0));

		assertEquals(4, scores.size());
		assertEquals(100.0 / 89.0, scores.get(0), DELTA);
		assertEquals(110.0 / 89.0, scores.get(1), DELTA);
		assertEquals(scores.get(0), scores.get(3), DELTA);
		assertEquals(scores.get(1), scores.get(2), DELTA);
	}

	@Test
	public void normalizedPathGraph()
	{
		final Graph<Integer, DefaultEdge> path = createPath(4);
		final Map<Integer, Double> raw = new PowerIterationKatz(0.1, 1000, 1.0e-6, false).rank(path, Bias.of(1.0));
		final Map<Integer, Double> normalized = new PowerIterationKatz(0.1, 1000, 1.0e-6, true).rank(path, Bias.of(1.0));

		final double norm = Math.sqrt(raw.values().stream().mapToDouble(d -> d * d).sum());
		raw.forEach((node, score) -> assertEquals(score / norm, normalized.get(node), 1.0e-12));
		assertEquals(0.475651, normalized.get(0), DELTA);
		assertEquals(0.523216, normalized.get(1), DELTA);
	}

	// In directed graphs a node collects the scores of the nodes it points to
	@Test
	public void directedChain()
	{
		Graph<String, DefaultEdge> g = new SimpleDirectedGraph<>(DefaultEdge.class);
		Graphs.addEdgeWithVertices(g, "a", "b");
		Graphs.addEdgeWithVertices(g, "b", "c");

		final Map<String, Double> scores = new PowerIterationKatz(0.1, 1000, 1.0e-6, false).rank(g, Bias.of(1.0));
		assertEquals(1.11, scores.get("a"), DELTA);
		assertEquals(1.1, scores.get("b"), DELTA);
		assertEquals(1.0, scores.get("c"), DELTA);
	}

	@Test
	public void weightedEdges()
	{
		SimpleDirectedWeightedGraph<String, DefaultWeightedEdge> g = new SimpleDirectedWeightedGraph<>(DefaultWeightedEdge.class);
		Graphs.addEdgeWithVertices(g, "a", "b", 2.0);

		final Map<String, Double> scores = new PowerIterationKatz(0.1, 1000, 1.0e-6, false).rank(g, Bias.of(1.0));
		assertEquals(1.2, scores.get("a"), DELTA);
		assertEquals(1.0, scores.get("b"), DELTA);
	}

	@Test
	public void selfLoop()
	{
		Graph<String, DefaultEdge> g = new DefaultDirectedGraph<>(DefaultEdge.class);
		g.addVertex("a");
		g.addEdge("a", "a");

		final Map<String, Double> scores = new PowerIterationKatz(0.1, 1000, 1.0e-9, false).rank(g, Bias.of(1.0));
		assertEquals(1.0 / 0.9, scores.get("a"), DELTA);
	}

	@Test
	public void zeroBiasIsNotScaled()
	{
		final Map<Integer, Double> scores = new PowerIterationKatz(0.1, 10, 1.0e-6, true).rank(createPath(3), Bias.of(0.0));
		assertEquals(3, scores.size());
		scores.values().forEach(s -> assertEquals(0.0, s, 0.0));
	}

	@Test
	public void scalarAndMappingBiasAgree()
	{
		final Graph<Integer, DefaultEdge> path = createPath(5);
		final Map<Integer, Double> mapping = new HashMap<>();
		path.vertexSet().forEach(v -> mapping.put(v, 0.5));

		PowerIterationKatz alg = new PowerIterationKatz(0.1, 1000, 1.0e-6, true);
		assertEquals(alg.rank(path, Bias.of(0.5)), alg.rank(path, Bias.of(mapping)));
		assertEquals(alg.rank(path, Bias.of(0.5)), alg.rank(path, Bias.of(List.of(0.5, 0.5, 0.5, 0.5, 0.5))));
	}

	@Test
	public void startFromSolution()
	{
		final Graph<Integer, DefaultEdge> path = createPath(4);
		final Map<Integer, Double> initial = Map.of(0, 100.0 / 89.0, 1, 110.0 / 89.0, 2, 110.0 / 89.0, 3, 100.0 / 89.0);

		// Starting at the fixed point, a single pass is enough
		final Map<Integer, Double> scores = new PowerIterationKatz(0.1, 1, 1.0e-6, false).rank(path, Bias.of(1.0), initial);
		initial.forEach((node, score) -> assertEquals(score, scores.get(node), DELTA));
	}

	@Test(expected = IllegalArgumentException.class)
	public void incompleteInitialScores()
	{
		new PowerIterationKatz(0.1, 1000, 1.0e-6, false).rank(createPath(4), Bias.of(1.0), Map.of(0, 1.0));
	}

	@Test
	public void budgetExhausted()
	{
		try
		{
			new PowerIterationKatz(1.0, 1, 1.0e-6, true).rank(createPath(4), Bias.of(1.0));
			fail("Expected ConvergenceException");
		}
		catch (ConvergenceException e)
		{
			assertEquals(1, e.getIterations());
		}
	}

	// alpha above the inverse of the spectral radius makes scores grow without bound
	@Test(expected = ConvergenceException.class)
	public void divergingAlpha()
	{
		Graph<Integer, DefaultEdge> triangle = createPath(3);
		triangle.addEdge(2, 0);
		new PowerIterationKatz(1.0, 1000, 1.0e-6, true).rank(triangle, Bias.of(1.0));
	}

	@Test(expected = UnsupportedGraphException.class)
	public void rejectMultigraph()
	{
		Graph<String, DefaultEdge> g = new DirectedMultigraph<>(DefaultEdge.class);
		Graphs.addEdgeWithVertices(g, "a", "b");
		new PowerIterationKatz(0.1, 1000, 1.0e-6, true).rank(g, Bias.of(1.0));
	}

	// Checked before looking at nodes, even if there are none
	@Test(expected = UnsupportedGraphException.class)
	public void rejectEmptyMultigraph()
	{
		Graph<String, DefaultEdge> g = new Pseudograph<>(DefaultEdge.class);
		new PowerIterationKatz(0.1, 1000, 1.0e-6, true).rank(g, Bias.of(1.0));
	}

	@Test(expected = MissingBiasException.class)
	public void missingBias()
	{
		new PowerIterationKatz(0.1, 1000, 1.0e-6, true).rank(createPath(4), Bias.of(Map.of(0, 1.0, 1, 1.0)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void invalidIterations()
	{
		new PowerIterationKatz(0.1, 0, 1.0e-6, true);
	}
}
