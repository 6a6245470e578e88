package edu.upf.taln.centrality.core.ranking;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Creates the adjacency structures used to rank the nodes of a graph.
 *
 * Both structures follow the convention that a row (or list) for node u holds the weights of the edges leaving u,
 * so that multiplying it by a score vector sums the scores of the nodes u points to. For undirected graphs every
 * edge leaves both of its endpoints and the dense matrix is symmetric.
 * Edge weights are read with {@link Graph#getEdgeWeight}, which is 1.0 for unweighted graphs.
 */
public class AdjacencyFactory
{
	private final static Logger log = LogManager.getLogger();

	/**
	 * Rejects graphs that allow more than one edge between the same pair of nodes.
	 * Only the graph type is looked at, so this is safe to call before reading any node.
	 */
	public static <V, E> void checkSupported(Graph<V, E> graph)
	{
		if (graph.getType().isAllowingMultipleEdges())
			throw new UnsupportedGraphException("Katz centrality is not implemented for multigraphs");
	}

	// Fixes an order for the nodes of a graph, the one in which the graph lists them
	public static <V, E> List<V> createNodeList(Graph<V, E> graph)
	{
		return new ArrayList<>(graph.vertexSet());
	}

	/**
	 * Creates a sparse adjacency list: for each node, the (neighbor, weight) pairs of the edges leaving it.
	 * Neighbors are given as indexes into nodes.
	 */
	public static <V, E> List<List<Pair<Integer, Double>>> createAdjacencyList(Graph<V, E> graph, List<V> nodes)
	{
		final Map<V, Integer> indexes = createIndex(nodes);

		final List<List<Pair<Integer, Double>>> adjacency = nodes.stream()
				.map(u -> graph.outgoingEdgesOf(u).stream()
						.map(e -> Pair.of(indexes.get(Graphs.getOppositeVertex(graph, e, u)), graph.getEdgeWeight(e)))
						.collect(Collectors.toList()))
				.collect(Collectors.toList());

		log.debug("Adjacency list created for " + nodes.size() + " nodes and " + graph.edgeSet().size() + " edges");
		return adjacency;
	}

	/**
	 * Creates a dense n x n adjacency matrix where m[i][j] is the weight of the edge going from node i to node j,
	 * and 0 if there is no such edge.
	 */
	public static <V, E> double[][] createAdjacencyMatrix(Graph<V, E> graph, List<V> nodes)
	{
		final int n = nodes.size();
		final Map<V, Integer> indexes = createIndex(nodes);
		final double[][] m = new double[n][n];

		for (int i = 0; i < n; ++i)
		{
			final V u = nodes.get(i);
			for (E e : graph.outgoingEdgesOf(u))
			{
				final int j = indexes.get(Graphs.getOppositeVertex(graph, e, u));
				final double w = graph.getEdgeWeight(e);
				assert !Double.isNaN(w) : "NaN weight for edge " + e;
				m[i][j] = w;
			}
		}

		log.debug("Adjacency matrix created for " + n + " nodes");
		return m;
	}

	private static <V> Map<V, Integer> createIndex(List<V> nodes)
	{
		final Map<V, Integer> indexes = new HashMap<>();
		for (int i = 0; i < nodes.size(); ++i)
			indexes.put(nodes.get(i), i);
		return indexes;
	}
}
