package edu.upf.taln.centrality.core.ranking;

import Jama.Matrix;
import com.google.common.base.Preconditions;
import edu.upf.taln.centrality.core.structures.Bias;
import edu.upf.taln.centrality.core.utils.DebugUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.Graph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes Katz centrality with the power method over a sparse adjacency list.
 * Scores are updated synchronously: each pass reads the scores of the previous pass and writes a new vector, and
 * the two vectors are swapped at the end of the pass.
 * Iteration stops when the sum of absolute changes across all nodes falls below number_of_nodes * tolerance.
 * Immutable class.
 */
public class PowerIterationKatz implements KatzRanking
{
	private final double alpha;
	private final int max_iterations;
	private final double tolerance;
	private final boolean normalize;
	private final static Logger log = LogManager.getLogger();

	public PowerIterationKatz(double alpha, int max_iterations, double tolerance, boolean normalize)
	{
		Preconditions.checkArgument(max_iterations > 0, "Maximum number of iterations must be positive");
		Preconditions.checkArgument(tolerance >= 0.0, "Tolerance cannot be negative");
		this.alpha = alpha;
		this.max_iterations = max_iterations;
		this.tolerance = tolerance;
		this.normalize = normalize;
	}

	/**
	 * Ranks the nodes of a graph starting from a vector of zeros.
	 */
	@Override
	public <V, E> Map<V, Double> rank(Graph<V, E> graph, Bias<V> bias)
	{
		return rank(graph, bias, null);
	}

	/**
	 * Ranks the nodes of a graph.
	 *
	 * @param graph a graph that does not allow parallel edges
	 * @param bias bias added to every node at each pass
	 * @param initial starting score of each node, or null to start from zeros
	 * @return the Katz centrality of each node
	 * @throws ConvergenceException if the scores haven't converged after the maximum number of iterations
	 */
	public <V, E> Map<V, Double> rank(Graph<V, E> graph, Bias<V> bias, Map<V, Double> initial)
	{
		AdjacencyFactory.checkSupported(graph);
		if (graph.vertexSet().isEmpty())
			return new LinkedHashMap<>();

		final List<V> nodes = AdjacencyFactory.createNodeList(graph);
		final int n = nodes.size();
		final double[] b = bias.resolveVector(nodes);
		final List<List<Pair<Integer, Double>>> adjacency = AdjacencyFactory.createAdjacencyList(graph, nodes);

		double[] last = new double[n]; // scores of the previous pass
		double[] x = new double[n]; // scores being computed in the current pass
		if (initial != null)
		{
			for (int i = 0; i < n; ++i)
			{
				final Double s = initial.get(nodes.get(i));
				Preconditions.checkArgument(s != null, "No initial value for node %s", nodes.get(i));
				x[i] = s;
			}
		}

		log.info("Starting power iteration for " + n + " nodes, alpha=" + DebugUtils.printDouble(alpha));
		final double threshold = n * tolerance;
		for (int iteration = 1; iteration <= max_iterations; ++iteration)
		{
			final double[] tmp = last;
			last = x;
			x = tmp;

			double error = 0.0;
			for (int i = 0; i < n; ++i)
			{
				double sum = 0.0;
				for (Pair<Integer, Double> edge : adjacency.get(i))
					sum += last[edge.getLeft()] * edge.getRight();
				x[i] = alpha * sum + b[i];
				error += Math.abs(x[i] - last[i]);
			}

			log.debug("Iteration " + iteration + ": error " + error);
			if (error < threshold)
			{
				log.info("Power iteration completed after " + iteration + " iterations");
				if (normalize)
					ScoreVectors.scale(x, new Matrix(x, n).normF());
				return ScoreVectors.toScores(nodes, x);
			}
		}

		throw new ConvergenceException(max_iterations);
	}

	public double getAlpha() { return alpha; }
	public int getMaxIterations() { return max_iterations; }
	public double getTolerance() { return tolerance; }
	public boolean isNormalized() { return normalize; }
}
