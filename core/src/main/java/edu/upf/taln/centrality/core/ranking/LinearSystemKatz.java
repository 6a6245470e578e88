package edu.upf.taln.centrality.core.ranking;

import Jama.LUDecomposition;
import Jama.Matrix;
import edu.upf.taln.centrality.core.structures.Bias;
import edu.upf.taln.centrality.core.utils.DebugUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.Graph;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes Katz centrality in closed form by solving the linear system (I - alpha * A) x = beta over a dense
 * adjacency matrix A.
 * If requested, the solution is divided by its L2 norm carrying the sign of the sum of its values, so that scores
 * of a mostly negative solution come out positive.
 * Immutable class.
 */
public class LinearSystemKatz implements KatzRanking
{
	private final double alpha;
	private final boolean normalize;
	private final static Logger log = LogManager.getLogger();

	public LinearSystemKatz(double alpha, boolean normalize)
	{
		this.alpha = alpha;
		this.normalize = normalize;
	}

	/**
	 * @throws SingularSystemException if I - alpha * A is singular or the solution isn't finite
	 */
	@Override
	public <V, E> Map<V, Double> rank(Graph<V, E> graph, Bias<V> bias)
	{
		AdjacencyFactory.checkSupported(graph);
		if (graph.vertexSet().isEmpty())
			return new LinkedHashMap<>();

		final List<V> nodes = AdjacencyFactory.createNodeList(graph);
		final int n = nodes.size();
		final Matrix a = new Matrix(AdjacencyFactory.createAdjacencyMatrix(graph, nodes));
		final Matrix b = new Matrix(bias.resolveVector(nodes), n); // column vector

		log.info("Solving linear system for " + n + " nodes, alpha=" + DebugUtils.printDouble(alpha));
		final Matrix m = Matrix.identity(n, n).minus(a.times(alpha));
		final LUDecomposition lu = new LUDecomposition(m);
		if (!lu.isNonsingular())
			throw new SingularSystemException("Matrix I - alpha*A is singular for alpha=" + alpha);

		final Matrix solution;
		try
		{
			solution = lu.solve(b);
		}
		catch (RuntimeException e)
		{
			throw new SingularSystemException("Failed to solve linear system: " + e.getMessage(), e);
		}
		final double[] x = solution.getColumnPackedCopy();
		if (Arrays.stream(x).anyMatch(d -> !Double.isFinite(d)))
			throw new SingularSystemException("Linear system has no finite solution for alpha=" + alpha);

		if (normalize)
		{
			final double sign = Math.signum(Arrays.stream(x).sum());
			ScoreVectors.scale(x, sign * solution.normF()); // Frobenius norm of a column is its L2 norm
		}

		log.info("Linear system solved");
		return ScoreVectors.toScores(nodes, x);
	}

	public double getAlpha() { return alpha; }
	public boolean isNormalized() { return normalize; }
}
