package edu.upf.taln.centrality.core.ranking;

import edu.upf.taln.centrality.core.structures.Bias;
import org.jgrapht.Graph;

import java.util.Map;

/**
 * Interface for algorithms computing the Katz centrality of the nodes of a graph.
 *
 * The Katz centrality x of a graph with adjacency matrix A is the solution of
 *      x_i = alpha * SUM_j A_ij x_j + beta_i
 * where alpha attenuates the influence of nodes reached through longer paths and beta is a bias added to every
 * node. A solution exists when alpha is strictly less than the inverse of the largest eigenvalue of A, a condition
 * which callers are expected to meet and which is not checked.
 * See M. Newman, Networks: An Introduction. Oxford University Press, 2010, p. 720.
 *
 * Implementations reject graphs allowing parallel edges and return an empty map for empty graphs. Otherwise they
 * return a map with exactly one score per node of the graph.
 */
@FunctionalInterface
public interface KatzRanking
{
	<V, E> Map<V, Double> rank(Graph<V, E> graph, Bias<V> bias);
}
