package edu.upf.taln.centrality.core;

import com.google.common.base.Stopwatch;
import edu.upf.taln.centrality.core.ranking.CentralityException;
import edu.upf.taln.centrality.core.ranking.KatzRanking;
import edu.upf.taln.centrality.core.ranking.LinearSystemKatz;
import edu.upf.taln.centrality.core.ranking.PowerIterationKatz;
import edu.upf.taln.centrality.core.structures.Bias;
import edu.upf.taln.centrality.core.utils.DebugUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.Graph;

import java.util.Map;

/**
 * Katz centrality of the nodes of a graph, computed with the algorithm selected in {@link Options}.
 */
public final class KatzCentrality
{
	private final static Logger log = LogManager.getLogger();

	private KatzCentrality() {}

	/**
	 * Ranks nodes with a bias of 1.0 for every node
	 */
	public static <V, E> Map<V, Double> rank(Graph<V, E> graph, Options o)
	{
		return rank(graph, Bias.of(1.0), null, o);
	}

	public static <V, E> Map<V, Double> rank(Graph<V, E> graph, Bias<V> bias, Options o)
	{
		return rank(graph, bias, null, o);
	}

	/**
	 * Ranks nodes of a graph.
	 * @param initial starting scores for power iteration, or null. Not used when solving the linear system.
	 */
	public static <V, E> Map<V, Double> rank(Graph<V, E> graph, Bias<V> bias, Map<V, Double> initial, Options o)
	{
		log.info("*Ranking nodes with " + o.method + "*");
		Stopwatch timer = Stopwatch.createStarted();

		try
		{
			final Map<V, Double> scores;
			if (o.method == Options.Method.PowerIteration)
			{
				final PowerIterationKatz alg = new PowerIterationKatz(o.alpha, o.max_iterations, o.tolerance, o.normalized);
				scores = alg.rank(graph, bias, initial);
			}
			else
			{
				if (initial != null)
					log.warn("Initial scores are ignored when solving the linear system");
				scores = create(o).rank(graph, bias);
			}

			log.info("Ranking of " + scores.size() + " nodes completed in " + timer.stop());
			log.debug("Ranking:\n" + DebugUtils.printRank(scores, DebugUtils.RANK_PRINT_SIZE));
			return scores;
		}
		catch (CentralityException e)
		{
			log.error("Ranking failed: " + e.getMessage());
			throw e;
		}
	}

	// Creates the ranking algorithm selected in the options
	public static KatzRanking create(Options o)
	{
		switch (o.method)
		{
			case LinearSystem:
				return new LinearSystemKatz(o.alpha, o.normalized);
			case PowerIteration:
			default:
				return new PowerIterationKatz(o.alpha, o.max_iterations, o.tolerance, o.normalized);
		}
	}
}
