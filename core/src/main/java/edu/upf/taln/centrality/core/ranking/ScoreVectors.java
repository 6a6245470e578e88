package edu.upf.taln.centrality.core.ranking;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Helpers shared by ranking implementations to scale score vectors and map them back to nodes
final class ScoreVectors
{
	private ScoreVectors() {}

	// Divides every entry by the given norm. A zero norm leaves the vector untouched.
	static void scale(double[] v, double norm)
	{
		if (norm == 0.0)
			return;
		for (int i = 0; i < v.length; ++i)
			v[i] /= norm;
	}

	static <V> Map<V, Double> toScores(List<V> nodes, double[] v)
	{
		assert nodes.size() == v.length;
		final Map<V, Double> scores = new LinkedHashMap<>();
		for (int i = 0; i < v.length; ++i)
			scores.put(nodes.get(i), v[i]);
		return scores;
	}
}
