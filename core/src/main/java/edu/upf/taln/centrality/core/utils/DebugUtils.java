package edu.upf.taln.centrality.core.utils;

import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.Map;
import java.util.Map.Entry;

import static java.util.stream.Collectors.joining;

public class DebugUtils
{
	public static final int RANK_PRINT_SIZE = 10;

	private final static NumberFormat double_format = NumberFormat.getInstance();
	static {
		double_format.setRoundingMode(RoundingMode.UP);
		double_format.setMaximumFractionDigits(4);
		double_format.setMinimumFractionDigits(4);
	}

	public static synchronized String printDouble(double w) { return double_format.format(w); }

	// Lists the highest scored nodes, one per line
	public static <V> String printRank(Map<V, Double> scores, int max_size)
	{
		return scores.entrySet().stream()
				.sorted(Entry.<V, Double>comparingByValue().reversed())
				.limit(max_size)
				.map(e -> "\t" + e.getKey() + " " + printDouble(e.getValue()))
				.collect(joining("\n"));
	}
}
