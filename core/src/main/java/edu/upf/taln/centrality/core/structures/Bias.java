package edu.upf.taln.centrality.core.structures;

import com.google.common.base.Preconditions;
import edu.upf.taln.centrality.core.ranking.MissingBiasException;

import java.util.*;

/**
 * Additive bias term of Katz centrality, given either as a single value shared by all nodes, as a list of values
 * aligned with the order in which a graph lists its nodes, or as an explicit value for each node.
 * Whatever its shape, a bias is resolved once into a per-node mapping before any ranking takes place.
 * Immutable class.
 */
public final class Bias<V>
{
	public enum Type { Scalar, Sequence, Mapping }

	private final Type type;
	private final double value; // Scalar
	private final List<Double> values; // Sequence
	private final Map<V, Double> mapping; // Mapping

	private Bias(Type type, double value, List<Double> values, Map<V, Double> mapping)
	{
		this.type = type;
		this.value = value;
		this.values = values;
		this.mapping = mapping;
	}

	public static <V> Bias<V> of(double value)
	{
		return new Bias<>(Type.Scalar, value, List.of(), Map.of());
	}

	public static <V> Bias<V> of(List<Double> values)
	{
		Preconditions.checkNotNull(values, "Bias values cannot be null");
		return new Bias<>(Type.Sequence, 0.0, Collections.unmodifiableList(new ArrayList<>(values)), Map.of());
	}

	public static <V> Bias<V> of(Map<V, Double> mapping)
	{
		Preconditions.checkNotNull(mapping, "Bias mapping cannot be null");
		return new Bias<>(Type.Mapping, 0.0, List.of(), Collections.unmodifiableMap(new HashMap<>(mapping)));
	}

	public Type getType() { return type; }

	/**
	 * Maps each node to its bias value.
	 * @param nodes the nodes of a graph, in the graph's iteration order
	 * @return a map with exactly one entry per node
	 * @throws MissingBiasException if the bias has no value for one of the nodes
	 */
	public Map<V, Double> resolve(List<V> nodes)
	{
		final Map<V, Double> resolved = new LinkedHashMap<>();
		switch (type)
		{
			case Scalar:
				nodes.forEach(n -> resolved.put(n, value));
				break;
			case Sequence:
				Preconditions.checkArgument(values.size() <= nodes.size(),
						"%s bias values given for %s nodes", values.size(), nodes.size());
				for (int i = 0; i < nodes.size(); ++i)
				{
					if (i >= values.size() || values.get(i) == null)
						throw new MissingBiasException(nodes.get(i));
					resolved.put(nodes.get(i), values.get(i));
				}
				break;
			case Mapping:
				for (V n : nodes)
				{
					final Double b = mapping.get(n);
					if (b == null)
						throw new MissingBiasException(n);
					resolved.put(n, b);
				}
				break;
		}

		return resolved;
	}

	// Same as resolve, but as a column of values in node order
	public double[] resolveVector(List<V> nodes)
	{
		final Map<V, Double> resolved = resolve(nodes);
		return nodes.stream()
				.mapToDouble(resolved::get)
				.toArray();
	}

	@Override
	public String toString()
	{
		switch (type)
		{
			case Scalar:
				return "Bias " + value;
			case Sequence:
				return "Bias " + values;
			default:
				return "Bias " + mapping;
		}
	}
}
