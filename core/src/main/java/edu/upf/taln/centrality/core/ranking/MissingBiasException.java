package edu.upf.taln.centrality.core.ranking;

public class MissingBiasException extends CentralityException
{
	private final Object node;

	public MissingBiasException(Object node)
	{
		super("No bias value for node " + node);
		this.node = node;
	}

	public Object getNode()
	{
		return node;
	}
}
