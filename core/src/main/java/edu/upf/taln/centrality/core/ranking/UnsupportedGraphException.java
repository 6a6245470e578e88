package edu.upf.taln.centrality.core.ranking;

/**
 * Raised when a graph allows parallel edges between the same pair of nodes.
 * Katz scores are only defined here for simple graphs, so such graphs are rejected before any node is read.
 */
public class UnsupportedGraphException extends CentralityException
{
	public UnsupportedGraphException(String message)
	{
		super(message);
	}
}
