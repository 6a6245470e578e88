package edu.upf.taln.centrality.core.ranking;

// Base class of all failures raised while computing centrality scores
public class CentralityException extends RuntimeException
{
	public CentralityException(String message)
	{
		super(message);
	}

	public CentralityException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
