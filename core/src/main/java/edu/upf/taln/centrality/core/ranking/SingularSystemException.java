package edu.upf.taln.centrality.core.ranking;

// The linear system (I - alpha * A) x = beta has no usable solution
public class SingularSystemException extends CentralityException
{
	public SingularSystemException(String message)
	{
		super(message);
	}

	public SingularSystemException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
