package edu.upf.taln.centrality.core.ranking;

public class ConvergenceException extends CentralityException
{
	private final int iterations;

	public ConvergenceException(int iterations)
	{
		super("Power iteration failed to converge in " + iterations + " iterations");
		this.iterations = iterations;
	}

	// Number of iterations run before giving up
	public int getIterations()
	{
		return iterations;
	}
}
