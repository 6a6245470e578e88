package edu.upf.taln.centrality.core;

import edu.upf.taln.centrality.core.utils.DebugUtils;

public class Options
{
	public enum Method { PowerIteration, LinearSystem }

	public double alpha = 0.1; // attenuation factor. Should be strictly less than the inverse of the largest eigenvalue of the adjacency matrix
	public double tolerance = 1.0e-6; // error tolerance per node used to check convergence of power iteration
	public int max_iterations = 1000; // maximum number of power iterations
	public boolean normalized = true; // divide scores by their L2 norm
	public Method method = Method.PowerIteration; // algorithm used to compute scores

	public Options() {}

	public Options(Options o)
	{
		this.alpha = o.alpha;
		this.tolerance = o.tolerance;
		this.max_iterations = o.max_iterations;
		this.normalized = o.normalized;
		this.method = o.method;
	}

	@Override
	public String toString()
	{
		return  "Options:" +
				"\n\talpha = " + DebugUtils.printDouble(alpha) +
				"\n\ttolerance = " + tolerance +
				"\n\tmax_iterations = " + max_iterations +
				"\n\tnormalized = " + normalized +
				"\n\tmethod = " + method;
	}
}
