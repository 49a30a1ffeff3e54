package com.github.micycle1.specrecon.admm;

/**
 * How a solve ended.
 */
public enum Termination {
	/** Every primal and dual residual fell below its tolerance. */
	CONVERGED,
	/** The outer iteration cap was reached first; the last iterate is returned. */
	BUDGET_EXHAUSTED,
	/** No split constraints: solved directly as a least-squares problem. */
	LEAST_SQUARES
}
