package com.github.micycle1.specrecon.linalg;

/**
 * Outcome of one iterative linear solve. Not reaching the tolerance is a normal
 * outcome here; the solution vector passed to the solver holds the best
 * iterate either way.
 */
public final class SolveResult {

	private final boolean converged;
	private final int iters;
	private final double relResidual;
	private final String breakdown; // null if OK

	private SolveResult(boolean converged, int iters, double relResidual, String breakdown) {
		this.converged = converged;
		this.iters = iters;
		this.relResidual = relResidual;
		this.breakdown = breakdown;
	}

	static SolveResult converged(int iters, double relResidual) {
		return new SolveResult(true, iters, relResidual, null);
	}

	/** @param breakdown reason the recurrence stopped early, null when the cap was hit */
	static SolveResult stopped(int iters, double relResidual, String breakdown) {
		return new SolveResult(false, iters, relResidual, breakdown);
	}

	public boolean isConverged() {
		return converged;
	}

	public int getIterations() {
		return iters;
	}

	public double getRelativeResidual() {
		return relResidual;
	}

	public String getBreakdown() {
		return breakdown;
	}

	@Override
	public String toString() {
		return "SolveResult{converged=" + converged + ", iters=" + iters + ", relResidual=" + relResidual
				+ (breakdown != null ? ", breakdown=" + breakdown : "") + "}";
	}
}
