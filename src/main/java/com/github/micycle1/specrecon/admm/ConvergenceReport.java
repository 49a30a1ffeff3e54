package com.github.micycle1.specrecon.admm;

import java.util.Arrays;

/**
 * Outcome of one {@link AdmmSolver#solve(AdmmState)} call. Non-convergence is
 * reported here rather than thrown, so a caller such as a weight search can
 * decide whether to retry with other settings.
 */
public final class ConvergenceReport {

	private final Termination termination;
	private final int iterations;
	private final int innerFailures;
	private final double primalResidual;
	private final double dualResidual;
	private final double[] history;
	private final double[] rho;

	ConvergenceReport(Termination termination, int iterations, int innerFailures, double primalResidual, double dualResidual, double[] history,
			double[] rho) {
		this.termination = termination;
		this.iterations = iterations;
		this.innerFailures = innerFailures;
		this.primalResidual = primalResidual;
		this.dualResidual = dualResidual;
		this.history = history;
		this.rho = rho;
	}

	public Termination getTermination() {
		return termination;
	}

	public boolean isConverged() {
		return termination != Termination.BUDGET_EXHAUSTED && innerFailures == 0;
	}

	/** Outer ADMM iterations performed, 0 for a direct least-squares solve. */
	public int getIterations() {
		return iterations;
	}

	/** Number of inner linear solves that stopped at their iteration cap. */
	public int getInnerFailures() {
		return innerFailures;
	}

	/** Sum over slots of the final primal residual norms. */
	public double getPrimalResidual() {
		return primalResidual;
	}

	/** Sum over slots of the final dual residual norms. */
	public double getDualResidual() {
		return dualResidual;
	}

	public double[] getResidualHistory() {
		return history.clone();
	}

	/** Penalties at the end of the solve, after any adaptation. */
	public double[] getRho() {
		return rho.clone();
	}

	@Override
	public String toString() {
		return "ConvergenceReport{" + termination + ", iterations=" + iterations + ", innerFailures=" + innerFailures + ", primal="
				+ primalResidual + ", dual=" + dualResidual + ", rho=" + Arrays.toString(rho) + "}";
	}
}
