package com.github.micycle1.specrecon.admm;

import java.util.Arrays;

/**
 * Stopping test of Boyd et al. 2011, section 3.3.1, applied per constraint
 * slot. For a slot with constraint {@code G I = Z} of output length {@code p}
 * acting on a latent image of length {@code n}:
 *
 * <pre>
 * ||R|| &lt;= sqrt(p) eps_abs + eps_rel max(||G I||, ||Z||)
 * ||S|| &lt;= sqrt(n) eps_abs + eps_rel ||rho G^T U||
 * </pre>
 *
 * An iteration converges when every slot passes both tests.
 */
public final class ConvergenceMonitor {

	private final double absoluteTolerance;
	private final double relativeTolerance;

	private boolean allPassed;
	private double primalSum;
	private double dualSum;
	private double[] history = new double[16];
	private int iterations;

	public ConvergenceMonitor(double absoluteTolerance, double relativeTolerance) {
		this.absoluteTolerance = absoluteTolerance;
		this.relativeTolerance = relativeTolerance;
	}

	public void beginIteration() {
		allPassed = true;
		primalSum = 0.0;
		dualSum = 0.0;
	}

	/**
	 * @param outputLength   p, length of the slack vector
	 * @param latentLength   n, length of the primal image
	 * @param primalResidual ||G I - Z||
	 * @param dualResidual   ||rho G^T (Z - Z_prev)||
	 * @param outputNorm     ||G I||
	 * @param slackNorm      ||Z||
	 * @param dualNorm       ||rho G^T U||
	 * @return whether this slot passes both tests
	 */
	public boolean record(int outputLength, int latentLength, double primalResidual, double dualResidual, double outputNorm, double slackNorm,
			double dualNorm) {
		double primalTol = Math.sqrt(outputLength) * absoluteTolerance + relativeTolerance * Math.max(outputNorm, slackNorm);
		double dualTol = Math.sqrt(latentLength) * absoluteTolerance + relativeTolerance * dualNorm;
		boolean passed = primalResidual <= primalTol && dualResidual <= dualTol;
		allPassed &= passed;
		primalSum += primalResidual;
		dualSum += dualResidual;
		return passed;
	}

	/** @return whether every slot recorded since {@link #beginIteration()} passed */
	public boolean endIteration() {
		if (iterations == history.length) {
			history = Arrays.copyOf(history, 2 * history.length);
		}
		history[iterations++] = primalSum + dualSum;
		return allPassed;
	}

	public double getPrimalResidual() {
		return primalSum;
	}

	public double getDualResidual() {
		return dualSum;
	}

	/** Combined primal + dual residual norm per completed iteration. */
	public double[] getHistory() {
		return Arrays.copyOf(history, iterations);
	}

	public int getIterations() {
		return iterations;
	}
}
