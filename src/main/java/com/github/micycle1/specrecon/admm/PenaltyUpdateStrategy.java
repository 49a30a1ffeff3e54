package com.github.micycle1.specrecon.admm;

/**
 * Rule for varying one ADMM penalty parameter between iterations. The solver
 * multiplies the penalty by the returned factor and divides the scaled dual
 * variable by it, so the unscaled dual {@code rho * U} and the fixed point are
 * unchanged.
 */
@FunctionalInterface
public interface PenaltyUpdateStrategy {

	/**
	 * @param primalResidual norm of the primal residual of the slot
	 * @param dualResidual   norm of the dual residual of the slot
	 * @param rho            current penalty of the slot
	 * @return factor to scale {@code rho} by, {@code 1} to leave it unchanged
	 */
	double update(double primalResidual, double dualResidual, double rho);
}
