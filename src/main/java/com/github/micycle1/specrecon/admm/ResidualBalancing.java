package com.github.micycle1.specrecon.admm;

import com.github.micycle1.specrecon.ConfigurationException;

/**
 * Residual balancing (Boyd et al. 2011, section 3.4.1): raise the penalty when
 * the primal residual dominates the dual residual by more than {@code mu},
 * lower it in the opposite case.
 */
public final class ResidualBalancing implements PenaltyUpdateStrategy {

	private final double increase;
	private final double decrease;
	private final double mu;

	/**
	 * @param increase  tau_incr, factor applied when the primal residual dominates
	 * @param decrease  tau_decr, divisor applied when the dual residual dominates
	 * @param threshold mu, the tolerated ratio between the two residual norms
	 */
	public ResidualBalancing(double increase, double decrease, double threshold) {
		if (!(increase > 1.0) || !(decrease > 1.0)) {
			throw new ConfigurationException("Penalty increase/decrease factors must exceed 1, got " + increase + ", " + decrease);
		}
		if (!(threshold > 1.0)) {
			throw new ConfigurationException("Residual imbalance threshold must exceed 1, got " + threshold);
		}
		this.increase = increase;
		this.decrease = decrease;
		this.mu = threshold;
	}

	@Override
	public double update(double primalResidual, double dualResidual, double rho) {
		if (primalResidual > mu * dualResidual) {
			return increase;
		}
		if (dualResidual > mu * primalResidual) {
			return 1.0 / decrease;
		}
		return 1.0;
	}

	public double getIncrease() {
		return increase;
	}

	public double getDecrease() {
		return decrease;
	}

	public double getThreshold() {
		return mu;
	}

	@Override
	public String toString() {
		return "ResidualBalancing{increase=" + increase + ", decrease=" + decrease + ", mu=" + mu + "}";
	}
}
