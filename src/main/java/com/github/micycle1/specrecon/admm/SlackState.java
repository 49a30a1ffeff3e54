package com.github.micycle1.specrecon.admm;

/**
 * Per-constraint ADMM working vectors, all of the constraint's output length.
 * They persist across solves on the same {@link AdmmState} so later solves
 * start from warm slack and dual values.
 */
public final class SlackState {

	/** Slack variable. */
	final double[] z;
	/** Scaled dual variable. */
	final double[] u;
	/** Scratch: {@code Z - U} while assembling the right-hand side, then the constraint output. */
	final double[] g;
	final double[] zPrev;
	/** Primal residual. */
	final double[] r;
	/** Slack change since the previous iteration. */
	final double[] y;

	SlackState(int length) {
		z = new double[length];
		u = new double[length];
		g = new double[length];
		zPrev = new double[length];
		r = new double[length];
		y = new double[length];
	}

	public int length() {
		return z.length;
	}

	public double[] getSlack() {
		return z.clone();
	}

	public double[] getScaledDual() {
		return u.clone();
	}
}
