package com.github.micycle1.specrecon;

import com.github.micycle1.specrecon.admm.ConvergenceReport;

/**
 * Result of one reconstruction: the latent image indexed
 * {@code [row][col][band]}, the normalised weights that were applied, and how
 * the solver terminated.
 */
public final class Reconstruction {

	private final double[][][] image;
	private final double[] weights;
	private final ConvergenceReport report;

	Reconstruction(double[][][] image, double[] weights, ConvergenceReport report) {
		this.image = image;
		this.weights = weights;
		this.report = report;
	}

	public double[][][] getImage() {
		return image;
	}

	public double[] getNormalizedWeights() {
		return weights.clone();
	}

	public ConvergenceReport getReport() {
		return report;
	}
}
