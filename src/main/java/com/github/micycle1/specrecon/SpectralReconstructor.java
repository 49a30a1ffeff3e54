package com.github.micycle1.specrecon;

import java.util.Objects;

import org.ejml.data.DMatrixSparseCSC;

import com.github.micycle1.specrecon.admm.AdmmConfig;
import com.github.micycle1.specrecon.admm.AdmmSolver;
import com.github.micycle1.specrecon.admm.AdmmState;
import com.github.micycle1.specrecon.admm.ConvergenceReport;
import com.github.micycle1.specrecon.operators.ImageSampling;
import com.github.micycle1.specrecon.operators.ProblemOperators;

/**
 * <p>
 * Reconstructs a multi-band latent image from one colour-filter-array capture.
 * </p>
 *
 * <p>
 * Key usage pattern:
 * </p>
 * <ol>
 * <li>Construct with the raw mosaic, its CFA pattern, the sensor sensitivity
 * ({@code channels x bands}, channels in r, g, b order), an optional dispersion
 * operator, the enabled prior terms and a configuration. Operators and solver
 * state are built once here.</li>
 * <li>Call {@link #reconstruct(double[])} with a weight vector whose zero
 * pattern matches the enabled terms. Repeated calls reuse the operators and
 * start from the previous slack, dual and primal values.</li>
 * <li>Optionally call {@link #resetPrimal()} between calls for a cold start of
 * the image.</li>
 * </ol>
 *
 * <p>
 * Instances are not thread-safe. Tiles of a larger image may be reconstructed
 * concurrently with one instance per tile.
 * </p>
 */
public class SpectralReconstructor {

	private final ImageSampling sampling;
	private final ProblemOperators operators;
	private final AdmmState state;

	/**
	 * @param mosaic      raw CFA samples, indexed {@code [row][col]}
	 * @param cfaPattern  four-symbol tile description, e.g. {@code "gbrg"}
	 * @param sensitivity {@code sensitivity[channel][band]}
	 * @param dispersion  optional warp operator from the latent image to the
	 *                    sensor colour image, may be null
	 * @param enabled     which of the three prior terms are active
	 */
	public SpectralReconstructor(double[][] mosaic, String cfaPattern, double[][] sensitivity, DMatrixSparseCSC dispersion, boolean[] enabled,
			AdmmConfig config) {
		Objects.requireNonNull(config, "config must not be null");
		this.sampling = samplingOf(mosaic);
		this.operators = ProblemOperators.build(sampling, sensitivity, cfaPattern, dispersion, enabled, config.isReplicateSpectralGradient());
		this.state = AdmmState.build(operators, vectorize(mosaic, sampling), enabled, config);
	}

	/** Reconstruct with these raw weights; zero entries must match the disabled terms. */
	public Reconstruction reconstruct(double[] weights) {
		double[] normalized = state.reWeight(weights);
		ConvergenceReport report = AdmmSolver.solve(state);
		return new Reconstruction(toImage(state.getPrimal(), sampling, operators.getBands()), normalized, report);
	}

	/** Zeroes the estimated image; slack and dual variables stay warm. */
	public void resetPrimal() {
		state.resetPrimal();
	}

	public ProblemOperators getOperators() {
		return operators;
	}

	public AdmmState getState() {
		return state;
	}

	static ImageSampling samplingOf(double[][] mosaic) {
		if (mosaic == null || mosaic.length == 0 || mosaic[0] == null) {
			throw new ConfigurationException("Mosaic image must be non-empty");
		}
		int cols = mosaic[0].length;
		for (double[] row : mosaic) {
			if (row == null || row.length != cols) {
				throw new ConfigurationException("Mosaic image rows must all have " + cols + " columns");
			}
		}
		return new ImageSampling(mosaic.length, cols);
	}

	static double[] vectorize(double[][] mosaic, ImageSampling s) {
		double[] j = new double[s.pixels()];
		for (int row = 0; row < s.rows; row++) {
			for (int col = 0; col < s.cols; col++) {
				j[s.index(row, col, 0)] = mosaic[row][col];
			}
		}
		return j;
	}

	static double[][][] toImage(double[] v, ImageSampling s, int bands) {
		double[][][] img = new double[s.rows][s.cols][bands];
		for (int k = 0; k < bands; k++) {
			for (int col = 0; col < s.cols; col++) {
				for (int row = 0; row < s.rows; row++) {
					img[row][col][k] = v[s.index(row, col, k)];
				}
			}
		}
		return img;
	}
}
