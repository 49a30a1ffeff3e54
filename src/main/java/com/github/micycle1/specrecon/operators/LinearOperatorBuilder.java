package com.github.micycle1.specrecon.operators;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.ejml.sparse.csc.CommonOps_DSCC;

import com.github.micycle1.specrecon.ConfigurationException;

/**
 * <p>
 * Builds the fixed sparse operators of the image formation model: colour
 * mixing (Omega), dispersion-aware colour mixing (Omega_Phi), CFA sampling (M)
 * and the regularization operators G_k.
 * </p>
 *
 * <p>
 * All operators act on vectorized images laid out as described by
 * {@link ImageSampling}. Matrices are assembled in triplet form and converted to
 * CSC once; no builder emits duplicate entries.
 * </p>
 */
public final class LinearOperatorBuilder {

	private LinearOperatorBuilder() {
	}

	/**
	 * Colour space conversion from a latent image with {@code bands} bands to a
	 * sensor image with {@code channels} channels, where
	 * {@code sensitivity[channel][band]} is the response of a channel to a band.
	 * Equivalent to {@code kron(sensitivity, speye(pixels))}.
	 */
	public static DMatrixSparseCSC buildColorMixing(ImageSampling sampling, double[][] sensitivity) {
		checkSensitivity(sensitivity);
		final int px = sampling.pixels();
		final int channels = sensitivity.length;
		final int bands = sensitivity[0].length;

		int nonZero = 0;
		for (double[] row : sensitivity) {
			for (double s : row) {
				if (s != 0.0) {
					nonZero++;
				}
			}
		}

		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(px * channels, px * bands, nonZero * px);
		for (int c = 0; c < channels; c++) {
			for (int b = 0; b < bands; b++) {
				double s = sensitivity[c][b];
				if (s == 0.0) {
					continue;
				}
				for (int p = 0; p < px; p++) {
					tr.addItem(c * px + p, b * px + p, s);
				}
			}
		}
		return DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
	}

	/**
	 * Colour conversion including dispersion. Without a dispersion operator this
	 * is the plain colour mixing matrix; otherwise the dispersion operator itself,
	 * which already maps latent bands to sensor channels, after checking its
	 * shape against Omega.
	 */
	public static DMatrixSparseCSC buildDispersion(ImageSampling sampling, double[][] sensitivity, DMatrixSparseCSC dispersion) {
		DMatrixSparseCSC omega = buildColorMixing(sampling, sensitivity);
		return buildDispersion(sampling, omega, sensitivity[0].length, dispersion);
	}

	static DMatrixSparseCSC buildDispersion(ImageSampling sampling, DMatrixSparseCSC omega, int bands, DMatrixSparseCSC dispersion) {
		if (dispersion == null) {
			return omega;
		}
		if (dispersion.numRows != omega.numRows) {
			throw new ConfigurationException("Dispersion operator must have as many rows as the colour conversion operator ("
					+ omega.numRows + "), got " + dispersion.numRows);
		}
		int latentLength = sampling.pixels() * bands;
		if (dispersion.numCols != latentLength) {
			throw new ConfigurationException(
					"Dispersion operator must have as many columns as the latent image (" + latentLength + "), got " + dispersion.numCols);
		}
		return dispersion;
	}

	/**
	 * Mosaicking operator mapping a full three-channel image to the single-channel
	 * CFA image: one unit entry per pixel, in the column of the channel the CFA
	 * samples there.
	 */
	public static DMatrixSparseCSC buildSampling(ImageSampling sampling, String cfaPattern) {
		return buildSampling(sampling, CfaPattern.parse(cfaPattern));
	}

	public static DMatrixSparseCSC buildSampling(ImageSampling sampling, CfaPattern cfa) {
		final int px = sampling.pixels();
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(px, px * CfaPattern.CHANNELS, px);
		for (int col = 0; col < sampling.cols; col++) {
			for (int row = 0; row < sampling.rows; row++) {
				int p = sampling.index(row, col, 0);
				tr.addItem(p, cfa.channelAt(row, col) * px + p, 1.0);
			}
		}
		return DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
	}

	/**
	 * Regularization operator for one prior term.
	 *
	 * @param replicateSpectral only used by {@link PriorTerm#SPECTRAL_GRADIENT}:
	 *                          if true the spectral difference covers every band,
	 *                          the last band repeating the difference of the band
	 *                          before it
	 */
	public static DMatrixSparseCSC buildGradient(PriorTerm term, ImageSampling sampling, int bands, boolean replicateSpectral) {
		if (bands <= 0) {
			throw new ConfigurationException("Number of bands must be positive, got " + bands);
		}
		switch (term) {
			case SPATIAL_GRADIENT:
				return spatialGradient(sampling, bands);
			case SPECTRAL_GRADIENT:
				return spectralOfSpatialGradient(sampling, bands, replicateSpectral);
			case SPATIAL_LAPLACIAN:
				return spatialLaplacian(sampling, bands);
			default:
				throw new IllegalArgumentException("Unknown prior term " + term);
		}
	}

	// [G_x; G_y], forward differences, zero rows on the last column/row
	static DMatrixSparseCSC spatialGradient(ImageSampling s, int bands) {
		final int n = s.pixels() * bands;
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(2 * n, n, 4 * n);
		for (int k = 0; k < bands; k++) {
			for (int col = 0; col < s.cols; col++) {
				for (int row = 0; row < s.rows; row++) {
					int i = s.index(row, col, k);
					if (col + 1 < s.cols) {
						tr.addItem(i, i, -1.0);
						tr.addItem(i, s.index(row, col + 1, k), 1.0);
					}
					if (row + 1 < s.rows) {
						tr.addItem(n + i, i, -1.0);
						tr.addItem(n + i, s.index(row + 1, col, k), 1.0);
					}
				}
			}
		}
		return DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
	}

	// Forward differences between adjacent bands
	static DMatrixSparseCSC spectralGradient(ImageSampling s, int bands, boolean replicate) {
		if (bands < 2) {
			throw new ConfigurationException("Spectral regularization needs at least two bands, got " + bands);
		}
		final int px = s.pixels();
		final int outBands = replicate ? bands : bands - 1;
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(px * outBands, px * bands, 2 * px * outBands);
		for (int k = 0; k < outBands; k++) {
			int from = Math.min(k, bands - 2);
			for (int p = 0; p < px; p++) {
				tr.addItem(k * px + p, from * px + p, -1.0);
				tr.addItem(k * px + p, (from + 1) * px + p, 1.0);
			}
		}
		return DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
	}

	// blkdiag(G_lambda, G_lambda) * [G_x; G_y]
	static DMatrixSparseCSC spectralOfSpatialGradient(ImageSampling s, int bands, boolean replicate) {
		DMatrixSparseCSC gLambda = spectralGradient(s, bands, replicate);
		DMatrixSparseCSC gXY = spatialGradient(s, bands);

		final int r = gLambda.numRows, c = gLambda.numCols;
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(2 * r, 2 * c, 2 * gLambda.nz_length);
		for (int j = 0; j < c; j++) {
			for (int p = gLambda.col_idx[j]; p < gLambda.col_idx[j + 1]; p++) {
				int i = gLambda.nz_rows[p];
				double v = gLambda.nz_values[p];
				tr.addItem(i, j, v);
				tr.addItem(r + i, c + j, v);
			}
		}
		DMatrixSparseCSC blk = DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);

		DMatrixSparseCSC out = new DMatrixSparseCSC(blk.numRows, gXY.numCols, 0);
		CommonOps_DSCC.mult(blk, gXY, out);
		return out;
	}

	// 5-point stencil, Neumann boundary
	static DMatrixSparseCSC spatialLaplacian(ImageSampling s, int bands) {
		final int n = s.pixels() * bands;
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(n, n, 5 * n);
		for (int k = 0; k < bands; k++) {
			for (int col = 0; col < s.cols; col++) {
				for (int row = 0; row < s.rows; row++) {
					int i = s.index(row, col, k);
					int neighbours = 0;
					if (row > 0) {
						tr.addItem(i, s.index(row - 1, col, k), 1.0);
						neighbours++;
					}
					if (row + 1 < s.rows) {
						tr.addItem(i, s.index(row + 1, col, k), 1.0);
						neighbours++;
					}
					if (col > 0) {
						tr.addItem(i, s.index(row, col - 1, k), 1.0);
						neighbours++;
					}
					if (col + 1 < s.cols) {
						tr.addItem(i, s.index(row, col + 1, k), 1.0);
						neighbours++;
					}
					if (neighbours > 0) {
						tr.addItem(i, i, -neighbours);
					}
				}
			}
		}
		return DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
	}

	static void checkSensitivity(double[][] sensitivity) {
		if (sensitivity == null || sensitivity.length == 0 || sensitivity[0] == null || sensitivity[0].length == 0) {
			throw new ConfigurationException("Sensitivity matrix must be non-empty");
		}
		int bands = sensitivity[0].length;
		for (double[] row : sensitivity) {
			if (row == null || row.length != bands) {
				throw new ConfigurationException("Sensitivity matrix rows must all have " + bands + " bands");
			}
			for (double s : row) {
				if (!Double.isFinite(s)) {
					throw new ConfigurationException("Sensitivity matrix contains a non-finite value");
				}
			}
		}
	}
}
