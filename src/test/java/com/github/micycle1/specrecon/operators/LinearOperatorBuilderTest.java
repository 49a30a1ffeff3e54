package com.github.micycle1.specrecon.operators;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.ejml.data.DMatrixSparseCSC;
import org.junit.jupiter.api.Test;

import com.github.micycle1.specrecon.ConfigurationException;
import com.github.micycle1.specrecon.linalg.SparseOps;

public class LinearOperatorBuilderTest {

	private static final double[][] SENSITIVITY = { { 0.9, 0.3, 0.0 }, { 0.2, 0.8, 0.2 }, { 0.0, 0.3, 0.9 } };

	private static double[] image(ImageSampling s, int bands) {
		double[] v = new double[s.pixels() * bands];
		for (int k = 0; k < bands; k++) {
			for (int c = 0; c < s.cols; c++) {
				for (int r = 0; r < s.rows; r++) {
					v[s.index(r, c, k)] = 1.0 + r + 10.0 * c + 100.0 * k;
				}
			}
		}
		return v;
	}

	@Test
	void colorMixingAppliesSensitivityPerPixel() {
		ImageSampling s = new ImageSampling(3, 2);
		DMatrixSparseCSC omega = LinearOperatorBuilder.buildColorMixing(s, SENSITIVITY);
		assertEquals(18, omega.numRows);
		assertEquals(18, omega.numCols);
		// two zero sensitivities are not stored
		assertEquals(7 * 6, omega.nz_length);

		double[] latent = image(s, 3);
		double[] sensor = new double[18];
		SparseOps.mult(omega, latent, sensor);
		int p = s.index(2, 1, 0);
		for (int ch = 0; ch < 3; ch++) {
			double expected = 0.0;
			for (int k = 0; k < 3; k++) {
				expected += SENSITIVITY[ch][k] * latent[s.index(2, 1, k)];
			}
			assertEquals(expected, sensor[ch * s.pixels() + p], 1e-12);
		}
	}

	@Test
	void dispersionDefaultsToColorMixing() {
		ImageSampling s = new ImageSampling(2, 2);
		DMatrixSparseCSC omega = LinearOperatorBuilder.buildColorMixing(s, SENSITIVITY);
		assertSame(omega, LinearOperatorBuilder.buildDispersion(s, omega, 3, null));

		DMatrixSparseCSC warp = new DMatrixSparseCSC(12, 12, 0);
		assertSame(warp, LinearOperatorBuilder.buildDispersion(s, SENSITIVITY, warp));
	}

	@Test
	void dispersionShapeIsValidated() {
		ImageSampling s = new ImageSampling(2, 2);
		assertThrows(ConfigurationException.class, () -> LinearOperatorBuilder.buildDispersion(s, SENSITIVITY, new DMatrixSparseCSC(11, 12, 0)));
		assertThrows(ConfigurationException.class, () -> LinearOperatorBuilder.buildDispersion(s, SENSITIVITY, new DMatrixSparseCSC(12, 8, 0)));
	}

	@Test
	void samplingPicksCfaChannel() {
		ImageSampling s = new ImageSampling(4, 4);
		DMatrixSparseCSC m = LinearOperatorBuilder.buildSampling(s, "gbrg");
		assertEquals(16, m.numRows);
		assertEquals(48, m.numCols);
		assertEquals(16, m.nz_length);

		// full colour image where channel ch has value ch + 1 everywhere
		double[] full = new double[48];
		for (int ch = 0; ch < 3; ch++) {
			for (int p = 0; p < 16; p++) {
				full[ch * 16 + p] = ch + 1;
			}
		}
		double[] raw = new double[16];
		SparseOps.mult(m, full, raw);
		assertEquals(2.0, raw[s.index(0, 0, 0)]); // g
		assertEquals(3.0, raw[s.index(0, 1, 0)]); // b
		assertEquals(1.0, raw[s.index(1, 0, 0)]); // r
		assertEquals(2.0, raw[s.index(3, 3, 0)]); // g
	}

	@Test
	void unknownCfaPatternIsFatal() {
		assertThrows(ConfigurationException.class, () -> LinearOperatorBuilder.buildSampling(new ImageSampling(2, 2), "rgbw"));
	}

	@Test
	void spatialGradientShapeAndValues() {
		ImageSampling s = new ImageSampling(3, 4);
		DMatrixSparseCSC g = LinearOperatorBuilder.buildGradient(PriorTerm.SPATIAL_GRADIENT, s, 2, false);
		int n = s.pixels() * 2;
		assertEquals(2 * n, g.numRows);
		assertEquals(n, g.numCols);

		double[] v = image(s, 2);
		double[] out = new double[2 * n];
		SparseOps.mult(g, v, out);
		// x-gradient is 10 per column step, y-gradient 1 per row step, zero on the far border
		assertEquals(10.0, out[s.index(1, 0, 1)], 1e-12);
		assertEquals(0.0, out[s.index(1, 3, 1)], 1e-12);
		assertEquals(1.0, out[n + s.index(0, 2, 0)], 1e-12);
		assertEquals(0.0, out[n + s.index(2, 2, 0)], 1e-12);
	}

	@Test
	void constantImageHasNoGradientOrCurvature() {
		ImageSampling s = new ImageSampling(4, 5);
		int bands = 3;
		double[] c = new double[s.pixels() * bands];
		Arrays.fill(c, 7.5);
		for (PriorTerm term : PriorTerm.values()) {
			DMatrixSparseCSC g = LinearOperatorBuilder.buildGradient(term, s, bands, true);
			double[] out = new double[g.numRows];
			SparseOps.mult(g, c, out);
			assertArrayEquals(new double[g.numRows], out, 1e-12, term.name());
		}
	}

	@Test
	void spectralGradientSizeDependsOnReplication() {
		ImageSampling s = new ImageSampling(2, 3);
		int px = s.pixels();
		DMatrixSparseCSC partial = LinearOperatorBuilder.buildGradient(PriorTerm.SPECTRAL_GRADIENT, s, 4, false);
		DMatrixSparseCSC full = LinearOperatorBuilder.buildGradient(PriorTerm.SPECTRAL_GRADIENT, s, 4, true);
		assertEquals(2 * px * 3, partial.numRows);
		assertEquals(2 * px * 4, full.numRows);
		assertEquals(px * 4, full.numCols);
	}

	@Test
	void spectralGradientOfSpatialGradient() {
		ImageSampling s = new ImageSampling(3, 3);
		int px = s.pixels();
		// band k is k times a horizontal ramp: spectral difference of the x-gradient is the ramp slope
		double[] v = new double[px * 3];
		for (int k = 0; k < 3; k++) {
			for (int c = 0; c < 3; c++) {
				for (int r = 0; r < 3; r++) {
					v[s.index(r, c, k)] = k * 2.0 * c;
				}
			}
		}
		DMatrixSparseCSC g = LinearOperatorBuilder.buildGradient(PriorTerm.SPECTRAL_GRADIENT, s, 3, true);
		double[] out = new double[g.numRows];
		SparseOps.mult(g, v, out);
		// x part: rows [0, 3 px), y part: rows [3 px, 6 px)
		assertEquals(2.0, out[s.index(0, 0, 0)], 1e-12);
		assertEquals(2.0, out[s.index(1, 1, 2)], 1e-12); // replicated last band
		assertEquals(0.0, out[s.index(1, 2, 1)], 1e-12); // border column
		assertEquals(0.0, out[3 * px + s.index(0, 0, 0)], 1e-12);
	}

	@Test
	void spectralGradientNeedsTwoBands() {
		assertThrows(ConfigurationException.class,
				() -> LinearOperatorBuilder.buildGradient(PriorTerm.SPECTRAL_GRADIENT, new ImageSampling(2, 2), 1, true));
	}

	@Test
	void laplacianOfQuadratic() {
		ImageSampling s = new ImageSampling(5, 5);
		double[] v = new double[s.pixels()];
		for (int c = 0; c < 5; c++) {
			for (int r = 0; r < 5; r++) {
				v[s.index(r, c, 0)] = r * r + c * c;
			}
		}
		DMatrixSparseCSC l = LinearOperatorBuilder.buildGradient(PriorTerm.SPATIAL_LAPLACIAN, s, 1, false);
		assertEquals(25, l.numRows);
		double[] out = new double[25];
		SparseOps.mult(l, v, out);
		assertEquals(4.0, out[s.index(2, 2, 0)], 1e-12);
		// corner: neighbours (1,0) and (0,1) only
		assertEquals(2.0, out[s.index(0, 0, 0)], 1e-12);
	}
}
