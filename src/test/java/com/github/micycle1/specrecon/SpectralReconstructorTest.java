package com.github.micycle1.specrecon;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.sparse.csc.CommonOps_DSCC;
import org.junit.jupiter.api.Test;

import com.github.micycle1.specrecon.admm.AdmmConfig;
import com.github.micycle1.specrecon.admm.Termination;
import com.github.micycle1.specrecon.operators.ImageSampling;
import com.github.micycle1.specrecon.operators.LinearOperatorBuilder;

public class SpectralReconstructorTest {

	private static final double[][] RGB = { { 0.9, 0.3, 0.05 }, { 0.2, 0.8, 0.2 }, { 0.05, 0.3, 0.9 } };
	private static final double[][] GREY = { { 1.0 }, { 1.0 }, { 1.0 } };

	private static double[][] mosaic(int rows, int cols) {
		double[][] m = new double[rows][cols];
		for (int r = 0; r < rows; r++) {
			for (int c = 0; c < cols; c++) {
				m[r][c] = 0.5 + 0.4 * Math.sin(0.7 * r + 1.3 * c);
			}
		}
		return m;
	}

	@Test
	void reconstructsEveryBand() {
		SpectralReconstructor rec = new SpectralReconstructor(mosaic(6, 5), "gbrg", RGB, null, new boolean[] { true, true, false },
				AdmmConfig.builder().maxIterations(500, 2000).build());
		Reconstruction out = rec.reconstruct(new double[] { 0.01, 0.05, 0.0 });

		double[][][] image = out.getImage();
		assertEquals(6, image.length);
		assertEquals(5, image[0].length);
		assertEquals(3, image[0][0].length);
		assertEquals(Termination.CONVERGED, out.getReport().getTermination(), out.getReport().toString());

		// 30 samples; spatial operator has 2 * 30 * 3 rows, spectral 2 * 30 * 2
		assertArrayEquals(new double[] { 0.01 * 30 / 180, 0.05 * 30 / 120, 0.0 }, out.getNormalizedWeights(), 1e-15);
	}

	@Test
	void repeatedReconstructionsReuseOperators() {
		SpectralReconstructor rec = new SpectralReconstructor(mosaic(4, 4), "rggb", RGB, null, new boolean[] { true, true, false },
				AdmmConfig.builder().maxIterations(500, 40).build());
		rec.reconstruct(new double[] { 0.01, 0.05, 0.0 });
		Reconstruction second = rec.reconstruct(new double[] { 0.02, 0.01, 0.0 });
		assertTrue(second.getReport().getIterations() >= 1);

		rec.resetPrimal();
		assertArrayEquals(new double[rec.getOperators().latentLength()], rec.getState().getPrimal());

		assertThrows(ConfigurationException.class, () -> rec.reconstruct(new double[] { 0.01, 0.0, 0.0 }));
		assertThrows(ConfigurationException.class, () -> rec.reconstruct(new double[] { 0.01, -0.01, 0.0 }));
	}

	@Test
	void imageLayoutFollowsVectorization() {
		double[][] m = { { 1, 2, 3 }, { 4, 5, 6 } };
		SpectralReconstructor rec = new SpectralReconstructor(m, "rggb", GREY, null, new boolean[3],
				AdmmConfig.builder().nonNegative(false).build());
		Reconstruction out = rec.reconstruct(new double[3]);
		assertEquals(Termination.LEAST_SQUARES, out.getReport().getTermination());
		for (int r = 0; r < 2; r++) {
			for (int c = 0; c < 3; c++) {
				assertEquals(m[r][c], out.getImage()[r][c][0], 1e-12);
			}
		}
	}

	@Test
	void dispersionReplacesColourMixing() {
		ImageSampling s = new ImageSampling(4, 4);
		DMatrixSparseCSC omega = LinearOperatorBuilder.buildColorMixing(s, GREY);
		DMatrixSparseCSC phi = new DMatrixSparseCSC(omega.numRows, omega.numCols, 0);
		CommonOps_DSCC.scale(2.0, omega, phi);

		double[][] m = mosaic(4, 4);
		SpectralReconstructor rec = new SpectralReconstructor(m, "bggr", GREY, phi, new boolean[3],
				AdmmConfig.builder().nonNegative(false).build());
		assertTrue(rec.getOperators().hasDispersion());
		Reconstruction out = rec.reconstruct(new double[3]);
		for (int r = 0; r < 4; r++) {
			for (int c = 0; c < 4; c++) {
				assertEquals(m[r][c] / 2, out.getImage()[r][c][0], 1e-12);
			}
		}
	}

	@Test
	void invalidInputsAreRejected() {
		boolean[] mask = new boolean[3];
		AdmmConfig config = AdmmConfig.defaults();
		assertThrows(ConfigurationException.class, () -> new SpectralReconstructor(new double[0][], "rggb", RGB, null, mask, config));
		assertThrows(ConfigurationException.class, () -> new SpectralReconstructor(new double[][] { { 1, 2 }, { 3 } }, "rggb", RGB, null, mask, config));
		assertThrows(ConfigurationException.class, () -> new SpectralReconstructor(mosaic(2, 2), "rgbx", RGB, null, mask, config));

		DMatrixSparseCSC wrong = new DMatrixSparseCSC(5, 5, 0);
		assertThrows(ConfigurationException.class, () -> new SpectralReconstructor(mosaic(2, 2), "rggb", RGB, wrong, mask, config));
	}
}
