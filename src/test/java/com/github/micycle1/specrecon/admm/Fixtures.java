package com.github.micycle1.specrecon.admm;

import com.github.micycle1.specrecon.operators.ImageSampling;
import com.github.micycle1.specrecon.operators.ProblemOperators;

final class Fixtures {

	/** One band seen identically by every channel: M * Omega is the identity. */
	static final double[][] GREY = { { 1.0 }, { 1.0 }, { 1.0 } };

	static final double[][] RGB = { { 0.9, 0.3, 0.05 }, { 0.2, 0.8, 0.2 }, { 0.05, 0.3, 0.9 } };

	private Fixtures() {
	}

	static double[] smoothMosaic(ImageSampling s) {
		double[] j = new double[s.pixels()];
		for (int c = 0; c < s.cols; c++) {
			for (int r = 0; r < s.rows; r++) {
				j[s.index(r, c, 0)] = 0.5 + 0.4 * Math.sin(0.7 * r + 1.3 * c);
			}
		}
		return j;
	}

	static double[] ramp(int n) {
		double[] j = new double[n];
		for (int i = 0; i < n; i++) {
			j[i] = i + 1.0;
		}
		return j;
	}

	static ProblemOperators operators(ImageSampling s, double[][] sensitivity, String cfa, boolean[] enabled) {
		return ProblemOperators.build(s, sensitivity, cfa, null, enabled, false);
	}

	static double min(double[] v) {
		double m = Double.POSITIVE_INFINITY;
		for (double x : v) {
			m = Math.min(m, x);
		}
		return m;
	}
}
