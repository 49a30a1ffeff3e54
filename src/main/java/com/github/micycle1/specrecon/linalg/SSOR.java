package com.github.micycle1.specrecon.linalg;

/**
 * Symmetric successive over-relaxation preconditioner. For a symmetric A the
 * operator is symmetric positive definite whenever 0 &lt; omega &lt; 2, so it
 * can be used with conjugate gradients.
 */
public class SSOR implements Preconditioner {
	final int n;
	final int[] rp, ci;
	final double[] a;
	final double[] Dinv;
	final double omega; // e.g., 1.2

	public SSOR(SparseCSR A, double omega) {
		if (!(omega > 0.0 && omega < 2.0)) {
			throw new IllegalArgumentException("SSOR relaxation must lie in (0, 2), got " + omega);
		}
		this.n = A.n;
		this.rp = A.rowPtr;
		this.ci = A.colIdx;
		this.a = A.val;
		this.omega = omega;
		this.Dinv = new double[n];
		for (int i = 0; i < n; i++) {
			double d = 0.0;
			for (int p = rp[i]; p < rp[i + 1]; p++) {
				if (ci[p] == i) {
					d = a[p];
					break;
				}
			}
			if (Math.abs(d) < 1e-14) {
				d = (d >= 0 ? 1e-14 : -1e-14);
			}
			Dinv[i] = 1.0 / d;
		}
	}

	// z = M^{-1} r with M = (D/ω + L) (D/ω)^{-1} (D/ω + U)
	@Override
	public void apply(double[] r, double[] z) {
		double[] y = z; // reuse output buffer
		// Forward: (D/ω + L) y = r
		for (int i = 0; i < n; i++) {
			double sum = r[i];
			for (int p = rp[i]; p < rp[i + 1]; p++) {
				int j = ci[p];
				if (j < i) {
					sum -= a[p] * y[j];
				}
			}
			y[i] = sum * (omega * Dinv[i]);
		}
		// Middle: y <- (D/ω) y
		for (int i = 0; i < n; i++) {
			y[i] /= omega * Dinv[i];
		}
		// Backward: (D/ω + U) z = y
		for (int i = n - 1; i >= 0; i--) {
			double sum = y[i];
			for (int p = rp[i]; p < rp[i + 1]; p++) {
				int j = ci[p];
				if (j > i) {
					sum -= a[p] * z[j];
				}
			}
			z[i] = sum * (omega * Dinv[i]);
		}
	}
}
