package com.github.micycle1.specrecon.linalg;

import static com.github.micycle1.specrecon.linalg.Preconditioner.applyOrCopy;
import static com.github.micycle1.specrecon.linalg.SparseOps.dot;
import static com.github.micycle1.specrecon.linalg.SparseOps.finite;
import static com.github.micycle1.specrecon.linalg.SparseOps.norm2;
import static com.github.micycle1.specrecon.linalg.SparseOps.residual;

import java.util.Arrays;

/**
 * Right-preconditioned BiCGStab (van der Vorst) for general square systems
 * A x = b in CSR format. The alternative inner solver of the ADMM primal step;
 * unlike {@link ConjugateGradientSolver} it does not need A to be symmetric.
 * <p>
 * Warm-started from {@code x}, which holds the best iterate on return.
 */
public final class BiCGStabSolver {

	private static final double TINY = 1e-300;

	private BiCGStabSolver() {
	}

	public static SolveResult solve(SparseCSR A, double[] b, double[] x, double tol, int maxIters, Preconditioner precond) {
		final int n = A.n;
		double bnorm = norm2(b);
		if (bnorm == 0.0) {
			Arrays.fill(x, 0.0);
			return SolveResult.converged(0, 0.0);
		}

		double[] r = new double[n];
		residual(A, b, x, r);
		double rel = norm2(r) / bnorm;
		if (rel <= tol) {
			return SolveResult.converged(0, rel);
		}

		double[] shadow = r.clone(); // fixed shadow residual
		double[] p = new double[n];
		double[] v = new double[n];
		double[] s = new double[n];
		double[] t = new double[n];
		double[] y = new double[n]; // M^-1 p
		double[] z = new double[n]; // M^-1 s

		double rhoPrev = 1.0, alpha = 1.0, omega = 1.0;
		String breakdown = null;
		int k = 0;
		while (k < maxIters) {
			k++;
			double rho = dot(shadow, r);
			if (!finite(rho) || Math.abs(rho) < TINY) {
				breakdown = "rho breakdown";
				break;
			}
			if (k == 1) {
				System.arraycopy(r, 0, p, 0, n);
			} else {
				double beta = (rho / rhoPrev) * (alpha / omega);
				for (int i = 0; i < n; i++) {
					p[i] = r[i] + beta * (p[i] - omega * v[i]);
				}
			}

			applyOrCopy(precond, p, y);
			A.matVec(y, v);
			double sv = dot(shadow, v);
			if (!finite(sv) || Math.abs(sv) < TINY) {
				breakdown = "alpha breakdown";
				break;
			}
			alpha = rho / sv;
			for (int i = 0; i < n; i++) {
				s[i] = r[i] - alpha * v[i];
			}

			// half step already good enough
			rel = norm2(s) / bnorm;
			if (rel <= tol) {
				SparseOps.axpy(alpha, y, x);
				return SolveResult.converged(k, rel);
			}

			applyOrCopy(precond, s, z);
			A.matVec(z, t);
			double tt = dot(t, t);
			omega = tt > 0.0 ? dot(t, s) / tt : 0.0;
			if (!finite(omega) || Math.abs(omega) < TINY) {
				breakdown = "omega breakdown";
				break;
			}
			for (int i = 0; i < n; i++) {
				x[i] += alpha * y[i] + omega * z[i];
				r[i] = s[i] - omega * t[i];
			}

			rel = norm2(r) / bnorm;
			if (rel <= tol) {
				return SolveResult.converged(k, rel);
			}
			rhoPrev = rho;
		}

		// the recurrence residual is stale after a breakdown
		residual(A, b, x, r);
		return SolveResult.stopped(k, norm2(r) / bnorm, breakdown);
	}
}
