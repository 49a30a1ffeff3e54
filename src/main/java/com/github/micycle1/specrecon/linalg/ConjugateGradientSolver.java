package com.github.micycle1.specrecon.linalg;

import static com.github.micycle1.specrecon.linalg.Preconditioner.applyOrCopy;
import static com.github.micycle1.specrecon.linalg.SparseOps.dot;
import static com.github.micycle1.specrecon.linalg.SparseOps.finite;
import static com.github.micycle1.specrecon.linalg.SparseOps.norm2;
import static com.github.micycle1.specrecon.linalg.SparseOps.residual;

import java.util.Arrays;

/**
 * Preconditioned conjugate gradient method for symmetric positive
 * (semi-)definite systems A x = b stored in CSR format. This is the default
 * solver for the normal equations of the ADMM primal step.
 * <p>
 * The iteration starts from the contents of {@code x} (warm start) and stops
 * once {@code ||b - A x|| / ||b|| <= tol} or after {@code maxIters} steps. On a
 * consistent singular system started from zero the iterates stay in the range
 * of A, so the result is the minimum-norm solution.
 */
public final class ConjugateGradientSolver {

	private ConjugateGradientSolver() {
	}

	public static SolveResult solve(SparseCSR A, double[] b, double[] x, double tol, int maxIters, Preconditioner precond) {
		final int n = A.n;
		double bnorm = norm2(b);
		if (bnorm == 0.0) {
			Arrays.fill(x, 0.0);
			return SolveResult.converged(0, 0.0);
		}

		double[] r = new double[n];
		double[] z = new double[n];
		double[] p = new double[n];
		double[] Ap = new double[n];

		residual(A, b, x, r);
		double rel = norm2(r) / bnorm;
		if (rel <= tol) {
			return SolveResult.converged(0, rel);
		}

		applyOrCopy(precond, r, z);
		System.arraycopy(z, 0, p, 0, n);
		double rz = dot(r, z);

		String breakdown = null;
		int k = 0;
		while (k < maxIters) {
			k++;
			A.matVec(p, Ap);
			double pAp = dot(p, Ap);
			if (!finite(pAp) || pAp <= 0.0) {
				// A is not positive definite along p
				breakdown = "curvature breakdown";
				break;
			}
			double alpha = rz / pAp;
			for (int i = 0; i < n; i++) {
				x[i] += alpha * p[i];
				r[i] -= alpha * Ap[i];
			}

			rel = norm2(r) / bnorm;
			if (rel <= tol) {
				return SolveResult.converged(k, rel);
			}

			applyOrCopy(precond, r, z);
			double rzNew = dot(r, z);
			if (!finite(rzNew) || Math.abs(rzNew) < 1e-300) {
				breakdown = "rz breakdown";
				break;
			}
			double beta = rzNew / rz;
			for (int i = 0; i < n; i++) {
				p[i] = z[i] + beta * p[i];
			}
			rz = rzNew;
		}
		return SolveResult.stopped(k, norm2(r) / bnorm, breakdown);
	}
}
