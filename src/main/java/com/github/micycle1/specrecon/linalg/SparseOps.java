package com.github.micycle1.specrecon.linalg;

import java.util.Arrays;

import org.ejml.data.DMatrixSparseCSC;

/**
 * Vector kernels shared by the solvers and the ADMM loop. Sparse operands are
 * EJML CSC matrices, dense operands plain {@code double[]} buffers owned by the
 * caller.
 */
public final class SparseOps {

	private SparseOps() {
	}

	/** y = A x */
	public static void mult(DMatrixSparseCSC A, double[] x, double[] y) {
		checkLength(x, A.numCols, "x");
		checkLength(y, A.numRows, "y");
		Arrays.fill(y, 0.0);
		for (int j = 0; j < A.numCols; j++) {
			double xj = x[j];
			if (xj == 0.0) {
				continue;
			}
			for (int p = A.col_idx[j]; p < A.col_idx[j + 1]; p++) {
				y[A.nz_rows[p]] += A.nz_values[p] * xj;
			}
		}
	}

	/** y = A^T x */
	public static void multTransA(DMatrixSparseCSC A, double[] x, double[] y) {
		checkLength(x, A.numRows, "x");
		checkLength(y, A.numCols, "y");
		for (int j = 0; j < A.numCols; j++) {
			double sum = 0.0;
			for (int p = A.col_idx[j]; p < A.col_idx[j + 1]; p++) {
				sum += A.nz_values[p] * x[A.nz_rows[p]];
			}
			y[j] = sum;
		}
	}

	/** r = b - A x */
	public static void residual(SparseCSR A, double[] b, double[] x, double[] r) {
		A.matVec(x, r);
		for (int i = 0; i < r.length; i++) {
			r[i] = b[i] - r[i];
		}
	}

	/** y += alpha x */
	public static void axpy(double alpha, double[] x, double[] y) {
		for (int i = 0; i < y.length; i++) {
			y[i] += alpha * x[i];
		}
	}

	public static double dot(double[] a, double[] b) {
		double s = 0.0;
		for (int i = 0; i < a.length; i++) {
			s += a[i] * b[i];
		}
		return s;
	}

	public static double norm2(double[] a) {
		double s = 0.0;
		for (double v : a) {
			s += v * v;
		}
		return Math.sqrt(s);
	}

	/** ||a - b|| without a temporary. */
	public static double distance(double[] a, double[] b) {
		double s = 0.0;
		for (int i = 0; i < a.length; i++) {
			double d = a[i] - b[i];
			s += d * d;
		}
		return Math.sqrt(s);
	}

	public static boolean finite(double v) {
		return !Double.isNaN(v) && !Double.isInfinite(v);
	}

	private static void checkLength(double[] v, int expected, String name) {
		if (v.length != expected) {
			throw new IllegalArgumentException(name + " has length " + v.length + ", expected " + expected);
		}
	}
}
