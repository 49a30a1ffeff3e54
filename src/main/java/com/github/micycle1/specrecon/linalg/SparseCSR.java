package com.github.micycle1.specrecon.linalg;

import org.ejml.data.DMatrixSparseCSC;

/**
 * Square matrix in compressed sparse row (CSR) format, the layout the
 * iterative solvers and preconditioners in this package sweep over. Instances
 * are built once from an assembled EJML matrix and never modified.
 */
public final class SparseCSR {

	public final int n;
	public final int nnz;
	public final int[] rowPtr; // length n+1
	public final int[] colIdx; // length nnz, ascending within a row
	public final double[] val; // length nnz
	public final double[] Minv; // Jacobi inverse = 1/diag(A), 1 where the diagonal vanishes

	public SparseCSR(int n, int nnz, int[] rowPtr, int[] colIdx, double[] val, double[] Minv) {
		this.n = n;
		this.nnz = nnz;
		this.rowPtr = rowPtr;
		this.colIdx = colIdx;
		this.val = val;
		this.Minv = Minv;
	}

	/**
	 * Converts a square CSC matrix to CSR. Column indices of each output row come
	 * out sorted because the CSC columns are visited in order.
	 */
	public static SparseCSR fromCSC(DMatrixSparseCSC A) {
		if (A.numRows != A.numCols) {
			throw new IllegalArgumentException("Expected a square matrix, got " + A.numRows + "x" + A.numCols);
		}
		final int n = A.numRows;
		final int nnz = A.nz_length;
		int[] rowPtr = new int[n + 1];
		for (int p = 0; p < nnz; p++) {
			rowPtr[A.nz_rows[p] + 1]++;
		}
		for (int i = 0; i < n; i++) {
			rowPtr[i + 1] += rowPtr[i];
		}

		int[] next = rowPtr.clone();
		int[] colIdx = new int[nnz];
		double[] val = new double[nnz];
		double[] diag = new double[n];
		for (int j = 0; j < n; j++) {
			for (int p = A.col_idx[j]; p < A.col_idx[j + 1]; p++) {
				int i = A.nz_rows[p];
				int q = next[i]++;
				colIdx[q] = j;
				val[q] = A.nz_values[p];
				if (i == j) {
					diag[i] += A.nz_values[p];
				}
			}
		}

		double[] Minv = new double[n];
		for (int i = 0; i < n; i++) {
			Minv[i] = Math.abs(diag[i]) < 1e-14 ? 1.0 : 1.0 / diag[i];
		}
		return new SparseCSR(n, nnz, rowPtr, colIdx, val, Minv);
	}

	/** y = A x */
	public void matVec(double[] x, double[] y) {
		for (int i = 0; i < n; i++) {
			double sum = 0.0;
			int start = rowPtr[i], end = rowPtr[i + 1];
			for (int p = start; p < end; p++) {
				sum += val[p] * x[colIdx[p]];
			}
			y[i] = sum;
		}
	}

	@Override
	public String toString() {
		return "SparseCSR{n=" + n + ", nnz=" + nnz + "}";
	}
}
