package com.github.micycle1.specrecon.linalg;

public final class Jacobi implements Preconditioner {
	private final int n;
	private final double[] Minv; // Minv[i] = 1 / A[i,i]

	private Jacobi(int n, double[] Minv) {
		this.n = n;
		this.Minv = Minv;
	}

	// The inverse diagonal is already computed during CSR conversion
	public static Jacobi fromCSR(SparseCSR A) {
		return new Jacobi(A.n, A.Minv);
	}

	@Override
	public void apply(double[] r, double[] z) {
		for (int i = 0; i < n; i++) {
			z[i] = Minv[i] * r[i];
		}
	}
}
