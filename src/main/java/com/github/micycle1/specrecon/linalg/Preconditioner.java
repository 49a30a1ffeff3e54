package com.github.micycle1.specrecon.linalg;

/**
 * <p>
 * Light-weight preconditioner for CSR sparse matrices used with the iterative
 * solvers in this package. Implementations compute
 * <code>z = M^{-1} r</code>; for {@link ConjugateGradientSolver} M must be
 * symmetric positive definite.
 * </p>
 */
public interface Preconditioner {

	void apply(double[] r, double[] z);

	/** {@code z = M^{-1} r}, or a plain copy when {@code precond} is null. */
	static void applyOrCopy(Preconditioner precond, double[] r, double[] z) {
		if (precond != null) {
			precond.apply(r, z);
		} else {
			System.arraycopy(r, 0, z, 0, r.length);
		}
	}

	/** Preconditioner choices exposed through the solver configuration. */
	enum Kind {
		NONE, JACOBI, SSOR;

		public Preconditioner create(SparseCSR A) {
			switch (this) {
				case JACOBI:
					return Jacobi.fromCSR(A);
				case SSOR:
					return new SSOR(A, 1.2);
				default:
					return null;
			}
		}
	}
}
