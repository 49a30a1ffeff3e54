package com.github.micycle1.specrecon.linalg;

/**
 * Inner linear solvers selectable for the ADMM primal step.
 */
public enum IterativeSolver {

	CONJUGATE_GRADIENT {
		@Override
		public SolveResult solve(SparseCSR A, double[] b, double[] x, double tol, int maxIters, Preconditioner precond) {
			return ConjugateGradientSolver.solve(A, b, x, tol, maxIters, precond);
		}
	},
	BICGSTAB {
		@Override
		public SolveResult solve(SparseCSR A, double[] b, double[] x, double tol, int maxIters, Preconditioner precond) {
			return BiCGStabSolver.solve(A, b, x, tol, maxIters, precond);
		}
	};

	public abstract SolveResult solve(SparseCSR A, double[] b, double[] x, double tol, int maxIters, Preconditioner precond);
}
