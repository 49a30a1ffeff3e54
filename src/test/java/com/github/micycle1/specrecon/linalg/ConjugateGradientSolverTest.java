package com.github.micycle1.specrecon.linalg;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class ConjugateGradientSolverTest {

	// banded test matrix with a slowly growing diagonal
	static SparseCSR tridiagonal(int n, double diag, double lower, double upper) {
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(n, n, 3 * n);
		for (int i = 0; i < n; i++) {
			tr.addItem(i, i, diag + 0.01 * i);
			if (i > 0) {
				tr.addItem(i, i - 1, lower);
			}
			if (i + 1 < n) {
				tr.addItem(i, i + 1, upper);
			}
		}
		return SparseCSR.fromCSC(DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null));
	}

	static double[] knownSolution(int n) {
		double[] x = new double[n];
		for (int i = 0; i < n; i++) {
			x[i] = Math.sin(0.3 * i) + 0.1 * i;
		}
		return x;
	}

	@ParameterizedTest
	@EnumSource(Preconditioner.Kind.class)
	void solvesSymmetricSystem(Preconditioner.Kind kind) {
		int n = 60;
		SparseCSR A = tridiagonal(n, 3.0, -1.0, -1.0);
		double[] expected = knownSolution(n);
		double[] b = new double[n];
		A.matVec(expected, b);

		double[] x = new double[n];
		SolveResult res = ConjugateGradientSolver.solve(A, b, x, 1e-12, 500, kind.create(A));

		assertTrue(res.isConverged(), res.toString());
		assertNull(res.getBreakdown());
		assertTrue(res.getRelativeResidual() <= 1e-12);
		assertArrayEquals(expected, x, 1e-9);
	}

	@Test
	void warmStartAtSolutionNeedsNoIterations() {
		int n = 20;
		SparseCSR A = tridiagonal(n, 3.0, -1.0, -1.0);
		double[] x = knownSolution(n);
		double[] b = new double[n];
		A.matVec(x, b);

		SolveResult res = ConjugateGradientSolver.solve(A, b, x, 1e-10, 100, null);
		assertTrue(res.isConverged());
		assertEquals(0, res.getIterations());
	}

	@Test
	void zeroRightHandSideGivesZero() {
		int n = 10;
		SparseCSR A = tridiagonal(n, 3.0, -1.0, -1.0);
		double[] x = knownSolution(n);
		SolveResult res = ConjugateGradientSolver.solve(A, new double[n], x, 1e-10, 100, null);
		assertTrue(res.isConverged());
		assertArrayEquals(new double[n], x, 0.0);
	}

	@Test
	void iterationCapIsReportedNotThrown() {
		int n = 80;
		SparseCSR A = tridiagonal(n, 2.0, -1.0, -1.0);
		double[] b = new double[n];
		A.matVec(knownSolution(n), b);

		double[] x = new double[n];
		SolveResult res = ConjugateGradientSolver.solve(A, b, x, 1e-14, 2, null);
		assertFalse(res.isConverged());
		assertEquals(2, res.getIterations());
		assertTrue(res.getRelativeResidual() > 1e-14);
	}

	@Test
	void selectableThroughIterativeSolver() {
		int n = 30;
		SparseCSR A = tridiagonal(n, 3.0, -1.0, -1.0);
		double[] expected = knownSolution(n);
		double[] b = new double[n];
		A.matVec(expected, b);
		double[] x = new double[n];
		SolveResult res = IterativeSolver.CONJUGATE_GRADIENT.solve(A, b, x, 1e-12, 200, Preconditioner.Kind.JACOBI.create(A));
		assertTrue(res.isConverged());
		assertArrayEquals(expected, x, 1e-9);
	}
}
