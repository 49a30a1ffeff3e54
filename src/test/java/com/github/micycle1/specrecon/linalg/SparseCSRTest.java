package com.github.micycle1.specrecon.linalg;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.junit.jupiter.api.Test;

public class SparseCSRTest {

	private static DMatrixSparseCSC sample() {
		DMatrixSparseTriplet tr = new DMatrixSparseTriplet(3, 3, 6);
		tr.addItem(0, 0, 2.0);
		tr.addItem(0, 2, 1.0);
		tr.addItem(1, 1, 0.0);
		tr.addItem(2, 0, -1.0);
		tr.addItem(2, 1, 4.0);
		tr.addItem(2, 2, 5.0);
		return DConvertMatrixStruct.convert(tr, (DMatrixSparseCSC) null);
	}

	@Test
	void matVecAgreesWithCscKernels() {
		DMatrixSparseCSC csc = sample();
		SparseCSR csr = SparseCSR.fromCSC(csc);
		double[] x = { 1.0, -2.0, 3.0 };

		double[] fromCsr = new double[3];
		csr.matVec(x, fromCsr);
		double[] fromCsc = new double[3];
		SparseOps.mult(csc, x, fromCsc);

		assertArrayEquals(new double[] { 5.0, 0.0, 6.0 }, fromCsr, 1e-15);
		assertArrayEquals(fromCsc, fromCsr, 1e-15);
	}

	@Test
	void transposedProduct() {
		double[] y = new double[3];
		SparseOps.multTransA(sample(), new double[] { 1.0, 1.0, 1.0 }, y);
		assertArrayEquals(new double[] { 1.0, 4.0, 6.0 }, y, 1e-15);
	}

	@Test
	void inverseDiagonalFallsBackToOne() {
		SparseCSR csr = SparseCSR.fromCSC(sample());
		assertEquals(0.5, csr.Minv[0]);
		assertEquals(1.0, csr.Minv[1]);
		assertEquals(0.2, csr.Minv[2], 1e-15);
	}

	@Test
	void rejectsNonSquare() {
		assertThrows(IllegalArgumentException.class, () -> SparseCSR.fromCSC(new DMatrixSparseCSC(2, 3, 0)));
	}

	@Test
	void residualOfSample() {
		SparseCSR csr = SparseCSR.fromCSC(sample());
		double[] r = new double[3];
		SparseOps.residual(csr, new double[] { 5.0, 1.0, 7.0 }, new double[] { 1.0, -2.0, 3.0 }, r);
		assertArrayEquals(new double[] { 0.0, 1.0, 1.0 }, r, 1e-15);
	}

	@Test
	void missingPreconditionerCopies() {
		double[] z = new double[3];
		Preconditioner.applyOrCopy(null, new double[] { 1.0, 2.0, 3.0 }, z);
		assertArrayEquals(new double[] { 1.0, 2.0, 3.0 }, z);
	}

	@Test
	void lengthMismatchIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> SparseOps.mult(sample(), new double[2], new double[3]));
	}
}
