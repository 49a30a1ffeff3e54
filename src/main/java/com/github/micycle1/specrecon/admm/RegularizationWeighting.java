package com.github.micycle1.specrecon.admm;

import java.util.Arrays;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.sparse.csc.CommonOps_DSCC;

import com.github.micycle1.specrecon.ConfigurationException;
import com.github.micycle1.specrecon.operators.PriorTerm;

/**
 * Weight normalisation and the weight-dependent part of the normal equations.
 * <p>
 * Each regularization weight is rescaled by {@code rows(M Omega_Phi) / rows(G_k)}
 * so that a term's strength does not depend on how many gradient directions or
 * bands its operator spans. Only L2 terms enter {@code A_const}; L1 terms and
 * the non-negativity constraint act through the ADMM loop alone.
 */
public final class RegularizationWeighting {

	private RegularizationWeighting() {
	}

	/**
	 * @param weights   raw weights, one per prior term, non-negative; zero means
	 *                  disabled
	 * @param dataRows  rows of {@code M * Omega_Phi}
	 * @param termRows  rows of each term's operator (ignored for zero weights)
	 * @return normalised weights with the same zero pattern
	 */
	public static double[] normalize(double[] weights, int dataRows, int[] termRows) {
		checkWeights(weights);
		if (termRows == null || termRows.length != PriorTerm.COUNT) {
			throw new ConfigurationException("Expected " + PriorTerm.COUNT + " operator row counts");
		}
		double[] out = new double[PriorTerm.COUNT];
		for (int k = 0; k < PriorTerm.COUNT; k++) {
			if (weights[k] == 0.0) {
				continue;
			}
			if (termRows[k] <= 0) {
				throw new ConfigurationException("Term " + PriorTerm.values()[k] + " has a weight but no operator rows");
			}
			out[k] = weights[k] * dataRows / termRows[k];
		}
		return out;
	}

	/**
	 * Weight-independent part of the normal equations,
	 * {@code (M Omega_Phi)^T (M Omega_Phi)}.
	 */
	public static DMatrixSparseCSC buildConstPart(DMatrixSparseCSC omegaPhi, DMatrixSparseCSC mosaic) {
		DMatrixSparseCSC mOmegaPhi = new DMatrixSparseCSC(mosaic.numRows, omegaPhi.numCols, 0);
		CommonOps_DSCC.mult(mosaic, omegaPhi, mOmegaPhi);
		return gram(mOmegaPhi);
	}

	/**
	 * {@code A_const = A_const_noWeights + sum_k weight_k G_k^T G_k} over the
	 * L2-tagged terms.
	 *
	 * @param normalizedWeights output of
	 *                          {@link #normalize(double[], int, int[])}
	 */
	public static DMatrixSparseCSC foldWeights(DMatrixSparseCSC constNoWeights, RegularizationTerm[] terms, double[] normalizedWeights) {
		DMatrixSparseCSC a = constNoWeights.copy();
		for (int k = 0; k < terms.length; k++) {
			RegularizationTerm term = terms[k];
			if (term.getTag() != RegularizationTerm.Tag.L2 || normalizedWeights[k] == 0.0) {
				continue;
			}
			a = add(a, normalizedWeights[k], term.getGram());
		}
		return a;
	}

	/** {@code a + beta * b} as a new matrix. */
	static DMatrixSparseCSC add(DMatrixSparseCSC a, double beta, DMatrixSparseCSC b) {
		DMatrixSparseCSC out = new DMatrixSparseCSC(a.numRows, a.numCols, 0);
		CommonOps_DSCC.add(1.0, a, beta, b, out, null, null);
		return out;
	}

	/** {@code G^T G} */
	static DMatrixSparseCSC gram(DMatrixSparseCSC g) {
		DMatrixSparseCSC gT = new DMatrixSparseCSC(g.numCols, g.numRows, 0);
		CommonOps_DSCC.transpose(g, gT, null);
		DMatrixSparseCSC out = new DMatrixSparseCSC(g.numCols, g.numCols, 0);
		CommonOps_DSCC.mult(gT, g, out);
		out.sortIndices(null);
		return out;
	}

	static void checkWeights(double[] weights) {
		if (weights == null || weights.length != PriorTerm.COUNT) {
			throw new ConfigurationException("Expected " + PriorTerm.COUNT + " regularization weights, got "
					+ (weights == null ? "null" : Arrays.toString(weights)));
		}
		for (double w : weights) {
			if (!(w >= 0.0) || Double.isInfinite(w)) {
				throw new ConfigurationException("Regularization weights must be non-negative and finite, got " + Arrays.toString(weights));
			}
		}
	}
}
