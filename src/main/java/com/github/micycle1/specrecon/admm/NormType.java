package com.github.micycle1.specrecon.admm;

/**
 * Norm applied to the output of a regularization operator.
 */
public enum NormType {
	/** Sparsity-promoting; handled by slack and dual variables in the ADMM loop. */
	L1,
	/** Quadratic; folded directly into the normal equations. */
	L2
}
