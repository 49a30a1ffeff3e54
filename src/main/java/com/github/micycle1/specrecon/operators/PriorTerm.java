package com.github.micycle1.specrecon.operators;

/**
 * The three regularization slots, in weight-vector order.
 */
public enum PriorTerm {
	/** Horizontal and vertical forward differences, stacked. */
	SPATIAL_GRADIENT,
	/** Spectral differences of the spatial gradient. */
	SPECTRAL_GRADIENT,
	/** 5-point spatial Laplacian per band. */
	SPATIAL_LAPLACIAN;

	public static final int COUNT = 3;
}
