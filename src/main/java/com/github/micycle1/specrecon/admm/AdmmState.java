package com.github.micycle1.specrecon.admm;

import java.util.Arrays;
import java.util.Objects;

import org.ejml.data.DMatrixSparseCSC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.specrecon.ConfigurationException;
import com.github.micycle1.specrecon.linalg.SparseOps;
import com.github.micycle1.specrecon.operators.PriorTerm;
import com.github.micycle1.specrecon.operators.ProblemOperators;

/**
 * <p>
 * Persistent working set of the ADMM solver for one operator set: the primal
 * image, per-constraint slack/dual state, the current penalties and the
 * weighted normal-equations matrix.
 * </p>
 *
 * <p>
 * A state is reused across many solves, typically while a caller searches over
 * regularization weights:
 * </p>
 * <ol>
 * <li>{@link #build} allocates everything for an operator set (full
 * reallocation; call it again when the operators change).</li>
 * <li>{@link #reWeight(double[])} swaps the weights, rebuilding
 * {@code A_const} while keeping the slack, dual and primal vectors warm.</li>
 * <li>{@link #resetPrimal()} zeroes the primal image only (cold restart of the
 * image, warm duals).</li>
 * </ol>
 *
 * <p>
 * The enabled/disabled pattern of the prior terms is fixed at build time. The
 * class is not thread-safe; one solve owns a state at a time.
 * </p>
 */
public final class AdmmState {

	private static final Logger log = LoggerFactory.getLogger(AdmmState.class);

	private final ProblemOperators operators;
	private final AdmmConfig config;
	private final double[] observation;
	private final boolean[] enabled;

	private final RegularizationTerm[] terms = new RegularizationTerm[PriorTerm.COUNT];
	private final SlackState nonNegativity; // null when the constraint is off
	private final double[] rho; // live penalties, length PriorTerm.COUNT + 1

	private final double[] primal;
	private final double[] dataRhs; // (M Omega_Phi)^T J
	private final DMatrixSparseCSC constNoWeights;
	private final double absoluteTolerance;

	private DMatrixSparseCSC constPart; // null until weights are applied
	private double[] normalizedWeights;

	private AdmmState(ProblemOperators operators, double[] observation, boolean[] enabled, AdmmConfig config) {
		this.operators = operators;
		this.config = config;
		this.observation = observation.clone();
		this.enabled = enabled.clone();

		for (PriorTerm p : PriorTerm.values()) {
			int k = p.ordinal();
			if (!enabled[k]) {
				terms[k] = RegularizationTerm.disabled(p);
			} else {
				if (!operators.isEnabled(p)) {
					throw new ConfigurationException("Term " + p + " is enabled but the operator set has no operator for it");
				}
				terms[k] = RegularizationTerm.of(p, config.getNorm(p), operators.getPrior(p));
			}
		}

		final int n = operators.latentLength();
		nonNegativity = config.isNonNegative() ? new SlackState(n) : null;

		double[] configured = config.getRho();
		rho = new double[PriorTerm.COUNT + 1];
		System.arraycopy(configured, 0, rho, 0, Math.min(configured.length, rho.length));

		primal = new double[n];
		dataRhs = new double[n];
		SparseOps.multTransA(operators.getMOmegaPhi(), this.observation, dataRhs);
		constNoWeights = RegularizationWeighting.buildConstPart(operators.getOmegaPhi(), operators.getMosaic());
		absoluteTolerance = absoluteTolerance(this.observation, operators.maxChannelSensitivity(), config.getOuterRelativeTolerance());

		log.debug("Allocated ADMM state: terms={}, nonNegative={}, latent length={}, absolute tolerance={}", Arrays.toString(terms),
				nonNegativity != null, n, absoluteTolerance);
	}

	/**
	 * Allocates a state whose weight-dependent matrix is left pending until
	 * {@link #reWeight(double[])} is called.
	 *
	 * @param observation vectorized CFA image, length = pixels
	 * @param enabled     which prior terms are active
	 */
	public static AdmmState build(ProblemOperators operators, double[] observation, boolean[] enabled, AdmmConfig config) {
		Objects.requireNonNull(operators, "operators must not be null");
		Objects.requireNonNull(config, "config must not be null");
		if (enabled == null || enabled.length != PriorTerm.COUNT) {
			throw new ConfigurationException("Expected an enabled-term mask of length " + PriorTerm.COUNT);
		}
		if (observation == null || observation.length != operators.getMOmegaPhi().numRows) {
			throw new ConfigurationException("Observation must have " + operators.getMOmegaPhi().numRows + " samples, got "
					+ (observation == null ? "null" : observation.length));
		}
		return new AdmmState(operators, observation, enabled, config);
	}

	/**
	 * Allocates a state and applies {@code weights}; terms with zero weight are
	 * disabled.
	 */
	public static AdmmState build(ProblemOperators operators, double[] observation, double[] weights, AdmmConfig config) {
		RegularizationWeighting.checkWeights(weights);
		AdmmState state = build(operators, observation, maskOf(weights), config);
		state.reWeight(weights);
		return state;
	}

	/**
	 * Applies new regularization weights. Slack, dual and primal vectors are kept
	 * so the next solve starts warm.
	 *
	 * @return the normalised weights now in effect
	 * @throws ConfigurationException if the zero pattern of {@code weights}
	 *                                differs from the mask the state was built
	 *                                with
	 */
	public double[] reWeight(double[] weights) {
		RegularizationWeighting.checkWeights(weights);
		checkMask(maskOf(weights));

		int[] rows = new int[PriorTerm.COUNT];
		for (int k = 0; k < PriorTerm.COUNT; k++) {
			rows[k] = terms[k].rows();
		}
		normalizedWeights = RegularizationWeighting.normalize(weights, operators.getMOmegaPhi().numRows, rows);
		constPart = RegularizationWeighting.foldWeights(constNoWeights, terms, normalizedWeights);
		log.debug("Re-weighted: raw={} normalized={}", Arrays.toString(weights), Arrays.toString(normalizedWeights));
		return normalizedWeights.clone();
	}

	/** Zeroes the primal image, keeping slack and dual history. */
	public void resetPrimal() {
		Arrays.fill(primal, 0.0);
	}

	/**
	 * Zeroes the primal image after checking the caller's view of the enabled
	 * terms against this state.
	 *
	 * @throws ConfigurationException if {@code expectedMask} differs from the
	 *                                mask the state was built with
	 */
	public void resetPrimal(boolean[] expectedMask) {
		checkMask(expectedMask);
		resetPrimal();
	}

	void checkMask(boolean[] mask) {
		if (mask == null || !Arrays.equals(mask, enabled)) {
			throw new ConfigurationException("The set of enabled regularization terms has changed since the state was built: expected "
					+ Arrays.toString(enabled) + ", got " + Arrays.toString(mask));
		}
	}

	static boolean[] maskOf(double[] weights) {
		boolean[] mask = new boolean[weights.length];
		for (int k = 0; k < weights.length; k++) {
			mask[k] = weights[k] != 0.0;
		}
		return mask;
	}

	/*
	 * Assume the latent image is spectrally uniform, so each channel records the
	 * latent intensity times its summed sensitivity; take the median raw value as
	 * coming from the most sensitive channel.
	 */
	static double absoluteTolerance(double[] observation, double maxChannelSensitivity, double relativeTolerance) {
		if (!(maxChannelSensitivity > 0.0)) {
			return 0.0;
		}
		double tol = relativeTolerance * median(observation) / maxChannelSensitivity;
		return SparseOps.finite(tol) ? Math.max(0.0, tol) : 0.0;
	}

	static double median(double[] values) {
		double[] sorted = values.clone();
		Arrays.sort(sorted);
		int m = sorted.length / 2;
		return sorted.length % 2 == 1 ? sorted[m] : 0.5 * (sorted[m - 1] + sorted[m]);
	}

	/** True when at least one L1 term or the non-negativity constraint needs the ADMM loop. */
	boolean hasSplitConstraints() {
		if (nonNegativity != null) {
			return true;
		}
		for (RegularizationTerm t : terms) {
			if (t.getTag() == RegularizationTerm.Tag.L1) {
				return true;
			}
		}
		return false;
	}

	public ProblemOperators getOperators() {
		return operators;
	}

	public AdmmConfig getConfig() {
		return config;
	}

	public boolean[] getEnabledMask() {
		return enabled.clone();
	}

	public RegularizationTerm getTerm(PriorTerm p) {
		return terms[p.ordinal()];
	}

	RegularizationTerm[] terms() {
		return terms;
	}

	SlackState nonNegativity() {
		return nonNegativity;
	}

	public boolean hasNonNegativity() {
		return nonNegativity != null;
	}

	/** Live penalties; entry {@link AdmmConfig#NONNEG_INDEX} is the non-negativity penalty. */
	double[] rho() {
		return rho;
	}

	public double[] getRho() {
		return rho.clone();
	}

	/** The primal buffer itself; solves write into it in place. */
	double[] primal() {
		return primal;
	}

	public double[] getPrimal() {
		return primal.clone();
	}

	double[] dataRhs() {
		return dataRhs;
	}

	public double[] getObservation() {
		return observation.clone();
	}

	/** Null until weights are applied. */
	DMatrixSparseCSC getConstPart() {
		return constPart;
	}

	public boolean isWeighted() {
		return constPart != null;
	}

	/** Null until weights are applied. */
	public double[] getNormalizedWeights() {
		return normalizedWeights == null ? null : normalizedWeights.clone();
	}

	double normalizedWeight(int k) {
		return normalizedWeights[k];
	}

	public double getAbsoluteTolerance() {
		return absoluteTolerance;
	}

	public SlackState getSlackState(PriorTerm p) {
		return terms[p.ordinal()].getSlack();
	}

	public SlackState getNonNegativityState() {
		return nonNegativity;
	}
}
