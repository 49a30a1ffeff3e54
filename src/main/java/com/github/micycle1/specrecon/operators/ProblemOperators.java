package com.github.micycle1.specrecon.operators;

import java.util.Objects;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.sparse.csc.CommonOps_DSCC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.specrecon.ConfigurationException;

/**
 * Immutable set of operators for one problem shape: image sampling, sensor
 * sensitivity, optional dispersion, CFA layout and the enabled prior terms.
 * Built once and shared read-only by every solve on that shape; regularization
 * operators exist only for enabled terms.
 */
public final class ProblemOperators {

	private static final Logger log = LoggerFactory.getLogger(ProblemOperators.class);

	private final ImageSampling sampling;
	private final int bands;
	private final double[][] sensitivity;
	private final CfaPattern cfa;
	private final boolean dispersed;

	private final DMatrixSparseCSC omega;
	private final DMatrixSparseCSC omegaPhi;
	private final DMatrixSparseCSC mosaic;
	private final DMatrixSparseCSC mOmegaPhi;
	private final DMatrixSparseCSC[] priors = new DMatrixSparseCSC[PriorTerm.COUNT];

	private ProblemOperators(ImageSampling sampling, double[][] sensitivity, CfaPattern cfa, DMatrixSparseCSC dispersion, boolean[] enabled,
			boolean replicateSpectral) {
		this.sampling = sampling;
		this.bands = sensitivity[0].length;
		this.sensitivity = deepCopy(sensitivity);
		this.cfa = cfa;
		this.dispersed = dispersion != null;

		omega = LinearOperatorBuilder.buildColorMixing(sampling, sensitivity);
		omegaPhi = LinearOperatorBuilder.buildDispersion(sampling, omega, bands, dispersion);
		mosaic = LinearOperatorBuilder.buildSampling(sampling, cfa);

		mOmegaPhi = new DMatrixSparseCSC(mosaic.numRows, omegaPhi.numCols, 0);
		CommonOps_DSCC.mult(mosaic, omegaPhi, mOmegaPhi);

		for (PriorTerm term : PriorTerm.values()) {
			if (enabled[term.ordinal()]) {
				priors[term.ordinal()] = LinearOperatorBuilder.buildGradient(term, sampling, bands, replicateSpectral);
			}
		}
		log.debug("Built operators for {} x {} bands (cfa={}, dispersion={}): M*Omega_Phi {}x{}", sampling, bands, cfa, dispersed,
				mOmegaPhi.numRows, mOmegaPhi.numCols);
	}

	/**
	 * @param dispersion        optional warp operator (rows = sensor image length,
	 *                          columns = latent image length), may be null
	 * @param enabled           which of the three prior terms get an operator
	 * @param replicateSpectral see
	 *                          {@link LinearOperatorBuilder#buildGradient(PriorTerm, ImageSampling, int, boolean)}
	 */
	public static ProblemOperators build(ImageSampling sampling, double[][] sensitivity, String cfaPattern, DMatrixSparseCSC dispersion,
			boolean[] enabled, boolean replicateSpectral) {
		Objects.requireNonNull(sampling, "sampling must not be null");
		LinearOperatorBuilder.checkSensitivity(sensitivity);
		if (sensitivity.length != CfaPattern.CHANNELS) {
			throw new ConfigurationException("Sensitivity must have one row per CFA channel (" + CfaPattern.CHANNELS + "), got " + sensitivity.length);
		}
		if (enabled == null || enabled.length != PriorTerm.COUNT) {
			throw new ConfigurationException("Expected an enabled-term mask of length " + PriorTerm.COUNT);
		}
		CfaPattern cfa = CfaPattern.parse(cfaPattern);
		return new ProblemOperators(sampling, sensitivity, cfa, dispersion, enabled.clone(), replicateSpectral);
	}

	public ImageSampling getSampling() {
		return sampling;
	}

	public int getBands() {
		return bands;
	}

	/** Length of the vectorized latent image. */
	public int latentLength() {
		return sampling.pixels() * bands;
	}

	public double[][] getSensitivity() {
		return deepCopy(sensitivity);
	}

	public CfaPattern getCfa() {
		return cfa;
	}

	public boolean hasDispersion() {
		return dispersed;
	}

	public DMatrixSparseCSC getOmega() {
		return omega;
	}

	public DMatrixSparseCSC getOmegaPhi() {
		return omegaPhi;
	}

	public DMatrixSparseCSC getMosaic() {
		return mosaic;
	}

	public DMatrixSparseCSC getMOmegaPhi() {
		return mOmegaPhi;
	}

	public boolean isEnabled(PriorTerm term) {
		return priors[term.ordinal()] != null;
	}

	public boolean[] enabledMask() {
		boolean[] mask = new boolean[PriorTerm.COUNT];
		for (int k = 0; k < PriorTerm.COUNT; k++) {
			mask[k] = priors[k] != null;
		}
		return mask;
	}

	public DMatrixSparseCSC getPrior(PriorTerm term) {
		DMatrixSparseCSC g = priors[term.ordinal()];
		if (g == null) {
			throw new IllegalStateException("No operator was built for disabled term " + term);
		}
		return g;
	}

	/**
	 * Largest per-channel sum of spectral sensitivities, i.e. the strongest
	 * channel response to a spectrally uniform latent image.
	 */
	public double maxChannelSensitivity() {
		double max = Double.NEGATIVE_INFINITY;
		for (double[] row : sensitivity) {
			double sum = 0.0;
			for (double s : row) {
				sum += s;
			}
			max = Math.max(max, sum);
		}
		return max;
	}

	private static double[][] deepCopy(double[][] a) {
		double[][] c = new double[a.length][];
		for (int i = 0; i < a.length; i++) {
			c[i] = a[i].clone();
		}
		return c;
	}
}
