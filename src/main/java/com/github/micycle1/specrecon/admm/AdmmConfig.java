package com.github.micycle1.specrecon.admm;

import java.util.Arrays;
import java.util.Objects;

import com.github.micycle1.specrecon.ConfigurationException;
import com.github.micycle1.specrecon.linalg.IterativeSolver;
import com.github.micycle1.specrecon.linalg.Preconditioner;
import com.github.micycle1.specrecon.operators.PriorTerm;

/**
 * <p>
 * Immutable solver configuration, validated once when built.
 * </p>
 *
 * <p>
 * Defaults:
 * </p>
 * <ul>
 * <li>{@code rho = [1, 1, 1, 1]}: penalties of the three prior terms, then of
 * the non-negativity constraint (only required when it is enabled)</li>
 * <li>{@code replicateSpectralGradient = false}</li>
 * <li>{@code norms = [L2, L1, L2]}</li>
 * <li>{@code nonNegative = true}</li>
 * <li>{@code innerTolerance = 1e-5}, {@code outerRelativeTolerance = 1e-3}</li>
 * <li>{@code maxInnerIterations = 500}, {@code maxOuterIterations = 1000}</li>
 * <li>{@code penaltyAdaptation = ResidualBalancing(2, 2, 10)}, null disables
 * it; {@code penaltyUpdatePeriod = 1}</li>
 * <li>{@code innerSolver = CONJUGATE_GRADIENT},
 * {@code preconditioner = JACOBI}</li>
 * </ul>
 */
public final class AdmmConfig {

	/** Index of the non-negativity penalty in {@link #getRho()}. */
	public static final int NONNEG_INDEX = PriorTerm.COUNT;

	private final double[] rho;
	private final boolean replicateSpectralGradient;
	private final NormType[] norms;
	private final boolean nonNegative;
	private final double innerTolerance;
	private final double outerRelativeTolerance;
	private final int maxInnerIterations;
	private final int maxOuterIterations;
	private final PenaltyUpdateStrategy penaltyAdaptation;
	private final int penaltyUpdatePeriod;
	private final IterativeSolver innerSolver;
	private final Preconditioner.Kind preconditioner;

	private AdmmConfig(Builder b) {
		this.rho = b.rho.clone();
		this.replicateSpectralGradient = b.replicateSpectralGradient;
		this.norms = b.norms.clone();
		this.nonNegative = b.nonNegative;
		this.innerTolerance = b.innerTolerance;
		this.outerRelativeTolerance = b.outerRelativeTolerance;
		this.maxInnerIterations = b.maxInnerIterations;
		this.maxOuterIterations = b.maxOuterIterations;
		this.penaltyAdaptation = b.penaltyAdaptation;
		this.penaltyUpdatePeriod = b.penaltyUpdatePeriod;
		this.innerSolver = b.innerSolver;
		this.preconditioner = b.preconditioner;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static AdmmConfig defaults() {
		return builder().build();
	}

	public Builder toBuilder() {
		return new Builder().rho(rho).replicateSpectralGradient(replicateSpectralGradient).norms(norms).nonNegative(nonNegative)
				.tolerances(innerTolerance, outerRelativeTolerance).maxIterations(maxInnerIterations, maxOuterIterations)
				.penaltyAdaptation(penaltyAdaptation).penaltyUpdatePeriod(penaltyUpdatePeriod).innerSolver(innerSolver)
				.preconditioner(preconditioner);
	}

	public double[] getRho() {
		return rho.clone();
	}

	public boolean isReplicateSpectralGradient() {
		return replicateSpectralGradient;
	}

	public NormType getNorm(PriorTerm term) {
		return norms[term.ordinal()];
	}

	public NormType[] getNorms() {
		return norms.clone();
	}

	public boolean isNonNegative() {
		return nonNegative;
	}

	public double getInnerTolerance() {
		return innerTolerance;
	}

	public double getOuterRelativeTolerance() {
		return outerRelativeTolerance;
	}

	public int getMaxInnerIterations() {
		return maxInnerIterations;
	}

	public int getMaxOuterIterations() {
		return maxOuterIterations;
	}

	/** May be null, meaning constant penalties. */
	public PenaltyUpdateStrategy getPenaltyAdaptation() {
		return penaltyAdaptation;
	}

	public int getPenaltyUpdatePeriod() {
		return penaltyUpdatePeriod;
	}

	public IterativeSolver getInnerSolver() {
		return innerSolver;
	}

	public Preconditioner.Kind getPreconditioner() {
		return preconditioner;
	}

	@Override
	public String toString() {
		return "AdmmConfig{rho=" + Arrays.toString(rho) + ", norms=" + Arrays.toString(norms) + ", nonNegative=" + nonNegative
				+ ", replicateSpectralGradient=" + replicateSpectralGradient + ", tol=[" + innerTolerance + ", " + outerRelativeTolerance
				+ "], maxit=[" + maxInnerIterations + ", " + maxOuterIterations + "], penaltyAdaptation=" + penaltyAdaptation + "/"
				+ penaltyUpdatePeriod + ", innerSolver=" + innerSolver + ", preconditioner=" + preconditioner + "}";
	}

	public static final class Builder {

		private double[] rho = { 1, 1, 1, 1 };
		private boolean replicateSpectralGradient = false;
		private NormType[] norms = { NormType.L2, NormType.L1, NormType.L2 };
		private boolean nonNegative = true;
		private double innerTolerance = 1e-5;
		private double outerRelativeTolerance = 1e-3;
		private int maxInnerIterations = 500;
		private int maxOuterIterations = 1000;
		private PenaltyUpdateStrategy penaltyAdaptation = new ResidualBalancing(2, 2, 10);
		private int penaltyUpdatePeriod = 1;
		private IterativeSolver innerSolver = IterativeSolver.CONJUGATE_GRADIENT;
		private Preconditioner.Kind preconditioner = Preconditioner.Kind.JACOBI;

		private Builder() {
		}

		public Builder rho(double... rho) {
			this.rho = Objects.requireNonNull(rho, "rho").clone();
			return this;
		}

		public Builder replicateSpectralGradient(boolean replicate) {
			this.replicateSpectralGradient = replicate;
			return this;
		}

		public Builder norms(NormType... norms) {
			this.norms = Objects.requireNonNull(norms, "norms").clone();
			return this;
		}

		/** {@code true} selects L1 for the corresponding term, {@code false} L2. */
		public Builder l1Norms(boolean... l1) {
			Objects.requireNonNull(l1, "l1");
			NormType[] n = new NormType[l1.length];
			for (int i = 0; i < l1.length; i++) {
				n[i] = l1[i] ? NormType.L1 : NormType.L2;
			}
			this.norms = n;
			return this;
		}

		public Builder nonNegative(boolean nonNegative) {
			this.nonNegative = nonNegative;
			return this;
		}

		public Builder tolerances(double inner, double outerRelative) {
			this.innerTolerance = inner;
			this.outerRelativeTolerance = outerRelative;
			return this;
		}

		public Builder maxIterations(int inner, int outer) {
			this.maxInnerIterations = inner;
			this.maxOuterIterations = outer;
			return this;
		}

		public Builder penaltyAdaptation(PenaltyUpdateStrategy strategy) {
			this.penaltyAdaptation = strategy;
			return this;
		}

		/** Residual balancing from an (increase, decrease, threshold) triple. */
		public Builder penaltyAdaptation(double increase, double decrease, double threshold) {
			this.penaltyAdaptation = new ResidualBalancing(increase, decrease, threshold);
			return this;
		}

		public Builder penaltyUpdatePeriod(int period) {
			this.penaltyUpdatePeriod = period;
			return this;
		}

		public Builder innerSolver(IterativeSolver solver) {
			this.innerSolver = Objects.requireNonNull(solver, "solver");
			return this;
		}

		public Builder preconditioner(Preconditioner.Kind kind) {
			this.preconditioner = Objects.requireNonNull(kind, "kind");
			return this;
		}

		public AdmmConfig build() {
			if (norms.length != PriorTerm.COUNT) {
				throw new ConfigurationException("Expected " + PriorTerm.COUNT + " norm types, got " + norms.length);
			}
			for (NormType n : norms) {
				if (n == null) {
					throw new ConfigurationException("Norm types must not be null");
				}
			}
			if (nonNegative && rho.length < PriorTerm.COUNT + 1) {
				throw new ConfigurationException(
						"A penalty for the non-negativity constraint is required: expected at least " + (PriorTerm.COUNT + 1) + " values in rho");
			} else if (rho.length < PriorTerm.COUNT) {
				throw new ConfigurationException("Expected rho to have at least " + PriorTerm.COUNT + " values, got " + rho.length);
			}
			for (double r : rho) {
				if (!(r > 0.0) || Double.isInfinite(r)) {
					throw new ConfigurationException("Penalty parameters must be positive and finite, got " + Arrays.toString(rho));
				}
			}
			if (!(innerTolerance > 0.0) || !(outerRelativeTolerance > 0.0)) {
				throw new ConfigurationException("Tolerances must be positive, got " + innerTolerance + ", " + outerRelativeTolerance);
			}
			if (maxInnerIterations < 1 || maxOuterIterations < 1) {
				throw new ConfigurationException("Iteration caps must be at least 1, got " + maxInnerIterations + ", " + maxOuterIterations);
			}
			if (penaltyUpdatePeriod < 1) {
				throw new ConfigurationException("Penalty update period must be at least 1, got " + penaltyUpdatePeriod);
			}
			return new AdmmConfig(this);
		}
	}
}
