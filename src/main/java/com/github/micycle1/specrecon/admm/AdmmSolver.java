package com.github.micycle1.specrecon.admm;

import static com.github.micycle1.specrecon.linalg.SparseOps.axpy;
import static com.github.micycle1.specrecon.linalg.SparseOps.norm2;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.interfaces.linsol.LinearSolverSparse;
import org.ejml.sparse.FillReducing;
import org.ejml.sparse.csc.CommonOps_DSCC;
import org.ejml.sparse.csc.factory.LinearSolverFactory_DSCC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.specrecon.linalg.Preconditioner;
import com.github.micycle1.specrecon.linalg.SolveResult;
import com.github.micycle1.specrecon.linalg.SparseCSR;
import com.github.micycle1.specrecon.linalg.SparseOps;

/**
 * <p>
 * ADMM solver for
 * </p>
 *
 * <pre>
 * min_I  1/2 ||M Omega_Phi I - J||^2
 *        + sum_{L2 terms} w_k/2 ||G_k I||^2
 *        + sum_{L1 terms} w_k ||G_k I||_1
 *        (subject to I &gt;= 0 when enabled)
 * </pre>
 *
 * <p>
 * following Algorithm 2 of Baek et al. 2017 with the scaled-dual form of Boyd
 * et al. 2011. Each L1 term and the non-negativity constraint get a slack
 * variable {@code Z = G I} (identity for non-negativity) and a scaled dual
 * {@code U}.
 * </p>
 *
 * <p>
 * Phases: INIT assembles {@code A = A_const + sum rho_k G_k^T G_k} (plus
 * {@code rho I} for non-negativity); LOOP runs primal solve, slack update,
 * dual update, residuals and the optional penalty adaptation until the
 * residuals pass or the iteration cap is hit; with non-negativity on, the
 * final image is projected onto the non-negative orthant. The primal image in the state is
 * used as the starting point, so callers choose warm or cold starts through
 * {@link AdmmState#resetPrimal()}. Without any split constraint the problem is
 * plain least squares and is solved directly.
 * </p>
 *
 * <p>
 * Running out of inner or outer iterations is not an error: the best iterate
 * stays in the state and the event is logged and reported.
 * </p>
 */
public final class AdmmSolver {

	private static final Logger log = LoggerFactory.getLogger(AdmmSolver.class);

	// One split constraint Z = G I; g == null means G is the identity
	private static final class Slot {
		final String name;
		final int rhoIndex;
		final DMatrixSparseCSC g;
		final DMatrixSparseCSC gram;
		final SlackState s;
		final boolean nonNegative;
		final double weight;

		Slot(String name, int rhoIndex, DMatrixSparseCSC g, DMatrixSparseCSC gram, SlackState s, boolean nonNegative, double weight) {
			this.name = name;
			this.rhoIndex = rhoIndex;
			this.g = g;
			this.gram = gram;
			this.s = s;
			this.nonNegative = nonNegative;
			this.weight = weight;
		}
	}

	private final AdmmState state;
	private final AdmmConfig config;
	private final int n;
	private final double[] rho;
	private final double[] image;
	private final List<Slot> slots = new ArrayList<>();

	private final double[] b;
	private final double[] tmp;
	private final ConvergenceMonitor monitor;

	private SparseCSR A;
	private Preconditioner precond;
	private int innerFailures;

	private AdmmSolver(AdmmState state) {
		this.state = state;
		this.config = state.getConfig();
		this.n = state.getOperators().latentLength();
		this.rho = state.rho();
		this.image = state.primal();
		this.b = new double[n];
		this.tmp = new double[n];
		this.monitor = new ConvergenceMonitor(state.getAbsoluteTolerance(), config.getOuterRelativeTolerance());

		RegularizationTerm[] terms = state.terms();
		for (int k = 0; k < terms.length; k++) {
			RegularizationTerm t = terms[k];
			if (t.getTag() == RegularizationTerm.Tag.L1) {
				slots.add(new Slot(t.getPrior().name(), k, t.getOperator(), t.getGram(), t.getSlack(), false, state.normalizedWeight(k)));
			}
		}
		if (state.hasNonNegativity()) {
			slots.add(new Slot("NON_NEGATIVITY", AdmmConfig.NONNEG_INDEX, null, null, state.nonNegativity(), true, 0.0));
		}
	}

	/**
	 * Runs one solve, updating the state's primal image, slack and dual variables
	 * and penalties in place.
	 *
	 * @throws IllegalStateException if no weights have been applied to the state
	 */
	public static ConvergenceReport solve(AdmmState state) {
		Objects.requireNonNull(state, "state must not be null");
		if (!state.isWeighted()) {
			throw new IllegalStateException("Regularization weights have not been applied; call reWeight() first");
		}
		if (!state.hasSplitConstraints()) {
			return solveLeastSquares(state);
		}
		return new AdmmSolver(state).run();
	}

	private ConvergenceReport run() {
		assemble();

		final int maxIter = config.getMaxOuterIterations();
		final PenaltyUpdateStrategy adaptation = config.getPenaltyAdaptation();
		final int period = config.getPenaltyUpdatePeriod();

		Termination termination = Termination.BUDGET_EXHAUSTED;
		int iter = 0;
		while (iter < maxIter) {
			iter++;
			updatePrimal(iter);

			monitor.beginIteration();
			double[] primalNorms = new double[slots.size()];
			double[] dualNorms = new double[slots.size()];
			for (int i = 0; i < slots.size(); i++) {
				Slot slot = slots.get(i);
				updateSlackAndDual(slot);
				recordResiduals(slot, i, primalNorms, dualNorms);
			}
			boolean converged = monitor.endIteration();
			if (log.isDebugEnabled()) {
				log.debug("ADMM iteration {}: primal={} dual={}", iter, monitor.getPrimalResidual(), monitor.getDualResidual());
			}
			if (converged) {
				termination = Termination.CONVERGED;
				break;
			}

			if (adaptation != null && iter % period == 0 && iter < maxIter) {
				adaptPenalties(adaptation, primalNorms, dualNorms, iter);
			}
		}

		if (state.hasNonNegativity()) {
			projectNonNegative(image);
		}

		if (termination == Termination.BUDGET_EXHAUSTED) {
			log.warn("ADMM stopped after {} iterations without converging (primal={}, dual={})", iter, monitor.getPrimalResidual(),
					monitor.getDualResidual());
		} else {
			log.debug("ADMM converged after {} iterations", iter);
		}
		return new ConvergenceReport(termination, iter, innerFailures, monitor.getPrimalResidual(), monitor.getDualResidual(),
				monitor.getHistory(), rho.clone());
	}

	// A = A_const + sum rho_k G_k^T G_k (+ rho_nn I)
	private void assemble() {
		DMatrixSparseCSC a = state.getConstPart();
		for (Slot slot : slots) {
			DMatrixSparseCSC gram = slot.nonNegative ? CommonOps_DSCC.identity(n) : slot.gram;
			a = RegularizationWeighting.add(a, rho[slot.rhoIndex], gram);
		}
		A = SparseCSR.fromCSC(a);
		precond = config.getPreconditioner().create(A);
	}

	// b = (M Omega_Phi)^T J + sum rho_k G_k^T (Z_k - U_k), then A I = b
	private void updatePrimal(int iter) {
		System.arraycopy(state.dataRhs(), 0, b, 0, n);
		for (Slot slot : slots) {
			SlackState s = slot.s;
			for (int i = 0; i < s.g.length; i++) {
				s.g[i] = s.z[i] - s.u[i];
			}
			applyTranspose(slot, s.g, tmp);
			axpy(rho[slot.rhoIndex], tmp, b);
		}

		SolveResult res = config.getInnerSolver().solve(A, b, image, config.getInnerTolerance(), config.getMaxInnerIterations(), precond);
		if (!res.isConverged()) {
			innerFailures++;
			log.warn("ADMM iteration {}: inner solve did not reach tolerance {} ({}); continuing with best iterate", iter,
					config.getInnerTolerance(), res);
		}
	}

	private void updateSlackAndDual(Slot slot) {
		SlackState s = slot.s;
		apply(slot, image, s.g); // g = G I
		System.arraycopy(s.z, 0, s.zPrev, 0, s.z.length);

		if (slot.nonNegative) {
			for (int i = 0; i < s.z.length; i++) {
				s.z[i] = Math.max(0.0, s.g[i] + s.u[i]);
			}
		} else {
			double kappa = slot.weight / rho[slot.rhoIndex];
			for (int i = 0; i < s.z.length; i++) {
				s.z[i] = softThreshold(s.g[i] + s.u[i], kappa);
			}
		}

		for (int i = 0; i < s.z.length; i++) {
			s.r[i] = s.g[i] - s.z[i];
			s.u[i] += s.r[i];
			s.y[i] = s.z[i] - s.zPrev[i];
		}
	}

	private void recordResiduals(Slot slot, int index, double[] primalNorms, double[] dualNorms) {
		SlackState s = slot.s;
		double r = rho[slot.rhoIndex];
		double primal = norm2(s.r);
		applyTranspose(slot, s.y, tmp);
		double dual = r * norm2(tmp);
		applyTranspose(slot, s.u, tmp);
		double dualScale = r * norm2(tmp);
		monitor.record(s.z.length, n, primal, dual, norm2(s.g), norm2(s.z), dualScale);
		primalNorms[index] = primal;
		dualNorms[index] = dual;
	}

	private void adaptPenalties(PenaltyUpdateStrategy adaptation, double[] primalNorms, double[] dualNorms, int iter) {
		boolean changed = false;
		for (int i = 0; i < slots.size(); i++) {
			Slot slot = slots.get(i);
			double factor = adaptation.update(primalNorms[i], dualNorms[i], rho[slot.rhoIndex]);
			if (factor == 1.0 || !(factor > 0.0) || Double.isInfinite(factor)) {
				continue;
			}
			rho[slot.rhoIndex] *= factor;
			// keep rho * U fixed
			double[] u = slot.s.u;
			for (int j = 0; j < u.length; j++) {
				u[j] /= factor;
			}
			changed = true;
			log.debug("ADMM iteration {}: rho[{}] -> {}", iter, slot.name, rho[slot.rhoIndex]);
		}
		if (changed) {
			assemble();
		}
	}

	// I = max(I, 0) elementwise
	static void projectNonNegative(double[] image) {
		for (int i = 0; i < image.length; i++) {
			if (image[i] < 0.0) {
				image[i] = 0.0;
			}
		}
	}

	static double softThreshold(double v, double kappa) {
		if (v > kappa) {
			return v - kappa;
		}
		if (v < -kappa) {
			return v + kappa;
		}
		return 0.0;
	}

	private static void apply(Slot slot, double[] x, double[] out) {
		if (slot.g == null) {
			System.arraycopy(x, 0, out, 0, x.length);
		} else {
			SparseOps.mult(slot.g, x, out);
		}
	}

	private static void applyTranspose(Slot slot, double[] x, double[] out) {
		if (slot.g == null) {
			System.arraycopy(x, 0, out, 0, x.length);
		} else {
			SparseOps.multTransA(slot.g, x, out);
		}
	}

	/*
	 * A_const I = (M Omega_Phi)^T J. Sparse Cholesky first; an indefinite or
	 * singular A_const falls back to the configured iterative solver, warm-started
	 * from the current primal image.
	 */
	private static ConvergenceReport solveLeastSquares(AdmmState state) {
		AdmmConfig config = state.getConfig();
		double[] image = state.primal();
		double[] rhs = state.dataRhs();
		final int n = image.length;

		DMatrixSparseCSC a = state.getConstPart().copy();
		a.sortIndices(null);
		SparseCSR csr = SparseCSR.fromCSC(a);

		LinearSolverSparse<DMatrixSparseCSC, DMatrixRMaj> solver = LinearSolverFactory_DSCC.cholesky(FillReducing.NONE);
		if (solver.setA(a)) {
			DMatrixRMaj x = new DMatrixRMaj(n, 1);
			solver.solve(new DMatrixRMaj(n, 1, true, rhs), x);
			double rel = relativeResidual(csr, x.data, rhs);
			if (SparseOps.finite(rel) && rel <= config.getInnerTolerance()) {
				System.arraycopy(x.data, 0, image, 0, n);
				return new ConvergenceReport(Termination.LEAST_SQUARES, 0, 0, 0.0, 0.0, new double[0], state.getRho());
			}
			log.debug("Cholesky least-squares solution has relative residual {}; falling back to {}", rel, config.getInnerSolver());
		} else {
			log.debug("Cholesky factorisation of A_const failed; falling back to {}", config.getInnerSolver());
		}

		SolveResult res = config.getInnerSolver().solve(csr, rhs, image, config.getInnerTolerance(), config.getMaxInnerIterations(),
				config.getPreconditioner().create(csr));
		int failures = 0;
		if (!res.isConverged()) {
			failures = 1;
			log.warn("Least-squares solve did not reach tolerance {} ({}); returning best iterate", config.getInnerTolerance(), res);
		}
		return new ConvergenceReport(Termination.LEAST_SQUARES, 0, failures, 0.0, 0.0, new double[0], state.getRho());
	}

	private static double relativeResidual(SparseCSR a, double[] x, double[] rhs) {
		double bnorm = norm2(rhs);
		if (bnorm == 0.0) {
			return norm2(x) == 0.0 ? 0.0 : Double.POSITIVE_INFINITY;
		}
		double[] ax = new double[rhs.length];
		a.matVec(x, ax);
		for (int i = 0; i < ax.length; i++) {
			ax[i] = rhs[i] - ax[i];
		}
		return norm2(ax) / bnorm;
	}
}
