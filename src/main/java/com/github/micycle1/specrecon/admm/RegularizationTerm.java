package com.github.micycle1.specrecon.admm;

import org.ejml.data.DMatrixSparseCSC;

import com.github.micycle1.specrecon.operators.PriorTerm;

/**
 * One of the three prior slots: disabled, an L2 penalty folded into the
 * normal equations, or an L1 penalty split off with its own slack state.
 * The tag is fixed for the lifetime of the owning {@link AdmmState}.
 */
public final class RegularizationTerm {

	public enum Tag {
		DISABLED, L2, L1
	}

	private final PriorTerm prior;
	private final Tag tag;
	private final DMatrixSparseCSC operator; // null iff DISABLED
	private final DMatrixSparseCSC gram; // G^T G, null iff DISABLED
	private final SlackState slack; // non-null iff L1

	private RegularizationTerm(PriorTerm prior, Tag tag, DMatrixSparseCSC operator) {
		this.prior = prior;
		this.tag = tag;
		this.operator = operator;
		this.gram = operator != null ? RegularizationWeighting.gram(operator) : null;
		this.slack = tag == Tag.L1 ? new SlackState(operator.numRows) : null;
	}

	static RegularizationTerm disabled(PriorTerm prior) {
		return new RegularizationTerm(prior, Tag.DISABLED, null);
	}

	static RegularizationTerm of(PriorTerm prior, NormType norm, DMatrixSparseCSC operator) {
		return new RegularizationTerm(prior, norm == NormType.L1 ? Tag.L1 : Tag.L2, operator);
	}

	public PriorTerm getPrior() {
		return prior;
	}

	public Tag getTag() {
		return tag;
	}

	public boolean isEnabled() {
		return tag != Tag.DISABLED;
	}

	public DMatrixSparseCSC getOperator() {
		return operator;
	}

	DMatrixSparseCSC getGram() {
		return gram;
	}

	SlackState getSlack() {
		return slack;
	}

	/** Output length of the operator, 0 when disabled. */
	public int rows() {
		return operator == null ? 0 : operator.numRows;
	}

	@Override
	public String toString() {
		return prior + ":" + tag;
	}
}
