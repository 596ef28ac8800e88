package mixfix.grammar;

import java.util.BitSet;
import java.util.Objects;

/**
 * What an operand position requires of the operators along the edges of its operand.
 *
 * <p>Each edge of the operand that touches a keyword outside it is contested, and carries the set of categories
 * an operator open on that edge may belong to: every category except those weaker than the requiring one, and
 * except the requiring one itself when the position is strict. A null set means the edge is not contested.</p>
 *
 * <p>The constraint holds all the way down the edge. When an operator is accepted here, its leading operand
 * shares its left edge and its trailing operand shares its right edge, so those operands inherit the
 * constraint of that edge on top of their own (see {@link #narrow}).</p>
 */
public final class OperandContext {

	public static final OperandContext ROOT = new OperandContext(null, null);

	private final BitSet leftAccepted;
	private final BitSet rightAccepted;

	OperandContext(BitSet leftAccepted, BitSet rightAccepted) {
		this.leftAccepted = leftAccepted;
		this.rightAccepted = rightAccepted;
	}

	public boolean isUnconstrained() {
		return leftAccepted == null && rightAccepted == null;
	}

	public boolean checksLeftEdge() {
		return leftAccepted != null;
	}

	public boolean checksRightEdge() {
		return rightAccepted != null;
	}

	/**
	 * @return the categories an operator open on the left edge may belong to, or null if that edge is free
	 */
	public BitSet getLeftAccepted() {
		return leftAccepted == null ? null : (BitSet) leftAccepted.clone();
	}

	/**
	 * @return the categories an operator open on the right edge may belong to, or null if that edge is free
	 */
	public BitSet getRightAccepted() {
		return rightAccepted == null ? null : (BitSet) rightAccepted.clone();
	}

	/**
	 * @return true if an operand whose top operator is inner may fill this position
	 */
	public boolean accepts(CompiledOperator inner) {
		return accepts(inner.getCategoryIndex(), inner.isLeftOpen(), inner.isRightOpen());
	}

	public boolean accepts(int categoryIndex, boolean leftOpen, boolean rightOpen) {
		if(leftOpen && leftAccepted != null && !leftAccepted.get(categoryIndex)) {
			return false;
		}
		return !rightOpen || rightAccepted == null || rightAccepted.get(categoryIndex);
	}

	/**
	 * @param slot the context an operator accepted here asks of one of its operands
	 * @param leading whether that operand starts the operator's span
	 * @param trailing whether that operand ends the operator's span
	 * @return the context of the operand: its own, further restricted on each edge it shares with the operator
	 */
	public OperandContext narrow(OperandContext slot, boolean leading, boolean trailing) {
		BitSet left = leading ? intersect(slot.leftAccepted, leftAccepted) : slot.leftAccepted;
		BitSet right = trailing ? intersect(slot.rightAccepted, rightAccepted) : slot.rightAccepted;
		if(Objects.equals(left, slot.leftAccepted) && Objects.equals(right, slot.rightAccepted)) {
			return slot;
		}
		return new OperandContext(left, right);
	}

	private static BitSet intersect(BitSet a, BitSet b) {
		if(a == null) {
			return b;
		}
		if(b == null) {
			return a;
		}
		BitSet result = (BitSet) a.clone();
		result.and(b);
		return result;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		OperandContext that = (OperandContext) o;
		return Objects.equals(leftAccepted, that.leftAccepted) && Objects.equals(rightAccepted, that.rightAccepted);
	}

	@Override
	public int hashCode() {
		return Objects.hash(leftAccepted, rightAccepted);
	}

	@Override
	public String toString() {
		if(isUnconstrained()) {
			return "OperandContext [ROOT]";
		}
		return "OperandContext [left=" + leftAccepted + ", right=" + rightAccepted + "]";
	}
}
