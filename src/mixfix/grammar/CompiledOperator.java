package mixfix.grammar;

import mixfix.model.operator.OperatorDefinition;
import mixfix.model.operator.OperatorShape;

import java.util.Collections;
import java.util.List;

public final class CompiledOperator {

	private final OperatorDefinition definition;
	private final int categoryIndex;
	private final OperatorShape shape;
	private final boolean leftOpen;
	private final boolean rightOpen;
	private final List<OperandSlot> slots;

	CompiledOperator(OperatorDefinition definition, int categoryIndex, List<OperandSlot> slots) {
		this.definition = definition;
		this.categoryIndex = categoryIndex;
		this.shape = definition.getShape();
		this.leftOpen = definition.isLeftOpen();
		this.rightOpen = definition.isRightOpen();
		this.slots = Collections.unmodifiableList(slots);
	}

	public OperatorDefinition getDefinition() {
		return definition;
	}

	public String getId() {
		return definition.getId();
	}

	public String getCategory() {
		return definition.getCategory();
	}

	public int getCategoryIndex() {
		return categoryIndex;
	}

	public OperatorShape getShape() {
		return shape;
	}

	public boolean isLeftOpen() {
		return leftOpen;
	}

	public boolean isRightOpen() {
		return rightOpen;
	}

	/**
	 * @return the operand positions, in form order
	 */
	public List<OperandSlot> getSlots() {
		return slots;
	}

	public OperandSlot slotAt(int partIndex) {
		for(OperandSlot slot : slots) {
			if(slot.getPartIndex() == partIndex) {
				return slot;
			}
		}
		return null;
	}

	@Override
	public String toString() {
		return "CompiledOperator [id=" + getId() + ", shape=" + shape + ", slots=" + slots + "]";
	}
}
