package mixfix.grammar;

/**
 * One placeholder of a compiled operator.
 */
public final class OperandSlot {

	private final String name;
	private final int partIndex;
	private final SlotSide side;
	private final OperandContext context;

	OperandSlot(String name, int partIndex, SlotSide side, OperandContext context) {
		this.name = name;
		this.partIndex = partIndex;
		this.side = side;
		this.context = context;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the index of the placeholder in the operator's form
	 */
	public int getPartIndex() {
		return partIndex;
	}

	public SlotSide getSide() {
		return side;
	}

	public OperandContext getContext() {
		return context;
	}

	@Override
	public String toString() {
		return "OperandSlot [name=" + name + ", side=" + side + ", context=" + context + "]";
	}
}
