package mixfix.grammar;

/**
 * Where an operand position sits in its operator's form.
 */
public enum SlotSide {
	// before the first keyword; the operand's right edge touches the operator
	LEADING,
	// after the last keyword; the operand's left edge touches the operator
	TRAILING,
	// between two keywords, so delimited on both edges
	INTERIOR,
}
