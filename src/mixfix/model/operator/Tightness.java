package mixfix.model.operator;

/**
 * What an open operand position accepts from operators of the same category as its own operator.
 */
public enum Tightness {
	SAME_OR_TIGHTER,
	STRICTLY_TIGHTER,
}
