package mixfix.model.operator;

/**
 * One part of an operator's display form: a keyword, an operand placeholder, or the slot that carries
 * the operator's inner parameters.
 */
public abstract class FormPart {

	public abstract <T, E extends Throwable> T accept(FormPartVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

}
