package mixfix.model.operator;

public abstract class FormPartVisitor<T, E extends Throwable> {
	public abstract T visit(Keyword keyword) throws E;
	public abstract T visit(Placeholder placeholder) throws E;
	public abstract T visit(ParamSlot paramSlot) throws E;
}
