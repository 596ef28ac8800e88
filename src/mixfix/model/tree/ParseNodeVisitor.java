package mixfix.model.tree;

public abstract class ParseNodeVisitor<T, E extends Throwable> {
	public abstract T visit(Atom atom) throws E;
	public abstract T visit(Apply apply) throws E;
	public abstract T visit(Chain chain) throws E;
	public abstract T visit(ErrorNode errorNode) throws E;
}
