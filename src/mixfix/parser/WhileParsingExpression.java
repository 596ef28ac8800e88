package mixfix.parser;

import mixfix.errors.Context;
import mixfix.errors.ContextVisitor;
import mixfix.util.SourceLocation;

public class WhileParsingExpression extends Context {

	private final int index;
	private final SourceLocation location;

	public WhileParsingExpression(int index, SourceLocation location) {
		this.index = index;
		this.location = location;
	}

	/**
	 * @return the 0-based position of the expression in its batch
	 */
	public int getIndex() {
		return index;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}
}
