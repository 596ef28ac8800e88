package mixfix.errors;

import mixfix.config.WhileLoadingTable;
import mixfix.parser.WhileParsingExpression;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileParsingExpression whileParsingExpression) throws E;
	public abstract T visit(WhileLoadingTable whileLoadingTable) throws E;

}
