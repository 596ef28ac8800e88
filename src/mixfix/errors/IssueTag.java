package mixfix.errors;

/**
 * The taxonomy every diagnostic belongs to. Declaration time tags abort the compilation unit,
 * the expression tags only affect the expression they were found in.
 */
public enum IssueTag {
	CATEGORY_CYCLE(true),
	UNKNOWN_CATEGORY(true),
	DUPLICATE_OPERATOR(true),
	MALFORMED_OPERATOR(true),
	UNKNOWN_COMBINATOR(true),
	CONFIGURATION(true),
	IO_ERROR(true),
	TOKEN_ERROR(false),
	UNDECLARED_OPERATOR_SYMBOL(false),
	NO_PARSE(false),
	AMBIGUOUS_EXPRESSION(false),
	UNKNOWN_PARAMETER(false),
	PARAMETER_ARITY(false);

	private final boolean declarationTime;

	IssueTag(boolean declarationTime) {
		this.declarationTime = declarationTime;
	}

	public boolean isDeclarationTime() {
		return declarationTime;
	}
}
