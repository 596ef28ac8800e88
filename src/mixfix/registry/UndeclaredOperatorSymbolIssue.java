package mixfix.registry;

import mixfix.errors.Issue;
import mixfix.errors.IssueTag;
import mixfix.errors.IssueVisitor;
import mixfix.util.SourceLocation;

import java.util.Collections;
import java.util.List;

public class UndeclaredOperatorSymbolIssue extends Issue {
	private final String symbol;
	private final String scope;
	private final List<String> unimportedOperators;
	private final SourceLocation location;

	/**
	 * @param unimportedOperators operators declared with this symbol that the scope did not import, empty if
	 * the symbol was never declared
	 */
	public UndeclaredOperatorSymbolIssue(String symbol, String scope, List<String> unimportedOperators,
	                                     SourceLocation location) {
		this.symbol = symbol;
		this.scope = scope;
		this.unimportedOperators = Collections.unmodifiableList(unimportedOperators);
		this.location = location;
	}

	public String getSymbol() {
		return symbol;
	}

	public String getScope() {
		return scope;
	}

	public List<String> getUnimportedOperators() {
		return unimportedOperators;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public List<SourceLocation> getLocations() {
		return Collections.singletonList(location);
	}

	@Override
	public IssueTag getTag() {
		return IssueTag.UNDECLARED_OPERATOR_SYMBOL;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
