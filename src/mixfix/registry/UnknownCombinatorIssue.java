package mixfix.registry;

import mixfix.errors.Issue;
import mixfix.errors.IssueTag;
import mixfix.errors.IssueVisitor;

/**
 * A chain enabled category names a combinator that is not a declared operator of two operands.
 */
public class UnknownCombinatorIssue extends Issue {
	private final String category;
	private final String combinator;
	private final String reason;

	public UnknownCombinatorIssue(String category, String combinator, String reason) {
		this.category = category;
		this.combinator = combinator;
		this.reason = reason;
	}

	public String getCategory() {
		return category;
	}

	public String getCombinator() {
		return combinator;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public IssueTag getTag() {
		return IssueTag.UNKNOWN_COMBINATOR;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
