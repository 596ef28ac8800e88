package mixfix.model.category;

import mixfix.errors.Issue;
import mixfix.errors.IssueTag;
import mixfix.errors.IssueVisitor;

public class UnknownCategoryIssue extends Issue {
	private final String category;
	private final String referencedBy;

	/**
	 * @param category the missing category, null if none was given at all
	 * @param referencedBy the category or operator whose declaration mentions it
	 */
	public UnknownCategoryIssue(String category, String referencedBy) {
		this.category = category;
		this.referencedBy = referencedBy;
	}

	public String getCategory() {
		return category;
	}

	public String getReferencedBy() {
		return referencedBy;
	}

	@Override
	public IssueTag getTag() {
		return IssueTag.UNKNOWN_CATEGORY;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
