package mixfix.model.tree;

import mixfix.errors.Issue;
import mixfix.util.SourceLocation;

import java.util.Objects;

/**
 * Stands in for an expression that could not be parsed. The issue has already been reported.
 */
public class ErrorNode extends ParseNode {

	private final Issue issue;

	public ErrorNode(SourceLocation location, Issue issue) {
		super(location);
		this.issue = issue;
	}

	public Issue getIssue() {
		return issue;
	}

	@Override
	public <T, E extends Throwable> T accept(ParseNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(issue.getTag());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return issue.getTag() == ((ErrorNode) obj).issue.getTag();
	}
}
