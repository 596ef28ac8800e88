package mixfix.registry;

import mixfix.errors.Issue;
import mixfix.errors.IssueTag;
import mixfix.errors.IssueVisitor;
import mixfix.model.operator.OperatorDefinition;

public class DuplicateOperatorIssue extends Issue {
	private final OperatorDefinition declared;
	private final OperatorDefinition existing;

	public DuplicateOperatorIssue(OperatorDefinition declared, OperatorDefinition existing) {
		this.declared = declared;
		this.existing = existing;
	}

	public OperatorDefinition getDeclared() {
		return declared;
	}

	public OperatorDefinition getExisting() {
		return existing;
	}

	@Override
	public IssueTag getTag() {
		return IssueTag.DUPLICATE_OPERATOR;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
