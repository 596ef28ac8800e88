package mixfix.registry;

import mixfix.errors.Issue;
import mixfix.errors.IssueTag;
import mixfix.errors.IssueVisitor;

public class MalformedOperatorIssue extends Issue {
	private final String operatorId;
	private final String reason;

	public MalformedOperatorIssue(String operatorId, String reason) {
		this.operatorId = operatorId;
		this.reason = reason;
	}

	public String getOperatorId() {
		return operatorId;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public IssueTag getTag() {
		return IssueTag.MALFORMED_OPERATOR;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
