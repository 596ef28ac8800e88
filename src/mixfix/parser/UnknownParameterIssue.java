package mixfix.parser;

import mixfix.errors.Issue;
import mixfix.errors.IssueTag;
import mixfix.errors.IssueVisitor;
import mixfix.util.SourceLocation;

import java.util.Collections;
import java.util.List;

public class UnknownParameterIssue extends Issue {
	private final String operatorId;
	private final String label;
	private final SourceLocation location;

	public UnknownParameterIssue(String operatorId, String label, SourceLocation location) {
		this.operatorId = operatorId;
		this.label = label;
		this.location = location;
	}

	public String getOperatorId() {
		return operatorId;
	}

	public String getLabel() {
		return label;
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
		return IssueTag.UNKNOWN_PARAMETER;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
