package mixfix.parser;

import mixfix.errors.Issue;
import mixfix.errors.IssueTag;
import mixfix.errors.IssueVisitor;
import mixfix.util.SourceLocation;

import java.util.Collections;
import java.util.List;

public class NoParseIssue extends Issue {
	private final String reason;
	private final SourceLocation location;

	public NoParseIssue(String reason, SourceLocation location) {
		this.reason = reason;
		this.location = location;
	}

	public String getReason() {
		return reason;
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
		return IssueTag.NO_PARSE;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
