package mixfix.config;

import mixfix.errors.Issue;
import mixfix.errors.IssueTag;
import mixfix.errors.IssueVisitor;

public class OptionParserIssue extends Issue {

	private final String message;

	public OptionParserIssue(String message) {
		this.message = message;
	}

	public String getOptionMessage() {
		return message;
	}

	@Override
	public IssueTag getTag() {
		return IssueTag.CONFIGURATION;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
