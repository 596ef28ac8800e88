package mixfix.config;

import mixfix.errors.Issue;
import mixfix.errors.IssueTag;
import mixfix.errors.IssueVisitor;

import java.io.IOException;

public class IOErrorIssue extends Issue {

	private final IOException error;

	public IOErrorIssue(IOException e) {
		super();
		this.error = e;
	}

	public IOException getError() {
		return error;
	}

	@Override
	public IssueTag getTag() {
		return IssueTag.IO_ERROR;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
