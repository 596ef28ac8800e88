package mixfix.lexer;

import mixfix.errors.Issue;
import mixfix.errors.IssueTag;
import mixfix.errors.IssueVisitor;
import mixfix.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * Some text of an expression could not be split into tokens.
 */
public class TokenReaderIssue extends Issue {

	private final TokenReaderException error;
	private final SourceLocation location;

	public TokenReaderIssue(TokenReaderException error, SourceLocation location) {
		this.error = error;
		this.location = location;
	}

	public TokenReaderException getError() {
		return error;
	}

	@Override
	public List<SourceLocation> getLocations() {
		return Collections.singletonList(location);
	}

	@Override
	public IssueTag getTag() {
		return IssueTag.TOKEN_ERROR;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
