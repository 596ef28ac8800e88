package mixfix.parser;

import mixfix.errors.Issue;
import mixfix.errors.IssueTag;
import mixfix.errors.IssueVisitor;
import mixfix.util.SourceLocation;

import java.util.Collections;
import java.util.List;

public class ParameterArityIssue extends Issue {

	public enum Problem {
		MISSING,
		SURPLUS,
		REPEATED,
	}

	private final String operatorId;
	private final String parameter;
	private final Problem problem;
	private final SourceLocation location;

	/**
	 * @param parameter the slot concerned, or null for a surplus positional value
	 */
	public ParameterArityIssue(String operatorId, String parameter, Problem problem, SourceLocation location) {
		this.operatorId = operatorId;
		this.parameter = parameter;
		this.problem = problem;
		this.location = location;
	}

	public String getOperatorId() {
		return operatorId;
	}

	public String getParameter() {
		return parameter;
	}

	public Problem getProblem() {
		return problem;
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
		return IssueTag.PARAMETER_ARITY;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
