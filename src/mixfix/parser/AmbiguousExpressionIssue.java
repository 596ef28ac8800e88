package mixfix.parser;

import mixfix.errors.Issue;
import mixfix.errors.IssueTag;
import mixfix.errors.IssueVisitor;
import mixfix.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class AmbiguousExpressionIssue extends Issue {
	private final SourceLocation location;
	private final List<CompetingOperator> competitors;
	private final List<List<String>> incomparableCategories;

	/**
	 * @param incomparableCategories pairs of competitor categories that have no tightness relation; declaring
	 * one would resolve the ambiguity
	 */
	public AmbiguousExpressionIssue(SourceLocation location, List<CompetingOperator> competitors,
	                                List<List<String>> incomparableCategories) {
		this.location = location;
		this.competitors = Collections.unmodifiableList(competitors);
		this.incomparableCategories = Collections.unmodifiableList(incomparableCategories);
	}

	public SourceLocation getLocation() {
		return location;
	}

	public List<CompetingOperator> getCompetitors() {
		return competitors;
	}

	public List<String> getCompetingOperatorIds() {
		List<String> ids = new ArrayList<>();
		for(CompetingOperator competitor : competitors) {
			ids.add(competitor.getOperatorId());
		}
		return ids;
	}

	public List<List<String>> getIncomparableCategories() {
		return incomparableCategories;
	}

	@Override
	public List<SourceLocation> getLocations() {
		List<SourceLocation> locations = new ArrayList<>();
		for(CompetingOperator competitor : competitors) {
			locations.add(competitor.getLocation());
		}
		return locations;
	}

	@Override
	public IssueTag getTag() {
		return IssueTag.AMBIGUOUS_EXPRESSION;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
