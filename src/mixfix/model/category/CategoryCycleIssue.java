package mixfix.model.category;

import mixfix.errors.Issue;
import mixfix.errors.IssueTag;
import mixfix.errors.IssueVisitor;

import java.util.Collections;
import java.util.List;

public class CategoryCycleIssue extends Issue {
	private final String declaring;
	private final List<String> cycle;

	/**
	 * @param declaring the category whose declaration was rejected
	 * @param cycle the categories along the cycle, the first one repeated at the end
	 */
	public CategoryCycleIssue(String declaring, List<String> cycle) {
		this.declaring = declaring;
		this.cycle = Collections.unmodifiableList(cycle);
	}

	public String getDeclaring() {
		return declaring;
	}

	public List<String> getCycle() {
		return cycle;
	}

	@Override
	public IssueTag getTag() {
		return IssueTag.CATEGORY_CYCLE;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
