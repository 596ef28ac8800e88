package mixfix.parser;

import mixfix.util.SourceLocation;

import java.util.Objects;

/**
 * One of the derivations an ambiguous expression admits, named by its top operator.
 */
public final class CompetingOperator {
	private final String operatorId;
	private final String category;
	private final SourceLocation location;

	public CompetingOperator(String operatorId, String category, SourceLocation location) {
		this.operatorId = operatorId;
		this.category = category;
		this.location = location;
	}

	public String getOperatorId() {
		return operatorId;
	}

	public String getCategory() {
		return category;
	}

	/**
	 * @return where the operator's first keyword was written, or the span of its operands for juxtaposition
	 */
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public String toString() {
		return operatorId + " (" + category + ") " + location.prettyString();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CompetingOperator that = (CompetingOperator) o;
		return Objects.equals(operatorId, that.operatorId) &&
				Objects.equals(category, that.category) &&
				Objects.equals(location, that.location);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operatorId, category, location);
	}
}
