package mixfix.model.tree;

import mixfix.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 *
 * A folded run of relations from one chain enabled category:
 *
 * x0 op1 x1 op2 x2 ... opn xn
 *
 * which means the pairwise relations combined with the category's combinator.
 *
 */
public class Chain extends ParseNode {

	private final String categoryId;
	private final String combinatorId;
	private final List<ParseNode> operands;
	private final List<String> relations;

	public Chain(SourceLocation location, String categoryId, String combinatorId, List<ParseNode> operands,
	             List<String> relations) {
		super(location);
		if(relations.isEmpty()) {
			throw new IllegalArgumentException("a chain needs at least one relation");
		}
		if(operands.size() != relations.size() + 1) {
			throw new IllegalArgumentException("a chain of " + relations.size() + " relations needs " +
					(relations.size() + 1) + " operands, got " + operands.size());
		}
		this.categoryId = categoryId;
		this.combinatorId = combinatorId;
		this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
		this.relations = Collections.unmodifiableList(new ArrayList<>(relations));
	}

	public String getCategoryId() {
		return categoryId;
	}

	public String getCombinatorId() {
		return combinatorId;
	}

	public List<ParseNode> getOperands() {
		return operands;
	}

	public List<String> getRelations() {
		return relations;
	}

	/**
	 * @return the equivalent tree without chains at this level: each adjacent pair related by its operator, and
	 * the relations folded left through the combinator
	 */
	public ParseNode expand() {
		List<ParseNode> pairs = new ArrayList<>();
		for(int i = 0; i < relations.size(); ++i) {
			ParseNode lhs = operands.get(i);
			ParseNode rhs = operands.get(i + 1);
			pairs.add(new Apply(lhs.getLocation().combine(rhs.getLocation()), relations.get(i), Arrays.asList(lhs, rhs)));
		}
		ParseNode result = pairs.get(0);
		for(int i = 1; i < pairs.size(); ++i) {
			result = new Apply(getLocation(), combinatorId, Arrays.asList(result, pairs.get(i)));
		}
		return result;
	}

	@Override
	public <T, E extends Throwable> T accept(ParseNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(categoryId, combinatorId, operands, relations);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		Chain other = (Chain) obj;
		return categoryId.equals(other.categoryId) && combinatorId.equals(other.combinatorId) &&
				operands.equals(other.operands) && relations.equals(other.relations);
	}
}
