package mixfix.model.category;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A tightness category: an abstract precedence level. Categories are related by direct
 * "tighter than" edges, and form a partial order, not a total one.
 */
public class OperatorCategory {

	private final String id;
	private final String label;
	private final Set<String> tighterThan;
	private final Set<String> weakerThan;
	private final String chainCombinator;

	public OperatorCategory(String id, String label, Set<String> tighterThan, Set<String> weakerThan,
	                        String chainCombinator) {
		this.id = id;
		this.label = label;
		this.tighterThan = Collections.unmodifiableSet(new LinkedHashSet<>(tighterThan));
		this.weakerThan = Collections.unmodifiableSet(new LinkedHashSet<>(weakerThan));
		this.chainCombinator = chainCombinator;
	}

	public String getId() {
		return id;
	}

	public String getLabel() {
		return label;
	}

	/**
	 * @return the categories this one is directly tighter than
	 */
	public Set<String> getTighterThan() {
		return tighterThan;
	}

	/**
	 * @return the categories this one is directly weaker than
	 */
	public Set<String> getWeakerThan() {
		return weakerThan;
	}

	/**
	 * @return the id of the operator used to fold repeated uses of this category's operators, or null when
	 * repeated uses are not chained
	 */
	public String getChainCombinator() {
		return chainCombinator;
	}

	public boolean isChainEnabled() {
		return chainCombinator != null;
	}

	OperatorCategory withEdges(Set<String> moreTighterThan, Set<String> moreWeakerThan) {
		Set<String> t = new LinkedHashSet<>(tighterThan);
		t.addAll(moreTighterThan);
		Set<String> w = new LinkedHashSet<>(weakerThan);
		w.addAll(moreWeakerThan);
		return new OperatorCategory(id, label, t, w, chainCombinator);
	}

	OperatorCategory withChainCombinator(String combinator) {
		return new OperatorCategory(id, label, tighterThan, weakerThan, combinator);
	}

	@Override
	public String toString() {
		return "OperatorCategory [id=" + id + ", label=" + label + ", tighterThan=" + tighterThan +
				", weakerThan=" + weakerThan + ", chainCombinator=" + chainCombinator + "]";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		OperatorCategory that = (OperatorCategory) o;
		return Objects.equals(id, that.id) &&
				Objects.equals(label, that.label) &&
				Objects.equals(tighterThan, that.tighterThan) &&
				Objects.equals(weakerThan, that.weakerThan) &&
				Objects.equals(chainCombinator, that.chainCombinator);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, label, tighterThan, weakerThan, chainCombinator);
	}
}
