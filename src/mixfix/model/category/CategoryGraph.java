package mixfix.model.category;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Stores tightness categories and their partial order.
 *
 * <p>An edge {@code a -> b} means {@code a} is directly tighter than {@code b}. The edges always form a DAG;
 * every declaration is checked against that invariant and is either applied completely or not at all.</p>
 *
 * <p>Reachability is kept as an arena of category indices plus one {@link BitSet} row per category, computed
 * on demand and thrown away on every mutation. A frozen graph (see {@link #freeze()}) computes it up front and
 * can then be shared between threads.</p>
 */
public class CategoryGraph {

	private static final Logger logger = Logger.getLogger(CategoryGraph.class.getName());

	private final Map<String, OperatorCategory> categories;
	private final Map<String, Integer> indices;
	private final List<String> order;
	private final boolean frozen;
	private BitSet[] closure;

	public CategoryGraph() {
		this.categories = new LinkedHashMap<>();
		this.indices = new HashMap<>();
		this.order = new ArrayList<>();
		this.frozen = false;
		this.closure = null;
	}

	private CategoryGraph(CategoryGraph other, boolean frozen) {
		this.categories = new LinkedHashMap<>(other.categories);
		this.indices = new HashMap<>(other.indices);
		this.order = new ArrayList<>(other.order);
		this.frozen = frozen;
		this.closure = null;
		if(frozen) {
			computeClosure();
		}
	}

	/**
	 * @return an immutable copy of this graph, with its reachability index already computed
	 */
	public CategoryGraph freeze() {
		return new CategoryGraph(this, true);
	}

	/**
	 * @return a mutable copy of this graph
	 */
	public CategoryGraph copy() {
		return new CategoryGraph(this, false);
	}

	public boolean isFrozen() {
		return frozen;
	}

	private void checkMutable() {
		if(frozen) {
			throw new IllegalStateException("cannot declare into a frozen category graph");
		}
	}

	public void declareCategory(String id, Set<String> tighterThan, Set<String> weakerThan) {
		declareCategory(id, id, tighterThan, weakerThan);
	}

	/**
	 * Adds the category id, or extends it if it already exists, together with the given edges.
	 *
	 * @param tighterThan categories id is directly tighter than
	 * @param weakerThan categories id is directly weaker than
	 * @throws UnknownCategoryIssue if an edge mentions an undeclared category
	 * @throws CategoryCycleIssue if the new edges would make some category reachable from itself; the graph is
	 * left unchanged
	 */
	public void declareCategory(String id, String label, Set<String> tighterThan, Set<String> weakerThan) {
		checkMutable();
		if(id == null || id.isEmpty()) {
			throw new IllegalArgumentException("category id must not be empty");
		}
		for(String other : concat(tighterThan, weakerThan)) {
			if(!other.equals(id) && !categories.containsKey(other)) {
				throw new UnknownCategoryIssue(other, id);
			}
		}

		Map<String, Set<String>> successors = new HashMap<>();
		for(OperatorCategory category : categories.values()) {
			successors.put(category.getId(), new LinkedHashSet<>(category.getTighterThan()));
		}
		successors.computeIfAbsent(id, k -> new LinkedHashSet<>());
		List<String[]> newEdges = new ArrayList<>();
		for(String t : tighterThan) {
			successors.get(id).add(t);
			newEdges.add(new String[]{id, t});
		}
		for(String w : weakerThan) {
			successors.get(w).add(id);
			newEdges.add(new String[]{w, id});
		}
		for(String[] edge : newEdges) {
			List<String> path = findPath(successors, edge[1], edge[0]);
			if(path != null) {
				List<String> cycle = new ArrayList<>();
				cycle.add(edge[0]);
				cycle.addAll(path);
				throw new CategoryCycleIssue(id, cycle);
			}
		}

		// no cycle, so commit everything
		OperatorCategory existing = categories.get(id);
		if(existing == null) {
			indices.put(id, order.size());
			order.add(id);
			categories.put(id, new OperatorCategory(id, label, tighterThan, weakerThan, null));
		} else {
			categories.put(id, existing.withEdges(tighterThan, weakerThan));
		}
		for(String t : tighterThan) {
			if(!t.equals(id)) {
				categories.put(t, categories.get(t).withEdges(Collections.emptySet(), Collections.singleton(id)));
			}
		}
		for(String w : weakerThan) {
			if(!w.equals(id)) {
				categories.put(w, categories.get(w).withEdges(Collections.singleton(id), Collections.emptySet()));
			}
		}
		closure = null;
		logger.fine("declared category " + id + " tighter than " + tighterThan + ", weaker than " + weakerThan);
	}

	/**
	 * Makes repeated use of category's operators fold through the operator combinator.
	 */
	public void setChainPolicy(String category, String combinator) {
		checkMutable();
		OperatorCategory existing = categories.get(category);
		if(existing == null) {
			throw new UnknownCategoryIssue(category, combinator);
		}
		categories.put(category, existing.withChainCombinator(combinator));
	}

	private static Collection<String> concat(Set<String> a, Set<String> b) {
		List<String> result = new ArrayList<>(a);
		result.addAll(b);
		return result;
	}

	// breadth-first, so the reported cycle is a shortest one
	private static List<String> findPath(Map<String, Set<String>> successors, String from, String to) {
		Map<String, String> parents = new HashMap<>();
		Deque<String> queue = new ArrayDeque<>();
		queue.add(from);
		parents.put(from, null);
		while(!queue.isEmpty()) {
			String current = queue.poll();
			if(current.equals(to)) {
				List<String> path = new ArrayList<>();
				for(String step = current; step != null; step = parents.get(step)) {
					path.add(0, step);
				}
				return path;
			}
			for(String next : successors.getOrDefault(current, Collections.emptySet())) {
				if(!parents.containsKey(next)) {
					parents.put(next, current);
					queue.add(next);
				}
			}
		}
		return null;
	}

	private BitSet[] computeClosure() {
		BitSet[] rows = new BitSet[order.size()];
		for(int i = 0; i < order.size(); ++i) {
			fillRow(rows, i);
		}
		closure = rows;
		return rows;
	}

	private BitSet fillRow(BitSet[] rows, int index) {
		if(rows[index] != null) {
			return rows[index];
		}
		BitSet row = new BitSet(order.size());
		for(String next : categories.get(order.get(index)).getTighterThan()) {
			int nextIndex = indices.get(next);
			row.set(nextIndex);
			row.or(fillRow(rows, nextIndex));
		}
		rows[index] = row;
		return row;
	}

	private BitSet[] getClosure() {
		BitSet[] rows = closure;
		if(rows == null) {
			rows = computeClosure();
		}
		return rows;
	}

	/**
	 * @return true iff a binds more tightly than b; false for equal or unrelated categories
	 */
	public boolean tighterThan(String a, String b) {
		Integer ia = indices.get(a);
		Integer ib = indices.get(b);
		if(ia == null || ib == null) {
			return false;
		}
		return tighterThan(ia, ib);
	}

	public boolean tighterThan(int a, int b) {
		return getClosure()[a].get(b);
	}

	public boolean comparable(String a, String b) {
		return a.equals(b) || tighterThan(a, b) || tighterThan(b, a);
	}

	/**
	 * @return the indices of every category a is tighter than
	 */
	public BitSet weakerCategories(int a) {
		return (BitSet) getClosure()[a].clone();
	}

	public boolean contains(String id) {
		return categories.containsKey(id);
	}

	public OperatorCategory get(String id) {
		return categories.get(id);
	}

	public int indexOf(String id) {
		Integer index = indices.get(id);
		return index == null ? -1 : index;
	}

	public String idAt(int index) {
		return order.get(index);
	}

	public int size() {
		return order.size();
	}

	/**
	 * @return the categories in declaration order
	 */
	public List<OperatorCategory> getCategories() {
		List<OperatorCategory> result = new ArrayList<>(order.size());
		for(String id : order) {
			result.add(categories.get(id));
		}
		return Collections.unmodifiableList(result);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CategoryGraph that = (CategoryGraph) o;
		return order.equals(that.order) && categories.equals(that.categories);
	}

	@Override
	public int hashCode() {
		return order.hashCode() * 31 + categories.hashCode();
	}

}
