package mixfix.grammar;

import mixfix.lexer.Token;
import mixfix.model.category.CategoryGraph;
import mixfix.model.operator.OperatorDefinition;
import mixfix.registry.RegistrySnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The parse tables derived from one {@link RegistrySnapshot}. Built once by {@link GrammarBuilder} and never
 * changed; a new snapshot gets a new grammar.
 */
public class CompiledGrammar {

	private final RegistrySnapshot snapshot;
	private final List<CompiledOperator> operators;
	private final Map<String, CompiledOperator> byId;
	private final Map<String, List<CompiledOperator>> byCategory;
	// keyword text to the compiled operators the snapshot's index finds for it, filled on first use
	private final Map<String, List<CompiledOperator>> byLeadingKeyword = new ConcurrentHashMap<>();
	private final Map<String, List<CompiledOperator>> byToken = new ConcurrentHashMap<>();
	private final Set<String> keywords;
	private final CompiledOperator juxtaposition;
	private final Map<OperandContext, OperandContext> contexts;

	CompiledGrammar(RegistrySnapshot snapshot, List<CompiledOperator> operators, Map<String, CompiledOperator> byId,
	                Map<String, List<CompiledOperator>> byCategory, Set<String> keywords,
	                CompiledOperator juxtaposition, Map<OperandContext, OperandContext> contexts) {
		this.snapshot = snapshot;
		this.operators = Collections.unmodifiableList(operators);
		this.byId = Collections.unmodifiableMap(byId);
		this.byCategory = Collections.unmodifiableMap(byCategory);
		this.keywords = Collections.unmodifiableSet(keywords);
		this.juxtaposition = juxtaposition;
		this.contexts = new ConcurrentHashMap<>(contexts);
	}

	public RegistrySnapshot getSnapshot() {
		return snapshot;
	}

	public CategoryGraph getCategories() {
		return snapshot.getCategories();
	}

	public List<CompiledOperator> getOperators() {
		return operators;
	}

	public CompiledOperator getOperator(String id) {
		return byId.get(id);
	}

	public List<CompiledOperator> operatorsInCategory(String category) {
		return byCategory.getOrDefault(category, Collections.emptyList());
	}

	/**
	 * @return operators whose form starts with the keyword text
	 */
	public List<CompiledOperator> withLeadingKeyword(String text) {
		return byLeadingKeyword.computeIfAbsent(text, t -> compiled(snapshot.withLeadingKeyword(t)));
	}

	/**
	 * @return the operators that could start at token or continue with it, as
	 * {@link RegistrySnapshot#lookup(Token)} finds them
	 */
	public List<CompiledOperator> lookup(Token token) {
		return byToken.computeIfAbsent(token.getValue(), t -> compiled(snapshot.lookup(token)));
	}

	private List<CompiledOperator> compiled(List<OperatorDefinition> definitions) {
		List<CompiledOperator> result = new ArrayList<>(definitions.size());
		for(OperatorDefinition definition : definitions) {
			result.add(byId.get(definition.getId()));
		}
		return Collections.unmodifiableList(result);
	}

	public boolean isKeyword(String text) {
		return keywords.contains(text);
	}

	/**
	 * @return the juxtaposition operator, or null when adjacent operands are not an application
	 */
	public CompiledOperator getJuxtaposition() {
		return juxtaposition;
	}

	/**
	 * @return the context of an operand whose given edges touch an operator of category categoryIndex
	 */
	public OperandContext context(boolean checkLeftEdge, boolean checkRightEdge, int categoryIndex, boolean strict) {
		if(!checkLeftEdge && !checkRightEdge) {
			return OperandContext.ROOT;
		}
		return intern(GrammarBuilder.buildContext(getCategories(), checkLeftEdge, checkRightEdge, categoryIndex,
				strict));
	}

	/**
	 * Like {@link #context}, except that an operator of a category incomparable to categoryIndex is not accepted
	 * either. Such an operator parses, but only as one of several competing readings, so a printer has to
	 * parenthesise it.
	 */
	public OperandContext unambiguousContext(boolean checkLeftEdge, boolean checkRightEdge, int categoryIndex,
	                                         boolean strict) {
		if(!checkLeftEdge && !checkRightEdge) {
			return OperandContext.ROOT;
		}
		return intern(GrammarBuilder.buildUnambiguousContext(getCategories(), checkLeftEdge, checkRightEdge,
				categoryIndex, strict));
	}

	private OperandContext intern(OperandContext context) {
		OperandContext existing = contexts.putIfAbsent(context, context);
		return existing == null ? context : existing;
	}
}
