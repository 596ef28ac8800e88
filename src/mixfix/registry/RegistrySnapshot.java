package mixfix.registry;

import mixfix.grammar.CompiledGrammar;
import mixfix.grammar.GrammarBuilder;
import mixfix.lexer.Token;
import mixfix.model.category.CategoryGraph;
import mixfix.model.operator.OperatorDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable view of an {@link OperatorRegistry} at one point in time. Any number of threads may parse
 * against the same snapshot; each parse only reads it.
 */
public class RegistrySnapshot {

	private final CategoryGraph categories;
	private final Map<String, OperatorDefinition> operators;
	private final OperatorIndex index;
	private final Map<String, Scope> scopes;
	private final OperatorDefinition juxtaposition;

	private volatile CompiledGrammar grammar;

	RegistrySnapshot(CategoryGraph categories, Map<String, OperatorDefinition> operators, OperatorIndex index,
	                 Map<String, Scope> scopes, OperatorDefinition juxtaposition) {
		this.categories = categories;
		this.operators = Collections.unmodifiableMap(new LinkedHashMap<>(operators));
		this.index = index;
		this.scopes = Collections.unmodifiableMap(new LinkedHashMap<>(scopes));
		this.juxtaposition = juxtaposition;
	}

	public CategoryGraph getCategories() {
		return categories;
	}

	/**
	 * @return the declared operators in declaration order, not including juxtaposition
	 */
	public List<OperatorDefinition> getOperators() {
		return new ArrayList<>(operators.values());
	}

	public OperatorDefinition getOperator(String id) {
		OperatorDefinition definition = operators.get(id);
		if(definition == null && juxtaposition != null && juxtaposition.getId().equals(id)) {
			return juxtaposition;
		}
		return definition;
	}

	public OperatorDefinition getJuxtaposition() {
		return juxtaposition;
	}

	/**
	 * @return the operators that could start at token (their form starts with its text) or continue with it
	 * (their form starts with a placeholder followed by its text)
	 */
	public List<OperatorDefinition> lookup(Token token) {
		return index.lookup(token);
	}

	/**
	 * @return the operators whose form starts with the keyword text
	 */
	public List<OperatorDefinition> withLeadingKeyword(String text) {
		return index.withLeadingKeyword(text);
	}


	/**
	 * @return the ids of the operators using text as one of their keywords
	 */
	public Set<String> operatorsUsingKeyword(String text) {
		return index.usersOf(text);
	}

	/**
	 * @return the named scope; a scope nothing was imported into only sees pronounceable operators
	 */
	public Scope getScope(String name) {
		Scope scope = scopes.get(name);
		return scope == null ? new Scope(name, Collections.emptySet()) : scope;
	}

	/**
	 * @return the grammar compiled from this snapshot, compiling it on first use
	 */
	public CompiledGrammar getGrammar() {
		CompiledGrammar result = grammar;
		if(result == null) {
			synchronized (this) {
				result = grammar;
				if(result == null) {
					result = GrammarBuilder.compile(this);
					grammar = result;
				}
			}
		}
		return result;
	}
}
