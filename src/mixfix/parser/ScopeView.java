package mixfix.parser;

import mixfix.grammar.CompiledGrammar;
import mixfix.grammar.CompiledOperator;
import mixfix.registry.Scope;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The operators of a grammar that one scope can see, and the keyword texts they use.
 */
final class ScopeView {

	private final CompiledGrammar grammar;
	private final Scope scope;
	private final Set<String> visibleIds;
	private final Set<String> keywords;

	ScopeView(CompiledGrammar grammar, Scope scope) {
		this.grammar = grammar;
		this.scope = scope;
		this.visibleIds = new HashSet<>();
		this.keywords = new HashSet<>();
		for(CompiledOperator operator : grammar.getOperators()) {
			if(scope.isVisible(operator.getDefinition())) {
				visibleIds.add(operator.getId());
				keywords.addAll(operator.getDefinition().getAllKeywordTexts());
			}
		}
	}

	Scope getScope() {
		return scope;
	}

	boolean isVisible(CompiledOperator operator) {
		return visibleIds.contains(operator.getId());
	}

	boolean isKeyword(String text) {
		return keywords.contains(text);
	}

	/**
	 * @return ids of operators using text as a keyword that this scope did not import
	 */
	List<String> hiddenUsersOf(String text) {
		List<String> hidden = new ArrayList<>();
		for(String id : grammar.getSnapshot().operatorsUsingKeyword(text)) {
			if(!visibleIds.contains(id)) {
				hidden.add(id);
			}
		}
		return hidden;
	}
}
