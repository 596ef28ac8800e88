package mixfix.registry;

import mixfix.lexer.Token;
import mixfix.model.operator.FormPart;
import mixfix.model.operator.Keyword;
import mixfix.model.operator.OperatorDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dispatch tables from keyword text to the operators that could start, or continue, at a token with that text.
 */
class OperatorIndex {

	// operators whose form starts with this keyword
	private final Map<String, List<OperatorDefinition>> byLeadingKeyword;
	// operators whose form starts with a placeholder followed by this keyword
	private final Map<String, List<OperatorDefinition>> byFirstKeyword;
	// every keyword text, including interior and closing keywords, to the operators using it
	private final Map<String, Set<String>> keywordUsers;

	OperatorIndex() {
		this.byLeadingKeyword = new HashMap<>();
		this.byFirstKeyword = new HashMap<>();
		this.keywordUsers = new HashMap<>();
	}

	OperatorIndex(OperatorIndex other) {
		this();
		for(Map.Entry<String, List<OperatorDefinition>> e : other.byLeadingKeyword.entrySet()) {
			byLeadingKeyword.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
		}
		for(Map.Entry<String, List<OperatorDefinition>> e : other.byFirstKeyword.entrySet()) {
			byFirstKeyword.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
		}
		for(Map.Entry<String, Set<String>> e : other.keywordUsers.entrySet()) {
			keywordUsers.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
		}
	}

	void add(OperatorDefinition definition) {
		FormPart first = definition.getForm().get(0);
		if(first instanceof Keyword) {
			byLeadingKeyword.computeIfAbsent(((Keyword) first).getText(), k -> new ArrayList<>()).add(definition);
		} else if(definition.getFirstKeyword() != null) {
			byFirstKeyword.computeIfAbsent(definition.getFirstKeyword(), k -> new ArrayList<>()).add(definition);
		}
		for(String text : definition.getAllKeywordTexts()) {
			keywordUsers.computeIfAbsent(text, k -> new LinkedHashSet<>()).add(definition.getId());
		}
	}

	List<OperatorDefinition> withLeadingKeyword(String text) {
		return byLeadingKeyword.getOrDefault(text, Collections.emptyList());
	}

	List<OperatorDefinition> withFirstKeyword(String text) {
		return byFirstKeyword.getOrDefault(text, Collections.emptyList());
	}

	Set<String> usersOf(String text) {
		return keywordUsers.getOrDefault(text, Collections.emptySet());
	}

	List<OperatorDefinition> lookup(Token token) {
		List<OperatorDefinition> result = new ArrayList<>(withLeadingKeyword(token.getValue()));
		result.addAll(withFirstKeyword(token.getValue()));
		return result;
	}
}
