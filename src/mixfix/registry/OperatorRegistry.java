package mixfix.registry;

import mixfix.lexer.Token;
import mixfix.model.category.CategoryGraph;
import mixfix.model.category.OperatorCategory;
import mixfix.model.category.UnknownCategoryIssue;
import mixfix.model.operator.FormPart;
import mixfix.model.operator.FormPartVisitor;
import mixfix.model.operator.InnerParameter;
import mixfix.model.operator.Keyword;
import mixfix.model.operator.OperatorDefinition;
import mixfix.model.operator.ParamSlot;
import mixfix.model.operator.Placeholder;
import mixfix.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Collects category and operator declarations for one compilation unit, in the order the directive processor
 * issues them. Every declaration is atomic: it is either fully applied or rejected with an issue, leaving the
 * registry as it was.
 *
 * <p>Parsing never reads a registry directly, only a {@link RegistrySnapshot} taken from it.</p>
 */
public class OperatorRegistry {

	private static final Logger logger = Logger.getLogger(OperatorRegistry.class.getName());

	public static final String DEFAULT_JUXTAPOSITION_ID = "juxtaposition";

	private final CategoryGraph categories;
	private final Map<String, OperatorDefinition> operators;
	private final Map<List<String>, OperatorDefinition> skeletons;
	private final OperatorIndex index;
	private final Map<String, Set<String>> imports;
	private OperatorDefinition juxtaposition;

	public OperatorRegistry() {
		this.categories = new CategoryGraph();
		this.operators = new LinkedHashMap<>();
		this.skeletons = new HashMap<>();
		this.index = new OperatorIndex();
		this.imports = new LinkedHashMap<>();
		this.juxtaposition = null;
	}

	public void declareCategory(String id, Set<String> tighterThan, Set<String> weakerThan) {
		categories.declareCategory(id, tighterThan, weakerThan);
	}

	public void declareCategory(String id, String label, Set<String> tighterThan, Set<String> weakerThan) {
		categories.declareCategory(id, label, tighterThan, weakerThan);
	}

	public void setChainPolicy(String category, String combinator) {
		categories.setChainPolicy(category, combinator);
	}

	public CategoryGraph getCategories() {
		return categories;
	}

	/**
	 * @throws MalformedOperatorIssue if the display form cannot be parsed unambiguously at the token level
	 * @throws UnknownCategoryIssue if the operator has no category, or an undeclared one
	 * @throws DuplicateOperatorIssue if the id is taken, or another operator has the same skeleton
	 */
	public void declareOperator(OperatorDefinition definition) {
		checkForm(definition);
		if(definition.getCategory() == null || !categories.contains(definition.getCategory())) {
			throw new UnknownCategoryIssue(definition.getCategory(), definition.getId());
		}
		OperatorDefinition existing = operators.get(definition.getId());
		if(existing == null) {
			existing = skeletons.get(definition.getSkeleton());
		}
		if(existing == null && juxtaposition != null && juxtaposition.getId().equals(definition.getId())) {
			existing = juxtaposition;
		}
		if(existing != null) {
			throw new DuplicateOperatorIssue(definition, existing);
		}
		operators.put(definition.getId(), definition);
		skeletons.put(definition.getSkeleton(), definition);
		index.add(definition);
		logger.fine("declared operator " + definition.getId() + " in category " + definition.getCategory() +
				" as " + definition.getShape());
	}

	/**
	 * Makes the symbolic operator id usable in scope.
	 *
	 * @throws UndeclaredOperatorSymbolIssue if no such operator exists
	 */
	public void importOperator(String scope, String id) {
		if(!operators.containsKey(id)) {
			throw new UndeclaredOperatorSymbolIssue(id, scope, Collections.emptyList(),
					SourceLocation.unknown());
		}
		imports.computeIfAbsent(scope, k -> new LinkedHashSet<>()).add(id);
	}

	public void enableJuxtaposition(String category) {
		enableJuxtaposition(DEFAULT_JUXTAPOSITION_ID, category);
	}

	/**
	 * Lets two operands written side by side parse as an application of the first to the second, under the
	 * operator id.
	 */
	public void enableJuxtaposition(String id, String category) {
		if(category == null || !categories.contains(category)) {
			throw new UnknownCategoryIssue(category, id);
		}
		OperatorDefinition definition = OperatorDefinition.juxtaposition(id, category);
		if(operators.containsKey(id)) {
			throw new DuplicateOperatorIssue(definition, operators.get(id));
		}
		juxtaposition = definition;
	}

	public OperatorDefinition getOperator(String id) {
		return operators.get(id);
	}

	/**
	 * @return the operators that could start at, or continue with, a keyword token
	 */
	public List<OperatorDefinition> lookup(Token token) {
		return index.lookup(token);
	}

	/**
	 * @return a frozen copy of everything declared so far; later declarations do not affect it
	 * @throws UnknownCombinatorIssue if a chain enabled category's combinator is not a declared operator of two
	 * operands
	 */
	public RegistrySnapshot snapshot() {
		checkChainCombinators();
		Map<String, Scope> scopes = new LinkedHashMap<>();
		for(Map.Entry<String, Set<String>> e : imports.entrySet()) {
			scopes.put(e.getKey(), new Scope(e.getKey(), e.getValue()));
		}
		return new RegistrySnapshot(categories.freeze(), operators, new OperatorIndex(index), scopes, juxtaposition);
	}

	// a category may name its combinator before the combinator is declared
	private void checkChainCombinators() {
		for(OperatorCategory category : categories.getCategories()) {
			if(!category.isChainEnabled()) {
				continue;
			}
			String combinator = category.getChainCombinator();
			OperatorDefinition definition = operators.get(combinator);
			if(definition == null && juxtaposition != null && juxtaposition.getId().equals(combinator)) {
				definition = juxtaposition;
			}
			if(definition == null) {
				throw new UnknownCombinatorIssue(category.getId(), combinator, "is not a declared operator");
			}
			if(definition.getPlaceholders().size() != 2) {
				throw new UnknownCombinatorIssue(category.getId(), combinator,
						"takes " + definition.getPlaceholders().size() + " operand(s) instead of 2");
			}
		}
	}

	private static void checkForm(OperatorDefinition definition) {
		String id = definition.getId();
		if(id == null || id.isEmpty()) {
			throw new MalformedOperatorIssue(id, "the operator has no id");
		}
		List<FormPart> form = definition.getForm();
		if(form.isEmpty()) {
			throw new MalformedOperatorIssue(id, "the display form is empty");
		}
		if(definition.getKeywords().isEmpty()) {
			throw new MalformedOperatorIssue(id, "the display form has no keyword");
		}
		FormChecker checker = new FormChecker(id);
		for(FormPart part : form) {
			part.accept(checker);
		}
	}

	private static final class FormChecker extends FormPartVisitor<Void, RuntimeException> {
		private final String id;
		private final Set<String> placeholderNames = new HashSet<>();
		private FormPart previous = null;
		private boolean seenParamSlot = false;

		FormChecker(String id) {
			this.id = id;
		}

		@Override
		public Void visit(Keyword keyword) {
			checkKeywordText(keyword.getText());
			previous = keyword;
			return null;
		}

		@Override
		public Void visit(Placeholder placeholder) {
			if(previous instanceof Placeholder) {
				throw new MalformedOperatorIssue(id, "placeholders $" + ((Placeholder) previous).getSlot() +
						" and $" + placeholder.getSlot() + " are adjacent");
			}
			if(!placeholderNames.add(placeholder.getSlot())) {
				throw new MalformedOperatorIssue(id, "placeholder $" + placeholder.getSlot() + " appears twice");
			}
			previous = placeholder;
			return null;
		}

		@Override
		public Void visit(ParamSlot paramSlot) {
			if(seenParamSlot) {
				throw new MalformedOperatorIssue(id, "only one keyword may carry inner parameters");
			}
			if(!(previous instanceof Keyword)) {
				throw new MalformedOperatorIssue(id, "inner parameters must directly follow a keyword");
			}
			if(paramSlot.getClosingKeyword() != null) {
				checkKeywordText(paramSlot.getClosingKeyword());
			}
			List<String> names = new ArrayList<>();
			for(InnerParameter parameter : paramSlot.getParameters()) {
				if(names.contains(parameter.getName())) {
					throw new MalformedOperatorIssue(id, "inner parameter " + parameter.getName() + " appears twice");
				}
				names.add(parameter.getName());
			}
			// the slot does not count as a part for adjacency; the closing keyword belongs to the slot
			seenParamSlot = true;
			return null;
		}

		private void checkKeywordText(String text) {
			if(text == null || text.isEmpty()) {
				throw new MalformedOperatorIssue(id, "empty keyword");
			}
			for(char c : text.toCharArray()) {
				if(Character.isWhitespace(c) || "()[],".indexOf(c) != -1) {
					throw new MalformedOperatorIssue(id, "keyword \"" + text + "\" contains '" + c + "'");
				}
			}
			if(text.equals(":")) {
				throw new MalformedOperatorIssue(id, "\":\" is reserved for inner parameter labels");
			}
		}
	}
}
