package mixfix.grammar;

import mixfix.InternalCompilerError;
import mixfix.model.category.CategoryGraph;
import mixfix.model.operator.FormPart;
import mixfix.model.operator.OperatorDefinition;
import mixfix.model.operator.Placeholder;
import mixfix.model.operator.Tightness;
import mixfix.registry.RegistrySnapshot;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Compiles a registry snapshot into a {@link CompiledGrammar}: for each category the operators in it, and for
 * each operator which categories each operand position accepts. Keyword dispatch stays with the snapshot's
 * index; the grammar only maps what it finds to compiled operators.
 */
public class GrammarBuilder {

	private static final Logger logger = Logger.getLogger(GrammarBuilder.class.getName());

	private GrammarBuilder() {}

	public static CompiledGrammar compile(RegistrySnapshot snapshot) {
		CategoryGraph categories = snapshot.getCategories();
		Map<OperandContext, OperandContext> contexts = new HashMap<>();

		List<CompiledOperator> operators = new ArrayList<>();
		Map<String, CompiledOperator> byId = new LinkedHashMap<>();
		Map<String, List<CompiledOperator>> byCategory = new LinkedHashMap<>();
		Set<String> keywords = new HashSet<>();

		for(OperatorDefinition definition : snapshot.getOperators()) {
			CompiledOperator compiled = compileOperator(categories, contexts, definition);
			operators.add(compiled);
			byId.put(compiled.getId(), compiled);
			byCategory.computeIfAbsent(definition.getCategory(), k -> new ArrayList<>()).add(compiled);
			keywords.addAll(definition.getAllKeywordTexts());
		}

		CompiledOperator juxtaposition = null;
		if(snapshot.getJuxtaposition() != null) {
			juxtaposition = compileOperator(categories, contexts, snapshot.getJuxtaposition());
			byId.put(juxtaposition.getId(), juxtaposition);
			byCategory.computeIfAbsent(juxtaposition.getCategory(), k -> new ArrayList<>()).add(juxtaposition);
		}

		logger.fine("compiled grammar of " + operators.size() + " operator(s) over " + categories.size() +
				" categor(ies)");
		return new CompiledGrammar(snapshot, operators, byId, byCategory, keywords, juxtaposition, contexts);
	}

	private static CompiledOperator compileOperator(CategoryGraph categories,
	                                                Map<OperandContext, OperandContext> contexts,
	                                                OperatorDefinition definition) {
		int categoryIndex = categories.indexOf(definition.getCategory());
		if(categoryIndex < 0) {
			throw new InternalCompilerError("operator " + definition.getId() + " has an undeclared category");
		}
		List<FormPart> form = definition.getForm();
		List<Integer> placeholderIndices = new ArrayList<>();
		for(int i = 0; i < form.size(); ++i) {
			if(form.get(i) instanceof Placeholder) {
				placeholderIndices.add(i);
			}
		}

		List<SlotSide> sides = new ArrayList<>();
		switch (definition.getShape()) {
			case PREFIX:
				sides.add(SlotSide.TRAILING);
				break;
			case POSTFIX:
				sides.add(SlotSide.LEADING);
				break;
			case INFIX:
				sides.add(SlotSide.LEADING);
				sides.add(SlotSide.TRAILING);
				break;
			case MIXFIX:
				for(int i = 0; i < placeholderIndices.size(); ++i) {
					if(i == 0 && definition.isLeftOpen()) {
						sides.add(SlotSide.LEADING);
					} else if(i == placeholderIndices.size() - 1 && definition.isRightOpen()) {
						sides.add(SlotSide.TRAILING);
					} else {
						sides.add(SlotSide.INTERIOR);
					}
				}
				break;
			default:
				throw new InternalCompilerError("unknown operator shape " + definition.getShape());
		}

		List<OperandSlot> slots = new ArrayList<>();
		for(int i = 0; i < placeholderIndices.size(); ++i) {
			int partIndex = placeholderIndices.get(i);
			String name = ((Placeholder) form.get(partIndex)).getSlot();
			SlotSide side = sides.get(i);
			OperandContext context;
			switch (side) {
				case LEADING:
					context = intern(contexts, buildContext(categories, false, true, categoryIndex,
							definition.getLeftTightness() == Tightness.STRICTLY_TIGHTER));
					break;
				case TRAILING:
					context = intern(contexts, buildContext(categories, true, false, categoryIndex,
							definition.getRightTightness() == Tightness.STRICTLY_TIGHTER));
					break;
				case INTERIOR:
					context = OperandContext.ROOT;
					break;
				default:
					throw new InternalCompilerError("unknown slot side " + side);
			}
			slots.add(new OperandSlot(name, partIndex, side, context));
		}
		return new CompiledOperator(definition, categoryIndex, slots);
	}

	private static OperandContext intern(Map<OperandContext, OperandContext> contexts, OperandContext context) {
		OperandContext existing = contexts.putIfAbsent(context, context);
		return existing == null ? context : existing;
	}

	static OperandContext buildContext(CategoryGraph categories, boolean checkLeftEdge, boolean checkRightEdge,
	                                   int categoryIndex, boolean strict) {
		BitSet accepted = new BitSet(categories.size());
		accepted.set(0, categories.size());
		// categories the requiring one is tighter than may not appear on a contested edge
		accepted.andNot(categories.weakerCategories(categoryIndex));
		if(strict) {
			accepted.clear(categoryIndex);
		}
		return new OperandContext(checkLeftEdge ? accepted : null, checkRightEdge ? accepted : null);
	}

	// like buildContext, but incomparable categories are left out as well
	static OperandContext buildUnambiguousContext(CategoryGraph categories, boolean checkLeftEdge,
	                                              boolean checkRightEdge, int categoryIndex, boolean strict) {
		BitSet accepted = new BitSet(categories.size());
		for(int i = 0; i < categories.size(); ++i) {
			if(categories.tighterThan(i, categoryIndex) || (i == categoryIndex && !strict)) {
				accepted.set(i);
			}
		}
		return new OperandContext(checkLeftEdge ? accepted : null, checkRightEdge ? accepted : null);
	}
}
