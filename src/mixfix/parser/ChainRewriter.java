package mixfix.parser;

import mixfix.grammar.CompiledGrammar;
import mixfix.grammar.CompiledOperator;
import mixfix.grammar.OperandContext;
import mixfix.model.category.CategoryGraph;
import mixfix.model.category.OperatorCategory;
import mixfix.model.operator.OperatorShape;
import mixfix.model.tree.Chain;
import mixfix.model.tree.ParseNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Resolves a span with several derivations.
 *
 * <p>If every derivation is an infix operator of the same chain enabled category K, the span is a run
 * {@code x0 op1 x1 ... opn xn} of relations from K. It becomes a single {@link Chain}, provided each xi parses
 * uniquely as an operand strictly tighter than K. Anything else is an {@link AmbiguousExpressionIssue}.</p>
 */
public final class ChainRewriter {

	private static final Logger logger = Logger.getLogger(ChainRewriter.class.getName());

	ParseNode rewrite(ParseChart chart, int start, int end, OperandContext context, List<ChartItem> alternatives) {
		CompiledGrammar grammar = chart.getGrammar();
		OperatorCategory category = chainCategory(grammar, alternatives);
		if(category == null) {
			throw ambiguity(chart, start, end, alternatives);
		}
		int categoryIndex = grammar.getCategories().indexOf(category.getId());

		Map<Integer, CompiledOperator> relations = new TreeMap<>();
		for(ChartItem alternative : alternatives) {
			OperatorItem item = (OperatorItem) alternative;
			relations.put(item.getKeywordPositions().get(0), item.getOperator());
		}

		List<ParseNode> operands = new ArrayList<>();
		List<String> relationIds = new ArrayList<>();
		int leafStart = start;
		for(Map.Entry<Integer, CompiledOperator> relation : relations.entrySet()) {
			// the first leaf shares the chain's left edge
			OperandContext leafContext = context.narrow(grammar.context(leafStart != start, true, categoryIndex, true),
					leafStart == start, false);
			operands.add(buildLeaf(chart, leafStart, relation.getKey(), leafContext, start, end, alternatives));
			relationIds.add(relation.getValue().getId());
			leafStart = relation.getKey() + 1;
		}
		operands.add(buildLeaf(chart, leafStart, end,
				context.narrow(grammar.context(true, false, categoryIndex, true), false, true), start, end, alternatives));

		logger.finer("folded " + relationIds + " into a chain of category " + category.getId());
		return new Chain(chart.location(start, end), category.getId(), category.getChainCombinator(), operands,
				relationIds);
	}

	private ParseNode buildLeaf(ParseChart chart, int leafStart, int leafEnd, OperandContext leafContext,
	                            int start, int end, List<ChartItem> alternatives) {
		if(chart.total(leafStart, leafEnd, leafContext) == 0) {
			throw ambiguity(chart, start, end, alternatives);
		}
		return chart.build(leafStart, leafEnd, leafContext);
	}

	/**
	 * @return the category all alternatives are chainable relations of, or null if there is none
	 */
	private static OperatorCategory chainCategory(CompiledGrammar grammar, List<ChartItem> alternatives) {
		String category = null;
		for(ChartItem alternative : alternatives) {
			if(!(alternative instanceof OperatorItem)) {
				return null;
			}
			CompiledOperator operator = ((OperatorItem) alternative).getOperator();
			// a relation's parameters would be lost in the chain
			if(operator.getShape() != OperatorShape.INFIX || operator.getDefinition().getParamSlot() != null) {
				return null;
			}
			if(category == null) {
				category = operator.getCategory();
			} else if(!category.equals(operator.getCategory())) {
				return null;
			}
		}
		OperatorCategory result = grammar.getCategories().get(category);
		return result != null && result.isChainEnabled() ? result : null;
	}

	static AmbiguousExpressionIssue ambiguity(ParseChart chart, int start, int end, List<ChartItem> alternatives) {
		CategoryGraph categories = chart.getGrammar().getCategories();
		List<CompetingOperator> competitors = new ArrayList<>();
		for(ChartItem alternative : alternatives) {
			CompetingOperator competitor = alternative.asCompetitor(chart);
			if(competitor != null) {
				competitors.add(competitor);
			}
		}
		List<List<String>> incomparable = new ArrayList<>();
		for(int i = 0; i < competitors.size(); ++i) {
			for(int j = i + 1; j < competitors.size(); ++j) {
				String a = competitors.get(i).getCategory();
				String b = competitors.get(j).getCategory();
				List<String> pair = Arrays.asList(a, b);
				if(!categories.comparable(a, b) && !incomparable.contains(pair) &&
						!incomparable.contains(Arrays.asList(b, a))) {
					incomparable.add(pair);
				}
			}
		}
		return new AmbiguousExpressionIssue(chart.location(start, end), competitors, incomparable);
	}
}
