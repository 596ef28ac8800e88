package mixfix.parser;

import mixfix.grammar.OperandContext;
import mixfix.model.tree.ParseNode;

import java.util.HashMap;
import java.util.Map;

/**
 * One way of reading a span of tokens as a single operand. Derivation counts saturate at 2: all that matters is
 * whether there are none, one, or several. They depend on the context, since the constraints on an operand's
 * edges pass down to the operands of its own that share those edges.
 */
abstract class ChartItem {

	static final int MANY = 2;

	private final int start;
	private final int end;
	private final Map<OperandContext, Integer> derivations = new HashMap<>();

	ChartItem(int start, int end) {
		this.start = start;
		this.end = end;
	}

	int getStart() {
		return start;
	}

	int getEnd() {
		return end;
	}

	/**
	 * @return true if this item may stand where context requires an operand
	 */
	abstract boolean acceptedIn(OperandContext context);

	abstract int countDerivations(ParseChart chart, OperandContext context);

	/**
	 * @return the tree of this item, assuming it has exactly one derivation in context
	 */
	abstract ParseNode build(ParseChart chart, OperandContext context);

	/**
	 * @return a description of this item for ambiguity reports, or null if it is not an operator use
	 */
	abstract CompetingOperator asCompetitor(ParseChart chart);

	final int derivations(ParseChart chart, OperandContext context) {
		Integer memo = derivations.get(context);
		if(memo == null) {
			memo = Math.min(countDerivations(chart, context), MANY);
			derivations.put(context, memo);
		}
		return memo;
	}

	static int saturatingProduct(int a, int b) {
		return Math.min(a * b, MANY);
	}

	static int saturatingSum(int a, int b) {
		return Math.min(a + b, MANY);
	}
}
