package mixfix.parser;

import mixfix.grammar.OperandContext;
import mixfix.model.tree.ParseNode;

/**
 * A parenthesised span. It is closed on both sides, so any operand position accepts it, and its contents are
 * parsed as a fresh expression.
 */
final class GroupItem extends ChartItem {

	GroupItem(int open, int close) {
		super(open, close + 1);
	}

	@Override
	boolean acceptedIn(OperandContext context) {
		return true;
	}

	@Override
	int countDerivations(ParseChart chart, OperandContext context) {
		return chart.total(getStart() + 1, getEnd() - 1, OperandContext.ROOT);
	}

	@Override
	ParseNode build(ParseChart chart, OperandContext context) {
		return chart.build(getStart() + 1, getEnd() - 1, OperandContext.ROOT);
	}

	@Override
	CompetingOperator asCompetitor(ParseChart chart) {
		return null;
	}
}
