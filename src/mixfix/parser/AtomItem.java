package mixfix.parser;

import mixfix.grammar.OperandContext;
import mixfix.model.tree.Atom;
import mixfix.model.tree.ParseNode;

final class AtomItem extends ChartItem {

	AtomItem(int index) {
		super(index, index + 1);
	}

	@Override
	boolean acceptedIn(OperandContext context) {
		return true;
	}

	@Override
	int countDerivations(ParseChart chart, OperandContext context) {
		return 1;
	}

	@Override
	ParseNode build(ParseChart chart, OperandContext context) {
		return new Atom(chart.token(getStart()));
	}

	@Override
	CompetingOperator asCompetitor(ParseChart chart) {
		return null;
	}
}
