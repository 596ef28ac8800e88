package mixfix.parser;

import mixfix.grammar.CompiledOperator;
import mixfix.grammar.OperandContext;
import mixfix.grammar.OperandSlot;
import mixfix.grammar.SlotSide;
import mixfix.model.operator.ParamSlot;
import mixfix.model.tree.Apply;
import mixfix.model.tree.ParamValue;
import mixfix.model.tree.ParseNode;
import mixfix.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A use of an operator over a span: where each of its keywords was found, the sub-span of each operand, and
 * the bracket holding its inner parameters if one was written.
 */
final class OperatorItem extends ChartItem {

	private final CompiledOperator operator;
	private final int[] operandStarts;
	private final int[] operandEnds;
	private final List<Integer> keywordPositions;
	private final int paramKeyword;
	private final int bracketOpen;
	private final int bracketClose;

	/**
	 * @param paramKeyword position of the keyword carrying the inner parameters, -1 if the operator has none
	 * @param bracketOpen position of the written parameter bracket, -1 if none was written
	 */
	OperatorItem(CompiledOperator operator, int start, int end, int[] operandStarts, int[] operandEnds,
	             List<Integer> keywordPositions, int paramKeyword, int bracketOpen, int bracketClose) {
		super(start, end);
		this.operator = operator;
		this.operandStarts = operandStarts;
		this.operandEnds = operandEnds;
		this.keywordPositions = Collections.unmodifiableList(keywordPositions);
		this.paramKeyword = paramKeyword;
		this.bracketOpen = bracketOpen;
		this.bracketClose = bracketClose;
	}

	CompiledOperator getOperator() {
		return operator;
	}

	List<Integer> getKeywordPositions() {
		return keywordPositions;
	}

	boolean hasBracket() {
		return bracketOpen >= 0;
	}

	@Override
	boolean acceptedIn(OperandContext context) {
		return context.accepts(operator);
	}

	private static OperandContext operandContext(OperandContext context, OperandSlot slot) {
		return context.narrow(slot.getContext(), slot.getSide() == SlotSide.LEADING,
				slot.getSide() == SlotSide.TRAILING);
	}

	@Override
	int countDerivations(ParseChart chart, OperandContext context) {
		int result = 1;
		List<OperandSlot> slots = operator.getSlots();
		for(int i = 0; i < slots.size() && result > 0; ++i) {
			result = saturatingProduct(result, chart.total(operandStarts[i], operandEnds[i],
					operandContext(context, slots.get(i))));
		}
		return result;
	}

	@Override
	ParseNode build(ParseChart chart, OperandContext context) {
		List<OperandSlot> slots = operator.getSlots();
		List<ParseNode> operands = new ArrayList<>(slots.size());
		for(int i = 0; i < slots.size(); ++i) {
			operands.add(chart.build(operandStarts[i], operandEnds[i], operandContext(context, slots.get(i))));
		}
		Map<String, ParamValue> params = Collections.emptyMap();
		ParamSlot paramSlot = operator.getDefinition().getParamSlot();
		if(paramSlot != null) {
			if(hasBracket()) {
				params = InnerParameterParser.parse(operator.getId(), paramSlot,
						chart.tokens(bracketOpen + 1, bracketClose), chart.location(bracketOpen, bracketClose + 1));
			} else {
				params = InnerParameterParser.defaults(operator.getId(), paramSlot,
						chart.location(paramKeyword, paramKeyword + 1));
			}
		}
		return new Apply(chart.location(getStart(), getEnd()), operator.getId(), operands, params);
	}

	@Override
	CompetingOperator asCompetitor(ParseChart chart) {
		SourceLocation location;
		if(keywordPositions.isEmpty()) {
			location = chart.location(getStart(), getEnd());
		} else {
			location = chart.location(keywordPositions.get(0), keywordPositions.get(0) + 1);
		}
		return new CompetingOperator(operator.getId(), operator.getCategory(), location);
	}

	@Override
	public String toString() {
		return "OperatorItem [operator=" + operator.getId() + ", start=" + getStart() + ", end=" + getEnd() +
				", keywords=" + keywordPositions + "]";
	}
}
