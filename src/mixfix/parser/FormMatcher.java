package mixfix.parser;

import mixfix.grammar.CompiledOperator;
import mixfix.model.operator.FormPart;
import mixfix.model.operator.Keyword;
import mixfix.model.operator.ParamSlot;
import mixfix.model.operator.Placeholder;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds every way an operator's display form can cover a span exactly. Keywords must appear at the span's
 * top level, outside any parentheses or brackets, and every operand gets a non-empty sub-span.
 */
final class FormMatcher {

	private final ParseChart chart;
	private final CompiledOperator operator;
	private final List<FormPart> form;
	private final int start;
	private final int end;

	private final int[] operandStarts;
	private final int[] operandEnds;
	private final List<Integer> keywordPositions = new ArrayList<>();
	private int paramKeyword = -1;
	private int bracketOpen = -1;
	private int bracketClose = -1;

	private final List<OperatorItem> matches = new ArrayList<>();

	private FormMatcher(ParseChart chart, CompiledOperator operator, int start, int end) {
		this.chart = chart;
		this.operator = operator;
		this.form = operator.getDefinition().getForm();
		this.start = start;
		this.end = end;
		this.operandStarts = new int[operator.getSlots().size()];
		this.operandEnds = new int[operator.getSlots().size()];
	}

	static List<OperatorItem> match(ParseChart chart, CompiledOperator operator, int start, int end) {
		FormMatcher matcher = new FormMatcher(chart, operator, start, end);
		matcher.matchFrom(0, 0, start);
		return matcher.matches;
	}

	private void matchFrom(int partIndex, int slotIndex, int pos) {
		if(partIndex == form.size()) {
			if(pos == end) {
				matches.add(new OperatorItem(operator, start, end, operandStarts.clone(), operandEnds.clone(),
						new ArrayList<>(keywordPositions), paramKeyword, bracketOpen, bracketClose));
			}
			return;
		}
		FormPart part = form.get(partIndex);
		if(part instanceof Keyword) {
			if(pos < end && chart.isKeywordAt(pos, ((Keyword) part).getText())) {
				keywordPositions.add(pos);
				matchFrom(partIndex + 1, slotIndex, pos + 1);
				keywordPositions.remove(keywordPositions.size() - 1);
			}
		} else if(part instanceof ParamSlot) {
			matchParamSlot((ParamSlot) part, partIndex, slotIndex, pos);
		} else if(part instanceof Placeholder) {
			matchPlaceholder(partIndex, slotIndex, pos);
		}
	}

	private void matchParamSlot(ParamSlot slot, int partIndex, int slotIndex, int pos) {
		paramKeyword = pos - 1;
		if(pos < end && chart.isOpenBracket(pos)) {
			int close = chart.partner(pos);
			int next = close + 1;
			if(slot.getClosingKeyword() != null) {
				if(next >= end || !chart.isKeywordAt(next, slot.getClosingKeyword())) {
					return;
				}
				++next;
			}
			bracketOpen = pos;
			bracketClose = close;
			matchFrom(partIndex + 1, slotIndex, next);
			bracketOpen = -1;
			bracketClose = -1;
		} else {
			matchFrom(partIndex + 1, slotIndex, pos);
		}
	}

	private void matchPlaceholder(int partIndex, int slotIndex, int pos) {
		if(pos >= end) {
			return;
		}
		operandStarts[slotIndex] = pos;
		if(partIndex == form.size() - 1) {
			operandEnds[slotIndex] = end;
			matchFrom(partIndex + 1, slotIndex + 1, end);
			return;
		}
		// a well formed operator never has two adjacent placeholders
		String next = ((Keyword) form.get(partIndex + 1)).getText();
		for(int split = chart.nextUnit(pos); split < end; split = chart.nextUnit(split)) {
			if(chart.isKeywordAt(split, next)) {
				operandEnds[slotIndex] = split;
				matchFrom(partIndex + 1, slotIndex + 1, split);
			}
		}
	}
}
