package mixfix.parser;

import mixfix.grammar.CompiledGrammar;
import mixfix.grammar.CompiledOperator;
import mixfix.grammar.OperandContext;
import mixfix.lexer.Token;
import mixfix.lexer.TokenKind;
import mixfix.model.operator.FormPart;
import mixfix.model.operator.Keyword;
import mixfix.model.operator.ParamSlot;
import mixfix.model.tree.ParseNode;
import mixfix.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The memo tables of one parse.
 *
 * <p>Spans are half open token ranges. For every span the items that could cover it are found once; for every
 * pair of a span and an operand context, the number of derivations (none, one or several) is computed once.
 * Every operand of an item covers a strictly smaller span, so the recursion terminates.</p>
 *
 * <p>A chart is private to one parse and is simply dropped when the parse ends or is abandoned.</p>
 */
final class ParseChart {

	private final CompiledGrammar grammar;
	private final ScopeView view;
	private final ChainRewriter chainRewriter;
	private final List<Token> tokens;
	private final int[] partners;

	private final Map<Long, List<ChartItem>> candidates = new HashMap<>();
	private final Map<Cell, Integer> totals = new HashMap<>();

	private static final class Cell {
		private final int start;
		private final int end;
		private final OperandContext context;

		Cell(int start, int end, OperandContext context) {
			this.start = start;
			this.end = end;
			this.context = context;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Cell cell = (Cell) o;
			return start == cell.start && end == cell.end && context.equals(cell.context);
		}

		@Override
		public int hashCode() {
			return Objects.hash(start, end, context);
		}
	}

	/**
	 * @param partners for each opening or closing parenthesis or bracket, the index of its partner; -1 for
	 * every other token
	 */
	ParseChart(CompiledGrammar grammar, ScopeView view, ChainRewriter chainRewriter, List<Token> tokens,
	           int[] partners) {
		this.grammar = grammar;
		this.view = view;
		this.chainRewriter = chainRewriter;
		this.tokens = tokens;
		this.partners = partners;
	}

	CompiledGrammar getGrammar() {
		return grammar;
	}

	int size() {
		return tokens.size();
	}

	Token token(int index) {
		return tokens.get(index);
	}

	List<Token> tokens(int start, int end) {
		return tokens.subList(start, end);
	}

	int partner(int index) {
		return partners[index];
	}

	boolean isOpenBracket(int index) {
		return tokens.get(index).getKind() == TokenKind.OPEN_BRACKET;
	}

	boolean isKeywordAt(int index, String text) {
		Token token = tokens.get(index);
		return token.isKeywordCandidate() && token.getValue().equals(text);
	}

	/**
	 * @return the index after the unit starting at index: a whole parenthesised or bracketed group, or one token
	 */
	int nextUnit(int index) {
		Token token = tokens.get(index);
		if(token.getKind() == TokenKind.OPEN_PAREN || token.getKind() == TokenKind.OPEN_BRACKET) {
			return partners[index] + 1;
		}
		return index + 1;
	}

	boolean isAtom(int index) {
		Token token = tokens.get(index);
		return token.getKind() == TokenKind.NUMERAL ||
				(token.getKind() == TokenKind.IDENTIFIER && !view.isKeyword(token.getValue()));
	}

	SourceLocation location(int start, int end) {
		if(start >= end) {
			if(start < tokens.size()) {
				return tokens.get(start).getLocation();
			}
			return tokens.isEmpty() ? SourceLocation.unknown() : tokens.get(tokens.size() - 1).getLocation();
		}
		return tokens.get(start).getLocation().combine(tokens.get(end - 1).getLocation());
	}

	List<ChartItem> candidates(int start, int end) {
		long key = (long) start * (tokens.size() + 1) + end;
		List<ChartItem> items = candidates.get(key);
		if(items == null) {
			items = findCandidates(start, end);
			candidates.put(key, items);
		}
		return items;
	}

	private List<ChartItem> findCandidates(int start, int end) {
		List<ChartItem> items = new ArrayList<>();
		if(start >= end) {
			return items;
		}
		if(end - start == 1 && isAtom(start)) {
			items.add(new AtomItem(start));
			return items;
		}
		if(tokens.get(start).getKind() == TokenKind.OPEN_PAREN && partners[start] == end - 1) {
			items.add(new GroupItem(start, end - 1));
			return items;
		}

		// operators that start at the first token, then operators whose first keyword comes after a leading operand
		Set<CompiledOperator> operators = new LinkedHashSet<>();
		Token first = tokens.get(start);
		if(first.isKeywordCandidate()) {
			for(CompiledOperator operator : grammar.lookup(first)) {
				if(!operator.isLeftOpen() && view.isVisible(operator)) {
					operators.add(operator);
				}
			}
		}
		for(int i = nextUnit(start); i < end; i = nextUnit(i)) {
			Token token = tokens.get(i);
			if(token.isKeywordCandidate()) {
				for(CompiledOperator operator : grammar.lookup(token)) {
					if(operator.isLeftOpen() && view.isVisible(operator)) {
						operators.add(operator);
					}
				}
			}
		}
		for(CompiledOperator operator : operators) {
			items.addAll(FormMatcher.match(this, operator, start, end));
		}

		CompiledOperator juxtaposition = grammar.getJuxtaposition();
		if(juxtaposition != null) {
			for(int split = nextUnit(start); split < end; split = nextUnit(split)) {
				items.add(new OperatorItem(juxtaposition, start, end, new int[]{start, split}, new int[]{split, end},
						Collections.emptyList(), -1, -1, -1));
			}
		}
		return items;
	}

	/**
	 * @return the number of derivations of the span as an operand in context, saturated at 2
	 */
	int total(int start, int end, OperandContext context) {
		if(start >= end) {
			return 0;
		}
		Cell cell = new Cell(start, end, context);
		Integer memo = totals.get(cell);
		if(memo != null) {
			return memo;
		}
		int result = 0;
		for(ChartItem item : candidates(start, end)) {
			if(result < ChartItem.MANY && item.acceptedIn(context)) {
				result = ChartItem.saturatingSum(result, item.derivations(this, context));
			}
		}
		totals.put(cell, result);
		return result;
	}

	/**
	 * @return the items that derive the span in context at least once
	 */
	List<ChartItem> alternatives(int start, int end, OperandContext context) {
		List<ChartItem> result = new ArrayList<>();
		for(ChartItem item : candidates(start, end)) {
			if(item.acceptedIn(context) && item.derivations(this, context) > 0) {
				result.add(item);
			}
		}
		return result;
	}

	/**
	 * Builds the tree of a span that has at least one derivation in context.
	 *
	 * @throws AmbiguousExpressionIssue if it has several that are not a chain of relations
	 */
	ParseNode build(int start, int end, OperandContext context) {
		List<ChartItem> alternatives = alternatives(start, end, context);
		if(alternatives.isEmpty()) {
			throw explainFailure(start, end);
		}
		if(alternatives.size() == 1) {
			return alternatives.get(0).build(this, context);
		}
		return chainRewriter.rewrite(this, start, end, context, alternatives);
	}

	ParseNode parseAll() {
		if(total(0, tokens.size(), OperandContext.ROOT) == 0) {
			throw explainFailure(0, tokens.size());
		}
		return build(0, tokens.size(), OperandContext.ROOT);
	}

	NoParseIssue explainFailure(int start, int end) {
		if(start >= end) {
			return new NoParseIssue("the expression is empty", location(start, end));
		}
		if(grammar.getJuxtaposition() == null) {
			for(int i = start; i + 1 < end; ++i) {
				if(endsOperand(i) && startsOperand(i + 1)) {
					return new NoParseIssue("\"" + tokens.get(i).getValue() + "\" and \"" +
							tokens.get(i + 1).getValue() + "\" are adjacent with no operator between them",
							location(i, i + 2));
				}
			}
		}
		Token first = tokens.get(start);
		if(first.isKeywordCandidate() && view.isKeyword(first.getValue()) && !startsSomeOperator(first.getValue())) {
			return new NoParseIssue("missing operand before \"" + first.getValue() + "\"", first.getLocation());
		}
		Token last = tokens.get(end - 1);
		if(last.isKeywordCandidate() && view.isKeyword(last.getValue()) && !endsSomeOperator(last.getValue())) {
			return new NoParseIssue("missing operand after \"" + last.getValue() + "\"", last.getLocation());
		}
		return new NoParseIssue("no arrangement of the visible operators derives these tokens", location(start, end));
	}

	private boolean endsOperand(int index) {
		TokenKind kind = tokens.get(index).getKind();
		return kind == TokenKind.CLOSE_PAREN || isAtom(index);
	}

	private boolean startsOperand(int index) {
		TokenKind kind = tokens.get(index).getKind();
		return kind == TokenKind.OPEN_PAREN || isAtom(index);
	}

	private boolean startsSomeOperator(String text) {
		for(CompiledOperator operator : grammar.withLeadingKeyword(text)) {
			if(view.isVisible(operator)) {
				return true;
			}
		}
		return false;
	}

	private boolean endsSomeOperator(String text) {
		for(CompiledOperator operator : grammar.getOperators()) {
			if(view.isVisible(operator) && !operator.isRightOpen() && lastKeyword(operator).contains(text)) {
				return true;
			}
		}
		return false;
	}

	// the keywords a right closed operator can end with; a param slot may be left out
	private static List<String> lastKeyword(CompiledOperator operator) {
		List<String> result = new ArrayList<>();
		List<FormPart> form = operator.getDefinition().getForm();
		for(int i = form.size() - 1; i >= 0; --i) {
			FormPart part = form.get(i);
			if(part instanceof ParamSlot) {
				if(((ParamSlot) part).getClosingKeyword() != null) {
					result.add(((ParamSlot) part).getClosingKeyword());
				}
			} else {
				if(part instanceof Keyword) {
					result.add(((Keyword) part).getText());
				}
				break;
			}
		}
		return result;
	}
}
