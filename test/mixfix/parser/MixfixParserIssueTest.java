package mixfix.parser;

import static mixfix.ExampleRegistries.*;
import static mixfix.model.tree.ParseNodeBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import mixfix.ExampleRegistries.SignVersusFact;
import mixfix.errors.Issue;
import mixfix.errors.IssueTag;
import mixfix.errors.TopLevelIssueContext;
import mixfix.lexer.TokenReader;
import mixfix.model.operator.Tightness;
import mixfix.model.tree.ErrorNode;
import mixfix.model.tree.ParseNode;
import mixfix.registry.OperatorRegistry;
import mixfix.registry.RegistrySnapshot;
import mixfix.registry.UndeclaredOperatorSymbolIssue;
import mixfix.registry.UnknownCombinatorIssue;

public class MixfixParserIssueTest {

	private TopLevelIssueContext ctx;

	@Before
	public void setup() {
		ctx = new TopLevelIssueContext();
	}

	private ParseNode parse(RegistrySnapshot snapshot, String scope, String expression) {
		return new MixfixParser(snapshot).parse(ctx, snapshot.getScope(scope), tokens(expression));
	}

	private Issue expectIssue(RegistrySnapshot snapshot, String scope, String expression, IssueTag tag) {
		ParseNode result = parse(snapshot, scope, expression);
		assertThat(result, instanceOf(ErrorNode.class));
		assertThat(ctx.getIssues().size(), is(1));
		Issue issue = ctx.getIssues().get(0);
		assertThat(issue.getTag(), is(tag));
		assertSame(issue, ((ErrorNode) result).getIssue());
		return issue;
	}

	private Issue expectIssue(String expression, IssueTag tag) {
		return expectIssue(arithmetic().snapshot(), SCOPE, expression, tag);
	}

	@Test
	public void adjacentOperands() {
		NoParseIssue issue = (NoParseIssue) expectIssue("a b", IssueTag.NO_PARSE);
		assertThat(issue.getReason(), containsString("adjacent"));
	}

	@Test
	public void missingOperand() {
		NoParseIssue issue = (NoParseIssue) expectIssue("a +", IssueTag.NO_PARSE);
		assertThat(issue.getReason(), containsString("missing operand after \"+\""));
		assertThat(issue.getLocation().getStartColumn(), is(3));
	}

	@Test
	public void missingLeadingOperand() {
		NoParseIssue issue = (NoParseIssue) expectIssue("* a", IssueTag.NO_PARSE);
		assertThat(issue.getReason(), containsString("missing operand before \"*\""));
	}

	@Test
	public void unclosedParenthesis() {
		NoParseIssue issue = (NoParseIssue) expectIssue("(a + b", IssueTag.NO_PARSE);
		assertThat(issue.getReason(), containsString("unclosed"));
	}

	@Test
	public void mismatchedBrackets() {
		expectIssue("a ~~[1)~~ b", IssueTag.NO_PARSE);
	}

	@Test
	public void emptyExpression() {
		NoParseIssue issue = (NoParseIssue) expectIssue("", IssueTag.NO_PARSE);
		assertThat(issue.getReason(), containsString("empty"));
	}

	@Test
	public void missingMandatoryParameter() {
		ParameterArityIssue issue = (ParameterArityIssue) expectIssue("a ==> b", IssueTag.PARAMETER_ARITY);
		assertThat(issue.getProblem(), is(ParameterArityIssue.Problem.MISSING));
		assertThat(issue.getOperatorId(), is("implies"));
		assertThat(issue.getParameter(), is("by"));
	}

	@Test
	public void unknownLabel() {
		UnknownParameterIssue issue = (UnknownParameterIssue) expectIssue("a ~~[stiffness: 2]~~ b",
				IssueTag.UNKNOWN_PARAMETER);
		assertThat(issue.getLabel(), is("stiffness"));
		assertThat(issue.getOperatorId(), is("spring"));
	}

	@Test
	public void tooManyPositionalValues() {
		ParameterArityIssue issue = (ParameterArityIssue) expectIssue("a ~~[1, 2]~~ b", IssueTag.PARAMETER_ARITY);
		assertThat(issue.getProblem(), is(ParameterArityIssue.Problem.SURPLUS));
	}

	@Test
	public void repeatedLabel() {
		ParameterArityIssue issue = (ParameterArityIssue) expectIssue("a ~~[tension: 1, tension: 2]~~ b",
				IssueTag.PARAMETER_ARITY);
		assertThat(issue.getProblem(), is(ParameterArityIssue.Problem.REPEATED));
		assertThat(issue.getParameter(), is("tension"));
	}

	@Test
	public void malformedParameters() {
		expectIssue("a ~~[tension: ]~~ b", IssueTag.NO_PARSE);
	}

	@Test
	public void writtenBracketNeedsItsClosingKeyword() {
		expectIssue("a ~~[2] b", IssueTag.NO_PARSE);
	}

	@Test
	public void undeclaredSymbol() {
		UndeclaredOperatorSymbolIssue issue = (UndeclaredOperatorSymbolIssue) expectIssue("a % b",
				IssueTag.UNDECLARED_OPERATOR_SYMBOL);
		assertThat(issue.getSymbol(), is("%"));
		assertThat(issue.getUnimportedOperators().isEmpty(), is(true));
	}

	@Test
	public void symbolNotImportedIntoScope() {
		UndeclaredOperatorSymbolIssue issue = (UndeclaredOperatorSymbolIssue) expectIssue(arithmetic().snapshot(),
				"other", "a + b", IssueTag.UNDECLARED_OPERATOR_SYMBOL);
		assertThat(issue.getScope(), is("other"));
		assertThat(issue.getUnimportedOperators(), hasItems("add", "pos"));
	}

	@Test
	public void pronounceableOperatorsNeedNoImport() {
		ParseNode result = parse(arithmetic().snapshot(), "other", "if a then b else c");
		assertThat(ctx.hasErrors(), is(false));
		assertThat(result, is(apply("if", atom("a"), atom("b"), atom("c"))));
	}

	@Test
	public void incomparableCategoriesAreAmbiguous() {
		AmbiguousExpressionIssue issue = (AmbiguousExpressionIssue) expectIssue(
				signAndFactorial(SignVersusFact.INCOMPARABLE).snapshot(), SCOPE, "+n!",
				IssueTag.AMBIGUOUS_EXPRESSION);
		assertThat(issue.getCompetingOperatorIds(), is(Arrays.asList("pos", "fact")));
		assertThat(issue.getIncomparableCategories(), is(Arrays.asList(Arrays.asList("sign", "fact"))));
	}

	@Test
	public void comparableCategoriesDecide() {
		ParseNode signTighter = parse(signAndFactorial(SignVersusFact.SIGN_TIGHTER).snapshot(), SCOPE, "+n!");
		ParseNode factTighter = parse(signAndFactorial(SignVersusFact.FACT_TIGHTER).snapshot(), SCOPE, "+n!");
		assertThat(ctx.hasErrors(), is(false));
		assertThat(signTighter, is(apply("fact", apply("pos", atom("n")))));
		assertThat(factTighter, is(apply("pos", apply("fact", atom("n")))));
	}

	@Test
	public void incomparableInfixOperatorsAreAmbiguous() {
		AmbiguousExpressionIssue issue = (AmbiguousExpressionIssue) expectIssue("a + b ~~ c",
				IssueTag.AMBIGUOUS_EXPRESSION);
		assertThat(issue.getCompetingOperatorIds(), hasItems("add", "spring"));
		assertThat(issue.getIncomparableCategories().size(), is(1));
	}

	@Test
	public void noAssociativityIsAmbiguous() {
		OperatorRegistry registry = new OperatorRegistry();
		registry.declareCategory("arith", set(), set());
		registry.declareOperator(op("sub", "arith", "_a - _b"));
		registry.importOperator(SCOPE, "sub");
		AmbiguousExpressionIssue issue = (AmbiguousExpressionIssue) expectIssue(registry.snapshot(), SCOPE,
				"a - b - c", IssueTag.AMBIGUOUS_EXPRESSION);
		assertThat(issue.getCompetingOperatorIds(), is(Arrays.asList("sub", "sub")));
		assertThat(issue.getIncomparableCategories().isEmpty(), is(true));
	}

	// the combinator chains fold through; a pronounceable operator, so every scope sees it
	private static void declareConjunction(OperatorRegistry registry) {
		registry.declareCategory("logic", set(), set("cmp"));
		registry.declareOperator(op("and", "logic", "_a and _b"));
	}

	@Test
	public void chainCombinatorMustBeDeclared() {
		OperatorRegistry registry = new OperatorRegistry();
		registry.declareCategory("cmp", set(), set());
		registry.setChainPolicy("cmp", "both");
		try {
			registry.snapshot();
			fail("a chain through an undeclared operator was accepted");
		} catch (UnknownCombinatorIssue issue) {
			assertThat(issue.getCategory(), is("cmp"));
			assertThat(issue.getMessage(), is("category cmp chains through both, which is not a declared operator"));
		}

		registry.declareOperator(op("both", "cmp", "both _a"));
		try {
			registry.snapshot();
			fail("a chain through a one operand operator was accepted");
		} catch (UnknownCombinatorIssue issue) {
			assertThat(issue.getReason(), is("takes 1 operand(s) instead of 2"));
		}
	}

	@Test
	public void relationsOnlyChainWhenEnabled() {
		OperatorRegistry registry = new OperatorRegistry();
		registry.declareCategory("cmp", set(), set());
		declareConjunction(registry);
		registry.declareOperator(op("lt", "cmp", "_a < _b"));
		registry.importOperator(SCOPE, "lt");
		expectIssue(registry.snapshot(), SCOPE, "a < b < c", IssueTag.AMBIGUOUS_EXPRESSION);

		registry.setChainPolicy("cmp", "and");
		ctx = new TopLevelIssueContext();
		ParseNode result = parse(registry.snapshot(), SCOPE, "a < b < c");
		assertThat(ctx.hasErrors(), is(false));
		assertThat(result, is(chain("cmp", "and", operands(atom("a"), atom("b"), atom("c")), relations("lt", "lt"))));
	}

	@Test
	public void strictRelationsDoNotChain() {
		OperatorRegistry registry = new OperatorRegistry();
		registry.declareCategory("cmp", set(), set());
		declareConjunction(registry);
		registry.setChainPolicy("cmp", "and");
		registry.declareOperator(op("lt", "cmp", "_a < _b", Tightness.STRICTLY_TIGHTER, Tightness.STRICTLY_TIGHTER));
		registry.importOperator(SCOPE, "lt");
		expectIssue(registry.snapshot(), SCOPE, "a < b < c", IssueTag.NO_PARSE);
	}

	@Test
	public void chainLeavesMustBeUnique() {
		// a relation from an unrelated category inside the run leaves it ambiguous
		OperatorRegistry registry = new OperatorRegistry();
		registry.declareCategory("cmp", set(), set());
		declareConjunction(registry);
		registry.declareCategory("other", set(), set());
		registry.setChainPolicy("cmp", "and");
		registry.declareOperator(op("lt", "cmp", "_a < _b"));
		registry.declareOperator(op("at", "other", "_a @ _b"));
		registry.importOperator(SCOPE, "lt");
		registry.importOperator(SCOPE, "at");
		AmbiguousExpressionIssue issue = (AmbiguousExpressionIssue) expectIssue(registry.snapshot(), SCOPE,
				"a < b @ c < d", IssueTag.AMBIGUOUS_EXPRESSION);
		assertThat(issue.getCompetingOperatorIds(), hasItems("lt", "at"));
	}

	@Test
	public void batchParsingContinuesAfterErrors() {
		RegistrySnapshot snapshot = arithmetic().snapshot();
		List<ParseNode> results = new ExpressionBatchParser(new MixfixParser(snapshot)).parse(ctx,
				snapshot.getScope(SCOPE), Arrays.asList(tokens("a + b"), tokens("a +"), tokens("a % b"), tokens("c")));
		assertThat(results.size(), is(4));
		assertThat(results.get(0), is(apply("add", atom("a"), atom("b"))));
		assertThat(results.get(1), instanceOf(ErrorNode.class));
		assertThat(results.get(2), instanceOf(ErrorNode.class));
		assertThat(results.get(3), is(atom("c")));
		assertThat(ctx.getIssues().size(), is(2));
		assertThat(ctx.getIssues().get(0).getTag(), is(IssueTag.NO_PARSE));
		assertThat(ctx.getIssues().get(1).getTag(), is(IssueTag.UNDECLARED_OPERATOR_SYMBOL));
		assertThat(ctx.format(), containsString("while parsing expression #2"));
	}

	@Test
	public void unreadableLinesOnlyFailThemselves() {
		RegistrySnapshot snapshot = arithmetic().snapshot();
		List<ParseNode> results = new ExpressionBatchParser(new MixfixParser(snapshot)).parseLines(ctx,
				snapshot.getScope(SCOPE), new TokenReader(Paths.get("LINES")), "a + b\n\na { b\nc * d\n");
		assertThat(results.size(), is(3));
		assertThat(results.get(0), is(apply("add", atom("a"), atom("b"))));
		assertThat(results.get(1), instanceOf(ErrorNode.class));
		assertThat(results.get(2), is(apply("mul", atom("c"), atom("d"))));
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0).getTag(), is(IssueTag.TOKEN_ERROR));
		assertThat(ctx.format(), containsString("while parsing expression #2"));
		assertThat(ctx.format(), containsString("cannot read tokens: unexpected character '{' at line 3 column 3"));
		// tokens keep their place in the whole text
		assertThat(results.get(2).getLocation().getStartLine(), is(4));
		assertThat(results.get(2).getLocation().getStartOffset(), is(13));
	}
}
