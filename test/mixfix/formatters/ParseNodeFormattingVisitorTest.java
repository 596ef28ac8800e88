package mixfix.formatters;

import static mixfix.ExampleRegistries.*;
import static mixfix.model.tree.ParseNodeBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import mixfix.errors.TopLevelIssueContext;
import mixfix.model.tree.ParseNode;
import mixfix.parser.MixfixParser;
import mixfix.registry.RegistrySnapshot;

@RunWith(Parameterized.class)
public class ParseNodeFormattingVisitorTest {

	private static final RegistrySnapshot ARITHMETIC = arithmetic().snapshot();

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
			{ atom("x"), "x" },
			{ apply("add", atom("a"), apply("mul", atom("b"), atom("c"))), "a + b * c" },
			{ apply("mul", apply("add", atom("a"), atom("b")), atom("c")), "(a + b) * c" },
			{ apply("sub", apply("sub", atom("a"), atom("b")), atom("c")), "a - b - c" },
			{ apply("sub", atom("a"), apply("sub", atom("b"), atom("c"))), "a - (b - c)" },
			{ apply("pow", atom("a"), apply("pow", atom("b"), atom("c"))), "a ^ b ^ c" },
			{ apply("pow", apply("pow", atom("a"), atom("b")), atom("c")), "(a ^ b) ^ c" },
			{ apply("pos", apply("fact", atom("n"))), "+ n !" },
			{ apply("fact", apply("pos", atom("n"))), "(+ n) !" },
			{ apply("abs", apply("sub", atom("a"), atom("b"))), "| a - b |" },
			{ apply("if", atom("a"), apply("if", atom("b"), atom("c"), atom("d")), atom("e")),
					"if a then if b then c else d else e" },
			{ apply("add", apply("if", atom("a"), atom("b"), atom("c")), atom("d")), "(if a then b else c) + d" },
			{ apply("add", apply("mul", atom("a"), apply("if", atom("c"), atom("x"), atom("y"))), atom("d")),
					"a * (if c then x else y) + d" },
			{ apply("add", apply("add", atom("a"), apply("if", atom("c"), atom("x"), atom("y"))), atom("d")),
					"a + (if c then x else y) + d" },
			{ apply("add", atom("a"), apply("if", atom("c"), atom("x"), apply("add", atom("y"), atom("d")))),
					"a + if c then x else y + d" },
			{ apply("spring", params("tension", defaulted("1")), atom("a"), atom("b")), "a ~~ b" },
			{ apply("spring", params("tension", given("1.5", "1")), atom("a"), atom("b")),
					"a ~~ [tension: 1.5, 1] ~~ b" },
			{ apply("implies", params("by", given("x")), atom("a"), atom("b")), "a ==> [by: x] b" },
			{ chain("cmp", "and", operands(atom("a"), apply("add", atom("b"), atom("1")), atom("c")),
					relations("lt", "le")), "a < b + 1 <= c" },
			{ apply("and", chain("cmp", "and", operands(atom("a"), atom("b"), atom("c")), relations("lt", "lt")),
					atom("d")), "a < b < c and d" },
		});
	}

	private final ParseNode tree;
	private final String expected;

	public ParseNodeFormattingVisitorTest(ParseNode tree, String expected) {
		this.tree = tree;
		this.expected = expected;
	}

	@Test
	public void format() {
		assertThat(ParseNodeFormattingVisitor.format(tree, ARITHMETIC.getGrammar()), is(expected));
	}

	@Test
	public void formattedTextParsesBack() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ParseNode reparsed = new MixfixParser(ARITHMETIC).parse(ctx, ARITHMETIC.getScope(SCOPE), tokens(expected));
		assertThat(ctx.format(), ctx.hasErrors(), is(false));
		assertThat(reparsed, is(tree));
	}
}
