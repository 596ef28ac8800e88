package mixfix.parser;

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
import mixfix.registry.RegistrySnapshot;

@RunWith(Parameterized.class)
public class MixfixParserTest {

	private static final RegistrySnapshot ARITHMETIC = arithmetic().snapshot();
	private static final RegistrySnapshot APPLICATION = application().snapshot();

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
			{ ARITHMETIC, "a", atom("a") },
			{ ARITHMETIC, "(42)", atom("42") },
			{ ARITHMETIC, "a + b * c", apply("add", atom("a"), apply("mul", atom("b"), atom("c"))) },
			{ ARITHMETIC, "a * b + c", apply("add", apply("mul", atom("a"), atom("b")), atom("c")) },
			{ ARITHMETIC, "a - b - c", apply("sub", apply("sub", atom("a"), atom("b")), atom("c")) },
			{ ARITHMETIC, "a - (b - c)", apply("sub", atom("a"), apply("sub", atom("b"), atom("c"))) },
			{ ARITHMETIC, "a ^ b ^ c", apply("pow", atom("a"), apply("pow", atom("b"), atom("c"))) },
			{ ARITHMETIC, "(a + b) * c", apply("mul", apply("add", atom("a"), atom("b")), atom("c")) },
			{ ARITHMETIC, "+n!", apply("pos", apply("fact", atom("n"))) },
			{ ARITHMETIC, "+a * b", apply("mul", apply("pos", atom("a")), atom("b")) },
			{ ARITHMETIC, "if a then b else c + d",
					apply("if", atom("a"), atom("b"), apply("add", atom("c"), atom("d"))) },
			{ ARITHMETIC, "if a < b then a + 1 else b",
					apply("if", apply("lt", atom("a"), atom("b")), apply("add", atom("a"), atom("1")), atom("b")) },
			{ ARITHMETIC, "a + if c then x else y + d",
					apply("add", atom("a"), apply("if", atom("c"), atom("x"), apply("add", atom("y"), atom("d")))) },
			{ ARITHMETIC, "a * if c then x else y + d",
					apply("mul", atom("a"), apply("if", atom("c"), atom("x"), apply("add", atom("y"), atom("d")))) },
			{ ARITHMETIC, "a - if c then x else y - d",
					apply("sub", atom("a"), apply("if", atom("c"), atom("x"), apply("sub", atom("y"), atom("d")))) },
			{ ARITHMETIC, "a < if c then x else y < d",
					apply("lt", atom("a"), apply("if", atom("c"), atom("x"), apply("lt", atom("y"), atom("d")))) },
			{ ARITHMETIC, "a < b", apply("lt", atom("a"), atom("b")) },
			{ ARITHMETIC, "a < b <= c",
					chain("cmp", "and", operands(atom("a"), atom("b"), atom("c")), relations("lt", "le")) },
			{ ARITHMETIC, "0 <= i + 1 < n",
					chain("cmp", "and", operands(atom("0"), apply("add", atom("i"), atom("1")), atom("n")),
							relations("le", "lt")) },
			{ ARITHMETIC, "a < b and b < c",
					apply("and", apply("lt", atom("a"), atom("b")), apply("lt", atom("b"), atom("c"))) },
			{ ARITHMETIC, "| a - b | * c", apply("mul", apply("abs", apply("sub", atom("a"), atom("b"))), atom("c")) },
			{ ARITHMETIC, "a ~~ b", apply("spring", params("tension", defaulted("1")), atom("a"), atom("b")) },
			{ ARITHMETIC, "a ~~[tension: 1.5, 1]~~ b",
					apply("spring", params("tension", given("1.5", "1")), atom("a"), atom("b")) },
			{ ARITHMETIC, "a ~~[2]~~ b", apply("spring", params("tension", given("2")), atom("a"), atom("b")) },
			{ ARITHMETIC, "a < b ~~ c",
					apply("lt", atom("a"), apply("spring", params("tension", defaulted("1")), atom("b"), atom("c"))) },
			{ ARITHMETIC, "a ==>[by: x] b", apply("implies", params("by", given("x")), atom("a"), atom("b")) },
			{ ARITHMETIC, "a ==>[lemma] (b ==>[by: y] c)",
					apply("implies", params("by", given("lemma")), atom("a"),
							apply("implies", params("by", given("y")), atom("b"), atom("c"))) },
			{ APPLICATION, "f x", apply("juxtaposition", atom("f"), atom("x")) },
			{ APPLICATION, "f x y",
					apply("juxtaposition", apply("juxtaposition", atom("f"), atom("x")), atom("y")) },
			{ APPLICATION, "f (x y)",
					apply("juxtaposition", atom("f"), apply("juxtaposition", atom("x"), atom("y"))) },
			{ APPLICATION, "f x + g y",
					apply("add", apply("juxtaposition", atom("f"), atom("x")),
							apply("juxtaposition", atom("g"), atom("y"))) },
		});
	}

	private final RegistrySnapshot snapshot;
	private final String expression;
	private final ParseNode expected;

	public MixfixParserTest(RegistrySnapshot snapshot, String expression, ParseNode expected) {
		this.snapshot = snapshot;
		this.expression = expression;
		this.expected = expected;
	}

	@Test
	public void test() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ParseNode actual = new MixfixParser(snapshot).parse(ctx, snapshot.getScope(SCOPE), tokens(expression));
		assertThat(ctx.format(), ctx.hasErrors(), is(false));
		assertThat(expression, actual, is(expected));
	}
}
