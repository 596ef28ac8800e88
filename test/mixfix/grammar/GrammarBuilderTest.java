package mixfix.grammar;

import static mixfix.ExampleRegistries.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.Test;

import mixfix.lexer.Token;
import mixfix.model.category.CategoryGraph;
import mixfix.model.operator.OperatorDefinition;
import mixfix.registry.RegistrySnapshot;

public class GrammarBuilderTest {

	private static List<SlotSide> sides(CompiledOperator operator) {
		return operator.getSlots().stream().map(OperandSlot::getSide).collect(Collectors.toList());
	}

	private static List<String> names(CompiledGrammar grammar, BitSet accepted) {
		CategoryGraph categories = grammar.getCategories();
		return accepted.stream().mapToObj(categories::idAt).collect(Collectors.toList());
	}

	@Test
	public void slotSidesFollowTheShape() {
		CompiledGrammar grammar = arithmetic().snapshot().getGrammar();
		assertThat(sides(grammar.getOperator("add")), is(Arrays.asList(SlotSide.LEADING, SlotSide.TRAILING)));
		assertThat(sides(grammar.getOperator("pos")), is(Arrays.asList(SlotSide.TRAILING)));
		assertThat(sides(grammar.getOperator("fact")), is(Arrays.asList(SlotSide.LEADING)));
		assertThat(sides(grammar.getOperator("abs")), is(Arrays.asList(SlotSide.INTERIOR)));
		assertThat(sides(grammar.getOperator("if")),
				is(Arrays.asList(SlotSide.INTERIOR, SlotSide.INTERIOR, SlotSide.TRAILING)));
		assertThat(grammar.getOperator("if").getSlots().get(0).getContext(), is(OperandContext.ROOT));
	}

	@Test
	public void strictSidesRejectTheirOwnCategory() {
		CompiledGrammar grammar = arithmetic().snapshot().getGrammar();
		CompiledOperator add = grammar.getOperator("add");
		OperandContext left = add.getSlots().get(0).getContext();
		OperandContext right = add.getSlots().get(1).getContext();
		assertTrue(left.checksRightEdge());
		assertFalse(left.checksLeftEdge());
		assertTrue(right.checksLeftEdge());
		assertFalse(right.checksRightEdge());

		assertThat(names(grammar, left.getRightAccepted()),
				is(Arrays.asList("arith", "spring", "mul", "sign", "pow", "fact")));
		assertThat(names(grammar, right.getLeftAccepted()), is(Arrays.asList("spring", "mul", "sign", "pow", "fact")));
		assertTrue(left.accepts(grammar.getOperator("sub")));
		assertFalse(right.accepts(grammar.getOperator("sub")));
		assertFalse(left.accepts(grammar.getOperator("lt")));
	}

	@Test
	public void delimitedOperandsAreAlwaysAccepted() {
		CompiledGrammar grammar = arithmetic().snapshot().getGrammar();
		OperandContext trailingOfPos = grammar.getOperator("pos").getSlots().get(0).getContext();
		// "if" is not left open, so nothing touches its left edge
		assertTrue(trailingOfPos.accepts(grammar.getOperator("if")));
		assertTrue(trailingOfPos.accepts(grammar.getOperator("abs")));
		assertFalse(trailingOfPos.accepts(grammar.getOperator("add")));
		assertTrue(OperandContext.ROOT.accepts(grammar.getOperator("add")));
	}

	@Test
	public void contextsAreShared() {
		CompiledGrammar grammar = arithmetic().snapshot().getGrammar();
		OperandContext addRight = grammar.getOperator("add").getSlots().get(1).getContext();
		OperandContext subRight = grammar.getOperator("sub").getSlots().get(1).getContext();
		assertSame(addRight, subRight);
		int arith = grammar.getCategories().indexOf("arith");
		assertSame(addRight, grammar.context(true, false, arith, true));
		assertSame(OperandContext.ROOT, grammar.context(false, false, arith, true));
	}

	@Test
	public void edgeConstraintsPassDownToOperandsOnThatEdge() {
		CompiledGrammar grammar = arithmetic().snapshot().getGrammar();
		OperandContext addLeft = grammar.getOperator("add").getSlots().get(0).getContext();
		OperandSlot mulRight = grammar.getOperator("mul").getSlots().get(1);
		CompiledOperator conditional = grammar.getOperator("if");

		// on its own, the right operand of * may be an if, whose left edge is closed
		assertTrue(mulRight.getContext().accepts(conditional));
		// inside the left operand of +, that operand's right edge also faces the +
		OperandContext narrowed = addLeft.narrow(mulRight.getContext(), false, true);
		assertFalse(narrowed.accepts(conditional));
		assertThat(names(grammar, narrowed.getLeftAccepted()), is(Arrays.asList("spring", "sign", "pow", "fact")));
		assertThat(names(grammar, narrowed.getRightAccepted()),
				is(Arrays.asList("arith", "spring", "mul", "sign", "pow", "fact")));

		// interior operands and unconstrained contexts are left alone
		OperandSlot condition = conditional.getSlots().get(0);
		assertSame(condition.getContext(), addLeft.narrow(condition.getContext(), false, false));
		assertSame(mulRight.getContext(), OperandContext.ROOT.narrow(mulRight.getContext(), false, true));
	}

	@Test
	public void unambiguousContextsLeaveOutIncomparableCategories() {
		CompiledGrammar grammar = arithmetic().snapshot().getGrammar();
		int arith = grammar.getCategories().indexOf("arith");
		OperandContext parsing = grammar.context(false, true, arith, false);
		OperandContext printing = grammar.unambiguousContext(false, true, arith, false);
		assertTrue(parsing.accepts(grammar.getOperator("spring")));
		assertFalse(printing.accepts(grammar.getOperator("spring")));
		assertThat(names(grammar, printing.getRightAccepted()), is(Arrays.asList("arith", "mul", "sign", "pow", "fact")));
	}

	@Test
	public void grammarIsCompiledOncePerSnapshot() {
		RegistrySnapshot snapshot = arithmetic().snapshot();
		assertSame(snapshot.getGrammar(), snapshot.getGrammar());
		assertNotSame(snapshot.getGrammar(), arithmetic().snapshot().getGrammar());
	}

	@Test
	public void keywordIndexes() {
		CompiledGrammar grammar = arithmetic().snapshot().getGrammar();
		assertThat(grammar.withLeadingKeyword("if").get(0).getId(), is("if"));
		assertThat(grammar.lookup(tokens("+").get(0)).get(1).getId(), is("add"));
		assertThat(grammar.withLeadingKeyword("+").get(0).getId(), is("pos"));
		assertTrue(grammar.isKeyword("then"));
		assertTrue(grammar.isKeyword("~~"));
		assertFalse(grammar.isKeyword("x"));
		assertThat(grammar.getJuxtaposition(), is(nullValue()));
		assertThat(grammar.operatorsInCategory("arith").size(), is(2));
	}

	@Test
	public void dispatchFollowsTheSnapshotIndex() {
		RegistrySnapshot snapshot = arithmetic().snapshot();
		CompiledGrammar grammar = snapshot.getGrammar();
		Token plus = tokens("+").get(0);
		assertThat(snapshot.lookup(plus).stream().map(OperatorDefinition::getId).collect(Collectors.toList()),
				is(Arrays.asList("pos", "add")));
		List<CompiledOperator> compiled = grammar.lookup(plus);
		assertThat(compiled.size(), is(2));
		assertSame(grammar.getOperator("pos"), compiled.get(0));
		assertSame(grammar.getOperator("add"), compiled.get(1));
		assertSame(compiled, grammar.lookup(tokens("+").get(0)));
		assertTrue(grammar.lookup(tokens("then").get(0)).isEmpty());
	}

	@Test
	public void juxtapositionIsCompiled() {
		CompiledGrammar grammar = application().snapshot().getGrammar();
		CompiledOperator juxtaposition = grammar.getJuxtaposition();
		assertThat(juxtaposition.getCategory(), is("app"));
		assertThat(sides(juxtaposition), is(Arrays.asList(SlotSide.LEADING, SlotSide.TRAILING)));
		int app = grammar.getCategories().indexOf("app");
		assertFalse(juxtaposition.getSlots().get(1).getContext().getLeftAccepted().get(app));
		assertTrue(juxtaposition.getSlots().get(0).getContext().getRightAccepted().get(app));
		assertSame(juxtaposition, grammar.getOperator("juxtaposition"));
	}
}
