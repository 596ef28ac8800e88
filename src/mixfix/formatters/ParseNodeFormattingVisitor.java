package mixfix.formatters;

import mixfix.Unreachable;
import mixfix.grammar.CompiledGrammar;
import mixfix.grammar.CompiledOperator;
import mixfix.grammar.OperandContext;
import mixfix.grammar.OperandSlot;
import mixfix.grammar.SlotSide;
import mixfix.model.operator.FormPart;
import mixfix.model.operator.Keyword;
import mixfix.model.operator.OperatorDefinition;
import mixfix.model.operator.ParamSlot;
import mixfix.model.operator.Tightness;
import mixfix.model.tree.Apply;
import mixfix.model.tree.Atom;
import mixfix.model.tree.Chain;
import mixfix.model.tree.ErrorNode;
import mixfix.model.tree.ParamValue;
import mixfix.model.tree.ParseNode;
import mixfix.model.tree.ParseNodeVisitor;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;

/**
 * Writes a tree back in the display form of its operators. An operand is parenthesised exactly when, written
 * bare, it would be read differently: when some operator open on one of its edges that touches a keyword outside
 * it is not strictly tighter than every operator that keyword belongs to (or of the same category, where that
 * side allows it).
 */
public class ParseNodeFormattingVisitor extends ParseNodeVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final CompiledGrammar grammar;
	// what the edges of the node being written face
	private OperandContext context = OperandContext.ROOT;

	public ParseNodeFormattingVisitor(IndentingWriter out, CompiledGrammar grammar) {
		this.out = out;
		this.grammar = grammar;
	}

	public static String format(ParseNode node, CompiledGrammar grammar) {
		StringWriter w = new StringWriter();
		try {
			node.accept(new ParseNodeFormattingVisitor(new IndentingWriter(w), grammar));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

	private CompiledOperator operator(String id) {
		CompiledOperator operator = grammar.getOperator(id);
		if(operator == null) {
			throw new IllegalArgumentException("the grammar has no operator " + id);
		}
		return operator;
	}

	private boolean accepted(ParseNode child, OperandContext childContext) {
		if(child instanceof Apply) {
			return childContext.accepts(operator(((Apply) child).getOperatorId()));
		}
		if(child instanceof Chain) {
			int categoryIndex = grammar.getCategories().indexOf(((Chain) child).getCategoryId());
			return childContext.accepts(categoryIndex, true, true);
		}
		return true;
	}

	private OperandContext slotContext(CompiledOperator operator, OperandSlot slot) {
		OperatorDefinition definition = operator.getDefinition();
		switch (slot.getSide()) {
			case LEADING:
				return grammar.unambiguousContext(false, true, operator.getCategoryIndex(),
						definition.getLeftTightness() == Tightness.STRICTLY_TIGHTER);
			case TRAILING:
				return grammar.unambiguousContext(true, false, operator.getCategoryIndex(),
						definition.getRightTightness() == Tightness.STRICTLY_TIGHTER);
			case INTERIOR:
				return OperandContext.ROOT;
			default:
				throw new Unreachable();
		}
	}

	/**
	 * Writes child bare if its edges are acceptable in childContext, and in parentheses otherwise, where it
	 * starts over with nothing facing its edges.
	 */
	private void writeOperand(ParseNode child, OperandContext childContext) throws IOException {
		OperandContext saved = context;
		try {
			if(accepted(child, childContext)) {
				context = childContext;
				child.accept(this);
			} else {
				context = OperandContext.ROOT;
				out.write("(");
				child.accept(this);
				out.write(")");
			}
		} finally {
			context = saved;
		}
	}

	@Override
	public Void visit(Atom atom) throws IOException {
		out.write(atom.getToken().getValue());
		return null;
	}

	@Override
	public Void visit(Apply apply) throws IOException {
		CompiledOperator operator = operator(apply.getOperatorId());
		List<FormPart> form = operator.getDefinition().getForm();
		int operand = 0;
		boolean first = true;
		for(int i = 0; i < form.size(); ++i) {
			FormPart part = form.get(i);
			if(part instanceof ParamSlot) {
				writeParams((ParamSlot) part, apply.getParams());
				continue;
			}
			if(!first) {
				out.write(" ");
			}
			first = false;
			if(part instanceof Keyword) {
				out.write(((Keyword) part).getText());
			} else {
				OperandSlot slot = operator.slotAt(i);
				ParseNode child = apply.getOperands().get(operand++);
				writeOperand(child, context.narrow(slotContext(operator, slot), slot.getSide() == SlotSide.LEADING,
						slot.getSide() == SlotSide.TRAILING));
			}
		}
		return null;
	}

	private void writeParams(ParamSlot slot, Map<String, ParamValue> params) throws IOException {
		boolean any = false;
		for(ParamValue value : params.values()) {
			any |= !value.isDefaulted();
		}
		if(!any) {
			return;
		}
		out.write(" [");
		boolean first = true;
		for(Map.Entry<String, ParamValue> e : params.entrySet()) {
			if(e.getValue().isDefaulted()) {
				continue;
			}
			if(!first) {
				out.write(", ");
			}
			first = false;
			out.write(e.getKey());
			out.write(": ");
			boolean firstValue = true;
			for(Atom value : e.getValue().getValues()) {
				if(!firstValue) {
					out.write(", ");
				}
				firstValue = false;
				out.write(value.getToken().getValue());
			}
		}
		out.write("]");
		if(slot.getClosingKeyword() != null) {
			out.write(" ");
			out.write(slot.getClosingKeyword());
		}
	}

	@Override
	public Void visit(Chain chain) throws IOException {
		int categoryIndex = grammar.getCategories().indexOf(chain.getCategoryId());
		List<ParseNode> operands = chain.getOperands();
		for(int i = 0; i < operands.size(); ++i) {
			if(i > 0) {
				out.write(" ");
				out.write(operator(chain.getRelations().get(i - 1)).getDefinition().getFirstKeyword());
				out.write(" ");
			}
			OperandContext leaf = grammar.unambiguousContext(i > 0, i < operands.size() - 1, categoryIndex, true);
			writeOperand(operands.get(i), context.narrow(leaf, i == 0, i == operands.size() - 1));
		}
		return null;
	}

	@Override
	public Void visit(ErrorNode errorNode) throws IOException {
		out.write("?");
		return null;
	}
}
