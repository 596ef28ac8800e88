package mixfix.formatters;

import mixfix.model.tree.Apply;
import mixfix.model.tree.Atom;
import mixfix.model.tree.Chain;
import mixfix.model.tree.ErrorNode;
import mixfix.model.tree.ParamValue;
import mixfix.model.tree.ParseNode;
import mixfix.model.tree.ParseNodeVisitor;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Writes a tree as nested constructor calls, e.g. {@code Apply(+, [Atom(a), Atom(b)])}.
 */
public class ParseNodeStructureFormattingVisitor extends ParseNodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ParseNodeStructureFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeNodes(List<? extends ParseNode> nodes) throws IOException {
		out.write("[");
		boolean first = true;
		for(ParseNode node : nodes) {
			if(first) {
				first = false;
			} else {
				out.write(", ");
			}
			node.accept(this);
		}
		out.write("]");
	}

	@Override
	public Void visit(Atom atom) throws IOException {
		out.write("Atom(");
		out.write(atom.getToken().getValue());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(Apply apply) throws IOException {
		out.write("Apply(");
		out.write(apply.getOperatorId());
		out.write(", ");
		writeNodes(apply.getOperands());
		if(!apply.getParams().isEmpty()) {
			out.write(", {");
			boolean first = true;
			for(Map.Entry<String, ParamValue> e : apply.getParams().entrySet()) {
				if(first) {
					first = false;
				} else {
					out.write(", ");
				}
				out.write(e.getKey());
				out.write(e.getValue().isDefaulted() ? "=default" : "=");
				writeNodes(e.getValue().getValues());
			}
			out.write("}");
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(Chain chain) throws IOException {
		out.write("Chain(");
		out.write(chain.getCategoryId());
		out.write(", ");
		out.write(chain.getCombinatorId());
		out.write(", ");
		writeNodes(chain.getOperands());
		out.write(", ");
		out.write(chain.getRelations().toString());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(ErrorNode errorNode) throws IOException {
		out.write("ErrorNode(");
		out.write(errorNode.getIssue().getTag().toString());
		out.write(")");
		return null;
	}
}
