package mixfix.formatters;

import mixfix.config.WhileLoadingTable;
import mixfix.errors.ContextVisitor;
import mixfix.parser.WhileParsingExpression;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileParsingExpression whileParsingExpression) throws IOException {
		out.write("while parsing expression #");
		out.write(Integer.toString(whileParsingExpression.getIndex() + 1));
		out.write(" ");
		whileParsingExpression.getLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(WhileLoadingTable whileLoadingTable) throws IOException {
		out.write("while loading operator table ");
		out.write(whileLoadingTable.getTable().toString());
		return null;
	}

}
