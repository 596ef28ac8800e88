package mixfix.formatters;

import mixfix.config.IOErrorIssue;
import mixfix.config.OptionParserIssue;
import mixfix.errors.IssueVisitor;
import mixfix.errors.IssueWithContext;
import mixfix.lexer.TokenReaderIssue;
import mixfix.model.category.CategoryCycleIssue;
import mixfix.model.category.UnknownCategoryIssue;
import mixfix.parser.AmbiguousExpressionIssue;
import mixfix.parser.CompetingOperator;
import mixfix.parser.NoParseIssue;
import mixfix.parser.ParameterArityIssue;
import mixfix.parser.UnknownParameterIssue;
import mixfix.registry.DuplicateOperatorIssue;
import mixfix.registry.MalformedOperatorIssue;
import mixfix.registry.UndeclaredOperatorSymbolIssue;
import mixfix.registry.UnknownCombinatorIssue;

import java.io.IOException;
import java.util.List;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(CategoryCycleIssue categoryCycleIssue) throws IOException {
		out.write("declaring category ");
		out.write(categoryCycleIssue.getDeclaring());
		out.write(" would create a tightness cycle: ");
		out.write(String.join(" > ", categoryCycleIssue.getCycle()));
		return null;
	}

	@Override
	public Void visit(UnknownCategoryIssue unknownCategoryIssue) throws IOException {
		if(unknownCategoryIssue.getCategory() == null) {
			out.write("no category given for ");
			out.write(unknownCategoryIssue.getReferencedBy());
			return null;
		}
		out.write("unknown category ");
		out.write(unknownCategoryIssue.getCategory());
		out.write(" referenced by ");
		out.write(unknownCategoryIssue.getReferencedBy());
		return null;
	}

	@Override
	public Void visit(DuplicateOperatorIssue duplicateOperatorIssue) throws IOException {
		out.write("operator ");
		out.write(duplicateOperatorIssue.getDeclared().getId());
		if(duplicateOperatorIssue.getDeclared().getId().equals(duplicateOperatorIssue.getExisting().getId())) {
			out.write(" is already declared");
		} else {
			out.write(" has the same keywords and operand positions as ");
			out.write(duplicateOperatorIssue.getExisting().getId());
		}
		return null;
	}

	@Override
	public Void visit(MalformedOperatorIssue malformedOperatorIssue) throws IOException {
		out.write("malformed operator ");
		out.write(String.valueOf(malformedOperatorIssue.getOperatorId()));
		out.write(": ");
		out.write(malformedOperatorIssue.getReason());
		return null;
	}

	@Override
	public Void visit(UndeclaredOperatorSymbolIssue undeclaredOperatorSymbolIssue) throws IOException {
		out.write("operator symbol \"");
		out.write(undeclaredOperatorSymbolIssue.getSymbol());
		out.write("\" ");
		undeclaredOperatorSymbolIssue.getLocation().writePretty(out);
		if(undeclaredOperatorSymbolIssue.getUnimportedOperators().isEmpty()) {
			out.write(" is not declared");
		} else {
			out.write(" is declared by ");
			out.write(String.join(", ", undeclaredOperatorSymbolIssue.getUnimportedOperators()));
			out.write(" but not imported into scope ");
			out.write(undeclaredOperatorSymbolIssue.getScope());
		}
		return null;
	}

	@Override
	public Void visit(NoParseIssue noParseIssue) throws IOException {
		out.write("could not parse expression ");
		noParseIssue.getLocation().writePretty(out);
		out.write(": ");
		out.write(noParseIssue.getReason());
		return null;
	}

	@Override
	public Void visit(AmbiguousExpressionIssue ambiguousExpressionIssue) throws IOException {
		out.write("ambiguous expression ");
		ambiguousExpressionIssue.getLocation().writePretty(out);
		out.write("; competing operators:");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for(CompetingOperator competitor : ambiguousExpressionIssue.getCompetitors()) {
				out.newLine();
				out.write(competitor.getOperatorId());
				out.write(" in category ");
				out.write(competitor.getCategory());
				out.write(" ");
				competitor.getLocation().writePretty(out);
			}
			for(List<String> pair : ambiguousExpressionIssue.getIncomparableCategories()) {
				out.newLine();
				out.write("categories ");
				out.write(pair.get(0));
				out.write(" and ");
				out.write(pair.get(1));
				out.write(" have no tightness relation");
			}
		}
		return null;
	}

	@Override
	public Void visit(UnknownParameterIssue unknownParameterIssue) throws IOException {
		out.write("operator ");
		out.write(unknownParameterIssue.getOperatorId());
		out.write(" has no inner parameter ");
		out.write(unknownParameterIssue.getLabel());
		out.write(" ");
		unknownParameterIssue.getLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(ParameterArityIssue parameterArityIssue) throws IOException {
		out.write("operator ");
		out.write(parameterArityIssue.getOperatorId());
		switch (parameterArityIssue.getProblem()) {
			case MISSING:
				out.write(" requires inner parameter ");
				out.write(parameterArityIssue.getParameter());
				break;
			case SURPLUS:
				out.write(" was given more positional inner parameters than it has");
				break;
			case REPEATED:
				out.write(" was given inner parameter ");
				out.write(parameterArityIssue.getParameter());
				out.write(" more than once");
				break;
		}
		out.write(" ");
		parameterArityIssue.getLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getOptionMessage());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(TokenReaderIssue tokenReaderIssue) throws IOException {
		out.write("cannot read tokens: ");
		out.write(tokenReaderIssue.getError().getMsg());
		return null;
	}

	@Override
	public Void visit(UnknownCombinatorIssue unknownCombinatorIssue) throws IOException {
		out.write("category ");
		out.write(unknownCombinatorIssue.getCategory());
		out.write(" chains through ");
		out.write(unknownCombinatorIssue.getCombinator());
		out.write(", which ");
		out.write(unknownCombinatorIssue.getReason());
		return null;
	}
}
