package mixfix.parser;

import mixfix.errors.IssueContext;
import mixfix.lexer.Token;
import mixfix.lexer.TokenReader;
import mixfix.lexer.TokenReaderException;
import mixfix.lexer.TokenReaderIssue;
import mixfix.model.tree.ErrorNode;
import mixfix.model.tree.ParseNode;
import mixfix.registry.Scope;
import mixfix.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a sequence of independent expressions. A failing expression becomes an error node and parsing goes
 * on with the next one.
 */
public class ExpressionBatchParser {

	private final MixfixParser parser;

	public ExpressionBatchParser(MixfixParser parser) {
		this.parser = parser;
	}

	public List<ParseNode> parse(IssueContext ctx, Scope scope, List<List<Token>> expressions) {
		List<ParseNode> results = new ArrayList<>(expressions.size());
		for(int i = 0; i < expressions.size(); ++i) {
			List<Token> tokens = expressions.get(i);
			SourceLocation location = tokens.isEmpty() ? SourceLocation.unknown() :
					tokens.get(0).getLocation().combine(tokens.get(tokens.size() - 1).getLocation());
			results.add(parser.parse(ctx.withContext(new WhileParsingExpression(i, location)), scope, tokens));
		}
		return results;
	}

	/**
	 * Parses one expression per non-blank line of text. A line with text the reader cannot split into tokens is
	 * reported like any other failing expression.
	 */
	public List<ParseNode> parseLines(IssueContext ctx, Scope scope, TokenReader reader, String text) {
		List<ParseNode> results = new ArrayList<>();
		int lineNumber = 1;
		int offset = 0;
		while(offset <= text.length()) {
			int lineEnd = text.indexOf('\n', offset);
			if(lineEnd < 0) {
				lineEnd = text.length();
			}
			String line = text.substring(offset, lineEnd);
			if(!line.trim().isEmpty()) {
				SourceLocation location = new SourceLocation(reader.getFile(), offset, lineEnd, lineNumber, lineNumber,
						1, line.length() + 1);
				IssueContext expressionCtx = ctx.withContext(new WhileParsingExpression(results.size(), location));
				ParseNode result;
				try {
					List<Token> tokens = reader.readTokens(line, lineNumber, offset);
					result = parser.parse(expressionCtx, scope, tokens);
				} catch (TokenReaderException e) {
					TokenReaderIssue issue = new TokenReaderIssue(e, location);
					expressionCtx.error(issue);
					result = new ErrorNode(location, issue);
				}
				results.add(result);
			}
			offset = lineEnd + 1;
			++lineNumber;
		}
		return results;
	}
}
