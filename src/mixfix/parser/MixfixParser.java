package mixfix.parser;

import mixfix.errors.Issue;
import mixfix.errors.IssueContext;
import mixfix.grammar.CompiledGrammar;
import mixfix.lexer.Token;
import mixfix.lexer.TokenKind;
import mixfix.model.tree.ErrorNode;
import mixfix.model.tree.ParseNode;
import mixfix.registry.RegistrySnapshot;
import mixfix.registry.Scope;
import mixfix.registry.UndeclaredOperatorSymbolIssue;
import mixfix.util.SourceLocation;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Parses token lists against one compiled grammar. A parser holds no per-parse state, so any number of threads
 * may share one.
 */
public class MixfixParser {

	private static final Logger logger = Logger.getLogger(MixfixParser.class.getName());

	private final CompiledGrammar grammar;
	private final ChainRewriter chainRewriter;
	private final Map<Scope, ScopeView> views;

	public MixfixParser(CompiledGrammar grammar) {
		this.grammar = grammar;
		this.chainRewriter = new ChainRewriter();
		this.views = new ConcurrentHashMap<>();
	}

	public MixfixParser(RegistrySnapshot snapshot) {
		this(snapshot.getGrammar());
	}

	public CompiledGrammar getGrammar() {
		return grammar;
	}

	/**
	 * Parses one expression. On failure the issue is reported to ctx and an {@link ErrorNode} is returned.
	 */
	public ParseNode parse(IssueContext ctx, Scope scope, List<Token> tokens) {
		SourceLocation location = tokens.isEmpty() ? SourceLocation.unknown() :
				tokens.get(0).getLocation().combine(tokens.get(tokens.size() - 1).getLocation());
		try {
			ScopeView view = views.computeIfAbsent(scope, s -> new ScopeView(grammar, s));
			int[] partners = matchGroups(tokens);
			checkSymbols(view, tokens, partners);
			ParseNode result = new ParseChart(grammar, view, chainRewriter, tokens, partners).parseAll();
			logger.finer("parsed " + tokens.size() + " token(s)");
			return result;
		} catch (Issue issue) {
			ctx.error(issue);
			return new ErrorNode(location, issue);
		}
	}

	private static int[] matchGroups(List<Token> tokens) {
		int[] partners = new int[tokens.size()];
		Arrays.fill(partners, -1);
		Deque<Integer> open = new ArrayDeque<>();
		for(int i = 0; i < tokens.size(); ++i) {
			TokenKind kind = tokens.get(i).getKind();
			if(kind == TokenKind.OPEN_PAREN || kind == TokenKind.OPEN_BRACKET) {
				open.push(i);
			} else if(kind == TokenKind.CLOSE_PAREN || kind == TokenKind.CLOSE_BRACKET) {
				TokenKind expected = kind == TokenKind.CLOSE_PAREN ? TokenKind.OPEN_PAREN : TokenKind.OPEN_BRACKET;
				if(open.isEmpty() || tokens.get(open.peek()).getKind() != expected) {
					throw new NoParseIssue("unmatched \"" + tokens.get(i).getValue() + "\"", tokens.get(i).getLocation());
				}
				int partner = open.pop();
				partners[partner] = i;
				partners[i] = partner;
			}
		}
		if(!open.isEmpty()) {
			Token unclosed = tokens.get(open.peek());
			throw new NoParseIssue("unclosed \"" + unclosed.getValue() + "\"", unclosed.getLocation());
		}
		return partners;
	}

	// a symbolic token outside parameter brackets must belong to an operator the scope can see
	private static void checkSymbols(ScopeView view, List<Token> tokens, int[] partners) {
		for(int i = 0; i < tokens.size(); ++i) {
			Token token = tokens.get(i);
			if(token.getKind() == TokenKind.OPEN_BRACKET) {
				i = partners[i];
			} else if(token.getKind() == TokenKind.KEYWORD && !view.isKeyword(token.getValue())) {
				throw new UndeclaredOperatorSymbolIssue(token.getValue(), view.getScope().getName(),
						view.hiddenUsersOf(token.getValue()), token.getLocation());
			}
		}
	}
}
