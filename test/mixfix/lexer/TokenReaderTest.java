package mixfix.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import mixfix.util.SourceLocation;

@RunWith(Parameterized.class)
public class TokenReaderTest {

	static Path testFile = Paths.get("TEST");

	// offsets are only right for single line inputs
	private static Token tok(String value, TokenKind kind, int column, int line) {
		return new Token(value, kind, new SourceLocation(testFile, column - 1, column - 1 + value.length(),
				line, line, column, column + value.length()));
	}

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
			{ "a", Arrays.asList(tok("a", TokenKind.IDENTIFIER, 1, 1)) },
			{ "a b", Arrays.asList(tok("a", TokenKind.IDENTIFIER, 1, 1), tok("b", TokenKind.IDENTIFIER, 3, 1)) },
			{ "x' + 12", Arrays.asList(
					tok("x'", TokenKind.IDENTIFIER, 1, 1),
					tok("+", TokenKind.KEYWORD, 4, 1),
					tok("12", TokenKind.NUMERAL, 6, 1))
			},
			{ "+n!", Arrays.asList(
					tok("+", TokenKind.KEYWORD, 1, 1),
					tok("n", TokenKind.IDENTIFIER, 2, 1),
					tok("!", TokenKind.KEYWORD, 3, 1))
			},
			{ "a ~~[tension: 1.5, 1]~~ b", Arrays.asList(
					tok("a", TokenKind.IDENTIFIER, 1, 1),
					tok("~~", TokenKind.KEYWORD, 3, 1),
					tok("[", TokenKind.OPEN_BRACKET, 5, 1),
					tok("tension", TokenKind.IDENTIFIER, 6, 1),
					tok(":", TokenKind.COLON, 13, 1),
					tok("1.5", TokenKind.NUMERAL, 15, 1),
					tok(",", TokenKind.COMMA, 18, 1),
					tok("1", TokenKind.NUMERAL, 20, 1),
					tok("]", TokenKind.CLOSE_BRACKET, 21, 1),
					tok("~~", TokenKind.KEYWORD, 22, 1),
					tok("b", TokenKind.IDENTIFIER, 25, 1))
			},
			{ "(a<=b)", Arrays.asList(
					tok("(", TokenKind.OPEN_PAREN, 1, 1),
					tok("a", TokenKind.IDENTIFIER, 2, 1),
					tok("<=", TokenKind.KEYWORD, 3, 1),
					tok("b", TokenKind.IDENTIFIER, 5, 1),
					tok(")", TokenKind.CLOSE_PAREN, 6, 1))
			},
			{ "a ::= b", Arrays.asList(
					tok("a", TokenKind.IDENTIFIER, 1, 1),
					tok("::=", TokenKind.KEYWORD, 3, 1),
					tok("b", TokenKind.IDENTIFIER, 7, 1))
			},
		});
	}

	private final String input;
	private final List<Token> expected;

	public TokenReaderTest(String input, List<Token> expected) {
		this.input = input;
		this.expected = expected;
	}

	@Test
	public void test() {
		assertThat(new TokenReader(testFile).readTokens(input), is(expected));
	}

	@Test
	public void lineNumbersCountNewlines() {
		List<Token> tokens = new TokenReader(testFile).readTokens(input + "\n  z");
		Token last = tokens.get(tokens.size() - 1);
		assertThat(last.getLocation().getStartLine(), is(2));
		assertThat(last.getLocation().getStartColumn(), is(3));
	}

	@Test(expected = TokenReaderException.class)
	public void rejectsUnknownCharacters() {
		new TokenReader(testFile).readTokens(input + " \"oops\"");
	}
}
