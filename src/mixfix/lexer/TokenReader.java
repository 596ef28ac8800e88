package mixfix.lexer;

import mixfix.util.SourceLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A plain token reader used by the command line driver and the tests.
 *
 * It knows nothing about layout, strings or comments: whitespace separates tokens, runs of
 * symbol characters become a single KEYWORD token, and brackets, parentheses, commas and
 * a lone colon are classified on their own.
 */
public class TokenReader {

	static final Pattern NUMERAL = Pattern.compile("[0-9]+(\\.[0-9]+)?");
	static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_']*");
	static final Pattern SYMBOL = Pattern.compile("[!#$%&*+\\-./<=>?@\\\\^|~:;]+");

	private final Path file;

	public TokenReader(Path file) {
		this.file = file;
	}

	public Path getFile() {
		return file;
	}

	private Token makeToken(String value, TokenKind kind, int offset, int line, int column) {
		return new Token(value, kind,
				new SourceLocation(file, offset, offset + value.length(), line, line, column, column + value.length()));
	}

	private static TokenKind singleCharacterKind(char c) {
		switch (c) {
			case '(':
				return TokenKind.OPEN_PAREN;
			case ')':
				return TokenKind.CLOSE_PAREN;
			case '[':
				return TokenKind.OPEN_BRACKET;
			case ']':
				return TokenKind.CLOSE_BRACKET;
			case ',':
				return TokenKind.COMMA;
			default:
				return null;
		}
	}

	/**
	 * @return the tokens of text, in order
	 * @throws TokenReaderException if some character cannot start a token
	 */
	public List<Token> readTokens(CharSequence text) throws TokenReaderException {
		return readTokens(text, 1, 0);
	}

	/**
	 * Reads text that starts at the given line and character offset of the file, such as a single line of it.
	 *
	 * @throws TokenReaderException if some character cannot start a token
	 */
	public List<Token> readTokens(CharSequence text, int firstLine, int firstOffset) throws TokenReaderException {
		List<Token> tokens = new ArrayList<>();
		int line = firstLine;
		int lineStart = 0;
		int pos = 0;
		while(pos < text.length()) {
			char c = text.charAt(pos);
			if(c == '\n') {
				++line;
				lineStart = pos + 1;
				++pos;
				continue;
			}
			int column = pos - lineStart + 1;

			TokenKind single = singleCharacterKind(c);
			if(single != null) {
				tokens.add(makeToken(String.valueOf(c), single, firstOffset + pos, line, column));
				++pos;
				continue;
			}

			if(Character.isWhitespace(c)) {
				++pos;
				continue;
			}

			Matcher m = NUMERAL.matcher(text);
			m.region(pos, text.length());
			if(m.lookingAt()) {
				tokens.add(makeToken(m.group(), TokenKind.NUMERAL, firstOffset + pos, line, column));
				pos = m.end();
				continue;
			}

			m = IDENTIFIER.matcher(text);
			m.region(pos, text.length());
			if(m.lookingAt()) {
				tokens.add(makeToken(m.group(), TokenKind.IDENTIFIER, firstOffset + pos, line, column));
				pos = m.end();
				continue;
			}

			m = SYMBOL.matcher(text);
			m.region(pos, text.length());
			if(m.lookingAt()) {
				String symbol = m.group();
				TokenKind kind = symbol.equals(":") ? TokenKind.COLON : TokenKind.KEYWORD;
				tokens.add(makeToken(symbol, kind, firstOffset + pos, line, column));
				pos = m.end();
				continue;
			}

			throw new TokenReaderException(line, column, "unexpected character '" + c + "'");
		}
		return tokens;
	}
}
