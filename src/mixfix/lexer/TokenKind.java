package mixfix.lexer;

public enum TokenKind {
	IDENTIFIER,
	NUMERAL,
	// a symbolic fragment of some operator's display form, e.g "+" or "~~"
	KEYWORD,
	OPEN_BRACKET,
	CLOSE_BRACKET,
	COMMA,
	COLON,
	OPEN_PAREN,
	CLOSE_PAREN,
}
