package mixfix.lexer;

import mixfix.util.SourceLocatable;
import mixfix.util.SourceLocation;

import java.util.Objects;

public class Token extends SourceLocatable {

	private final String value;
	private final TokenKind kind;
	private final SourceLocation location;

	public Token(String value, TokenKind kind, SourceLocation location) {
		this.value = value;
		this.kind = kind;
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getValue() {
		return value;
	}

	public TokenKind getKind() {
		return kind;
	}

	/**
	 * @return true if this token could be the keyword of an operator, i.e it is a symbolic fragment or a
	 * pronounceable name
	 */
	public boolean isKeywordCandidate() {
		return kind == TokenKind.KEYWORD || kind == TokenKind.IDENTIFIER;
	}

	/**
	 * @return true if this token names the same lexeme as other, ignoring where either was found
	 */
	public boolean sameLexeme(Token other) {
		return kind == other.kind && value.equals(other.value);
	}

	@Override
	public String toString() {
		return "Token [value=" + value + ", kind=" + kind + ", location=" + location + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, kind, location);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		Token other = (Token) obj;
		return kind == other.kind && Objects.equals(value, other.value) && Objects.equals(location, other.location);
	}

}
