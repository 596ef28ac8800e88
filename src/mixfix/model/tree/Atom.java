package mixfix.model.tree;

import mixfix.lexer.Token;

import java.util.Objects;

/**
 * A single identifier or numeral token used as an operand.
 */
public class Atom extends ParseNode {

	private final Token token;

	public Atom(Token token) {
		super(token.getLocation());
		this.token = token;
	}

	public Token getToken() {
		return token;
	}

	@Override
	public <T, E extends Throwable> T accept(ParseNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(token.getKind(), token.getValue());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return token.sameLexeme(((Atom) obj).token);
	}
}
