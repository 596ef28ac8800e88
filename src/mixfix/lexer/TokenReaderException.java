package mixfix.lexer;

import mixfix.MixfixException;

public class TokenReaderException extends MixfixException {

	private static final long serialVersionUID = -2094367402416128539L;

	private final int line;
	private final int column;

	public TokenReaderException(int line, int column, String msg) {
		super("Token Error", msg + " at line " + line + " column " + column);
		this.line = line;
		this.column = column;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}
}
