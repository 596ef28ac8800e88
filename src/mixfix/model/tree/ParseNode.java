package mixfix.model.tree;

import mixfix.formatters.IndentingWriter;
import mixfix.formatters.ParseNodeStructureFormattingVisitor;
import mixfix.util.SourceLocatable;
import mixfix.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 *
 * The base class for parser output. Equality is structural: two nodes are equal if they have the same shape
 * and the same lexemes, wherever in the source they came from.
 *
 */
public abstract class ParseNode extends SourceLocatable {
	private final SourceLocation location;

	public ParseNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new ParseNodeStructureFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(ParseNodeVisitor<T, E> v) throws E;

}
