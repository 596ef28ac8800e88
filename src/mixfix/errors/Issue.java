package mixfix.errors;

import mixfix.MixfixException;
import mixfix.Unreachable;
import mixfix.formatters.IndentingWriter;
import mixfix.formatters.IssueFormattingVisitor;
import mixfix.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.List;

public abstract class Issue extends MixfixException {
	public Issue() {
		super("Issue", "");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract IssueTag getTag();

	/**
	 * @return the source spans this issue is about, possibly none
	 */
	public List<SourceLocation> getLocations() {
		return Collections.emptyList();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
