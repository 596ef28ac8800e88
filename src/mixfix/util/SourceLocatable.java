package mixfix.util;

/**
 *
 * A common abstract base, typically meant for tokens and parse nodes, that
 * should be implemented by anything that needs to be traced back to its
 * original location.
 *
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
