package mixfix.model.operator;

import java.util.Objects;
import java.util.regex.Pattern;

public class Keyword extends FormPart {

	private static final Pattern PRONOUNCEABLE = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

	private final String text;

	public Keyword(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return true if text is an alphabetic name rather than a symbol
	 */
	public static boolean isPronounceable(String text) {
		return PRONOUNCEABLE.matcher(text).matches();
	}

	@Override
	public <T, E extends Throwable> T accept(FormPartVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public String toString() {
		return text;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(text, ((Keyword) o).text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}
}
