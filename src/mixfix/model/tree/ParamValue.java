package mixfix.model.tree;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The value bound to one inner parameter: the literal atoms written for it, or its declared default.
 */
public class ParamValue {

	private final List<Atom> values;
	private final boolean defaulted;

	public ParamValue(List<Atom> values, boolean defaulted) {
		this.values = Collections.unmodifiableList(values);
		this.defaulted = defaulted;
	}

	public List<Atom> getValues() {
		return values;
	}

	public boolean isDefaulted() {
		return defaulted;
	}

	@Override
	public String toString() {
		return (defaulted ? "default" : "") + values;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ParamValue that = (ParamValue) o;
		return defaulted == that.defaulted && Objects.equals(values, that.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(values, defaulted);
	}
}
