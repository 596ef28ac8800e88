package mixfix.model.operator;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named inner parameter slot. A mandatory slot has no default value.
 */
public class InnerParameter {

	private final String name;
	private final List<String> defaultValue;
	private final boolean mandatory;

	private InnerParameter(String name, List<String> defaultValue, boolean mandatory) {
		this.name = name;
		this.defaultValue = defaultValue;
		this.mandatory = mandatory;
	}

	public static InnerParameter optional(String name, List<String> defaultValue) {
		return new InnerParameter(name, Collections.unmodifiableList(defaultValue), false);
	}

	public static InnerParameter mandatory(String name) {
		return new InnerParameter(name, Collections.emptyList(), true);
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the literal values the slot takes when it is not supplied
	 */
	public List<String> getDefaultValue() {
		return defaultValue;
	}

	public boolean isMandatory() {
		return mandatory;
	}

	@Override
	public String toString() {
		return mandatory ? name + "!" : name + "=" + defaultValue;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		InnerParameter that = (InnerParameter) o;
		return mandatory == that.mandatory &&
				Objects.equals(name, that.name) &&
				Objects.equals(defaultValue, that.defaultValue);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, defaultValue, mandatory);
	}
}
