package mixfix.model.operator;

import java.util.Objects;

public class Placeholder extends FormPart {

	private final String slot;

	public Placeholder(String slot) {
		this.slot = slot;
	}

	public String getSlot() {
		return slot;
	}

	@Override
	public <T, E extends Throwable> T accept(FormPartVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public String toString() {
		return "$" + slot;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(slot, ((Placeholder) o).slot);
	}

	@Override
	public int hashCode() {
		return Objects.hash(slot);
	}
}
