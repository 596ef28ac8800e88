package mixfix.registry;

import mixfix.model.operator.OperatorDefinition;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A lexical scope's view of the operators: symbolic operators are usable only once imported, operators
 * whose keywords are all names are always usable.
 */
public class Scope {

	private final String name;
	private final Set<String> imported;

	public Scope(String name, Set<String> imported) {
		this.name = name;
		this.imported = Collections.unmodifiableSet(new LinkedHashSet<>(imported));
	}

	public String getName() {
		return name;
	}

	public Set<String> getImported() {
		return imported;
	}

	public boolean isVisible(OperatorDefinition definition) {
		return definition.isPronounceable() || imported.contains(definition.getId());
	}

	@Override
	public String toString() {
		return "Scope [name=" + name + ", imported=" + imported + "]";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Scope scope = (Scope) o;
		return Objects.equals(name, scope.name) && Objects.equals(imported, scope.imported);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, imported);
	}
}
