package mixfix.model.operator;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The inner parameters of an operator, attached to the keyword directly before this part in the form.
 *
 * <p>When written, the parameters are a bracketed, comma separated list right after that keyword. If a
 * closing keyword is set it must follow the closing bracket, as in {@code a ~~[tension: 2]~~ b}.</p>
 */
public class ParamSlot extends FormPart {

	private final List<InnerParameter> parameters;
	private final String closingKeyword;

	public ParamSlot(List<InnerParameter> parameters, String closingKeyword) {
		this.parameters = Collections.unmodifiableList(parameters);
		this.closingKeyword = closingKeyword;
	}

	public List<InnerParameter> getParameters() {
		return parameters;
	}

	public InnerParameter getParameter(String name) {
		for(InnerParameter parameter : parameters) {
			if(parameter.getName().equals(name)) {
				return parameter;
			}
		}
		return null;
	}

	/**
	 * @return the keyword that must follow the closing bracket, or null
	 */
	public String getClosingKeyword() {
		return closingKeyword;
	}

	@Override
	public <T, E extends Throwable> T accept(FormPartVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public String toString() {
		return "[" + parameters + "]" + (closingKeyword == null ? "" : closingKeyword);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ParamSlot that = (ParamSlot) o;
		return Objects.equals(parameters, that.parameters) && Objects.equals(closingKeyword, that.closingKeyword);
	}

	@Override
	public int hashCode() {
		return Objects.hash(parameters, closingKeyword);
	}
}
