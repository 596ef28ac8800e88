package mixfix.model.tree;

import mixfix.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 *
 * One use of an operator: its operands in form order, and its inner parameters by slot name.
 *
 */
public class Apply extends ParseNode {

	private final String operatorId;
	private final List<ParseNode> operands;
	private final Map<String, ParamValue> params;

	public Apply(SourceLocation location, String operatorId, List<ParseNode> operands, Map<String, ParamValue> params) {
		super(location);
		this.operatorId = operatorId;
		this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
		this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
	}

	public Apply(SourceLocation location, String operatorId, List<ParseNode> operands) {
		this(location, operatorId, operands, Collections.emptyMap());
	}

	public String getOperatorId() {
		return operatorId;
	}

	public List<ParseNode> getOperands() {
		return operands;
	}

	public Map<String, ParamValue> getParams() {
		return params;
	}

	@Override
	public <T, E extends Throwable> T accept(ParseNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operatorId, operands, params);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		Apply other = (Apply) obj;
		return operatorId.equals(other.operatorId) && operands.equals(other.operands) && params.equals(other.params);
	}
}
