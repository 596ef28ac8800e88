package mixfix.parser;

import mixfix.lexer.Token;
import mixfix.lexer.TokenKind;
import mixfix.model.operator.InnerParameter;
import mixfix.model.operator.ParamSlot;
import mixfix.model.tree.Atom;
import mixfix.model.tree.ParamValue;
import mixfix.util.SourceLocation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads the contents of an inner parameter bracket:
 *
 * <pre>
 * params ::= item (',' item)*
 * item   ::= IDENTIFIER ':' value | value
 * value  ::= NUMERAL | IDENTIFIER
 * </pre>
 *
 * Unlabelled values before the first label fill the slots in declaration order. Every value after a label
 * belongs to that label's slot, so {@code tension: 1.5, 1} gives tension both values.
 */
final class InnerParameterParser {

	private static final Pattern NUMERIC = Pattern.compile("[0-9]+(\\.[0-9]+)?");

	private final String operatorId;
	private final ParamSlot slot;
	private final List<Token> tokens;
	private final SourceLocation bracket;
	private int pos = 0;

	private InnerParameterParser(String operatorId, ParamSlot slot, List<Token> tokens, SourceLocation bracket) {
		this.operatorId = operatorId;
		this.slot = slot;
		this.tokens = tokens;
		this.bracket = bracket;
	}

	/**
	 * @param tokens the tokens between the brackets
	 * @param bracket the location of the whole bracket
	 * @throws UnknownParameterIssue if a label names no slot
	 * @throws ParameterArityIssue if a slot is missing, given twice, or there are too many positional values
	 * @throws NoParseIssue if the bracket does not follow the grammar above
	 */
	static Map<String, ParamValue> parse(String operatorId, ParamSlot slot, List<Token> tokens,
	                                     SourceLocation bracket) {
		return new InnerParameterParser(operatorId, slot, tokens, bracket).parseItems();
	}

	/**
	 * @return the parameters of an operator written without a bracket
	 * @throws ParameterArityIssue if some slot is mandatory
	 */
	static Map<String, ParamValue> defaults(String operatorId, ParamSlot slot, SourceLocation keyword) {
		return complete(operatorId, slot, new LinkedHashMap<>(), keyword);
	}

	private Map<String, ParamValue> parseItems() {
		Map<String, List<Atom>> given = new LinkedHashMap<>();
		List<InnerParameter> parameters = slot.getParameters();
		String label = null;
		int positional = 0;
		while(pos < tokens.size()) {
			Token token = tokens.get(pos);
			if(token.getKind() == TokenKind.IDENTIFIER && pos + 1 < tokens.size() &&
					tokens.get(pos + 1).getKind() == TokenKind.COLON) {
				label = token.getValue();
				if(slot.getParameter(label) == null) {
					throw new UnknownParameterIssue(operatorId, label, token.getLocation());
				}
				if(given.containsKey(label)) {
					throw new ParameterArityIssue(operatorId, label, ParameterArityIssue.Problem.REPEATED,
							token.getLocation());
				}
				given.put(label, new ArrayList<>());
				pos += 2;
				given.get(label).add(readValue());
			} else if(label != null) {
				given.get(label).add(readValue());
			} else {
				Atom value = readValue();
				if(positional >= parameters.size()) {
					throw new ParameterArityIssue(operatorId, null, ParameterArityIssue.Problem.SURPLUS,
							value.getLocation());
				}
				List<Atom> values = new ArrayList<>();
				values.add(value);
				given.put(parameters.get(positional).getName(), values);
				++positional;
			}
			if(pos < tokens.size()) {
				Token separator = tokens.get(pos);
				if(separator.getKind() != TokenKind.COMMA) {
					throw new NoParseIssue("expected ',' between inner parameters, found \"" + separator.getValue() +
							"\"", separator.getLocation());
				}
				++pos;
				if(pos == tokens.size()) {
					throw new NoParseIssue("trailing ',' in inner parameters", separator.getLocation());
				}
			}
		}
		Map<String, ParamValue> written = new LinkedHashMap<>();
		for(Map.Entry<String, List<Atom>> e : given.entrySet()) {
			written.put(e.getKey(), new ParamValue(e.getValue(), false));
		}
		return complete(operatorId, slot, written, bracket);
	}

	private Atom readValue() {
		if(pos >= tokens.size()) {
			throw new NoParseIssue("expected an inner parameter value", bracket);
		}
		Token token = tokens.get(pos);
		if(token.getKind() != TokenKind.NUMERAL && token.getKind() != TokenKind.IDENTIFIER) {
			throw new NoParseIssue("expected an inner parameter value, found \"" + token.getValue() + "\"",
					token.getLocation());
		}
		++pos;
		return new Atom(token);
	}

	// fills in defaults and orders the result by declaration
	private static Map<String, ParamValue> complete(String operatorId, ParamSlot slot, Map<String, ParamValue> written,
	                                                SourceLocation where) {
		Map<String, ParamValue> result = new LinkedHashMap<>();
		for(InnerParameter parameter : slot.getParameters()) {
			ParamValue value = written.get(parameter.getName());
			if(value == null) {
				if(parameter.isMandatory()) {
					throw new ParameterArityIssue(operatorId, parameter.getName(), ParameterArityIssue.Problem.MISSING,
							where);
				}
				List<Atom> defaults = new ArrayList<>();
				for(String literal : parameter.getDefaultValue()) {
					TokenKind kind = NUMERIC.matcher(literal).matches() ? TokenKind.NUMERAL : TokenKind.IDENTIFIER;
					defaults.add(new Atom(new Token(literal, kind, SourceLocation.unknown())));
				}
				value = new ParamValue(defaults, true);
			}
			result.put(parameter.getName(), value);
		}
		return result;
	}
}
