package mixfix.model.tree;

import mixfix.lexer.Token;
import mixfix.lexer.TokenKind;
import mixfix.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ParseNodeBuilder {
	private ParseNodeBuilder() {}

	public static Atom atom(String text) {
		TokenKind kind = Character.isDigit(text.charAt(0)) ? TokenKind.NUMERAL : TokenKind.IDENTIFIER;
		return new Atom(new Token(text, kind, SourceLocation.unknown()));
	}

	public static Apply apply(String operatorId, ParseNode... operands) {
		return new Apply(SourceLocation.unknown(), operatorId, Arrays.asList(operands));
	}

	public static Apply apply(String operatorId, Map<String, ParamValue> params, ParseNode... operands) {
		return new Apply(SourceLocation.unknown(), operatorId, Arrays.asList(operands), params);
	}

	public static ParamValue given(String... values) {
		List<Atom> atoms = new ArrayList<>();
		for(String value : values) {
			atoms.add(atom(value));
		}
		return new ParamValue(atoms, false);
	}

	public static ParamValue defaulted(String... values) {
		List<Atom> atoms = new ArrayList<>();
		for(String value : values) {
			atoms.add(atom(value));
		}
		return new ParamValue(atoms, true);
	}

	public static Map<String, ParamValue> params(String name, ParamValue value) {
		return Collections.singletonMap(name, value);
	}

	public static Map<String, ParamValue> params(String name1, ParamValue value1, String name2, ParamValue value2) {
		Map<String, ParamValue> result = new LinkedHashMap<>();
		result.put(name1, value1);
		result.put(name2, value2);
		return result;
	}

	public static List<ParseNode> operands(ParseNode... operands) {
		return Arrays.asList(operands);
	}

	public static List<String> relations(String... relations) {
		return Arrays.asList(relations);
	}

	public static Chain chain(String categoryId, String combinatorId, List<ParseNode> operands, List<String> relations) {
		return new Chain(SourceLocation.unknown(), categoryId, combinatorId, operands, relations);
	}
}
