package mixfix.config;

import mixfix.model.operator.FormPart;
import mixfix.model.operator.InnerParameter;
import mixfix.model.operator.Keyword;
import mixfix.model.operator.ParamSlot;
import mixfix.model.operator.Placeholder;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads display forms written as space separated parts, as in {@code "if _c then _a else _b"} or
 * {@code "_a ~~ []~~ _b"}:
 *
 * <ul>
 *     <li>{@code _name} is a placeholder</li>
 *     <li>{@code [...]} marks where the inner parameters go; text inside the brackets is a free comment</li>
 *     <li>{@code [...]kw} also names the keyword that must follow a written bracket</li>
 *     <li>anything else is a keyword</li>
 * </ul>
 */
public class FormParser {

	private static final Pattern PLACEHOLDER = Pattern.compile("_([A-Za-z][A-Za-z0-9_]*)");
	private static final Pattern PARAM_SLOT = Pattern.compile("\\[[^\\]]*\\](\\S*)");

	private FormParser() {}

	/**
	 * @param parameters the inner parameters a param slot in the form stands for
	 * @throws OptionParserIssue if the form cannot be read, or parameters are given without a slot for them
	 */
	public static List<FormPart> parse(String operatorId, String form, List<InnerParameter> parameters) {
		List<FormPart> parts = new ArrayList<>();
		boolean sawSlot = false;
		for(String word : form.trim().split("\\s+")) {
			if(word.isEmpty()) {
				continue;
			}
			Matcher placeholder = PLACEHOLDER.matcher(word);
			Matcher paramSlot = PARAM_SLOT.matcher(word);
			if(placeholder.matches()) {
				parts.add(new Placeholder(placeholder.group(1)));
			} else if(paramSlot.matches()) {
				String closing = paramSlot.group(1);
				parts.add(new ParamSlot(parameters, closing.isEmpty() ? null : closing));
				sawSlot = true;
			} else if(word.startsWith("_") || word.contains("[") || word.contains("]")) {
				throw new OptionParserIssue("operator " + operatorId + ": cannot read form part \"" + word + "\"");
			} else {
				parts.add(new Keyword(word));
			}
		}
		if(!sawSlot && !parameters.isEmpty()) {
			throw new OptionParserIssue("operator " + operatorId + " declares inner parameters but its form has no []");
		}
		return parts;
	}
}
