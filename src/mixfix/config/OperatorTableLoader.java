package mixfix.config;

import mixfix.model.operator.FormPart;
import mixfix.model.operator.InnerParameter;
import mixfix.model.operator.OperatorDefinition;
import mixfix.model.operator.Tightness;
import mixfix.registry.OperatorRegistry;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Applies a JSON operator table to a registry. The sections are applied in a fixed order: categories, chain
 * policies, operators, imports, then juxtaposition; within a section, in array order. The first declaration
 * that fails stops the load, leaving the declarations before it in place.
 *
 * <pre>
 * {
 *   "categories": [{"id": "arith", "label": "arithmetic", "tighterThan": ["cmp"], "weakerThan": [], "chain": null}],
 *   "operators": [{"id": "+", "form": "_a + _b", "category": "arith",
 *                  "leftTightness": "same_or_tighter", "rightTightness": "strictly_tighter",
 *                  "params": [{"name": "tension", "default": ["1"]}, {"name": "style", "mandatory": true}]}],
 *   "imports": {"main": ["+"]},
 *   "juxtaposition": "application"
 * }
 * </pre>
 */
public class OperatorTableLoader {

	private static final Logger logger = Logger.getLogger(OperatorTableLoader.class.getName());

	public static final String CATEGORIES_FIELD = "categories";
	public static final String OPERATORS_FIELD = "operators";
	public static final String IMPORTS_FIELD = "imports";
	public static final String JUXTAPOSITION_FIELD = "juxtaposition";

	private final OperatorRegistry registry;

	public OperatorTableLoader(OperatorRegistry registry) {
		this.registry = registry;
	}

	/**
	 * @throws IOErrorIssue if the file cannot be read
	 * @throws OptionParserIssue if the file is not a valid table
	 */
	public void load(Path table) {
		String text;
		try {
			text = FileUtils.readFileToString(table.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new IOErrorIssue(e);
		}
		logger.info("loading operator table " + table);
		load(text);
	}

	public void load(String json) {
		JSONObject config;
		try {
			config = new JSONObject(json);
		} catch (JSONException e) {
			throw new OptionParserIssue("parsing error: " + e.getMessage());
		}
		try {
			apply(config);
		} catch (JSONException e) {
			throw new OptionParserIssue("operator table is invalid: " + e.getMessage());
		}
	}

	private void apply(JSONObject config) {
		JSONArray categories = config.optJSONArray(CATEGORIES_FIELD);
		if(categories != null) {
			for(int i = 0; i < categories.length(); i++) {
				JSONObject category = categories.getJSONObject(i);
				String id = category.getString("id");
				registry.declareCategory(id, category.optString("label", id),
						strings(category.optJSONArray("tighterThan")), strings(category.optJSONArray("weakerThan")));
			}
			for(int i = 0; i < categories.length(); i++) {
				JSONObject category = categories.getJSONObject(i);
				if(category.has("chain") && !category.isNull("chain")) {
					registry.setChainPolicy(category.getString("id"), category.getString("chain"));
				}
			}
		}

		JSONArray operators = config.optJSONArray(OPERATORS_FIELD);
		if(operators != null) {
			for(int i = 0; i < operators.length(); i++) {
				registry.declareOperator(readOperator(operators.getJSONObject(i)));
			}
		}

		JSONObject imports = config.optJSONObject(IMPORTS_FIELD);
		if(imports != null) {
			for(String scope : imports.keySet()) {
				for(String id : strings(imports.getJSONArray(scope))) {
					registry.importOperator(scope, id);
				}
			}
		}

		if(config.has(JUXTAPOSITION_FIELD)) {
			Object juxtaposition = config.get(JUXTAPOSITION_FIELD);
			if(juxtaposition instanceof JSONObject) {
				JSONObject options = (JSONObject) juxtaposition;
				registry.enableJuxtaposition(options.optString("id", OperatorRegistry.DEFAULT_JUXTAPOSITION_ID),
						options.getString("category"));
			} else {
				registry.enableJuxtaposition(config.getString(JUXTAPOSITION_FIELD));
			}
		}
	}

	private static OperatorDefinition readOperator(JSONObject operator) {
		String id = operator.getString("id");
		List<InnerParameter> parameters = new ArrayList<>();
		JSONArray params = operator.optJSONArray("params");
		if(params != null) {
			for(int i = 0; i < params.length(); i++) {
				JSONObject param = params.getJSONObject(i);
				String name = param.getString("name");
				if(param.optBoolean("mandatory", false)) {
					parameters.add(InnerParameter.mandatory(name));
				} else {
					parameters.add(InnerParameter.optional(name, values(param.optJSONArray("default"))));
				}
			}
		}
		List<FormPart> form = FormParser.parse(id, operator.getString("form"), parameters);
		String category = operator.has("category") && !operator.isNull("category") ?
				operator.getString("category") : null;
		return new OperatorDefinition(id, category, form,
				tightness(id, operator.optString("leftTightness", null)),
				tightness(id, operator.optString("rightTightness", null)));
	}

	private static Tightness tightness(String operatorId, String value) {
		if(value == null) {
			return Tightness.SAME_OR_TIGHTER;
		}
		try {
			return Tightness.valueOf(value.toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new OptionParserIssue("operator " + operatorId + ": unknown tightness \"" + value + "\"");
		}
	}

	private static List<String> values(JSONArray array) {
		List<String> result = new ArrayList<>();
		if(array != null) {
			for(int i = 0; i < array.length(); i++) {
				result.add(array.get(i).toString());
			}
		}
		return result;
	}

	private static Set<String> strings(JSONArray array) {
		Set<String> result = new LinkedHashSet<>();
		if(array != null) {
			for(int i = 0; i < array.length(); i++) {
				result.add(array.getString(i));
			}
		}
		return result;
	}
}
