package mixfix.model.operator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A user declared operator: its display form, the category it belongs to, and how its open operand
 * positions treat operators of that same category.
 */
public class OperatorDefinition {

	private final String id;
	private final String category;
	private final List<FormPart> form;
	private final Tightness leftTightness;
	private final Tightness rightTightness;

	public OperatorDefinition(String id, String category, List<FormPart> form,
	                          Tightness leftTightness, Tightness rightTightness) {
		this.id = id;
		this.category = category;
		this.form = Collections.unmodifiableList(new ArrayList<>(form));
		this.leftTightness = leftTightness;
		this.rightTightness = rightTightness;
	}

	public OperatorDefinition(String id, String category, List<FormPart> form) {
		this(id, category, form, Tightness.SAME_OR_TIGHTER, Tightness.SAME_OR_TIGHTER);
	}

	/**
	 * The built-in operator applying one operand to the next by writing them side by side. It folds to the
	 * left.
	 */
	public static OperatorDefinition juxtaposition(String id, String category) {
		return new OperatorDefinition(id, category,
				Arrays.asList(new Placeholder("function"), new Placeholder("argument")),
				Tightness.SAME_OR_TIGHTER, Tightness.STRICTLY_TIGHTER);
	}

	public String getId() {
		return id;
	}

	public String getCategory() {
		return category;
	}

	public List<FormPart> getForm() {
		return form;
	}

	public Tightness getLeftTightness() {
		return leftTightness;
	}

	public Tightness getRightTightness() {
		return rightTightness;
	}

	/**
	 * @return the form without its ParamSlot, if any
	 */
	public List<FormPart> getSkeletonParts() {
		List<FormPart> parts = new ArrayList<>();
		for(FormPart part : form) {
			if(!(part instanceof ParamSlot)) {
				parts.add(part);
			}
		}
		return parts;
	}

	/**
	 * @return the keyword texts and placeholders, with "_" standing for every placeholder; two operators with
	 * the same skeleton cannot be told apart from their tokens
	 */
	public List<String> getSkeleton() {
		List<String> skeleton = new ArrayList<>();
		for(FormPart part : getSkeletonParts()) {
			skeleton.add(part instanceof Keyword ? ((Keyword) part).getText() : "_");
		}
		return skeleton;
	}

	public List<Keyword> getKeywords() {
		List<Keyword> keywords = new ArrayList<>();
		for(FormPart part : form) {
			if(part instanceof Keyword) {
				keywords.add((Keyword) part);
			}
		}
		return keywords;
	}

	/**
	 * @return the keyword texts this operator may consume, including the closing keyword of its ParamSlot
	 */
	public List<String> getAllKeywordTexts() {
		List<String> texts = new ArrayList<>();
		for(Keyword keyword : getKeywords()) {
			texts.add(keyword.getText());
		}
		ParamSlot slot = getParamSlot();
		if(slot != null && slot.getClosingKeyword() != null) {
			texts.add(slot.getClosingKeyword());
		}
		return texts;
	}

	public String getFirstKeyword() {
		List<Keyword> keywords = getKeywords();
		return keywords.isEmpty() ? null : keywords.get(0).getText();
	}

	public List<Placeholder> getPlaceholders() {
		List<Placeholder> placeholders = new ArrayList<>();
		for(FormPart part : form) {
			if(part instanceof Placeholder) {
				placeholders.add((Placeholder) part);
			}
		}
		return placeholders;
	}

	public ParamSlot getParamSlot() {
		for(FormPart part : form) {
			if(part instanceof ParamSlot) {
				return (ParamSlot) part;
			}
		}
		return null;
	}

	public boolean isLeftOpen() {
		List<FormPart> parts = getSkeletonParts();
		return !parts.isEmpty() && parts.get(0) instanceof Placeholder;
	}

	public boolean isRightOpen() {
		List<FormPart> parts = getSkeletonParts();
		return !parts.isEmpty() && parts.get(parts.size() - 1) instanceof Placeholder;
	}

	/**
	 * @return true if every keyword is an alphabetic name; such operators need no import
	 */
	public boolean isPronounceable() {
		for(String text : getAllKeywordTexts()) {
			if(!Keyword.isPronounceable(text)) {
				return false;
			}
		}
		return true;
	}

	public OperatorShape getShape() {
		int placeholders = getPlaceholders().size();
		int keywords = getKeywords().size();
		boolean leading = isLeftOpen();
		boolean trailing = isRightOpen();
		if(leading && trailing && placeholders == 2 && keywords == 1) {
			return OperatorShape.INFIX;
		}
		if(!leading && trailing && placeholders == 1) {
			return OperatorShape.PREFIX;
		}
		if(leading && !trailing && placeholders == 1) {
			return OperatorShape.POSTFIX;
		}
		return OperatorShape.MIXFIX;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for(FormPart part : form) {
			if(builder.length() > 0) {
				builder.append(' ');
			}
			builder.append(part);
		}
		return "OperatorDefinition [id=" + id + ", category=" + category + ", form=" + builder + "]";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		OperatorDefinition that = (OperatorDefinition) o;
		return Objects.equals(id, that.id) &&
				Objects.equals(category, that.category) &&
				Objects.equals(form, that.form) &&
				leftTightness == that.leftTightness &&
				rightTightness == that.rightTightness;
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, category, form, leftTightness, rightTightness);
	}
}
