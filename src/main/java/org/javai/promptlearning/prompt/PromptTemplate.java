package org.javai.promptlearning.prompt;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.promptlearning.ConfigurationException;

/**
 * Text with {@code {identifier}} placeholders.
 *
 * <p>Single curly braces around a bare identifier are the only placeholder syntax.
 * Substitution matches the exact {@code {name}} text of each declared variable, and
 * delimiter characters inside substituted values are replaced with spaces, so a value
 * can never open or close a placeholder of its own.</p>
 */
public final class PromptTemplate {

	public static final String START_DELIM = "{";
	public static final String END_DELIM = "}";

	private static final Pattern VARIABLE = Pattern.compile("\\{([a-zA-Z_][a-zA-Z0-9_]*)\\}");

	private final String text;
	private final List<String> variables;

	private PromptTemplate(String text) {
		this.text = Objects.requireNonNull(text, "text must not be null");
		this.variables = List.copyOf(detectVariables(text));
	}

	public static PromptTemplate of(String text) {
		return new PromptTemplate(text);
	}

	/**
	 * Unique placeholder names of {@code text}, in order of first appearance.
	 */
	public static Set<String> detectVariables(String text) {
		Set<String> names = new LinkedHashSet<>();
		if (text == null) {
			return names;
		}
		Matcher matcher = VARIABLE.matcher(text);
		while (matcher.find()) {
			names.add(matcher.group(1));
		}
		return names;
	}

	/**
	 * Replace both delimiters with a space.
	 */
	public static String escape(String value) {
		if (value == null) {
			return null;
		}
		return value.replace(START_DELIM, " ").replace(END_DELIM, " ");
	}

	public String text() {
		return text;
	}

	public List<String> variables() {
		return variables;
	}

	/**
	 * Substitute every declared variable present in {@code values}, escaping delimiters in
	 * the values. Placeholders without a value are left untouched; null renders as empty.
	 */
	public String render(Map<String, ?> values) {
		return render(values, Map.of());
	}

	/**
	 * Single-pass substitution: each placeholder of the template is replaced at most once
	 * and substituted text is never scanned again.
	 *
	 * @param escapedValues values inserted after {@link #escape(String)}
	 * @param verbatimValues values inserted as-is, e.g. a prompt whose own placeholders must survive
	 */
	public String render(Map<String, ?> escapedValues, Map<String, ?> verbatimValues) {
		Objects.requireNonNull(escapedValues, "escapedValues must not be null");
		Objects.requireNonNull(verbatimValues, "verbatimValues must not be null");
		Matcher matcher = VARIABLE.matcher(text);
		StringBuilder out = new StringBuilder(text.length());
		while (matcher.find()) {
			String name = matcher.group(1);
			String replacement;
			if (verbatimValues.containsKey(name)) {
				replacement = stringOf(verbatimValues.get(name));
			}
			else if (escapedValues.containsKey(name)) {
				replacement = escape(stringOf(escapedValues.get(name)));
			}
			else {
				replacement = matcher.group();
			}
			matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
		}
		matcher.appendTail(out);
		return out.toString();
	}

	private static String stringOf(Object value) {
		return value == null ? "" : value.toString();
	}

	/**
	 * Reject this template unless it declares every required variable and nothing outside
	 * {@code required} and {@code optional}.
	 *
	 * @return this template
	 */
	public PromptTemplate requireVariables(Collection<String> required, Collection<String> optional) {
		List<String> missing = new ArrayList<>();
		for (String name : required) {
			if (!variables.contains(name)) {
				missing.add(name);
			}
		}
		List<String> unexpected = new ArrayList<>();
		for (String name : variables) {
			if (!required.contains(name) && !optional.contains(name)) {
				unexpected.add(name);
			}
		}
		if (!missing.isEmpty() || !unexpected.isEmpty()) {
			throw new ConfigurationException("Template variables do not match: missing " + missing
					+ ", unexpected " + unexpected);
		}
		return this;
	}

	/**
	 * Variables of this template that do not occur as placeholders in {@code other}.
	 */
	public List<String> missingFrom(String other) {
		Set<String> present = detectVariables(other);
		List<String> missing = new ArrayList<>();
		for (String name : variables) {
			if (!present.contains(name)) {
				missing.add(name);
			}
		}
		return missing;
	}

	@Override
	public String toString() {
		return "PromptTemplate" + variables;
	}
}
