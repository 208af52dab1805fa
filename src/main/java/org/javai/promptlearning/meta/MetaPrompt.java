package org.javai.promptlearning.meta;

import static org.javai.promptlearning.meta.MetaPromptTemplates.ANNOTATIONS;
import static org.javai.promptlearning.meta.MetaPromptTemplates.BASELINE_PROMPT;
import static org.javai.promptlearning.meta.MetaPromptTemplates.EXAMPLES;
import static org.javai.promptlearning.meta.MetaPromptTemplates.RULESET;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.promptlearning.DatasetException;
import org.javai.promptlearning.dataset.Batch;
import org.javai.promptlearning.dataset.DatasetRow;
import org.javai.promptlearning.prompt.PromptTemplate;

/**
 * Renders the instruction sent to the optimizing model for one batch.
 *
 * <p>Two template families exist: the prompt-rewrite template asks for a new prompt, the
 * ruleset template asks for a revised ruleset. The candidate prompt and ruleset are
 * inserted verbatim so that their own placeholders reach the model intact; every value
 * taken from the dataset or from annotations is delimiter-escaped.</p>
 */
public class MetaPrompt {

	static final String NONE = "None";

	private final PromptTemplate promptTemplate;
	private final PromptTemplate rulesetTemplate;

	public MetaPrompt() {
		this(MetaPromptTemplates.PROMPT_REWRITE, MetaPromptTemplates.RULESET_EDIT);
	}

	/**
	 * @throws org.javai.promptlearning.ConfigurationException if either template lacks a
	 * required placeholder or declares an unknown one
	 */
	public MetaPrompt(String promptTemplate, String rulesetTemplate) {
		this.promptTemplate = PromptTemplate.of(promptTemplate)
				.requireVariables(List.of(BASELINE_PROMPT, EXAMPLES), List.of(ANNOTATIONS));
		this.rulesetTemplate = PromptTemplate.of(rulesetTemplate)
				.requireVariables(List.of(BASELINE_PROMPT, RULESET, EXAMPLES), List.of(ANNOTATIONS));
	}

	public PromptTemplate promptTemplate() {
		return promptTemplate;
	}

	public PromptTemplate rulesetTemplate() {
		return rulesetTemplate;
	}

	/**
	 * Render the meta-prompt for a batch.
	 *
	 * @param candidatePrompt current editable prompt text
	 * @param batch the rows to show as examples
	 * @param templateVariables placeholders of the candidate prompt, shown per example
	 * @param feedbackColumns columns holding feedback on each output
	 * @param outputColumn column holding the model output
	 * @param annotations extra guidance, joined with newlines; may be empty
	 * @param ruleset current ruleset, or {@code null} to render the prompt-rewrite family
	 */
	public String render(
			String candidatePrompt,
			Batch batch,
			List<String> templateVariables,
			List<String> feedbackColumns,
			String outputColumn,
			List<String> annotations,
			String ruleset
	) {
		Objects.requireNonNull(candidatePrompt, "candidatePrompt must not be null");
		Objects.requireNonNull(batch, "batch must not be null");
		Objects.requireNonNull(outputColumn, "outputColumn must not be null");
		boolean rulesetMode = ruleset != null;

		StringBuilder examples = new StringBuilder();
		List<DatasetRow> rows = batch.rows().rows();
		for (int i = 0; i < rows.size(); i++) {
			DatasetRow row = rows.get(i);
			examples.append("\n\nExample ").append(batch.startRow() + i).append('\n');
			if (rulesetMode) {
				examples.append("coding agent patch: ").append(outputText(row, outputColumn)).append('\n');
			}
			else {
				examples.append("Data for baseline prompt:\n");
				for (String variable : templateVariables) {
					examples.append(variable).append(": ").append(valueText(row, variable)).append('\n');
				}
				examples.append("LLM Output using baseline prompt: ").append(outputText(row, outputColumn)).append('\n');
			}
			examples.append("Output level feedback:");
			for (String column : feedbackColumns) {
				examples.append('\n').append(column).append(": ").append(valueText(row, column));
			}
		}

		Map<String, Object> verbatim = new HashMap<>();
		verbatim.put(BASELINE_PROMPT, candidatePrompt);
		// examples are escaped value by value above
		verbatim.put(EXAMPLES, examples.toString());
		Map<String, Object> escaped = new HashMap<>();
		escaped.put(ANNOTATIONS, annotations == null ? "" : String.join("\n", annotations));

		if (rulesetMode) {
			verbatim.put(RULESET, ruleset);
			return rulesetTemplate.render(escaped, verbatim);
		}
		return promptTemplate.render(escaped, verbatim);
	}

	/**
	 * Fill {@code template} with the values of {@code variables}, matching each exact
	 * {@code {name}} placeholder and escaping delimiters in the values.
	 *
	 * @throws DatasetException if {@code values} has no entry for one of the variables
	 */
	public static String formatTemplateWithVariables(String template, List<String> variables, Map<String, ?> values) {
		Map<String, Object> selected = new LinkedHashMap<>();
		for (String variable : variables) {
			if (!values.containsKey(variable)) {
				throw new DatasetException("No value for template variable '" + variable + "'");
			}
			selected.put(variable, String.valueOf(values.get(variable)));
		}
		return PromptTemplate.of(template).render(selected);
	}

	static String outputText(DatasetRow row, String outputColumn) {
		Object output = row.value(outputColumn);
		if (output instanceof String text) {
			return PromptTemplate.escape(text);
		}
		return NONE;
	}

	static String valueText(DatasetRow row, String column) {
		String text = row.text(column);
		return text == null ? NONE : PromptTemplate.escape(text);
	}
}
