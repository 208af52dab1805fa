package org.javai.promptlearning.meta;

import static org.javai.promptlearning.meta.MetaPromptTemplates.BASELINE_PROMPT;
import static org.javai.promptlearning.meta.MetaPromptTemplates.EXAMPLES;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.promptlearning.dataset.Batch;
import org.javai.promptlearning.dataset.Dataset;
import org.javai.promptlearning.dataset.DatasetRow;
import org.javai.promptlearning.llm.LlmClient;
import org.javai.promptlearning.llm.LlmResponse;
import org.javai.promptlearning.llm.RetryPolicy;
import org.javai.promptlearning.llm.RetryResult;
import org.javai.promptlearning.prompt.PromptTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces free-text guidance about a batch's failures, fed into the meta-prompt as
 * annotations.
 */
public class Annotator {

	private static final Logger logger = LoggerFactory.getLogger(Annotator.class);

	static final String NOT_AVAILABLE = "N/A";

	private final LlmClient llmClient;
	private final RetryPolicy retryPolicy;
	private final PromptTemplate template;

	public Annotator(LlmClient llmClient, RetryPolicy retryPolicy) {
		this(llmClient, retryPolicy, MetaPromptTemplates.ANNOTATION);
	}

	/**
	 * @param template annotation prompt; must contain {@code {examples}} and may contain
	 * {@code {baseline_prompt}}
	 */
	public Annotator(LlmClient llmClient, RetryPolicy retryPolicy, String template) {
		this.llmClient = Objects.requireNonNull(llmClient, "llmClient must not be null");
		this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
		this.template = PromptTemplate.of(template).requireVariables(List.of(EXAMPLES), List.of(BASELINE_PROMPT));
	}

	public String constructContent(
			Dataset rows,
			String baselinePrompt,
			List<String> templateVariables,
			List<String> feedbackColumns,
			String outputColumn,
			String groundTruthColumn
	) {
		return constructContent(new Batch(0, 0, rows, 0), baselinePrompt, templateVariables,
				feedbackColumns, outputColumn, groundTruthColumn);
	}

	/**
	 * Render the annotation prompt: for each row its input values, output, ground truth
	 * ({@code N/A} without a ground-truth column) and feedback.
	 */
	public String constructContent(
			Batch batch,
			String baselinePrompt,
			List<String> templateVariables,
			List<String> feedbackColumns,
			String outputColumn,
			String groundTruthColumn
	) {
		StringBuilder examples = new StringBuilder();
		List<DatasetRow> rows = batch.rows().rows();
		for (int i = 0; i < rows.size(); i++) {
			DatasetRow row = rows.get(i);
			examples.append("\n\nExample ").append(batch.startRow() + i).append('\n');
			examples.append("Input:\n");
			for (String variable : templateVariables) {
				examples.append(variable).append(": ").append(MetaPrompt.valueText(row, variable)).append('\n');
			}
			examples.append("Output: ").append(MetaPrompt.outputText(row, outputColumn)).append('\n');
			String groundTruth = groundTruthColumn == null ? NOT_AVAILABLE : MetaPrompt.valueText(row, groundTruthColumn);
			examples.append("Ground Truth: ").append(groundTruth).append('\n');
			examples.append("Feedback:");
			for (String column : feedbackColumns) {
				examples.append('\n').append(column).append(": ").append(MetaPrompt.valueText(row, column));
			}
		}
		return template.render(Map.of(), Map.of(
				BASELINE_PROMPT, baselinePrompt == null ? "" : baselinePrompt,
				EXAMPLES, examples.toString()));
	}

	/**
	 * Make the annotation call under the retry policy.
	 */
	public RetryResult<LlmResponse> request(String renderedPrompt) {
		Objects.requireNonNull(renderedPrompt, "renderedPrompt must not be null");
		logger.debug("Requesting annotation ({} chars)", renderedPrompt.length());
		return retryPolicy.execute("annotation", () -> llmClient.call(renderedPrompt));
	}

	/**
	 * @return the annotation text
	 * @throws org.javai.promptlearning.OptimizationException if every attempt failed with a
	 * retryable error
	 */
	public String generateAnnotation(String renderedPrompt) {
		return request(renderedPrompt).getOrThrow().text();
	}
}
