package org.javai.promptlearning.optimizer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.promptlearning.dataset.Dataset;
import org.javai.promptlearning.meta.OptimizationMode;

/**
 * Input of one optimization run.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * OptimizationRequest request = OptimizationRequest.builder()
 *         .dataset(dataset)
 *         .outputColumn("answer")
 *         .feedbackColumns("correctness", "explanation")
 *         .build();
 * }</pre>
 *
 * @param dataset in-memory rows; exclusive with {@code datasetPath}
 * @param datasetPath JSON, JSON-lines or CSV file to load the rows from
 * @param outputColumn column holding the model output for each row
 * @param feedbackColumns columns holding existing feedback
 * @param evaluators producers of additional feedback columns
 * @param annotations static guidance added to every meta-prompt
 * @param annotatorTemplates templates for per-batch annotation calls
 * @param groundTruthColumn column with the expected answer, shown to annotators
 * @param ruleset initial ruleset; a non-blank one selects ruleset mode
 * @param contextSizeTokens token budget of a batch; {@code null} uses the settings
 */
public record OptimizationRequest(
		Dataset dataset,
		Path datasetPath,
		String outputColumn,
		List<String> feedbackColumns,
		List<Evaluator> evaluators,
		List<String> annotations,
		List<String> annotatorTemplates,
		String groundTruthColumn,
		String ruleset,
		Integer contextSizeTokens
) {

	public OptimizationRequest {
		if ((dataset == null) == (datasetPath == null)) {
			throw new IllegalArgumentException("exactly one of dataset and datasetPath must be set");
		}
		if (outputColumn == null || outputColumn.isBlank()) {
			throw new IllegalArgumentException("outputColumn must not be blank");
		}
		feedbackColumns = List.copyOf(feedbackColumns);
		evaluators = List.copyOf(evaluators);
		annotations = List.copyOf(annotations);
		annotatorTemplates = List.copyOf(annotatorTemplates);
		if (contextSizeTokens != null && contextSizeTokens <= 0) {
			throw new IllegalArgumentException("contextSizeTokens must be positive");
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Ruleset editing when a non-blank ruleset is given, prompt rewriting otherwise.
	 */
	public OptimizationMode mode() {
		return ruleset == null || ruleset.isBlank()
				? OptimizationMode.promptRewrite()
				: OptimizationMode.rulesetEdit(ruleset);
	}

	/**
	 * Builder for {@link OptimizationRequest}.
	 */
	public static class Builder {
		private Dataset dataset;
		private Path datasetPath;
		private String outputColumn;
		private final List<String> feedbackColumns = new ArrayList<>();
		private final List<Evaluator> evaluators = new ArrayList<>();
		private final List<String> annotations = new ArrayList<>();
		private final List<String> annotatorTemplates = new ArrayList<>();
		private String groundTruthColumn;
		private String ruleset;
		private Integer contextSizeTokens;

		private Builder() {}

		public Builder dataset(Dataset dataset) {
			this.dataset = dataset;
			return this;
		}

		public Builder dataset(Path datasetPath) {
			this.datasetPath = datasetPath;
			return this;
		}

		public Builder outputColumn(String outputColumn) {
			this.outputColumn = outputColumn;
			return this;
		}

		public Builder feedbackColumns(String... columns) {
			return feedbackColumns(List.of(columns));
		}

		public Builder feedbackColumns(List<String> columns) {
			this.feedbackColumns.addAll(columns);
			return this;
		}

		public Builder evaluator(Evaluator evaluator) {
			this.evaluators.add(Objects.requireNonNull(evaluator, "evaluator must not be null"));
			return this;
		}

		public Builder evaluators(List<Evaluator> evaluators) {
			evaluators.forEach(this::evaluator);
			return this;
		}

		public Builder annotation(String annotation) {
			this.annotations.add(Objects.requireNonNull(annotation, "annotation must not be null"));
			return this;
		}

		public Builder annotatorTemplate(String template) {
			this.annotatorTemplates.add(Objects.requireNonNull(template, "template must not be null"));
			return this;
		}

		public Builder groundTruthColumn(String groundTruthColumn) {
			this.groundTruthColumn = groundTruthColumn;
			return this;
		}

		/**
		 * Switch to ruleset mode, starting from {@code ruleset}.
		 */
		public Builder ruleset(String ruleset) {
			this.ruleset = ruleset;
			return this;
		}

		public Builder contextSizeTokens(int contextSizeTokens) {
			this.contextSizeTokens = contextSizeTokens;
			return this;
		}

		public OptimizationRequest build() {
			return new OptimizationRequest(dataset, datasetPath, outputColumn, feedbackColumns, evaluators,
					annotations, annotatorTemplates, groundTruthColumn, ruleset, contextSizeTokens);
		}
	}
}
