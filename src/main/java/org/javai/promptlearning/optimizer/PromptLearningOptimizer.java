package org.javai.promptlearning.optimizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.promptlearning.DatasetException;
import org.javai.promptlearning.dataset.Batch;
import org.javai.promptlearning.dataset.Dataset;
import org.javai.promptlearning.dataset.DatasetLoader;
import org.javai.promptlearning.dataset.DatasetSplitter;
import org.javai.promptlearning.llm.LlmClient;
import org.javai.promptlearning.llm.LlmResponse;
import org.javai.promptlearning.llm.RetryPolicy;
import org.javai.promptlearning.llm.RetryResult;
import org.javai.promptlearning.meta.Annotator;
import org.javai.promptlearning.meta.MetaPrompt;
import org.javai.promptlearning.meta.OptimizationMode;
import org.javai.promptlearning.pricing.PricingCalculator;
import org.javai.promptlearning.prompt.PromptRepresentation;
import org.javai.promptlearning.prompt.PromptTemplate;
import org.javai.promptlearning.token.TiktokenCounter;
import org.javai.promptlearning.token.TokenCounter;

/**
 * Rewrites a prompt, or its ruleset, from a dataset of outputs and feedback.
 *
 * <p>The dataset is split into batches that fit the context budget. Batches are
 * processed strictly in order; each one renders a meta-prompt from the current candidate
 * and asks the model for a revision. A successful batch replaces the candidate, a failed
 * batch leaves it as it was and the run moves on. Before each model call the pricing
 * ledger is consulted, and the run stops once the next call would exceed the spending
 * limit.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * PromptLearningOptimizer optimizer = PromptLearningOptimizer.builder()
 *         .prompt(PromptRepresentation.of("Answer the question: {question}"))
 *         .llmClient(new ChatClientLlmClient(chatClient))
 *         .build();
 *
 * OptimizationResult result = optimizer.optimize(OptimizationRequest.builder()
 *         .dataset(dataset)
 *         .outputColumn("answer")
 *         .feedbackColumns("feedback")
 *         .build());
 * }</pre>
 *
 * <p>Instances are not thread-safe: the pricing ledger is updated without locking.</p>
 */
public class PromptLearningOptimizer {

	private final OptimizationLogger optimizationLogger = new OptimizationLogger(PromptLearningOptimizer.class);

	private final PromptRepresentation prompt;
	private final LlmClient llmClient;
	private final LlmClient annotationLlmClient;
	private final TokenCounter tokenCounter;
	private final DatasetSplitter splitter;
	private final PricingCalculator pricingCalculator;
	private final OptimizerSettings settings;
	private final MetaPrompt metaPrompt;
	private final RetryPolicy retryPolicy;
	private final DatasetLoader datasetLoader;

	private PromptLearningOptimizer(Builder builder) {
		this.prompt = Objects.requireNonNull(builder.prompt, "prompt must not be null");
		this.llmClient = Objects.requireNonNull(builder.llmClient, "llmClient must not be null");
		this.annotationLlmClient = builder.annotationLlmClient != null ? builder.annotationLlmClient : llmClient;
		this.settings = builder.settings != null ? builder.settings : OptimizerSettings.defaults();
		this.tokenCounter = builder.tokenCounter != null ? builder.tokenCounter : TiktokenCounter.forModel(settings.model());
		this.splitter = new DatasetSplitter(tokenCounter);
		this.pricingCalculator = builder.pricingCalculator != null ? builder.pricingCalculator : new PricingCalculator();
		this.metaPrompt = builder.metaPrompt != null ? builder.metaPrompt : new MetaPrompt();
		this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : settings.retryPolicy();
		this.datasetLoader = builder.datasetLoader != null ? builder.datasetLoader : new DatasetLoader();
		// fails fast on a prompt without messages
		this.prompt.editableIndex(settings.editableRole());
	}

	public static Builder builder() {
		return new Builder();
	}

	public PromptRepresentation prompt() {
		return prompt;
	}

	public OptimizerSettings settings() {
		return settings;
	}

	public PricingCalculator pricingCalculator() {
		return pricingCalculator;
	}

	/**
	 * Run the optimization.
	 *
	 * @throws DatasetException if no feedback source is given or a required column is
	 * missing; raised before any model call
	 * @throws org.javai.promptlearning.ConfigurationException if an annotator template is malformed
	 */
	public OptimizationResult optimize(OptimizationRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		Dataset dataset = resolveDataset(request);
		validateInputs(dataset, request.feedbackColumns(), request.evaluators(), request.outputColumn(),
				request.groundTruthColumn());
		List<Annotator> annotators = annotatorsFor(request.annotatorTemplates());

		List<String> feedbackColumns = request.feedbackColumns();
		if (!request.evaluators().isEmpty()) {
			EvaluatedDataset evaluated = runEvaluators(dataset, request.evaluators(), feedbackColumns);
			dataset = evaluated.dataset();
			feedbackColumns = evaluated.feedbackColumns();
		}

		OptimizationMode mode = request.mode();
		String editableRole = settings.editableRole();
		String content = prompt.editableContent(editableRole);
		List<String> templateVariables = List.copyOf(PromptTemplate.detectVariables(content));
		int contextSize = request.contextSizeTokens() != null ? request.contextSizeTokens() : settings.contextSizeTokens();

		List<String> columnsToCount = List.copyOf(dataset.columns());
		List<Batch> batches = splitter.split(dataset, columnsToCount, contextSize);
		optimizationLogger.logRunStart(mode, dataset.size(), batches.size(), templateVariables);

		String ruleset = mode instanceof OptimizationMode.RulesetEdit edit ? edit.initialRuleset() : null;
		List<BatchReport> reports = new ArrayList<>(batches.size());
		StopReason stopReason = StopReason.COMPLETED;

		for (Batch batch : batches) {
			if (stopReason == StopReason.BUDGET_EXCEEDED) {
				reports.add(BatchReport.skipped(batch));
				continue;
			}
			double costBefore = pricingCalculator.totalCost();
			String target = ruleset != null ? ruleset : content;

			List<String> annotations = new ArrayList<>(request.annotations());
			boolean affordable = true;
			if (!annotators.isEmpty()) {
				// annotations only make the meta-prompt longer
				affordable = !wouldExceedBudget(metaPrompt.render(content, batch, templateVariables, feedbackColumns,
						request.outputColumn(), annotations, ruleset), target);
				if (affordable) {
					Annotations generated = annotate(annotators, content, templateVariables, batch, feedbackColumns,
							request.outputColumn(), request.groundTruthColumn());
					annotations.addAll(generated.texts());
					affordable = !generated.budgetExceeded();
				}
			}

			String metaPromptText = metaPrompt.render(content, batch, templateVariables, feedbackColumns,
					request.outputColumn(), annotations, ruleset);

			if (!affordable || wouldExceedBudget(metaPromptText, target)) {
				optimizationLogger.logBudgetStop(mode, batch, batches.size(), pricingCalculator.totalCost(),
						settings.budgetLimit());
				stopReason = StopReason.BUDGET_EXCEEDED;
				reports.add(BatchReport.of(batch, BatchStatus.SKIPPED_BUDGET, 0,
						pricingCalculator.totalCost() - costBefore, null));
				continue;
			}

			RetryResult<LlmResponse> call = retryPolicy.execute("batch " + (batch.index() + 1),
					() -> llmClient.call(metaPromptText));
			if (!call.succeeded()) {
				Throwable error = call.error().orElseThrow();
				optimizationLogger.logBatchFailed(mode, batch, batches.size(), call.attemptCount(), error);
				reports.add(BatchReport.of(batch, BatchStatus.FAILED, call.attemptCount(),
						pricingCalculator.totalCost() - costBefore, describe(error)));
				continue;
			}

			LlmResponse response = call.getOrThrow();
			recordUsage(settings.model(), metaPromptText, response);
			double batchCost = pricingCalculator.totalCost() - costBefore;
			String revised = response.text();

			if (ruleset != null) {
				ruleset = revised;
			}
			else {
				List<String> missing = missingVariables(templateVariables, revised);
				if (!missing.isEmpty()) {
					optimizationLogger.logBatchRejected(mode, batch, batches.size(), missing);
					reports.add(BatchReport.of(batch, BatchStatus.REJECTED, call.attemptCount(), batchCost,
							"Rewrite dropped template variables " + missing));
					continue;
				}
				content = revised;
			}
			optimizationLogger.logBatchApplied(mode, batch, batches.size(), revised, batchCost);
			reports.add(BatchReport.of(batch, BatchStatus.SUCCEEDED, call.attemptCount(), batchCost, null));
		}

		PromptRepresentation optimized = ruleset != null ? prompt : prompt.withEditableContent(editableRole, content);
		OptimizationResult result = new OptimizationResult(mode, optimized, ruleset, reports,
				pricingCalculator.summary(), stopReason);
		optimizationLogger.logRunSummary(result);
		return result;
	}

	/**
	 * Run each evaluator and append the columns it produces to the dataset and to the
	 * feedback columns. A failing evaluator is logged and skipped.
	 *
	 * @throws DatasetException if neither feedback columns nor evaluators are given
	 */
	public EvaluatedDataset runEvaluators(Dataset dataset, List<Evaluator> evaluators, List<String> feedbackColumns) {
		validateInputs(dataset, feedbackColumns, evaluators, null, null);
		optimizationLogger.debug("Running {} evaluator(s)", evaluators.size());
		Dataset current = dataset;
		List<String> columns = new ArrayList<>(feedbackColumns);
		for (int i = 0; i < evaluators.size(); i++) {
			try {
				EvaluationResult result = evaluators.get(i).evaluate(current);
				if (result == null) {
					throw new DatasetException("Evaluator returned no result");
				}
				Dataset evaluated = current;
				for (Map.Entry<String, List<?>> column : result.columns().entrySet()) {
					evaluated = evaluated.withColumn(column.getKey(), column.getValue());
				}
				current = evaluated;
				for (String column : result.columns().keySet()) {
					if (!columns.contains(column)) {
						columns.add(column);
					}
				}
				optimizationLogger.debug("Evaluator {} produced columns {}", i + 1, result.columns().keySet());
			}
			catch (RuntimeException e) {
				optimizationLogger.logEvaluatorFailure(i + 1, e);
			}
		}
		return new EvaluatedDataset(current, columns);
	}

	/**
	 * Generate one annotation per template for the whole dataset. A failing annotator is
	 * logged and skipped; annotation stops at the first call that would exceed the
	 * spending limit.
	 *
	 * @throws org.javai.promptlearning.ConfigurationException if a template is malformed
	 */
	public List<String> createAnnotations(
			String promptContent,
			List<String> templateVariables,
			Dataset dataset,
			List<String> feedbackColumns,
			List<String> annotatorTemplates,
			String outputColumn,
			String groundTruthColumn
	) {
		validateInputs(dataset, feedbackColumns, List.of(), outputColumn, groundTruthColumn);
		return annotate(annotatorsFor(annotatorTemplates), promptContent, templateVariables,
				new Batch(0, 0, dataset, 0), feedbackColumns, outputColumn, groundTruthColumn).texts();
	}

	private Annotations annotate(
			List<Annotator> annotators,
			String promptContent,
			List<String> templateVariables,
			Batch batch,
			List<String> feedbackColumns,
			String outputColumn,
			String groundTruthColumn
	) {
		List<String> annotations = new ArrayList<>();
		for (int i = 0; i < annotators.size(); i++) {
			Annotator annotator = annotators.get(i);
			String rendered = annotator.constructContent(batch, promptContent, templateVariables, feedbackColumns,
					outputColumn, groundTruthColumn);
			if (settings.hasBudgetLimit() && pricingCalculator.wouldExceed(settings.annotationModel(),
					tokenCounter.count(rendered), tokenCounter.count(promptContent), settings.budgetLimit())) {
				optimizationLogger.logAnnotationBudgetStop(i + 1, pricingCalculator.totalCost(), settings.budgetLimit());
				return new Annotations(annotations, true);
			}
			RetryResult<LlmResponse> call = annotator.request(rendered);
			if (!call.succeeded()) {
				optimizationLogger.logAnnotatorFailure(i + 1, call.error().orElseThrow());
				continue;
			}
			LlmResponse response = call.getOrThrow();
			recordUsage(settings.annotationModel(), rendered, response);
			annotations.add(response.text());
		}
		return new Annotations(annotations, false);
	}

	private List<Annotator> annotatorsFor(List<String> templates) {
		List<Annotator> annotators = new ArrayList<>(templates.size());
		for (String template : templates) {
			annotators.add(new Annotator(annotationLlmClient, retryPolicy, template));
		}
		return annotators;
	}

	private Dataset resolveDataset(OptimizationRequest request) {
		if (request.dataset() != null) {
			return request.dataset();
		}
		return datasetLoader.load(request.datasetPath());
	}

	private void validateInputs(
			Dataset dataset,
			List<String> feedbackColumns,
			List<Evaluator> evaluators,
			String outputColumn,
			String groundTruthColumn
	) {
		if (feedbackColumns.isEmpty() && evaluators.isEmpty()) {
			throw new DatasetException("Either feedback columns or evaluators must be provided; "
					+ "optimization needs some feedback");
		}
		List<String> required = new ArrayList<>();
		if (outputColumn != null) {
			required.add(outputColumn);
		}
		required.addAll(feedbackColumns);
		if (groundTruthColumn != null) {
			required.add(groundTruthColumn);
		}
		List<String> missing = required.stream().filter(column -> !dataset.hasColumn(column)).toList();
		if (!missing.isEmpty()) {
			throw new DatasetException("Dataset missing required columns: " + missing);
		}
	}

	private boolean wouldExceedBudget(String metaPromptText, String currentTarget) {
		if (!settings.hasBudgetLimit()) {
			return false;
		}
		// the answer is expected to be about as long as what it replaces
		int inputTokens = tokenCounter.count(metaPromptText);
		int estimatedOutputTokens = tokenCounter.count(currentTarget);
		return pricingCalculator.wouldExceed(settings.model(), inputTokens, estimatedOutputTokens,
				settings.budgetLimit());
	}

	private void recordUsage(String model, String promptText, LlmResponse response) {
		long inputTokens = response.inputTokens() != null ? response.inputTokens() : tokenCounter.count(promptText);
		long outputTokens = response.outputTokens() != null ? response.outputTokens() : tokenCounter.count(response.text());
		pricingCalculator.record(model, inputTokens, outputTokens);
	}

	private List<String> missingVariables(List<String> templateVariables, String revised) {
		if (!settings.requireTemplateVariables()) {
			return List.of();
		}
		Set<String> present = PromptTemplate.detectVariables(revised);
		return templateVariables.stream().filter(name -> !present.contains(name)).toList();
	}

	private static String describe(Throwable error) {
		return error.getClass().getSimpleName() + ": " + error.getMessage();
	}

	private record Annotations(List<String> texts, boolean budgetExceeded) {}

	/**
	 * Builder for {@link PromptLearningOptimizer}.
	 */
	public static class Builder {
		private PromptRepresentation prompt;
		private LlmClient llmClient;
		private LlmClient annotationLlmClient;
		private TokenCounter tokenCounter;
		private PricingCalculator pricingCalculator;
		private OptimizerSettings settings;
		private MetaPrompt metaPrompt;
		private RetryPolicy retryPolicy;
		private DatasetLoader datasetLoader;

		private Builder() {}

		public Builder prompt(PromptRepresentation prompt) {
			this.prompt = prompt;
			return this;
		}

		public Builder prompt(String prompt) {
			this.prompt = PromptRepresentation.of(prompt);
			return this;
		}

		public Builder llmClient(LlmClient llmClient) {
			this.llmClient = llmClient;
			return this;
		}

		/**
		 * Client for annotation calls; defaults to the main client.
		 */
		public Builder annotationLlmClient(LlmClient annotationLlmClient) {
			this.annotationLlmClient = annotationLlmClient;
			return this;
		}

		/**
		 * Defaults to the tiktoken encoding of the configured model.
		 */
		public Builder tokenCounter(TokenCounter tokenCounter) {
			this.tokenCounter = tokenCounter;
			return this;
		}

		public Builder pricingCalculator(PricingCalculator pricingCalculator) {
			this.pricingCalculator = pricingCalculator;
			return this;
		}

		public Builder settings(OptimizerSettings settings) {
			this.settings = settings;
			return this;
		}

		public Builder metaPrompt(MetaPrompt metaPrompt) {
			this.metaPrompt = metaPrompt;
			return this;
		}

		/**
		 * Overrides the policy derived from the settings.
		 */
		public Builder retryPolicy(RetryPolicy retryPolicy) {
			this.retryPolicy = retryPolicy;
			return this;
		}

		public Builder datasetLoader(DatasetLoader datasetLoader) {
			this.datasetLoader = datasetLoader;
			return this;
		}

		public PromptLearningOptimizer build() {
			return new PromptLearningOptimizer(this);
		}
	}
}
