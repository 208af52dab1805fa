package org.javai.promptlearning.experiment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.promptlearning.DatasetException;
import org.javai.promptlearning.dataset.Batch;
import org.javai.promptlearning.dataset.Dataset;
import org.javai.promptlearning.dataset.DatasetSplitter;
import org.javai.promptlearning.llm.LlmClient;
import org.javai.promptlearning.llm.LlmResponse;
import org.javai.promptlearning.llm.RetryPolicy;
import org.javai.promptlearning.llm.RetryResult;
import org.javai.promptlearning.meta.Annotator;
import org.javai.promptlearning.meta.MetaPrompt;
import org.javai.promptlearning.optimizer.OptimizerSettings;
import org.javai.promptlearning.optimizer.StopReason;
import org.javai.promptlearning.pricing.PricingCalculator;
import org.javai.promptlearning.prompt.PromptRepresentation;
import org.javai.promptlearning.prompt.PromptTemplate;
import org.javai.promptlearning.token.TiktokenCounter;
import org.javai.promptlearning.token.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Experiment-driven optimization: train, rewrite, test, repeat.
 *
 * <p>Each step runs the candidate on training rows, rewrites the candidate from the
 * resulting feedback in a single meta-prompt call, then scores it on held-out data. A
 * failed or rejected rewrite keeps the previous candidate. Two schedules are offered:</p>
 * <ul>
 *   <li>{@link #run(ExperimentRequest)} - one step per loop, on a sample of the training
 *   data that fits the context budget</li>
 *   <li>{@link #runBatched(ExperimentRequest)} - every loop reshuffles the training data
 *   and takes one step per context-sized batch, so each loop sees every row</li>
 * </ul>
 * <p>Both stop when the score reaches the threshold, the loops are used up, or the next
 * model call would exceed the spending limit.</p>
 */
public class ExperimentLoop {

	private static final Logger logger = LoggerFactory.getLogger(ExperimentLoop.class);

	private final PromptRepresentation prompt;
	private final ExperimentRunner runner;
	private final LlmClient llmClient;
	private final LlmClient annotationLlmClient;
	private final OptimizerSettings settings;
	private final TokenCounter tokenCounter;
	private final PricingCalculator pricingCalculator;
	private final MetaPrompt metaPrompt;
	private final RetryPolicy retryPolicy;

	private ExperimentLoop(Builder builder) {
		this.prompt = Objects.requireNonNull(builder.prompt, "prompt must not be null");
		this.runner = Objects.requireNonNull(builder.runner, "runner must not be null");
		this.llmClient = Objects.requireNonNull(builder.llmClient, "llmClient must not be null");
		this.annotationLlmClient = builder.annotationLlmClient != null ? builder.annotationLlmClient : llmClient;
		this.settings = builder.settings != null ? builder.settings : OptimizerSettings.defaults();
		this.tokenCounter = builder.tokenCounter != null ? builder.tokenCounter : TiktokenCounter.forModel(settings.model());
		this.pricingCalculator = builder.pricingCalculator != null ? builder.pricingCalculator : new PricingCalculator();
		this.metaPrompt = builder.metaPrompt != null ? builder.metaPrompt : new MetaPrompt();
		this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : settings.retryPolicy();
	}

	public static Builder builder() {
		return new Builder();
	}

	public ExperimentResult run(ExperimentRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		Scorer scorer = request.scorer();
		double initialMetric = scorer.score(runner.evaluate(prompt.editableContent(settings.editableRole())));
		logger.info("Initial {}: {}", scorer, format(initialMetric));
		if (initialMetric >= request.threshold()) {
			return alreadyMet(initialMetric, request);
		}

		Dataset train = request.trainDataset();
		int maxRows = maxRowsForContext(request);
		boolean sample = train.size() > maxRows;
		if (sample) {
			logger.info("Sampling {} of {} training examples each loop", maxRows, train.size());
		}

		Run state = new Run(request);
		for (int loop = 1; loop <= request.loops(); loop++) {
			Dataset rows = sample ? train.sample(maxRows, request.random()) : train;
			if (!state.step("Loop " + loop, rows, loop, 1, 1)) {
				break;
			}
		}
		return state.finish(initialMetric);
	}

	/**
	 * Batched schedule: every loop shuffles the training data with the request's random
	 * source, splits it into consecutive batches of the largest row count that fits the
	 * context budget, and runs one train-rewrite-test step per batch.
	 */
	public ExperimentResult runBatched(ExperimentRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		Scorer scorer = request.scorer();
		double initialMetric = scorer.score(runner.evaluate(prompt.editableContent(settings.editableRole())));
		logger.info("Initial {}: {}", scorer, format(initialMetric));
		if (initialMetric >= request.threshold()) {
			return alreadyMet(initialMetric, request);
		}

		Dataset train = request.trainDataset();
		int maxRows = maxRowsForContext(request);
		Run state = new Run(request);
		if (maxRows == 0) {
			logger.warn("No training examples, nothing to optimize");
			return state.finish(initialMetric);
		}
		int totalBatches = (train.size() + maxRows - 1) / maxRows;
		logger.info("Processing {} training examples in {} batch(es) of up to {} rows each loop",
				train.size(), totalBatches, maxRows);

		loops:
		for (int loop = 1; loop <= request.loops(); loop++) {
			Dataset shuffled = train.shuffled(request.random());
			for (int batch = 0; batch < totalBatches; batch++) {
				int from = batch * maxRows;
				Dataset rows = shuffled.slice(from, Math.min(from + maxRows, shuffled.size()));
				String label = "Loop " + loop + " batch " + (batch + 1) + "/" + totalBatches;
				if (!state.step(label, rows, loop, batch + 1, totalBatches)) {
					break loops;
				}
			}
		}
		return state.finish(initialMetric);
	}

	private ExperimentResult alreadyMet(double initialMetric, ExperimentRequest request) {
		logger.info("Initial prompt already meets threshold {}", format(request.threshold()));
		return new ExperimentResult(prompt, initialMetric, List.of(), true, StopReason.COMPLETED,
				pricingCalculator.summary());
	}

	private int maxRowsForContext(ExperimentRequest request) {
		Dataset train = request.trainDataset();
		if (train.isEmpty()) {
			return 0;
		}
		return new DatasetSplitter(tokenCounter)
				.maxRowsForContext(train, List.copyOf(train.columns()), request.contextSizeTokens());
	}

	/**
	 * Mutable state of one experiment run.
	 */
	private final class Run {

		private final ExperimentRequest request;
		private final Annotator annotator;
		private final List<LoopResult> loops = new ArrayList<>();
		private String content;
		private boolean thresholdMet;
		private StopReason stopReason = StopReason.COMPLETED;

		private Run(ExperimentRequest request) {
			this.request = request;
			this.annotator = request.annotatorTemplate() == null ? null
					: new Annotator(annotationLlmClient, retryPolicy, request.annotatorTemplate());
			this.content = prompt.editableContent(settings.editableRole());
		}

		/**
		 * Train on {@code rows}, rewrite, test.
		 *
		 * @return whether the run should go on
		 */
		private boolean step(String label, Dataset rows, int loop, int batch, int totalBatches) {
			Dataset withFeedback = runner.runTraining(content, rows);
			requireColumns(withFeedback, request);

			List<String> variables = List.copyOf(PromptTemplate.detectVariables(content));
			Batch examples = new Batch(0, 0, withFeedback, 0);
			List<String> annotations = new ArrayList<>();
			if (annotator != null) {
				String withoutAnnotations = metaPrompt.render(content, examples, variables,
						request.feedbackColumns(), request.outputColumn(), annotations, null);
				String rendered = annotator.constructContent(withFeedback, content, variables,
						request.feedbackColumns(), request.outputColumn(), request.groundTruthColumn());
				if (wouldExceedBudget(settings.model(), withoutAnnotations, content)
						|| wouldExceedBudget(settings.annotationModel(), rendered, content)) {
					return stopForBudget(label);
				}
				annotate(rendered).ifPresent(annotations::add);
			}

			String metaPromptText = metaPrompt.render(content, examples, variables,
					request.feedbackColumns(), request.outputColumn(), annotations, null);
			if (wouldExceedBudget(settings.model(), metaPromptText, content)) {
				return stopForBudget(label);
			}

			boolean rewritten = false;
			RetryResult<LlmResponse> call = retryPolicy.execute(label, () -> llmClient.call(metaPromptText));
			if (call.succeeded()) {
				LlmResponse response = call.getOrThrow();
				recordUsage(settings.model(), metaPromptText, response);
				List<String> missing = missingVariables(variables, response.text());
				if (missing.isEmpty()) {
					content = response.text();
					rewritten = true;
				}
				else {
					logger.warn("{}: rewrite rejected, template variables {} missing", label, missing);
				}
			}
			else {
				Throwable error = call.error().orElseThrow();
				logger.warn("{}: rewrite failed after {} attempt(s), keeping prompt: {}",
						label, call.attemptCount(), error.toString(), error);
			}

			Scorer scorer = request.scorer();
			double testMetric = scorer.score(runner.evaluate(content));
			logger.info("{}: test {} = {}", label, scorer, format(testMetric));
			loops.add(new LoopResult(loop, batch, totalBatches, rows.size(), rewritten, testMetric, content));
			if (testMetric >= request.threshold()) {
				thresholdMet = true;
				return false;
			}
			return true;
		}

		private boolean stopForBudget(String label) {
			logger.warn("{}: stopping, spend {} and the next call would exceed budget {}",
					label, format(pricingCalculator.totalCost()), format(settings.budgetLimit()));
			stopReason = StopReason.BUDGET_EXCEEDED;
			return false;
		}

		private Optional<String> annotate(String rendered) {
			RetryResult<LlmResponse> call = annotator.request(rendered);
			if (!call.succeeded()) {
				Throwable error = call.error().orElseThrow();
				logger.warn("Annotation failed and is skipped: {}", error.toString(), error);
				return Optional.empty();
			}
			LlmResponse response = call.getOrThrow();
			recordUsage(settings.annotationModel(), rendered, response);
			return Optional.of(response.text());
		}

		private ExperimentResult finish(double initialMetric) {
			ExperimentResult result = new ExperimentResult(prompt.withEditableContent(settings.editableRole(), content),
					initialMetric, loops, thresholdMet, stopReason, pricingCalculator.summary());
			logger.info("Experiment finished after {} step(s): {} {} -> {}, threshold met={}",
					loops.size(), request.scorer(), format(initialMetric), format(result.finalMetric()), thresholdMet);
			return result;
		}
	}

	private static void requireColumns(Dataset rows, ExperimentRequest request) {
		List<String> required = new ArrayList<>();
		required.add(request.outputColumn());
		required.addAll(request.feedbackColumns());
		List<String> missing = required.stream().filter(column -> !rows.hasColumn(column)).toList();
		if (!missing.isEmpty() && !rows.isEmpty()) {
			throw new DatasetException("Training run did not produce columns: " + missing);
		}
	}

	// the answer is expected to be about as long as the current prompt
	private boolean wouldExceedBudget(String model, String promptText, String content) {
		if (!settings.hasBudgetLimit()) {
			return false;
		}
		return pricingCalculator.wouldExceed(model, tokenCounter.count(promptText),
				tokenCounter.count(content), settings.budgetLimit());
	}

	private void recordUsage(String model, String promptText, LlmResponse response) {
		long inputTokens = response.inputTokens() != null ? response.inputTokens() : tokenCounter.count(promptText);
		long outputTokens = response.outputTokens() != null ? response.outputTokens() : tokenCounter.count(response.text());
		pricingCalculator.record(model, inputTokens, outputTokens);
	}

	private List<String> missingVariables(List<String> variables, String revised) {
		if (!settings.requireTemplateVariables()) {
			return List.of();
		}
		Set<String> present = PromptTemplate.detectVariables(revised);
		return variables.stream().filter(name -> !present.contains(name)).toList();
	}

	private static String format(Double value) {
		return value == null ? "n/a" : String.format(Locale.ROOT, "%.3f", value);
	}

	/**
	 * Builder for {@link ExperimentLoop}.
	 */
	public static class Builder {
		private PromptRepresentation prompt;
		private ExperimentRunner runner;
		private LlmClient llmClient;
		private LlmClient annotationLlmClient;
		private OptimizerSettings settings;
		private TokenCounter tokenCounter;
		private PricingCalculator pricingCalculator;
		private MetaPrompt metaPrompt;
		private RetryPolicy retryPolicy;

		private Builder() {}

		public Builder prompt(PromptRepresentation prompt) {
			this.prompt = prompt;
			return this;
		}

		public Builder runner(ExperimentRunner runner) {
			this.runner = runner;
			return this;
		}

		public Builder llmClient(LlmClient llmClient) {
			this.llmClient = llmClient;
			return this;
		}

		public Builder annotationLlmClient(LlmClient annotationLlmClient) {
			this.annotationLlmClient = annotationLlmClient;
			return this;
		}

		public Builder settings(OptimizerSettings settings) {
			this.settings = settings;
			return this;
		}

		public Builder tokenCounter(TokenCounter tokenCounter) {
			this.tokenCounter = tokenCounter;
			return this;
		}

		public Builder pricingCalculator(PricingCalculator pricingCalculator) {
			this.pricingCalculator = pricingCalculator;
			return this;
		}

		public Builder metaPrompt(MetaPrompt metaPrompt) {
			this.metaPrompt = metaPrompt;
			return this;
		}

		public Builder retryPolicy(RetryPolicy retryPolicy) {
			this.retryPolicy = retryPolicy;
			return this;
		}

		public ExperimentLoop build() {
			return new ExperimentLoop(this);
		}
	}
}
