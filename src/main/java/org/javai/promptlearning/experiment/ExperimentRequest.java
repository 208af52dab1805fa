package org.javai.promptlearning.experiment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.javai.promptlearning.dataset.Dataset;

/**
 * Input of an {@link ExperimentLoop} run.
 *
 * @param trainDataset rows the candidate is trained on each iteration
 * @param outputColumn column the runner fills with the candidate's output
 * @param feedbackColumns columns the runner fills with feedback
 * @param annotatorTemplate annotation template, or {@code null} for no annotation
 * @param groundTruthColumn column with the expected answer, shown to the annotator
 * @param threshold score at which the run stops
 * @param loops maximum number of iterations
 * @param scorer metric compared against the threshold
 * @param contextSizeTokens token budget the training sample must fit
 * @param random source of training samples
 */
public record ExperimentRequest(
		Dataset trainDataset,
		String outputColumn,
		List<String> feedbackColumns,
		String annotatorTemplate,
		String groundTruthColumn,
		double threshold,
		int loops,
		Scorer scorer,
		int contextSizeTokens,
		Random random
) {

	public static final double DEFAULT_THRESHOLD = 1.0;
	public static final int DEFAULT_LOOPS = 5;
	public static final int DEFAULT_CONTEXT_SIZE_TOKENS = 90_000;

	public ExperimentRequest {
		Objects.requireNonNull(trainDataset, "trainDataset must not be null");
		if (outputColumn == null || outputColumn.isBlank()) {
			throw new IllegalArgumentException("outputColumn must not be blank");
		}
		feedbackColumns = List.copyOf(feedbackColumns);
		if (feedbackColumns.isEmpty()) {
			throw new IllegalArgumentException("at least one feedback column is required");
		}
		if (loops < 0) {
			throw new IllegalArgumentException("loops must be non-negative");
		}
		Objects.requireNonNull(scorer, "scorer must not be null");
		if (contextSizeTokens <= 0) {
			throw new IllegalArgumentException("contextSizeTokens must be positive");
		}
		Objects.requireNonNull(random, "random must not be null");
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link ExperimentRequest}.
	 */
	public static class Builder {
		private Dataset trainDataset;
		private String outputColumn;
		private final List<String> feedbackColumns = new ArrayList<>();
		private String annotatorTemplate;
		private String groundTruthColumn;
		private double threshold = DEFAULT_THRESHOLD;
		private int loops = DEFAULT_LOOPS;
		private Scorer scorer = Scorer.ACCURACY;
		private int contextSizeTokens = DEFAULT_CONTEXT_SIZE_TOKENS;
		private Random random = new Random();

		private Builder() {}

		public Builder trainDataset(Dataset trainDataset) {
			this.trainDataset = trainDataset;
			return this;
		}

		public Builder outputColumn(String outputColumn) {
			this.outputColumn = outputColumn;
			return this;
		}

		public Builder feedbackColumns(String... columns) {
			this.feedbackColumns.addAll(List.of(columns));
			return this;
		}

		public Builder annotatorTemplate(String annotatorTemplate) {
			this.annotatorTemplate = annotatorTemplate;
			return this;
		}

		public Builder groundTruthColumn(String groundTruthColumn) {
			this.groundTruthColumn = groundTruthColumn;
			return this;
		}

		public Builder threshold(double threshold) {
			this.threshold = threshold;
			return this;
		}

		public Builder loops(int loops) {
			this.loops = loops;
			return this;
		}

		public Builder scorer(Scorer scorer) {
			this.scorer = scorer;
			return this;
		}

		public Builder contextSizeTokens(int contextSizeTokens) {
			this.contextSizeTokens = contextSizeTokens;
			return this;
		}

		/**
		 * Seeded sampling, for reproducible runs.
		 */
		public Builder seed(long seed) {
			this.random = new Random(seed);
			return this;
		}

		public ExperimentRequest build() {
			return new ExperimentRequest(trainDataset, outputColumn, feedbackColumns, annotatorTemplate,
					groundTruthColumn, threshold, loops, scorer, contextSizeTokens, random);
		}
	}
}
