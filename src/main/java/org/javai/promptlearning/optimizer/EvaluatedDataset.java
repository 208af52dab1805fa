package org.javai.promptlearning.optimizer;

import java.util.List;
import java.util.Objects;
import org.javai.promptlearning.dataset.Dataset;

/**
 * A dataset after evaluators have run, with the feedback columns now available.
 *
 * @param dataset the dataset including evaluator columns
 * @param feedbackColumns the caller's feedback columns followed by the evaluator columns
 */
public record EvaluatedDataset(Dataset dataset, List<String> feedbackColumns) {

	public EvaluatedDataset {
		Objects.requireNonNull(dataset, "dataset must not be null");
		feedbackColumns = List.copyOf(feedbackColumns);
	}
}
