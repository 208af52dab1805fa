package org.javai.promptlearning.experiment;

import java.util.List;
import java.util.Objects;
import org.javai.promptlearning.optimizer.StopReason;
import org.javai.promptlearning.pricing.UsageSummary;
import org.javai.promptlearning.prompt.PromptRepresentation;

/**
 * Outcome of an {@link ExperimentLoop} run, either schedule.
 *
 * @param prompt the final candidate, same shape as the input prompt
 * @param initialMetric score of the input prompt
 * @param loops the steps that ran, in order
 * @param thresholdMet whether a score reached the threshold
 * @param stopReason {@link StopReason#BUDGET_EXCEEDED} when the spending limit ended the run
 * @param usage the pricing ledger at the end of the run
 */
public record ExperimentResult(
		PromptRepresentation prompt,
		double initialMetric,
		List<LoopResult> loops,
		boolean thresholdMet,
		StopReason stopReason,
		UsageSummary usage
) {

	public ExperimentResult {
		Objects.requireNonNull(prompt, "prompt must not be null");
		loops = List.copyOf(loops);
		Objects.requireNonNull(stopReason, "stopReason must not be null");
		Objects.requireNonNull(usage, "usage must not be null");
	}

	/**
	 * Score of the last iteration, or the initial score when none ran.
	 */
	public double finalMetric() {
		return loops.isEmpty() ? initialMetric : loops.get(loops.size() - 1).testMetric();
	}
}
