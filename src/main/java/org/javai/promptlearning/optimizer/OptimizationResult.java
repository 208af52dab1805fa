package org.javai.promptlearning.optimizer;

import java.util.List;
import java.util.Objects;
import org.javai.promptlearning.meta.OptimizationMode;
import org.javai.promptlearning.pricing.UsageSummary;
import org.javai.promptlearning.prompt.PromptRepresentation;

/**
 * Outcome of {@link PromptLearningOptimizer#optimize(OptimizationRequest)}.
 *
 * @param mode what the run rewrote
 * @param prompt the optimized prompt, same shape as the input; unchanged in ruleset mode
 * @param ruleset the revised ruleset in ruleset mode, otherwise {@code null}
 * @param batches one report per batch, in order
 * @param usage the pricing ledger at the end of the run
 * @param stopReason why the run stopped
 */
public record OptimizationResult(
		OptimizationMode mode,
		PromptRepresentation prompt,
		String ruleset,
		List<BatchReport> batches,
		UsageSummary usage,
		StopReason stopReason
) {

	public OptimizationResult {
		Objects.requireNonNull(mode, "mode must not be null");
		Objects.requireNonNull(prompt, "prompt must not be null");
		batches = List.copyOf(batches);
		Objects.requireNonNull(usage, "usage must not be null");
		Objects.requireNonNull(stopReason, "stopReason must not be null");
	}

	public List<BatchReport> succeededBatches() {
		return batchesWith(BatchStatus.SUCCEEDED);
	}

	public List<BatchReport> failedBatches() {
		return batchesWith(BatchStatus.FAILED);
	}

	public List<BatchReport> batchesWith(BatchStatus status) {
		return batches.stream().filter(b -> b.status() == status).toList();
	}

	public boolean budgetExceeded() {
		return stopReason == StopReason.BUDGET_EXCEEDED;
	}
}
