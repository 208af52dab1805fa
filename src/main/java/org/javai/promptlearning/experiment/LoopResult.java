package org.javai.promptlearning.experiment;

/**
 * One train-rewrite-test step of an {@link ExperimentLoop}.
 *
 * @param loop 1-based loop number
 * @param batch 1-based batch number within the loop; always 1 for the sampled schedule
 * @param totalBatches batches per loop
 * @param trainingRows rows the candidate was trained on
 * @param rewritten whether the model's rewrite was applied
 * @param testMetric score of the resulting candidate on held-out data
 * @param promptContent the candidate after this step
 */
public record LoopResult(
		int loop,
		int batch,
		int totalBatches,
		int trainingRows,
		boolean rewritten,
		double testMetric,
		String promptContent
) {

	public LoopResult {
		if (loop < 1) {
			throw new IllegalArgumentException("loop must be >= 1");
		}
		if (batch < 1 || batch > totalBatches) {
			throw new IllegalArgumentException("batch must be between 1 and totalBatches");
		}
	}
}
