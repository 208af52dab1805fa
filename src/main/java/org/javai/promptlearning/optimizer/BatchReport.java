package org.javai.promptlearning.optimizer;

import java.util.Objects;
import org.javai.promptlearning.dataset.Batch;

/**
 * What happened to one batch of an optimization run.
 *
 * @param index 0-based batch index
 * @param startRow offset of the batch's first row in the dataset
 * @param rowCount number of rows in the batch
 * @param tokenCount token count of the batch's rows
 * @param status how the batch ended
 * @param attempts model call attempts made (0 when the call was never made)
 * @param cost spend attributed to the batch, annotations included
 * @param error failure description, or {@code null}
 */
public record BatchReport(
		int index,
		int startRow,
		int rowCount,
		int tokenCount,
		BatchStatus status,
		int attempts,
		double cost,
		String error
) {

	public BatchReport {
		Objects.requireNonNull(status, "status must not be null");
		if (attempts < 0) {
			throw new IllegalArgumentException("attempts must be non-negative");
		}
		if (cost < 0) {
			throw new IllegalArgumentException("cost must be non-negative");
		}
	}

	static BatchReport of(Batch batch, BatchStatus status, int attempts, double cost, String error) {
		return new BatchReport(batch.index(), batch.startRow(), batch.size(), batch.tokenCount(),
				status, attempts, cost, error);
	}

	static BatchReport skipped(Batch batch) {
		return of(batch, BatchStatus.SKIPPED_BUDGET, 0, 0.0, null);
	}

	public boolean succeeded() {
		return status == BatchStatus.SUCCEEDED;
	}
}
