package org.javai.promptlearning.dataset;

import java.util.Objects;

/**
 * A contiguous, order-preserving slice of a dataset processed in one meta-prompt call.
 *
 * @param index 0-based position of the batch in the split
 * @param startRow offset of the batch's first row in the source dataset
 * @param rows the rows of the batch
 * @param tokenCount aggregate token count of the rows over the counted columns
 */
public record Batch(int index, int startRow, Dataset rows, int tokenCount) {

	public Batch {
		if (index < 0) {
			throw new IllegalArgumentException("index must be >= 0");
		}
		if (startRow < 0) {
			throw new IllegalArgumentException("startRow must be >= 0");
		}
		Objects.requireNonNull(rows, "rows must not be null");
		if (tokenCount < 0) {
			throw new IllegalArgumentException("tokenCount must be >= 0");
		}
	}

	public int size() {
		return rows.size();
	}

	/**
	 * Exclusive end offset of the batch in the source dataset.
	 */
	public int endRow() {
		return startRow + rows.size();
	}
}
