package org.javai.promptlearning.token;

import java.util.ArrayList;
import java.util.List;
import org.javai.promptlearning.dataset.Dataset;
import org.javai.promptlearning.dataset.DatasetRow;

/**
 * Measures the token cost of text.
 *
 * <p>Two strategies ship with the library: {@link TiktokenCounter} for exact
 * sub-word counts and {@link ApproximateTokenCounter} for the fast
 * characters-divided-by-four rule.</p>
 */
public interface TokenCounter {

	/**
	 * Count tokens in a single text. {@code null} and empty text count as zero.
	 */
	int count(String text);

	/**
	 * Cheaper approximation of {@link #count(String)}, for progress estimates.
	 */
	int estimate(String text);

	/**
	 * Token count of each row, summed over the named columns. Absent columns and
	 * null values contribute nothing.
	 *
	 * @return one entry per row, in row order
	 */
	default List<Integer> countBatch(Dataset dataset, List<String> columns) {
		List<Integer> counts = new ArrayList<>(dataset.size());
		for (DatasetRow row : dataset.rows()) {
			int total = 0;
			for (String column : columns) {
				total += count(row.text(column));
			}
			counts.add(total);
		}
		return counts;
	}
}
