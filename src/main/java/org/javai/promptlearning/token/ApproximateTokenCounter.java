package org.javai.promptlearning.token;

import java.util.ArrayList;
import java.util.List;
import org.javai.promptlearning.dataset.Dataset;
import org.javai.promptlearning.dataset.DatasetRow;

/**
 * Character-based approximation: one token per four characters, rounded down.
 *
 * <p>Length is measured in Java {@code char}s; multi-byte text is not special-cased.</p>
 */
public class ApproximateTokenCounter implements TokenCounter {

	static final int CHARS_PER_TOKEN = 4;

	@Override
	public int count(String text) {
		if (text == null || text.isEmpty()) {
			return 0;
		}
		return text.length() / CHARS_PER_TOKEN;
	}

	@Override
	public int estimate(String text) {
		return count(text);
	}

	/**
	 * Sums characters across the columns of a row before dividing, so short
	 * values are not each rounded down to zero.
	 */
	@Override
	public List<Integer> countBatch(Dataset dataset, List<String> columns) {
		List<Integer> counts = new ArrayList<>(dataset.size());
		for (DatasetRow row : dataset.rows()) {
			int chars = 0;
			for (String column : columns) {
				String text = row.text(column);
				if (text != null) {
					chars += text.length();
				}
			}
			counts.add(chars / CHARS_PER_TOKEN);
		}
		return counts;
	}
}
