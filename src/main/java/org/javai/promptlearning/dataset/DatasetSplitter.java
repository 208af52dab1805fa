package org.javai.promptlearning.dataset;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.promptlearning.TokenLimitException;
import org.javai.promptlearning.token.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a dataset into contiguous batches that fit a token budget.
 *
 * <p>Greedy single pass: rows accumulate into the current batch until the next row
 * would push the running total past the budget, at which point the batch is closed
 * and the row starts a new one. A row that alone exceeds the budget still starts a
 * batch and therefore ends up alone in it; no row is ever dropped or reordered.</p>
 *
 * <pre>{@code
 * DatasetSplitter splitter = new DatasetSplitter(new TiktokenCounter());
 * List<Batch> batches = splitter.split(dataset, List.of("input", "output", "feedback"), 32_000);
 * }</pre>
 */
public class DatasetSplitter {

	private static final Logger logger = LoggerFactory.getLogger(DatasetSplitter.class);

	private final TokenCounter tokenCounter;

	public DatasetSplitter(TokenCounter tokenCounter) {
		this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter must not be null");
	}

	/**
	 * Partition {@code dataset} into the batches described above.
	 *
	 * @param dataset rows to split, in order
	 * @param columns columns whose text is counted
	 * @param maxTokens token budget per batch (must be positive)
	 * @return batches in row order; empty for an empty dataset
	 */
	public List<Batch> split(Dataset dataset, List<String> columns, int maxTokens) {
		Objects.requireNonNull(dataset, "dataset must not be null");
		Objects.requireNonNull(columns, "columns must not be null");
		requirePositiveBudget(maxTokens);
		if (dataset.isEmpty()) {
			return List.of();
		}

		List<Integer> rowTokens = tokenCounter.countBatch(dataset, columns);
		List<Batch> batches = new ArrayList<>();
		int batchStart = 0;
		int batchTokens = 0;

		for (int idx = 0; idx < rowTokens.size(); idx++) {
			int tokens = rowTokens.get(idx);
			if (batchTokens + tokens > maxTokens && idx > batchStart) {
				batches.add(new Batch(batches.size(), batchStart, dataset.slice(batchStart, idx), batchTokens));
				batchStart = idx;
				batchTokens = tokens;
			}
			else {
				batchTokens += tokens;
			}
		}
		batches.add(new Batch(batches.size(), batchStart, dataset.slice(batchStart, dataset.size()), batchTokens));

		if (logger.isDebugEnabled()) {
			logger.debug("Split {} rows into {} batches (budget {} tokens, columns {})",
					dataset.size(), batches.size(), maxTokens, columns);
		}
		return List.copyOf(batches);
	}

	/**
	 * Fast upper-bound estimate of the number of batches, without materializing them.
	 *
	 * @return 0 for an empty dataset, otherwise at least 1
	 */
	public int estimateBatchCount(Dataset dataset, List<String> columns, int maxTokens) {
		requirePositiveBudget(maxTokens);
		if (dataset.isEmpty()) {
			return 0;
		}
		long totalTokens = 0;
		for (String column : columns) {
			if (!dataset.hasColumn(column)) {
				continue;
			}
			StringBuilder text = new StringBuilder();
			for (DatasetRow row : dataset.rows()) {
				String value = row.text(column);
				if (value != null) {
					text.append(value);
				}
			}
			totalTokens += tokenCounter.estimate(text.toString());
		}
		long batches = (totalTokens + maxTokens - 1) / maxTokens;
		return (int) Math.max(1, batches);
	}

	/**
	 * Length of the longest row prefix whose token total fits the budget; at least one
	 * row for a non-empty dataset so callers always make progress.
	 */
	public int maxRowsForContext(Dataset dataset, List<String> columns, int maxTokens) {
		requirePositiveBudget(maxTokens);
		if (dataset.isEmpty()) {
			return 0;
		}
		List<Integer> rowTokens = tokenCounter.countBatch(dataset, columns);
		long total = 0;
		int rows = 0;
		for (int tokens : rowTokens) {
			if (total + tokens > maxTokens) {
				break;
			}
			total += tokens;
			rows++;
		}
		return Math.max(1, rows);
	}

	private static void requirePositiveBudget(int maxTokens) {
		if (maxTokens <= 0) {
			throw new TokenLimitException("Token budget must be positive but was " + maxTokens);
		}
	}
}
