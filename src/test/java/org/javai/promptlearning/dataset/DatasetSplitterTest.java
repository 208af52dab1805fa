package org.javai.promptlearning.dataset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.promptlearning.testsupport.DatasetFixtures.textRows;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.promptlearning.TokenLimitException;
import org.javai.promptlearning.token.ApproximateTokenCounter;
import org.junit.jupiter.api.Test;

class DatasetSplitterTest {

	private static final List<String> TEXT = List.of("text");

	private final DatasetSplitter splitter = new DatasetSplitter(new ApproximateTokenCounter());

	@Test
	void greedySplitClosesBatchBeforeItExceedsBudget() {
		// 10 rows of 1000 tokens each
		Dataset dataset = textRows(10, 4000);

		List<Batch> batches = splitter.split(dataset, TEXT, 3500);

		assertThat(batches).extracting(Batch::size).containsExactly(3, 3, 3, 1);
		assertThat(batches).extracting(Batch::tokenCount).containsExactly(3000, 3000, 3000, 1000);
		assertThat(batches).extracting(Batch::startRow).containsExactly(0, 3, 6, 9);
		assertThat(batches).extracting(Batch::index).containsExactly(0, 1, 2, 3);
	}

	@Test
	void batchesCoverEveryRowOnceInOrder() {
		List<Map<String, Object>> records = new ArrayList<>();
		int[] lengths = {40, 400, 12, 800, 4, 360, 1200, 80, 16, 44, 900};
		for (int i = 0; i < lengths.length; i++) {
			Map<String, Object> row = new LinkedHashMap<>();
			row.put("id", i);
			row.put("text", "y".repeat(lengths[i]));
			records.add(row);
		}
		Dataset dataset = Dataset.of(records);

		List<Batch> batches = splitter.split(dataset, TEXT, 250);

		List<DatasetRow> concatenated = new ArrayList<>();
		batches.forEach(batch -> concatenated.addAll(batch.rows().rows()));
		assertThat(concatenated).isEqualTo(dataset.rows());
		assertThat(batches.stream().mapToInt(Batch::size).sum()).isEqualTo(dataset.size());
		for (int i = 1; i < batches.size(); i++) {
			assertThat(batches.get(i).startRow()).isEqualTo(batches.get(i - 1).endRow());
		}
		assertThat(batches)
				.filteredOn(batch -> batch.size() > 1)
				.allSatisfy(batch -> assertThat(batch.tokenCount()).isLessThanOrEqualTo(250));
	}

	@Test
	void oversizedRowBecomesSingletonBatch() {
		Dataset dataset = Dataset.of(List.of(
				Map.of("text", "a".repeat(400)),
				Map.of("text", "b".repeat(20_000)),
				Map.of("text", "c".repeat(400))
		));

		List<Batch> batches = splitter.split(dataset, TEXT, 1000);

		assertThat(batches).extracting(Batch::size).containsExactly(1, 1, 1);
		assertThat(batches.get(1).tokenCount()).isEqualTo(5000);
		assertThat(batches.get(1).rows().row(0).text("text")).startsWith("b");
	}

	@Test
	void oversizedFirstRowDoesNotSwallowFollowingRows() {
		Dataset dataset = Dataset.of(List.of(
				Map.of("text", "a".repeat(8000)),
				Map.of("text", "b".repeat(40)),
				Map.of("text", "c".repeat(40))
		));

		List<Batch> batches = splitter.split(dataset, TEXT, 100);

		assertThat(batches).extracting(Batch::size).containsExactly(1, 2);
	}

	@Test
	void emptyDatasetYieldsNoBatches() {
		assertThat(splitter.split(Dataset.empty(), TEXT, 100)).isEmpty();
	}

	@Test
	void nullAndMissingValuesCountAsZeroTokens() {
		Map<String, Object> withNull = new LinkedHashMap<>();
		withNull.put("text", null);
		Dataset dataset = Dataset.of(List.of(withNull, Map.of("other", "zzzz"), Map.of("text", "x".repeat(40))));

		List<Batch> batches = splitter.split(dataset, TEXT, 10);

		assertThat(batches).hasSize(1);
		assertThat(batches.get(0).tokenCount()).isEqualTo(10);
	}

	@Test
	void nonPositiveBudgetIsRejected() {
		assertThatThrownBy(() -> splitter.split(textRows(2, 4), TEXT, 0))
				.isInstanceOf(TokenLimitException.class);
		assertThatThrownBy(() -> splitter.estimateBatchCount(textRows(2, 4), TEXT, -1))
				.isInstanceOf(TokenLimitException.class);
	}

	@Test
	void estimateBatchCountIsCeilingOfTotalOverBudget() {
		Dataset dataset = textRows(10, 4000);

		assertThat(splitter.estimateBatchCount(dataset, TEXT, 3500)).isEqualTo(3);
		assertThat(splitter.estimateBatchCount(dataset, TEXT, 100_000)).isEqualTo(1);
		assertThat(splitter.estimateBatchCount(Dataset.empty(), TEXT, 3500)).isZero();
	}

	@Test
	void maxRowsForContextIsLongestFittingPrefix() {
		Dataset dataset = textRows(10, 4000);

		assertThat(splitter.maxRowsForContext(dataset, TEXT, 3500)).isEqualTo(3);
		assertThat(splitter.maxRowsForContext(dataset, TEXT, 50_000)).isEqualTo(10);
		assertThat(splitter.maxRowsForContext(dataset, TEXT, 500)).isEqualTo(1);
		assertThat(splitter.maxRowsForContext(Dataset.empty(), TEXT, 500)).isZero();
	}
}
