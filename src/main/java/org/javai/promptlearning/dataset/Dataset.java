package org.javai.promptlearning.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import org.javai.promptlearning.DatasetException;

/**
 * An ordered, immutable table of examples.
 *
 * <p>Row order is significant and preserved by every operation except
 * {@link #sample(int, Random)}, which callers use to pre-shuffle data before an
 * optimization run. Columns are the union of the rows' keys in order of first
 * appearance.</p>
 */
public final class Dataset {

	private static final Dataset EMPTY = new Dataset(List.of());

	private final List<DatasetRow> rows;
	private final Set<String> columns;

	private Dataset(List<DatasetRow> rows) {
		this.rows = List.copyOf(rows);
		Set<String> names = new LinkedHashSet<>();
		for (DatasetRow row : this.rows) {
			names.addAll(row.values().keySet());
		}
		this.columns = Collections.unmodifiableSet(names);
	}

	public static Dataset empty() {
		return EMPTY;
	}

	public static Dataset of(List<? extends Map<String, ?>> records) {
		Objects.requireNonNull(records, "records must not be null");
		List<DatasetRow> rows = new ArrayList<>(records.size());
		for (Map<String, ?> record : records) {
			rows.add(DatasetRow.of(Objects.requireNonNull(record, "records must not contain null")));
		}
		return new Dataset(rows);
	}

	public static Dataset ofRows(List<DatasetRow> rows) {
		Objects.requireNonNull(rows, "rows must not be null");
		return new Dataset(rows);
	}

	public int size() {
		return rows.size();
	}

	public boolean isEmpty() {
		return rows.isEmpty();
	}

	public List<DatasetRow> rows() {
		return rows;
	}

	public DatasetRow row(int index) {
		return rows.get(index);
	}

	public Set<String> columns() {
		return columns;
	}

	public boolean hasColumn(String column) {
		return columns.contains(column);
	}

	/**
	 * Contiguous view of rows {@code [from, to)}.
	 */
	public Dataset slice(int from, int to) {
		if (from < 0 || to > rows.size() || from > to) {
			throw new IndexOutOfBoundsException(
					"slice [" + from + ", " + to + ") out of range for " + rows.size() + " rows");
		}
		return new Dataset(rows.subList(from, to));
	}

	/**
	 * Returns a copy of this dataset with {@code column} set to the given values, one per row.
	 */
	public Dataset withColumn(String column, List<?> values) {
		Objects.requireNonNull(column, "column must not be null");
		Objects.requireNonNull(values, "values must not be null");
		if (values.size() != rows.size()) {
			throw new DatasetException("Column '" + column + "' has " + values.size()
					+ " values but the dataset has " + rows.size() + " rows");
		}
		List<DatasetRow> updated = new ArrayList<>(rows.size());
		for (int i = 0; i < rows.size(); i++) {
			updated.add(rows.get(i).with(column, values.get(i)));
		}
		return new Dataset(updated);
	}

	/**
	 * Draws {@code count} distinct rows at random. Returns this dataset when it is no larger than {@code count}.
	 */
	public Dataset sample(int count, Random random) {
		Objects.requireNonNull(random, "random must not be null");
		if (count < 0) {
			throw new IllegalArgumentException("count must be >= 0");
		}
		if (count >= rows.size()) {
			return this;
		}
		List<DatasetRow> shuffled = new ArrayList<>(rows);
		Collections.shuffle(shuffled, random);
		return new Dataset(shuffled.subList(0, count));
	}

	/**
	 * All rows in a random order.
	 */
	public Dataset shuffled(Random random) {
		Objects.requireNonNull(random, "random must not be null");
		List<DatasetRow> shuffled = new ArrayList<>(rows);
		Collections.shuffle(shuffled, random);
		return new Dataset(shuffled);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Dataset other && rows.equals(other.rows);
	}

	@Override
	public int hashCode() {
		return rows.hashCode();
	}

	@Override
	public String toString() {
		return "Dataset[rows=" + rows.size() + ", columns=" + columns + "]";
	}
}
