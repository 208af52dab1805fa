package org.javai.promptlearning.dataset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One example of a dataset: column name to value, in column order.
 *
 * <p>Values may be {@code null}. The row is immutable; columns are added by
 * building a new {@link Dataset} via {@link Dataset#withColumn(String, java.util.List)}.</p>
 *
 * @param values the column values, in column order
 */
public record DatasetRow(Map<String, Object> values) {

	public DatasetRow {
		Objects.requireNonNull(values, "values must not be null");
		// null values allowed, column order kept
		values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
	}

	public static DatasetRow of(Map<String, ?> values) {
		return new DatasetRow(new LinkedHashMap<>(values));
	}

	public boolean has(String column) {
		return values.containsKey(column);
	}

	public Object value(String column) {
		return values.get(column);
	}

	/**
	 * String form of a column value, or {@code null} when the column is absent or null.
	 */
	public String text(String column) {
		Object value = values.get(column);
		return value == null ? null : value.toString();
	}

	DatasetRow with(String column, Object value) {
		Map<String, Object> copy = new LinkedHashMap<>(values);
		copy.put(column, value);
		return new DatasetRow(copy);
	}
}
