package org.javai.promptlearning.optimizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Feedback columns produced by an {@link Evaluator}, one value per dataset row.
 *
 * @param columns column name to values, in column order
 */
public record EvaluationResult(Map<String, List<?>> columns) {

	public EvaluationResult {
		Objects.requireNonNull(columns, "columns must not be null");
		columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
	}

	public static EvaluationResult of(String column, List<?> values) {
		Map<String, List<?>> columns = new LinkedHashMap<>();
		columns.put(column, values);
		return new EvaluationResult(columns);
	}
}
