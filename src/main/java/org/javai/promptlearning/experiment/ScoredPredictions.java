package org.javai.promptlearning.experiment;

import java.util.List;
import java.util.Objects;

/**
 * Expected and predicted labels of an evaluation, aligned by position.
 *
 * @param expected the reference labels
 * @param predicted the labels produced with the candidate prompt
 */
public record ScoredPredictions(List<String> expected, List<String> predicted) {

	public ScoredPredictions {
		Objects.requireNonNull(expected, "expected must not be null");
		Objects.requireNonNull(predicted, "predicted must not be null");
		if (expected.size() != predicted.size()) {
			throw new IllegalArgumentException("expected has " + expected.size()
					+ " labels but predicted has " + predicted.size());
		}
		expected = List.copyOf(expected);
		predicted = List.copyOf(predicted);
	}

	/**
	 * Predictions judged by a binary evaluator: every expected label is {@code "1"} and
	 * each prediction is {@code "1"} when judged correct.
	 */
	public static ScoredPredictions ofJudgements(List<Boolean> correct) {
		List<String> expected = correct.stream().map(c -> "1").toList();
		List<String> predicted = correct.stream().map(c -> Boolean.TRUE.equals(c) ? "1" : "0").toList();
		return new ScoredPredictions(expected, predicted);
	}

	public int size() {
		return expected.size();
	}
}
