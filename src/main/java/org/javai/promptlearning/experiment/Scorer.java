package org.javai.promptlearning.experiment;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Classification metrics over {@link ScoredPredictions}. Precision, recall and F1 are
 * macro-averaged over every label that occurs in either list; a ratio with a zero
 * denominator counts as 0.
 */
public enum Scorer {

	ACCURACY {
		@Override
		public double score(ScoredPredictions predictions) {
			if (predictions.size() == 0) {
				return 0.0;
			}
			int correct = 0;
			for (int i = 0; i < predictions.size(); i++) {
				if (Objects.equals(predictions.expected().get(i), predictions.predicted().get(i))) {
					correct++;
				}
			}
			return (double) correct / predictions.size();
		}
	},
	PRECISION {
		@Override
		public double score(ScoredPredictions predictions) {
			return macroAverage(predictions, Counts::precision);
		}
	},
	RECALL {
		@Override
		public double score(ScoredPredictions predictions) {
			return macroAverage(predictions, Counts::recall);
		}
	},
	F1 {
		@Override
		public double score(ScoredPredictions predictions) {
			return macroAverage(predictions, Counts::f1);
		}
	};

	public abstract double score(ScoredPredictions predictions);

	/**
	 * Case-insensitive lookup, e.g. {@code "f1"}.
	 */
	public static Scorer named(String name) {
		for (Scorer scorer : values()) {
			if (scorer.name().equalsIgnoreCase(name)) {
				return scorer;
			}
		}
		throw new IllegalArgumentException("Unknown scorer: " + name);
	}

	private static double macroAverage(ScoredPredictions predictions, ToDoubleFunction<Counts> metric) {
		Set<String> labels = new LinkedHashSet<>(predictions.expected());
		labels.addAll(predictions.predicted());
		if (labels.isEmpty()) {
			return 0.0;
		}
		double sum = 0.0;
		for (String label : labels) {
			sum += metric.applyAsDouble(Counts.of(label, predictions.expected(), predictions.predicted()));
		}
		return sum / labels.size();
	}

	private record Counts(int truePositives, int falsePositives, int falseNegatives) {

		static Counts of(String label, List<String> expected, List<String> predicted) {
			int tp = 0;
			int fp = 0;
			int fn = 0;
			for (int i = 0; i < expected.size(); i++) {
				boolean isExpected = Objects.equals(label, expected.get(i));
				boolean isPredicted = Objects.equals(label, predicted.get(i));
				if (isExpected && isPredicted) {
					tp++;
				}
				else if (isPredicted) {
					fp++;
				}
				else if (isExpected) {
					fn++;
				}
			}
			return new Counts(tp, fp, fn);
		}

		double precision() {
			return ratio(truePositives, truePositives + falsePositives);
		}

		double recall() {
			return ratio(truePositives, truePositives + falseNegatives);
		}

		double f1() {
			return ratio(2 * truePositives, 2 * truePositives + falsePositives + falseNegatives);
		}

		private static double ratio(int numerator, int denominator) {
			return denominator == 0 ? 0.0 : (double) numerator / denominator;
		}
	}
}
