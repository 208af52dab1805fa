package org.javai.promptlearning.experiment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScorerTest {

	private final ScoredPredictions predictions = new ScoredPredictions(
			List.of("a", "a", "b", "c"),
			List.of("a", "b", "b", "a"));

	@Test
	void accuracyIsTheShareOfExactMatches() {
		assertThat(Scorer.ACCURACY.score(predictions)).isEqualTo(0.5);
	}

	@Test
	void precisionRecallAndF1AreMacroAveraged() {
		assertThat(Scorer.PRECISION.score(predictions)).isCloseTo(1.0 / 3, within(1e-9));
		assertThat(Scorer.RECALL.score(predictions)).isCloseTo(0.5, within(1e-9));
		assertThat(Scorer.F1.score(predictions)).isCloseTo(7.0 / 18, within(1e-9));
	}

	@Test
	void perfectPredictionsScoreOne() {
		ScoredPredictions perfect = new ScoredPredictions(List.of("x", "y"), List.of("x", "y"));

		for (Scorer scorer : Scorer.values()) {
			assertThat(scorer.score(perfect)).as(scorer.name()).isEqualTo(1.0);
		}
	}

	@Test
	void emptyPredictionsScoreZero() {
		ScoredPredictions empty = new ScoredPredictions(List.of(), List.of());

		for (Scorer scorer : Scorer.values()) {
			assertThat(scorer.score(empty)).isZero();
		}
	}

	@Test
	void judgementsBecomeBinaryLabels() {
		ScoredPredictions judged = ScoredPredictions.ofJudgements(Arrays.asList(true, false, true, null));

		assertThat(judged.predicted()).containsExactly("1", "0", "1", "0");
		assertThat(Scorer.ACCURACY.score(judged)).isEqualTo(0.5);
		assertThat(Scorer.RECALL.score(judged)).isCloseTo(0.25, within(1e-9));
	}

	@Test
	void scorerIsFoundByName() {
		assertThat(Scorer.named("f1")).isEqualTo(Scorer.F1);
		assertThatThrownBy(() -> Scorer.named("bleu")).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void misalignedListsAreRejected() {
		assertThatThrownBy(() -> new ScoredPredictions(List.of("a"), List.of()))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
