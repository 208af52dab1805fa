package org.javai.promptlearning.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.javai.promptlearning.TokenLimitException;
import org.javai.promptlearning.dataset.Dataset;
import org.junit.jupiter.api.Test;

class TiktokenCounterTest {

	private final TiktokenCounter counter = new TiktokenCounter();

	@Test
	void countsSubWordTokens() {
		assertThat(counter.count("hello world")).isEqualTo(2);
	}

	@Test
	void emptyAndNullTextCountAsZero() {
		assertThat(counter.count("")).isZero();
		assertThat(counter.count(null)).isZero();
	}

	@Test
	void estimateMatchesCount() {
		String text = "Classify the support query into one of: billing, shipping, account, other.";
		assertThat(counter.estimate(text)).isEqualTo(counter.count(text));
	}

	@Test
	void specialTokenTextIsCountedAsPlainText() {
		assertThat(counter.count("<|endoftext|>")).isPositive();
	}

	@Test
	void gpt4UsesCl100kEncoding() {
		assertThat(TiktokenCounter.forModel("gpt-4").encodingName()).isEqualTo("cl100k_base");
	}

	@Test
	void unknownModelFallsBackToDefaultEncoding() {
		assertThat(TiktokenCounter.forModel("some-local-model").encodingName())
				.isEqualTo(TiktokenCounter.DEFAULT_ENCODING);
		assertThat(TiktokenCounter.forModel(null).encodingName())
				.isEqualTo(TiktokenCounter.DEFAULT_ENCODING);
	}

	@Test
	void unknownEncodingIsRejected() {
		assertThatThrownBy(() -> new TiktokenCounter("no_such_encoding"))
				.isInstanceOf(TokenLimitException.class)
				.hasMessageContaining("no_such_encoding");
	}

	@Test
	void countBatchReturnsOneCountPerRow() {
		Dataset dataset = Dataset.of(List.of(
				Map.of("q", "hello world", "a", "hello world"),
				Map.of("q", "hello world")
		));

		assertThat(counter.countBatch(dataset, List.of("q", "a"))).containsExactly(4, 2);
	}
}
