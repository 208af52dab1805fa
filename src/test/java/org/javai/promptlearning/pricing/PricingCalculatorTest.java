package org.javai.promptlearning.pricing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PricingCalculatorTest {

	private final PricingCalculator calculator = new PricingCalculator();

	@Test
	void costUsesPricesPerThousandTokens() {
		assertThat(calculator.cost("gpt-4", 1000, 500)).isCloseTo(0.06, within(1e-9));
		assertThat(calculator.cost("gpt-4", 0, 0)).isZero();
	}

	@Test
	void negativeTokenCountsAreRejected() {
		assertThatThrownBy(() -> calculator.cost("gpt-4", -1, 0))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> calculator.record("gpt-4", 0, -5))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Nested
	class ModelResolution {

		@Test
		void exactNameWins() {
			assertThat(calculator.priceFor("gpt-4-turbo").inputPricePer1k()).isEqualTo(0.01);
		}

		@Test
		void familyNameInsideModelNameMatches() {
			assertThat(calculator.priceFor("gpt-4o").modelName()).isEqualTo("gpt-4");
			assertThat(calculator.priceFor("GEMINI-2.5-flash-lite").modelName()).isEqualTo("gemini-2.5-flash");
		}

		@Test
		void unknownModelUsesFallback() {
			assertThat(calculator.priceFor("claude-3")).isEqualTo(PricingCalculator.FALLBACK_PRICING);
			assertThat(calculator.priceFor(null)).isEqualTo(PricingCalculator.FALLBACK_PRICING);
			assertThat(calculator.cost("claude-3", 1000, 1000)).isCloseTo(0.04, within(1e-9));
		}

		@Test
		void customTableAndFallback() {
			PricingCalculator custom = new PricingCalculator(
					Map.of("local-llm", new ModelPricing("local-llm", 0.0, 0.0)),
					new ModelPricing("other", 1.0, 2.0));

			assertThat(custom.cost("local-llm", 10_000, 10_000)).isZero();
			assertThat(custom.cost("gpt-4", 1000, 1000)).isCloseTo(3.0, within(1e-9));
		}
	}

	@Nested
	class Ledger {

		@Test
		void recordAccumulatesCostAndTokens() {
			double first = calculator.record("gpt-4", 1000, 500);
			double second = calculator.record("gpt-3.5-turbo", 2000, 1000);

			UsageSummary summary = calculator.summary();
			assertThat(first).isCloseTo(0.06, within(1e-9));
			assertThat(second).isCloseTo(0.005, within(1e-9));
			assertThat(summary.totalCost()).isCloseTo(first + second, within(1e-9));
			assertThat(summary.totalInputTokens()).isEqualTo(3000);
			assertThat(summary.totalOutputTokens()).isEqualTo(1500);
			assertThat(summary.totalTokens()).isEqualTo(4500);
		}

		@Test
		void resetClearsTheLedger() {
			calculator.record("gpt-4", 1000, 500);

			calculator.reset();

			assertThat(calculator.summary()).isEqualTo(UsageSummary.empty());
		}

		@Test
		void wouldExceedIsStrictAndDoesNotRecord() {
			calculator.record("gpt-4", 1000, 0);

			// 0.03 spent, next call costs 0.03
			assertThat(calculator.wouldExceed("gpt-4", 1000, 0, 0.06)).isFalse();
			assertThat(calculator.wouldExceed("gpt-4", 1000, 0, 0.059)).isTrue();
			assertThat(calculator.totalCost()).isCloseTo(0.03, within(1e-9));
		}
	}
}
