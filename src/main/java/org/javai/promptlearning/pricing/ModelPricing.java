package org.javai.promptlearning.pricing;

import java.util.Objects;

/**
 * Unit prices of a model, per 1,000 tokens.
 *
 * @param modelName the model or model family the prices apply to
 * @param inputPricePer1k cost of 1,000 prompt tokens
 * @param outputPricePer1k cost of 1,000 completion tokens
 */
public record ModelPricing(String modelName, double inputPricePer1k, double outputPricePer1k) {

	public ModelPricing {
		Objects.requireNonNull(modelName, "modelName must not be null");
		if (inputPricePer1k < 0 || outputPricePer1k < 0) {
			throw new IllegalArgumentException("prices must be >= 0");
		}
	}

	public double cost(long inputTokens, long outputTokens) {
		return (inputTokens / 1000.0) * inputPricePer1k + (outputTokens / 1000.0) * outputPricePer1k;
	}
}
