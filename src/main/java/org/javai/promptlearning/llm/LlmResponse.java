package org.javai.promptlearning.llm;

import java.util.Objects;

/**
 * Text returned by a language model, with the usage the provider reported.
 *
 * @param text the generated text
 * @param inputTokens prompt tokens reported by the provider, or null when unknown
 * @param outputTokens completion tokens reported by the provider, or null when unknown
 */
public record LlmResponse(String text, Integer inputTokens, Integer outputTokens) {

	public LlmResponse {
		Objects.requireNonNull(text, "text must not be null");
	}

	public static LlmResponse of(String text) {
		return new LlmResponse(text, null, null);
	}

	public boolean hasUsage() {
		return inputTokens != null && outputTokens != null;
	}
}
