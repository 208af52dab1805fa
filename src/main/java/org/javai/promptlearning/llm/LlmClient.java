package org.javai.promptlearning.llm;

/**
 * The language-model boundary: text in, text out.
 *
 * <p>Implementations signal timeouts and rate limiting with a retryable exception
 * (see {@link RetryPolicy#isTransient(Throwable)}); anything else is treated as fatal.</p>
 */
@FunctionalInterface
public interface LlmClient {

	LlmResponse call(String prompt);
}
