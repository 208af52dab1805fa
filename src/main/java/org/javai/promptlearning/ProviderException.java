package org.javai.promptlearning;

/**
 * Thrown when a language-model call is misconfigured or fails.
 */
public class ProviderException extends PromptLearningException {

	public ProviderException(String message) {
		super(message);
	}

	public ProviderException(String message, Throwable cause) {
		super(message, cause);
	}
}
