package org.javai.promptlearning;

/**
 * Thrown when token accounting fails or a token budget is unusable.
 */
public class TokenLimitException extends PromptLearningException {

	public TokenLimitException(String message) {
		super(message);
	}

	public TokenLimitException(String message, Throwable cause) {
		super(message, cause);
	}
}
