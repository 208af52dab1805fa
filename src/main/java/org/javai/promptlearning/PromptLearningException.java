package org.javai.promptlearning;

/**
 * Base exception for prompt learning operations.
 */
public class PromptLearningException extends RuntimeException {

	public PromptLearningException(String message) {
		super(message);
	}

	public PromptLearningException(String message, Throwable cause) {
		super(message, cause);
	}
}
