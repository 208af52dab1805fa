package org.javai.promptlearning;

/**
 * Thrown when a batch cannot be processed, typically because retries were exhausted.
 */
public class OptimizationException extends PromptLearningException {

	public OptimizationException(String message) {
		super(message);
	}

	public OptimizationException(String message, Throwable cause) {
		super(message, cause);
	}
}
