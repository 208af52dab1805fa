package org.javai.promptlearning;

/**
 * Thrown when a dataset cannot be loaded or does not carry the columns an optimization run needs.
 */
public class DatasetException extends PromptLearningException {

	public DatasetException(String message) {
		super(message);
	}

	public DatasetException(String message, Throwable cause) {
		super(message, cause);
	}
}
