package org.javai.promptlearning;

/**
 * Thrown for setup problems: invalid settings, malformed templates, unusable prompts.
 */
public class ConfigurationException extends PromptLearningException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
