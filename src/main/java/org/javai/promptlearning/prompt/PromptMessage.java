package org.javai.promptlearning.prompt;

import java.util.Objects;

/**
 * A role/content pair of a chat prompt.
 *
 * @param role the message role, e.g. "system" or "user"
 * @param content the message text
 */
public record PromptMessage(String role, String content) {

	public static final String SYSTEM = "system";
	public static final String USER = "user";

	public PromptMessage {
		Objects.requireNonNull(role, "role must not be null");
		Objects.requireNonNull(content, "content must not be null");
	}

	public static PromptMessage system(String content) {
		return new PromptMessage(SYSTEM, content);
	}

	public static PromptMessage user(String content) {
		return new PromptMessage(USER, content);
	}

	public PromptMessage withContent(String newContent) {
		return new PromptMessage(role, newContent);
	}
}
