package org.javai.promptlearning.prompt;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.promptlearning.ConfigurationException;

/**
 * The prompt being optimized. Sealed so that every shape is known:
 * <ul>
 *   <li>{@link PlainText} - a single instruction string</li>
 *   <li>{@link MessageList} - an ordered chat template</li>
 *   <li>{@link VersionedPrompt} - a prompt-registry entry carrying its model metadata</li>
 * </ul>
 *
 * <p>Exactly one message is editable: the first one whose role matches the editable role,
 * or the first message when none does. {@link #withEditableContent(String, String)}
 * replaces that message's content and keeps everything else verbatim, so the optimized
 * prompt always has the shape of the input.</p>
 */
public sealed interface PromptRepresentation {

	/**
	 * The prompt as chat messages; a plain text prompt is a single user message.
	 */
	List<PromptMessage> messages();

	/**
	 * Rebuild this prompt with the editable message's content replaced.
	 */
	PromptRepresentation withEditableContent(String editableRole, String content);

	/**
	 * Index of the editable message among {@link #messages()}.
	 *
	 * @throws ConfigurationException if the prompt has no messages
	 */
	default int editableIndex(String editableRole) {
		List<PromptMessage> messages = messages();
		if (messages.isEmpty()) {
			throw new ConfigurationException("Prompt has no messages to optimize");
		}
		for (int i = 0; i < messages.size(); i++) {
			if (messages.get(i).role().equals(editableRole)) {
				return i;
			}
		}
		return 0;
	}

	default String editableContent(String editableRole) {
		return messages().get(editableIndex(editableRole)).content();
	}

	static PlainText of(String text) {
		return new PlainText(text);
	}

	static MessageList of(List<PromptMessage> messages) {
		return new MessageList(messages);
	}

	private static List<PromptMessage> replaceEditable(PromptRepresentation prompt, String editableRole, String content) {
		int index = prompt.editableIndex(editableRole);
		List<PromptMessage> updated = new ArrayList<>(prompt.messages());
		updated.set(index, updated.get(index).withContent(content));
		return updated;
	}

	/**
	 * @param text the instruction text
	 */
	record PlainText(String text) implements PromptRepresentation {
		public PlainText {
			Objects.requireNonNull(text, "text must not be null");
		}

		@Override
		public List<PromptMessage> messages() {
			return List.of(PromptMessage.user(text));
		}

		@Override
		public String editableContent(String editableRole) {
			return text;
		}

		@Override
		public PlainText withEditableContent(String editableRole, String content) {
			return new PlainText(content);
		}
	}

	/**
	 * @param messages the chat messages, in order
	 */
	record MessageList(List<PromptMessage> messages) implements PromptRepresentation {
		public MessageList {
			messages = List.copyOf(Objects.requireNonNull(messages, "messages must not be null"));
		}

		@Override
		public MessageList withEditableContent(String editableRole, String content) {
			return new MessageList(replaceEditable(this, editableRole, content));
		}
	}

	/**
	 * A prompt held in an external registry.
	 *
	 * @param name registry name of the prompt
	 * @param messages the chat template messages
	 * @param modelName the model the prompt is declared for
	 * @param modelProvider the provider of that model
	 * @param description free-text description of this version
	 */
	record VersionedPrompt(
			String name,
			List<PromptMessage> messages,
			String modelName,
			String modelProvider,
			String description
	) implements PromptRepresentation {
		public VersionedPrompt {
			Objects.requireNonNull(name, "name must not be null");
			messages = List.copyOf(Objects.requireNonNull(messages, "messages must not be null"));
		}

		@Override
		public VersionedPrompt withEditableContent(String editableRole, String content) {
			return new VersionedPrompt(
					name,
					replaceEditable(this, editableRole, content),
					modelName,
					modelProvider,
					"Optimized version of " + name
			);
		}
	}
}
