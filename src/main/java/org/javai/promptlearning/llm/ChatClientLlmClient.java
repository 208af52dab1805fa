package org.javai.promptlearning.llm;

import java.util.Objects;
import org.javai.promptlearning.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;

/**
 * {@link LlmClient} backed by a Spring AI {@link ChatClient}.
 *
 * <p>Each call sends the prompt as a single user message, optionally preceded by a
 * system message. Spring AI's {@code TransientAiException} propagates unchanged so the
 * retry policy can recognise it.</p>
 */
public class ChatClientLlmClient implements LlmClient {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientLlmClient.class);

	private final ChatClient chatClient;
	private final String systemMessage;

	public ChatClientLlmClient(ChatClient chatClient) {
		this(chatClient, null);
	}

	public ChatClientLlmClient(ChatClient chatClient, String systemMessage) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.systemMessage = systemMessage;
	}

	@Override
	public LlmResponse call(String prompt) {
		Objects.requireNonNull(prompt, "prompt must not be null");
		ChatClient.ChatClientRequestSpec request = chatClient.prompt();
		if (systemMessage != null && !systemMessage.isBlank()) {
			request = request.system(systemMessage);
		}
		ChatResponse response = request.user(prompt).call().chatResponse();
		String text = extractText(response);

		Integer inputTokens = null;
		Integer outputTokens = null;
		if (response.getMetadata() != null && response.getMetadata().getUsage() != null) {
			Usage usage = response.getMetadata().getUsage();
			inputTokens = usage.getPromptTokens();
			outputTokens = usage.getCompletionTokens();
		}
		logger.debug("LLM call returned {} chars (prompt tokens={}, completion tokens={})",
				text.length(), inputTokens, outputTokens);
		return new LlmResponse(text, inputTokens, outputTokens);
	}

	private static String extractText(ChatResponse response) {
		if (response == null) {
			throw new ProviderException("LLM returned no response");
		}
		Generation generation = response.getResult();
		if (generation == null || generation.getOutput() == null) {
			throw new ProviderException("LLM response contains no generation");
		}
		String text = generation.getOutput().getText();
		if (text == null || text.isBlank()) {
			throw new ProviderException("LLM returned empty content");
		}
		return text;
	}
}
