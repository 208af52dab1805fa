package org.javai.promptlearning.prompt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.promptlearning.ConfigurationException;
import org.junit.jupiter.api.Test;

class PromptRepresentationTest {

	@Test
	void plainTextIsItsOwnEditableContent() {
		PromptRepresentation prompt = PromptRepresentation.of("Classify {query}");

		assertThat(prompt.editableContent(PromptMessage.SYSTEM)).isEqualTo("Classify {query}");
		assertThat(prompt.withEditableContent(PromptMessage.SYSTEM, "Label {query}"))
				.isEqualTo(new PromptRepresentation.PlainText("Label {query}"));
	}

	@Test
	void messageListReplacesOnlyTheFirstMessageWithTheEditableRole() {
		PromptRepresentation prompt = PromptRepresentation.of(List.of(
				PromptMessage.user("Hi"),
				PromptMessage.system("Be terse"),
				PromptMessage.system("Second system"),
				PromptMessage.user("{question}")));

		PromptRepresentation optimized = prompt.withEditableContent(PromptMessage.SYSTEM, "Be precise");

		assertThat(optimized).isInstanceOf(PromptRepresentation.MessageList.class);
		assertThat(optimized.messages()).containsExactly(
				PromptMessage.user("Hi"),
				PromptMessage.system("Be precise"),
				PromptMessage.system("Second system"),
				PromptMessage.user("{question}"));
	}

	@Test
	void firstMessageIsEditableWhenNoRoleMatches() {
		PromptRepresentation prompt = PromptRepresentation.of(List.of(
				PromptMessage.user("Answer {question}"),
				new PromptMessage("assistant", "ok")));

		assertThat(prompt.editableIndex(PromptMessage.SYSTEM)).isZero();
		assertThat(prompt.editableContent(PromptMessage.SYSTEM)).isEqualTo("Answer {question}");
	}

	@Test
	void versionedPromptKeepsMetadataAndDescribesTheOptimization() {
		PromptRepresentation.VersionedPrompt prompt = new PromptRepresentation.VersionedPrompt(
				"support-router",
				List.of(PromptMessage.system("Route {query}")),
				"gpt-4o",
				"openai",
				"v3");

		PromptRepresentation.VersionedPrompt optimized =
				prompt.withEditableContent(PromptMessage.SYSTEM, "Route the {query} carefully");

		assertThat(optimized.name()).isEqualTo("support-router");
		assertThat(optimized.modelName()).isEqualTo("gpt-4o");
		assertThat(optimized.modelProvider()).isEqualTo("openai");
		assertThat(optimized.description()).isEqualTo("Optimized version of support-router");
		assertThat(optimized.messages()).containsExactly(PromptMessage.system("Route the {query} carefully"));
	}

	@Test
	void emptyMessageListHasNothingToEdit() {
		PromptRepresentation prompt = PromptRepresentation.of(List.<PromptMessage>of());

		assertThatThrownBy(() -> prompt.editableContent(PromptMessage.SYSTEM))
				.isInstanceOf(ConfigurationException.class);
	}
}
