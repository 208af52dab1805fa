package org.javai.promptlearning.meta;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import org.javai.promptlearning.ConfigurationException;
import org.javai.promptlearning.OptimizationException;
import org.javai.promptlearning.TransientProviderException;
import org.javai.promptlearning.dataset.Dataset;
import org.javai.promptlearning.llm.LlmClient;
import org.javai.promptlearning.llm.LlmResponse;
import org.javai.promptlearning.llm.RetryPolicy;
import org.javai.promptlearning.testsupport.DatasetFixtures;
import org.junit.jupiter.api.Test;

class AnnotatorTest {

	private final LlmClient llmClient = mock(LlmClient.class);
	private final RetryPolicy retryPolicy = RetryPolicy.defaults().withSleeper(delay -> {});
	private final Dataset dataset = DatasetFixtures.dataset(DatasetFixtures.SUPPORT_QUERIES);
	private final String prompt = DatasetFixtures.prompt(DatasetFixtures.SUPPORT_QUERIES);

	@Test
	void contentShowsGroundTruthAndFeedback() {
		Annotator annotator = new Annotator(llmClient, retryPolicy);

		String content = annotator.constructContent(dataset.slice(0, 2), prompt, List.of("query"),
				List.of("correctness", "explanation"), "output", "ground_truth");

		assertThat(content)
				.contains(prompt)
				.contains("Example 0\nInput:\nquery: ")
				.contains("Output: billing\nGround Truth: billing\nFeedback:\ncorrectness: correct")
				.contains("Example 1\n")
				.contains("YOUR ANALYSIS:");
	}

	@Test
	void groundTruthIsNotAvailableWithoutColumn() {
		Annotator annotator = new Annotator(llmClient, retryPolicy);

		String content = annotator.constructContent(dataset.slice(0, 1), prompt, List.of("query"),
				List.of("correctness"), "output", null);

		assertThat(content).contains("Ground Truth: N/A");
	}

	@Test
	void customTemplateNeedsExamples() {
		assertThatThrownBy(() -> new Annotator(llmClient, retryPolicy, "Summarize {baseline_prompt}"))
				.isInstanceOf(ConfigurationException.class);
		assertThatThrownBy(() -> new Annotator(llmClient, retryPolicy, "{examples} {unknown}"))
				.isInstanceOf(ConfigurationException.class);
	}

	@Test
	void customTemplateMayOmitBaselinePrompt() {
		Annotator annotator = new Annotator(llmClient, retryPolicy, "Find patterns:{examples}");

		String content = annotator.constructContent(dataset.slice(0, 1), prompt, List.of("query"),
				List.of("correctness"), "output", "ground_truth");

		assertThat(content).startsWith("Find patterns:\n\nExample 0\n").doesNotContain(prompt);
	}

	@Test
	void generateAnnotationRetriesTransientFailures() {
		when(llmClient.call(anyString()))
				.thenThrow(new TransientProviderException("rate limited"))
				.thenReturn(LlmResponse.of("Outputs confuse account and billing."));
		Annotator annotator = new Annotator(llmClient, retryPolicy);

		assertThat(annotator.generateAnnotation("analyze")).isEqualTo("Outputs confuse account and billing.");
		verify(llmClient, times(2)).call("analyze");
	}

	@Test
	void generateAnnotationFailsWhenRetriesRunOut() {
		when(llmClient.call(anyString())).thenThrow(new TransientProviderException("rate limited"));
		Annotator annotator = new Annotator(llmClient, RetryPolicy.defaults().withSleeper(delay -> {}));

		assertThatThrownBy(() -> annotator.generateAnnotation("analyze"))
				.isInstanceOf(OptimizationException.class);
	}
}
