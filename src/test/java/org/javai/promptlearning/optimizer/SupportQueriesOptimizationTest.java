package org.javai.promptlearning.optimizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.javai.promptlearning.dataset.Dataset;
import org.javai.promptlearning.llm.LlmClient;
import org.javai.promptlearning.llm.LlmResponse;
import org.javai.promptlearning.llm.RetryPolicy;
import org.javai.promptlearning.prompt.PromptRepresentation;
import org.javai.promptlearning.testsupport.DatasetFixtures;
import org.javai.promptlearning.token.ApproximateTokenCounter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

/**
 * End to end run over the support-ticket fixture with a scripted model.
 */
class SupportQueriesOptimizationTest {

	private static final String REVISED = """
			Classify the support query into one of: billing, shipping, account, other.
			Deliveries, parcels and address changes are shipping. Refunds are billing.
			Query: {query}
			Answer with the category only.
			""";

	private final Dataset dataset = DatasetFixtures.dataset(DatasetFixtures.SUPPORT_QUERIES);
	private final String prompt = DatasetFixtures.prompt(DatasetFixtures.SUPPORT_QUERIES);

	@Test
	void optimizesTheClassifierAndWritesAReport(@TempDir Path reportDir) throws IOException {
		LlmClient llmClient = mock(LlmClient.class);
		LlmClient annotationClient = mock(LlmClient.class);
		when(annotationClient.call(anyString())).thenReturn(LlmResponse.of("Shipping questions are labelled other or account."));
		when(llmClient.call(anyString())).thenReturn(new LlmResponse(REVISED, 1500, 60));

		PromptLearningOptimizer optimizer = PromptLearningOptimizer.builder()
				.prompt(prompt)
				.llmClient(llmClient)
				.annotationLlmClient(annotationClient)
				.tokenCounter(new ApproximateTokenCounter())
				.retryPolicy(RetryPolicy.defaults().withSleeper(delay -> {}))
				.build();

		OptimizationResult result = optimizer.optimize(OptimizationRequest.builder()
				.dataset(dataset)
				.outputColumn("output")
				.feedbackColumns("correctness", "explanation")
				.groundTruthColumn("ground_truth")
				.annotatorTemplate("Explain the mistakes:{examples}")
				.build());

		assertThat(result.prompt()).isEqualTo(PromptRepresentation.of(REVISED));
		assertThat(result.succeededBatches()).singleElement()
				.satisfies(batch -> assertThat(batch.rowCount()).isEqualTo(6));

		ArgumentCaptor<String> annotationPrompt = ArgumentCaptor.forClass(String.class);
		verify(annotationClient).call(annotationPrompt.capture());
		assertThat(annotationPrompt.getValue())
				.contains("Output: other\nGround Truth: shipping\nFeedback:\ncorrectness: incorrect")
				.contains("query: Can I change the delivery address  after  ordering?");

		ArgumentCaptor<String> metaPrompt = ArgumentCaptor.forClass(String.class);
		verify(llmClient).call(metaPrompt.capture());
		assertThat(metaPrompt.getValue())
				.contains("Query: {query}")
				.contains("explanation: Address changes for a placed order belong to  shipping .")
				.contains("Shipping questions are labelled other or account.")
				.doesNotContain("{after}")
				.doesNotContain("{shipping}");

		new OptimizationReportGenerator().generateReport(result, reportDir);
		assertThat(Files.readString(reportDir.resolve(OptimizationReportGenerator.PROMPT_FILE))).isEqualTo(REVISED);
		List<String> summary = Files.readAllLines(reportDir.resolve(OptimizationReportGenerator.SUMMARY_FILE));
		assertThat(summary).hasSize(2);
		assertThat(summary.get(1)).startsWith("0,0,6,").contains(",SUCCEEDED,1,");
	}

	@Test
	void fixtureHasThreeMisclassifications() {
		List<String> incorrect = dataset.rows().stream()
				.filter(row -> "incorrect".equals(row.text("correctness")))
				.map(row -> row.text("ground_truth"))
				.toList();

		assertThat(incorrect).containsExactly("shipping", "shipping", "billing");
	}
}
