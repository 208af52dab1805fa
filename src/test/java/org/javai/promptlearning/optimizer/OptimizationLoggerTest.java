package org.javai.promptlearning.optimizer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.promptlearning.dataset.Batch;
import org.javai.promptlearning.meta.OptimizationMode;
import org.javai.promptlearning.pricing.UsageSummary;
import org.javai.promptlearning.prompt.PromptRepresentation;
import org.javai.promptlearning.testsupport.DatasetFixtures;
import org.javai.promptlearning.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;

class OptimizationLoggerTest {

	private final OptimizationLogger optimizationLogger = new OptimizationLogger(OptimizationLoggerTest.class);
	private final Batch batch = new Batch(1, 10, DatasetFixtures.textRows(5, 8), 10);

	@Test
	void appliedBatchIsLoggedAtInfo() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(OptimizationLoggerTest.class, Level.INFO)) {
			optimizationLogger.logBatchApplied(OptimizationMode.promptRewrite(), batch, 4, "Answer   the\n{question}", 0.1234);

			assertThat(appender.messagesAt(Level.INFO)).containsExactly(
					"[prompt] batch 2/4 rows 10-14 optimized, cost=0.1234 ('Answer the {question}')");
		}
	}

	@Test
	void budgetStopIsLoggedAtWarn() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(OptimizationLoggerTest.class, Level.WARN)) {
			optimizationLogger.logBudgetStop(OptimizationMode.rulesetEdit("- r"), batch, 4, 4.99, 5.0);
			optimizationLogger.logRunStart(OptimizationMode.promptRewrite(), 50, 4, List.of("question"));

			assertThat(appender.messages()).containsExactly(
					"[ruleset] stopping before batch 2/4: spend 4.9900 would exceed budget 5.0000");
		}
	}

	@Test
	void runSummaryCountsBatchesByStatus() {
		OptimizationResult result = new OptimizationResult(OptimizationMode.promptRewrite(),
				PromptRepresentation.of("p"),
				null,
				List.of(
						new BatchReport(0, 0, 1, 1, BatchStatus.SUCCEEDED, 1, 0.01, null),
						new BatchReport(1, 1, 1, 1, BatchStatus.REJECTED, 1, 0.01, "dropped"),
						new BatchReport(2, 2, 1, 1, BatchStatus.SKIPPED_BUDGET, 0, 0.0, null)),
				new UsageSummary(0.02, 100, 20),
				StopReason.BUDGET_EXCEEDED);

		try (LogCaptorAppender appender = LogCaptorAppender.create(OptimizationLoggerTest.class, Level.INFO)) {
			optimizationLogger.logRunSummary(result);

			assertThat(appender.messages()).singleElement().isEqualTo(
					"[prompt] finished (BUDGET_EXCEEDED): 1 succeeded, 0 failed, 1 rejected, 1 skipped; "
							+ "tokens in=100 out=20 cost=0.0200");
		}
	}

	@Test
	void longContentIsTruncated() {
		String summarized = OptimizationLogger.summarize("word ".repeat(40));

		assertThat(summarized).hasSize(64).endsWith("...");
		assertThat(OptimizationLogger.summarize(null)).isEmpty();
	}
}
