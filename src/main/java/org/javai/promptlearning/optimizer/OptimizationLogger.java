package org.javai.promptlearning.optimizer;

import java.util.List;
import java.util.Locale;
import org.javai.promptlearning.dataset.Batch;
import org.javai.promptlearning.meta.OptimizationMode;
import org.javai.promptlearning.pricing.UsageSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Log lines of optimization runs, one method per event.
 */
public class OptimizationLogger {

	private final Logger logger;

	public OptimizationLogger(Class<?> owner) {
		this.logger = LoggerFactory.getLogger(owner);
	}

	public void logRunStart(OptimizationMode mode, int rows, int batches, List<String> templateVariables) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("[{}] processing {} examples in {} batches (template variables={})",
				mode.label(), rows, batches, templateVariables);
	}

	public void logBatchApplied(OptimizationMode mode, Batch batch, int totalBatches, String newContent, double cost) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("[{}] batch {}/{} rows {}-{} optimized, cost={} ('{}')",
				mode.label(),
				batch.index() + 1,
				totalBatches,
				batch.startRow(),
				batch.endRow() - 1,
				formatCost(cost),
				summarize(newContent)
		);
	}

	public void logBatchFailed(OptimizationMode mode, Batch batch, int totalBatches, int attempts, Throwable error) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn("[{}] batch {}/{} rows {}-{} failed after {} attempt(s), state unchanged: {}",
				mode.label(),
				batch.index() + 1,
				totalBatches,
				batch.startRow(),
				batch.endRow() - 1,
				attempts,
				error.toString(),
				error
		);
	}

	public void logBatchRejected(OptimizationMode mode, Batch batch, int totalBatches, List<String> missingVariables) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn("[{}] batch {}/{} rewrite rejected, template variables {} missing",
				mode.label(), batch.index() + 1, totalBatches, missingVariables);
	}

	public void logBudgetStop(OptimizationMode mode, Batch batch, int totalBatches, double spent, double limit) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn("[{}] stopping before batch {}/{}: spend {} would exceed budget {}",
				mode.label(), batch.index() + 1, totalBatches, formatCost(spent), formatCost(limit));
	}

	public void logAnnotationBudgetStop(int annotatorNumber, double spent, double limit) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn("Annotator {} not run: spend {} would exceed budget {}",
				annotatorNumber, formatCost(spent), formatCost(limit));
	}

	public void logEvaluatorFailure(int evaluatorNumber, Exception e) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn("Evaluator {} failed and is skipped: {}", evaluatorNumber, e.toString(), e);
	}

	public void logAnnotatorFailure(int annotatorNumber, Throwable e) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn("Annotator {} failed and is skipped: {}", annotatorNumber, e.toString(), e);
	}

	public void logRunSummary(OptimizationResult result) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		UsageSummary usage = result.usage();
		logger.info("[{}] finished ({}): {} succeeded, {} failed, {} rejected, {} skipped; tokens in={} out={} cost={}",
				result.mode().label(),
				result.stopReason(),
				result.succeededBatches().size(),
				result.failedBatches().size(),
				result.batchesWith(BatchStatus.REJECTED).size(),
				result.batchesWith(BatchStatus.SKIPPED_BUDGET).size(),
				usage.totalInputTokens(),
				usage.totalOutputTokens(),
				formatCost(usage.totalCost())
		);
	}

	/**
	 * Uses SLF4J's {} placeholder format.
	 */
	public void debug(String format, Object... args) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug(format, args);
	}

	static String formatCost(double cost) {
		return String.format(Locale.ROOT, "%.4f", cost);
	}

	static String summarize(String text) {
		if (text == null || text.isBlank()) {
			return "";
		}
		String normalized = text.replaceAll("\\s+", " ").trim();
		int maxLength = 64;
		return normalized.length() <= maxLength ? normalized : normalized.substring(0, maxLength - 3) + "...";
	}
}
