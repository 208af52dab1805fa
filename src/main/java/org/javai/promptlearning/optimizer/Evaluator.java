package org.javai.promptlearning.optimizer;

import org.javai.promptlearning.dataset.Dataset;

/**
 * Produces feedback columns for a dataset, e.g. by judging each output with a model.
 *
 * <p>An evaluator that throws is skipped; it does not abort optimization.</p>
 */
@FunctionalInterface
public interface Evaluator {

	EvaluationResult evaluate(Dataset dataset);
}
