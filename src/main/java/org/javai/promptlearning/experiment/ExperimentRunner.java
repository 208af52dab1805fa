package org.javai.promptlearning.experiment;

import org.javai.promptlearning.dataset.Dataset;

/**
 * Runs a candidate prompt against data. Implementations call the application under
 * optimization and judge its answers; the experiment loop only sees the results.
 */
public interface ExperimentRunner {

	/**
	 * Run the candidate on training rows.
	 *
	 * @return the rows with the output column and every feedback column filled in
	 */
	Dataset runTraining(String candidatePrompt, Dataset trainRows);

	/**
	 * Run the candidate on held-out data.
	 */
	ScoredPredictions evaluate(String candidatePrompt);
}
