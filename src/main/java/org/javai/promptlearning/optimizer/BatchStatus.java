package org.javai.promptlearning.optimizer;

/**
 * How a batch ended.
 */
public enum BatchStatus {
    /** The rewrite was applied to the optimization state. */
    SUCCEEDED,
    /** The model call failed; the state was left unchanged. */
    FAILED,
    /** The model answered but the rewrite dropped a template variable; the state was left unchanged. */
    REJECTED,
    /** Not attempted because the spending limit was reached. */
    SKIPPED_BUDGET
}
