package org.javai.promptlearning.optimizer;

/**
 * Why an optimization run stopped.
 */
public enum StopReason {
    COMPLETED,
    BUDGET_EXCEEDED
}
