package org.javai.promptlearning.llm;

/**
 * Outcome of a single attempt of a retried call.
 */
public enum AttemptOutcome {
    /**
     * The call returned a value.
     */
    SUCCESS,

    /**
     * The call failed with a retryable error (timeout, rate limiting).
     */
    TRANSIENT_FAILURE,

    /**
     * The call failed with an error that is never retried.
     */
    FATAL_FAILURE
}
