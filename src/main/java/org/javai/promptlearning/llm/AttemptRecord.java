package org.javai.promptlearning.llm;

/**
 * Record of a single attempt of a retried call, for observability.
 *
 * @param attempt 1-based attempt number (1 = initial call, 2 = first retry, ...)
 * @param outcome result of the attempt
 * @param durationMillis time taken by the attempt in milliseconds
 * @param errorDetails error description if outcome is not SUCCESS, null otherwise
 */
public record AttemptRecord(
        int attempt,
        AttemptOutcome outcome,
        long durationMillis,
        String errorDetails
) {
    public AttemptRecord {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        if (durationMillis < 0) {
            throw new IllegalArgumentException("durationMillis must be >= 0");
        }
    }

    public boolean isSuccess() {
        return outcome == AttemptOutcome.SUCCESS;
    }
}
