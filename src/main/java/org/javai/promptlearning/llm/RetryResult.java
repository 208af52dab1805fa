package org.javai.promptlearning.llm;

import java.util.List;
import java.util.Optional;
import org.javai.promptlearning.OptimizationException;
import org.javai.promptlearning.ProviderException;

/**
 * Result of a call executed under a {@link RetryPolicy}. Sealed to the three ways a
 * retried call can end:
 * <ul>
 *   <li>{@link Succeeded} - an attempt returned a value</li>
 *   <li>{@link Exhausted} - every attempt failed with a retryable error</li>
 *   <li>{@link Fatal} - an attempt failed with a non-retryable error</li>
 * </ul>
 *
 * @param <T> the value type of the call
 */
public sealed interface RetryResult<T> {

	List<AttemptRecord> attempts();

	default int attemptCount() {
		return attempts().size();
	}

	default boolean succeeded() {
		return this instanceof Succeeded;
	}

	default Optional<Throwable> error() {
		if (this instanceof Exhausted<T> exhausted) {
			return Optional.of(exhausted.lastError());
		}
		if (this instanceof Fatal<T> fatal) {
			return Optional.of(fatal.cause());
		}
		return Optional.empty();
	}

	/**
	 * The value, or an exception: {@link OptimizationException} wrapping the last error
	 * when retries ran out; the original error (wrapped in {@link ProviderException} if
	 * checked) when it was fatal.
	 */
	T getOrThrow();

	record Succeeded<T>(T value, List<AttemptRecord> attempts) implements RetryResult<T> {
		public Succeeded {
			attempts = List.copyOf(attempts);
		}

		@Override
		public T getOrThrow() {
			return value;
		}
	}

	record Exhausted<T>(Throwable lastError, List<AttemptRecord> attempts) implements RetryResult<T> {
		public Exhausted {
			attempts = List.copyOf(attempts);
		}

		@Override
		public T getOrThrow() {
			int retries = Math.max(0, attempts.size() - 1);
			throw new OptimizationException("Call failed after " + retries + " retries. Last error: "
					+ lastError.getMessage(), lastError);
		}
	}

	record Fatal<T>(Throwable cause, List<AttemptRecord> attempts) implements RetryResult<T> {
		public Fatal {
			attempts = List.copyOf(attempts);
		}

		@Override
		public T getOrThrow() {
			if (cause instanceof RuntimeException runtime) {
				throw runtime;
			}
			if (cause instanceof Error err) {
				throw err;
			}
			throw new ProviderException("Call failed: " + cause.getMessage(), cause);
		}
	}
}
