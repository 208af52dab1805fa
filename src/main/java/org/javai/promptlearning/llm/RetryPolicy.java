package org.javai.promptlearning.llm;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import org.javai.promptlearning.OptimizationException;
import org.javai.promptlearning.TransientProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;

/**
 * Exponential-backoff retry for blocking external calls.
 *
 * <p>A call gets one initial attempt plus up to {@code maxRetries} retries. The first
 * retry waits {@code initialDelay}; each later retry waits the previous delay times
 * {@code backoffMultiplier} (1s, 3s, 9s, ... with the defaults). Only errors accepted by
 * the {@code retryable} predicate are retried; any other error ends the call at once.
 * Each call runs on a Spring Retry {@link RetryTemplate} built from these settings.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.defaults();
 * RetryResult<LlmResponse> result = policy.execute(() -> client.call(prompt));
 * }</pre>
 *
 * @param maxRetries retries after the initial attempt (>= 0)
 * @param initialDelay wait before the first retry
 * @param backoffMultiplier factor applied to the delay for each later retry (>= 1)
 * @param retryable decides whether an error is worth retrying
 * @param sleeper blocks between attempts
 */
public record RetryPolicy(
		int maxRetries,
		Duration initialDelay,
		double backoffMultiplier,
		Predicate<Throwable> retryable,
		Sleeper sleeper
) {

	private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

	public static final int DEFAULT_MAX_RETRIES = 5;
	public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
	public static final double DEFAULT_BACKOFF_MULTIPLIER = 3.0;

	public RetryPolicy {
		if (maxRetries < 0) {
			throw new IllegalArgumentException("maxRetries must be >= 0");
		}
		Objects.requireNonNull(initialDelay, "initialDelay must not be null");
		if (initialDelay.isNegative()) {
			throw new IllegalArgumentException("initialDelay must not be negative");
		}
		if (backoffMultiplier < 1.0) {
			throw new IllegalArgumentException("backoffMultiplier must be >= 1");
		}
		Objects.requireNonNull(retryable, "retryable must not be null");
		Objects.requireNonNull(sleeper, "sleeper must not be null");
	}

	public RetryPolicy(int maxRetries, Duration initialDelay, double backoffMultiplier) {
		this(maxRetries, initialDelay, backoffMultiplier, RetryPolicy::isTransient, new ThreadWaitSleeper());
	}

	public static RetryPolicy defaults() {
		return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_DELAY, DEFAULT_BACKOFF_MULTIPLIER);
	}

	public RetryPolicy withSleeper(Sleeper newSleeper) {
		return new RetryPolicy(maxRetries, initialDelay, backoffMultiplier, retryable, newSleeper);
	}

	public RetryPolicy withRetryable(Predicate<Throwable> newRetryable) {
		return new RetryPolicy(maxRetries, initialDelay, backoffMultiplier, newRetryable, sleeper);
	}

	/**
	 * Default retry predicate: timeouts and rate limiting anywhere in the cause chain.
	 */
	public static boolean isTransient(Throwable error) {
		Throwable current = error;
		int depth = 0;
		while (current != null && depth++ < 16) {
			if (current instanceof TransientProviderException
					|| current instanceof TransientAiException
					|| current instanceof SocketTimeoutException
					|| current instanceof HttpTimeoutException
					|| current instanceof TimeoutException) {
				return true;
			}
			current = current.getCause();
		}
		return false;
	}

	/**
	 * Delay before retry number {@code retry} (1-based).
	 */
	public Duration delayBeforeRetry(int retry) {
		if (retry < 1) {
			throw new IllegalArgumentException("retry must be >= 1");
		}
		double millis = initialDelay.toMillis() * Math.pow(backoffMultiplier, retry - 1);
		return Duration.ofMillis((long) millis);
	}

	public <T> RetryResult<T> execute(Callable<T> call) {
		return execute("call", call);
	}

	/**
	 * Run {@code call} under this policy. Never throws for failures of the call itself;
	 * the outcome is described by the returned {@link RetryResult}.
	 *
	 * @param operation short name used in log lines
	 * @throws OptimizationException if the thread is interrupted while waiting to retry
	 */
	public <T> RetryResult<T> execute(String operation, Callable<T> call) {
		Objects.requireNonNull(call, "call must not be null");
		AttemptRecorder recorder = new AttemptRecorder(operation);
		RetryTemplate template = RetryTemplate.builder()
				.maxAttempts(maxRetries + 1)
				.customBackoff(backOffPolicy())
				.retryOn(retryable)
				.withListener(recorder)
				.build();

		RetryCallback<RetryResult<T>, Exception> attempt = context -> {
			recorder.started();
			T value = call.call();
			recorder.succeeded();
			return new RetryResult.Succeeded<>(value, recorder.attempts);
		};
		try {
			return template.execute(attempt, context -> recorder.finish(context.getLastThrowable()));
		}
		catch (BackOffInterruptedException interrupted) {
			Thread.currentThread().interrupt();
			OptimizationException failure = new OptimizationException(operation + " interrupted while waiting to retry",
					interrupted.getCause() != null ? interrupted.getCause() : interrupted);
			if (recorder.lastError != null) {
				failure.addSuppressed(recorder.lastError);
			}
			throw failure;
		}
		catch (Exception e) {
			throw new OptimizationException(operation + " could not be executed: " + e.getMessage(), e);
		}
	}

	private ExponentialBackOffPolicy backOffPolicy() {
		ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
		backOff.setInitialInterval(initialDelay.toMillis());
		backOff.setMultiplier(backoffMultiplier);
		backOff.setMaxInterval(delayBeforeRetry(Math.max(1, maxRetries)).toMillis());
		backOff.setSleeper(sleeper);
		return backOff;
	}

	/**
	 * Collects one {@link AttemptRecord} per attempt of a single call and turns the last
	 * error into the final {@link RetryResult}.
	 */
	private final class AttemptRecorder implements RetryListener {

		private final String operation;
		private final List<AttemptRecord> attempts = new ArrayList<>();
		private long startNanos;
		private Throwable lastError;

		private AttemptRecorder(String operation) {
			this.operation = operation;
		}

		private void started() {
			startNanos = System.nanoTime();
		}

		private void succeeded() {
			attempts.add(new AttemptRecord(attempts.size() + 1, AttemptOutcome.SUCCESS, elapsedMillis(startNanos), null));
		}

		@Override
		public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable error) {
			int attempt = attempts.size() + 1;
			lastError = error;
			boolean transientError = retryable.test(error);
			AttemptOutcome outcome = transientError ? AttemptOutcome.TRANSIENT_FAILURE : AttemptOutcome.FATAL_FAILURE;
			attempts.add(new AttemptRecord(attempt, outcome, elapsedMillis(startNanos), describe(error)));
			if (transientError && attempt <= maxRetries) {
				logger.warn("{} failed (attempt {}/{}): {}. Retrying in {} ms",
						operation, attempt, maxRetries + 1, describe(error), delayBeforeRetry(attempt).toMillis());
			}
		}

		private <T> RetryResult<T> finish(Throwable error) {
			if (!retryable.test(error)) {
				logger.debug("{} failed with non-retryable {} on attempt {}", operation, error.getClass().getSimpleName(),
						attempts.size());
				return new RetryResult.Fatal<>(error, attempts);
			}
			logger.warn("{} failed after {} retries: {}", operation, maxRetries, describe(error));
			return new RetryResult.Exhausted<>(error, attempts);
		}
	}

	private static long elapsedMillis(long startNanos) {
		return Math.max(0, (System.nanoTime() - startNanos) / 1_000_000);
	}

	private static String describe(Throwable error) {
		return error.getClass().getSimpleName() + ": " + error.getMessage();
	}
}
