package org.javai.promptlearning.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.promptlearning.OptimizationException;
import org.javai.promptlearning.ProviderException;
import org.javai.promptlearning.TransientProviderException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.TransientAiException;

class RetryPolicyTest {

	private final List<Long> sleeps = new ArrayList<>();
	private final RetryPolicy policy = RetryPolicy.defaults().withSleeper(sleeps::add);

	@AfterEach
	void clearInterrupt() {
		Thread.interrupted();
	}

	@Test
	void successOnFirstAttemptDoesNotSleep() {
		RetryResult<String> result = policy.execute(() -> "ok");

		assertThat(result.succeeded()).isTrue();
		assertThat(result.getOrThrow()).isEqualTo("ok");
		assertThat(result.attemptCount()).isEqualTo(1);
		assertThat(result.attempts().get(0).isSuccess()).isTrue();
		assertThat(sleeps).isEmpty();
	}

	@Test
	void transientFailuresBackOffExponentiallyUntilExhausted() {
		AtomicInteger calls = new AtomicInteger();

		RetryResult<String> result = policy.execute("batch 1", () -> {
			calls.incrementAndGet();
			throw new TransientProviderException("rate limited");
		});

		assertThat(result).isInstanceOf(RetryResult.Exhausted.class);
		assertThat(calls).hasValue(6);
		assertThat(sleeps).containsExactly(1_000L, 3_000L, 9_000L, 27_000L, 81_000L);
		assertThat(result.attempts()).extracting(AttemptRecord::outcome)
				.containsOnly(AttemptOutcome.TRANSIENT_FAILURE);
		assertThat(result.attempts()).extracting(AttemptRecord::attempt)
				.containsExactly(1, 2, 3, 4, 5, 6);
		assertThat(result.error()).get().isInstanceOf(TransientProviderException.class);
		assertThatThrownBy(result::getOrThrow)
				.isInstanceOf(OptimizationException.class)
				.hasMessageContaining("Call failed after 5 retries")
				.hasMessageContaining("rate limited");
	}

	@Test
	void recoversAfterTransientFailures() {
		AtomicInteger calls = new AtomicInteger();

		RetryResult<String> result = policy.execute(() -> {
			if (calls.incrementAndGet() < 3) {
				throw new TransientAiException("timeout");
			}
			return "done";
		});

		assertThat(result.getOrThrow()).isEqualTo("done");
		assertThat(result.attemptCount()).isEqualTo(3);
		assertThat(sleeps).containsExactly(1_000L, 3_000L);
	}

	@Test
	void fatalErrorIsNotRetried() {
		AtomicInteger calls = new AtomicInteger();

		RetryResult<String> result = policy.execute(() -> {
			calls.incrementAndGet();
			throw new IllegalStateException("invalid api key");
		});

		assertThat(result).isInstanceOf(RetryResult.Fatal.class);
		assertThat(calls).hasValue(1);
		assertThat(sleeps).isEmpty();
		assertThat(result.attempts()).singleElement()
				.extracting(AttemptRecord::outcome).isEqualTo(AttemptOutcome.FATAL_FAILURE);
		assertThat(((RetryResult.Fatal<String>) result).cause()).hasMessage("invalid api key");
		assertThat(result.error()).get().isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(result::getOrThrow)
				.isInstanceOf(IllegalStateException.class)
				.hasMessage("invalid api key");
	}

	@Test
	void checkedFatalErrorIsWrapped() {
		RetryResult<String> result = policy.execute(() -> {
			throw new java.io.IOException("connection refused");
		});

		assertThatThrownBy(result::getOrThrow)
				.isInstanceOf(ProviderException.class)
				.hasCauseInstanceOf(java.io.IOException.class);
	}

	@Test
	void zeroRetriesMeansOneAttempt() {
		RetryPolicy once = new RetryPolicy(0, Duration.ofSeconds(1), 3.0).withSleeper(sleeps::add);

		RetryResult<String> result = once.execute(() -> {
			throw new TransientProviderException("busy");
		});

		assertThat(result.attemptCount()).isEqualTo(1);
		assertThat(sleeps).isEmpty();
	}

	@Test
	void interruptedWaitAbortsTheCall() {
		RetryPolicy interrupted = policy.withSleeper(delay -> {
			throw new InterruptedException("shutdown");
		});

		assertThatThrownBy(() -> interrupted.execute("batch 2", () -> {
			throw new TransientProviderException("slow");
		}))
				.isInstanceOf(OptimizationException.class)
				.hasMessageContaining("batch 2 interrupted");
		assertThat(Thread.currentThread().isInterrupted()).isTrue();
	}

	@Test
	void transientErrorsAreFoundInTheCauseChain() {
		assertThat(RetryPolicy.isTransient(new RuntimeException(new SocketTimeoutException("read timed out")))).isTrue();
		assertThat(RetryPolicy.isTransient(new RuntimeException("bad request"))).isFalse();
	}

	@Test
	void invalidSettingsAreRejected() {
		assertThatThrownBy(() -> new RetryPolicy(-1, Duration.ZERO, 1.0))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new RetryPolicy(1, Duration.ZERO, 0.5))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
