package org.javai.promptlearning;

/**
 * A provider failure worth retrying: timeouts and rate limiting.
 *
 * <p>The default retry predicate treats this type (and Spring AI's
 * {@code TransientAiException}) as retryable; every other exception is fatal.</p>
 */
public class TransientProviderException extends ProviderException {

	public TransientProviderException(String message) {
		super(message);
	}

	public TransientProviderException(String message, Throwable cause) {
		super(message, cause);
	}
}
