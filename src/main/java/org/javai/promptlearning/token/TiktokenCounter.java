package org.javai.promptlearning.token;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.ModelType;
import java.util.Objects;
import org.javai.promptlearning.TokenLimitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exact token counter backed by jtokkit, a Java port of OpenAI's tiktoken.
 */
public class TiktokenCounter implements TokenCounter {

	private static final Logger logger = LoggerFactory.getLogger(TiktokenCounter.class);
	private static final EncodingRegistry REGISTRY = Encodings.newDefaultEncodingRegistry();

	public static final String DEFAULT_ENCODING = "cl100k_base";

	private final Encoding encoding;

	public TiktokenCounter() {
		this(DEFAULT_ENCODING);
	}

	public TiktokenCounter(String encodingName) {
		Objects.requireNonNull(encodingName, "encodingName must not be null");
		EncodingType type = EncodingType.fromName(encodingName)
				.orElseThrow(() -> new TokenLimitException("Unknown encoding: " + encodingName));
		this.encoding = REGISTRY.getEncoding(type);
	}

	private TiktokenCounter(Encoding encoding) {
		this.encoding = encoding;
	}

	/**
	 * Counter using the encoding of the given model family; unknown models get {@value #DEFAULT_ENCODING}.
	 */
	public static TiktokenCounter forModel(String model) {
		if (model == null || model.isBlank()) {
			return new TiktokenCounter();
		}
		return REGISTRY.getEncodingForModel(model)
				.or(() -> ModelType.fromName(model).map(REGISTRY::getEncodingForModel))
				.map(TiktokenCounter::new)
				.orElseGet(() -> {
					logger.debug("No tokenizer registered for model '{}'; using {}", model, DEFAULT_ENCODING);
					return new TiktokenCounter();
				});
	}

	public String encodingName() {
		return encoding.getName();
	}

	@Override
	public int count(String text) {
		if (text == null || text.isEmpty()) {
			return 0;
		}
		// ordinary counting treats special-token text as plain text instead of rejecting it
		return encoding.countTokensOrdinary(text);
	}

	@Override
	public int estimate(String text) {
		return count(text);
	}
}
