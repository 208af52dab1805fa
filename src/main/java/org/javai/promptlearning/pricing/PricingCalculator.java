package org.javai.promptlearning.pricing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps model names to unit prices and keeps a running ledger of spend.
 *
 * <p>Costs are plain floating point without rounding; treat the ledger as an advisory
 * estimate, not as billing. The ledger only grows until {@link #reset()}.</p>
 *
 * <p>Not thread-safe. The optimizer mutates it from its single loop thread; callers
 * sharing one calculator across concurrent runs must serialize access.</p>
 */
public class PricingCalculator {

	private static final Logger logger = LoggerFactory.getLogger(PricingCalculator.class);

	/**
	 * Conservative price used when no table entry matches.
	 */
	public static final ModelPricing FALLBACK_PRICING = new ModelPricing("unknown", 0.01, 0.03);

	private static final Map<String, ModelPricing> DEFAULT_PRICING = defaultPricing();

	private final Map<String, ModelPricing> pricing;
	private final ModelPricing fallback;

	private double totalCost;
	private long totalInputTokens;
	private long totalOutputTokens;

	public PricingCalculator() {
		this(DEFAULT_PRICING, FALLBACK_PRICING);
	}

	/**
	 * @param pricing price table; iteration order decides which family wins when several match
	 * @param fallback price for models that match nothing
	 */
	public PricingCalculator(Map<String, ModelPricing> pricing, ModelPricing fallback) {
		Objects.requireNonNull(pricing, "pricing must not be null");
		this.pricing = Collections.unmodifiableMap(new LinkedHashMap<>(pricing));
		this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
	}

	public static Map<String, ModelPricing> defaultPricing() {
		Map<String, ModelPricing> table = new LinkedHashMap<>();
		put(table, "gpt-4", 0.03, 0.06);
		put(table, "gpt-4-turbo", 0.01, 0.03);
		put(table, "gpt-3.5-turbo", 0.0015, 0.002);
		put(table, "gemini-2.5-flash", 0.0003, 0.0025);
		put(table, "gemini-2.5-pro", 0.00125, 0.01);
		put(table, "gemini-pro", 0.00125, 0.01);
		return Collections.unmodifiableMap(table);
	}

	private static void put(Map<String, ModelPricing> table, String model, double input, double output) {
		table.put(model, new ModelPricing(model, input, output));
	}

	/**
	 * Exact name first, then the first family whose name (or any '-'-separated part of
	 * it) occurs in the lower-cased model name, then the fallback.
	 */
	public ModelPricing priceFor(String model) {
		if (model == null || model.isBlank()) {
			return fallback;
		}
		ModelPricing exact = pricing.get(model);
		if (exact != null) {
			return exact;
		}
		String lower = model.toLowerCase(Locale.ROOT);
		for (Map.Entry<String, ModelPricing> entry : pricing.entrySet()) {
			String key = entry.getKey().toLowerCase(Locale.ROOT);
			if (lower.contains(key) || anyPartContained(key, lower)) {
				return entry.getValue();
			}
		}
		logger.debug("No pricing entry matches model '{}'; using fallback {}", model, fallback);
		return fallback;
	}

	private static boolean anyPartContained(String key, String model) {
		for (String part : key.split("-")) {
			if (!part.isEmpty() && model.contains(part)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Pure cost of a call: {@code in/1000 * inputPrice + out/1000 * outputPrice}.
	 */
	public double cost(String model, long inputTokens, long outputTokens) {
		requireNonNegative(inputTokens, outputTokens);
		return priceFor(model).cost(inputTokens, outputTokens);
	}

	/**
	 * Add a call to the ledger.
	 *
	 * @return the cost of this call alone
	 */
	public double record(String model, long inputTokens, long outputTokens) {
		double cost = cost(model, inputTokens, outputTokens);
		totalCost += cost;
		totalInputTokens += inputTokens;
		totalOutputTokens += outputTokens;
		if (logger.isDebugEnabled()) {
			logger.debug("Recorded {} input / {} output tokens for {}: cost={} total={}",
					inputTokens, outputTokens, model, String.format("%.6f", cost), String.format("%.6f", totalCost));
		}
		return cost;
	}

	/**
	 * Whether adding the given call would push the ledger strictly above {@code budget}.
	 */
	public boolean wouldExceed(String model, long inputTokens, long outputTokens, double budget) {
		return totalCost + cost(model, inputTokens, outputTokens) > budget;
	}

	public double totalCost() {
		return totalCost;
	}

	public UsageSummary summary() {
		return new UsageSummary(totalCost, totalInputTokens, totalOutputTokens);
	}

	public void reset() {
		totalCost = 0.0;
		totalInputTokens = 0;
		totalOutputTokens = 0;
	}

	private static void requireNonNegative(long inputTokens, long outputTokens) {
		if (inputTokens < 0 || outputTokens < 0) {
			throw new IllegalArgumentException("token counts must be >= 0");
		}
	}
}
