package org.javai.promptlearning.pricing;

/**
 * Snapshot of a {@link PricingCalculator} ledger.
 *
 * @param totalCost accumulated cost in currency units
 * @param totalInputTokens accumulated prompt tokens
 * @param totalOutputTokens accumulated completion tokens
 */
public record UsageSummary(double totalCost, long totalInputTokens, long totalOutputTokens) {

	public static UsageSummary empty() {
		return new UsageSummary(0.0, 0, 0);
	}

	public long totalTokens() {
		return totalInputTokens + totalOutputTokens;
	}
}
