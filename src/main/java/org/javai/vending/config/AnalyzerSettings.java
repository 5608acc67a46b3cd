package org.javai.vending.config;

import java.util.Objects;

/**
 * Limits and policies applied by the attribute evaluator.
 *
 * @param maxDepth deepest block nesting that is still valid
 * @param purchasePrice coins consumed by one purchase
 * @param purchaseQuota purchases allowed per block
 * @param coinValue coins added by an insert and removed by a return
 * @param finalBalancePolicy what the end of a content chain reports as its balance
 */
public record AnalyzerSettings(
		int maxDepth,
		int purchasePrice,
		int purchaseQuota,
		int coinValue,
		FinalBalancePolicy finalBalancePolicy
) {

	public static final AnalyzerSettings DEFAULTS = new AnalyzerSettings(3, 3, 3, 1, FinalBalancePolicy.RESET);

	public AnalyzerSettings {
		requirePositive("maxDepth", maxDepth);
		requirePositive("purchasePrice", purchasePrice);
		requirePositive("purchaseQuota", purchaseQuota);
		requirePositive("coinValue", coinValue);
		Objects.requireNonNull(finalBalancePolicy, "finalBalancePolicy must not be null");
	}

	public AnalyzerSettings withFinalBalancePolicy(FinalBalancePolicy policy) {
		return new AnalyzerSettings(maxDepth, purchasePrice, purchaseQuota, coinValue, policy);
	}

	private static void requirePositive(String name, int value) {
		if (value <= 0) {
			throw new IllegalArgumentException(name + " must be positive, was " + value);
		}
	}
}
