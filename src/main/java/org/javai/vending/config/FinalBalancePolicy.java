package org.javai.vending.config;

import java.util.Locale;

/**
 * What an {@code ε} leaf reports as the balance at the end of a content chain.
 */
public enum FinalBalancePolicy {

	/**
	 * {@code C → ε} yields balance 0 and purchase count 0, so every {@code C} node and the
	 * root report zero regardless of the coins left after the last token.
	 */
	RESET("reset"),

	/**
	 * {@code C → ε} passes through the balance and purchase count it inherited, so the
	 * root reports the coins actually left in the top-level block.
	 */
	CARRY("carry");

	private final String key;

	FinalBalancePolicy(String key) {
		this.key = key;
	}

	public String key() {
		return key;
	}

	public static FinalBalancePolicy fromKey(String key) {
		if (key == null) {
			throw new IllegalArgumentException("Final balance policy must not be null");
		}
		String normalized = key.trim().toLowerCase(Locale.ROOT);
		for (FinalBalancePolicy policy : values()) {
			if (policy.key.equals(normalized)) {
				return policy;
			}
		}
		throw new IllegalArgumentException("Unknown final balance policy: '" + key + "' (expected 'reset' or 'carry')");
	}
}
