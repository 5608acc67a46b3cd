package org.javai.vending.diagnostic;

/**
 * Categories of problems reported by an analysis.
 */
public enum DiagnosticKind {

	MISSING_DELIMITERS(Tier.SYNTAX),
	UNBALANCED_BRACES(Tier.SYNTAX),
	INVALID_CHARACTER(Tier.SYNTAX),

	INSUFFICIENT_BALANCE(Tier.SEMANTIC),
	PURCHASE_QUOTA_EXCEEDED(Tier.SEMANTIC),
	NO_COIN_TO_RETURN(Tier.SEMANTIC),
	NESTING_LIMIT_EXCEEDED(Tier.SEMANTIC);

	public enum Tier {
		/** Found before any tree is built; aborts the analysis. */
		SYNTAX,
		/** Found while decorating a complete tree. */
		SEMANTIC
	}

	private final Tier tier;

	DiagnosticKind(Tier tier) {
		this.tier = tier;
	}

	public Tier tier() {
		return tier;
	}

	public boolean isSyntax() {
		return tier == Tier.SYNTAX;
	}
}
