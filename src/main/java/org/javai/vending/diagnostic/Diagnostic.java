package org.javai.vending.diagnostic;

import java.util.Objects;

/**
 * A single problem found while analyzing an input string.
 *
 * @param kind what went wrong
 * @param message human-readable description, including the values involved
 */
public record Diagnostic(DiagnosticKind kind, String message) {

	public Diagnostic {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(message, "message must not be null");
	}

	public static Diagnostic missingDelimiters() {
		return new Diagnostic(DiagnosticKind.MISSING_DELIMITERS,
				"Input must start with '{' and end with '}'");
	}

	public static Diagnostic unbalancedBraces() {
		return new Diagnostic(DiagnosticKind.UNBALANCED_BRACES, "Unbalanced braces");
	}

	public static Diagnostic invalidCharacter(char c, int position) {
		return new Diagnostic(DiagnosticKind.INVALID_CHARACTER,
				"Invalid character: '" + c + "' at position " + position);
	}

	public static Diagnostic insufficientBalance(int have, int need) {
		return new Diagnostic(DiagnosticKind.INSUFFICIENT_BALANCE,
				"Insufficient balance to purchase (balance: " + have + ", required: " + need + ")");
	}

	public static Diagnostic purchaseQuotaExceeded(int limit) {
		return new Diagnostic(DiagnosticKind.PURCHASE_QUOTA_EXCEEDED,
				"Exceeds the maximum of " + limit + " purchases per block");
	}

	public static Diagnostic noCoinToReturn() {
		return new Diagnostic(DiagnosticKind.NO_COIN_TO_RETURN, "No coins to return");
	}

	public static Diagnostic nestingLimitExceeded(int depth, int limit) {
		return new Diagnostic(DiagnosticKind.NESTING_LIMIT_EXCEEDED,
				"Exceeds the nesting limit of " + limit + " levels (depth " + depth + ")");
	}

	@Override
	public String toString() {
		return message;
	}
}
