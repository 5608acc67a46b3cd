package org.javai.vending.syntax;

import java.util.Objects;
import java.util.Optional;
import org.javai.vending.diagnostic.Diagnostic;

/**
 * Outcome of a syntax check.
 *
 * @param input the whitespace-stripped input that was checked
 * @param error the first violation found, or {@code null} when the input is well formed
 */
public record SyntaxValidation(String input, Diagnostic error) {

	public SyntaxValidation {
		Objects.requireNonNull(input, "input must not be null");
	}

	static SyntaxValidation accepted(String input) {
		return new SyntaxValidation(input, null);
	}

	static SyntaxValidation rejected(String input, Diagnostic error) {
		return new SyntaxValidation(input, Objects.requireNonNull(error, "error must not be null"));
	}

	public boolean isValid() {
		return error == null;
	}

	public Optional<Diagnostic> failure() {
		return Optional.ofNullable(error);
	}
}
