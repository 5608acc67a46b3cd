package org.javai.vending.syntax;

import org.javai.vending.diagnostic.Diagnostic;
import org.javai.vending.grammar.Grammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lexical and structural gate run before any derivation tree is built.
 * <p>
 * Checks are applied in a fixed order and the first violation is returned:
 * <ol>
 *   <li>the stripped input starts with '{' and ends with '}'</li>
 *   <li>braces are balanced, never closing more than were opened, and the first
 *       brace closes only at the end</li>
 *   <li>every character belongs to the grammar alphabet</li>
 * </ol>
 */
public class SyntaxValidator {

	private static final Logger logger = LoggerFactory.getLogger(SyntaxValidator.class);

	public SyntaxValidation validate(String input) {
		String stripped = input != null ? input.strip() : "";

		if (!stripped.startsWith("{") || !stripped.endsWith("}")) {
			return reject(stripped, Diagnostic.missingDelimiters());
		}

		int depth = 0;
		for (int pos = 0; pos < stripped.length(); pos++) {
			char c = stripped.charAt(pos);
			if (c == '{') {
				depth++;
			} else if (c == '}') {
				depth--;
				if (depth < 0) {
					return reject(stripped, Diagnostic.unbalancedBraces());
				}
				// The outer block must close on the last character
				if (depth == 0 && pos != stripped.length() - 1) {
					return reject(stripped, Diagnostic.unbalancedBraces());
				}
			}
		}
		if (depth != 0) {
			return reject(stripped, Diagnostic.unbalancedBraces());
		}

		for (int pos = 0; pos < stripped.length(); pos++) {
			char c = stripped.charAt(pos);
			if (!Grammar.inAlphabet(c)) {
				return reject(stripped, Diagnostic.invalidCharacter(c, pos));
			}
		}

		return SyntaxValidation.accepted(stripped);
	}

	private SyntaxValidation reject(String stripped, Diagnostic error) {
		logger.debug("Rejected '{}': {}", stripped, error.message());
		return SyntaxValidation.rejected(stripped, error);
	}
}
