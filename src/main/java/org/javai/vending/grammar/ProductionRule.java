package org.javai.vending.grammar;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A grammar production with all of its alternatives, e.g. {@code C → A C | ε}.
 *
 * @param head the non-terminal being rewritten
 * @param alternatives the right-hand sides, in declaration order
 */
public record ProductionRule(GrammarSymbol head, List<List<GrammarSymbol>> alternatives) {

	public ProductionRule {
		Objects.requireNonNull(head, "head must not be null");
		if (head.isTerminal()) {
			throw new IllegalArgumentException("Production head must be a non-terminal: " + head);
		}
		alternatives = alternatives != null
				? alternatives.stream().map(List::copyOf).toList()
				: List.of();
	}

	@Override
	public String toString() {
		return head.text() + " → " + alternatives.stream()
				.map(rhs -> rhs.stream().map(GrammarSymbol::text).collect(Collectors.joining(" ")))
				.collect(Collectors.joining(" | "));
	}
}
