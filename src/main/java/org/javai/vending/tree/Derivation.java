package org.javai.vending.tree;

import org.javai.vending.grammar.GrammarSymbol;

/**
 * The production applied at a node, with the children that production introduced.
 * Sealed so that decoration can account for every case.
 * <ul>
 *   <li>{@link Program} - {@code P → { C }}</li>
 *   <li>{@link EmptyContent} - {@code C → ε}</li>
 *   <li>{@link TokenChain} - {@code C → A C}</li>
 *   <li>{@link Insert}, {@link Purchase}, {@link Return} - {@code A → $ | R | <}</li>
 *   <li>{@link Block} - {@code A → { C }}</li>
 *   <li>{@link Leaf} - a terminal, which derives nothing</li>
 * </ul>
 */
public sealed interface Derivation {

	record Program(DerivationNode content) implements Derivation {
	}

	record EmptyContent() implements Derivation {
	}

	/**
	 * @param action the {@code A} node for the first token
	 * @param tail the {@code C} node holding the remaining tokens
	 */
	record TokenChain(DerivationNode action, DerivationNode tail) implements Derivation {
	}

	record Insert() implements Derivation {
	}

	record Purchase() implements Derivation {
	}

	record Return() implements Derivation {
	}

	/**
	 * @param content the {@code C} node of the nested block
	 */
	record Block(DerivationNode content) implements Derivation {
	}

	record Leaf(GrammarSymbol symbol) implements Derivation {
	}
}
