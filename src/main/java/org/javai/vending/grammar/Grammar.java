package org.javai.vending.grammar;

import static org.javai.vending.grammar.GrammarSymbol.ACTION;
import static org.javai.vending.grammar.GrammarSymbol.CLOSE_BRACE;
import static org.javai.vending.grammar.GrammarSymbol.COIN;
import static org.javai.vending.grammar.GrammarSymbol.CONTENT;
import static org.javai.vending.grammar.GrammarSymbol.EPSILON;
import static org.javai.vending.grammar.GrammarSymbol.OPEN_BRACE;
import static org.javai.vending.grammar.GrammarSymbol.PROGRAM;
import static org.javai.vending.grammar.GrammarSymbol.PURCHASE;
import static org.javai.vending.grammar.GrammarSymbol.RETURN_COIN;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The fixed vending machine grammar:
 *
 * <pre>
 * P → { C }
 * C → A C | ε
 * A → $ | R | &lt; | { C }
 * </pre>
 */
public final class Grammar {

	public static final GrammarSymbol START = PROGRAM;

	public static final List<ProductionRule> PRODUCTIONS = List.of(
			new ProductionRule(PROGRAM, List.of(List.of(OPEN_BRACE, CONTENT, CLOSE_BRACE))),
			new ProductionRule(CONTENT, List.of(List.of(ACTION, CONTENT), List.of(EPSILON))),
			new ProductionRule(ACTION, List.of(
					List.of(COIN),
					List.of(PURCHASE),
					List.of(RETURN_COIN),
					List.of(OPEN_BRACE, CONTENT, CLOSE_BRACE)))
	);

	/** Characters allowed in an input string. */
	public static final Set<Character> ALPHABET = Set.of('{', '}', '$', 'R', '<', ' ');

	private Grammar() {
		// Constants only
	}

	public static boolean inAlphabet(char c) {
		return ALPHABET.contains(c);
	}

	/**
	 * Returns the productions one per line, in declaration order.
	 */
	public static String describe() {
		return PRODUCTIONS.stream()
				.map(ProductionRule::toString)
				.collect(Collectors.joining("\n"));
	}
}
