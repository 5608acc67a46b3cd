package org.javai.vending.grammar;

import java.util.Optional;

/**
 * The symbols of the vending machine grammar.
 * <p>
 * Non-terminals are {@code P} (program), {@code C} (content) and {@code A} (action).
 * Terminals are the two braces, the three action characters and {@code ε}, which
 * terminates every content chain.
 */
public enum GrammarSymbol {

	PROGRAM("P", Kind.NON_TERMINAL),
	CONTENT("C", Kind.NON_TERMINAL),
	ACTION("A", Kind.NON_TERMINAL),
	OPEN_BRACE("{", Kind.TERMINAL),
	CLOSE_BRACE("}", Kind.TERMINAL),
	COIN("$", Kind.TERMINAL),
	PURCHASE("R", Kind.TERMINAL),
	RETURN_COIN("<", Kind.TERMINAL),
	EPSILON("ε", Kind.TERMINAL);

	public enum Kind {
		TERMINAL,
		NON_TERMINAL
	}

	private final String text;
	private final Kind kind;

	GrammarSymbol(String text, Kind kind) {
		this.text = text;
		this.kind = kind;
	}

	public String text() {
		return text;
	}

	public Kind kind() {
		return kind;
	}

	public boolean isTerminal() {
		return kind == Kind.TERMINAL;
	}

	/**
	 * Looks up the single-character action terminal ({@code $}, {@code R} or {@code <})
	 * written as {@code c}.
	 */
	public static Optional<GrammarSymbol> actionTerminal(char c) {
		return switch (c) {
			case '$' -> Optional.of(COIN);
			case 'R' -> Optional.of(PURCHASE);
			case '<' -> Optional.of(RETURN_COIN);
			default -> Optional.empty();
		};
	}

	@Override
	public String toString() {
		return text;
	}
}
