package org.javai.vending;

import java.util.List;

/**
 * Sample strings covering the main valid and invalid cases.
 */
public final class Examples {

	public record Example(String input, String description, boolean expectedValid) {
	}

	public static final List<Example> ALL = List.of(
			new Example("{ $ $ $ R }", "3 coins, 1 purchase", true),
			new Example("{ $ { $ $ $ R } < }", "Nested block", true),
			new Example("{ $ $ $ $ $ $ $ $ $ R R R }", "9 coins, 3 purchases", true),
			new Example("{ $ R }", "Insufficient balance", false),
			new Example("{ $ { $ $ R } < }", "Insufficient balance in nested block", false),
			new Example("{ { { { $ $ $ R } } } }", "Exceeds nesting limit", false),
			new Example("{ < }", "No coins to return", false),
			new Example("{ $ $ $ $ R R R R }", "Insufficient balance after first purchase", false)
	);

	private Examples() {
		// Constants only
	}
}
