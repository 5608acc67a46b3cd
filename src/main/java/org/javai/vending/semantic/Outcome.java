package org.javai.vending.semantic;

import java.util.ArrayList;
import java.util.List;
import org.javai.vending.diagnostic.Diagnostic;

/**
 * Synthesized result of decorating one node.
 */
record Outcome(ChainState state, boolean valid, List<Diagnostic> errors) {

	Outcome {
		errors = List.copyOf(errors);
	}

	static Outcome ok(ChainState state) {
		return new Outcome(state, true, List.of());
	}

	static Outcome failed(ChainState state, Diagnostic error) {
		return new Outcome(state, false, List.of(error));
	}

	/**
	 * Combines this outcome with the one that follows it in a chain: the state is taken
	 * from {@code next}, validity is the conjunction and errors keep their order.
	 */
	Outcome then(Outcome next) {
		List<Diagnostic> combined = new ArrayList<>(errors);
		combined.addAll(next.errors);
		return new Outcome(next.state, valid && next.valid, combined);
	}
}
