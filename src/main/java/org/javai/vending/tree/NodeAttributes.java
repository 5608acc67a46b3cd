package org.javai.vending.tree;

import java.util.List;
import org.javai.vending.diagnostic.Diagnostic;

/**
 * Semantic attributes attached to a non-terminal node during decoration.
 *
 * @param balance coins available after the node's tokens
 * @param valid whether the node and everything beneath it passed the semantic rules
 * @param depth block nesting depth, starting at 1 for the top-level block
 * @param purchaseCount purchases made in the enclosing block after the node's tokens
 * @param errors diagnostics raised at or below this node, in the order they were raised
 */
public record NodeAttributes(int balance, boolean valid, int depth, int purchaseCount, List<Diagnostic> errors) {

	/** Attributes of a node that decoration never reached. */
	public static final NodeAttributes UNDECORATED = new NodeAttributes(0, true, 0, 0, List.of());

	public NodeAttributes {
		errors = errors != null ? List.copyOf(errors) : List.of();
	}
}
