package org.javai.vending.render;

import org.javai.vending.tree.DerivationTree;

/**
 * Produces a textual view of a decorated derivation tree. Implementations never
 * modify the tree and return the same text for the same tree.
 */
public interface TreeRenderer {

	String render(DerivationTree tree);
}
