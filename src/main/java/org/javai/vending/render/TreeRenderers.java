package org.javai.vending.render;

import org.javai.vending.tree.DerivationNode;
import org.javai.vending.tree.DerivationTree;

/**
 * Static entry points for the two tree views.
 */
public final class TreeRenderers {

	private TreeRenderers() {
		// Utility class - no instantiation
	}

	public static String renderVisual(DerivationTree tree) {
		return new VisualTreeRenderer().render(tree);
	}

	public static String renderIndented(DerivationTree tree) {
		return new IndentedTreeRenderer().render(tree);
	}

	static String attributeText(DerivationNode node) {
		return "balance=" + node.balance()
				+ ", valid=" + node.valid()
				+ ", depth=" + node.depth()
				+ ", purchases=" + node.purchaseCount();
	}
}
