package org.javai.vending.render;

import java.util.ArrayList;
import java.util.List;
import org.javai.vending.diagnostic.Diagnostic;
import org.javai.vending.tree.DerivationNode;
import org.javai.vending.tree.DerivationTree;

/**
 * Renders a tree with box-drawing connectors:
 *
 * <pre>
 * P[balance=0, valid=true, depth=1, purchases=0]
 * ├── {
 * ├── C[balance=0, valid=true, depth=1, purchases=0]
 * │   └── ε
 * └── }
 * </pre>
 */
public class VisualTreeRenderer implements TreeRenderer {

	static final String BRANCH = "├── ";
	static final String LAST_BRANCH = "└── ";
	static final String PIPE = "│   ";
	static final String SPACE = "    ";
	static final String ERROR_MARKER = "⚠ ERROR: ";

	@Override
	public String render(DerivationTree tree) {
		List<String> lines = new ArrayList<>();
		renderRoot(tree, lines);
		return String.join("\n", lines);
	}

	private void renderRoot(DerivationTree tree, List<String> lines) {
		DerivationNode root = tree.root();
		lines.add(label(root));
		appendErrors(root, SPACE, lines);
		renderChildren(tree, root, "", lines);
	}

	private void renderNode(DerivationTree tree, DerivationNode node, String prefix, boolean last, List<String> lines) {
		lines.add(prefix + (last ? LAST_BRANCH : BRANCH) + label(node));
		String childPrefix = prefix + (last ? SPACE : PIPE);
		appendErrors(node, childPrefix, lines);
		renderChildren(tree, node, childPrefix, lines);
	}

	private void renderChildren(DerivationTree tree, DerivationNode node, String prefix, List<String> lines) {
		List<DerivationNode> children = tree.children(node);
		for (int i = 0; i < children.size(); i++) {
			renderNode(tree, children.get(i), prefix, i == children.size() - 1, lines);
		}
	}

	private void appendErrors(DerivationNode node, String prefix, List<String> lines) {
		if (node.isTerminal()) {
			return;
		}
		for (Diagnostic error : node.errors()) {
			lines.add(prefix + ERROR_MARKER + error.message());
		}
	}

	private String label(DerivationNode node) {
		if (node.isTerminal()) {
			return node.symbol().text();
		}
		return node.symbol().text() + "[" + TreeRenderers.attributeText(node) + "]";
	}
}
