package org.javai.vending.render;

import java.util.ArrayList;
import java.util.List;
import org.javai.vending.diagnostic.Diagnostic;
import org.javai.vending.tree.DerivationNode;
import org.javai.vending.tree.DerivationTree;

/**
 * Renders a tree as an outline, one indentation step per tree level, with each node's
 * errors one step further in.
 */
public class IndentedTreeRenderer implements TreeRenderer {

	private final int indentSize;

	public IndentedTreeRenderer() {
		this(2);
	}

	public IndentedTreeRenderer(int indentSize) {
		if (indentSize < 0) {
			throw new IllegalArgumentException("indentSize must not be negative");
		}
		this.indentSize = indentSize;
	}

	@Override
	public String render(DerivationTree tree) {
		List<String> lines = new ArrayList<>();
		renderNode(tree, tree.root(), 0, lines);
		return String.join("\n", lines);
	}

	private void renderNode(DerivationTree tree, DerivationNode node, int level, List<String> lines) {
		String indent = indent(level);
		if (node.isTerminal()) {
			lines.add(indent + node.symbol().text());
		} else {
			lines.add(indent + node.symbol().text() + " (" + TreeRenderers.attributeText(node) + ")");
			String errorIndent = indent(level + 1);
			for (Diagnostic error : node.errors()) {
				lines.add(errorIndent + "ERROR: " + error.message());
			}
		}
		for (DerivationNode child : tree.children(node)) {
			renderNode(tree, child, level + 1, lines);
		}
	}

	private String indent(int level) {
		return " ".repeat(level * indentSize);
	}
}
