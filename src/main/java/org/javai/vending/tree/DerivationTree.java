package org.javai.vending.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.vending.grammar.GrammarSymbol;

/**
 * Concrete derivation tree for one input string.
 * <p>
 * All nodes live in a single list owned by the tree; nodes refer to their parent and
 * children by index. The shape is fixed once {@link TreeBuilder} returns and the
 * attributes are fixed once decoration completes, after which the tree is read-only.
 */
public final class DerivationTree {

	private final List<DerivationNode> nodes = new ArrayList<>();
	private boolean closed;

	DerivationTree() {
	}

	DerivationNode addRoot(GrammarSymbol symbol) {
		if (!nodes.isEmpty()) {
			throw new IllegalStateException("Tree already has a root");
		}
		DerivationNode root = new DerivationNode(0, symbol, DerivationNode.NO_PARENT);
		nodes.add(root);
		return root;
	}

	DerivationNode attach(DerivationNode parent, GrammarSymbol symbol) {
		if (closed) {
			throw new IllegalStateException("Tree structure is closed");
		}
		Objects.requireNonNull(parent, "parent must not be null");
		DerivationNode child = new DerivationNode(nodes.size(), symbol, parent.index());
		nodes.add(child);
		parent.addChild(child.index());
		return child;
	}

	void close() {
		this.closed = true;
	}

	/**
	 * Whether decoration has completed. The root is the last node an evaluation pass
	 * decorates, so the tree is decorated exactly when its root is.
	 */
	public boolean isDecorated() {
		return !nodes.isEmpty() && root().isDecorated();
	}

	public DerivationNode root() {
		if (nodes.isEmpty()) {
			throw new IllegalStateException("Tree is empty");
		}
		return nodes.get(0);
	}

	public DerivationNode node(int index) {
		return nodes.get(index);
	}

	public int size() {
		return nodes.size();
	}

	public List<DerivationNode> children(DerivationNode node) {
		List<DerivationNode> children = new ArrayList<>();
		for (int childIndex : node.childIndices()) {
			children.add(nodes.get(childIndex));
		}
		return List.copyOf(children);
	}

	public Optional<DerivationNode> parent(DerivationNode node) {
		return node.isRoot() ? Optional.empty() : Optional.of(nodes.get(node.parentIndex()));
	}

	/**
	 * Identifies the production applied at {@code node}.
	 *
	 * @throws IllegalStateException if the node's children do not match any production
	 */
	public Derivation derivation(DerivationNode node) {
		List<DerivationNode> children = children(node);
		return switch (node.symbol()) {
			case PROGRAM -> {
				requireShape(node, children.size() == 3);
				yield new Derivation.Program(children.get(1));
			}
			case CONTENT -> {
				if (children.size() == 1 && children.get(0).symbol() == GrammarSymbol.EPSILON) {
					yield new Derivation.EmptyContent();
				}
				requireShape(node, children.size() == 2);
				yield new Derivation.TokenChain(children.get(0), children.get(1));
			}
			case ACTION -> {
				if (children.size() == 3) {
					yield new Derivation.Block(children.get(1));
				}
				requireShape(node, children.size() == 1);
				yield switch (children.get(0).symbol()) {
					case COIN -> new Derivation.Insert();
					case PURCHASE -> new Derivation.Purchase();
					case RETURN_COIN -> new Derivation.Return();
					default -> throw malformed(node);
				};
			}
			default -> new Derivation.Leaf(node.symbol());
		};
	}

	/**
	 * Terminal leaves in left-to-right order.
	 */
	public List<GrammarSymbol> leaves() {
		List<GrammarSymbol> leaves = new ArrayList<>();
		collectLeaves(root(), leaves);
		return leaves;
	}

	private void collectLeaves(DerivationNode node, List<GrammarSymbol> leaves) {
		if (node.isTerminal()) {
			leaves.add(node.symbol());
			return;
		}
		for (DerivationNode child : children(node)) {
			collectLeaves(child, leaves);
		}
	}

	private static void requireShape(DerivationNode node, boolean condition) {
		if (!condition) {
			throw malformed(node);
		}
	}

	private static IllegalStateException malformed(DerivationNode node) {
		return new IllegalStateException("Node " + node.index() + " (" + node.symbol() + ") matches no production");
	}
}
