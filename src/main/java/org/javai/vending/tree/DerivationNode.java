package org.javai.vending.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.javai.vending.diagnostic.Diagnostic;
import org.javai.vending.grammar.GrammarSymbol;

/**
 * One vertex of a {@link DerivationTree}.
 * <p>
 * Nodes do not reference each other directly. The parent and children are stored as
 * indices into the owning tree, which resolves them.
 */
public final class DerivationNode {

	static final int NO_PARENT = -1;

	private final int index;
	private final GrammarSymbol symbol;
	private final int parentIndex;
	private final List<Integer> childIndices = new ArrayList<>();
	private NodeAttributes attributes = NodeAttributes.UNDECORATED;
	private boolean decorated;

	DerivationNode(int index, GrammarSymbol symbol, int parentIndex) {
		this.index = index;
		this.symbol = Objects.requireNonNull(symbol, "symbol must not be null");
		this.parentIndex = parentIndex;
	}

	public int index() {
		return index;
	}

	public GrammarSymbol symbol() {
		return symbol;
	}

	public boolean isTerminal() {
		return symbol.isTerminal();
	}

	public boolean isRoot() {
		return parentIndex == NO_PARENT;
	}

	int parentIndex() {
		return parentIndex;
	}

	List<Integer> childIndices() {
		return Collections.unmodifiableList(childIndices);
	}

	void addChild(int childIndex) {
		childIndices.add(childIndex);
	}

	public NodeAttributes attributes() {
		return attributes;
	}

	public boolean isDecorated() {
		return decorated;
	}

	/**
	 * Records the synthesized attributes of this node. Each node is decorated at most once.
	 *
	 * @throws IllegalStateException if the node is a terminal or already carries attributes
	 */
	public void decorate(NodeAttributes attributes) {
		Objects.requireNonNull(attributes, "attributes must not be null");
		if (isTerminal()) {
			throw new IllegalStateException("Terminal '" + symbol + "' carries no attributes");
		}
		if (decorated) {
			throw new IllegalStateException("Node " + index + " (" + symbol + ") is already decorated");
		}
		this.attributes = attributes;
		this.decorated = true;
	}

	// Convenience accessors used by the renderers

	public int balance() {
		return attributes.balance();
	}

	public boolean valid() {
		return attributes.valid();
	}

	public int depth() {
		return attributes.depth();
	}

	public int purchaseCount() {
		return attributes.purchaseCount();
	}

	public List<Diagnostic> errors() {
		return attributes.errors();
	}

	@Override
	public String toString() {
		return isTerminal()
				? symbol.text()
				: symbol.text() + "(balance=" + balance() + ", valid=" + valid() + ", depth=" + depth()
						+ ", purchases=" + purchaseCount() + ")";
	}
}
