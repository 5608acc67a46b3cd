package org.javai.vending.tree;

import java.util.Objects;
import org.javai.vending.grammar.Grammar;
import org.javai.vending.grammar.GrammarSymbol;

/**
 * Builds the concrete derivation tree for an input that already passed
 * {@link org.javai.vending.syntax.SyntaxValidator}.
 * <p>
 * Each token of a block becomes an {@code A} node paired with a fresh {@code C} node
 * ({@code C → A C}), so the content of a block is a right-leaning chain of {@code C}
 * nodes closed by an {@code ε} leaf. Nested blocks are located with a brace-depth scan
 * and built recursively beneath {@code A → { C }}.
 */
public class TreeBuilder {

	public DerivationTree build(String validatedInput) {
		Objects.requireNonNull(validatedInput, "validatedInput must not be null");
		String input = validatedInput.strip();

		DerivationTree tree = new DerivationTree();
		DerivationNode root = tree.addRoot(Grammar.START);
		tree.attach(root, GrammarSymbol.OPEN_BRACE);
		DerivationNode content = tree.attach(root, GrammarSymbol.CONTENT);
		tree.attach(root, GrammarSymbol.CLOSE_BRACE);

		buildContent(tree, content, input.substring(1, input.length() - 1));
		tree.close();
		return tree;
	}

	private void buildContent(DerivationTree tree, DerivationNode content, String text) {
		DerivationNode current = content;
		int pos = skipSpaces(text, 0);

		while (pos < text.length()) {
			DerivationNode action = tree.attach(current, GrammarSymbol.ACTION);
			DerivationNode tail = tree.attach(current, GrammarSymbol.CONTENT);

			char c = text.charAt(pos);
			if (c == '{') {
				int close = matchingBrace(text, pos);
				tree.attach(action, GrammarSymbol.OPEN_BRACE);
				DerivationNode inner = tree.attach(action, GrammarSymbol.CONTENT);
				tree.attach(action, GrammarSymbol.CLOSE_BRACE);
				buildContent(tree, inner, text.substring(pos + 1, close));
				pos = close + 1;
			} else {
				GrammarSymbol terminal = GrammarSymbol.actionTerminal(c)
						.orElseThrow(() -> new IllegalStateException("Unexpected character '" + c + "' in validated input"));
				tree.attach(action, terminal);
				pos++;
			}

			pos = skipSpaces(text, pos);
			current = tail;
		}

		tree.attach(current, GrammarSymbol.EPSILON);
	}

	private int matchingBrace(String text, int open) {
		int depth = 0;
		for (int pos = open; pos < text.length(); pos++) {
			char c = text.charAt(pos);
			if (c == '{') {
				depth++;
			} else if (c == '}') {
				depth--;
				if (depth == 0) {
					return pos;
				}
			}
		}
		throw new IllegalStateException("No closing brace for block at position " + open);
	}

	private int skipSpaces(String text, int pos) {
		while (pos < text.length() && text.charAt(pos) == ' ') {
			pos++;
		}
		return pos;
	}
}
