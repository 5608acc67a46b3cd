package org.javai.vending.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.vending.grammar.GrammarSymbol.ACTION;
import static org.javai.vending.grammar.GrammarSymbol.CLOSE_BRACE;
import static org.javai.vending.grammar.GrammarSymbol.COIN;
import static org.javai.vending.grammar.GrammarSymbol.CONTENT;
import static org.javai.vending.grammar.GrammarSymbol.EPSILON;
import static org.javai.vending.grammar.GrammarSymbol.OPEN_BRACE;
import static org.javai.vending.grammar.GrammarSymbol.PROGRAM;
import static org.javai.vending.grammar.GrammarSymbol.PURCHASE;
import static org.javai.vending.grammar.GrammarSymbol.RETURN_COIN;

import java.util.List;
import java.util.stream.Collectors;
import org.javai.vending.grammar.GrammarSymbol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("TreeBuilder")
class TreeBuilderTest {

	private final TreeBuilder builder = new TreeBuilder();

	@Nested
	@DisplayName("Shape")
	class Shape {

		@Test
		@DisplayName("empty program derives C → ε")
		void emptyProgram() {
			DerivationTree tree = builder.build("{ }");
			DerivationNode root = tree.root();

			assertThat(root.symbol()).isEqualTo(PROGRAM);
			assertThat(symbols(tree, root)).containsExactly(OPEN_BRACE, CONTENT, CLOSE_BRACE);
			assertThat(symbols(tree, tree.children(root).get(1))).containsExactly(EPSILON);
			assertThat(tree.size()).isEqualTo(5);
		}

		@Test
		@DisplayName("tokens form a right-leaning chain closed by ε")
		void rightLeaningChain() {
			DerivationTree tree = builder.build("{ $ R < }");
			DerivationNode content = tree.children(tree.root()).get(1);

			for (GrammarSymbol expected : List.of(COIN, PURCHASE, RETURN_COIN)) {
				List<DerivationNode> children = tree.children(content);
				assertThat(children).extracting(DerivationNode::symbol).containsExactly(ACTION, CONTENT);
				assertThat(symbols(tree, children.get(0))).containsExactly(expected);
				content = children.get(1);
			}
			assertThat(symbols(tree, content)).containsExactly(EPSILON);
		}

		@Test
		@DisplayName("nested block becomes A → { C }")
		void nestedBlock() {
			DerivationTree tree = builder.build("{ { $ } }");
			DerivationNode content = tree.children(tree.root()).get(1);
			DerivationNode block = tree.children(content).get(0);

			assertThat(symbols(tree, block)).containsExactly(OPEN_BRACE, CONTENT, CLOSE_BRACE);
			DerivationNode inner = tree.children(block).get(1);
			assertThat(symbols(tree, inner)).containsExactly(ACTION, CONTENT);
			assertThat(symbols(tree, tree.children(content).get(1))).containsExactly(EPSILON);
		}

		@Test
		@DisplayName("blank nested block still ends in ε")
		void blankNestedBlock() {
			DerivationTree tree = builder.build("{ $ {   } }");
			DerivationNode content = tree.children(tree.root()).get(1);
			DerivationNode secondAction = tree.children(tree.children(content).get(1)).get(0);
			DerivationNode inner = tree.children(secondAction).get(1);

			assertThat(symbols(tree, inner)).containsExactly(EPSILON);
		}

		@Test
		@DisplayName("spaces between tokens are optional")
		void spacesOptional() {
			assertThat(builder.build("{$${R}<}").leaves())
					.isEqualTo(builder.build("{ $ $ { R } < }").leaves());
		}
	}

	@Nested
	@DisplayName("Arena links")
	class Links {

		@Test
		@DisplayName("every child points back to its parent")
		void parentLinks() {
			DerivationTree tree = builder.build("{ $ { R { < } } $ }");

			assertThat(tree.parent(tree.root())).isEmpty();
			for (int i = 0; i < tree.size(); i++) {
				DerivationNode node = tree.node(i);
				for (DerivationNode child : tree.children(node)) {
					assertThat(tree.parent(child)).contains(node);
				}
			}
		}

		@Test
		@DisplayName("structure is closed after building")
		void closedAfterBuild() {
			DerivationTree tree = builder.build("{ $ }");

			assertThatThrownBy(() -> tree.attach(tree.root(), COIN))
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("closed");
		}
	}

	@Nested
	@DisplayName("Derivations")
	class Derivations {

		@Test
		@DisplayName("identifies the production applied at each node")
		void identifiesProductions() {
			DerivationTree tree = builder.build("{ $ { R } < }");
			DerivationNode content = ((Derivation.Program) tree.derivation(tree.root())).content();

			Derivation.TokenChain first = (Derivation.TokenChain) tree.derivation(content);
			assertThat(tree.derivation(first.action())).isInstanceOf(Derivation.Insert.class);

			Derivation.TokenChain second = (Derivation.TokenChain) tree.derivation(first.tail());
			Derivation.Block block = (Derivation.Block) tree.derivation(second.action());
			Derivation.TokenChain blockChain = (Derivation.TokenChain) tree.derivation(block.content());
			assertThat(tree.derivation(blockChain.action())).isInstanceOf(Derivation.Purchase.class);

			Derivation.TokenChain third = (Derivation.TokenChain) tree.derivation(second.tail());
			assertThat(tree.derivation(third.action())).isInstanceOf(Derivation.Return.class);
			assertThat(tree.derivation(third.tail())).isInstanceOf(Derivation.EmptyContent.class);
		}

		@Test
		@DisplayName("terminals derive nothing")
		void terminals() {
			DerivationTree tree = builder.build("{ }");

			assertThat(tree.derivation(tree.children(tree.root()).get(0)))
					.isEqualTo(new Derivation.Leaf(OPEN_BRACE));
		}
	}

	@ParameterizedTest
	@ValueSource(strings = {"{ }", "{ $ $ $ R }", "{ $ { $ $ $ R } < }", "{ { { { $ $ $ R } } } }", "{ R<$ {{}} $ }"})
	@DisplayName("token leaves spell out the input")
	void leavesMatchInputTokens(String input) {
		String tokens = builder.build(input).leaves().stream()
				.filter(symbol -> symbol != OPEN_BRACE && symbol != CLOSE_BRACE && symbol != EPSILON)
				.map(GrammarSymbol::text)
				.collect(Collectors.joining());

		assertThat(tokens).isEqualTo(input.replaceAll("[ {}]", ""));
	}

	private static List<GrammarSymbol> symbols(DerivationTree tree, DerivationNode node) {
		return tree.children(node).stream().map(DerivationNode::symbol).toList();
	}
}
