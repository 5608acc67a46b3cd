package org.javai.vending.semantic;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.vending.config.AnalyzerSettings;
import org.javai.vending.config.FinalBalancePolicy;
import org.javai.vending.diagnostic.Diagnostic;
import org.javai.vending.tree.Derivation;
import org.javai.vending.tree.DerivationNode;
import org.javai.vending.tree.DerivationTree;
import org.javai.vending.tree.NodeAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates a derivation tree with its semantic attributes in one recursive pass.
 * <p>
 * The balance and purchase count before a token are inherited attributes and travel
 * down as a {@link ChainState} argument; the state after the token, the validity and
 * the diagnostics are synthesized and returned as an {@link Outcome}. Rules per production:
 * <ul>
 *   <li>{@code P → { C }}: the program takes the content's outcome.</li>
 *   <li>{@code C → ε}: valid; balance and count reset to zero, or carried through
 *       under {@link FinalBalancePolicy#CARRY}.</li>
 *   <li>{@code C → A C}: the action runs on the inherited state, the tail on the action's
 *       result; validity is the conjunction and errors keep their order.</li>
 *   <li>{@code A → $}: adds one coin.</li>
 *   <li>{@code A → R}: needs the purchase price in balance, then a free slot in the
 *       block's purchase quota. The balance check comes first.</li>
 *   <li>{@code A → <}: needs a coin to give back.</li>
 *   <li>{@code A → { C }}: the nested content starts from an empty state one level deeper.
 *       Its validity and errors propagate up, its balance and count do not.</li>
 * </ul>
 * A node deeper than {@link AnalyzerSettings#maxDepth()} is invalid and its descendants
 * are left undecorated.
 */
public class AttributeEvaluator {

	private static final Logger logger = LoggerFactory.getLogger(AttributeEvaluator.class);

	static final int TOP_LEVEL_DEPTH = 1;

	private final AnalyzerSettings settings;

	public AttributeEvaluator() {
		this(AnalyzerSettings.DEFAULTS);
	}

	public AttributeEvaluator(AnalyzerSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	/**
	 * Decorates every reachable node of {@code tree}.
	 *
	 * @return every diagnostic raised, once each, in the order raised
	 * @throws IllegalStateException if the tree was already decorated
	 */
	public List<Diagnostic> decorate(DerivationTree tree) {
		Objects.requireNonNull(tree, "tree must not be null");
		if (tree.isDecorated()) {
			throw new IllegalStateException("Tree is already decorated");
		}
		Pass pass = new Pass(tree);
		pass.decorate(tree.root(), TOP_LEVEL_DEPTH, ChainState.EMPTY);
		return List.copyOf(pass.diagnostics);
	}

	/**
	 * State of a single decoration run.
	 */
	private final class Pass {

		private final DerivationTree tree;
		private final List<Diagnostic> diagnostics = new ArrayList<>();

		Pass(DerivationTree tree) {
			this.tree = tree;
		}

		Outcome decorate(DerivationNode node, int depth, ChainState before) {
			if (depth > settings.maxDepth()) {
				logger.debug("Node {} ({}) at depth {} exceeds nesting limit {}",
						node.index(), node.symbol(), depth, settings.maxDepth());
				return commit(node, depth, Outcome.failed(before,
						raise(Diagnostic.nestingLimitExceeded(depth, settings.maxDepth()))));
			}

			Derivation derivation = tree.derivation(node);
			Outcome outcome;
			if (derivation instanceof Derivation.Program program) {
				outcome = decorate(program.content(), depth, ChainState.EMPTY);
			} else if (derivation instanceof Derivation.EmptyContent) {
				outcome = Outcome.ok(settings.finalBalancePolicy() == FinalBalancePolicy.CARRY
						? before
						: ChainState.EMPTY);
			} else if (derivation instanceof Derivation.TokenChain chain) {
				Outcome action = decorate(chain.action(), depth, before);
				outcome = action.then(decorate(chain.tail(), depth, action.state()));
			} else if (derivation instanceof Derivation.Insert) {
				outcome = Outcome.ok(new ChainState(before.balance() + settings.coinValue(), before.purchaseCount()));
			} else if (derivation instanceof Derivation.Purchase) {
				outcome = purchase(before);
			} else if (derivation instanceof Derivation.Return) {
				outcome = before.balance() < settings.coinValue()
						? Outcome.failed(before, raise(Diagnostic.noCoinToReturn()))
						: Outcome.ok(new ChainState(before.balance() - settings.coinValue(), before.purchaseCount()));
			} else if (derivation instanceof Derivation.Block block) {
				Outcome inner = decorate(block.content(), depth + 1, ChainState.EMPTY);
				outcome = new Outcome(before, inner.valid(), inner.errors());
			} else {
				throw new IllegalStateException("Terminal '" + node.symbol() + "' cannot be decorated");
			}
			return commit(node, depth, outcome);
		}

		private Outcome purchase(ChainState before) {
			if (before.balance() < settings.purchasePrice()) {
				return Outcome.failed(before,
						raise(Diagnostic.insufficientBalance(before.balance(), settings.purchasePrice())));
			}
			if (before.purchaseCount() >= settings.purchaseQuota()) {
				return Outcome.failed(before, raise(Diagnostic.purchaseQuotaExceeded(settings.purchaseQuota())));
			}
			return Outcome.ok(new ChainState(
					before.balance() - settings.purchasePrice(),
					before.purchaseCount() + 1));
		}

		private Diagnostic raise(Diagnostic diagnostic) {
			diagnostics.add(diagnostic);
			return diagnostic;
		}

		private Outcome commit(DerivationNode node, int depth, Outcome outcome) {
			node.decorate(new NodeAttributes(
					outcome.state().balance(),
					outcome.valid(),
					depth,
					outcome.state().purchaseCount(),
					outcome.errors()));
			return outcome;
		}
	}
}
