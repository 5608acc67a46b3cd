package org.javai.vending;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.vending.diagnostic.Diagnostic;
import org.javai.vending.tree.DerivationTree;

/**
 * Outcome of analyzing one input string.
 *
 * @param tree the decorated derivation tree; empty only when the input failed the syntax check
 * @param valid whether the input is both well formed and semantically valid
 * @param globalErrors every diagnostic, once each, in the order it was raised
 */
public record AnalysisResult(Optional<DerivationTree> tree, boolean valid, List<Diagnostic> globalErrors) {

	public AnalysisResult {
		Objects.requireNonNull(tree, "tree must not be null");
		globalErrors = globalErrors != null ? List.copyOf(globalErrors) : List.of();
	}

	static AnalysisResult syntaxFailure(Diagnostic error) {
		return new AnalysisResult(Optional.empty(), false, List.of(error));
	}

	static AnalysisResult decorated(DerivationTree tree, List<Diagnostic> errors) {
		boolean valid = tree.root().valid() && errors.isEmpty();
		return new AnalysisResult(Optional.of(tree), valid, errors);
	}

	public boolean hasTree() {
		return tree.isPresent();
	}

	public List<String> errorMessages() {
		return globalErrors.stream().map(Diagnostic::message).toList();
	}
}
