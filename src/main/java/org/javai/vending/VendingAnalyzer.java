package org.javai.vending;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.vending.config.AnalyzerSettings;
import org.javai.vending.diagnostic.Diagnostic;
import org.javai.vending.semantic.AttributeEvaluator;
import org.javai.vending.syntax.SyntaxValidation;
import org.javai.vending.syntax.SyntaxValidator;
import org.javai.vending.tree.DerivationTree;
import org.javai.vending.tree.TreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates, builds and decorates the derivation tree of a vending machine string.
 * <p>
 * Example usage:
 *
 * <pre>
 * VendingAnalyzer analyzer = new VendingAnalyzer();
 * AnalysisResult result = analyzer.analyze("{ $ $ $ R }");
 * result.tree().ifPresent(tree -&gt; System.out.println(TreeRenderers.renderVisual(tree)));
 * </pre>
 *
 * An analyzer keeps no state between calls; every call builds its own tree and
 * diagnostic list.
 */
public class VendingAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(VendingAnalyzer.class);

	private final SyntaxValidator validator;
	private final TreeBuilder builder;
	private final AttributeEvaluator evaluator;

	public VendingAnalyzer() {
		this(AnalyzerSettings.DEFAULTS);
	}

	public VendingAnalyzer(AnalyzerSettings settings) {
		this(new SyntaxValidator(), new TreeBuilder(), new AttributeEvaluator(settings));
	}

	VendingAnalyzer(SyntaxValidator validator, TreeBuilder builder, AttributeEvaluator evaluator) {
		this.validator = Objects.requireNonNull(validator, "validator must not be null");
		this.builder = Objects.requireNonNull(builder, "builder must not be null");
		this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
	}

	public AnalysisResult analyze(String input) {
		logger.debug("Analyzing '{}'", input);

		SyntaxValidation validation = validator.validate(input);
		Optional<Diagnostic> failure = validation.failure();
		if (failure.isPresent()) {
			logger.debug("Syntax check failed: {}", failure.get().message());
			return AnalysisResult.syntaxFailure(failure.get());
		}

		DerivationTree tree = builder.build(validation.input());
		List<Diagnostic> errors = evaluator.decorate(tree);
		AnalysisResult result = AnalysisResult.decorated(tree, errors);

		logger.debug("'{}' is {} ({} nodes, {} diagnostics)",
				validation.input(), result.valid() ? "valid" : "invalid", tree.size(), errors.size());
		return result;
	}
}
