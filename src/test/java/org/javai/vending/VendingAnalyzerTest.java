package org.javai.vending;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.stream.Stream;
import org.apache.logging.log4j.Level;
import org.javai.vending.config.AnalyzerSettings;
import org.javai.vending.config.FinalBalancePolicy;
import org.javai.vending.diagnostic.Diagnostic;
import org.javai.vending.diagnostic.DiagnosticKind;
import org.javai.vending.render.TreeRenderers;
import org.javai.vending.syntax.SyntaxValidation;
import org.javai.vending.syntax.SyntaxValidator;
import org.javai.vending.testsupport.LogCaptorAppender;
import org.javai.vending.tree.DerivationTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("VendingAnalyzer")
class VendingAnalyzerTest {

	private final VendingAnalyzer analyzer = new VendingAnalyzer();

	static Stream<Examples.Example> examples() {
		return Examples.ALL.stream();
	}

	@ParameterizedTest
	@MethodSource("examples")
	@DisplayName("built-in examples have their expected validity")
	void examplesMatchExpectation(Examples.Example example) {
		AnalysisResult result = analyzer.analyze(example.input());

		assertThat(result.valid()).as(example.description()).isEqualTo(example.expectedValid());
		assertThat(result.hasTree()).isTrue();
		assertThat(result.globalErrors().isEmpty()).isEqualTo(example.expectedValid());
	}

	@Nested
	@DisplayName("Scenarios")
	class Scenarios {

		@Test
		@DisplayName("insufficient balance reports what was available")
		void insufficientBalance() {
			assertThat(analyzer.analyze("{ $ R }").globalErrors())
					.containsExactly(Diagnostic.insufficientBalance(1, 3));
		}

		@Test
		@DisplayName("failure inside a nested block invalidates the analysis")
		void nestedFailure() {
			AnalysisResult result = analyzer.analyze("{ $ { $ $ R } < }");

			assertThat(result.valid()).isFalse();
			assertThat(result.globalErrors()).containsExactly(Diagnostic.insufficientBalance(2, 3));
		}

		@Test
		@DisplayName("content at depth four exceeds the nesting limit")
		void nestingLimit() {
			AnalysisResult result = analyzer.analyze("{ { { { $ $ $ R } } } }");

			assertThat(result.valid()).isFalse();
			assertThat(result.globalErrors()).extracting(Diagnostic::kind)
					.containsExactly(DiagnosticKind.NESTING_LIMIT_EXCEEDED);
		}

		@Test
		@DisplayName("returning with no coins is invalid")
		void noCoin() {
			assertThat(analyzer.analyze("{ < }").errorMessages()).containsExactly("No coins to return");
		}

		@Test
		@DisplayName("exhausted balance is reported before the quota")
		void balanceBeforeQuota() {
			AnalysisResult result = analyzer.analyze("{ $ $ $ $ R R R R }");

			assertThat(result.globalErrors()).isNotEmpty()
					.allSatisfy(error -> assertThat(error.kind()).isEqualTo(DiagnosticKind.INSUFFICIENT_BALANCE));
			assertThat(result.globalErrors().get(0)).isEqualTo(Diagnostic.insufficientBalance(1, 3));
		}
	}

	@Nested
	@DisplayName("Syntax failures")
	class SyntaxFailures {

		@ParameterizedTest
		@ValueSource(strings = {"", "$ $ R", "{ $ R", "{ $ } }", "{ { $ }", "{ $ a }", "{ $\t}"})
		@DisplayName("produce no tree and exactly one diagnostic")
		void noTreeOneDiagnostic(String input) {
			AnalysisResult result = analyzer.analyze(input);

			assertThat(result.tree()).isEmpty();
			assertThat(result.valid()).isFalse();
			assertThat(result.globalErrors()).hasSize(1);
			assertThat(result.globalErrors().get(0).kind().isSyntax()).isTrue();
		}
	}

	@Nested
	@DisplayName("Properties")
	class Properties {

		@ParameterizedTest
		@ValueSource(strings = {"{ $ { R < { $ } } R }", "{ { { { $ } } } R }", "{ $ $ $ R }"})
		@DisplayName("analysis is deterministic")
		void deterministic(String input) {
			AnalysisResult first = analyzer.analyze(input);
			AnalysisResult second = analyzer.analyze(input);

			assertThat(second.valid()).isEqualTo(first.valid());
			assertThat(second.globalErrors()).isEqualTo(first.globalErrors());
			assertThat(TreeRenderers.renderIndented(second.tree().orElseThrow()))
					.isEqualTo(TreeRenderers.renderIndented(first.tree().orElseThrow()));
		}

		@ParameterizedTest
		@ValueSource(strings = {"{ } { }", "{}{$}", "{ $ } { R }", "{ { } { } }", "{{{$}}{<}}", " {  } ", "{ R R R R }"})
		@DisplayName("input is either rejected by the syntax check or yields a decorated tree")
		void neverThrows(String input) {
			SyntaxValidation validation = new SyntaxValidator().validate(input);

			AnalysisResult result = analyzer.analyze(input);

			assertThat(result.hasTree()).isEqualTo(validation.isValid());
			result.tree().ifPresent(tree -> assertThat(tree.isDecorated()).isTrue());
		}

		@Test
		@DisplayName("global errors equal the root's errors")
		void globalErrorsFromRoot() {
			AnalysisResult result = analyzer.analyze("{ < { R } { { { } } } }");
			DerivationTree tree = result.tree().orElseThrow();

			assertThat(result.globalErrors()).hasSize(3).isEqualTo(tree.root().errors());
		}

		@Test
		@DisplayName("trees are rendered the same however often they are rendered")
		void repeatableRendering() {
			DerivationTree tree = analyzer.analyze("{ $ R }").tree().orElseThrow();

			assertThat(TreeRenderers.renderVisual(tree)).isEqualTo(TreeRenderers.renderVisual(tree));
		}

		@Test
		@DisplayName("carry policy keeps the remaining balance at the root")
		void carryPolicy() {
			VendingAnalyzer carrying = new VendingAnalyzer(
					AnalyzerSettings.DEFAULTS.withFinalBalancePolicy(FinalBalancePolicy.CARRY));

			AnalysisResult result = carrying.analyze("{ $ $ $ $ R }");

			assertThat(result.valid()).isTrue();
			assertThat(result.tree().orElseThrow().root().balance()).isEqualTo(1);
			assertThat(analyzer.analyze("{ $ $ $ $ R }").tree().orElseThrow().root().balance()).isZero();
		}
	}

	@Test
	@DisplayName("logs each analysis outcome at debug level")
	void logsOutcome() {
		try (LogCaptorAppender captor = LogCaptorAppender.capture(VendingAnalyzer.class, Level.DEBUG)) {
			analyzer.analyze("{ $ }");
			analyzer.analyze("{ R }");
			analyzer.analyze("$");

			assertThat(captor.messages(Level.DEBUG))
					.anyMatch(msg -> msg.contains("'{ $ }' is valid"))
					.anyMatch(msg -> msg.contains("'{ R }' is invalid"))
					.anyMatch(msg -> msg.contains("Syntax check failed"));
		}
	}
}
