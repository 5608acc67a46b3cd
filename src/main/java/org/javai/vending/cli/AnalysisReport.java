package org.javai.vending.cli;

import java.util.List;
import java.util.Objects;
import org.javai.vending.AnalysisResult;
import org.javai.vending.render.TreeFormat;

/**
 * Formats the result of one analysis for the console and batch output.
 */
public class AnalysisReport {

	static final String RULE = "-".repeat(35);

	private final TreeFormat format;

	public AnalysisReport(TreeFormat format) {
		this.format = Objects.requireNonNull(format, "format must not be null");
	}

	public String format(String input, AnalysisResult result) {
		StringBuilder sb = new StringBuilder();
		sb.append("Analysis of: ").append(input).append('\n');
		sb.append(RULE).append('\n');

		if (!result.hasTree()) {
			sb.append("Error: could not build derivation tree\n");
			for (String message : result.errorMessages()) {
				sb.append("- ").append(message).append('\n');
			}
			sb.append("Result: INVALID\n");
			return sb.toString();
		}

		sb.append("Decorated derivation tree:\n");
		sb.append(format.renderer().render(result.tree().get())).append("\n\n");

		List<String> errors = result.errorMessages();
		if (errors.isEmpty()) {
			sb.append("No semantic errors found\n");
		} else {
			sb.append("Errors found:\n");
			for (int i = 0; i < errors.size(); i++) {
				sb.append(i + 1).append(". ").append(errors.get(i)).append('\n');
			}
		}
		sb.append('\n');
		sb.append("Result: ").append(result.valid() ? "VALID" : "INVALID").append('\n');
		return sb.toString();
	}
}
