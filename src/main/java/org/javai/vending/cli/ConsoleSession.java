package org.javai.vending.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;
import org.javai.vending.Examples;
import org.javai.vending.VendingAnalyzer;
import org.javai.vending.render.TreeFormat;

/**
 * Line-oriented prompt loop: analyzes each entered string until {@code exit} or end of input.
 */
public class ConsoleSession {

	static final String EXIT_COMMAND = "exit";
	static final String EXAMPLES_COMMAND = "examples";

	private final VendingAnalyzer analyzer;
	private final AnalysisReport report;
	private final BufferedReader in;
	private final PrintStream out;

	public ConsoleSession(VendingAnalyzer analyzer, TreeFormat format, BufferedReader in, PrintStream out) {
		this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
		this.report = new AnalysisReport(format);
		this.in = Objects.requireNonNull(in, "in must not be null");
		this.out = Objects.requireNonNull(out, "out must not be null");
	}

	/**
	 * Runs the loop.
	 *
	 * @return the number of strings analyzed
	 */
	public int run() throws IOException {
		int analyzed = 0;
		while (true) {
			out.println();
			out.println("=".repeat(60));
			out.print("Enter a string ('" + EXAMPLES_COMMAND + "' for samples, '" + EXIT_COMMAND + "' to quit): ");
			out.flush();

			String line = in.readLine();
			if (line == null) {
				break;
			}
			String input = line.strip();
			if (input.isEmpty()) {
				continue;
			}
			String command = input.toLowerCase(Locale.ROOT);
			if (command.equals(EXIT_COMMAND)) {
				break;
			}
			if (command.equals(EXAMPLES_COMMAND)) {
				printExamples();
				continue;
			}

			out.println();
			out.print(report.format(input, analyzer.analyze(input)));
			analyzed++;
		}
		return analyzed;
	}

	private void printExamples() {
		for (int i = 0; i < Examples.ALL.size(); i++) {
			Examples.Example example = Examples.ALL.get(i);
			out.printf("%d. %-30s %s (%s)%n", i + 1, example.input(), example.description(),
					example.expectedValid() ? "valid" : "invalid");
		}
	}
}
