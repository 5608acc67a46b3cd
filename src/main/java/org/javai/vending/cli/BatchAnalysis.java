package org.javai.vending.cli;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.javai.vending.VendingAnalyzer;
import org.javai.vending.render.TreeFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzes every non-blank line of a text file and writes the reports to another file.
 */
public class BatchAnalysis {

	private static final Logger logger = LoggerFactory.getLogger(BatchAnalysis.class);

	static final String TITLE = "=== VENDING MACHINE SEMANTIC ANALYSIS ===";
	static final String SEPARATOR = "=".repeat(60);

	private final VendingAnalyzer analyzer;
	private final TreeFormat format;
	private final AnalysisReport report;

	public BatchAnalysis(VendingAnalyzer analyzer, TreeFormat format) {
		this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
		this.format = Objects.requireNonNull(format, "format must not be null");
		this.report = new AnalysisReport(format);
	}

	/**
	 * Where results go when no output file is given: {@code inputs.txt} becomes
	 * {@code inputs_result.txt}; other names get {@code _result.txt} appended.
	 */
	public static Path defaultOutput(Path input) {
		String name = input.getFileName().toString();
		String outputName = name.endsWith(".txt")
				? name.substring(0, name.length() - ".txt".length()) + "_result.txt"
				: name + "_result.txt";
		return input.resolveSibling(outputName);
	}

	/**
	 * @return the number of strings analyzed
	 */
	public int run(Path input, Path output) throws IOException {
		List<String> strings = Files.readAllLines(input, StandardCharsets.UTF_8).stream()
				.map(String::strip)
				.filter(line -> !line.isEmpty())
				.toList();
		logger.info("Analyzing {} strings from {}", strings.size(), input);

		try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
			writer.write(TITLE + "\n");
			writer.write("Format: " + format.displayName() + "\n\n");

			for (int i = 0; i < strings.size(); i++) {
				String string = strings.get(i);
				writer.write("STRING " + (i + 1) + ": " + string + "\n");
				writer.write(SEPARATOR + "\n");
				writer.write(report.format(string, analyzer.analyze(string)));
				writer.write("\n" + SEPARATOR + "\n\n");
			}
		}
		logger.info("Results written to {}", output);
		return strings.size();
	}
}
