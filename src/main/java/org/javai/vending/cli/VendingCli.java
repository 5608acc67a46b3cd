package org.javai.vending.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.javai.vending.VendingAnalyzer;
import org.javai.vending.config.AnalyzerConfigException;
import org.javai.vending.config.AnalyzerSettings;
import org.javai.vending.config.AnalyzerSettingsLoader;
import org.javai.vending.grammar.Grammar;
import org.javai.vending.render.TreeFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line driver. Runs an interactive prompt, or analyzes a file of strings with {@code --batch}.
 */
public final class VendingCli {

	private static final Logger logger = LoggerFactory.getLogger(VendingCli.class);

	static final String FORMAT_OPTION = "format";
	static final String BATCH_OPTION = "batch";
	static final String OUTPUT_OPTION = "output";
	static final String CONFIG_OPTION = "config";
	static final String HELP_OPTION = "help";

	static final int EXIT_OK = 0;
	static final int EXIT_FAILURE = 1;
	static final int EXIT_USAGE = 2;

	private VendingCli() {
	}

	public static void main(String[] args) {
		System.exit(run(args, System.in, System.out, System.err));
	}

	static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
		Options options = options();
		CommandLine cmd;
		TreeFormat format;
		try {
			CommandLineParser parser = new DefaultParser();
			cmd = parser.parse(options, args);
			format = TreeFormat.fromKey(cmd.getOptionValue(FORMAT_OPTION, TreeFormat.VISUAL.key()));
		} catch (ParseException | IllegalArgumentException e) {
			err.println("Error: " + e.getMessage());
			printUsage(options, err);
			return EXIT_USAGE;
		}

		if (cmd.hasOption(HELP_OPTION)) {
			printUsage(options, out);
			return EXIT_OK;
		}

		try {
			VendingAnalyzer analyzer = new VendingAnalyzer(loadSettings(cmd));
			if (cmd.hasOption(BATCH_OPTION)) {
				Path input = Paths.get(cmd.getOptionValue(BATCH_OPTION));
				if (!Files.isRegularFile(input)) {
					err.println("Error: could not find file '" + input + "'");
					return EXIT_FAILURE;
				}
				Path output = cmd.hasOption(OUTPUT_OPTION)
						? Paths.get(cmd.getOptionValue(OUTPUT_OPTION))
						: BatchAnalysis.defaultOutput(input);
				int count = new BatchAnalysis(analyzer, format).run(input, output);
				out.println("Analyzed " + count + " strings. Results saved to: " + output);
			} else {
				out.println("=== VENDING MACHINE SEMANTIC ANALYZER ===");
				out.println(Grammar.describe());
				BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
				new ConsoleSession(analyzer, format, reader, out).run();
			}
			return EXIT_OK;
		} catch (AnalyzerConfigException e) {
			logger.error("Invalid configuration", e);
			err.println("Error: " + e.getMessage());
			return EXIT_FAILURE;
		} catch (IOException e) {
			logger.error("I/O failure", e);
			err.println("Error processing file: " + e.getMessage());
			return EXIT_FAILURE;
		}
	}

	private static AnalyzerSettings loadSettings(CommandLine cmd) {
		AnalyzerSettingsLoader loader = new AnalyzerSettingsLoader();
		if (cmd.hasOption(CONFIG_OPTION)) {
			Path path = Paths.get(cmd.getOptionValue(CONFIG_OPTION));
			logger.info("Loading analyzer settings from {}", path);
			return loader.load(path);
		}
		return loader.loadDefault();
	}

	static Options options() {
		Options options = new Options();
		options.addOption(Option.builder("f").longOpt(FORMAT_OPTION).hasArg().argName("visual|indented")
				.desc("tree format (default: visual)").build());
		options.addOption(Option.builder("b").longOpt(BATCH_OPTION).hasArg().argName("file")
				.desc("analyze every non-blank line of a file").build());
		options.addOption(Option.builder("o").longOpt(OUTPUT_OPTION).hasArg().argName("file")
				.desc("batch output file (default: <file>_result.txt)").build());
		options.addOption(Option.builder("c").longOpt(CONFIG_OPTION).hasArg().argName("file")
				.desc("YAML analyzer settings").build());
		options.addOption(Option.builder("h").longOpt(HELP_OPTION).desc("show this help").build());
		return options;
	}

	private static void printUsage(Options options, PrintStream stream) {
		PrintWriter writer = new PrintWriter(stream);
		new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "vending-grammar", null, options,
				HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
		writer.flush();
	}
}
