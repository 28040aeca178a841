package org.metricshub.ethica;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Ethica
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.Locale;
import org.metricshub.ethica.analysis.CheckName;
import org.metricshub.ethica.analysis.VerificationResult;
import org.metricshub.ethica.backend.EthicaRuntimeException;
import org.metricshub.ethica.frontend.LexerException;
import org.metricshub.ethica.frontend.ParserException;
import org.metricshub.ethica.frontend.Token;
import org.metricshub.ethica.frontend.ast.ProgramAst;
import org.metricshub.ethica.util.EthicaLogger;
import org.metricshub.ethica.util.ScriptFileSource;
import org.metricshub.ethica.util.ScriptSource;
import org.metricshub.ethica.util.VerifierSettings;
import org.slf4j.Logger;

/**
 * Command-line interface for Ethica.
 * <p>
 * <code>ethica &lt;run|check|analyze&gt; &lt;file&gt; [options]</code>
 */
public final class Cli {

	private static final Logger LOG = EthicaLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "ethica.jar";
		}
		JAR_NAME = myName;
	}

	/**
	 * What to do with the program.
	 */
	public enum Command {
		/** Verify, then execute the program if it passed */
		RUN,
		/** Verify and print the failed reports */
		CHECK,
		/** Verify and print every report */
		ANALYZE;

		static Command fromArgument(String arg) {
			for (Command command : values()) {
				if (command.name().toLowerCase(Locale.ROOT).equals(arg)) {
					return command;
				}
			}
			return null;
		}
	}

	private final VerifierSettings settings = new VerifierSettings();
	private final PrintStream out;

	private Command command;
	private ScriptSource scriptSource;
	private boolean verbose;
	private boolean showTokens;
	private boolean dumpSyntaxTree;
	private boolean printUsage;

	/**
	 * Creates a CLI instance writing to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance writing reports and program output to the
	 * supplied stream.
	 *
	 * @param out stream where reports and program output are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link VerifierSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public VerifierSettings getSettings() {
		return settings;
	}

	public Command getCommand() {
		return command;
	}

	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	public boolean isVerbose() {
		return verbose;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// positional: the command, then the script file
				if (command == null) {
					command = Command.fromArgument(arg);
					if (command == null) {
						throw new IllegalArgumentException("Unknown command: " + arg);
					}
				} else if (scriptSource == null) {
					scriptSource = new ScriptFileSource(arg);
				} else {
					throw new IllegalArgumentException("Unexpected argument: " + arg);
				}
			} else if (arg.equals("-v") || arg.equals("--verbose")) {
				verbose = true;
			} else if (arg.equals("--show-tokens")) {
				showTokens = true;
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("--no-energy")) {
				settings.disable(CheckName.ENERGY);
			} else if (arg.equals("--no-ethics")) {
				settings.disable(CheckName.ETHICS);
			} else if (arg.equals("--no-readability")) {
				settings.disable(CheckName.READABILITY);
			} else if (arg.equals("--no-cleverness")) {
				settings.disable(CheckName.CLEVERNESS);
			} else if (arg.equals("--energy-budget")) {
				checkParameterHasArgument(args, argIdx);
				settings.setEnergyBudget(parseLong(arg, args[++argIdx]));
			} else if (arg.equals("--min-readability")) {
				checkParameterHasArgument(args, argIdx);
				settings.setMinReadability(parseDouble(arg, args[++argIdx]));
			} else if (arg.equals("--max-recursion-depth")) {
				checkParameterHasArgument(args, argIdx);
				settings.setMaxRecursionDepth(parseInt(arg, args[++argIdx]));
			} else if (arg.equals("--parallel")) {
				settings.setParallel(true);
			} else if (arg.equals("-h") || arg.equals("-?") || arg.equals("--help")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (command == null) {
			throw new IllegalArgumentException("Command not provided.");
		}
		if (scriptSource == null) {
			throw new IllegalArgumentException("Ethica script not provided.");
		}
		try (Reader reader = scriptSource.getReader()) {
			LOG.debug("Script {} is readable", scriptSource.getDescription());
		} catch (IOException ex) {
			throw new IllegalArgumentException(
					"Failed to read script '" + scriptSource.getDescription() + "': " + ex.getMessage(),
					ex);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static long parseLong(String option, String value) {
		try {
			return Long.parseLong(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " expects an integer, got \"" + value + "\"", e);
		}
	}

	private static int parseInt(String option, String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " expects an integer, got \"" + value + "\"", e);
		}
	}

	private static double parseDouble(String option, String value) {
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " expects a number, got \"" + value + "\"", e);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the script cannot be read
	 * @throws ExitException if the program was rejected by verification
	 */
	public void run() throws IOException, ExitException {
		if (printUsage) {
			usage(out);
			return;
		}
		if (verbose) {
			out.print(settings.toDescriptionString());
		}

		Ethica ethica = new Ethica();
		String source = scriptSource.readScript();
		if (showTokens) {
			for (Token token : ethica.tokenize(source)) {
				out.println(token);
			}
		}
		ProgramAst program = ethica.parse(new ScriptSource(scriptSource.getDescription(), new StringReader(source)));
		if (dumpSyntaxTree) {
			program.dump(out);
		}

		VerificationResult result = ethica.verify(program, settings);
		ReportPrinter printer = new ReportPrinter(out, verbose);
		if (command == Command.ANALYZE) {
			printer.print(result, true);
		} else if (command == Command.CHECK || !result.isPassed() || verbose) {
			printer.print(result, false);
		}
		if (!result.isPassed()) {
			throw new ExitException(ExitException.EXIT_CODE_FAILURE, "Verification failed");
		}
		if (command == Command.RUN) {
			ethica.execute(result.getProgram(), settings);
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" <run|check|analyze> <script-filename>" +
								" [-v|--verbose]" +
								" [--show-tokens]" +
								" [--dump-syntax]" +
								" [--no-energy] [--no-ethics] [--no-readability] [--no-cleverness]" +
								" [--energy-budget n]" +
								" [--min-readability n]" +
								" [--max-recursion-depth n]" +
								" [--parallel]");
		dest.println();
		dest.println(" run = Verify the script, then execute it if every enabled check passed.");
		dest.println(" check = Verify the script and print the reports of the failed checks.");
		dest.println(" analyze = Verify the script and print every report.");
		dest.println();
		dest.println(" -v, --verbose = Print the settings and detailed reports.");
		dest.println(" --show-tokens = Print the tokens of the script.");
		dest.println(" --dump-syntax = Print the syntax tree.");
		dest.println(" --no-<check> = Disable the energy, ethics, readability or cleverness check.");
		dest.println(" --energy-budget n = Maximum estimated cost (default 1000).");
		dest.println(" --min-readability n = Minimum readability score, 0 to 100 (default 70).");
		dest.println(" --max-recursion-depth n = Assumed depth of recursive calls (default 10).");
		dest.println(" --parallel = Run the checks concurrently.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses arguments into a new {@link Cli} instance without executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param out stream for reports and program output
	 * @return configured and executed CLI instance
	 * @throws IOException if the script cannot be read
	 * @throws ExitException if the program was rejected by verification
	 */
	public static Cli create(String[] args, PrintStream out) throws IOException, ExitException {
		Cli cli = new Cli(out);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (ExitException e) {
			System.exit(e.getCode());
		} catch (LexerException e) {
			printError(e, e.getLineNumber());
			System.exit(1);
		} catch (ParserException e) {
			printError(e, e.getLineNumber());
			System.exit(1);
		} catch (EthicaRuntimeException e) {
			printError(e, e.getLineNumber());
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s%n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}

	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	private static void printError(RuntimeException e, int lineNumber) {
		if (lineNumber >= 0) {
			System.err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), lineNumber, e.getMessage());
		} else {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
		}
	}
}
