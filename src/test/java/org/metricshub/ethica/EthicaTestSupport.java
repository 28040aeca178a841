package org.metricshub.ethica;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import org.metricshub.ethica.analysis.CheckName;
import org.metricshub.ethica.analysis.VerificationResult;
import org.metricshub.ethica.frontend.ast.ProgramAst;
import org.metricshub.ethica.util.VerifierSettings;

/**
 * Reusable helpers for Ethica tests. {@link #ethicaTest(String)} describes a
 * program, the settings it is verified with, and what is expected from its
 * verification and execution. {@link #cliTest(String)} does the same through
 * the command line interface.
 */
public final class EthicaTestSupport {

	private static final Ethica ETHICA = new Ethica();

	private EthicaTestSupport() {}

	/**
	 * Joins lines with '\n', and adds a final line break.
	 */
	public static String lines(String... lines) {
		StringBuilder sb = new StringBuilder();
		for (String line : lines) {
			sb.append(line).append('\n');
		}
		return sb.toString();
	}

	public static ProgramAst parse(String... lines) {
		return ETHICA.parse(lines(lines));
	}

	/**
	 * Settings with only the given checks enabled.
	 */
	public static VerifierSettings only(CheckName... checks) {
		VerifierSettings settings = new VerifierSettings();
		settings.setEnabledChecks(checks.length == 0 ? EnumSet.noneOf(CheckName.class) : Arrays.asList(checks));
		return settings;
	}

	public static EthicaTestBuilder ethicaTest(String description) {
		return new EthicaTestBuilder(description);
	}

	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	private static String normalize(String output) {
		return output.replace("\r\n", "\n");
	}

	/**
	 * Verifies and runs a program with the {@link Ethica} API.
	 */
	public static final class EthicaTestBuilder {

		private final String description;
		private final List<String> script = new ArrayList<>();
		private VerifierSettings settings = new VerifierSettings();
		private String expectedOutput;
		private Boolean expectedPassed;

		EthicaTestBuilder(String description) {
			this.description = description;
		}

		public EthicaTestBuilder script(String... lines) {
			script.addAll(Arrays.asList(lines));
			return this;
		}

		public EthicaTestBuilder settings(VerifierSettings verifierSettings) {
			this.settings = verifierSettings;
			return this;
		}

		public EthicaTestBuilder expect(String output) {
			this.expectedOutput = output;
			return this;
		}

		public EthicaTestBuilder expectLines(String... lines) {
			return expect(lines(lines));
		}

		public EthicaTestBuilder expectPassed(boolean passed) {
			this.expectedPassed = passed;
			return this;
		}

		public String source() {
			return lines(script.toArray(new String[0]));
		}

		/**
		 * Verifies the program only.
		 */
		public VerificationResult verify() {
			VerificationResult result = ETHICA.verify(source(), settings);
			if (expectedPassed != null) {
				assertEquals(description + ": " + result, expectedPassed.booleanValue(), result.isPassed());
			}
			return result;
		}

		/**
		 * Runs the program without verification and returns what it printed.
		 */
		public String execute() {
			ByteArrayOutputStream bytes = new ByteArrayOutputStream();
			PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
			settings.setOutputStream(out);
			ETHICA.execute(ETHICA.parse(source()), settings);
			String output = normalize(new String(bytes.toByteArray(), StandardCharsets.UTF_8));
			if (expectedOutput != null) {
				assertEquals(description, expectedOutput, output);
			}
			return output;
		}

		/**
		 * Verifies and runs the program, and returns what it printed.
		 */
		public String run() {
			ByteArrayOutputStream bytes = new ByteArrayOutputStream();
			PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
			settings.setOutputStream(out);
			ETHICA.run(source(), settings);
			String output = normalize(new String(bytes.toByteArray(), StandardCharsets.UTF_8));
			if (expectedOutput != null) {
				assertEquals(description, expectedOutput, output);
			}
			return output;
		}
	}

	/**
	 * Runs the command line interface on a temporary script file.
	 */
	public static final class CliTestBuilder {

		private final String description;
		private final List<String> script = new ArrayList<>();
		private final List<String> arguments = new ArrayList<>();
		private String command = "run";
		private int expectedExitCode;

		CliTestBuilder(String description) {
			this.description = description;
		}

		public CliTestBuilder script(String... lines) {
			script.addAll(Arrays.asList(lines));
			return this;
		}

		public CliTestBuilder command(String cliCommand) {
			this.command = cliCommand;
			return this;
		}

		public CliTestBuilder argument(String... args) {
			arguments.addAll(Arrays.asList(args));
			return this;
		}

		public CliTestBuilder expectExitCode(int code) {
			this.expectedExitCode = code;
			return this;
		}

		/**
		 * @return what the CLI printed
		 */
		public String run() throws IOException {
			Path file = Files.createTempFile("ethica-test", ".eth");
			try {
				Files.write(file, lines(script.toArray(new String[0])).getBytes(StandardCharsets.UTF_8));
				List<String> args = new ArrayList<>();
				args.add(command);
				args.add(file.toString());
				args.addAll(arguments);

				ByteArrayOutputStream bytes = new ByteArrayOutputStream();
				PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
				int exitCode = 0;
				try {
					Cli.create(args.toArray(new String[0]), out);
				} catch (ExitException e) {
					exitCode = e.getCode();
				}
				assertEquals(description + ": exit code", expectedExitCode, exitCode);
				return normalize(new String(bytes.toByteArray(), StandardCharsets.UTF_8));
			} finally {
				Files.deleteIfExists(file);
			}
		}
	}

	public static void assertContains(String text, String expected) {
		assertTrue("Expected to find \"" + expected + "\" in:\n" + text, text.contains(expected));
	}

	public static void assertNotContains(String text, String unexpected) {
		assertFalse("Did not expect \"" + unexpected + "\" in:\n" + text, text.contains(unexpected));
	}
}
