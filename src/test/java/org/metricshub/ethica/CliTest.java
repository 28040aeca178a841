package org.metricshub.ethica;

import static org.junit.Assert.*;
import static org.metricshub.ethica.EthicaTestSupport.assertContains;
import static org.metricshub.ethica.EthicaTestSupport.assertNotContains;
import static org.metricshub.ethica.EthicaTestSupport.cliTest;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;
import org.metricshub.ethica.analysis.CheckName;
import org.metricshub.ethica.frontend.ParserException;

public class CliTest {

	private static final String[] CLEAN = {
			"function double_value(amount):",
			"    return amount + amount",
			"print(double_value(10))" };

	private static final String[] UNCONSENTED = {
			"function share_position(user_id):",
			"    return collect_location(user_id)",
			"print('started')" };

	@Test
	public void testRunPrintsProgramOutput() throws Exception {
		String output = cliTest("run").script(CLEAN).run();
		assertEquals("20\n", output);
	}

	@Test
	public void testRunRejectedProgram() throws Exception {
		String output = cliTest("run rejected").script(UNCONSENTED).expectExitCode(1).run();
		assertContains(output, "[ethics] FAILED");
		assertContains(output, "suggestion: Add @requires_user_consent above 'function share_position'");
		assertContains(output, "Verification FAILED");
		assertNotContains(output, "started");
		assertNotContains(output, "[energy]");
	}

	@Test
	public void testCheckPassingProgram() throws Exception {
		String output = cliTest("check").command("check").script(CLEAN).run();
		assertEquals("Verification PASSED\n", output);
	}

	@Test
	public void testAnalyzePrintsEveryReport() throws Exception {
		String output = cliTest("analyze").command("analyze").script(CLEAN).run();
		assertContains(output, "[energy] passed");
		assertContains(output, "estimated cost: ");
		assertContains(output, "[ethics] passed");
		assertContains(output, "[readability] passed");
		assertContains(output, "score: 100.00 (minimum 70.00)");
		assertContains(output, "[cleverness] passed");
		assertContains(output, "Verification PASSED");
		assertNotContains(output, "20");
	}

	@Test
	public void testDisabledCheck() throws Exception {
		String output = cliTest("no ethics").command("analyze").script(UNCONSENTED).argument("--no-ethics").run();
		assertNotContains(output, "[ethics]");
		assertContains(output, "Verification PASSED");
	}

	@Test
	public void testEnergyBudget() throws Exception {
		String output = cliTest("tiny budget")
				.command("check")
				.script(CLEAN)
				.argument("--energy-budget", "5")
				.expectExitCode(1)
				.run();
		assertContains(output, "[energy] FAILED");
		assertContains(output, "(budget 5)");
	}

	@Test
	public void testShowTokensAndDumpSyntax() throws Exception {
		String output = cliTest("debug output")
				.command("check")
				.script("print('hi')")
				.argument("--show-tokens", "--dump-syntax")
				.run();
		assertContains(output, "IDENTIFIER print 1:1");
		assertContains(output, "EOF");
		assertContains(output, "FunctionCallAst");
		assertContains(output, "Verification PASSED");
	}

	@Test
	public void testParseOptions() throws Exception {
		Path script = Files.createTempFile("ethica-cli", ".eth");
		try {
			Cli cli = Cli
					.parseCommandLineArguments(
							new String[] {
									"analyze",
									script.toString(),
									"--min-readability",
									"80",
									"--max-recursion-depth",
									"3",
									"--parallel",
									"--no-cleverness",
									"-v" });
			assertEquals(Cli.Command.ANALYZE, cli.getCommand());
			assertEquals(script.toString(), cli.getScriptSource().getDescription());
			assertTrue(cli.isVerbose());
			assertEquals(80.0, cli.getSettings().getMinReadability(), 0.0);
			assertEquals(3, cli.getSettings().getMaxRecursionDepth());
			assertTrue(cli.getSettings().isParallel());
			assertFalse(cli.getSettings().isEnabled(CheckName.CLEVERNESS));
		} finally {
			Files.deleteIfExists(script);
		}
	}

	@Test
	public void testInvalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "compile", "script.eth" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "run" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "run", "a.eth", "b.eth" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "run", "a.eth", "--energy-budget" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "run", "a.eth", "--energy-budget", "lots" }));
		IllegalArgumentException depth = assertThrows(
				IllegalArgumentException.class,
				() -> new Cli().parse(new String[] { "run", "a.eth", "--max-recursion-depth", "4294967297" }));
		assertEquals("--max-recursion-depth expects an integer, got \"4294967297\"", depth.getMessage());
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "run", "a.eth", "--min-readability", "NaN" }));
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> new Cli().parse(new String[] { "run", "a.eth", "--fast" }));
		assertEquals("Unknown parameter: --fast", e.getMessage());
	}

	@Test
	public void testUnreadableScript() {
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> new Cli().parse(new String[] { "run", "does-not-exist.eth" }));
		assertTrue(e.getMessage(), e.getMessage().startsWith("Failed to read script 'does-not-exist.eth'"));
	}

	@Test
	public void testUsage() throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		Cli.create(new String[] { "-h" }, new PrintStream(bytes, true, StandardCharsets.UTF_8));
		String output = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
		assertContains(output, "Usage:");
		assertContains(output, "<run|check|analyze> <script-filename>");
		assertContains(output, "--energy-budget n");
	}

	@Test
	public void testSyntaxError() {
		assertThrows(ParserException.class, () -> cliTest("syntax error").script("if ready", "    go()").run());
	}
}
