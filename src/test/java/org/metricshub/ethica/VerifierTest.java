package org.metricshub.ethica;

import static org.junit.Assert.*;
import static org.metricshub.ethica.EthicaTestSupport.ethicaTest;
import static org.metricshub.ethica.EthicaTestSupport.only;
import static org.metricshub.ethica.EthicaTestSupport.parse;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.ethica.analysis.AnalysisReport;
import org.metricshub.ethica.analysis.Analyzer;
import org.metricshub.ethica.analysis.CheckName;
import org.metricshub.ethica.analysis.CostEstimator;
import org.metricshub.ethica.analysis.PolicyChecker;
import org.metricshub.ethica.analysis.VerificationResult;
import org.metricshub.ethica.analysis.Verifier;
import org.metricshub.ethica.frontend.ast.ProgramAst;
import org.metricshub.ethica.util.VerifierSettings;

public class VerifierTest {

	private static final String[] UNCONSENTED = {
			"function share_position(user_id):",
			"    return collect_location(user_id)",
			"print('started')",
			"print(share_position(1))" };

	private static final String[] DOUBLING = {
			"function double_value(amount):",
			"    return amount + amount",
			"print(double_value(10))" };

	/**
	 * Reports a failure for every program, or throws when asked to.
	 */
	private static final class StubAnalyzer implements Analyzer {

		private final CheckName check;
		private final RuntimeException failure;

		StubAnalyzer(CheckName check, RuntimeException failure) {
			this.check = check;
			this.failure = failure;
		}

		@Override
		public CheckName getCheckName() {
			return check;
		}

		@Override
		public AnalysisReport analyze(ProgramAst program, VerifierSettings settings) {
			if (failure != null) {
				throw failure;
			}
			return new AnalysisReport(check, false, Collections.emptyList());
		}
	}

	@Test
	public void testAllChecksByDefault() {
		VerificationResult result = ethicaTest("clean program").script(DOUBLING).expectPassed(true).verify();
		assertEquals(
				Arrays.asList(CheckName.ENERGY, CheckName.ETHICS, CheckName.READABILITY, CheckName.CLEVERNESS),
				new ArrayList<>(result.getReports().keySet()));
		assertNotNull(result.getCostReport());
		assertNotNull(result.getReadabilityReport());
	}

	@Test
	public void testUnconsentedProgramFails() {
		VerificationResult result = ethicaTest("unconsented").script(UNCONSENTED).expectPassed(false).verify();
		assertFalse(result.getReport(CheckName.ETHICS).isPassed());
		assertTrue(result.getReport(CheckName.ENERGY).isPassed());
		assertTrue(result.getReport(CheckName.CLEVERNESS).isPassed());
	}

	@Test
	public void testDisabledCheckIsNotReported() {
		VerifierSettings settings = new VerifierSettings();
		settings.disable(CheckName.ETHICS);
		VerificationResult result = ethicaTest("ethics disabled")
				.script(UNCONSENTED)
				.settings(settings)
				.expectPassed(true)
				.verify();
		assertNull(result.getReport(CheckName.ETHICS));
		assertEquals(3, result.getReports().size());
	}

	@Test
	public void testNoChecksEnabled() {
		VerificationResult result = ethicaTest("nothing to check")
				.script(UNCONSENTED)
				.settings(only())
				.expectPassed(true)
				.verify();
		assertTrue(result.getReports().isEmpty());
	}

	@Test
	public void testParallelMatchesSequential() {
		Verifier verifier = new Verifier();
		ProgramAst program = parse(UNCONSENTED);
		VerifierSettings sequential = new VerifierSettings();
		VerifierSettings parallel = new VerifierSettings();
		parallel.setParallel(true);

		VerificationResult first = verifier.verify(program, sequential);
		VerificationResult second = verifier.verify(program, parallel);
		assertEquals(first.isPassed(), second.isPassed());
		assertEquals(first.getReports().keySet(), second.getReports().keySet());
		for (CheckName check : first.getReports().keySet()) {
			assertEquals(
					check.getId(),
					first.getReport(check).getViolations().toString(),
					second.getReport(check).getViolations().toString());
		}
	}

	@Test
	public void testCustomAnalyzers() {
		Verifier verifier = new Verifier(new CostEstimator(), new StubAnalyzer(CheckName.CLEVERNESS, null));
		VerificationResult result = verifier.verify(parse(DOUBLING), new VerifierSettings());
		assertFalse(result.isPassed());
		assertEquals(Arrays.asList(CheckName.ENERGY, CheckName.CLEVERNESS), new ArrayList<>(result.getReports().keySet()));
		assertNotNull(result.getCostReport());
	}

	@Test
	public void testPlainReportsForDetailedChecks() {
		Verifier verifier = new Verifier(
				new StubAnalyzer(CheckName.ENERGY, null),
				new StubAnalyzer(CheckName.READABILITY, null));
		VerificationResult result = verifier.verify(parse(DOUBLING), new VerifierSettings());
		assertNotNull(result.getReport(CheckName.ENERGY));
		assertNull(result.getCostReport());
		assertNull(result.getReadabilityReport());
	}

	@Test
	public void testDuplicateAnalyzer() {
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> new Verifier(new PolicyChecker(), new PolicyChecker()));
		assertTrue(e.getMessage(), e.getMessage().contains("ethics"));
	}

	@Test
	public void testAnalyzerFailurePropagates() {
		final IllegalStateException failure = new IllegalStateException("broken analyzer");
		final Verifier verifier = new Verifier(new CostEstimator(), new StubAnalyzer(CheckName.READABILITY, failure));
		final ProgramAst program = parse(DOUBLING);
		final VerifierSettings settings = new VerifierSettings();

		assertSame(failure, assertThrows(IllegalStateException.class, () -> verifier.verify(program, settings)));
		settings.setParallel(true);
		assertSame(failure, assertThrows(IllegalStateException.class, () -> verifier.verify(program, settings)));
	}

	@Test
	public void testRunRejectsUnverifiedProgram() {
		final EthicaTestSupport.EthicaTestBuilder test = ethicaTest("rejected").script(UNCONSENTED);
		VerificationException e = assertThrows(VerificationException.class, () -> test.run());
		assertEquals("Program rejected by verification (failed checks: ethics)", e.getMessage());
		assertFalse(e.getResult().isPassed());
	}

	@Test
	public void testRunRejectedProgramPrintsNothing() {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		VerifierSettings settings = new VerifierSettings();
		settings.setOutputStream(new PrintStream(bytes, true));
		try {
			new Ethica().run(EthicaTestSupport.lines(UNCONSENTED), settings);
			fail("verification should have failed");
		} catch (VerificationException e) {
			assertEquals(0, bytes.size());
		}
	}

	@Test
	public void testRunVerifiedProgram() {
		ethicaTest("accepted").script(DOUBLING).expectLines("20").run();
	}

	@Test
	public void testCheckNames() {
		assertEquals(CheckName.READABILITY, CheckName.fromId("Readability"));
		assertEquals("cleverness", CheckName.CLEVERNESS.toString());
		assertThrows(IllegalArgumentException.class, () -> CheckName.fromId("speed"));
	}
}
