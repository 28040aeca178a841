package org.metricshub.ethica;

import static org.junit.Assert.*;
import static org.metricshub.ethica.EthicaTestSupport.parse;

import java.util.List;
import org.junit.Test;
import org.metricshub.ethica.analysis.AnalysisReport;
import org.metricshub.ethica.analysis.ObfuscationDetector;
import org.metricshub.ethica.analysis.Violation;
import org.metricshub.ethica.analysis.ViolationType;
import org.metricshub.ethica.util.VerifierSettings;

public class ObfuscationDetectorTest {

	private static final ObfuscationDetector DETECTOR = new ObfuscationDetector();

	private static AnalysisReport detect(String... lines) {
		return DETECTOR.analyze(parse(lines), new VerifierSettings());
	}

	private static int count(AnalysisReport report, ViolationType type) {
		return report.getViolations(type).size();
	}

	@Test
	public void testDeepExpression() {
		AnalysisReport report = detect("result = ((((((alpha + beta) * gamma) - delta) / epsilon) + zeta) * eta)");
		List<Violation> deep = report.getViolations(ViolationType.EXPRESSION_TOO_DEEP);
		assertEquals(1, deep.size());
		assertTrue(deep.get(0).getMessage(), deep.get(0).getMessage().startsWith("Expression nests 6 operations (maximum: 4)"));
		assertEquals(1, count(report, ViolationType.COMPLEX_ONE_LINER));
		assertFalse(report.isPassed());

		AnalysisReport split = detect(
				"first_part = (alpha + beta) * gamma",
				"second_part = (first_part - delta) / epsilon",
				"result = (second_part + zeta) * eta");
		assertEquals(0, count(split, ViolationType.EXPRESSION_TOO_DEEP));
		assertTrue(split.getViolations().toString(), split.isPassed());
	}

	@Test
	public void testDepthLimitIsInclusive() {
		assertEquals(0, count(detect("total = (((alpha + beta) + gamma) + delta) + epsilon"), ViolationType.EXPRESSION_TOO_DEEP));
		assertEquals(1, count(detect("total = ((((alpha + beta) + gamma) + delta) + epsilon) + zeta"), ViolationType.EXPRESSION_TOO_DEEP));
	}

	@Test
	public void testNestedCallsCountAsDepth() {
		assertEquals(1, count(detect("total = first(second(third(fourth(fifth(value)))))"), ViolationType.EXPRESSION_TOO_DEEP));
	}

	@Test
	public void testOperatorCountCoversRootExpressions() {
		AnalysisReport report = detect("if -alpha < beta and gamma > delta or not epsilon:", "    go()");
		// <, and, >, or, - and not
		assertEquals(1, count(report, ViolationType.COMPLEX_ONE_LINER));
	}

	@Test
	public void testLongChain() {
		AnalysisReport report = detect("host_name = config.database.primary.host.name");
		assertEquals("Reported once per chain", 1, count(report, ViolationType.LONG_CHAIN));
		assertEquals(1, count(detect("first_row = client.fetch(1).rows[0].name"), ViolationType.LONG_CHAIN));
		assertTrue(detect("host_name = config.database.host").isPassed());
		assertEquals(
				"Two separate chains",
				2,
				count(detect("print(alpha.beta.gamma.delta.epsilon, one.two.three.four.five)"), ViolationType.LONG_CHAIN));
	}

	@Test
	public void testMagicNumbers() {
		AnalysisReport report = detect(
				"MAX_RETRIES = 42",
				"timeout = delay * 42",
				"ratio = 0.5",
				"count = 10",
				"steps = [0, 1, 100]",
				"for item in range(7):",
				"    print(item)");
		List<Violation> magic = report.getViolations(ViolationType.MAGIC_NUMBER);
		assertEquals(3, magic.size());
		assertEquals(2, magic.get(0).getLine());
		assertTrue(magic.get(0).getMessage().startsWith("Magic number 42"));
		assertEquals(3, magic.get(1).getLine());
		assertEquals(6, magic.get(2).getLine());
	}

	@Test
	public void testSingleLetterNames() {
		AnalysisReport report = detect(
				"function scale(n):",
				"    return n",
				"for i in items:",
				"    print(i)",
				"for x in items:",
				"    print(x)",
				"a = 1");
		List<Violation> names = report.getViolations(ViolationType.SINGLE_LETTER_NAME);
		assertEquals(3, names.size());
		assertEquals("scale", names.get(0).getFunctionName());
		assertEquals(5, names.get(1).getLine());
		assertEquals(7, names.get(2).getLine());
	}

	@Test
	public void testTooManyParameters() {
		assertEquals(
				1,
				count(
						detect("function create(name, email, phone, street, city, country):", "    return name"),
						ViolationType.TOO_MANY_PARAMETERS));
		assertTrue(detect("function create(name, email, phone, street, city):", "    return name").isPassed());
	}

	@Test
	public void testChainedComparison() {
		AnalysisReport report = detect("if low < value < high:", "    go()");
		assertEquals(1, count(report, ViolationType.CHAINED_COMPARISON));
		assertNotNull(report.getViolations(ViolationType.CHAINED_COMPARISON).get(0).getSuggestion());
		assertTrue(detect("if low < value and value < high:", "    go()").isPassed());
	}

	@Test
	public void testEveryViolationHasSuggestion() {
		AnalysisReport report = detect(
				"function create(a, b, c, d, e, f):",
				"    return a.b.c.d.e * 42 < 3 < 4");
		assertFalse(report.isPassed());
		for (Violation violation : report.getViolations()) {
			assertNotNull(violation.toString(), violation.getSuggestion());
		}
	}
}
