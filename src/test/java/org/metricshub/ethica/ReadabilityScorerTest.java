package org.metricshub.ethica;

import static org.junit.Assert.*;
import static org.metricshub.ethica.EthicaTestSupport.parse;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.ethica.analysis.ReadabilityReport;
import org.metricshub.ethica.analysis.ReadabilityScorer;
import org.metricshub.ethica.analysis.ScoreCurve;
import org.metricshub.ethica.analysis.Violation;
import org.metricshub.ethica.analysis.ViolationType;
import org.metricshub.ethica.util.VerifierSettings;

public class ReadabilityScorerTest {

	private static final double DELTA = 0.001;

	private static final ReadabilityScorer SCORER = new ReadabilityScorer();

	private static ReadabilityReport score(VerifierSettings settings, String... lines) {
		return SCORER.analyze(parse(lines), settings);
	}

	private static ReadabilityReport score(String... lines) {
		return score(new VerifierSettings(), lines);
	}

	/**
	 * A function made of the given number of consecutive if statements.
	 */
	private static String[] manyBranches(int count) {
		List<String> lines = new ArrayList<>();
		lines.add("function classify(amount):");
		lines.add("    label = 'none'");
		for (int i = 0; i < count; i++) {
			lines.add("    if amount == limit_" + i + ":");
			lines.add("        label = name_" + i);
		}
		lines.add("    return label");
		return lines.toArray(new String[0]);
	}

	@Test
	public void testCleanFunctionScoresFullMarks() {
		ReadabilityReport report = score(
				"function average(values):",
				"    total = 0",
				"    for value in values:",
				"        total = total + value",
				"    return total / len(values)");
		assertEquals(100.0, report.getOverallScore(), 0.0);
		assertEquals(100.0, report.getComplexityScore(), 0.0);
		assertEquals(100.0, report.getNestingScore(), 0.0);
		assertEquals(100.0, report.getLengthScore(), 0.0);
		assertEquals(100.0, report.getNamingScore(), 0.0);
		assertTrue(report.isPassed());
		assertTrue(report.getViolations().isEmpty());

		assertEquals(1, report.getUnits().size());
		ReadabilityReport.UnitStatistics unit = report.getUnits().get(0);
		assertEquals("average", unit.getName());
		assertEquals(2, unit.getComplexity());
		assertEquals(1, unit.getMaxNesting());
		assertEquals(4, unit.getStatementCount());
	}

	@Test
	public void testNaming() {
		ReadabilityReport report = score("temp = 1", "x = 2", "q = 3", "temp = 4", "total = temp + x + q");
		assertEquals(100.0 - 3 * 15.0, report.getNamingScore(), DELTA);
		assertEquals(30.0 + 25.0 + 20.0 + 0.25 * 55.0, report.getOverallScore(), DELTA);
		assertTrue(report.isPassed());
		assertEquals(2, report.getViolations(ViolationType.NON_DESCRIPTIVE_NAME).size());
		assertEquals(1, report.getViolations(ViolationType.SHORT_NAME).size());
		assertEquals(ReadabilityReport.MODULE_UNIT, report.getUnits().get(0).getName());
	}

	@Test
	public void testNamingExceptions() {
		assertEquals(
				"x and y are fine as parameters",
				100.0,
				score("function plot(x, y):", "    return x + y").getNamingScore(),
				0.0);
		assertEquals(
				"i, j and k are fine as loop variables",
				100.0,
				score("for i in rows:", "    for j in i:", "        print(j)").getNamingScore(),
				0.0);
		ReadabilityReport loopOverX = score("for x in rows:", "    print(x)");
		assertEquals(1, loopOverX.getViolations(ViolationType.NON_DESCRIPTIVE_NAME).size());
		ReadabilityReport singleLetterParameter = score("function scale(n):", "    return n");
		assertEquals(1, singleLetterParameter.getViolations(ViolationType.SHORT_NAME).size());
		assertEquals("scale", singleLetterParameter.getViolations(ViolationType.SHORT_NAME).get(0).getFunctionName());
	}

	@Test
	public void testNamingScoreIsClamped() {
		ReadabilityReport report = score("a1 = 1", "b = 2", "c = 3", "d = 4", "e = 5", "f = 6", "g = 7", "h = 8");
		assertEquals(0.0, report.getNamingScore(), 0.0);
		assertEquals(75.0, report.getOverallScore(), DELTA);
	}

	@Test
	public void testComplexity() {
		ReadabilityReport report = score(manyBranches(20));
		// 1 + 20 ifs
		assertEquals(21, report.getUnits().get(0).getComplexity());
		assertEquals(45.0, report.getComplexityScore(), DELTA);
		assertEquals(0.30 * 45.0 + 25.0 + 20.0 + 25.0, report.getOverallScore(), DELTA);
		assertTrue(report.isPassed());
		List<Violation> complexity = report.getViolations(ViolationType.HIGH_COMPLEXITY);
		assertEquals(1, complexity.size());
		assertEquals("classify", complexity.get(0).getFunctionName());
	}

	@Test
	public void testLogicalOperatorsAreDecisionPoints() {
		ReadabilityReport report = score("if ready and able or forced:", "    go()");
		assertEquals(4, report.getUnits().get(0).getComplexity());
	}

	@Test
	public void testLowScoreFails() {
		VerifierSettings settings = new VerifierSettings();
		settings.setMinReadability(90);
		ReadabilityReport report = score(settings, manyBranches(20));
		assertFalse(report.isPassed());
		assertEquals(90.0, report.getMinScore(), 0.0);
		assertEquals(1, report.getViolations(ViolationType.LOW_READABILITY).size());
	}

	@Test
	public void testNesting() {
		ReadabilityReport report = score(
				"function dig(depth):",
				"    if depth:",
				"        if depth:",
				"            if depth:",
				"                if depth:",
				"                    if depth:",
				"                        return depth");
		assertEquals(5, report.getUnits().get(0).getMaxNesting());
		assertEquals(60.0, report.getNestingScore(), DELTA);
		assertEquals(1, report.getViolations(ViolationType.DEEP_NESTING).size());
	}

	@Test
	public void testUnits() {
		ReadabilityReport report = score(
				"function outer(items):",
				"    function inner(item):",
				"        return item",
				"    return inner(items)",
				"print(outer(1))");
		List<ReadabilityReport.UnitStatistics> units = report.getUnits();
		assertEquals(3, units.size());
		assertEquals(ReadabilityReport.MODULE_UNIT, units.get(0).getName());
		assertEquals("outer", units.get(1).getName());
		assertEquals(2, units.get(1).getStatementCount());
		assertEquals("inner", units.get(2).getName());
	}

	@Test
	public void testConfigurableCurves() {
		VerifierSettings settings = new VerifierSettings();
		settings.setLengthCurve(new ScoreCurve(2, 6));
		ReadabilityReport report = score(settings, "first = 1", "second = 2", "third = 3", "fourth = 4");
		assertEquals(50.0, report.getLengthScore(), DELTA);
		assertEquals(1, report.getViolations(ViolationType.LONG_FUNCTION).size());
		assertThrows(IllegalArgumentException.class, () -> new ScoreCurve(5, 5));
	}
}
