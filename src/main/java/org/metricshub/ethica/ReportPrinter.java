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

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import org.metricshub.ethica.analysis.AnalysisReport;
import org.metricshub.ethica.analysis.CostReport;
import org.metricshub.ethica.analysis.ReadabilityReport;
import org.metricshub.ethica.analysis.VerificationResult;
import org.metricshub.ethica.analysis.Violation;

/**
 * Formats verification reports as text for the command line.
 */
final class ReportPrinter {

	/** Cost contributors listed in a verbose energy report */
	static final int MAX_CONTRIBUTORS = 5;

	private final PrintStream out;
	private final boolean verbose;

	ReportPrinter(PrintStream out, boolean verbose) {
		this.out = out;
		this.verbose = verbose;
	}

	/**
	 * Prints the reports of a verification.
	 *
	 * @param result the verification
	 * @param all print passed reports too, otherwise only failed ones
	 */
	void print(VerificationResult result, boolean all) {
		for (AnalysisReport report : result.getReports().values()) {
			if (all || verbose || !report.isPassed()) {
				print(report);
			}
		}
		out.println("Verification " + (result.isPassed() ? "PASSED" : "FAILED"));
	}

	void print(AnalysisReport report) {
		out.println("[" + report.getCheckName() + "] " + (report.isPassed() ? "passed" : "FAILED"));
		if (report instanceof CostReport) {
			printCost((CostReport) report);
		} else if (report instanceof ReadabilityReport) {
			printReadability((ReadabilityReport) report);
		}
		for (Violation violation : report.getViolations()) {
			out.println("  " + violation);
			if (violation.getSuggestion() != null) {
				out.println("    suggestion: " + violation.getSuggestion());
			}
		}
	}

	private void printCost(CostReport report) {
		out.println("  estimated cost: " + report.getTotalCost() + " (budget " + report.getBudget() + ")");
		if (!report.getRecursiveFunctions().isEmpty()) {
			out.println("  recursive functions: " + String.join(", ", report.getRecursiveFunctions()));
		}
		if (verbose || !report.isPassed()) {
			List<CostReport.Contributor> contributors = report.getContributors();
			for (int i = 0; i < contributors.size() && i < MAX_CONTRIBUTORS; i++) {
				out.println("  " + contributors.get(i));
			}
		}
	}

	private void printReadability(ReadabilityReport report) {
		out
				.println(
						String
								.format(
										Locale.ROOT,
										"  score: %.2f (minimum %.2f)",
										report.getOverallScore(),
										report.getMinScore()));
		if (verbose) {
			out
					.println(
							String
									.format(
											Locale.ROOT,
											"  complexity %.2f, nesting %.2f, length %.2f, naming %.2f",
											report.getComplexityScore(),
											report.getNestingScore(),
											report.getLengthScore(),
											report.getNamingScore()));
			for (ReadabilityReport.UnitStatistics unit : report.getUnits()) {
				out.println("  " + unit);
			}
		}
	}
}
