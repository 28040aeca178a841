package org.metricshub.ethica.analysis;

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
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.metricshub.ethica.frontend.ast.ProgramAst;

/**
 * Outcome of the verification of a program: one report per enabled check,
 * in the order of {@link CheckName}.
 */
public final class VerificationResult {

	private final ProgramAst program;
	private final Map<CheckName, AnalysisReport> reports;
	private final boolean passed;

	public VerificationResult(ProgramAst program, Map<CheckName, AnalysisReport> reports) {
		this.program = program;
		Map<CheckName, AnalysisReport> copy = new EnumMap<>(CheckName.class);
		copy.putAll(reports);
		this.reports = Collections.unmodifiableMap(copy);
		boolean allPassed = true;
		for (AnalysisReport report : copy.values()) {
			allPassed &= report.isPassed();
		}
		this.passed = allPassed;
	}

	/**
	 * @return the verified program
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "the tree is immutable")
	public ProgramAst getProgram() {
		return program;
	}

	/**
	 * @return whether every enabled check passed; {@code true} when no check
	 *         was enabled
	 */
	public boolean isPassed() {
		return passed;
	}

	public Map<CheckName, AnalysisReport> getReports() {
		return reports;
	}

	/**
	 * @param check a check
	 * @return its report, or {@code null} if the check was not enabled
	 */
	public AnalysisReport getReport(CheckName check) {
		return reports.get(check);
	}

	/**
	 * @return the energy report, or {@code null} if the check was not enabled
	 *         or its analyzer does not produce a {@link CostReport}
	 */
	public CostReport getCostReport() {
		AnalysisReport report = reports.get(CheckName.ENERGY);
		return report instanceof CostReport ? (CostReport) report : null;
	}

	/**
	 * @return the readability report, or {@code null} if the check was not
	 *         enabled or its analyzer does not produce a {@link ReadabilityReport}
	 */
	public ReadabilityReport getReadabilityReport() {
		AnalysisReport report = reports.get(CheckName.READABILITY);
		return report instanceof ReadabilityReport ? (ReadabilityReport) report : null;
	}

	@Override
	public String toString() {
		return (passed ? "passed" : "failed") + " " + reports.values();
	}
}
