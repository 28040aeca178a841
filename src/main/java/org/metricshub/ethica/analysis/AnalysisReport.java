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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one check on one program.
 */
public class AnalysisReport {

	private final CheckName checkName;
	private final boolean passed;
	private final List<Violation> violations;

	public AnalysisReport(CheckName checkName, boolean passed, List<Violation> violations) {
		this.checkName = checkName;
		this.passed = passed;
		this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
	}

	public CheckName getCheckName() {
		return checkName;
	}

	public boolean isPassed() {
		return passed;
	}

	public List<Violation> getViolations() {
		return violations;
	}

	/**
	 * @param type kind of finding
	 * @return the findings of that kind, in report order
	 */
	public List<Violation> getViolations(ViolationType type) {
		List<Violation> result = new ArrayList<>();
		for (Violation violation : violations) {
			if (violation.getType() == type) {
				result.add(violation);
			}
		}
		return result;
	}

	@Override
	public String toString() {
		return checkName + ": " + (passed ? "passed" : "failed") + " (" + violations.size() + " violations)";
	}
}
