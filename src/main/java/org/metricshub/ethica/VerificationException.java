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
import org.metricshub.ethica.analysis.CheckName;
import org.metricshub.ethica.analysis.VerificationResult;

/**
 * Thrown by {@link Ethica#run(String, org.metricshub.ethica.util.VerifierSettings)}
 * when a program does not pass verification. It is never executed in that case.
 */
public class VerificationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final transient VerificationResult result;

	/**
	 * @param result the failed verification
	 */
	public VerificationException(VerificationResult result) {
		super(describe(result));
		this.result = result;
	}

	/**
	 * @return the reports that rejected the program
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "the result is immutable")
	public VerificationResult getResult() {
		return result;
	}

	private static String describe(VerificationResult result) {
		StringBuilder failed = new StringBuilder();
		for (CheckName check : result.getReports().keySet()) {
			if (!result.getReport(check).isPassed()) {
				if (failed.length() > 0) {
					failed.append(", ");
				}
				failed.append(check.getId());
			}
		}
		return "Program rejected by verification (failed checks: " + failed + ")";
	}
}
