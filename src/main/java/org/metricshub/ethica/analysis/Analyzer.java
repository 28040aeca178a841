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

import org.metricshub.ethica.frontend.ast.ProgramAst;
import org.metricshub.ethica.util.VerifierSettings;

/**
 * A static check run over a program before it is allowed to execute.
 * <p>
 * Implementations keep no state between calls and never modify the tree, so
 * one instance may check several programs at the same time.
 */
public interface Analyzer {

	/**
	 * @return the check this analyzer implements
	 */
	CheckName getCheckName();

	/**
	 * Checks a program. Findings are reported, never thrown.
	 *
	 * @param program the program
	 * @param settings thresholds and budgets
	 * @return the report of the check
	 */
	AnalysisReport analyze(ProgramAst program, VerifierSettings settings);
}
