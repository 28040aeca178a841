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
 * Report of the readability check: the overall score, its four components
 * and the measures taken on each unit of code.
 */
public class ReadabilityReport extends AnalysisReport {

	/** Name of the unit made of the top-level statements. */
	public static final String MODULE_UNIT = "<module>";

	/**
	 * Measures of one function, or of the top-level statements.
	 */
	public static final class UnitStatistics {

		private final String name;
		private final int complexity;
		private final int maxNesting;
		private final int statementCount;

		public UnitStatistics(String name, int complexity, int maxNesting, int statementCount) {
			this.name = name;
			this.complexity = complexity;
			this.maxNesting = maxNesting;
			this.statementCount = statementCount;
		}

		public String getName() {
			return name;
		}

		public int getComplexity() {
			return complexity;
		}

		public int getMaxNesting() {
			return maxNesting;
		}

		public int getStatementCount() {
			return statementCount;
		}

		@Override
		public String toString() {
			return name + ": complexity=" + complexity + ", nesting=" + maxNesting + ", statements=" + statementCount;
		}
	}

	private final double overallScore;
	private final double minScore;
	private final double complexityScore;
	private final double nestingScore;
	private final double lengthScore;
	private final double namingScore;
	private final List<UnitStatistics> units;

	public ReadabilityReport(
			boolean passed,
			List<Violation> violations,
			double overallScore,
			double minScore,
			double complexityScore,
			double nestingScore,
			double lengthScore,
			double namingScore,
			List<UnitStatistics> units) {
		super(CheckName.READABILITY, passed, violations);
		this.overallScore = overallScore;
		this.minScore = minScore;
		this.complexityScore = complexityScore;
		this.nestingScore = nestingScore;
		this.lengthScore = lengthScore;
		this.namingScore = namingScore;
		this.units = Collections.unmodifiableList(new ArrayList<>(units));
	}

	public double getOverallScore() {
		return overallScore;
	}

	public double getMinScore() {
		return minScore;
	}

	public double getComplexityScore() {
		return complexityScore;
	}

	public double getNestingScore() {
		return nestingScore;
	}

	public double getLengthScore() {
		return lengthScore;
	}

	public double getNamingScore() {
		return namingScore;
	}

	public List<UnitStatistics> getUnits() {
		return units;
	}
}
