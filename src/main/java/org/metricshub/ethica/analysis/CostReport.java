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
import java.util.Set;
import java.util.TreeSet;

/**
 * Report of the energy check, with the estimated cost of the program and of
 * each top-level statement.
 */
public class CostReport extends AnalysisReport {

	/**
	 * Estimated cost of one top-level statement.
	 */
	public static final class Contributor {

		private final String description;
		private final int line;
		private final long cost;

		public Contributor(String description, int line, long cost) {
			this.description = description;
			this.line = line;
			this.cost = cost;
		}

		public String getDescription() {
			return description;
		}

		public int getLine() {
			return line;
		}

		public long getCost() {
			return cost;
		}

		@Override
		public String toString() {
			return description + " (line " + line + "): " + cost;
		}
	}

	private final long totalCost;
	private final long budget;
	private final List<Contributor> contributors;
	private final Set<String> recursiveFunctions;

	public CostReport(
			boolean passed,
			List<Violation> violations,
			long totalCost,
			long budget,
			List<Contributor> contributors,
			Set<String> recursiveFunctions) {
		super(CheckName.ENERGY, passed, violations);
		this.totalCost = totalCost;
		this.budget = budget;
		this.contributors = Collections.unmodifiableList(new ArrayList<>(contributors));
		this.recursiveFunctions = Collections.unmodifiableSet(new TreeSet<>(recursiveFunctions));
	}

	public long getTotalCost() {
		return totalCost;
	}

	public long getBudget() {
		return budget;
	}

	/**
	 * @return the top-level statements, most expensive first
	 */
	public List<Contributor> getContributors() {
		return contributors;
	}

	/**
	 * @return names of the functions that take part in a call cycle, sorted
	 */
	public Set<String> getRecursiveFunctions() {
		return recursiveFunctions;
	}
}
