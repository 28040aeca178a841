package org.metricshub.ethica.util;

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
import java.io.PrintStream;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import org.metricshub.ethica.analysis.CheckName;
import org.metricshub.ethica.analysis.ScoreCurve;

/**
 * Parameters of the verification of a program, and of its execution.
 * <p>
 * Setters reject values that make no sense with an
 * {@link IllegalArgumentException}, so an instance is always usable.
 */
public class VerifierSettings {

	/** Deepest loop nesting the energy check accepts without a finding. */
	public static final int DEFAULT_MAX_LOOP_NESTING = 4;

	/**
	 * Largest estimated cost accepted by the energy check;
	 * 1000 by default.
	 */
	private long energyBudget = 1000;

	/**
	 * Smallest overall score accepted by the readability check, between 0 and
	 * 100; 70 by default.
	 */
	private double minReadability = 70.0;

	/**
	 * The checks to run. All of them by default.
	 */
	private Set<CheckName> enabledChecks = EnumSet.allOf(CheckName.class);

	/**
	 * How many nested calls the energy check assumes for a recursive function.
	 */
	private int maxRecursionDepth = 10;

	/**
	 * Iterations assumed for a loop whose count cannot be known statically.
	 */
	private long defaultLoopIterations = 100;

	/**
	 * Loops nested deeper than this are reported by the energy check;
	 * {@value #DEFAULT_MAX_LOOP_NESTING} by default.
	 */
	private int maxLoopNesting = DEFAULT_MAX_LOOP_NESTING;

	/**
	 * Whether the checks run concurrently;
	 * <code>false</code> by default.
	 */
	private boolean parallel = false;

	private ScoreCurve complexityCurve = new ScoreCurve(10, 30);

	private ScoreCurve nestingCurve = new ScoreCurve(3, 8);

	private ScoreCurve lengthCurve = new ScoreCurve(50, 150);

	/**
	 * Points taken off the naming score for each badly named identifier.
	 */
	private double namingPenalty = 15.0;

	/**
	 * Where {@code print} writes when the program runs;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("energyBudget = ").append(getEnergyBudget()).append(newLine);
		desc.append("minReadability = ").append(getMinReadability()).append(newLine);
		desc.append("enabledChecks = ").append(getEnabledChecks()).append(newLine);
		desc.append("maxRecursionDepth = ").append(getMaxRecursionDepth()).append(newLine);
		desc.append("defaultLoopIterations = ").append(getDefaultLoopIterations()).append(newLine);
		desc.append("maxLoopNesting = ").append(getMaxLoopNesting()).append(newLine);
		desc.append("parallel = ").append(isParallel()).append(newLine);
		desc.append("complexityCurve = ").append(getComplexityCurve()).append(newLine);
		desc.append("nestingCurve = ").append(getNestingCurve()).append(newLine);
		desc.append("lengthCurve = ").append(getLengthCurve()).append(newLine);
		desc.append("namingPenalty = ").append(getNamingPenalty()).append(newLine);

		return desc.toString();
	}

	public long getEnergyBudget() {
		return energyBudget;
	}

	/**
	 * @param energyBudget the budget, strictly positive
	 */
	public void setEnergyBudget(long energyBudget) {
		if (energyBudget <= 0) {
			throw new IllegalArgumentException("Energy budget must be positive: " + energyBudget);
		}
		this.energyBudget = energyBudget;
	}

	public double getMinReadability() {
		return minReadability;
	}

	/**
	 * @param minReadability the minimum score, between 0 and 100
	 */
	public void setMinReadability(double minReadability) {
		if (!(minReadability >= 0 && minReadability <= 100)) {
			throw new IllegalArgumentException("Minimum readability must be between 0 and 100: " + minReadability);
		}
		this.minReadability = minReadability;
	}

	/**
	 * @return a copy of the enabled checks
	 */
	public Set<CheckName> getEnabledChecks() {
		return enabledChecks.isEmpty() ? EnumSet.noneOf(CheckName.class) : EnumSet.copyOf(enabledChecks);
	}

	public void setEnabledChecks(Collection<CheckName> checks) {
		this.enabledChecks = checks.isEmpty() ? EnumSet.noneOf(CheckName.class) : EnumSet.copyOf(checks);
	}

	public boolean isEnabled(CheckName check) {
		return enabledChecks.contains(check);
	}

	public void enable(CheckName check) {
		enabledChecks.add(check);
	}

	public void disable(CheckName check) {
		enabledChecks.remove(check);
	}

	public int getMaxRecursionDepth() {
		return maxRecursionDepth;
	}

	public void setMaxRecursionDepth(int maxRecursionDepth) {
		if (maxRecursionDepth < 1) {
			throw new IllegalArgumentException("Maximum recursion depth must be at least 1: " + maxRecursionDepth);
		}
		this.maxRecursionDepth = maxRecursionDepth;
	}

	public long getDefaultLoopIterations() {
		return defaultLoopIterations;
	}

	public void setDefaultLoopIterations(long defaultLoopIterations) {
		if (defaultLoopIterations < 1) {
			throw new IllegalArgumentException("Default loop iterations must be at least 1: " + defaultLoopIterations);
		}
		this.defaultLoopIterations = defaultLoopIterations;
	}

	public int getMaxLoopNesting() {
		return maxLoopNesting;
	}

	public void setMaxLoopNesting(int maxLoopNesting) {
		if (maxLoopNesting < 1) {
			throw new IllegalArgumentException("Maximum loop nesting must be at least 1: " + maxLoopNesting);
		}
		this.maxLoopNesting = maxLoopNesting;
	}

	public boolean isParallel() {
		return parallel;
	}

	public void setParallel(boolean parallel) {
		this.parallel = parallel;
	}

	public ScoreCurve getComplexityCurve() {
		return complexityCurve;
	}

	public void setComplexityCurve(ScoreCurve complexityCurve) {
		this.complexityCurve = requireCurve(complexityCurve);
	}

	public ScoreCurve getNestingCurve() {
		return nestingCurve;
	}

	public void setNestingCurve(ScoreCurve nestingCurve) {
		this.nestingCurve = requireCurve(nestingCurve);
	}

	public ScoreCurve getLengthCurve() {
		return lengthCurve;
	}

	public void setLengthCurve(ScoreCurve lengthCurve) {
		this.lengthCurve = requireCurve(lengthCurve);
	}

	public double getNamingPenalty() {
		return namingPenalty;
	}

	public void setNamingPenalty(double namingPenalty) {
		if (!(namingPenalty >= 0)) {
			throw new IllegalArgumentException("Naming penalty must not be negative: " + namingPenalty);
		}
		this.namingPenalty = namingPenalty;
	}

	/**
	 * @return the stream {@code print} writes to
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "PrintStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the stream {@code print} writes to (instead of System.out by default)
	 *
	 * @param outputStream stream to use for print statements
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream outputStream) {
		if (outputStream == null) {
			throw new IllegalArgumentException("Output stream must not be null");
		}
		this.outputStream = outputStream;
	}

	private static ScoreCurve requireCurve(ScoreCurve curve) {
		if (curve == null) {
			throw new IllegalArgumentException("Score curve must not be null");
		}
		return curve;
	}
}
