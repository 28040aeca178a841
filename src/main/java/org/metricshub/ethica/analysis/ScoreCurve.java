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

/**
 * Maps a measure where lower is better onto a 0-100 score: 100 up to the
 * threshold, 0 from the cap on, linear in between.
 */
public final class ScoreCurve {

	private final double threshold;
	private final double cap;

	/**
	 * @param threshold largest value that still scores 100
	 * @param cap smallest value that scores 0, greater than {@code threshold}
	 */
	public ScoreCurve(double threshold, double cap) {
		if (threshold < 0 || cap <= threshold) {
			throw new IllegalArgumentException("Invalid score curve: threshold=" + threshold + ", cap=" + cap);
		}
		this.threshold = threshold;
		this.cap = cap;
	}

	public double getThreshold() {
		return threshold;
	}

	public double getCap() {
		return cap;
	}

	/**
	 * @param value the measure
	 * @return the score, between 0 and 100
	 */
	public double score(double value) {
		if (value <= threshold) {
			return 100.0;
		}
		if (value >= cap) {
			return 0.0;
		}
		return 100.0 * (cap - value) / (cap - threshold);
	}

	@Override
	public String toString() {
		return threshold + "/" + cap;
	}
}
