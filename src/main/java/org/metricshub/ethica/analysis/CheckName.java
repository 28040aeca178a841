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

import java.util.Locale;

/**
 * The four static checks a program must pass before it may run. The order of
 * the constants is the order of the reports.
 */
public enum CheckName {
	ENERGY("energy"),
	ETHICS("ethics"),
	READABILITY("readability"),
	CLEVERNESS("cleverness");

	private final String id;

	CheckName(String id) {
		this.id = id;
	}

	/**
	 * @return the lowercase name used on the command line and in reports
	 */
	public String getId() {
		return id;
	}

	/**
	 * @param id name of the check, case insensitive
	 * @return the check
	 * @throws IllegalArgumentException if there is no such check
	 */
	public static CheckName fromId(String id) {
		for (CheckName check : values()) {
			if (check.id.equals(id.toLowerCase(Locale.ROOT))) {
				return check;
			}
		}
		throw new IllegalArgumentException("Unknown check: " + id);
	}

	@Override
	public String toString() {
		return id;
	}
}
