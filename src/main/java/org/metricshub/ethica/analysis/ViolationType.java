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
 * Kinds of findings, each belonging to one check.
 */
public enum ViolationType {
	BUDGET_EXCEEDED(CheckName.ENERGY),
	EXCESSIVE_LOOP_NESTING(CheckName.ENERGY),
	RECURSION_DETECTED(CheckName.ENERGY),

	MISSING_ANNOTATION(CheckName.ETHICS),
	DISALLOWED_OPERATION(CheckName.ETHICS),
	HARDCODED_SECRET(CheckName.ETHICS),

	HIGH_COMPLEXITY(CheckName.READABILITY),
	DEEP_NESTING(CheckName.READABILITY),
	LONG_FUNCTION(CheckName.READABILITY),
	SHORT_NAME(CheckName.READABILITY),
	NON_DESCRIPTIVE_NAME(CheckName.READABILITY),
	LOW_READABILITY(CheckName.READABILITY),

	EXPRESSION_TOO_DEEP(CheckName.CLEVERNESS),
	LONG_CHAIN(CheckName.CLEVERNESS),
	COMPLEX_ONE_LINER(CheckName.CLEVERNESS),
	MAGIC_NUMBER(CheckName.CLEVERNESS),
	SINGLE_LETTER_NAME(CheckName.CLEVERNESS),
	TOO_MANY_PARAMETERS(CheckName.CLEVERNESS),
	CHAINED_COMPARISON(CheckName.CLEVERNESS);

	private final CheckName check;

	ViolationType(CheckName check) {
		this.check = check;
	}

	public CheckName getCheck() {
		return check;
	}
}
