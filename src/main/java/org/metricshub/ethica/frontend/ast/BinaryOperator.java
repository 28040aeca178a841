package org.metricshub.ethica.frontend.ast;

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
 * Binary operators, with their precedence in the expression grammar (a
 * higher number binds tighter).
 */
public enum BinaryOperator {
	OR("or", 1),
	AND("and", 2),
	EQ("==", 3),
	NE("!=", 3),
	LT("<", 4),
	LE("<=", 4),
	GT(">", 4),
	GE(">=", 4),
	ADD("+", 5),
	SUBTRACT("-", 5),
	MULTIPLY("*", 6),
	DIVIDE("/", 6),
	MODULO("%", 6),
	POWER("**", 8);

	/** Precedence of the prefix operators {@code not} and {@code -}. */
	public static final int UNARY_PRECEDENCE = 7;

	private final String symbol;
	private final int precedence;

	BinaryOperator(String symbol, int precedence) {
		this.symbol = symbol;
		this.precedence = precedence;
	}

	public String getSymbol() {
		return symbol;
	}

	public int getPrecedence() {
		return precedence;
	}

	/**
	 * @return {@code true} only for {@code **}
	 */
	public boolean isRightAssociative() {
		return this == POWER;
	}

	/**
	 * @return {@code true} for {@code and} and {@code or}
	 */
	public boolean isLogical() {
		return this == OR || this == AND;
	}

	/**
	 * @return {@code true} for the equality and ordering operators
	 */
	public boolean isComparison() {
		return precedence == 3 || precedence == 4;
	}
}
