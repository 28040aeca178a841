package org.metricshub.ethica.frontend;

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
 * Lexer token kinds.
 */
public enum TokenType {
	// literals
	INTEGER,
	FLOAT,
	STRING,
	TRUE,
	FALSE,
	NONE,

	IDENTIFIER,

	// keywords
	KW_FUNCTION,
	KW_RETURN,
	KW_IF,
	KW_ELSE,
	KW_WHILE,
	KW_FOR,
	KW_IN,
	AND,
	OR,
	NOT,

	// operators
	PLUS,
	MINUS,
	MULT,
	DIVIDE,
	MOD,
	POW,
	EQ,
	NE,
	LT,
	LE,
	GT,
	GE,
	EQUALS,

	// delimiters
	OPEN_PAREN,
	CLOSE_PAREN,
	OPEN_BRACKET,
	CLOSE_BRACKET,
	OPEN_BRACE,
	CLOSE_BRACE,
	COMMA,
	COLON,
	DOT,
	AT,
	ARROW,

	// layout
	NEWLINE,
	INDENT,
	DEDENT,
	EOF;

	/**
	 * @return {@code true} for the tokens that carry a literal value
	 */
	public boolean isLiteral() {
		return this == INTEGER || this == FLOAT || this == STRING || this == TRUE || this == FALSE || this == NONE;
	}

	/**
	 * @return {@code true} for the synthetic tokens that describe the layout
	 *         of the source rather than its text
	 */
	public boolean isLayout() {
		return this == NEWLINE || this == INDENT || this == DEDENT || this == EOF;
	}
}
