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
 * A single lexeme of an Ethica program, with its position in the source.
 * <p>
 * Tokens for literals also carry the decoded value ({@link Long},
 * {@link Double}, {@link String}, {@link Boolean}, or {@code null} for
 * {@code none}). Other kinds of tokens have a {@code null} literal.
 */
public final class Token {

	private final TokenType type;
	private final String lexeme;
	private final Object literal;
	private final int line;
	private final int column;

	/**
	 * Creates a token.
	 *
	 * @param type kind of the token
	 * @param lexeme exact source text of the token (empty for layout tokens)
	 * @param literal decoded value of a literal token, {@code null} otherwise
	 * @param line 1-based line of the first character
	 * @param column 1-based column of the first character
	 */
	public Token(TokenType type, String lexeme, Object literal, int line, int column) {
		this.type = type;
		this.lexeme = lexeme;
		this.literal = literal;
		this.line = line;
		this.column = column;
	}

	public TokenType getType() {
		return type;
	}

	public String getLexeme() {
		return lexeme;
	}

	public Object getLiteral() {
		return literal;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	/**
	 * Describes the token the way error messages quote it.
	 *
	 * @return the lexeme, or the token kind for layout tokens
	 */
	public String describe() {
		if (type.isLayout()) {
			return type.name();
		}
		return lexeme;
	}

	@Override
	public String toString() {
		return type + " " + lexeme + " " + line + ":" + column;
	}
}
