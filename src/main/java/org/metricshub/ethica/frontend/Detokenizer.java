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

import java.util.List;

/**
 * Renders a token list back into source text.
 * <p>
 * Lexemes of a logical line are separated by single spaces and each line is
 * indented by four spaces per open {@link TokenType#INDENT}. Tokenizing the
 * result again gives the same token kinds with the same block structure;
 * the original spacing, comments and blank lines are lost.
 */
public final class Detokenizer {

	private static final String INDENT_UNIT = "    ";

	private Detokenizer() {}

	/**
	 * @param tokens tokens produced by {@link Lexer#tokenize()}
	 * @return the source text
	 */
	public static String detokenize(List<Token> tokens) {
		StringBuilder sb = new StringBuilder();
		int level = 0;
		boolean lineStart = true;
		for (Token token : tokens) {
			switch (token.getType()) {
			case INDENT:
				level++;
				break;
			case DEDENT:
				if (level == 0) {
					throw new IllegalArgumentException("unbalanced DEDENT at " + token.getLine() + ":" + token.getColumn());
				}
				level--;
				break;
			case NEWLINE:
				sb.append('\n');
				lineStart = true;
				break;
			case EOF:
				return sb.toString();
			default:
				if (lineStart) {
					for (int i = 0; i < level; i++) {
						sb.append(INDENT_UNIT);
					}
					lineStart = false;
				} else {
					sb.append(' ');
				}
				sb.append(token.getLexeme());
				break;
			}
		}
		return sb.toString();
	}
}
