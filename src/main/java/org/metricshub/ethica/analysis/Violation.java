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

import org.metricshub.ethica.frontend.ast.AstNode;

/**
 * One finding of a check: what is wrong, where, and how to fix it.
 */
public final class Violation {

	private final ViolationType type;
	private final String message;
	private final int line;
	private final int column;
	private final String functionName;
	private final String suggestion;

	/**
	 * @param type kind of finding
	 * @param message description of the finding
	 * @param line 1-based line, or -1 when the finding concerns the whole program
	 * @param column 1-based column, or -1
	 * @param functionName enclosing function, {@code null} at the top level
	 * @param suggestion how to fix it, may be {@code null}
	 */
	public Violation(ViolationType type, String message, int line, int column, String functionName, String suggestion) {
		this.type = type;
		this.message = message;
		this.line = line;
		this.column = column;
		this.functionName = functionName;
		this.suggestion = suggestion;
	}

	/**
	 * Creates a finding located at a node.
	 */
	public static Violation at(
			ViolationType type,
			AstNode node,
			String functionName,
			String message,
			String suggestion) {
		return new Violation(type, message, node.getLine(), node.getColumn(), functionName, suggestion);
	}

	/**
	 * Creates a finding about the whole program.
	 */
	public static Violation global(ViolationType type, String message, String suggestion) {
		return new Violation(type, message, -1, -1, null, suggestion);
	}

	public ViolationType getType() {
		return type;
	}

	public String getMessage() {
		return message;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public String getFunctionName() {
		return functionName;
	}

	public String getSuggestion() {
		return suggestion;
	}

	/**
	 * @return "line L:C in function F", or the parts of it that are known
	 */
	public String getLocation() {
		StringBuilder sb = new StringBuilder();
		if (line > 0) {
			sb.append("line ").append(line);
			if (column > 0) {
				sb.append(':').append(column);
			}
		}
		if (functionName != null) {
			if (sb.length() > 0) {
				sb.append(' ');
			}
			sb.append("in function ").append(functionName);
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		String location = getLocation();
		return type + (location.isEmpty() ? "" : " (" + location + ")") + ": " + message;
	}
}
