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
 * A constant: {@link Long}, {@link Double}, {@link String}, {@link Boolean}
 * or {@code null} for {@code none}.
 */
public final class LiteralAst extends ExpressionAst {

	private final Object value;

	public LiteralAst(Object value, int line, int column) {
		super(line, column);
		this.value = value;
	}

	public Object getValue() {
		return value;
	}

	/**
	 * @return whether the value is a {@link Long} or a {@link Double}
	 */
	public boolean isNumber() {
		return value instanceof Long || value instanceof Double;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitLiteral(this);
	}

	@Override
	public String toString() {
		if (value == null) {
			return "none";
		}
		if (value instanceof String) {
			String s = (String) value;
			return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\t", "\\t") + "\"";
		}
		return value.toString();
	}
}
