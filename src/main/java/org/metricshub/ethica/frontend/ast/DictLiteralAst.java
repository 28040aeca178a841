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

import java.util.List;

/**
 * {@code {key: value, ...}}. Keys and values are kept in two lists of the
 * same size, in source order.
 */
public final class DictLiteralAst extends ExpressionAst {

	private final List<ExpressionAst> keys;
	private final List<ExpressionAst> values;

	public DictLiteralAst(List<ExpressionAst> keys, List<ExpressionAst> values, int line, int column) {
		super(line, column);
		if (keys.size() != values.size()) {
			throw new IllegalArgumentException("keys and values must have the same size");
		}
		this.keys = immutable(keys);
		this.values = immutable(values);
	}

	public List<ExpressionAst> getKeys() {
		return keys;
	}

	public List<ExpressionAst> getValues() {
		return values;
	}

	public int size() {
		return keys.size();
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitDictLiteral(this);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		for (int i = 0; i < keys.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(keys.get(i)).append(": ").append(values.get(i));
		}
		return sb.append('}').toString();
	}
}
