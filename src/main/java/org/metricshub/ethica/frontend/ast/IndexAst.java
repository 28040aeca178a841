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

public final class IndexAst extends ExpressionAst {

	private final ExpressionAst object;
	private final ExpressionAst index;

	public IndexAst(ExpressionAst object, ExpressionAst index, int line, int column) {
		super(line, column);
		this.object = object;
		this.index = index;
	}

	public ExpressionAst getObject() {
		return object;
	}

	public ExpressionAst getIndex() {
		return index;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitIndex(this);
	}

	@Override
	public String toString() {
		return object + "[" + index + "]";
	}
}
