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
 * {@code for variable in iterable:} block.
 */
public final class ForInStatementAst extends StatementAst {

	private final String variable;
	private final ExpressionAst iterable;
	private final List<StatementAst> body;

	public ForInStatementAst(String variable, ExpressionAst iterable, List<StatementAst> body, int line, int column) {
		super(line, column);
		this.variable = variable;
		this.iterable = iterable;
		this.body = immutable(body);
	}

	public String getVariable() {
		return variable;
	}

	public ExpressionAst getIterable() {
		return iterable;
	}

	public List<StatementAst> getBody() {
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitForInStatement(this);
	}

	@Override
	public String toString() {
		return "for " + variable + " in " + iterable;
	}
}
