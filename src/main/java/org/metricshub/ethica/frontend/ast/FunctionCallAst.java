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
 * {@code callee(arg, ...)}. The callee is usually an {@link IdentifierAst}
 * but may be any postfix expression.
 */
public final class FunctionCallAst extends ExpressionAst {

	private final ExpressionAst callee;
	private final List<ExpressionAst> arguments;

	public FunctionCallAst(ExpressionAst callee, List<ExpressionAst> arguments, int line, int column) {
		super(line, column);
		this.callee = callee;
		this.arguments = immutable(arguments);
	}

	public ExpressionAst getCallee() {
		return callee;
	}

	public List<ExpressionAst> getArguments() {
		return arguments;
	}

	/**
	 * Name of the called function: the identifier for a plain call, the
	 * member name for {@code obj.name(...)}.
	 *
	 * @return the name, or {@code null} if the callee is some other expression
	 */
	public String getCalleeName() {
		if (callee instanceof IdentifierAst) {
			return ((IdentifierAst) callee).getName();
		}
		if (callee instanceof MemberAst) {
			return ((MemberAst) callee).getName();
		}
		return null;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitFunctionCall(this);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder().append(callee).append('(');
		for (int i = 0; i < arguments.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(arguments.get(i));
		}
		return sb.append(')').toString();
	}
}
