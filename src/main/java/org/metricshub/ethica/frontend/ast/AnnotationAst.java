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
 * {@code @name} or {@code @name(literal, ...)} placed before a function
 * definition.
 */
public final class AnnotationAst extends AstNode {

	private final String name;
	private final List<LiteralAst> arguments;

	public AnnotationAst(String name, List<LiteralAst> arguments, int line, int column) {
		super(line, column);
		this.name = name;
		this.arguments = immutable(arguments);
	}

	public String getName() {
		return name;
	}

	public List<LiteralAst> getArguments() {
		return arguments;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitAnnotation(this);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("@").append(name);
		if (!arguments.isEmpty()) {
			sb.append('(');
			for (int i = 0; i < arguments.size(); i++) {
				if (i > 0) {
					sb.append(", ");
				}
				sb.append(arguments.get(i));
			}
			sb.append(')');
		}
		return sb.toString();
	}
}
