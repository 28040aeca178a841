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

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the tree: the top-level statements of one program, in source order.
 */
public final class ProgramAst extends AstNode {

	private final List<StatementAst> statements;

	public ProgramAst(List<StatementAst> statements) {
		super(1, 1);
		this.statements = immutable(statements);
	}

	public List<StatementAst> getStatements() {
		return statements;
	}

	/**
	 * @return the top-level function definitions, in source order
	 */
	public List<FunctionDefAst> getFunctions() {
		List<FunctionDefAst> functions = new ArrayList<>();
		for (StatementAst statement : statements) {
			if (statement instanceof FunctionDefAst) {
				functions.add((FunctionDefAst) statement);
			}
		}
		return functions;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitProgram(this);
	}

	@Override
	public String toString() {
		return "program (" + statements.size() + " statements)";
	}
}
