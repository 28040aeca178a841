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

import java.util.Collections;
import java.util.List;

/**
 * {@code if cond:} block, optionally followed by {@code else:} block.
 */
public final class IfStatementAst extends StatementAst {

	private final ExpressionAst condition;
	private final List<StatementAst> thenBlock;
	private final List<StatementAst> elseBlock;

	/**
	 * @param condition the condition
	 * @param thenBlock statements run when the condition holds
	 * @param elseBlock statements run otherwise, {@code null} when there is
	 *        no {@code else} clause
	 * @param line line of the {@code if} keyword
	 * @param column column of the {@code if} keyword
	 */
	public IfStatementAst(
			ExpressionAst condition,
			List<StatementAst> thenBlock,
			List<StatementAst> elseBlock,
			int line,
			int column) {
		super(line, column);
		this.condition = condition;
		this.thenBlock = immutable(thenBlock);
		this.elseBlock = elseBlock == null ? Collections.<StatementAst>emptyList() : immutable(elseBlock);
	}

	public ExpressionAst getCondition() {
		return condition;
	}

	public List<StatementAst> getThenBlock() {
		return thenBlock;
	}

	/**
	 * @return the else block, empty when there is no {@code else} clause
	 */
	public List<StatementAst> getElseBlock() {
		return elseBlock;
	}

	public boolean hasElse() {
		return !elseBlock.isEmpty();
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitIfStatement(this);
	}

	@Override
	public String toString() {
		return "if " + condition;
	}
}
