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

import java.io.PrintStream;
import java.util.List;

/**
 * Prints a tree one statement per line, indented by one space per block
 * level. Expressions are printed on the line of their statement, fully
 * parenthesized.
 */
class AstPrinter extends AstScanner<Void> {

	private final PrintStream ps;
	private int level;

	AstPrinter(PrintStream ps) {
		this.ps = ps;
	}

	void print(AstNode node) {
		node.accept(this);
	}

	private String indent() {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < level; i++) {
			spaces.append(' ');
		}
		return spaces.toString();
	}

	private void line(AstNode node) {
		ps.println(indent() + node.getClass().getSimpleName() + " " + node + " [" + node.getLine() + ":" + node.getColumn() + "]");
	}

	private void block(List<StatementAst> statements) {
		level++;
		scanAll(statements);
		level--;
	}

	@Override
	public Void visitProgram(ProgramAst program) {
		line(program);
		block(program.getStatements());
		return null;
	}

	@Override
	public Void visitFunctionDef(FunctionDefAst functionDef) {
		line(functionDef);
		level++;
		scanAll(functionDef.getAnnotations());
		level--;
		block(functionDef.getBody());
		return null;
	}

	@Override
	public Void visitAnnotation(AnnotationAst annotation) {
		line(annotation);
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatementAst ifStatement) {
		line(ifStatement);
		block(ifStatement.getThenBlock());
		if (ifStatement.hasElse()) {
			ps.println(indent() + "else");
			block(ifStatement.getElseBlock());
		}
		return null;
	}

	@Override
	public Void visitWhileStatement(WhileStatementAst whileStatement) {
		line(whileStatement);
		block(whileStatement.getBody());
		return null;
	}

	@Override
	public Void visitForInStatement(ForInStatementAst forInStatement) {
		line(forInStatement);
		block(forInStatement.getBody());
		return null;
	}

	@Override
	public Void visitAssignment(AssignmentAst assignment) {
		line(assignment);
		return null;
	}

	@Override
	public Void visitReturnStatement(ReturnStatementAst returnStatement) {
		line(returnStatement);
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatementAst expressionStatement) {
		line(expressionStatement);
		return null;
	}
}
