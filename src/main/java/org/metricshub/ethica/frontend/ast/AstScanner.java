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
 * Visitor that walks the whole tree, left to right and depth first, and
 * returns {@code null} from every method.
 * <p>
 * Subclasses override the methods of the nodes they are interested in and
 * call the {@code super} method (or {@link #scan(AstNode)} on selected
 * children) to keep descending.
 *
 * @param <R> result type of the visitor
 */
public abstract class AstScanner<R> implements AstVisitor<R> {

	/**
	 * Visits a node, if not {@code null}.
	 *
	 * @param node the node to visit
	 * @return the result of the visit, {@code null} for a {@code null} node
	 */
	public R scan(AstNode node) {
		return node == null ? null : node.accept(this);
	}

	/**
	 * Visits every node of a list, in order.
	 *
	 * @param nodes the nodes
	 */
	public void scanAll(List<? extends AstNode> nodes) {
		for (AstNode node : nodes) {
			node.accept(this);
		}
	}

	@Override
	public R visitProgram(ProgramAst program) {
		scanAll(program.getStatements());
		return null;
	}

	@Override
	public R visitFunctionDef(FunctionDefAst functionDef) {
		scanAll(functionDef.getAnnotations());
		scanAll(functionDef.getBody());
		return null;
	}

	@Override
	public R visitAnnotation(AnnotationAst annotation) {
		scanAll(annotation.getArguments());
		return null;
	}

	@Override
	public R visitAssignment(AssignmentAst assignment) {
		scan(assignment.getValue());
		return null;
	}

	@Override
	public R visitIfStatement(IfStatementAst ifStatement) {
		scan(ifStatement.getCondition());
		scanAll(ifStatement.getThenBlock());
		scanAll(ifStatement.getElseBlock());
		return null;
	}

	@Override
	public R visitWhileStatement(WhileStatementAst whileStatement) {
		scan(whileStatement.getCondition());
		scanAll(whileStatement.getBody());
		return null;
	}

	@Override
	public R visitForInStatement(ForInStatementAst forInStatement) {
		scan(forInStatement.getIterable());
		scanAll(forInStatement.getBody());
		return null;
	}

	@Override
	public R visitReturnStatement(ReturnStatementAst returnStatement) {
		scan(returnStatement.getValue());
		return null;
	}

	@Override
	public R visitExpressionStatement(ExpressionStatementAst expressionStatement) {
		scan(expressionStatement.getExpression());
		return null;
	}

	@Override
	public R visitBinaryExpression(BinaryExpressionAst binaryExpression) {
		scan(binaryExpression.getLeft());
		scan(binaryExpression.getRight());
		return null;
	}

	@Override
	public R visitUnaryExpression(UnaryExpressionAst unaryExpression) {
		scan(unaryExpression.getOperand());
		return null;
	}

	@Override
	public R visitFunctionCall(FunctionCallAst functionCall) {
		scan(functionCall.getCallee());
		scanAll(functionCall.getArguments());
		return null;
	}

	@Override
	public R visitIndex(IndexAst index) {
		scan(index.getObject());
		scan(index.getIndex());
		return null;
	}

	@Override
	public R visitMember(MemberAst member) {
		scan(member.getObject());
		return null;
	}

	@Override
	public R visitListLiteral(ListLiteralAst listLiteral) {
		scanAll(listLiteral.getElements());
		return null;
	}

	@Override
	public R visitDictLiteral(DictLiteralAst dictLiteral) {
		for (int i = 0; i < dictLiteral.size(); i++) {
			scan(dictLiteral.getKeys().get(i));
			scan(dictLiteral.getValues().get(i));
		}
		return null;
	}

	@Override
	public R visitIdentifier(IdentifierAst identifier) {
		return null;
	}

	@Override
	public R visitLiteral(LiteralAst literal) {
		return null;
	}
}
