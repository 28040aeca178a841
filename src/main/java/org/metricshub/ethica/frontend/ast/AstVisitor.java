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
 * Operation over the Ethica syntax tree, with one method per node class.
 * <p>
 * Adding a node class adds a method here, so every visitor that does not
 * handle the new node stops compiling. Visitors that only care about a few
 * node classes extend {@link AstScanner} instead of implementing this
 * interface directly.
 *
 * @param <R> result type of the operation
 */
public interface AstVisitor<R> {

	R visitProgram(ProgramAst program);

	R visitFunctionDef(FunctionDefAst functionDef);

	R visitAnnotation(AnnotationAst annotation);

	R visitAssignment(AssignmentAst assignment);

	R visitIfStatement(IfStatementAst ifStatement);

	R visitWhileStatement(WhileStatementAst whileStatement);

	R visitForInStatement(ForInStatementAst forInStatement);

	R visitReturnStatement(ReturnStatementAst returnStatement);

	R visitExpressionStatement(ExpressionStatementAst expressionStatement);

	R visitBinaryExpression(BinaryExpressionAst binaryExpression);

	R visitUnaryExpression(UnaryExpressionAst unaryExpression);

	R visitFunctionCall(FunctionCallAst functionCall);

	R visitIndex(IndexAst index);

	R visitMember(MemberAst member);

	R visitListLiteral(ListLiteralAst listLiteral);

	R visitDictLiteral(DictLiteralAst dictLiteral);

	R visitIdentifier(IdentifierAst identifier);

	R visitLiteral(LiteralAst literal);
}
