package org.metricshub.ethica.analysis;

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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.metricshub.ethica.frontend.ast.AssignmentAst;
import org.metricshub.ethica.frontend.ast.AstNode;
import org.metricshub.ethica.frontend.ast.AstScanner;
import org.metricshub.ethica.frontend.ast.BinaryExpressionAst;
import org.metricshub.ethica.frontend.ast.ExpressionAst;
import org.metricshub.ethica.frontend.ast.ExpressionStatementAst;
import org.metricshub.ethica.frontend.ast.ForInStatementAst;
import org.metricshub.ethica.frontend.ast.FunctionCallAst;
import org.metricshub.ethica.frontend.ast.FunctionDefAst;
import org.metricshub.ethica.frontend.ast.IfStatementAst;
import org.metricshub.ethica.frontend.ast.IndexAst;
import org.metricshub.ethica.frontend.ast.LiteralAst;
import org.metricshub.ethica.frontend.ast.MemberAst;
import org.metricshub.ethica.frontend.ast.ProgramAst;
import org.metricshub.ethica.frontend.ast.ReturnStatementAst;
import org.metricshub.ethica.frontend.ast.StatementAst;
import org.metricshub.ethica.frontend.ast.UnaryExpressionAst;
import org.metricshub.ethica.frontend.ast.WhileStatementAst;
import org.metricshub.ethica.util.EthicaLogger;
import org.metricshub.ethica.util.VerifierSettings;
import org.slf4j.Logger;

/**
 * Cleverness check: flags code that is correct but harder to read than it
 * needs to be.
 * <p>
 * Each statement has one root expression (assigned value, expression
 * statement, returned value, condition or loop iterable), which is checked for
 * depth, operator count, long postfix chains, chained comparisons and magic
 * numbers. Bound names and parameter lists are checked as well.
 */
public class ObfuscationDetector implements Analyzer {

	private static final Logger LOG = EthicaLogger.getLogger(ObfuscationDetector.class);

	public static final int MAX_EXPRESSION_DEPTH = 4;
	public static final int MAX_CHAIN_LENGTH = 3;
	public static final int MAX_OPERATORS_PER_STATEMENT = 5;
	public static final int MAX_PARAMETERS = 5;

	private static final Set<Double> PLAIN_NUMBERS = new HashSet<>(Arrays.asList(0.0, 1.0, 10.0, 100.0));
	private static final Set<String> LOOP_INDEX_NAMES = new HashSet<>(Arrays.asList("i", "j", "k"));
	private static final Pattern CONSTANT_NAME = Pattern.compile("[A-Z][A-Z0-9]*(_[A-Z0-9]+)*");

	@Override
	public CheckName getCheckName() {
		return CheckName.CLEVERNESS;
	}

	@Override
	public AnalysisReport analyze(ProgramAst program, VerifierSettings settings) {
		StatementChecker checker = new StatementChecker();
		program.accept(checker);
		List<Violation> violations = checker.violations;
		LOG.debug("Cleverness check found {} violations", violations.size());
		return new AnalysisReport(CheckName.CLEVERNESS, violations.isEmpty(), violations);
	}

	/**
	 * @param name a variable name
	 * @return whether it is written in UPPER_SNAKE_CASE
	 */
	static boolean isConstantName(String name) {
		return CONSTANT_NAME.matcher(name).matches();
	}

	/**
	 * Number of successive member, index and call operations ending at the
	 * given expression.
	 */
	static int chainLength(ExpressionAst expression) {
		int length = 0;
		ExpressionAst link = expression;
		while (true) {
			if (link instanceof MemberAst) {
				link = ((MemberAst) link).getObject();
			} else if (link instanceof IndexAst) {
				link = ((IndexAst) link).getObject();
			} else if (link instanceof FunctionCallAst) {
				link = ((FunctionCallAst) link).getCallee();
			} else {
				return length;
			}
			length++;
		}
	}

	private static boolean isPostfix(ExpressionAst expression) {
		return expression instanceof MemberAst || expression instanceof IndexAst || expression instanceof FunctionCallAst;
	}

	/**
	 * Walks the statements. Expressions are left to {@link ExpressionChecker}.
	 */
	private static final class StatementChecker extends AstScanner<Void> {

		private final List<Violation> violations = new ArrayList<>();
		private final Deque<String> functions = new ArrayDeque<>();

		private String currentFunction() {
			return functions.peek();
		}

		private void singleLetter(String name, boolean loopVariable, AstNode node) {
			if (name.length() != 1 || (loopVariable && LOOP_INDEX_NAMES.contains(name))) {
				return;
			}
			violations.add(Violation.at(
					ViolationType.SINGLE_LETTER_NAME,
					node,
					currentFunction(),
					"Single-letter name '" + name + "'",
					"Use a name that says what '" + name + "' holds"));
		}

		private void root(StatementAst statement, ExpressionAst expression, boolean constantDefinition) {
			ExpressionChecker checker = new ExpressionChecker(violations, currentFunction(), constantDefinition);
			checker.scan(expression);
			if (checker.maxDepth > MAX_EXPRESSION_DEPTH) {
				violations.add(Violation.at(
						ViolationType.EXPRESSION_TOO_DEEP,
						expression,
						currentFunction(),
						"Expression nests " + checker.maxDepth + " operations (maximum: " + MAX_EXPRESSION_DEPTH + ")",
						"Break the expression down with intermediate named variables"));
			}
			if (checker.operators > MAX_OPERATORS_PER_STATEMENT) {
				violations.add(Violation.at(
						ViolationType.COMPLEX_ONE_LINER,
						statement,
						currentFunction(),
						"Statement uses " + checker.operators + " operators (maximum: " + MAX_OPERATORS_PER_STATEMENT + ")",
						"Split it into several statements"));
			}
		}

		@Override
		public Void visitFunctionDef(FunctionDefAst functionDef) {
			functions.push(functionDef.getName());
			try {
				int count = functionDef.getParameters().size();
				if (count > MAX_PARAMETERS) {
					violations.add(Violation.at(
							ViolationType.TOO_MANY_PARAMETERS,
							functionDef,
							functionDef.getName(),
							"Function '" + functionDef.getName() + "' has " + count + " parameters (maximum: " + MAX_PARAMETERS + ")",
							"Group related parameters in a dict or split the function"));
				}
				for (String parameter : functionDef.getParameters()) {
					singleLetter(parameter, false, functionDef);
				}
				scanAll(functionDef.getBody());
			} finally {
				functions.pop();
			}
			return null;
		}

		@Override
		public Void visitAssignment(AssignmentAst assignment) {
			singleLetter(assignment.getTarget(), false, assignment);
			root(assignment, assignment.getValue(), isConstantName(assignment.getTarget()));
			return null;
		}

		@Override
		public Void visitIfStatement(IfStatementAst ifStatement) {
			root(ifStatement, ifStatement.getCondition(), false);
			scanAll(ifStatement.getThenBlock());
			scanAll(ifStatement.getElseBlock());
			return null;
		}

		@Override
		public Void visitWhileStatement(WhileStatementAst whileStatement) {
			root(whileStatement, whileStatement.getCondition(), false);
			scanAll(whileStatement.getBody());
			return null;
		}

		@Override
		public Void visitForInStatement(ForInStatementAst forInStatement) {
			singleLetter(forInStatement.getVariable(), true, forInStatement);
			root(forInStatement, forInStatement.getIterable(), false);
			scanAll(forInStatement.getBody());
			return null;
		}

		@Override
		public Void visitReturnStatement(ReturnStatementAst returnStatement) {
			if (returnStatement.getValue() != null) {
				root(returnStatement, returnStatement.getValue(), false);
			}
			return null;
		}

		@Override
		public Void visitExpressionStatement(ExpressionStatementAst expressionStatement) {
			root(expressionStatement, expressionStatement.getExpression(), false);
			return null;
		}
	}

	/**
	 * Measures one root expression and reports the findings that concern a
	 * single node of it.
	 */
	private static final class ExpressionChecker extends AstScanner<Void> {

		private final List<Violation> violations;
		private final String function;
		private final boolean constantDefinition;

		private int depth;
		private int maxDepth;
		private int operators;

		/** Set while visiting the base of a postfix operation that continues a chain. */
		private boolean chainLink;

		ExpressionChecker(List<Violation> violations, String function, boolean constantDefinition) {
			this.violations = violations;
			this.function = function;
			this.constantDefinition = constantDefinition;
		}

		private void enter() {
			depth++;
			maxDepth = Math.max(maxDepth, depth);
		}

		private void exit() {
			depth--;
		}

		private void chain(ExpressionAst link, ExpressionAst base) {
			boolean top = !chainLink;
			chainLink = false;
			if (top) {
				int length = chainLength(link);
				if (length > MAX_CHAIN_LENGTH) {
					violations.add(Violation.at(
							ViolationType.LONG_CHAIN,
							link,
							function,
							"Chain of " + length + " member, index or call operations (maximum: " + MAX_CHAIN_LENGTH + ")",
							"Store intermediate results in named variables"));
				}
			}
			chainLink = isPostfix(base);
			scan(base);
			chainLink = false;
		}

		@Override
		public Void visitBinaryExpression(BinaryExpressionAst binaryExpression) {
			operators++;
			if (binaryExpression.getOperator().isComparison()
					&& binaryExpression.getLeft() instanceof BinaryExpressionAst
					&& ((BinaryExpressionAst) binaryExpression.getLeft()).getOperator().isComparison()) {
				violations.add(Violation.at(
						ViolationType.CHAINED_COMPARISON,
						binaryExpression,
						function,
						"Chained comparison " + binaryExpression + " is easy to misread",
						"Combine separate comparisons with 'and'"));
			}
			enter();
			try {
				return super.visitBinaryExpression(binaryExpression);
			} finally {
				exit();
			}
		}

		@Override
		public Void visitUnaryExpression(UnaryExpressionAst unaryExpression) {
			operators++;
			enter();
			try {
				return super.visitUnaryExpression(unaryExpression);
			} finally {
				exit();
			}
		}

		@Override
		public Void visitFunctionCall(FunctionCallAst functionCall) {
			enter();
			try {
				chain(functionCall, functionCall.getCallee());
				scanAll(functionCall.getArguments());
			} finally {
				exit();
			}
			return null;
		}

		@Override
		public Void visitIndex(IndexAst index) {
			chain(index, index.getObject());
			scan(index.getIndex());
			return null;
		}

		@Override
		public Void visitMember(MemberAst member) {
			chain(member, member.getObject());
			return null;
		}

		@Override
		public Void visitLiteral(LiteralAst literal) {
			if (literal.isNumber() && !constantDefinition) {
				double value = ((Number) literal.getValue()).doubleValue();
				if (!PLAIN_NUMBERS.contains(value)) {
					violations.add(Violation.at(
							ViolationType.MAGIC_NUMBER,
							literal,
							function,
							"Magic number " + literal + " used without a name",
							"Assign it to an UPPER_SNAKE_CASE constant that explains its meaning"));
				}
			}
			return null;
		}
	}
}
