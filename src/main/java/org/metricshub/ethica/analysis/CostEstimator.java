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
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.ethica.frontend.ast.AnnotationAst;
import org.metricshub.ethica.frontend.ast.AssignmentAst;
import org.metricshub.ethica.frontend.ast.AstScanner;
import org.metricshub.ethica.frontend.ast.AstVisitor;
import org.metricshub.ethica.frontend.ast.BinaryExpressionAst;
import org.metricshub.ethica.frontend.ast.DictLiteralAst;
import org.metricshub.ethica.frontend.ast.ExpressionAst;
import org.metricshub.ethica.frontend.ast.ExpressionStatementAst;
import org.metricshub.ethica.frontend.ast.ForInStatementAst;
import org.metricshub.ethica.frontend.ast.FunctionCallAst;
import org.metricshub.ethica.frontend.ast.FunctionDefAst;
import org.metricshub.ethica.frontend.ast.IdentifierAst;
import org.metricshub.ethica.frontend.ast.IfStatementAst;
import org.metricshub.ethica.frontend.ast.IndexAst;
import org.metricshub.ethica.frontend.ast.ListLiteralAst;
import org.metricshub.ethica.frontend.ast.LiteralAst;
import org.metricshub.ethica.frontend.ast.MemberAst;
import org.metricshub.ethica.frontend.ast.ProgramAst;
import org.metricshub.ethica.frontend.ast.ReturnStatementAst;
import org.metricshub.ethica.frontend.ast.StatementAst;
import org.metricshub.ethica.frontend.ast.UnaryExpressionAst;
import org.metricshub.ethica.frontend.ast.UnaryOperator;
import org.metricshub.ethica.frontend.ast.WhileStatementAst;
import org.metricshub.ethica.util.EthicaLogger;
import org.metricshub.ethica.util.VerifierSettings;
import org.slf4j.Logger;

/**
 * Energy check: estimates the cost of running a program without running it,
 * and compares it with the configured budget.
 * <p>
 * Every node has a fixed base cost to which the cost of its children is
 * added. A loop costs its body times the estimated number of iterations, and
 * the outermost loop of a nest is further multiplied by
 * {@code 2^(height - 1)}, where the height is the number of loops in the
 * deepest chain of the nest. A call to a function of the program adds the cost
 * of its body. Functions that take part in a call cycle are not expanded but
 * charged their body once per level of the configured recursion depth.
 * <p>
 * Only the budget decides whether the check passes. Loops nested deeper than
 * {@link VerifierSettings#getMaxLoopNesting()} and recursive functions are
 * reported as advisory findings.
 * <p>
 * All arithmetic saturates at {@link Long#MAX_VALUE}.
 */
public class CostEstimator implements Analyzer {

	private static final Logger LOG = EthicaLogger.getLogger(CostEstimator.class);

	public static final long LITERAL_COST = 1;
	public static final long VARIABLE_COST = 1;
	public static final long ASSIGNMENT_COST = 2;
	public static final long BINARY_OPERATION_COST = 3;
	public static final long UNARY_OPERATION_COST = 2;
	public static final long CALL_COST = 10;
	public static final long RETURN_COST = 1;
	public static final long INDEX_COST = 5;
	public static final long MEMBER_COST = 3;
	public static final long LIST_ELEMENT_COST = 2;
	public static final long DICT_ENTRY_COST = 3;
	public static final long IF_COST = 5;

	private static final int MAX_DESCRIPTION_LENGTH = 60;

	@Override
	public CheckName getCheckName() {
		return CheckName.ENERGY;
	}

	@Override
	public CostReport analyze(ProgramAst program, VerifierSettings settings) {
		Map<String, FunctionDefAst> functions = collectFunctions(program);
		Map<String, Integer> cycles = findCycles(functions);

		CostVisitor visitor = new CostVisitor(functions, cycles, settings);
		List<CostReport.Contributor> contributors = new ArrayList<>();
		long total = 0;
		for (StatementAst statement : program.getStatements()) {
			long cost = statement.accept(visitor);
			contributors.add(new CostReport.Contributor(describe(statement), statement.getLine(), cost));
			total = add(total, cost);
		}
		// List.sort is stable: equal costs keep their source order
		contributors.sort(new Comparator<CostReport.Contributor>() {
			@Override
			public int compare(CostReport.Contributor c1, CostReport.Contributor c2) {
				return Long.compare(c2.getCost(), c1.getCost());
			}
		});

		long budget = settings.getEnergyBudget();
		boolean passed = total <= budget;
		List<Violation> violations = new ArrayList<>();
		if (!passed) {
			violations.add(Violation.global(
					ViolationType.BUDGET_EXCEEDED,
					"Estimated cost " + total + " exceeds the energy budget of " + budget,
					"Reduce loop iterations or nesting, or avoid recomputing the same values"));
		}
		violations.addAll(findDeepLoops(program, settings.getMaxLoopNesting()));
		for (String name : cycles.keySet()) {
			FunctionDefAst function = functions.get(name);
			long bodyCost = new CostVisitor(functions, cycles, settings).functionBody(function);
			long penalty = multiply(bodyCost, settings.getMaxRecursionDepth());
			violations.add(Violation.at(
					ViolationType.RECURSION_DETECTED,
					function,
					name,
					"Recursive function '" + name + "' is charged " + penalty + " per call (body cost " + bodyCost
							+ " x recursion depth " + settings.getMaxRecursionDepth() + ")",
					"Replace the recursion with a loop over a bounded range"));
		}
		LOG.debug("Estimated cost {} for a budget of {}", total, budget);
		return new CostReport(passed, violations, total, budget, contributors, cycles.keySet());
	}

	/**
	 * Every function defined anywhere in the program, by name. A later
	 * definition replaces an earlier one, as it does at run time.
	 */
	static Map<String, FunctionDefAst> collectFunctions(ProgramAst program) {
		final Map<String, FunctionDefAst> functions = new LinkedHashMap<>();
		program.accept(new AstScanner<Void>() {
			@Override
			public Void visitFunctionDef(FunctionDefAst functionDef) {
				functions.put(functionDef.getName(), functionDef);
				return super.visitFunctionDef(functionDef);
			}
		});
		return functions;
	}

	/**
	 * Finds the functions that can call themselves, directly or through other
	 * functions, with Tarjan's strongly connected components algorithm.
	 *
	 * @return for each recursive function, the index of its cycle
	 */
	static Map<String, Integer> findCycles(Map<String, FunctionDefAst> functions) {
		Map<String, Set<String>> callGraph = new LinkedHashMap<>();
		for (FunctionDefAst function : functions.values()) {
			final Set<String> callees = new LinkedHashSet<>();
			final Map<String, FunctionDefAst> known = functions;
			AstScanner<Void> scanner = new AstScanner<Void>() {
				@Override
				public Void visitFunctionCall(FunctionCallAst functionCall) {
					if (functionCall.getCallee() instanceof IdentifierAst) {
						String name = ((IdentifierAst) functionCall.getCallee()).getName();
						if (known.containsKey(name)) {
							callees.add(name);
						}
					}
					return super.visitFunctionCall(functionCall);
				}
			};
			scanner.scanAll(function.getBody());
			callGraph.put(function.getName(), callees);
		}
		return new Tarjan(callGraph).run();
	}

	private static final class Tarjan {

		private final Map<String, Set<String>> graph;
		private final Map<String, Integer> index = new HashMap<>();
		private final Map<String, Integer> lowLink = new HashMap<>();
		private final Deque<String> stack = new ArrayDeque<>();
		private final Set<String> onStack = new HashSet<>();
		private final Map<String, Integer> result = new LinkedHashMap<>();
		private int counter;
		private int cycleCount;

		Tarjan(Map<String, Set<String>> graph) {
			this.graph = graph;
		}

		Map<String, Integer> run() {
			for (String node : graph.keySet()) {
				if (!index.containsKey(node)) {
					connect(node);
				}
			}
			return result;
		}

		private void connect(String node) {
			index.put(node, counter);
			lowLink.put(node, counter);
			counter++;
			stack.push(node);
			onStack.add(node);

			for (String next : graph.get(node)) {
				if (!index.containsKey(next)) {
					connect(next);
					lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(next)));
				} else if (onStack.contains(next)) {
					lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
				}
			}

			if (lowLink.get(node).equals(index.get(node))) {
				List<String> component = new ArrayList<>();
				String member;
				do {
					member = stack.pop();
					onStack.remove(member);
					component.add(member);
				} while (!member.equals(node));

				if (component.size() > 1 || graph.get(node).contains(node)) {
					for (String name : component) {
						result.put(name, cycleCount);
					}
					cycleCount++;
				}
			}
		}
	}

	/**
	 * Reports every loop that has more than {@code maxNesting} loops around
	 * it, itself included. Nesting restarts in each function body.
	 */
	static List<Violation> findDeepLoops(ProgramAst program, final int maxNesting) {
		final List<Violation> violations = new ArrayList<>();
		program.accept(new AstScanner<Void>() {

			private int depth;
			private String function;

			private void loop(StatementAst loop, List<StatementAst> body) {
				depth++;
				try {
					if (depth > maxNesting) {
						violations.add(Violation.at(
								ViolationType.EXCESSIVE_LOOP_NESTING,
								loop,
								function,
								"Loop nesting depth " + depth + " exceeds the maximum of " + maxNesting,
								"Move the inner loops into a separate function or flatten the iteration"));
					}
					scanAll(body);
				} finally {
					depth--;
				}
			}

			@Override
			public Void visitFunctionDef(FunctionDefAst functionDef) {
				int savedDepth = depth;
				String savedFunction = function;
				depth = 0;
				function = functionDef.getName();
				try {
					return super.visitFunctionDef(functionDef);
				} finally {
					depth = savedDepth;
					function = savedFunction;
				}
			}

			@Override
			public Void visitWhileStatement(WhileStatementAst whileStatement) {
				scan(whileStatement.getCondition());
				loop(whileStatement, whileStatement.getBody());
				return null;
			}

			@Override
			public Void visitForInStatement(ForInStatementAst forInStatement) {
				scan(forInStatement.getIterable());
				loop(forInStatement, forInStatement.getBody());
				return null;
			}
		});
		return violations;
	}

	/**
	 * Number of loops in the deepest chain of loops nested in a block.
	 */
	static int loopHeight(List<StatementAst> block) {
		int height = 0;
		for (StatementAst statement : block) {
			if (statement instanceof ForInStatementAst) {
				height = Math.max(height, 1 + loopHeight(((ForInStatementAst) statement).getBody()));
			} else if (statement instanceof WhileStatementAst) {
				height = Math.max(height, 1 + loopHeight(((WhileStatementAst) statement).getBody()));
			} else if (statement instanceof IfStatementAst) {
				IfStatementAst ifStatement = (IfStatementAst) statement;
				height = Math.max(height, loopHeight(ifStatement.getThenBlock()));
				height = Math.max(height, loopHeight(ifStatement.getElseBlock()));
			}
		}
		return height;
	}

	private static String describe(StatementAst statement) {
		String description;
		if (statement instanceof FunctionDefAst) {
			description = "function " + ((FunctionDefAst) statement).getName();
		} else {
			description = statement.toString();
		}
		if (description.length() > MAX_DESCRIPTION_LENGTH) {
			description = description.substring(0, MAX_DESCRIPTION_LENGTH - 3) + "...";
		}
		return description;
	}

	static long add(long a, long b) {
		long r = a + b;
		// both operands are never negative: overflow shows as a negative sum
		return r < 0 ? Long.MAX_VALUE : r;
	}

	static long multiply(long a, long b) {
		if (a == 0 || b == 0) {
			return 0;
		}
		if (a > Long.MAX_VALUE / b) {
			return Long.MAX_VALUE;
		}
		return a * b;
	}

	/**
	 * Computes the cost of one node. A new instance is used for each
	 * analysis, as it tracks the loops and the function calls being expanded.
	 */
	private static final class CostVisitor implements AstVisitor<Long> {

		private final Map<String, FunctionDefAst> functions;
		private final Map<String, Integer> cycles;
		private final VerifierSettings settings;

		/** Loops enclosing the node being visited, within the current function body. */
		private int loopDepth;

		/** Cycles whose functions are being expanded. */
		private final Set<Integer> activeCycles = new HashSet<>();

		/** Functions being expanded, as a guard against unbounded expansion. */
		private final Set<String> expanding = new HashSet<>();

		CostVisitor(Map<String, FunctionDefAst> functions, Map<String, Integer> cycles, VerifierSettings settings) {
			this.functions = functions;
			this.cycles = cycles;
			this.settings = settings;
		}

		private long block(List<StatementAst> statements) {
			long cost = 0;
			for (StatementAst statement : statements) {
				cost = add(cost, statement.accept(this));
			}
			return cost;
		}

		private long expressions(List<ExpressionAst> expressions) {
			long cost = 0;
			for (ExpressionAst expression : expressions) {
				cost = add(cost, expression.accept(this));
			}
			return cost;
		}

		/**
		 * Cost of a function body evaluated on its own, outside of any loop.
		 */
		private long functionBody(FunctionDefAst function) {
			int savedLoopDepth = loopDepth;
			Integer cycle = cycles.get(function.getName());
			boolean cycleActivated = cycle != null && activeCycles.add(cycle);
			expanding.add(function.getName());
			loopDepth = 0;
			try {
				return block(function.getBody());
			} finally {
				loopDepth = savedLoopDepth;
				expanding.remove(function.getName());
				if (cycleActivated) {
					activeCycles.remove(cycle);
				}
			}
		}

		private long loop(long perIteration, long iterations, List<StatementAst> body) {
			long cost = multiply(perIteration, iterations);
			if (loopDepth == 0) {
				int height = 1 + loopHeight(body);
				long penalty = height > 62 ? Long.MAX_VALUE : 1L << (height - 1);
				cost = multiply(cost, penalty);
			}
			return cost;
		}

		private long iterations(ExpressionAst iterable) {
			long defaultIterations = settings.getDefaultLoopIterations();
			if (iterable instanceof ListLiteralAst) {
				return ((ListLiteralAst) iterable).getElements().size();
			}
			if (iterable instanceof LiteralAst && ((LiteralAst) iterable).getValue() instanceof String) {
				return ((String) ((LiteralAst) iterable).getValue()).length();
			}
			if (iterable instanceof FunctionCallAst) {
				FunctionCallAst call = (FunctionCallAst) iterable;
				if ("range".equals(call.getCalleeName())
						&& call.getCallee() instanceof IdentifierAst
						&& !functions.containsKey("range")) {
					Long count = rangeCount(call.getArguments());
					if (count != null) {
						return count;
					}
				}
			}
			return defaultIterations;
		}

		private Long rangeCount(List<ExpressionAst> arguments) {
			if (arguments.isEmpty() || arguments.size() > 3) {
				return null;
			}
			long[] values = new long[arguments.size()];
			for (int i = 0; i < values.length; i++) {
				Long value = integerConstant(arguments.get(i));
				if (value == null) {
					return null;
				}
				values[i] = value;
			}
			long start = values.length == 1 ? 0 : values[0];
			long stop = values.length == 1 ? values[0] : values[1];
			long step = values.length == 3 ? values[2] : 1;
			if (step == 0) {
				return null;
			}
			if (step > 0) {
				return stop <= start ? 0L : (stop - start + step - 1) / step;
			}
			return start <= stop ? 0L : (start - stop - step - 1) / -step;
		}

		private Long integerConstant(ExpressionAst expression) {
			if (expression instanceof LiteralAst && ((LiteralAst) expression).getValue() instanceof Long) {
				return (Long) ((LiteralAst) expression).getValue();
			}
			if (expression instanceof UnaryExpressionAst) {
				UnaryExpressionAst unary = (UnaryExpressionAst) expression;
				if (unary.getOperator() == UnaryOperator.NEGATE) {
					Long value = integerConstant(unary.getOperand());
					return value == null ? null : -value;
				}
			}
			return null;
		}

		@Override
		public Long visitProgram(ProgramAst program) {
			return block(program.getStatements());
		}

		@Override
		public Long visitFunctionDef(FunctionDefAst functionDef) {
			return functionBody(functionDef);
		}

		@Override
		public Long visitAnnotation(AnnotationAst annotation) {
			return 0L;
		}

		@Override
		public Long visitAssignment(AssignmentAst assignment) {
			return add(ASSIGNMENT_COST, assignment.getValue().accept(this));
		}

		@Override
		public Long visitIfStatement(IfStatementAst ifStatement) {
			long condition = ifStatement.getCondition().accept(this);
			long thenCost = block(ifStatement.getThenBlock());
			long elseCost = block(ifStatement.getElseBlock());
			return add(add(IF_COST, condition), Math.max(thenCost, elseCost));
		}

		@Override
		public Long visitWhileStatement(WhileStatementAst whileStatement) {
			loopDepth++;
			long perIteration;
			try {
				perIteration = add(whileStatement.getCondition().accept(this), block(whileStatement.getBody()));
			} finally {
				loopDepth--;
			}
			return loop(perIteration, settings.getDefaultLoopIterations(), whileStatement.getBody());
		}

		@Override
		public Long visitForInStatement(ForInStatementAst forInStatement) {
			long iterations = iterations(forInStatement.getIterable());
			loopDepth++;
			long perIteration;
			try {
				perIteration = block(forInStatement.getBody());
			} finally {
				loopDepth--;
			}
			return loop(perIteration, iterations, forInStatement.getBody());
		}

		@Override
		public Long visitReturnStatement(ReturnStatementAst returnStatement) {
			if (returnStatement.getValue() == null) {
				return RETURN_COST;
			}
			return add(RETURN_COST, returnStatement.getValue().accept(this));
		}

		@Override
		public Long visitExpressionStatement(ExpressionStatementAst expressionStatement) {
			return expressionStatement.getExpression().accept(this);
		}

		@Override
		public Long visitBinaryExpression(BinaryExpressionAst binaryExpression) {
			return add(
					add(BINARY_OPERATION_COST, binaryExpression.getLeft().accept(this)),
					binaryExpression.getRight().accept(this));
		}

		@Override
		public Long visitUnaryExpression(UnaryExpressionAst unaryExpression) {
			return add(UNARY_OPERATION_COST, unaryExpression.getOperand().accept(this));
		}

		@Override
		public Long visitFunctionCall(FunctionCallAst functionCall) {
			long cost = add(CALL_COST, expressions(functionCall.getArguments()));
			if (!(functionCall.getCallee() instanceof IdentifierAst)) {
				return add(cost, functionCall.getCallee().accept(this));
			}
			String name = ((IdentifierAst) functionCall.getCallee()).getName();
			FunctionDefAst callee = functions.get(name);
			if (callee == null || expanding.contains(name)) {
				return cost;
			}
			Integer cycle = cycles.get(name);
			if (cycle == null) {
				return add(cost, functionBody(callee));
			}
			if (activeCycles.contains(cycle)) {
				// a recursive call: the recursion depth is charged by the outermost call
				return cost;
			}
			return add(cost, multiply(functionBody(callee), settings.getMaxRecursionDepth()));
		}

		@Override
		public Long visitIndex(IndexAst index) {
			return add(add(INDEX_COST, index.getObject().accept(this)), index.getIndex().accept(this));
		}

		@Override
		public Long visitMember(MemberAst member) {
			return add(MEMBER_COST, member.getObject().accept(this));
		}

		@Override
		public Long visitListLiteral(ListLiteralAst listLiteral) {
			long cost = multiply(LIST_ELEMENT_COST, listLiteral.getElements().size());
			return add(cost, expressions(listLiteral.getElements()));
		}

		@Override
		public Long visitDictLiteral(DictLiteralAst dictLiteral) {
			long cost = multiply(DICT_ENTRY_COST, dictLiteral.size());
			cost = add(cost, expressions(dictLiteral.getKeys()));
			return add(cost, expressions(dictLiteral.getValues()));
		}

		@Override
		public Long visitIdentifier(IdentifierAst identifier) {
			return VARIABLE_COST;
		}

		@Override
		public Long visitLiteral(LiteralAst literal) {
			return LITERAL_COST;
		}
	}
}
