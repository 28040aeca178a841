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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.ethica.frontend.ast.AssignmentAst;
import org.metricshub.ethica.frontend.ast.AstNode;
import org.metricshub.ethica.frontend.ast.AstScanner;
import org.metricshub.ethica.frontend.ast.BinaryExpressionAst;
import org.metricshub.ethica.frontend.ast.ExpressionStatementAst;
import org.metricshub.ethica.frontend.ast.ForInStatementAst;
import org.metricshub.ethica.frontend.ast.FunctionDefAst;
import org.metricshub.ethica.frontend.ast.IfStatementAst;
import org.metricshub.ethica.frontend.ast.ProgramAst;
import org.metricshub.ethica.frontend.ast.ReturnStatementAst;
import org.metricshub.ethica.frontend.ast.StatementAst;
import org.metricshub.ethica.frontend.ast.WhileStatementAst;
import org.metricshub.ethica.util.EthicaLogger;
import org.metricshub.ethica.util.VerifierSettings;
import org.slf4j.Logger;

/**
 * Readability check: scores a program from 0 to 100.
 * <p>
 * The program is split into units: each function definition, plus the
 * top-level statements that are not function definitions. Four components
 * are scored, then weighted into the overall score:
 * <ul>
 * <li>complexity (30%): cyclomatic complexity of the most complex unit</li>
 * <li>nesting (25%): deepest block nesting in any unit</li>
 * <li>length (20%): statement count of the longest unit</li>
 * <li>naming (25%): points off for each short or meaningless name</li>
 * </ul>
 * The first three go through the {@link ScoreCurve}s of the settings. Only the
 * overall score decides whether the check passes; the findings are advice.
 */
public class ReadabilityScorer implements Analyzer {

	private static final Logger LOG = EthicaLogger.getLogger(ReadabilityScorer.class);

	public static final double COMPLEXITY_WEIGHT = 0.30;
	public static final double NESTING_WEIGHT = 0.25;
	public static final double LENGTH_WEIGHT = 0.20;
	public static final double NAMING_WEIGHT = 0.25;

	private static final Set<String> LOOP_INDEX_NAMES = new HashSet<>(Arrays.asList("i", "j", "k"));
	private static final Set<String> NON_DESCRIPTIVE_NAMES = new HashSet<>(
			Arrays.asList("temp", "tmp", "data", "foo", "bar", "x", "y"));
	private static final Set<String> COORDINATE_NAMES = new HashSet<>(Arrays.asList("x", "y"));

	/** Where a name is bound. */
	enum Binding {
		ASSIGNMENT,
		PARAMETER,
		LOOP_VARIABLE
	}

	@Override
	public CheckName getCheckName() {
		return CheckName.READABILITY;
	}

	@Override
	public ReadabilityReport analyze(ProgramAst program, VerifierSettings settings) {
		List<UnitMeasure> units = new ArrayList<>();
		List<StatementAst> moduleStatements = new ArrayList<>();
		List<FunctionDefAst> pending = new ArrayList<>();
		for (StatementAst statement : program.getStatements()) {
			if (statement instanceof FunctionDefAst) {
				pending.add((FunctionDefAst) statement);
			} else {
				moduleStatements.add(statement);
			}
		}
		if (!moduleStatements.isEmpty()) {
			UnitMeasure module = new UnitMeasure(ReadabilityReport.MODULE_UNIT, null, pending);
			module.measure(moduleStatements);
			units.add(module);
		}
		// nested definitions are appended to the list while it is walked
		for (int i = 0; i < pending.size(); i++) {
			FunctionDefAst function = pending.get(i);
			UnitMeasure unit = new UnitMeasure(function.getName(), function, pending);
			for (String parameter : function.getParameters()) {
				unit.bind(parameter, Binding.PARAMETER, function);
			}
			unit.measure(function.getBody());
			units.add(unit);
		}

		int maxComplexity = 1;
		int maxNesting = 0;
		int maxLength = 0;
		int flaggedNames = 0;
		List<Violation> violations = new ArrayList<>();
		List<ReadabilityReport.UnitStatistics> statistics = new ArrayList<>();
		for (UnitMeasure unit : units) {
			maxComplexity = Math.max(maxComplexity, unit.complexity);
			maxNesting = Math.max(maxNesting, unit.maxNesting);
			maxLength = Math.max(maxLength, unit.statementCount);
			flaggedNames += unit.flaggedNames.size();
			statistics.add(new ReadabilityReport.UnitStatistics(
					unit.name, unit.complexity, unit.maxNesting, unit.statementCount));
			unit.report(settings, violations);
		}

		double complexityScore = settings.getComplexityCurve().score(maxComplexity);
		double nestingScore = settings.getNestingCurve().score(maxNesting);
		double lengthScore = settings.getLengthCurve().score(maxLength);
		double namingScore = clamp(100.0 - settings.getNamingPenalty() * flaggedNames);
		double overall = round(
				COMPLEXITY_WEIGHT * clamp(complexityScore)
						+ NESTING_WEIGHT * clamp(nestingScore)
						+ LENGTH_WEIGHT * clamp(lengthScore)
						+ NAMING_WEIGHT * namingScore);

		double minScore = settings.getMinReadability();
		boolean passed = overall >= minScore;
		if (!passed) {
			violations.add(Violation.global(
					ViolationType.LOW_READABILITY,
					"Readability score " + overall + " is below the minimum of " + minScore,
					"Split long or complex functions and use descriptive names"));
		}
		LOG.debug(
				"Readability {} (complexity {}, nesting {}, length {}, naming {})",
				overall,
				complexityScore,
				nestingScore,
				lengthScore,
				namingScore);
		return new ReadabilityReport(
				passed,
				violations,
				overall,
				minScore,
				round(complexityScore),
				round(nestingScore),
				round(lengthScore),
				round(namingScore),
				statistics);
	}

	static double clamp(double score) {
		return Math.max(0.0, Math.min(100.0, score));
	}

	private static double round(double score) {
		return Math.round(score * 100.0) / 100.0;
	}

	/**
	 * Checks how a name is bound.
	 *
	 * @return the kind of naming problem, or {@code null} if the name is fine
	 */
	static ViolationType checkName(String name, Binding binding) {
		if (binding == Binding.PARAMETER && COORDINATE_NAMES.contains(name)) {
			return null;
		}
		if (binding == Binding.LOOP_VARIABLE && LOOP_INDEX_NAMES.contains(name)) {
			return null;
		}
		if (NON_DESCRIPTIVE_NAMES.contains(name)) {
			return ViolationType.NON_DESCRIPTIVE_NAME;
		}
		if (name.length() < 2) {
			return ViolationType.SHORT_NAME;
		}
		return null;
	}

	/**
	 * Measures of one unit. Nested function definitions count as one
	 * statement of the unit and are queued to be measured as units of their
	 * own.
	 */
	private static final class UnitMeasure extends AstScanner<Void> {

		private final String name;
		private final String functionName;
		private final List<FunctionDefAst> pending;

		private int complexity = 1;
		private int depth;
		private int maxNesting;
		private int statementCount;
		private final Map<String, Violation> flaggedNames = new LinkedHashMap<>();

		UnitMeasure(String name, FunctionDefAst function, List<FunctionDefAst> pending) {
			this.name = name;
			this.functionName = function == null ? null : function.getName();
			this.pending = pending;
		}

		void measure(List<StatementAst> statements) {
			scanAll(statements);
		}

		void bind(String boundName, Binding binding, AstNode node) {
			if (flaggedNames.containsKey(boundName)) {
				return;
			}
			ViolationType problem = checkName(boundName, binding);
			if (problem != null) {
				String message = problem == ViolationType.SHORT_NAME
						? "Name '" + boundName + "' is too short"
						: "Name '" + boundName + "' does not describe its content";
				flaggedNames.put(boundName, Violation.at(
						problem,
						node,
						functionName,
						message,
						"Rename '" + boundName + "' after what it holds"));
			}
		}

		void report(VerifierSettings settings, List<Violation> violations) {
			String unitLabel = functionName == null ? "Top-level code" : "Function '" + functionName + "'";
			if (complexity > settings.getComplexityCurve().getThreshold()) {
				violations.add(new Violation(
						ViolationType.HIGH_COMPLEXITY,
						unitLabel + " has cyclomatic complexity " + complexity,
						-1,
						-1,
						functionName,
						"Extract parts of the logic into smaller functions"));
			}
			if (maxNesting > settings.getNestingCurve().getThreshold()) {
				violations.add(new Violation(
						ViolationType.DEEP_NESTING,
						unitLabel + " nests blocks " + maxNesting + " levels deep",
						-1,
						-1,
						functionName,
						"Use early returns or extract the inner blocks"));
			}
			if (statementCount > settings.getLengthCurve().getThreshold()) {
				violations.add(new Violation(
						ViolationType.LONG_FUNCTION,
						unitLabel + " has " + statementCount + " statements",
						-1,
						-1,
						functionName,
						"Split it into several functions"));
			}
			violations.addAll(flaggedNames.values());
		}

		private void statement() {
			statementCount++;
			maxNesting = Math.max(maxNesting, depth);
		}

		private void nested(List<StatementAst> block) {
			depth++;
			try {
				scanAll(block);
			} finally {
				depth--;
			}
		}

		@Override
		public Void visitFunctionDef(FunctionDefAst functionDef) {
			statement();
			pending.add(functionDef);
			return null;
		}

		@Override
		public Void visitAssignment(AssignmentAst assignment) {
			statement();
			bind(assignment.getTarget(), Binding.ASSIGNMENT, assignment);
			return super.visitAssignment(assignment);
		}

		@Override
		public Void visitIfStatement(IfStatementAst ifStatement) {
			statement();
			complexity++;
			scan(ifStatement.getCondition());
			nested(ifStatement.getThenBlock());
			nested(ifStatement.getElseBlock());
			return null;
		}

		@Override
		public Void visitWhileStatement(WhileStatementAst whileStatement) {
			statement();
			complexity++;
			scan(whileStatement.getCondition());
			nested(whileStatement.getBody());
			return null;
		}

		@Override
		public Void visitForInStatement(ForInStatementAst forInStatement) {
			statement();
			complexity++;
			bind(forInStatement.getVariable(), Binding.LOOP_VARIABLE, forInStatement);
			scan(forInStatement.getIterable());
			nested(forInStatement.getBody());
			return null;
		}

		@Override
		public Void visitReturnStatement(ReturnStatementAst returnStatement) {
			statement();
			return super.visitReturnStatement(returnStatement);
		}

		@Override
		public Void visitExpressionStatement(ExpressionStatementAst expressionStatement) {
			statement();
			return super.visitExpressionStatement(expressionStatement);
		}

		@Override
		public Void visitBinaryExpression(BinaryExpressionAst binaryExpression) {
			if (binaryExpression.getOperator().isLogical()) {
				complexity++;
			}
			return super.visitBinaryExpression(binaryExpression);
		}
	}
}
