package org.metricshub.ethica.backend;

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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.ethica.frontend.ast.AnnotationAst;
import org.metricshub.ethica.frontend.ast.AssignmentAst;
import org.metricshub.ethica.frontend.ast.AstVisitor;
import org.metricshub.ethica.frontend.ast.BinaryExpressionAst;
import org.metricshub.ethica.frontend.ast.BinaryOperator;
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
import org.metricshub.ethica.frontend.ast.WhileStatementAst;
import org.metricshub.ethica.util.EthicaLogger;
import org.slf4j.Logger;

/**
 * Runs a program by walking its syntax tree.
 * <p>
 * Variables live in {@link Environment}s: the global scope, one scope per
 * function call and one scope per {@code for} loop. Assigning to a name
 * updates its innermost existing binding, or creates it in the current scope.
 * Functions see the scope they were defined in.
 * <p>
 * An interpreter keeps its global scope between calls to
 * {@link #execute(ProgramAst)} and is not thread-safe.
 */
public class Interpreter implements AstVisitor<Object> {

	private static final Logger LOG = EthicaLogger.getLogger(Interpreter.class);

	/** Nested calls allowed before the program is stopped. */
	public static final int MAX_CALL_DEPTH = 1000;

	private final Environment globals = new Environment();
	private Environment env = globals;
	private int callDepth;

	/**
	 * @param out where {@code print} writes
	 */
	public Interpreter(PrintStream out) {
		Builtins.register(globals, out);
	}

	/**
	 * Carries the value of a {@code return} statement up to the call.
	 */
	private static final class ReturnSignal extends RuntimeException {

		private static final long serialVersionUID = 1L;

		private final transient Object value;

		ReturnSignal(Object value) {
			super(null, null, false, false);
			this.value = value;
		}
	}

	/**
	 * A function defined by the program, with the scope it was defined in.
	 */
	private final class UserFunction implements EthicaFunction {

		private final FunctionDefAst definition;
		private final Environment closure;

		UserFunction(FunctionDefAst definition, Environment closure) {
			this.definition = definition;
			this.closure = closure;
		}

		@Override
		public String getName() {
			return definition.getName();
		}

		@Override
		public Object call(List<Object> arguments, int line) {
			List<String> parameters = definition.getParameters();
			if (arguments.size() != parameters.size()) {
				throw new EthicaRuntimeException(
						line,
						"Function " + getName() + " expects " + parameters.size() + " arguments, got " + arguments.size());
			}
			if (callDepth >= MAX_CALL_DEPTH) {
				throw new EthicaRuntimeException(line, "Maximum call depth of " + MAX_CALL_DEPTH + " exceeded in " + getName());
			}
			Environment callEnv = new Environment(closure);
			for (int i = 0; i < parameters.size(); i++) {
				callEnv.define(parameters.get(i), arguments.get(i));
			}
			Environment saved = env;
			env = callEnv;
			callDepth++;
			try {
				executeBlock(definition.getBody());
				return null;
			} catch (ReturnSignal signal) {
				return signal.value;
			} finally {
				callDepth--;
				env = saved;
			}
		}

		@Override
		public String toString() {
			return "<function " + getName() + ">";
		}
	}

	/**
	 * Runs a program.
	 *
	 * @param program a verified program
	 * @return the value of a top-level {@code return}, {@code null} otherwise
	 * @throws EthicaRuntimeException when the program fails
	 */
	public Object execute(ProgramAst program) {
		LOG.debug("Executing program of {} statements", program.getStatements().size());
		try {
			program.accept(this);
			return null;
		} catch (ReturnSignal signal) {
			return signal.value;
		}
	}

	/**
	 * @return the global scope, with the variables the program has set
	 */
	public Environment getGlobals() {
		return globals;
	}

	private void executeBlock(List<StatementAst> statements) {
		for (StatementAst statement : statements) {
			statement.accept(this);
		}
	}

	private Object eval(ExpressionAst expression) {
		return expression.accept(this);
	}

	@Override
	public Object visitProgram(ProgramAst program) {
		executeBlock(program.getStatements());
		return null;
	}

	@Override
	public Object visitFunctionDef(FunctionDefAst functionDef) {
		env.define(functionDef.getName(), new UserFunction(functionDef, env));
		return null;
	}

	@Override
	public Object visitAnnotation(AnnotationAst annotation) {
		return null;
	}

	@Override
	public Object visitAssignment(AssignmentAst assignment) {
		Object value = eval(assignment.getValue());
		env.assign(assignment.getTarget(), value);
		return null;
	}

	@Override
	public Object visitIfStatement(IfStatementAst ifStatement) {
		if (Values.isTruthy(eval(ifStatement.getCondition()))) {
			executeBlock(ifStatement.getThenBlock());
		} else {
			executeBlock(ifStatement.getElseBlock());
		}
		return null;
	}

	@Override
	public Object visitWhileStatement(WhileStatementAst whileStatement) {
		while (Values.isTruthy(eval(whileStatement.getCondition()))) {
			executeBlock(whileStatement.getBody());
		}
		return null;
	}

	@Override
	public Object visitForInStatement(ForInStatementAst forInStatement) {
		Object iterable = eval(forInStatement.getIterable());
		List<Object> items = new ArrayList<>();
		if (iterable instanceof List) {
			items.addAll((List<?>) iterable);
		} else if (iterable instanceof String) {
			String s = (String) iterable;
			for (int i = 0; i < s.length(); i++) {
				items.add(String.valueOf(s.charAt(i)));
			}
		} else if (iterable instanceof Map) {
			items.addAll(((Map<?, ?>) iterable).keySet());
		} else {
			throw new EthicaRuntimeException(
					forInStatement.getLine(),
					"Cannot iterate over " + Values.typeName(iterable));
		}
		Environment saved = env;
		env = new Environment(saved);
		try {
			for (Object item : items) {
				env.define(forInStatement.getVariable(), item);
				executeBlock(forInStatement.getBody());
			}
		} finally {
			env = saved;
		}
		return null;
	}

	@Override
	public Object visitReturnStatement(ReturnStatementAst returnStatement) {
		Object value = returnStatement.getValue() == null ? null : eval(returnStatement.getValue());
		throw new ReturnSignal(value);
	}

	@Override
	public Object visitExpressionStatement(ExpressionStatementAst expressionStatement) {
		return eval(expressionStatement.getExpression());
	}

	@Override
	public Object visitBinaryExpression(BinaryExpressionAst binaryExpression) {
		BinaryOperator operator = binaryExpression.getOperator();
		Object left = eval(binaryExpression.getLeft());
		// short circuit
		if (operator == BinaryOperator.AND) {
			return Values.isTruthy(left) && Values.isTruthy(eval(binaryExpression.getRight()));
		}
		if (operator == BinaryOperator.OR) {
			return Values.isTruthy(left) || Values.isTruthy(eval(binaryExpression.getRight()));
		}
		Object right = eval(binaryExpression.getRight());
		return Operators.binary(operator, left, right, binaryExpression.getLine());
	}

	@Override
	public Object visitUnaryExpression(UnaryExpressionAst unaryExpression) {
		Object operand = eval(unaryExpression.getOperand());
		return Operators.unary(unaryExpression.getOperator(), operand, unaryExpression.getLine());
	}

	@Override
	public Object visitFunctionCall(FunctionCallAst functionCall) {
		Object callee = eval(functionCall.getCallee());
		List<Object> arguments = new ArrayList<>();
		for (ExpressionAst argument : functionCall.getArguments()) {
			arguments.add(eval(argument));
		}
		if (!(callee instanceof EthicaFunction)) {
			throw new EthicaRuntimeException(
					functionCall.getLine(),
					"'" + functionCall.getCallee() + "' is not callable (" + Values.typeName(callee) + ")");
		}
		return ((EthicaFunction) callee).call(arguments, functionCall.getLine());
	}

	@Override
	public Object visitIndex(IndexAst index) {
		Object object = eval(index.getObject());
		Object key = eval(index.getIndex());
		int line = index.getLine();
		if (object instanceof List || object instanceof String) {
			if (!(key instanceof Long)) {
				throw new EthicaRuntimeException(line, "Index must be int, got " + Values.typeName(key));
			}
			int size = object instanceof List ? ((List<?>) object).size() : ((String) object).length();
			long position = (Long) key;
			if (position < 0) {
				position += size;
			}
			if (position < 0 || position >= size) {
				throw new EthicaRuntimeException(line, "Index " + key + " out of range");
			}
			if (object instanceof List) {
				return ((List<?>) object).get((int) position);
			}
			return String.valueOf(((String) object).charAt((int) position));
		}
		if (object instanceof Map) {
			Map<?, ?> map = (Map<?, ?>) object;
			if (!map.containsKey(key)) {
				throw new EthicaRuntimeException(line, "Key not found: " + Values.toDisplayString(key));
			}
			return map.get(key);
		}
		throw new EthicaRuntimeException(line, "Cannot index " + Values.typeName(object));
	}

	@Override
	public Object visitMember(MemberAst member) {
		Object object = eval(member.getObject());
		if (object instanceof Map) {
			Map<?, ?> map = (Map<?, ?>) object;
			if (map.containsKey(member.getName())) {
				return map.get(member.getName());
			}
			throw new EthicaRuntimeException(member.getLine(), "Dictionary has no key '" + member.getName() + "'");
		}
		throw new EthicaRuntimeException(
				member.getLine(),
				"Member access not supported for " + Values.typeName(object));
	}

	@Override
	public Object visitListLiteral(ListLiteralAst listLiteral) {
		List<Object> list = new ArrayList<>();
		for (ExpressionAst element : listLiteral.getElements()) {
			list.add(eval(element));
		}
		return list;
	}

	@Override
	public Object visitDictLiteral(DictLiteralAst dictLiteral) {
		Map<Object, Object> map = new LinkedHashMap<>();
		for (int i = 0; i < dictLiteral.size(); i++) {
			ExpressionAst keyExpression = dictLiteral.getKeys().get(i);
			Object key = eval(keyExpression);
			if (key instanceof List || key instanceof Map || key instanceof EthicaFunction) {
				throw new EthicaRuntimeException(
						keyExpression.getLine(),
						"Dictionary keys must be hashable, got " + Values.typeName(key));
			}
			map.put(key, eval(dictLiteral.getValues().get(i)));
		}
		return map;
	}

	@Override
	public Object visitIdentifier(IdentifierAst identifier) {
		return env.get(identifier.getName(), identifier.getLine());
	}

	@Override
	public Object visitLiteral(LiteralAst literal) {
		return literal.getValue();
	}
}
