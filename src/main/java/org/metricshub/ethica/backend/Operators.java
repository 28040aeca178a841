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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.ethica.frontend.ast.BinaryOperator;
import org.metricshub.ethica.frontend.ast.UnaryOperator;

/**
 * Arithmetic and comparison operators. Integer arithmetic is exact: an
 * overflow stops the program instead of wrapping around.
 */
final class Operators {

	private Operators() {}

	static Object binary(BinaryOperator operator, Object left, Object right, int line) {
		try {
			switch (operator) {
			case ADD:
				return add(left, right, line);
			case SUBTRACT:
				if (left instanceof Long && right instanceof Long) {
					return Math.subtractExact((Long) left, (Long) right);
				}
				return toDouble(operator, left, line) - toDouble(operator, right, line);
			case MULTIPLY:
				if (left instanceof Long && right instanceof Long) {
					return Math.multiplyExact((Long) left, (Long) right);
				}
				checkNumbers(operator, left, right, line);
				return toDouble(operator, left, line) * toDouble(operator, right, line);
			case DIVIDE:
				checkNumbers(operator, left, right, line);
				if (toDouble(operator, right, line) == 0.0) {
					throw new EthicaRuntimeException(line, "Division by zero");
				}
				return toDouble(operator, left, line) / toDouble(operator, right, line);
			case MODULO:
				return modulo(left, right, line);
			case POWER:
				return power(left, right, line);
			case EQ:
				return Values.isEqual(left, right);
			case NE:
				return !Values.isEqual(left, right);
			case LT:
				return Values.compare(left, right, line) < 0;
			case LE:
				return Values.compare(left, right, line) <= 0;
			case GT:
				return Values.compare(left, right, line) > 0;
			case GE:
				return Values.compare(left, right, line) >= 0;
			default:
				throw new IllegalStateException("Operator " + operator + " is evaluated by the interpreter");
			}
		} catch (ArithmeticException e) {
			throw new EthicaRuntimeException(line, "Integer overflow in " + operator.getSymbol(), e);
		}
	}

	static Object unary(UnaryOperator operator, Object operand, int line) {
		if (operator == UnaryOperator.NOT) {
			return !Values.isTruthy(operand);
		}
		if (operand instanceof Long) {
			try {
				return Math.negateExact((Long) operand);
			} catch (ArithmeticException e) {
				throw new EthicaRuntimeException(line, "Integer overflow in -", e);
			}
		}
		if (operand instanceof Double) {
			return -(Double) operand;
		}
		throw new EthicaRuntimeException(line, "Bad operand type for unary -: '" + Values.typeName(operand) + "'");
	}

	private static Object add(Object left, Object right, int line) {
		if (left instanceof Long && right instanceof Long) {
			return Math.addExact((Long) left, (Long) right);
		}
		if (Values.isNumber(left) && Values.isNumber(right)) {
			return ((Number) left).doubleValue() + ((Number) right).doubleValue();
		}
		if (left instanceof String && right instanceof String) {
			return (String) left + right;
		}
		if (left instanceof List && right instanceof List) {
			List<Object> result = new ArrayList<>((List<?>) left);
			result.addAll((List<?>) right);
			return result;
		}
		throw unsupported(BinaryOperator.ADD, left, right, line);
	}

	private static Object modulo(Object left, Object right, int line) {
		checkNumbers(BinaryOperator.MODULO, left, right, line);
		if (left instanceof Long && right instanceof Long) {
			if ((Long) right == 0L) {
				throw new EthicaRuntimeException(line, "Modulo by zero");
			}
			return Math.floorMod((Long) left, (Long) right);
		}
		double dividend = ((Number) left).doubleValue();
		double divisor = ((Number) right).doubleValue();
		if (divisor == 0.0) {
			throw new EthicaRuntimeException(line, "Modulo by zero");
		}
		return dividend - divisor * Math.floor(dividend / divisor);
	}

	private static Object power(Object left, Object right, int line) {
		checkNumbers(BinaryOperator.POWER, left, right, line);
		if (left instanceof Long && right instanceof Long && (Long) right >= 0) {
			long base = (Long) left;
			long exponent = (Long) right;
			long result = 1;
			while (exponent > 0) {
				if ((exponent & 1) == 1) {
					result = Math.multiplyExact(result, base);
				}
				exponent >>= 1;
				if (exponent > 0) {
					base = Math.multiplyExact(base, base);
				}
			}
			return result;
		}
		return Math.pow(((Number) left).doubleValue(), ((Number) right).doubleValue());
	}

	private static void checkNumbers(BinaryOperator operator, Object left, Object right, int line) {
		if (!Values.isNumber(left) || !Values.isNumber(right)) {
			throw unsupported(operator, left, right, line);
		}
	}

	private static double toDouble(BinaryOperator operator, Object value, int line) {
		if (!Values.isNumber(value)) {
			throw new EthicaRuntimeException(
					line,
					"Unsupported operand type for " + operator.getSymbol() + ": '" + Values.typeName(value) + "'");
		}
		return ((Number) value).doubleValue();
	}

	private static EthicaRuntimeException unsupported(BinaryOperator operator, Object left, Object right, int line) {
		return new EthicaRuntimeException(
				line,
				"Unsupported operand types for " + operator.getSymbol() + ": '" + Values.typeName(left) + "' and '"
						+ Values.typeName(right) + "'");
	}
}
