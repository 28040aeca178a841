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

import java.util.List;
import java.util.Map;

/**
 * Operations on run-time values: {@link Long}, {@link Double}, {@link String},
 * {@link Boolean}, {@code null}, {@link List}, {@link Map} and
 * {@link EthicaFunction}.
 */
public final class Values {

	private Values() {}

	/**
	 * {@code none}, {@code false}, zero and empty strings, lists and dicts are
	 * false; everything else is true.
	 */
	public static boolean isTruthy(Object value) {
		if (value == null) {
			return false;
		}
		if (value instanceof Boolean) {
			return (Boolean) value;
		}
		if (value instanceof Long) {
			return (Long) value != 0L;
		}
		if (value instanceof Double) {
			return (Double) value != 0.0;
		}
		if (value instanceof String) {
			return !((String) value).isEmpty();
		}
		if (value instanceof List) {
			return !((List<?>) value).isEmpty();
		}
		if (value instanceof Map) {
			return !((Map<?, ?>) value).isEmpty();
		}
		return true;
	}

	/**
	 * @return the name of the type of a value, as returned by {@code type()}
	 */
	public static String typeName(Object value) {
		if (value == null) {
			return "none";
		}
		if (value instanceof Boolean) {
			return "bool";
		}
		if (value instanceof Long) {
			return "int";
		}
		if (value instanceof Double) {
			return "float";
		}
		if (value instanceof String) {
			return "str";
		}
		if (value instanceof List) {
			return "list";
		}
		if (value instanceof Map) {
			return "dict";
		}
		if (value instanceof EthicaFunction) {
			return "function";
		}
		return value.getClass().getSimpleName();
	}

	public static boolean isNumber(Object value) {
		return value instanceof Long || value instanceof Double;
	}

	/**
	 * Converts a value to text the way {@code print} and {@code str()} do.
	 */
	public static String toDisplayString(Object value) {
		if (value instanceof String) {
			return (String) value;
		}
		return repr(value);
	}

	private static String repr(Object value) {
		if (value == null) {
			return "none";
		}
		if (value instanceof String) {
			String s = (String) value;
			return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\t", "\\t") + "\"";
		}
		if (value instanceof List) {
			StringBuilder sb = new StringBuilder("[");
			boolean first = true;
			for (Object element : (List<?>) value) {
				if (!first) {
					sb.append(", ");
				}
				first = false;
				sb.append(repr(element));
			}
			return sb.append(']').toString();
		}
		if (value instanceof Map) {
			StringBuilder sb = new StringBuilder("{");
			boolean first = true;
			for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
				if (!first) {
					sb.append(", ");
				}
				first = false;
				sb.append(repr(entry.getKey())).append(": ").append(repr(entry.getValue()));
			}
			return sb.append('}').toString();
		}
		if (value instanceof EthicaFunction) {
			return "<function " + ((EthicaFunction) value).getName() + ">";
		}
		return value.toString();
	}

	/**
	 * Equality as {@code ==} sees it: numbers compare by value, whatever
	 * their type.
	 */
	public static boolean isEqual(Object left, Object right) {
		if (isNumber(left) && isNumber(right)) {
			if (left instanceof Long && right instanceof Long) {
				return ((Long) left).longValue() == ((Long) right).longValue();
			}
			return ((Number) left).doubleValue() == ((Number) right).doubleValue();
		}
		if (left == null || right == null) {
			return left == right;
		}
		if (left instanceof List && right instanceof List) {
			List<?> l = (List<?>) left;
			List<?> r = (List<?>) right;
			if (l.size() != r.size()) {
				return false;
			}
			for (int i = 0; i < l.size(); i++) {
				if (!isEqual(l.get(i), r.get(i))) {
					return false;
				}
			}
			return true;
		}
		return left.equals(right);
	}

	/**
	 * Orders two numbers or two strings.
	 *
	 * @return a negative number, zero or a positive number
	 * @throws EthicaRuntimeException if the values cannot be ordered
	 */
	public static int compare(Object left, Object right, int line) {
		if (left instanceof Long && right instanceof Long) {
			return Long.compare((Long) left, (Long) right);
		}
		if (isNumber(left) && isNumber(right)) {
			return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
		}
		if (left instanceof String && right instanceof String) {
			return ((String) left).compareTo((String) right);
		}
		throw new EthicaRuntimeException(
				line,
				"Cannot compare '" + typeName(left) + "' with '" + typeName(right) + "'");
	}
}
