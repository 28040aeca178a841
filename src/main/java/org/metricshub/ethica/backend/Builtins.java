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
import java.util.List;
import java.util.Map;

/**
 * The functions every program can call without defining them.
 */
final class Builtins {

	/** Largest list {@code range()} builds. */
	static final long MAX_RANGE_SIZE = 10_000_000L;

	private Builtins() {}

	/**
	 * A built-in taking a fixed or bounded number of arguments.
	 */
	private abstract static class Builtin implements EthicaFunction {

		private final String name;
		private final int minArgs;
		private final int maxArgs;

		Builtin(String name, int minArgs, int maxArgs) {
			this.name = name;
			this.minArgs = minArgs;
			this.maxArgs = maxArgs;
		}

		@Override
		public String getName() {
			return name;
		}

		@Override
		public Object call(List<Object> arguments, int line) {
			int count = arguments.size();
			if (count < minArgs || count > maxArgs) {
				String expected = minArgs == maxArgs
						? String.valueOf(minArgs)
						: maxArgs == Integer.MAX_VALUE ? "at least " + minArgs : minArgs + " to " + maxArgs;
				throw new EthicaRuntimeException(line, name + "() takes " + expected + " arguments, got " + count);
			}
			return apply(arguments, line);
		}

		abstract Object apply(List<Object> arguments, int line);

		@Override
		public String toString() {
			return "<built-in " + name + ">";
		}
	}

	/**
	 * Defines the built-ins in a scope.
	 *
	 * @param env usually the global scope
	 * @param out where {@code print} writes
	 */
	static void register(Environment env, final PrintStream out) {
		define(env, new Builtin("print", 0, Integer.MAX_VALUE) {
			@Override
			Object apply(List<Object> arguments, int line) {
				StringBuilder sb = new StringBuilder();
				for (int i = 0; i < arguments.size(); i++) {
					if (i > 0) {
						sb.append(' ');
					}
					sb.append(Values.toDisplayString(arguments.get(i)));
				}
				out.println(sb);
				return null;
			}
		});
		define(env, new Builtin("len", 1, 1) {
			@Override
			Object apply(List<Object> arguments, int line) {
				Object value = arguments.get(0);
				if (value instanceof String) {
					return (long) ((String) value).length();
				}
				if (value instanceof List) {
					return (long) ((List<?>) value).size();
				}
				if (value instanceof Map) {
					return (long) ((Map<?, ?>) value).size();
				}
				throw new EthicaRuntimeException(line, "len() not supported for type " + Values.typeName(value));
			}
		});
		define(env, new Builtin("range", 1, 3) {
			@Override
			Object apply(List<Object> arguments, int line) {
				long[] values = new long[arguments.size()];
				for (int i = 0; i < values.length; i++) {
					Object argument = arguments.get(i);
					if (!(argument instanceof Long)) {
						throw new EthicaRuntimeException(line, "range() arguments must be int, got " + Values.typeName(argument));
					}
					values[i] = (Long) argument;
				}
				long start = values.length == 1 ? 0 : values[0];
				long stop = values.length == 1 ? values[0] : values[1];
				long step = values.length == 3 ? values[2] : 1;
				if (step == 0) {
					throw new EthicaRuntimeException(line, "range() step must not be zero");
				}
				List<Object> result = new ArrayList<>();
				for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
					if (result.size() >= MAX_RANGE_SIZE) {
						throw new EthicaRuntimeException(line, "range() too large");
					}
					result.add(i);
				}
				return result;
			}
		});
		define(env, new Builtin("str", 1, 1) {
			@Override
			Object apply(List<Object> arguments, int line) {
				return Values.toDisplayString(arguments.get(0));
			}
		});
		define(env, new Builtin("int", 1, 1) {
			@Override
			Object apply(List<Object> arguments, int line) {
				Object value = arguments.get(0);
				if (value instanceof Long) {
					return value;
				}
				if (value instanceof Double) {
					double d = (Double) value;
					if (Double.isNaN(d) || Double.isInfinite(d) || Math.abs(d) >= 9.223372036854775807E18) {
						throw new EthicaRuntimeException(line, "Cannot convert " + d + " to int");
					}
					return (long) d;
				}
				if (value instanceof Boolean) {
					return (Boolean) value ? 1L : 0L;
				}
				if (value instanceof String) {
					try {
						return Long.parseLong(((String) value).trim());
					} catch (NumberFormatException e) {
						throw new EthicaRuntimeException(line, "Cannot convert '" + value + "' to int", e);
					}
				}
				throw new EthicaRuntimeException(line, "Cannot convert " + Values.typeName(value) + " to int");
			}
		});
		define(env, new Builtin("float", 1, 1) {
			@Override
			Object apply(List<Object> arguments, int line) {
				Object value = arguments.get(0);
				if (Values.isNumber(value)) {
					return ((Number) value).doubleValue();
				}
				if (value instanceof Boolean) {
					return (Boolean) value ? 1.0 : 0.0;
				}
				if (value instanceof String) {
					try {
						return Double.parseDouble(((String) value).trim());
					} catch (NumberFormatException e) {
						throw new EthicaRuntimeException(line, "Cannot convert '" + value + "' to float", e);
					}
				}
				throw new EthicaRuntimeException(line, "Cannot convert " + Values.typeName(value) + " to float");
			}
		});
		define(env, new Builtin("type", 1, 1) {
			@Override
			Object apply(List<Object> arguments, int line) {
				return Values.typeName(arguments.get(0));
			}
		});
		define(env, new Builtin("abs", 1, 1) {
			@Override
			Object apply(List<Object> arguments, int line) {
				Object value = arguments.get(0);
				if (value instanceof Long) {
					long l = (Long) value;
					if (l == Long.MIN_VALUE) {
						throw new EthicaRuntimeException(line, "Integer overflow");
					}
					return Math.abs(l);
				}
				if (value instanceof Double) {
					return Math.abs((Double) value);
				}
				throw new EthicaRuntimeException(line, "abs() not supported for type " + Values.typeName(value));
			}
		});
		define(env, new Extremum("min", -1));
		define(env, new Extremum("max", 1));
		define(env, new Builtin("sum", 1, 1) {
			@Override
			Object apply(List<Object> arguments, int line) {
				Object value = arguments.get(0);
				if (!(value instanceof List)) {
					throw new EthicaRuntimeException(line, "sum() requires a list");
				}
				long longSum = 0;
				double doubleSum = 0;
				boolean isDouble = false;
				for (Object element : (List<?>) value) {
					if (element instanceof Long && !isDouble) {
						try {
							longSum = Math.addExact(longSum, (Long) element);
						} catch (ArithmeticException e) {
							throw new EthicaRuntimeException(line, "Integer overflow", e);
						}
					} else if (Values.isNumber(element)) {
						if (!isDouble) {
							doubleSum = longSum;
							isDouble = true;
						}
						doubleSum += ((Number) element).doubleValue();
					} else {
						throw new EthicaRuntimeException(line, "sum() requires numbers, got " + Values.typeName(element));
					}
				}
				return isDouble ? (Object) doubleSum : (Object) longSum;
			}
		});
	}

	private static void define(Environment env, EthicaFunction function) {
		env.define(function.getName(), function);
	}

	/**
	 * {@code min()} and {@code max()}: over the arguments, or over the
	 * elements of a single list argument.
	 */
	private static final class Extremum extends Builtin {

		private final int sign;

		Extremum(String name, int sign) {
			super(name, 1, Integer.MAX_VALUE);
			this.sign = sign;
		}

		@Override
		Object apply(List<Object> arguments, int line) {
			List<?> candidates = arguments;
			if (arguments.size() == 1 && arguments.get(0) instanceof List) {
				candidates = (List<?>) arguments.get(0);
			}
			if (candidates.isEmpty()) {
				throw new EthicaRuntimeException(line, getName() + "() of an empty list");
			}
			Object best = candidates.get(0);
			for (Object candidate : candidates.subList(1, candidates.size())) {
				if (Integer.signum(Values.compare(candidate, best, line)) == sign) {
					best = candidate;
				}
			}
			return best;
		}
	}
}
