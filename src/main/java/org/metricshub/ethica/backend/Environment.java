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

import java.util.HashMap;
import java.util.Map;

/**
 * A scope of variables, chained to the scope that encloses it.
 */
public class Environment {

	private final Environment parent;
	private final Map<String, Object> bindings = new HashMap<>();

	/**
	 * Creates a global scope.
	 */
	public Environment() {
		this(null);
	}

	/**
	 * @param parent enclosing scope, {@code null} for a global scope
	 */
	public Environment(Environment parent) {
		this.parent = parent;
	}

	public Environment getParent() {
		return parent;
	}

	/**
	 * Binds a name in this scope, hiding any binding of an enclosing scope.
	 */
	public void define(String name, Object value) {
		bindings.put(name, value);
	}

	/**
	 * Assigns a variable: the innermost existing binding is updated, and if
	 * there is none the variable is created in this scope.
	 */
	public void assign(String name, Object value) {
		for (Environment env = this; env != null; env = env.parent) {
			if (env.bindings.containsKey(name)) {
				env.bindings.put(name, value);
				return;
			}
		}
		bindings.put(name, value);
	}

	/**
	 * @param name a variable name
	 * @param line line of the program reading the variable
	 * @return the value of the innermost binding
	 * @throws EthicaRuntimeException if the name is not bound
	 */
	public Object get(String name, int line) {
		for (Environment env = this; env != null; env = env.parent) {
			if (env.bindings.containsKey(name)) {
				return env.bindings.get(name);
			}
		}
		throw new EthicaRuntimeException(line, "Undefined variable: " + name);
	}

	public boolean exists(String name) {
		for (Environment env = this; env != null; env = env.parent) {
			if (env.bindings.containsKey(name)) {
				return true;
			}
		}
		return false;
	}
}
