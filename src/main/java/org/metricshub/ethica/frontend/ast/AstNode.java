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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of every node of the Ethica syntax tree.
 * <p>
 * The set of node classes is closed: each concrete node is a final class of
 * this package and has a matching method in {@link AstVisitor}. Nodes are
 * immutable once built, keep their source position and hold no reference to
 * their parent.
 */
public abstract class AstNode {

	private final int line;
	private final int column;

	protected AstNode(int line, int column) {
		this.line = line;
		this.column = column;
	}

	/**
	 * @return 1-based line of the first token of this node
	 */
	public int getLine() {
		return line;
	}

	/**
	 * @return 1-based column of the first token of this node
	 */
	public int getColumn() {
		return column;
	}

	/**
	 * Calls the visitor method that matches the class of this node.
	 *
	 * @param visitor the visitor
	 * @param <R> result type of the visitor
	 * @return whatever the visitor method returns
	 */
	public abstract <R> R accept(AstVisitor<R> visitor);

	/**
	 * Prints this node and its children as an indented tree.
	 *
	 * @param ps where to print
	 */
	public void dump(PrintStream ps) {
		new AstPrinter(ps).print(this);
	}

	static <T> List<T> immutable(List<T> list) {
		return Collections.unmodifiableList(new ArrayList<>(list));
	}
}
