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

import java.util.List;

/**
 * {@code function name(params):} followed by its body, with the annotations
 * that precede it.
 */
public final class FunctionDefAst extends StatementAst {

	private final String name;
	private final List<String> parameters;
	private final List<AnnotationAst> annotations;
	private final List<StatementAst> body;

	public FunctionDefAst(
			String name,
			List<String> parameters,
			List<AnnotationAst> annotations,
			List<StatementAst> body,
			int line,
			int column) {
		super(line, column);
		this.name = name;
		this.parameters = immutable(parameters);
		this.annotations = immutable(annotations);
		this.body = immutable(body);
	}

	public String getName() {
		return name;
	}

	public List<String> getParameters() {
		return parameters;
	}

	public List<AnnotationAst> getAnnotations() {
		return annotations;
	}

	public List<StatementAst> getBody() {
		return body;
	}

	/**
	 * @param annotationName name of the annotation, without the {@code @}
	 * @return whether this function carries the annotation
	 */
	public boolean hasAnnotation(String annotationName) {
		for (AnnotationAst annotation : annotations) {
			if (annotation.getName().equals(annotationName)) {
				return true;
			}
		}
		return false;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor) {
		return visitor.visitFunctionDef(this);
	}

	@Override
	public String toString() {
		return "function " + name + "(" + String.join(", ", parameters) + ")";
	}
}
