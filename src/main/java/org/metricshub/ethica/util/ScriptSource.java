package org.metricshub.ethica.util;

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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * An Ethica program to compile, with a description of where it comes from.
 * The description is what error messages and reports call the program.
 */
public class ScriptSource {

	/** Description of a program given as a plain string. */
	public static final String DESCRIPTION_INLINE_SCRIPT = "<inline-script>";

	private final String description;
	private final Reader reader;

	/**
	 * @param description name of the program
	 * @param reader the program text
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * Wraps a program held in a string.
	 *
	 * @param script the program text
	 * @return the source, described as {@link #DESCRIPTION_INLINE_SCRIPT}
	 */
	public static ScriptSource of(String script) {
		return new ScriptSource(DESCRIPTION_INLINE_SCRIPT, new StringReader(script));
	}

	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the program text.
	 *
	 * @return The reader which contains the program text.
	 * @throws IOException if the program cannot be opened
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Reads the whole program text. The reader is consumed and closed.
	 *
	 * @return the program text
	 * @throws IOException if the program cannot be read
	 */
	public String readScript() throws IOException {
		StringBuilder sb = new StringBuilder();
		char[] buf = new char[8192];
		try (Reader r = getReader()) {
			int n;
			while ((n = r.read(buf)) != -1) {
				sb.append(buf, 0, n);
			}
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return getDescription();
	}
}
