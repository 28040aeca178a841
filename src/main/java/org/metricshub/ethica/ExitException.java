package org.metricshub.ethica;

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

/**
 * Requests that the process terminates with the given exit code.
 * <p>
 * Thrown by the command-line interface when a program is rejected or fails,
 * so that only {@link Cli#main(String[])} calls <code>System.exit()</code>.
 */
public class ExitException extends Exception {

	private static final long serialVersionUID = 1L;

	/** Exit code of a program that was rejected by the verifier or failed */
	public static final int EXIT_CODE_FAILURE = 1;

	private final int code;

	/**
	 * @param code the exit code
	 */
	public ExitException(int code) {
		super();
		this.code = code;
	}

	/**
	 * @param code the exit code
	 * @param msg what happened
	 */
	public ExitException(int code, String msg) {
		super(msg);
		this.code = code;
	}

	/**
	 * @return the exit code
	 */
	public int getCode() {
		return code;
	}
}
