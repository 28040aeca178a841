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

import java.io.IOException;
import java.util.List;
import org.metricshub.ethica.analysis.VerificationResult;
import org.metricshub.ethica.analysis.Verifier;
import org.metricshub.ethica.backend.Interpreter;
import org.metricshub.ethica.frontend.EthicaParser;
import org.metricshub.ethica.frontend.Lexer;
import org.metricshub.ethica.frontend.Token;
import org.metricshub.ethica.frontend.ast.ProgramAst;
import org.metricshub.ethica.util.EthicaLogger;
import org.metricshub.ethica.util.ScriptSource;
import org.metricshub.ethica.util.VerifierSettings;
import org.slf4j.Logger;

/**
 * Entry point into the tokenization, parsing, verification and execution
 * of an Ethica program.
 * This entry point is used both when Ethica is embedded as a library and when
 * invoked from the command line.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Tokenize the source text, producing a list of tokens with explicit
 * INDENT/DEDENT tokens for the block structure.
 * <li>Parse the tokens, producing an abstract syntax tree.
 * <li>Run the enabled checks (energy, ethics, readability, cleverness) on the
 * syntax tree. Each check produces a report.
 * <li>Only when every enabled check passed, interpret the syntax tree.
 * </ul>
 * Lexical and syntax errors abort the process with a {@link
 * org.metricshub.ethica.frontend.LexerException} or a {@link
 * org.metricshub.ethica.frontend.ParserException}. Checks never throw: a
 * program that does not meet them is described by its
 * {@link VerificationResult}.
 */
public class Ethica {

	private static final Logger LOG = EthicaLogger.getLogger(Ethica.class);

	private final Verifier verifier;

	/**
	 * Creates an instance running the four standard checks.
	 */
	public Ethica() {
		this(new Verifier());
	}

	/**
	 * Creates an instance running the checks of the given verifier.
	 *
	 * @param verifier verifier to use
	 */
	public Ethica(Verifier verifier) {
		if (verifier == null) {
			throw new IllegalArgumentException("verifier must not be null");
		}
		this.verifier = verifier;
	}

	/**
	 * Tokenizes a program.
	 *
	 * @param source program text
	 * @return the tokens, terminated by EOF
	 */
	public List<Token> tokenize(String source) {
		return new Lexer(source, ScriptSource.DESCRIPTION_INLINE_SCRIPT).tokenize();
	}

	/**
	 * Parses a program.
	 *
	 * @param source program text
	 * @return the syntax tree
	 */
	public ProgramAst parse(String source) {
		return parse(source, ScriptSource.DESCRIPTION_INLINE_SCRIPT);
	}

	/**
	 * Reads and parses a program.
	 *
	 * @param script where to read the program from
	 * @return the syntax tree
	 * @throws IOException if the script cannot be read
	 */
	public ProgramAst parse(ScriptSource script) throws IOException {
		return parse(script.readScript(), script.getDescription());
	}

	private ProgramAst parse(String source, String description) {
		long start = System.nanoTime();
		List<Token> tokens = new Lexer(source, description).tokenize();
		ProgramAst program = new EthicaParser(tokens, description).parse();
		LOG
				.debug(
						"Parsed {}: {} tokens, {} statements in {} us",
						description,
						tokens.size(),
						program.getStatements().size(),
						(System.nanoTime() - start) / 1000);
		return program;
	}

	/**
	 * Parses and verifies a program.
	 *
	 * @param source program text
	 * @param settings thresholds and enabled checks
	 * @return the reports of the enabled checks
	 */
	public VerificationResult verify(String source, VerifierSettings settings) {
		return verify(parse(source), settings);
	}

	/**
	 * Reads, parses and verifies a program.
	 *
	 * @param script where to read the program from
	 * @param settings thresholds and enabled checks
	 * @return the reports of the enabled checks
	 * @throws IOException if the script cannot be read
	 */
	public VerificationResult verify(ScriptSource script, VerifierSettings settings) throws IOException {
		return verify(parse(script), settings);
	}

	/**
	 * Verifies a parsed program.
	 *
	 * @param program the syntax tree
	 * @param settings thresholds and enabled checks
	 * @return the reports of the enabled checks
	 */
	public VerificationResult verify(ProgramAst program, VerifierSettings settings) {
		return verifier.verify(program, settings);
	}

	/**
	 * Parses, verifies and, if verification passed, runs a program.
	 * <code>print</code> writes to {@link VerifierSettings#getOutputStream()}.
	 *
	 * @param source program text
	 * @param settings thresholds, enabled checks and output stream
	 * @return the value of a top-level <code>return</code>, if any
	 * @throws VerificationException if an enabled check failed
	 */
	public Object run(String source, VerifierSettings settings) {
		return run(parse(source), settings);
	}

	/**
	 * Reads, parses, verifies and, if verification passed, runs a program.
	 *
	 * @param script where to read the program from
	 * @param settings thresholds, enabled checks and output stream
	 * @return the value of a top-level <code>return</code>, if any
	 * @throws IOException if the script cannot be read
	 * @throws VerificationException if an enabled check failed
	 */
	public Object run(ScriptSource script, VerifierSettings settings) throws IOException {
		return run(parse(script), settings);
	}

	/**
	 * Verifies and, if verification passed, runs a parsed program.
	 *
	 * @param program the syntax tree
	 * @param settings thresholds, enabled checks and output stream
	 * @return the value of a top-level <code>return</code>, if any
	 * @throws VerificationException if an enabled check failed
	 */
	public Object run(ProgramAst program, VerifierSettings settings) {
		VerificationResult result = verify(program, settings);
		if (!result.isPassed()) {
			throw new VerificationException(result);
		}
		return execute(result.getProgram(), settings);
	}

	/**
	 * Runs a program without verifying it.
	 *
	 * @param program the syntax tree
	 * @param settings where <code>print</code> writes
	 * @return the value of a top-level <code>return</code>, if any
	 */
	public Object execute(ProgramAst program, VerifierSettings settings) {
		long start = System.nanoTime();
		try {
			return new Interpreter(settings.getOutputStream()).execute(program);
		} finally {
			settings.getOutputStream().flush();
			LOG.debug("Executed program in {} us", (System.nanoTime() - start) / 1000);
		}
	}
}
