package org.metricshub.ethica.analysis;

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
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.metricshub.ethica.frontend.ast.ProgramAst;
import org.metricshub.ethica.util.EthicaLogger;
import org.metricshub.ethica.util.VerifierSettings;
import org.slf4j.Logger;

/**
 * Runs the enabled checks over a program and combines their reports.
 * <p>
 * The checks share nothing but the immutable tree, so they may run
 * concurrently ({@link VerifierSettings#isParallel()}), on a thread pool
 * created for the run and shut down afterwards.
 */
public class Verifier {

	private static final Logger LOG = EthicaLogger.getLogger(Verifier.class);

	private final Map<CheckName, Analyzer> analyzers;

	/**
	 * Creates a verifier with the four standard checks.
	 */
	public Verifier() {
		this(new CostEstimator(), new PolicyChecker(), new ReadabilityScorer(), new ObfuscationDetector());
	}

	/**
	 * Creates a verifier with specific analyzers, one per check at most.
	 *
	 * @param analyzers the analyzers
	 */
	public Verifier(Analyzer... analyzers) {
		Map<CheckName, Analyzer> map = new EnumMap<>(CheckName.class);
		for (Analyzer analyzer : analyzers) {
			if (map.put(analyzer.getCheckName(), analyzer) != null) {
				throw new IllegalArgumentException("Duplicate analyzer for check " + analyzer.getCheckName());
			}
		}
		this.analyzers = Collections.unmodifiableMap(map);
	}

	/**
	 * Verifies a program.
	 *
	 * @param program the program
	 * @param settings which checks to run, and their thresholds
	 * @return the reports of the enabled checks
	 */
	public VerificationResult verify(ProgramAst program, VerifierSettings settings) {
		List<Analyzer> enabled = new ArrayList<>();
		for (Map.Entry<CheckName, Analyzer> entry : analyzers.entrySet()) {
			if (settings.isEnabled(entry.getKey())) {
				enabled.add(entry.getValue());
			}
		}

		long start = System.currentTimeMillis();
		Map<CheckName, AnalysisReport> reports;
		if (settings.isParallel() && enabled.size() > 1) {
			reports = runParallel(enabled, program, settings);
		} else {
			reports = new EnumMap<>(CheckName.class);
			for (Analyzer analyzer : enabled) {
				reports.put(analyzer.getCheckName(), analyzer.analyze(program, settings));
			}
		}

		VerificationResult result = new VerificationResult(program, reports);
		for (AnalysisReport report : reports.values()) {
			LOG.debug("{}", report);
		}
		LOG.debug("Verification of {} checks took {} ms", enabled.size(), System.currentTimeMillis() - start);
		if (!result.isPassed()) {
			LOG.info("Program rejected: {}", result);
		}
		return result;
	}

	private Map<CheckName, AnalysisReport> runParallel(
			List<Analyzer> enabled,
			final ProgramAst program,
			final VerifierSettings settings) {
		ExecutorService executor = Executors.newFixedThreadPool(enabled.size());
		try {
			Map<CheckName, Future<AnalysisReport>> futures = new EnumMap<>(CheckName.class);
			for (final Analyzer analyzer : enabled) {
				Callable<AnalysisReport> task = new Callable<AnalysisReport>() {
					@Override
					public AnalysisReport call() {
						return analyzer.analyze(program, settings);
					}
				};
				futures.put(analyzer.getCheckName(), executor.submit(task));
			}
			Map<CheckName, AnalysisReport> reports = new EnumMap<>(CheckName.class);
			for (Map.Entry<CheckName, Future<AnalysisReport>> entry : futures.entrySet()) {
				reports.put(entry.getKey(), await(entry.getValue()));
			}
			return reports;
		} finally {
			executor.shutdownNow();
		}
	}

	private static AnalysisReport await(Future<AnalysisReport> future) {
		try {
			return future.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while waiting for a check", e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new IllegalStateException(cause);
		}
	}
}
