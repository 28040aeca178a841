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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.ethica.frontend.ast.AssignmentAst;
import org.metricshub.ethica.frontend.ast.AstNode;
import org.metricshub.ethica.frontend.ast.AstScanner;
import org.metricshub.ethica.frontend.ast.FunctionCallAst;
import org.metricshub.ethica.frontend.ast.FunctionDefAst;
import org.metricshub.ethica.frontend.ast.LiteralAst;
import org.metricshub.ethica.frontend.ast.ProgramAst;
import org.metricshub.ethica.util.EthicaLogger;
import org.metricshub.ethica.util.VerifierSettings;
import org.slf4j.Logger;

/**
 * Ethics check: sensitive operations must be declared with an annotation on
 * the function that performs them, some operations are never allowed, and
 * secrets must not be written in the source.
 * <p>
 * Operation names are matched against fixed tables. A function whose own name
 * is sensitive, or whose body calls a sensitive function, must carry the
 * annotation the table requires. A sensitive call at the top level of the
 * program can never be annotated and is always reported. Inside a function,
 * a variable whose name denotes sensitive data also requires
 * {@code @requires_data_protection}.
 */
public class PolicyChecker implements Analyzer {

	private static final Logger LOG = EthicaLogger.getLogger(PolicyChecker.class);

	public static final String REQUIRES_USER_CONSENT = "requires_user_consent";
	public static final String REQUIRES_DATA_PROTECTION = "requires_data_protection";

	/**
	 * How a rule pattern is compared with an operation name. Comparisons are
	 * case sensitive.
	 */
	public enum MatchMode {
		EXACT,
		PREFIX,
		SUBSTRING;

		boolean matches(String pattern, String name) {
			switch (this) {
			case EXACT:
				return name.equals(pattern);
			case PREFIX:
				return name.startsWith(pattern);
			default:
				return name.contains(pattern);
			}
		}
	}

	/**
	 * A sensitive operation pattern and the annotation it requires.
	 */
	public static final class Rule {

		private final String pattern;
		private final MatchMode mode;
		private final String category;
		private final String requiredAnnotation;

		Rule(String pattern, MatchMode mode, String category, String requiredAnnotation) {
			this.pattern = pattern;
			this.mode = mode;
			this.category = category;
			this.requiredAnnotation = requiredAnnotation;
		}

		public String getPattern() {
			return pattern;
		}

		public MatchMode getMode() {
			return mode;
		}

		public String getCategory() {
			return category;
		}

		public String getRequiredAnnotation() {
			return requiredAnnotation;
		}

		public boolean matches(String name) {
			return mode.matches(pattern, name);
		}
	}

	private static final List<Rule> RULES;

	/** Operation name fragments that are never allowed, with the reason. */
	private static final Map<String, String> DISALLOWED;

	private static final String[] SECRET_FRAGMENTS = { "password", "secret", "api_key" };
	private static final String[] SECRET_NAMES = { "key", "token" };

	/** Variable name fragments of sensitive data, which require data protection in a function. */
	private static final String[] SENSITIVE_DATA_FRAGMENTS = { "password", "ssn", "credit_card", "secret_key", "api_key" };

	static {
		List<Rule> rules = new ArrayList<>();
		consent(rules, "location data", MatchMode.EXACT, "collect_location", "get_gps", "track_location", "get_location");
		consent(rules, "location data", MatchMode.PREFIX, "get_location_", "collect_location_", "get_gps_");
		consent(rules, "biometric data", MatchMode.EXACT, "collect_biometric", "get_fingerprint", "get_face", "scan_face");
		consent(rules, "biometric data", MatchMode.SUBSTRING, "biometric", "fingerprint");
		consent(rules, "audio or video capture", MatchMode.EXACT, "record_audio", "access_microphone", "record_video", "access_camera");
		consent(rules, "contacts", MatchMode.EXACT, "collect_contacts", "read_contacts", "access_contacts");
		consent(rules, "messages", MatchMode.EXACT, "read_messages", "access_messages", "read_sms");
		consent(rules, "user tracking", MatchMode.EXACT, "track_user", "track_behavior", "log_activity", "monitor_user");
		consent(rules, "user tracking", MatchMode.PREFIX, "track_user_", "monitor_user_");
		consent(rules, "personal data collection", MatchMode.EXACT, "collect_data", "collect_personal_info", "gather_user_data");
		protection(rules, "passwords", MatchMode.EXACT, "store_password", "save_password");
		protection(rules, "credentials", MatchMode.EXACT, "store_credential");
		protection(rules, "credentials", MatchMode.PREFIX, "store_credential_");
		protection(rules, "payment data", MatchMode.EXACT, "store_payment", "process_payment", "save_card");
		protection(rules, "sensitive records", MatchMode.EXACT, "store_ssn", "store_personal_id", "save_sensitive_data");
		RULES = Collections.unmodifiableList(rules);

		Map<String, String> disallowed = new LinkedHashMap<>();
		disallowed.put("facial_recognition", "facial recognition systems are ethically problematic");
		disallowed.put("emotion_detection", "emotion detection from faces is ethically problematic");
		disallowed.put("deepfake", "deepfake generation is prohibited");
		disallowed.put("manipulate_ui", "UI manipulation (dark patterns) is prohibited");
		disallowed.put("hide_unsubscribe", "hiding unsubscribe options is a dark pattern");
		disallowed.put("fake_urgency", "creating fake urgency is manipulative");
		disallowed.put("confuse_user", "deliberately confusing users is unethical");
		disallowed.put("trick_into_purchase", "tricking users into purchases is prohibited");
		disallowed.put("hidden_charges", "hidden charges are unethical");
		DISALLOWED = Collections.unmodifiableMap(disallowed);
	}

	private static void consent(List<Rule> rules, String category, MatchMode mode, String... patterns) {
		for (String pattern : patterns) {
			rules.add(new Rule(pattern, mode, category, REQUIRES_USER_CONSENT));
		}
	}

	private static void protection(List<Rule> rules, String category, MatchMode mode, String... patterns) {
		for (String pattern : patterns) {
			rules.add(new Rule(pattern, mode, category, REQUIRES_DATA_PROTECTION));
		}
	}

	/**
	 * @return the sensitive operation rules
	 */
	public static List<Rule> getRules() {
		return RULES;
	}

	/**
	 * @return the disallowed operation name fragments, with the reason
	 */
	public static Map<String, String> getDisallowedOperations() {
		return DISALLOWED;
	}

	/**
	 * Annotations required by an operation name, each with the category of
	 * the first rule that requires it.
	 *
	 * @param name an operation name
	 * @return annotation name to category, empty if the operation is not sensitive
	 */
	public static Map<String, String> requiredAnnotations(String name) {
		Map<String, String> required = new LinkedHashMap<>();
		for (Rule rule : RULES) {
			if (rule.matches(name) && !required.containsKey(rule.getRequiredAnnotation())) {
				required.put(rule.getRequiredAnnotation(), rule.getCategory());
			}
		}
		return required;
	}

	/**
	 * @param name a variable name
	 * @return whether values assigned to that name are likely secrets
	 */
	public static boolean isSecretName(String name) {
		for (String fragment : SECRET_FRAGMENTS) {
			if (name.contains(fragment)) {
				return true;
			}
		}
		for (String secretName : SECRET_NAMES) {
			if (name.equals(secretName)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @param name a variable name
	 * @return the first sensitive data fragment the name contains, or
	 *         {@code null}
	 */
	public static String sensitiveDataFragment(String name) {
		for (String fragment : SENSITIVE_DATA_FRAGMENTS) {
			if (name.contains(fragment)) {
				return fragment;
			}
		}
		return null;
	}

	@Override
	public CheckName getCheckName() {
		return CheckName.ETHICS;
	}

	@Override
	public AnalysisReport analyze(ProgramAst program, VerifierSettings settings) {
		PolicyVisitor visitor = new PolicyVisitor();
		program.accept(visitor);
		List<Violation> violations = visitor.violations;
		LOG.debug("Ethics check found {} violations", violations.size());
		return new AnalysisReport(CheckName.ETHICS, violations.isEmpty(), violations);
	}

	private static final class PolicyVisitor extends AstScanner<Void> {

		private final List<Violation> violations = new ArrayList<>();
		private final Deque<FunctionDefAst> functions = new ArrayDeque<>();

		private String currentFunctionName() {
			return functions.isEmpty() ? null : functions.peek().getName();
		}

		private void disallowed(AstNode node, String what, String name) {
			for (Map.Entry<String, String> entry : DISALLOWED.entrySet()) {
				if (name.contains(entry.getKey())) {
					violations.add(Violation.at(
							ViolationType.DISALLOWED_OPERATION,
							node,
							currentFunctionName(),
							what + " '" + name + "' performs a disallowed operation: " + entry.getValue(),
							"Remove the operation; no annotation makes it acceptable"));
				}
			}
		}

		@Override
		public Void visitFunctionDef(FunctionDefAst functionDef) {
			String name = functionDef.getName();
			for (Map.Entry<String, String> entry : requiredAnnotations(name).entrySet()) {
				if (!functionDef.hasAnnotation(entry.getKey())) {
					violations.add(Violation.at(
							ViolationType.MISSING_ANNOTATION,
							functionDef,
							name,
							"Function '" + name + "' handles " + entry.getValue() + " but lacks @" + entry.getKey(),
							"Add @" + entry.getKey() + " above 'function " + name + "'"));
				}
			}
			functions.push(functionDef);
			try {
				disallowed(functionDef, "Function", name);
				scanAll(functionDef.getBody());
			} finally {
				functions.pop();
			}
			return null;
		}

		@Override
		public Void visitFunctionCall(FunctionCallAst functionCall) {
			String callee = functionCall.getCalleeName();
			if (callee != null) {
				FunctionDefAst function = functions.peek();
				for (Map.Entry<String, String> entry : requiredAnnotations(callee).entrySet()) {
					String annotation = entry.getKey();
					if (function == null) {
						violations.add(Violation.at(
								ViolationType.MISSING_ANNOTATION,
								functionCall,
								null,
								"Call to '" + callee + "' (" + entry.getValue() + ") outside of any function cannot carry @"
										+ annotation,
								"Move the call into a function annotated with @" + annotation));
					} else if (!function.hasAnnotation(annotation)) {
						violations.add(Violation.at(
								ViolationType.MISSING_ANNOTATION,
								functionCall,
								function.getName(),
								"Function '" + function.getName() + "' calls '" + callee + "' (" + entry.getValue()
										+ ") without @" + annotation,
								"Add @" + annotation + " above 'function " + function.getName() + "'"));
					}
				}
				disallowed(functionCall, "Call to", callee);
			}
			return super.visitFunctionCall(functionCall);
		}

		@Override
		public Void visitAssignment(AssignmentAst assignment) {
			String target = assignment.getTarget();
			FunctionDefAst function = functions.peek();
			String fragment = sensitiveDataFragment(target);
			if (fragment != null && function != null && !function.hasAnnotation(REQUIRES_DATA_PROTECTION)) {
				violations.add(Violation.at(
						ViolationType.MISSING_ANNOTATION,
						assignment,
						function.getName(),
						"Function '" + function.getName() + "' stores sensitive data (" + fragment + ") in '" + target
								+ "' without @" + REQUIRES_DATA_PROTECTION,
						"Add @" + REQUIRES_DATA_PROTECTION + " above 'function " + function.getName() + "'"));
			}
			if (isSecretName(target) && assignment.getValue() instanceof LiteralAst) {
				Object value = ((LiteralAst) assignment.getValue()).getValue();
				if (value instanceof String && !((String) value).isEmpty()) {
					violations.add(Violation.at(
							ViolationType.HARDCODED_SECRET,
							assignment,
							currentFunctionName(),
							"Possible hardcoded secret assigned to '" + assignment.getTarget() + "'",
							"Load the value from the environment or a secret store"));
				}
			}
			return super.visitAssignment(assignment);
		}
	}
}
