package org.metricshub.ethica;

import static org.junit.Assert.*;
import static org.metricshub.ethica.EthicaTestSupport.parse;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.ethica.analysis.AnalysisReport;
import org.metricshub.ethica.analysis.PolicyChecker;
import org.metricshub.ethica.analysis.Violation;
import org.metricshub.ethica.analysis.ViolationType;
import org.metricshub.ethica.util.VerifierSettings;

public class PolicyCheckerTest {

	private static final PolicyChecker CHECKER = new PolicyChecker();

	private static AnalysisReport check(String... lines) {
		return CHECKER.analyze(parse(lines), new VerifierSettings());
	}

	private static List<String> describeAllBut(AnalysisReport report, ViolationType excluded) {
		List<String> descriptions = new ArrayList<>();
		for (Violation violation : report.getViolations()) {
			if (violation.getType() != excluded) {
				descriptions.add(violation.toString());
			}
		}
		return descriptions;
	}

	@Test
	public void testMissingConsentAnnotation() {
		AnalysisReport unannotated = check(
				"api_key = 'abc123'",
				"function share_position(user_id):",
				"    return collect_location(user_id)");
		assertFalse(unannotated.isPassed());
		List<Violation> missing = unannotated.getViolations(ViolationType.MISSING_ANNOTATION);
		assertEquals(1, missing.size());
		Violation violation = missing.get(0);
		assertEquals("share_position", violation.getFunctionName());
		assertTrue(violation.getMessage(), violation.getMessage().contains("collect_location"));
		assertTrue(violation.getMessage(), violation.getMessage().contains("@requires_user_consent"));
		assertEquals("Add @requires_user_consent above 'function share_position'", violation.getSuggestion());
		assertEquals(3, violation.getLine());

		AnalysisReport annotated = check(
				"api_key = 'abc123'",
				"@requires_user_consent",
				"function share_position(user_id):",
				"    return collect_location(user_id)");
		assertTrue(annotated.getViolations(ViolationType.MISSING_ANNOTATION).isEmpty());
		assertEquals(
				"Only the missing annotation goes away",
				describeAllBut(unannotated, ViolationType.MISSING_ANNOTATION),
				describeAllBut(annotated, ViolationType.MISSING_ANNOTATION));
		assertEquals(1, annotated.getViolations(ViolationType.HARDCODED_SECRET).size());
	}

	@Test
	public void testAnnotatedProgramPasses() {
		AnalysisReport report = check(
				"@requires_user_consent",
				"function share_position(user_id):",
				"    return collect_location(user_id)",
				"@requires_data_protection",
				"function save_login(user_id, secret_value):",
				"    store_password(user_id, secret_value)");
		assertTrue(report.getViolations().toString(), report.isPassed());
	}

	@Test
	public void testSensitiveFunctionName() {
		AnalysisReport report = check("function collect_location():", "    return 1");
		List<Violation> missing = report.getViolations(ViolationType.MISSING_ANNOTATION);
		assertEquals(1, missing.size());
		assertTrue(missing.get(0).getMessage().startsWith("Function 'collect_location' handles location data"));
	}

	@Test
	public void testWrongAnnotation() {
		AnalysisReport report = check(
				"@requires_user_consent",
				"function save_login(user_id, secret_value):",
				"    store_password(user_id, secret_value)");
		List<Violation> missing = report.getViolations(ViolationType.MISSING_ANNOTATION);
		assertEquals(1, missing.size());
		assertTrue(missing.get(0).getMessage().contains("@requires_data_protection"));
	}

	@Test
	public void testTopLevelSensitiveCall() {
		AnalysisReport report = check("record_audio()");
		List<Violation> missing = report.getViolations(ViolationType.MISSING_ANNOTATION);
		assertEquals(1, missing.size());
		assertNull(missing.get(0).getFunctionName());
		assertTrue(missing.get(0).getSuggestion().startsWith("Move the call into a function annotated with @requires_user_consent"));
	}

	@Test
	public void testPatternModes() {
		assertEquals(
				"prefix",
				1,
				check("function locate():", "    get_location_precise()").getViolations(ViolationType.MISSING_ANNOTATION).size());
		assertEquals(
				"substring",
				1,
				check("function unlock():", "    read_fingerprint_data()").getViolations(ViolationType.MISSING_ANNOTATION).size());
		assertEquals(
				"member call",
				1,
				check("function film(device):", "    device.record_video()").getViolations(ViolationType.MISSING_ANNOTATION).size());
		assertTrue("case sensitive", check("function locate():", "    Collect_Location()").isPassed());
		assertTrue("not sensitive", check("function locate():", "    compute_route()").isPassed());
	}

	@Test
	public void testDisallowedOperations() {
		AnalysisReport report = check(
				"@requires_user_consent",
				"function run_facial_recognition(photo):",
				"    return deepfake_video(photo)");
		List<Violation> disallowed = report.getViolations(ViolationType.DISALLOWED_OPERATION);
		assertEquals(2, disallowed.size());
		assertTrue(disallowed.get(0).getMessage().contains("run_facial_recognition"));
		assertTrue(disallowed.get(1).getMessage().contains("deepfake_video"));
		assertFalse(report.isPassed());

		assertFalse("top level", check("fake_urgency()").isPassed());
	}

	@Test
	public void testHardcodedSecrets() {
		AnalysisReport report = check(
				"password = 'hunter2'",
				"key = 'abc'",
				"db_secret_value = \"s3cr3t\"",
				"token = ''",
				"user_token = 'abc'",
				"PASSWORD = 'upper'",
				"password = read_password()",
				"count = 'password'");
		List<Violation> secrets = report.getViolations(ViolationType.HARDCODED_SECRET);
		assertEquals(3, secrets.size());
		assertEquals(1, secrets.get(0).getLine());
		assertEquals(2, secrets.get(1).getLine());
		assertEquals(3, secrets.get(2).getLine());
		assertEquals("Possible hardcoded secret assigned to 'password'", secrets.get(0).getMessage());
	}

	@Test
	public void testSensitiveVariableRequiresDataProtection() {
		AnalysisReport unprotected = check(
				"function remember(user_id):",
				"    stored_password = hash_value(user_id)",
				"    return stored_password");
		List<Violation> missing = unprotected.getViolations(ViolationType.MISSING_ANNOTATION);
		assertEquals(1, missing.size());
		assertEquals("remember", missing.get(0).getFunctionName());
		assertEquals(2, missing.get(0).getLine());
		assertEquals(
				"Function 'remember' stores sensitive data (password) in 'stored_password' without @requires_data_protection",
				missing.get(0).getMessage());
		assertEquals("Add @requires_data_protection above 'function remember'", missing.get(0).getSuggestion());

		AnalysisReport annotated = check(
				"@requires_data_protection",
				"function remember(user_id):",
				"    stored_password = hash_value(user_id)",
				"    return stored_password");
		assertTrue(annotated.getViolations().toString(), annotated.isPassed());

		assertEquals(
				"consent does not protect data",
				1,
				check("@requires_user_consent", "function bill(order):", "    credit_card = order.card")
						.getViolations(ViolationType.MISSING_ANNOTATION)
						.size());
		assertTrue("case sensitive", check("function remember(user_id):", "    Stored_Password = user_id").isPassed());
		assertTrue("top level", check("user_ssn = lookup(1)").isPassed());
	}

	@Test
	public void testRuleLookup() {
		assertEquals("location data", PolicyChecker.requiredAnnotations("collect_location").get(PolicyChecker.REQUIRES_USER_CONSENT));
		assertTrue(PolicyChecker.requiredAnnotations("store_payment").containsKey(PolicyChecker.REQUIRES_DATA_PROTECTION));
		assertTrue(PolicyChecker.requiredAnnotations("print").isEmpty());
		assertTrue(PolicyChecker.isSecretName("api_key"));
		assertTrue(PolicyChecker.isSecretName("token"));
		assertFalse(PolicyChecker.isSecretName("tokens"));
		assertEquals("ssn", PolicyChecker.sensitiveDataFragment("user_ssn"));
		assertEquals("secret_key", PolicyChecker.sensitiveDataFragment("aws_secret_key"));
		assertNull(PolicyChecker.sensitiveDataFragment("count"));
	}
}
