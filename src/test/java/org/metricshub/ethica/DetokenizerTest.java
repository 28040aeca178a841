package org.metricshub.ethica;

import static org.junit.Assert.*;
import static org.metricshub.ethica.EthicaTestSupport.lines;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.ethica.frontend.Detokenizer;
import org.metricshub.ethica.frontend.Lexer;
import org.metricshub.ethica.frontend.Token;
import org.metricshub.ethica.frontend.TokenType;

public class DetokenizerTest {

	private static final String[] PROGRAMS = {
			lines("total = 0"),
			lines("if ready:", "    go()", "else:", "    wait()"),
			lines(
					"@requires_user_consent",
					"function locate(user_id):",
					"  for step in range(3):",
					"\tif step > 1:",
					"\t        return [step, {'id': user_id}]",
					"  return none",
					"print(locate(7))"),
			lines("while running:", "    while busy:", "        work()", "    rest()", "stop()"),
			lines("if ready:", "        go()", "", "# comment", "        again()"),
			"if ready:\n    go()" };

	private static List<TokenType> types(List<Token> tokens) {
		List<TokenType> types = new ArrayList<>();
		for (Token token : tokens) {
			types.add(token.getType());
		}
		return types;
	}

	@Test
	public void testRoundTripKeepsBlockStructure() {
		for (String program : PROGRAMS) {
			List<Token> tokens = Lexer.tokenize(program);
			String rendered = Detokenizer.detokenize(tokens);
			assertEquals(rendered, types(tokens), types(Lexer.tokenize(rendered)));
		}
	}

	@Test
	public void testRenderedLayout() {
		String rendered = Detokenizer.detokenize(Lexer.tokenize(lines("if ready:", "  go(1,2)", "done()")));
		assertEquals(lines("if ready :", "    go ( 1 , 2 )", "done ( )"), rendered);
	}

	@Test
	public void testRenderingIsStable() {
		for (String program : PROGRAMS) {
			String once = Detokenizer.detokenize(Lexer.tokenize(program));
			assertEquals(once, Detokenizer.detokenize(Lexer.tokenize(once)));
		}
	}

	@Test
	public void testUnbalancedDedent() {
		List<Token> tokens = new ArrayList<>();
		tokens.add(new Token(TokenType.DEDENT, "", null, 1, 1));
		tokens.add(new Token(TokenType.EOF, "", null, 1, 1));
		assertThrows(IllegalArgumentException.class, () -> Detokenizer.detokenize(tokens));
	}
}
