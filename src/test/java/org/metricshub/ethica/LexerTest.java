package org.metricshub.ethica;

import static org.junit.Assert.*;
import static org.metricshub.ethica.EthicaTestSupport.lines;
import static org.metricshub.ethica.frontend.TokenType.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.ethica.frontend.Lexer;
import org.metricshub.ethica.frontend.LexerException;
import org.metricshub.ethica.frontend.Token;
import org.metricshub.ethica.frontend.TokenType;

public class LexerTest {

	private static List<TokenType> types(String source) {
		List<TokenType> types = new ArrayList<>();
		for (Token token : Lexer.tokenize(source)) {
			types.add(token.getType());
		}
		return types;
	}

	@Test
	public void testSimpleStatement() {
		assertEquals(Arrays.asList(IDENTIFIER, EQUALS, INTEGER, NEWLINE, EOF), types("count = 1\n"));
		assertEquals("No NEWLINE without a line break", Arrays.asList(IDENTIFIER, EOF), types("count"));
		assertEquals(Arrays.asList(EOF), types(""));
	}

	@Test
	public void testLiterals() {
		List<Token> tokens = Lexer.tokenize("42 3.25 'single' \"double\" true false none\n");
		assertEquals(Long.valueOf(42), tokens.get(0).getLiteral());
		assertEquals(FLOAT, tokens.get(1).getType());
		assertEquals(Double.valueOf(3.25), tokens.get(1).getLiteral());
		assertEquals("single", tokens.get(2).getLiteral());
		assertEquals("'single'", tokens.get(2).getLexeme());
		assertEquals("double", tokens.get(3).getLiteral());
		assertEquals(Boolean.TRUE, tokens.get(4).getLiteral());
		assertEquals(Boolean.FALSE, tokens.get(5).getLiteral());
		assertEquals(NONE, tokens.get(6).getType());
		assertNull(tokens.get(6).getLiteral());
	}

	@Test
	public void testStringEscapes() {
		List<Token> tokens = Lexer.tokenize("\"a\\tb\\nc \\\" \\' \\\\ \\q\"");
		assertEquals("a\tb\nc \" ' \\ q", tokens.get(0).getLiteral());
	}

	@Test
	public void testOperators() {
		assertEquals(
				Arrays.asList(PLUS, MINUS, MULT, POW, DIVIDE, MOD, EQ, NE, LT, LE, GT, GE, EQUALS, ARROW, DOT, AT, COLON, COMMA, EOF),
				types("+ - * ** / % == != < <= > >= = -> . @ : ,"));
		assertEquals(Arrays.asList(KW_IF, NOT, IDENTIFIER, AND, IDENTIFIER, OR, IDENTIFIER, COLON, EOF), types("if not a and b or c:"));
	}

	@Test
	public void testIntegerFollowedByDot() {
		assertEquals(Arrays.asList(INTEGER, DOT, IDENTIFIER, EOF), types("1.real"));
	}

	@Test
	public void testIndentation() {
		String source = lines("if ready:", "    start()", "    if late:", "        hurry()", "done()");
		assertEquals(
				Arrays
						.asList(
								KW_IF,
								IDENTIFIER,
								COLON,
								NEWLINE,
								INDENT,
								IDENTIFIER,
								OPEN_PAREN,
								CLOSE_PAREN,
								NEWLINE,
								KW_IF,
								IDENTIFIER,
								COLON,
								NEWLINE,
								INDENT,
								IDENTIFIER,
								OPEN_PAREN,
								CLOSE_PAREN,
								NEWLINE,
								DEDENT,
								DEDENT,
								IDENTIFIER,
								OPEN_PAREN,
								CLOSE_PAREN,
								NEWLINE,
								EOF),
				types(source));
	}

	@Test
	public void testTabCountsAsFourSpaces() {
		String source = "if ready:\n\tstart()\n    stop()\n";
		List<TokenType> types = types(source);
		assertEquals(1, countOf(types, INDENT));
		assertEquals(1, countOf(types, DEDENT));
	}

	@Test
	public void testOpenBlocksAreClosedAtEndOfInput() {
		List<TokenType> types = types(lines("while running:", "    if ready:", "        go()"));
		int eof = types.size() - 1;
		assertEquals(EOF, types.get(eof));
		assertEquals(DEDENT, types.get(eof - 1));
		assertEquals(DEDENT, types.get(eof - 2));
	}

	@Test
	public void testBlankAndCommentLinesAreIgnored() {
		String source = lines("if ready:", "    start()", "", "# a comment at column 0", "        # an indented comment", "    stop()");
		List<TokenType> types = types(source);
		assertEquals(1, countOf(types, INDENT));
		assertEquals(1, countOf(types, DEDENT));
		assertEquals(3, countOf(types, NEWLINE));
	}

	@Test
	public void testLineBreaksInsideBrackets() {
		String source = lines("values = [", "    1,", "        2,", "]", "total = sum(values,", "  )");
		List<TokenType> types = types(source);
		assertEquals(0, countOf(types, INDENT));
		assertEquals(0, countOf(types, DEDENT));
		assertEquals(2, countOf(types, NEWLINE));
	}

	@Test
	public void testInconsistentIndentation() {
		LexerException e = assertThrows(
				LexerException.class,
				() -> Lexer.tokenize(lines("if ready:", "        start()", "    stop()")));
		assertTrue(e.getMessage(), e.getMessage().contains("inconsistent indentation"));
		assertEquals(3, e.getLineNumber());
		assertEquals(5, e.getColumnNumber());
	}

	@Test
	public void testInconsistentIndentationAfterSeveralLevels() {
		LexerException e = assertThrows(
				LexerException.class,
				() -> Lexer.tokenize(lines("if a1:", "  if b1:", "      c1()", "   d1()")));
		assertTrue(e.getMessage().contains("inconsistent indentation"));
		assertEquals(4, e.getLineNumber());
	}

	@Test
	public void testUnterminatedString() {
		LexerException e = assertThrows(LexerException.class, () -> Lexer.tokenize("name = \"unfinished"));
		assertTrue(e.getMessage().contains("unterminated string literal"));
		assertEquals(1, e.getLineNumber());
		assertEquals(8, e.getColumnNumber());
		assertThrows("End of line ends the string", LexerException.class, () -> Lexer.tokenize("name = 'a\nb'"));
		assertThrows("Escaped line break", LexerException.class, () -> Lexer.tokenize("name = 'a\\\nb'"));
	}

	@Test
	public void testUnexpectedCharacter() {
		LexerException e = assertThrows(LexerException.class, () -> Lexer.tokenize("total = 1\nflag = !ready"));
		assertTrue(e.getMessage().contains("unexpected character '!'"));
		assertEquals(2, e.getLineNumber());
		assertEquals(8, e.getColumnNumber());
		assertThrows(LexerException.class, () -> Lexer.tokenize("cost = 3 $ 4"));
	}

	@Test
	public void testNumberWithoutLeadingDigit() {
		assertThrows(LexerException.class, () -> Lexer.tokenize("ratio = .5"));
	}

	@Test
	public void testIntegerOutOfRange() {
		LexerException e = assertThrows(LexerException.class, () -> Lexer.tokenize("big = 99999999999999999999"));
		assertTrue(e.getMessage().contains("out of range"));
	}

	@Test
	public void testPositions() {
		List<Token> tokens = Lexer.tokenize(lines("first = 1", "  # comment", "second = first"));
		Token second = tokens.get(4);
		assertEquals("second", second.getLexeme());
		assertEquals(3, second.getLine());
		assertEquals(1, second.getColumn());
		Token reference = tokens.get(6);
		assertEquals("first", reference.getLexeme());
		assertEquals(10, reference.getColumn());
	}

	@Test
	public void testRestartable() {
		Lexer lexer = new Lexer(lines("if ready:", "    go()"));
		List<Token> first = lexer.tokenize();
		List<Token> second = lexer.tokenize();
		assertEquals(first.size(), second.size());
		assertEquals(first.toString(), second.toString());
	}

	private static int countOf(List<TokenType> types, TokenType type) {
		int count = 0;
		for (TokenType t : types) {
			if (t == type) {
				count++;
			}
		}
		return count;
	}
}
