package org.metricshub.ethica.frontend;

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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts the text of an Ethica program into a list of {@link Token}s.
 * <p>
 * Blocks are delimited by indentation, so the lexer keeps a stack of the
 * indentation widths that are currently open. At the start of each logical
 * line the width of the leading whitespace is compared with the top of that
 * stack, which produces {@link TokenType#INDENT} and {@link TokenType#DEDENT}
 * tokens. Blank lines and comment-only lines are ignored, and so are line
 * breaks inside an open bracket.
 * <p>
 * One instance handles exactly one source text. {@link #tokenize()} may be
 * called again, in which case the text is scanned again from the start.
 */
public class Lexer {

	/** Width of a tab character when measuring indentation. */
	public static final int TAB_WIDTH = 4;

	private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

	static {
		KEYWORDS.put("function", TokenType.KW_FUNCTION);
		KEYWORDS.put("return", TokenType.KW_RETURN);
		KEYWORDS.put("if", TokenType.KW_IF);
		KEYWORDS.put("else", TokenType.KW_ELSE);
		KEYWORDS.put("while", TokenType.KW_WHILE);
		KEYWORDS.put("for", TokenType.KW_FOR);
		KEYWORDS.put("in", TokenType.KW_IN);
		KEYWORDS.put("and", TokenType.AND);
		KEYWORDS.put("or", TokenType.OR);
		KEYWORDS.put("not", TokenType.NOT);
		KEYWORDS.put("true", TokenType.TRUE);
		KEYWORDS.put("false", TokenType.FALSE);
		KEYWORDS.put("none", TokenType.NONE);
	}

	private final String source;
	private final String sourceDescription;

	private int pos;
	private int line;
	private int column;
	private int c;
	private int bracketDepth;
	private boolean atLineStart;
	private final Deque<Integer> indentStack = new ArrayDeque<>();
	private final StringBuilder text = new StringBuilder();
	private List<Token> tokens;

	/**
	 * Creates a lexer for an anonymous source text.
	 *
	 * @param source the program text
	 */
	public Lexer(String source) {
		this(source, "<source>");
	}

	/**
	 * Creates a lexer.
	 *
	 * @param source the program text
	 * @param sourceDescription name of the source, used in error messages
	 */
	public Lexer(String source, String sourceDescription) {
		if (source == null) {
			throw new IllegalArgumentException("source must not be null");
		}
		this.source = source;
		this.sourceDescription = sourceDescription;
	}

	/**
	 * Scans the whole source text.
	 *
	 * @return the tokens, always terminated by {@link TokenType#EOF}
	 * @throws LexerException upon the first malformed character sequence
	 */
	public List<Token> tokenize() {
		pos = 0;
		line = 1;
		column = 1;
		c = source.isEmpty() ? -1 : source.charAt(0);
		bracketDepth = 0;
		atLineStart = true;
		indentStack.clear();
		indentStack.push(0);
		tokens = new ArrayList<>();

		while (c >= 0) {
			if (atLineStart && bracketDepth == 0) {
				lineStart();
			} else {
				lexer();
			}
		}

		// close the blocks that are still open
		while (indentStack.peek() > 0) {
			indentStack.pop();
			addToken(TokenType.DEDENT, "", null, line, column);
		}
		addToken(TokenType.EOF, "", null, line, column);
		return Collections.unmodifiableList(tokens);
	}

	private void read() {
		if (c < 0) {
			return;
		}
		text.append((char) c);
		pos++;
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		c = pos < source.length() ? source.charAt(pos) : -1;
	}

	private int peek() {
		return pos + 1 < source.length() ? source.charAt(pos + 1) : -1;
	}

	private LexerException lexerException(String msg, int errorLine, int errorColumn) {
		return new LexerException(msg, sourceDescription, errorLine, errorColumn);
	}

	private void addToken(TokenType type, String lexeme, Object literal, int tokenLine, int tokenColumn) {
		tokens.add(new Token(type, lexeme, literal, tokenLine, tokenColumn));
	}

	/**
	 * Measures the indentation of a new line and emits the INDENT/DEDENT
	 * tokens it implies. Blank and comment-only lines are consumed entirely.
	 */
	private void lineStart() {
		int width = 0;
		while (c == ' ' || c == '\t') {
			width += c == '\t' ? TAB_WIDTH : 1;
			read();
		}
		if (c == '#') {
			skipComment();
		}
		if (c < 0) {
			return;
		}
		if (c == '\n' || c == '\r') {
			readLineBreak();
			return;
		}
		handleIndentation(width);
		atLineStart = false;
	}

	private void handleIndentation(int width) {
		int current = indentStack.peek();
		if (width > current) {
			indentStack.push(width);
			addToken(TokenType.INDENT, "", null, line, 1);
		} else if (width < current) {
			while (indentStack.peek() > width) {
				indentStack.pop();
				addToken(TokenType.DEDENT, "", null, line, 1);
			}
			if (indentStack.peek() != width) {
				throw lexerException("inconsistent indentation", line, width + 1);
			}
		}
	}

	private void skipComment() {
		while (c >= 0 && c != '\n' && c != '\r') {
			read();
		}
	}

	private void readLineBreak() {
		if (c == '\r') {
			read();
			if (c == '\n') {
				read();
			}
		} else {
			read();
		}
	}

	/**
	 * Reads the next token of a line whose indentation has been handled.
	 */
	private void lexer() {
		// clear whitespace and comments
		if (c == ' ' || c == '\t' || c == '\f') {
			read();
			return;
		}
		if (c == '#') {
			skipComment();
			return;
		}

		int startLine = line;
		int startColumn = column;
		text.setLength(0);

		if (c == '\n' || c == '\r') {
			readLineBreak();
			if (bracketDepth == 0) {
				addToken(TokenType.NEWLINE, "", null, startLine, startColumn);
				atLineStart = true;
			}
			return;
		}
		if (c == '"' || c == '\'') {
			String value = readString(startLine, startColumn);
			addToken(TokenType.STRING, text.toString(), value, startLine, startColumn);
			return;
		}
		if (Character.isDigit(c)) {
			readNumber(startLine, startColumn);
			return;
		}
		if (Character.isLetter(c) || c == '_') {
			read();
			while (c >= 0 && (Character.isLetterOrDigit(c) || c == '_')) {
				read();
			}
			String word = text.toString();
			TokenType kwToken = KEYWORDS.get(word);
			if (kwToken == null) {
				addToken(TokenType.IDENTIFIER, word, null, startLine, startColumn);
			} else if (kwToken == TokenType.TRUE || kwToken == TokenType.FALSE) {
				addToken(kwToken, word, Boolean.valueOf(kwToken == TokenType.TRUE), startLine, startColumn);
			} else {
				addToken(kwToken, word, null, startLine, startColumn);
			}
			return;
		}

		TokenType type = operator();
		if (type == null) {
			throw lexerException("unexpected character '" + (char) c + "'", startLine, startColumn);
		}
		addToken(type, text.toString(), null, startLine, startColumn);
	}

	/**
	 * Reads an operator or a delimiter.
	 *
	 * @return the token kind, or {@code null} if the current character does
	 *         not start one (nothing is consumed in that case)
	 */
	private TokenType operator() {
		if (c == '(' || c == '[' || c == '{') {
			bracketDepth++;
			TokenType type = c == '(' ? TokenType.OPEN_PAREN : c == '[' ? TokenType.OPEN_BRACKET : TokenType.OPEN_BRACE;
			read();
			return type;
		}
		if (c == ')' || c == ']' || c == '}') {
			if (bracketDepth > 0) {
				bracketDepth--;
			}
			TokenType type = c == ')' ? TokenType.CLOSE_PAREN : c == ']' ? TokenType.CLOSE_BRACKET : TokenType.CLOSE_BRACE;
			read();
			return type;
		}
		if (c == ',') {
			read();
			return TokenType.COMMA;
		}
		if (c == ':') {
			read();
			return TokenType.COLON;
		}
		if (c == '@') {
			read();
			return TokenType.AT;
		}
		if (c == '.') {
			if (Character.isDigit(peek())) {
				throw lexerException("numbers must start with a digit", line, column);
			}
			read();
			return TokenType.DOT;
		}
		if (c == '+') {
			read();
			return TokenType.PLUS;
		}
		if (c == '-') {
			read();
			if (c == '>') {
				read();
				return TokenType.ARROW;
			}
			return TokenType.MINUS;
		}
		if (c == '*') {
			read();
			if (c == '*') {
				read();
				return TokenType.POW;
			}
			return TokenType.MULT;
		}
		if (c == '/') {
			read();
			return TokenType.DIVIDE;
		}
		if (c == '%') {
			read();
			return TokenType.MOD;
		}
		if (c == '=') {
			read();
			if (c == '=') {
				read();
				return TokenType.EQ;
			}
			return TokenType.EQUALS;
		}
		if (c == '!' && peek() == '=') {
			read();
			read();
			return TokenType.NE;
		}
		if (c == '<') {
			read();
			if (c == '=') {
				read();
				return TokenType.LE;
			}
			return TokenType.LT;
		}
		if (c == '>') {
			read();
			if (c == '=') {
				read();
				return TokenType.GE;
			}
			return TokenType.GT;
		}
		return null;
	}

	/**
	 * Reads a string literal and handles its escape codes. The raw text,
	 * quotes included, is left in {@link #text}.
	 *
	 * @return the decoded value of the literal
	 */
	private String readString(int startLine, int startColumn) {
		int quote = c;
		StringBuilder string = new StringBuilder();
		read();
		while (c >= 0 && c != quote && c != '\n' && c != '\r') {
			if (c == '\\') {
				read();
				switch (c) {
				case 'n':
					string.append('\n');
					break;
				case 't':
					string.append('\t');
					break;
				case -1:
				case '\n':
				case '\r':
					throw lexerException("unterminated string literal", startLine, startColumn);
				default:
					// \\, \" and \' as well as any other escaped character stand for themselves
					string.append((char) c);
					break;
				}
			} else {
				string.append((char) c);
			}
			read();
		}
		if (c != quote) {
			throw lexerException("unterminated string literal", startLine, startColumn);
		}
		read();
		return string.toString();
	}

	private void readNumber(int startLine, int startColumn) {
		while (c >= 0 && Character.isDigit(c)) {
			read();
		}
		if (c == '.' && Character.isDigit(peek())) {
			read();
			while (c >= 0 && Character.isDigit(c)) {
				read();
			}
			String lexeme = text.toString();
			addToken(TokenType.FLOAT, lexeme, Double.valueOf(lexeme), startLine, startColumn);
			return;
		}
		String lexeme = text.toString();
		Long value;
		try {
			value = Long.valueOf(lexeme);
		} catch (NumberFormatException e) {
			throw lexerException("integer literal out of range: " + lexeme, startLine, startColumn);
		}
		addToken(TokenType.INTEGER, lexeme, value, startLine, startColumn);
	}

	/**
	 * Convenience method tokenizing a source text in one call.
	 *
	 * @param source the program text
	 * @return the tokens
	 */
	public static List<Token> tokenize(String source) {
		return new Lexer(source).tokenize();
	}
}
