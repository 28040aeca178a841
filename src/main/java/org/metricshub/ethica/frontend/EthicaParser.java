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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.ethica.frontend.ast.AnnotationAst;
import org.metricshub.ethica.frontend.ast.AssignmentAst;
import org.metricshub.ethica.frontend.ast.BinaryExpressionAst;
import org.metricshub.ethica.frontend.ast.BinaryOperator;
import org.metricshub.ethica.frontend.ast.DictLiteralAst;
import org.metricshub.ethica.frontend.ast.ExpressionAst;
import org.metricshub.ethica.frontend.ast.ExpressionStatementAst;
import org.metricshub.ethica.frontend.ast.ForInStatementAst;
import org.metricshub.ethica.frontend.ast.FunctionCallAst;
import org.metricshub.ethica.frontend.ast.FunctionDefAst;
import org.metricshub.ethica.frontend.ast.IdentifierAst;
import org.metricshub.ethica.frontend.ast.IfStatementAst;
import org.metricshub.ethica.frontend.ast.IndexAst;
import org.metricshub.ethica.frontend.ast.ListLiteralAst;
import org.metricshub.ethica.frontend.ast.LiteralAst;
import org.metricshub.ethica.frontend.ast.MemberAst;
import org.metricshub.ethica.frontend.ast.ProgramAst;
import org.metricshub.ethica.frontend.ast.ReturnStatementAst;
import org.metricshub.ethica.frontend.ast.StatementAst;
import org.metricshub.ethica.frontend.ast.UnaryExpressionAst;
import org.metricshub.ethica.frontend.ast.UnaryOperator;
import org.metricshub.ethica.frontend.ast.WhileStatementAst;

/**
 * Converts the tokens of an Ethica program into a syntax tree.
 * <p>
 * Statements are parsed by recursive descent, dispatching on their first
 * token. Expressions are parsed by precedence climbing over
 * {@link BinaryOperator#getPrecedence()}. The parser stops at the first token
 * that does not fit the grammar and throws a {@link ParserException}; there
 * is no error recovery.
 * <p>
 * The grammar, in production-rule form:
 *
 * <pre>
 * PROGRAM        : STATEMENT* EOF
 * STATEMENT      : ANNOTATION* FUNCTION_DEF | IF | WHILE | FOR | RETURN | ASSIGNMENT | EXPRESSION
 * ANNOTATION     : '@' ID ( '(' [ LITERAL (',' LITERAL)* ] ')' )? NEWLINE
 * FUNCTION_DEF   : 'function' ID '(' [ ID (',' ID)* ] ')' BLOCK
 * IF             : 'if' EXPRESSION BLOCK ( 'else' BLOCK )?
 * WHILE          : 'while' EXPRESSION BLOCK
 * FOR            : 'for' ID 'in' EXPRESSION BLOCK
 * RETURN         : 'return' EXPRESSION?
 * ASSIGNMENT     : ID '=' EXPRESSION
 * BLOCK          : ':' NEWLINE INDENT STATEMENT+ DEDENT
 * EXPRESSION     : UNARY ( BINARY_OP EXPRESSION )*       (precedence climbing)
 * UNARY          : ( 'not' | '-' ) UNARY_OPERAND | POSTFIX
 * POSTFIX        : PRIMARY ( '(' ARGS ')' | '[' EXPRESSION ']' | '.' ID )*
 * PRIMARY        : LITERAL | ID | '(' EXPRESSION ')' | LIST | DICT
 * </pre>
 */
public class EthicaParser {

	private final List<Token> tokens;
	private final String sourceDescription;
	private int index;
	private Token token;

	/**
	 * @param tokens tokens produced by {@link Lexer#tokenize()}, terminated by
	 *        {@link TokenType#EOF}
	 * @param sourceDescription name of the source, used in error messages
	 */
	public EthicaParser(List<Token> tokens, String sourceDescription) {
		if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != TokenType.EOF) {
			throw new IllegalArgumentException("token list must end with EOF");
		}
		this.tokens = tokens;
		this.sourceDescription = sourceDescription;
	}

	/**
	 * Parses the whole token list.
	 *
	 * @return the root of the tree
	 * @throws ParserException at the first token that does not fit the grammar
	 */
	public ProgramAst parse() {
		index = 0;
		token = tokens.get(0);
		List<StatementAst> statements = new ArrayList<>();
		while (token.getType() != TokenType.EOF) {
			statements.add(STATEMENT());
		}
		return new ProgramAst(statements);
	}

	/**
	 * Tokenizes and parses a source text.
	 *
	 * @param source the program text
	 * @param sourceDescription name of the source, used in error messages
	 * @return the root of the tree
	 */
	public static ProgramAst parse(String source, String sourceDescription) {
		List<Token> tokens = new Lexer(source, sourceDescription).tokenize();
		return new EthicaParser(tokens, sourceDescription).parse();
	}

	// token handling

	private void lexer() {
		if (token.getType() != TokenType.EOF) {
			token = tokens.get(++index);
		}
	}

	private Token lexer(TokenType expected, String what) {
		if (token.getType() != expected) {
			throw parserException("expected " + what);
		}
		Token consumed = token;
		lexer();
		return consumed;
	}

	private boolean opt(TokenType type) {
		if (token.getType() == type) {
			lexer();
			return true;
		}
		return false;
	}

	private TokenType peek() {
		return index + 1 < tokens.size() ? tokens.get(index + 1).getType() : TokenType.EOF;
	}

	private ParserException parserException(String msg) {
		return new ParserException(
				msg + " at " + token.getLine() + ":" + token.getColumn(),
				sourceDescription,
				token.getLine(),
				token.getColumn());
	}

	private ParserException unexpectedToken() {
		return parserException("unexpected token '" + token.describe() + "'");
	}

	// statements

	private StatementAst STATEMENT() {
		switch (token.getType()) {
		case AT:
			return FUNCTION_DEF(ANNOTATIONS());
		case KW_FUNCTION:
			return FUNCTION_DEF(new ArrayList<AnnotationAst>());
		case KW_IF:
			return IF_STATEMENT();
		case KW_WHILE:
			return WHILE_STATEMENT();
		case KW_FOR:
			return FOR_IN_STATEMENT();
		case KW_RETURN:
			return endOfStatement(RETURN_STATEMENT());
		case IDENTIFIER:
			if (peek() == TokenType.EQUALS) {
				return endOfStatement(ASSIGNMENT());
			}
			return endOfStatement(new ExpressionStatementAst(EXPRESSION()));
		default:
			return endOfStatement(new ExpressionStatementAst(EXPRESSION()));
		}
	}

	private StatementAst endOfStatement(StatementAst statement) {
		if (token.getType() == TokenType.NEWLINE) {
			lexer();
		} else if (token.getType() != TokenType.DEDENT && token.getType() != TokenType.EOF) {
			throw unexpectedToken();
		}
		return statement;
	}

	private List<AnnotationAst> ANNOTATIONS() {
		List<AnnotationAst> annotations = new ArrayList<>();
		while (token.getType() == TokenType.AT) {
			Token at = token;
			lexer();
			String name = lexer(TokenType.IDENTIFIER, "annotation name").getLexeme();
			List<LiteralAst> arguments = new ArrayList<>();
			if (opt(TokenType.OPEN_PAREN)) {
				if (token.getType() != TokenType.CLOSE_PAREN) {
					arguments.add(LITERAL());
					while (opt(TokenType.COMMA)) {
						arguments.add(LITERAL());
					}
				}
				lexer(TokenType.CLOSE_PAREN, "')'");
			}
			lexer(TokenType.NEWLINE, "end of line after annotation");
			annotations.add(new AnnotationAst(name, arguments, at.getLine(), at.getColumn()));
		}
		if (token.getType() != TokenType.KW_FUNCTION) {
			throw parserException("annotations must be followed by a function definition");
		}
		return annotations;
	}

	private LiteralAst LITERAL() {
		if (!token.getType().isLiteral()) {
			throw unexpectedToken();
		}
		LiteralAst literal = new LiteralAst(token.getLiteral(), token.getLine(), token.getColumn());
		lexer();
		return literal;
	}

	private FunctionDefAst FUNCTION_DEF(List<AnnotationAst> annotations) {
		Token function = lexer(TokenType.KW_FUNCTION, "'function'");
		String name = lexer(TokenType.IDENTIFIER, "function name").getLexeme();
		lexer(TokenType.OPEN_PAREN, "'('");
		List<String> parameters = new ArrayList<>();
		if (token.getType() != TokenType.CLOSE_PAREN) {
			parameters.add(lexer(TokenType.IDENTIFIER, "parameter name").getLexeme());
			while (opt(TokenType.COMMA)) {
				parameters.add(lexer(TokenType.IDENTIFIER, "parameter name").getLexeme());
			}
		}
		lexer(TokenType.CLOSE_PAREN, "')'");
		List<StatementAst> body = BLOCK();
		// annotations come first in the source, but the function is the node
		int line = annotations.isEmpty() ? function.getLine() : annotations.get(0).getLine();
		int column = annotations.isEmpty() ? function.getColumn() : annotations.get(0).getColumn();
		return new FunctionDefAst(name, parameters, annotations, body, line, column);
	}

	private List<StatementAst> BLOCK() {
		lexer(TokenType.COLON, "':'");
		if (token.getType() != TokenType.NEWLINE || peek() != TokenType.INDENT) {
			throw parserException("expected indented block");
		}
		lexer();
		lexer();
		List<StatementAst> statements = new ArrayList<>();
		while (token.getType() != TokenType.DEDENT && token.getType() != TokenType.EOF) {
			statements.add(STATEMENT());
		}
		lexer(TokenType.DEDENT, "end of block");
		return statements;
	}

	private IfStatementAst IF_STATEMENT() {
		Token keyword = token;
		lexer();
		ExpressionAst condition = EXPRESSION();
		List<StatementAst> thenBlock = BLOCK();
		List<StatementAst> elseBlock = null;
		if (opt(TokenType.KW_ELSE)) {
			elseBlock = BLOCK();
		}
		return new IfStatementAst(condition, thenBlock, elseBlock, keyword.getLine(), keyword.getColumn());
	}

	private WhileStatementAst WHILE_STATEMENT() {
		Token keyword = token;
		lexer();
		ExpressionAst condition = EXPRESSION();
		List<StatementAst> body = BLOCK();
		return new WhileStatementAst(condition, body, keyword.getLine(), keyword.getColumn());
	}

	private ForInStatementAst FOR_IN_STATEMENT() {
		Token keyword = token;
		lexer();
		String variable = lexer(TokenType.IDENTIFIER, "loop variable").getLexeme();
		lexer(TokenType.KW_IN, "'in'");
		ExpressionAst iterable = EXPRESSION();
		List<StatementAst> body = BLOCK();
		return new ForInStatementAst(variable, iterable, body, keyword.getLine(), keyword.getColumn());
	}

	private ReturnStatementAst RETURN_STATEMENT() {
		Token keyword = token;
		lexer();
		ExpressionAst value = null;
		TokenType type = token.getType();
		if (type != TokenType.NEWLINE && type != TokenType.DEDENT && type != TokenType.EOF) {
			value = EXPRESSION();
		}
		return new ReturnStatementAst(value, keyword.getLine(), keyword.getColumn());
	}

	private AssignmentAst ASSIGNMENT() {
		Token target = token;
		lexer();
		lexer(TokenType.EQUALS, "'='");
		return new AssignmentAst(target.getLexeme(), EXPRESSION(), target.getLine(), target.getColumn());
	}

	// expressions

	private ExpressionAst EXPRESSION() {
		return climb(1);
	}

	/**
	 * Parses a chain of binary operations whose operators all have at least
	 * the given precedence.
	 */
	private ExpressionAst climb(int minPrecedence) {
		ExpressionAst left = UNARY();
		while (true) {
			BinaryOperator operator = binaryOperator(token.getType());
			if (operator == null || operator.getPrecedence() < minPrecedence) {
				return left;
			}
			lexer();
			int next = operator.isRightAssociative() ? operator.getPrecedence() : operator.getPrecedence() + 1;
			ExpressionAst right = climb(next);
			left = new BinaryExpressionAst(operator, left, right, left.getLine(), left.getColumn());
		}
	}

	private ExpressionAst UNARY() {
		UnaryOperator operator;
		if (token.getType() == TokenType.NOT) {
			operator = UnaryOperator.NOT;
		} else if (token.getType() == TokenType.MINUS) {
			operator = UnaryOperator.NEGATE;
		} else {
			return POSTFIX();
		}
		Token prefix = token;
		lexer();
		// the operand extends over any power operation: -2 ** 2 is -(2 ** 2)
		ExpressionAst operand = climb(BinaryOperator.POWER.getPrecedence());
		return new UnaryExpressionAst(operator, operand, prefix.getLine(), prefix.getColumn());
	}

	private ExpressionAst POSTFIX() {
		ExpressionAst expression = PRIMARY();
		while (true) {
			Token postfix = token;
			if (opt(TokenType.OPEN_PAREN)) {
				List<ExpressionAst> arguments = new ArrayList<>();
				if (token.getType() != TokenType.CLOSE_PAREN) {
					arguments.add(EXPRESSION());
					while (opt(TokenType.COMMA)) {
						arguments.add(EXPRESSION());
					}
				}
				lexer(TokenType.CLOSE_PAREN, "')'");
				expression = new FunctionCallAst(expression, arguments, expression.getLine(), expression.getColumn());
			} else if (opt(TokenType.OPEN_BRACKET)) {
				ExpressionAst indexExpression = EXPRESSION();
				lexer(TokenType.CLOSE_BRACKET, "']'");
				expression = new IndexAst(expression, indexExpression, postfix.getLine(), postfix.getColumn());
			} else if (opt(TokenType.DOT)) {
				String name = lexer(TokenType.IDENTIFIER, "member name").getLexeme();
				expression = new MemberAst(expression, name, postfix.getLine(), postfix.getColumn());
			} else {
				return expression;
			}
		}
	}

	private ExpressionAst PRIMARY() {
		Token start = token;
		if (token.getType().isLiteral()) {
			return LITERAL();
		}
		switch (token.getType()) {
		case IDENTIFIER:
			lexer();
			return new IdentifierAst(start.getLexeme(), start.getLine(), start.getColumn());
		case OPEN_PAREN:
			lexer();
			ExpressionAst expression = EXPRESSION();
			lexer(TokenType.CLOSE_PAREN, "')'");
			return expression;
		case OPEN_BRACKET:
			return LIST_LITERAL();
		case OPEN_BRACE:
			return DICT_LITERAL();
		default:
			throw unexpectedToken();
		}
	}

	private ListLiteralAst LIST_LITERAL() {
		Token open = token;
		lexer();
		List<ExpressionAst> elements = new ArrayList<>();
		while (token.getType() != TokenType.CLOSE_BRACKET) {
			elements.add(EXPRESSION());
			if (!opt(TokenType.COMMA)) {
				break;
			}
		}
		lexer(TokenType.CLOSE_BRACKET, "']'");
		return new ListLiteralAst(elements, open.getLine(), open.getColumn());
	}

	private DictLiteralAst DICT_LITERAL() {
		Token open = token;
		lexer();
		List<ExpressionAst> keys = new ArrayList<>();
		List<ExpressionAst> values = new ArrayList<>();
		while (token.getType() != TokenType.CLOSE_BRACE) {
			keys.add(EXPRESSION());
			lexer(TokenType.COLON, "':'");
			values.add(EXPRESSION());
			if (!opt(TokenType.COMMA)) {
				break;
			}
		}
		lexer(TokenType.CLOSE_BRACE, "'}'");
		return new DictLiteralAst(keys, values, open.getLine(), open.getColumn());
	}

	private static BinaryOperator binaryOperator(TokenType type) {
		switch (type) {
		case OR:
			return BinaryOperator.OR;
		case AND:
			return BinaryOperator.AND;
		case EQ:
			return BinaryOperator.EQ;
		case NE:
			return BinaryOperator.NE;
		case LT:
			return BinaryOperator.LT;
		case LE:
			return BinaryOperator.LE;
		case GT:
			return BinaryOperator.GT;
		case GE:
			return BinaryOperator.GE;
		case PLUS:
			return BinaryOperator.ADD;
		case MINUS:
			return BinaryOperator.SUBTRACT;
		case MULT:
			return BinaryOperator.MULTIPLY;
		case DIVIDE:
			return BinaryOperator.DIVIDE;
		case MOD:
			return BinaryOperator.MODULO;
		case POW:
			return BinaryOperator.POWER;
		default:
			return null;
		}
	}
}
