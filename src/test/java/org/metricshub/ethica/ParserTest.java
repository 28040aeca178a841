package org.metricshub.ethica;

import static org.junit.Assert.*;
import static org.metricshub.ethica.EthicaTestSupport.lines;
import static org.metricshub.ethica.EthicaTestSupport.parse;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.Test;
import org.metricshub.ethica.frontend.EthicaParser;
import org.metricshub.ethica.frontend.ParserException;
import org.metricshub.ethica.frontend.ast.AssignmentAst;
import org.metricshub.ethica.frontend.ast.BinaryExpressionAst;
import org.metricshub.ethica.frontend.ast.BinaryOperator;
import org.metricshub.ethica.frontend.ast.DictLiteralAst;
import org.metricshub.ethica.frontend.ast.ExpressionAst;
import org.metricshub.ethica.frontend.ast.ExpressionStatementAst;
import org.metricshub.ethica.frontend.ast.ForInStatementAst;
import org.metricshub.ethica.frontend.ast.FunctionCallAst;
import org.metricshub.ethica.frontend.ast.FunctionDefAst;
import org.metricshub.ethica.frontend.ast.IfStatementAst;
import org.metricshub.ethica.frontend.ast.ListLiteralAst;
import org.metricshub.ethica.frontend.ast.LiteralAst;
import org.metricshub.ethica.frontend.ast.ProgramAst;
import org.metricshub.ethica.frontend.ast.ReturnStatementAst;
import org.metricshub.ethica.frontend.ast.StatementAst;
import org.metricshub.ethica.frontend.ast.WhileStatementAst;

public class ParserTest {

	private static ExpressionAst expression(String source) {
		ProgramAst program = parse(source);
		assertEquals(1, program.getStatements().size());
		return ((ExpressionStatementAst) program.getStatements().get(0)).getExpression();
	}

	private static ParserException parseError(String... lines) {
		return assertThrows(ParserException.class, () -> EthicaParser.parse(lines(lines), "test.eth"));
	}

	@Test
	public void testPrecedence() {
		ExpressionAst sum = expression("2 + 3 * 4");
		assertTrue(sum instanceof BinaryExpressionAst);
		BinaryExpressionAst add = (BinaryExpressionAst) sum;
		assertEquals(BinaryOperator.ADD, add.getOperator());
		assertEquals(2L, ((LiteralAst) add.getLeft()).getValue());
		BinaryExpressionAst multiply = (BinaryExpressionAst) add.getRight();
		assertEquals(BinaryOperator.MULTIPLY, multiply.getOperator());
		assertEquals(3L, ((LiteralAst) multiply.getLeft()).getValue());
		assertEquals(4L, ((LiteralAst) multiply.getRight()).getValue());

		assertEquals("(a or (b and c))", expression("a or b and c").toString());
		assertEquals("((a < b) == (c < d))", expression("a < b == c < d").toString());
		assertEquals("((a + b) < (c * d))", expression("a + b < c * d").toString());
		assertEquals("((1 + 2) * 3)", expression("(1 + 2) * 3").toString());
		assertEquals("((total % 7) / 2)", expression("total % 7 / 2").toString());
	}

	@Test
	public void testLeftAssociativity() {
		assertEquals("((1 - 2) - 3)", expression("1 - 2 - 3").toString());
		assertEquals("((8 / 4) / 2)", expression("8 / 4 / 2").toString());
	}

	@Test
	public void testPowerIsRightAssociative() {
		ExpressionAst power = expression("2 ** 3 ** 2");
		assertEquals("(2 ** (3 ** 2))", power.toString());
		BinaryExpressionAst outer = (BinaryExpressionAst) power;
		assertEquals(BinaryOperator.POWER, outer.getOperator());
		assertTrue(outer.getRight() instanceof BinaryExpressionAst);
	}

	@Test
	public void testUnaryOperators() {
		assertEquals("(-(2 ** 2))", expression("-2 ** 2").toString());
		assertEquals("(2 ** (-1))", expression("2 ** -1").toString());
		assertEquals("((-a) * b)", expression("-a * b").toString());
		assertEquals("((not ready) and done)", expression("not ready and done").toString());
		assertEquals("(not (not ready))", expression("not not ready").toString());
	}

	@Test
	public void testPostfixOperations() {
		ExpressionAst call = expression("profile.items[0](1, 'two')");
		assertTrue(call instanceof FunctionCallAst);
		assertEquals("profile.items[0](1, \"two\")", call.toString());
		assertNull("An indexed callee has no name", ((FunctionCallAst) call).getCalleeName());
		assertEquals("save", ((FunctionCallAst) expression("profile.save(1)")).getCalleeName());
		assertEquals("print()", expression("print()").toString());
	}

	@Test
	public void testCollectionLiterals() {
		ListLiteralAst empty = (ListLiteralAst) expression("[]");
		assertTrue(empty.getElements().isEmpty());
		ListLiteralAst list = (ListLiteralAst) expression("[1, 2, 3,]");
		assertEquals(3, list.getElements().size());
		DictLiteralAst dict = (DictLiteralAst) expression("{'name': 'Ada', 'age': 36,}");
		assertEquals(2, dict.size());
		assertEquals("{\"name\": \"Ada\", \"age\": 36}", dict.toString());
		assertEquals(0, ((DictLiteralAst) expression("{}")).size());
		assertEquals("[none, true, 1.5]", expression("[none, true, 1.5]").toString());
	}

	@Test
	public void testMultiLineLiteral() {
		ProgramAst program = parse("scores = [", "    10,", "    20,", "]", "print(scores)");
		assertEquals(2, program.getStatements().size());
		assertEquals(2, ((ListLiteralAst) ((AssignmentAst) program.getStatements().get(0)).getValue()).getElements().size());
	}

	@Test
	public void testFunctionDefinition() {
		ProgramAst program = parse(
				"@requires_user_consent",
				"@audited('weekly', 2)",
				"function share_location(user_id, target):",
				"    position = collect_location(user_id)",
				"    return position",
				"share_location(1, 2)");
		assertEquals(2, program.getStatements().size());
		FunctionDefAst function = (FunctionDefAst) program.getStatements().get(0);
		assertEquals("share_location", function.getName());
		assertEquals(2, function.getParameters().size());
		assertEquals("target", function.getParameters().get(1));
		assertEquals(2, function.getAnnotations().size());
		assertTrue(function.hasAnnotation("requires_user_consent"));
		assertTrue(function.hasAnnotation("audited"));
		assertFalse(function.hasAnnotation("requires_data_protection"));
		assertEquals("@audited(\"weekly\", 2)", function.getAnnotations().get(1).toString());
		assertEquals("The function starts at its first annotation", 1, function.getLine());
		assertEquals(2, function.getBody().size());
		assertTrue(function.getBody().get(1) instanceof ReturnStatementAst);
		assertEquals(1, program.getFunctions().size());
	}

	@Test
	public void testControlFlow() {
		ProgramAst program = parse(
				"if count > 10:",
				"    label = 'many'",
				"else:",
				"    label = 'few'",
				"while count > 0:",
				"    count = count - 1",
				"for item in items:",
				"    print(item)",
				"function stop():",
				"    return");
		List<StatementAst> statements = program.getStatements();
		assertEquals(4, statements.size());
		IfStatementAst ifStatement = (IfStatementAst) statements.get(0);
		assertTrue(ifStatement.hasElse());
		assertEquals(1, ifStatement.getThenBlock().size());
		assertEquals(1, ifStatement.getElseBlock().size());
		assertEquals(5, ((WhileStatementAst) statements.get(1)).getLine());
		ForInStatementAst forIn = (ForInStatementAst) statements.get(2);
		assertEquals("item", forIn.getVariable());
		assertEquals("items", forIn.getIterable().toString());
		ReturnStatementAst bareReturn = (ReturnStatementAst) ((FunctionDefAst) statements.get(3)).getBody().get(0);
		assertNull(bareReturn.getValue());
	}

	@Test
	public void testIfWithoutElse() {
		IfStatementAst ifStatement = (IfStatementAst) parse("if ready:", "    go()").getStatements().get(0);
		assertFalse(ifStatement.hasElse());
		assertTrue(ifStatement.getElseBlock().isEmpty());
	}

	@Test
	public void testNestedBlocksEndingTogether() {
		ProgramAst program = parse(
				"for row in rows:",
				"    for cell in row:",
				"        if cell:",
				"            print(cell)",
				"print('done')");
		assertEquals(2, program.getStatements().size());
	}

	@Test
	public void testExpectedIndentedBlock() {
		ParserException e = parseError("if ready:", "go()");
		assertTrue(e.getMessage(), e.getMessage().contains("expected indented block"));
		assertEquals(1, e.getLineNumber());
		assertEquals("test.eth", e.getSourceDescription());
	}

	@Test
	public void testUnexpectedToken() {
		ParserException e = parseError("total = 1 2");
		assertEquals("unexpected token '2' at 1:11", e.getMessage());
		assertEquals(1, e.getLineNumber());
		assertEquals(11, e.getColumnNumber());

		assertTrue(parseError(")").getMessage().startsWith("unexpected token ')'"));
		assertTrue(parseError("total =").getMessage().startsWith("unexpected token 'NEWLINE'"));
	}

	@Test
	public void testExpectedColon() {
		ParserException e = parseError("if ready", "    go()");
		assertTrue(e.getMessage(), e.getMessage().startsWith("expected ':'"));
		assertEquals(1, e.getLineNumber());
	}

	@Test
	public void testAnnotationsNeedFunction() {
		ParserException e = parseError("@requires_user_consent", "total = 1");
		assertTrue(e.getMessage().contains("annotations must be followed by a function definition"));
		assertThrows(ParserException.class, () -> EthicaParser.parse("@audited total\n", "test.eth"));
	}

	@Test
	public void testMissingParts() {
		parseError("function (user_id):", "    return user_id");
		parseError("values = [1, 2");
		parseError("config = {'a' 1}");
		parseError("for 1 in items:", "    go()");
		parseError("profile.'name'");
	}

	@Test
	public void testDump() {
		ProgramAst program = parse("function greet(name):", "    print('hi ' + name)", "greet('Ada')");
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		program.dump(new PrintStream(bytes, true, StandardCharsets.UTF_8));
		String dump = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(dump, dump.startsWith("ProgramAst program (2 statements) [1:1]"));
		assertTrue(dump, dump.contains(" FunctionDefAst function greet(name) [1:1]"));
		assertTrue(dump, dump.contains("  ExpressionStatementAst print((\"hi \" + name)) [2:5]"));
	}
}
