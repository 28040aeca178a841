package org.metricshub.ethica;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.ethica.EthicaTestSupport.assertContains;
import static org.metricshub.ethica.EthicaTestSupport.ethicaTest;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.Test;
import org.metricshub.ethica.backend.Environment;
import org.metricshub.ethica.backend.EthicaRuntimeException;
import org.metricshub.ethica.backend.Interpreter;
import org.metricshub.ethica.util.VerifierSettings;

public class InterpreterTest {

	private static EthicaRuntimeException runtimeError(final String... script) {
		return assertThrows(EthicaRuntimeException.class, () -> ethicaTest("runtime error").script(script).execute());
	}

	@Test
	public void testPrintFormatting() {
		ethicaTest("print renders every value type")
				.script(
						"print('plain', 42, 1.5, true, none)",
						"print([1, 'two', [3]])",
						"print({'name': 'Ada', 'age': 36})",
						"print()")
				.expectLines("plain 42 1.5 true none", "[1, \"two\", [3]]", "{\"name\": \"Ada\", \"age\": 36}", "")
				.execute();
	}

	@Test
	public void testArithmetic() {
		ethicaTest("integer and float arithmetic")
				.script(
						"print(2 + 3 * 4)",
						"print(5 / 2)",
						"print(6 / 3)",
						"print(7 % 3)",
						"print(-7 % 3)",
						"print(7 % -3)",
						"print(2 ** 10)",
						"print(2 ** 3 ** 2)",
						"print(2 ** -1)",
						"print(1 + 0.5)")
				.expectLines("14", "2.5", "2.0", "1", "2", "-2", "1024", "512", "0.5", "1.5")
				.execute();
	}

	@Test
	public void testComparisons() {
		ethicaTest("comparisons and equality")
				.script("print(1 < 2, 2 <= 1, 3 == 3.0, 'a' != 'b', 'abc' < 'abd')")
				.expectLines("true false true true true")
				.execute();
	}

	@Test
	public void testIntegerOverflow() {
		EthicaRuntimeException e = runtimeError("big = 9223372036854775807", "print(big + 1)");
		assertContains(e.getMessage(), "Integer overflow in +");
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void testDivisionByZero() {
		EthicaRuntimeException e = runtimeError("total = 10", "", "print(total / 0)");
		assertEquals("Division by zero", e.getMessage());
		assertEquals(3, e.getLineNumber());
	}

	@Test
	public void testModuloByZero() {
		assertEquals("Modulo by zero", runtimeError("print(10 % 0)").getMessage());
	}

	@Test
	public void testUnsupportedOperands() {
		assertContains(runtimeError("print('count' - 1)").getMessage(), "Unsupported operand type");
		assertContains(runtimeError("print(-'text')").getMessage(), "Bad operand type for unary -");
	}

	@Test
	public void testStringsAndLists() {
		ethicaTest("concatenation and indexing")
				.script(
						"greeting = 'hello' + ' ' + 'world'",
						"print(greeting, len(greeting))",
						"items = [1, 2] + [3]",
						"print(items, items[0], items[-1])",
						"print(greeting[-5])")
				.expectLines("hello world 11", "[1, 2, 3] 1 3", "w")
				.execute();
	}

	@Test
	public void testIndexOutOfRange() {
		EthicaRuntimeException e = runtimeError("items = [1, 2, 3]", "print(items[3])");
		assertEquals("Index 3 out of range", e.getMessage());
		assertEquals(2, e.getLineNumber());
		assertEquals("Index -4 out of range", runtimeError("print([1, 2, 3][-4])").getMessage());
	}

	@Test
	public void testDictionaries() {
		ethicaTest("dict indexing and member access")
				.script(
						"profile = {'name': 'Ada', 'age': 36}",
						"print(profile['name'], profile.age, len(profile))")
				.expectLines("Ada 36 2")
				.execute();
		assertEquals("Key not found: email", runtimeError("profile = {'name': 'Ada'}", "print(profile['email'])").getMessage());
		assertContains(runtimeError("profile = {'name': 'Ada'}", "print(profile.email)").getMessage(), "no key 'email'");
		assertContains(runtimeError("table = {[1]: 2}").getMessage(), "hashable");
	}

	@Test
	public void testTruthiness() {
		ethicaTest("falsy values")
				.script(
						"for value in [0, 0.0, '', [], {}, none, false, 1, 'x', [0]]:",
						"    if value:",
						"        print('yes')",
						"    else:",
						"        print('no')")
				.expectLines("no", "no", "no", "no", "no", "no", "no", "yes", "yes", "yes")
				.execute();
	}

	@Test
	public void testShortCircuit() {
		ethicaTest("the right operand is only evaluated when needed")
				.script("print(false and undefined_call(), true or undefined_call(), 1 and 'x', not 0)")
				.expectLines("false true true true")
				.execute();
	}

	@Test
	public void testForLoops() {
		ethicaTest("iteration over lists, strings and dict keys")
				.script(
						"total = 0",
						"for number in [1, 2, 3]:",
						"    total = total + number",
						"print(total)",
						"for letter in 'ab':",
						"    print(letter)",
						"for key in {'first': 1, 'second': 2}:",
						"    print(key)")
				.expectLines("6", "a", "b", "first", "second")
				.execute();
		assertEquals("Cannot iterate over int", runtimeError("for item in 5:", "    print(item)").getMessage());
	}

	@Test
	public void testLoopVariableIsScopedToTheLoop() {
		assertEquals(
				"Undefined variable: item",
				runtimeError("for item in [1]:", "    print(item)", "print(item)").getMessage());
	}

	@Test
	public void testWhileLoop() {
		ethicaTest("while")
				.script("count = 0", "while count < 3:", "    count = count + 1", "print(count)")
				.expectLines("3")
				.execute();
	}

	@Test
	public void testRecursion() {
		ethicaTest("factorial")
				.script(
						"function factorial(number):",
						"    if number <= 1:",
						"        return 1",
						"    return number * factorial(number - 1)",
						"print(factorial(10))")
				.expectLines("3628800")
				.execute();
	}

	@Test
	public void testClosures() {
		ethicaTest("a nested function keeps the scope it was defined in")
				.script(
						"function make_counter(start):",
						"    count = start",
						"    function step():",
						"        count = count + 1",
						"        return count",
						"    return step",
						"counter = make_counter(5)",
						"print(counter())",
						"print(counter())",
						"print(counter)")
				.expectLines("6", "7", "<function step>")
				.execute();
	}

	@Test
	public void testFunctionWithoutReturnYieldsNone() {
		ethicaTest("implicit none")
				.script("function greet(name):", "    print('hi', name)", "print(greet('Ada'))")
				.expectLines("hi Ada", "none")
				.execute();
	}

	@Test
	public void testCallDepthLimit() {
		EthicaRuntimeException e = runtimeError("function dive(level):", "    return dive(level + 1)", "dive(0)");
		assertEquals("Maximum call depth of 1000 exceeded in dive", e.getMessage());
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void testArityMismatch() {
		assertEquals(
				"Function add expects 2 arguments, got 1",
				runtimeError("function add(first, second):", "    return first + second", "add(1)").getMessage());
	}

	@Test
	public void testCallingANonFunction() {
		assertContains(runtimeError("value = 3", "value(1)").getMessage(), "is not callable (int)");
	}

	@Test
	public void testUndefinedVariable() {
		EthicaRuntimeException e = runtimeError("print(1)", "print(missing)");
		assertEquals("Undefined variable: missing", e.getMessage());
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void testBuiltins() {
		ethicaTest("built-in functions")
				.script(
						"print(len('abc'), len([1, 2]), len({}))",
						"print(range(3), range(1, 4), range(10, 0, -4))",
						"print(str(12) + '!', int('42'), int(3.9), float(2))",
						"print(type(1), type(1.0), type('a'), type([]), type({}), type(none), type(true), type(len))",
						"print(abs(-5), abs(-2.5))",
						"print(min(4, 2, 8), max([4, 2, 8]), sum([1, 2, 3]), sum([1, 0.5]))")
				.expectLines(
						"3 2 0",
						"[0, 1, 2] [1, 2, 3] [10, 6, 2]",
						"12! 42 3 2.0",
						"int float str list dict none bool function",
						"5 2.5",
						"2 8 6 1.5")
				.execute();
	}

	@Test
	public void testBuiltinErrors() {
		assertEquals("len() takes 1 arguments, got 2", runtimeError("len('a', 'b')").getMessage());
		assertEquals("range() step must not be zero", runtimeError("range(1, 5, 0)").getMessage());
		assertContains(runtimeError("int('twelve')").getMessage(), "Cannot convert 'twelve' to int");
		assertEquals("max() of an empty list", runtimeError("max([])").getMessage());
	}

	@Test
	public void testTopLevelReturnValue() {
		Ethica ethica = new Ethica();
		Object value = ethica.execute(ethica.parse("answer = 6 * 7\nreturn answer\n"), new VerifierSettings());
		assertEquals(42L, value);
	}

	@Test
	public void testGlobalsAfterExecution() {
		Interpreter interpreter = new Interpreter(new PrintStream(new ByteArrayOutputStream(), true));
		interpreter.execute(EthicaTestSupport.parse("total = 0", "for number in range(4):", "    total = total + number"));
		Environment globals = interpreter.getGlobals();
		assertEquals(6L, globals.get("total", 0));
		assertTrue(globals.exists("len"));
		assertFalse(globals.exists("number"));
	}
}
