package org.metricshub.jox;

import static org.junit.Assert.*;
import static org.metricshub.jox.sexpr.SExpressions.build;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.jox.ast.Atom;
import org.metricshub.jox.ast.Block;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.ast.NodeKind;
import org.metricshub.jox.frontend.SourceReader;
import org.metricshub.jox.frontend.SourceSyntaxException;

public class SourceReaderTest {

	private static Node n(String id) {
		return build("name", id);
	}

	private static SourceSyntaxException syntaxError(String text) {
		return assertThrows(text, SourceSyntaxException.class, () -> SourceReader.parseModule(text));
	}

	@Test
	public void testExpressions() {
		assertEquals(build("+", 42, n("x")), SourceReader.parse("42 + x"));
		assertEquals(build("+", 1, build("*", 2, 3)), SourceReader.parse("1 + 2 * 3"));
		assertEquals(build("*", build("+", 1, 2), 3), SourceReader.parse("(1 + 2) * 3"));
		assertEquals(build("not in", n("a"), n("b")), SourceReader.parse("a not in b"));
		assertEquals(build("is not", n("a"), n("b")), SourceReader.parse("a is not b"));
		assertEquals(build("not", build("in", n("a"), n("b"))), SourceReader.parse("not a in b"));
		assertEquals(build("ifexpr", n("c"), n("x"), n("y")), SourceReader.parse("x if c else y"));
		assertEquals(build("lambda", Arrays.asList("x", "y"), n("x")), SourceReader.parse("lambda x, y: x"));
		assertEquals(build("lambda", Collections.emptyList(), 0), SourceReader.parse("lambda: 0"));
	}

	@Test
	public void testNegativeLiterals() {
		assertEquals(new Atom(-5), SourceReader.parse("-5"));
		assertEquals(new Atom(-2.5), SourceReader.parse("-2.5"));
		assertEquals(build("-", 5), SourceReader.parse("-(5)"));
		assertEquals(build("-", build("**", 5, 2)), SourceReader.parse("-5 ** 2"));
		assertEquals(build("**", 2, -1), SourceReader.parse("2 ** -1"));
		assertEquals(build("-", n("x"), 5), SourceReader.parse("x - 5"));
		assertEquals(build("-", n("x"), -5), SourceReader.parse("x - -5"));
		assertEquals(build("-", n("x")), SourceReader.parse("- x"));
		assertEquals(build("-", build("attr", n("x"), "y")), SourceReader.parse("-x.y"));
		assertEquals(new Atom(Long.MIN_VALUE), SourceReader.parse("-9223372036854775808"));
	}

	@Test
	public void testPostfixAndCalls() {
		assertEquals(build("attr", 1.5, "real"), SourceReader.parse("1.5.real"));
		assertEquals(build("attr", 42, "y"), SourceReader.parse("(42).y"));
		assertEquals(build("index", n("a"), build("tuple", 1, 2)), SourceReader.parse("a[1, 2]"));
		assertEquals(
				build("call", n("f"), n("x"), Collections.singletonMap("y", 42)),
				SourceReader.parse("f(x, y=42)"));
		assertEquals(build("call", n("f"), 1, 2), SourceReader.parse("f(1,\n      2,)"));
	}

	@Test
	public void testDisplays() {
		assertEquals(build("tuple"), SourceReader.parse("()"));
		assertEquals(build("tuple", 1), SourceReader.parse("(1,)"));
		assertEquals(build("tuple", 1, 2), SourceReader.parse("1, 2"));
		assertEquals(build("list", 1, 2), SourceReader.parse("[1, 2,]"));
		assertEquals(build("set", 1), SourceReader.parse("{1}"));
		assertEquals(build("list"), SourceReader.parse("[]"));
	}

	@Test
	public void testLiterals() {
		assertEquals(new Atom(true), SourceReader.parse("True"));
		assertEquals(new Atom(null), SourceReader.parse("None"));
		assertEquals(new Atom(1e-5), SourceReader.parse("1.0E-5"));
		assertEquals(new Atom(0.5), SourceReader.parse(".5"));
		assertEquals(new Atom("a'b"), SourceReader.parse("'a\\'b'"));
		assertEquals(new Atom("xA\u00e9"), SourceReader.parse("\"x\\x41\\u00e9\""));
		assertEquals(new Atom("ab"), SourceReader.parse("'a' \"b\""));
		assertEquals(new Atom("\\d"), SourceReader.parse("'\\d'"));
		assertEquals(new Atom("\0\n\t"), SourceReader.parse("'\\0\\n\\t'"));
	}

	@Test
	public void testStatements() {
		assertEquals(build("=", n("x"), 1), SourceReader.parse("x = 1"));
		assertEquals(build("=", build("attr", n("x"), "y"), 1), SourceReader.parse("x.y = 1\n"));
		assertEquals(build("=", build("tuple", n("a"), n("b")), build("tuple", n("b"), n("a"))), SourceReader.parse("a, b = b, a"));
		assertEquals(build("del", n("a"), n("b")), SourceReader.parse("del a, b"));
		assertEquals(build("import", "os.path", "p"), SourceReader.parse("import os.path as p"));
		assertEquals(build("return"), SourceReader.parse("return"));
		assertEquals(build("return", build("tuple", 1, 2)), SourceReader.parse("return 1, 2"));
		assertEquals(build("break"), SourceReader.parse("break"));
	}

	@Test
	public void testCompoundStatements() {
		assertEquals(
				build("def", "calc", Arrays.asList("x"), build("return", build("+", 42, n("x")))),
				SourceReader.parse("def calc(x):\n    return 42 + x\n"));
		assertEquals(
				build("def", "f", Arrays.asList("x"), Collections.emptyList()),
				SourceReader.parse("def f(x):\n    pass\n"));
		assertEquals(
				build("if", n("a"), n("x"), build("if", n("b"), n("y"), n("z"))),
				SourceReader.parse("if a:\n    x\nelif b:\n    y\nelse:\n    z\n"));
		assertEquals(build("if", n("a"), n("x")), SourceReader.parse("if a: x\n"));
		assertEquals(
				build("while", true, Arrays.asList(build("if", n("x"), build("break")), build("continue"))),
				SourceReader.parse("while True:\n\tif x:\n\t\tbreak\n\tcontinue\n"));
	}

	@Test
	public void testAugmentedAssignment() {
		assertEquals(build("+=", n("x"), 1), SourceReader.parse("x += 1"));
		assertEquals(build("**=", n("x"), 2), SourceReader.parse("x**=2"));
		assertEquals(build("<<=", build("index", n("a"), 0), n("n")), SourceReader.parse("a[0] <<= n"));
		assertEquals(build("-=", build("attr", n("o"), "n"), -1), SourceReader.parse("o.n -= -1"));
		assertEquals(build("+=", n("t"), build("tuple", 1, 2)), SourceReader.parse("t += 1, 2"));
		assertEquals(build("<=", n("a"), n("b")), SourceReader.parse("a <= b"));
		assertEquals(build(">>", n("a"), n("b")), SourceReader.parse("a >> b"));
	}

	@Test
	public void testWhileElseAndYield() {
		assertEquals(
				build("while", n("c"), build("break"), build("=", n("x"), 1)),
				SourceReader.parse("while c:\n    break\nelse:\n    x = 1\n"));
		assertEquals(build("while", n("c"), Collections.emptyList()), SourceReader.parse("while c: pass\n"));
		assertEquals(build("yield", n("x")), SourceReader.parse("yield x"));
		assertEquals(build("yield", build("tuple", 1, 2)), SourceReader.parse("yield 1, 2"));
		assertEquals(build("yield"), SourceReader.parse("(yield)"));
		assertEquals(build("yield from", n("g")), SourceReader.parse("(yield from g)"));
		assertEquals(build("=", n("y"), build("yield", n("x"))), SourceReader.parse("y = yield x"));
		assertEquals(build("+=", n("y"), build("yield")), SourceReader.parse("y += yield"));
	}

	@Test
	public void testImportFrom() {
		assertEquals(
				build("from", "os.path", "join", Collections.singletonMap("exists", "present")),
				SourceReader.parse("from os.path import join, exists as present"));
		assertEquals(build("from", "..pkg.sub", "a", "b"), SourceReader.parse("from ..pkg.sub import (\n    a,\n    b,\n)\n"));
		assertEquals(build("from", ".", "a"), SourceReader.parse("from . import a"));
		assertEquals(build("from", "m", "*"), SourceReader.parse("from m import *"));
	}

	@Test
	public void testModules() {
		Node module = SourceReader.parse("x = 1\ny = 2\n");
		assertEquals(NodeKind.BLOCK, module.kind());
		assertEquals(2, ((Block) module).getStatements().size());
		assertEquals(module, SourceReader.parse("x = 1; y = 2"));
		assertEquals(module, SourceReader.parse("# leading\n\nx = 1  # trailing\n   \n# inner\ny = 2"));
		assertEquals(module, SourceReader.parse("x = 1\r\ny = 2\r\n"));
		assertEquals(build("do"), SourceReader.parse(""));
		assertEquals(build("do"), SourceReader.parse("pass\n"));
		assertEquals(build("do", n("x")), SourceReader.parseModule("x"));
		assertEquals(build("=", n("x"), build("+", 1, 2)), SourceReader.parse("x = 1 + \\\n    2\n"));
	}

	@Test
	public void testParseStatementAndExpression() {
		assertEquals(build("=", n("x"), 1), SourceReader.parseStatement("x = 1"));
		assertThrows(SourceSyntaxException.class, () -> SourceReader.parseStatement("x = 1\ny = 2"));
		assertThrows(SourceSyntaxException.class, () -> SourceReader.parseStatement(""));
		assertEquals(build("tuple", 1, 2), SourceReader.parseExpression("1, 2\n\n"));
		assertThrows(SourceSyntaxException.class, () -> SourceReader.parseExpression("x = 1"));
		assertThrows(SourceSyntaxException.class, () -> SourceReader.parseExpression("x\ny"));
	}

	@Test
	public void testErrorPosition() {
		SourceSyntaxException e = syntaxError("x = 1\ny = )\n");
		assertEquals(2, e.getLine());
		assertEquals(5, e.getColumn());
		assertTrue(e.getMessage().endsWith("(line 2, column 5)"));

		e = syntaxError("if x:\n  y\n z\n");
		assertEquals(3, e.getLine());
		assertTrue(e.getMessage().startsWith("Unindent does not match any outer indentation level"));
	}

	@Test
	public void testMalformedNodesAreSyntaxErrors() {
		SourceSyntaxException e = syntaxError("1 = x");
		assertTrue(e.getCause() instanceof MalformedNodeException);
		assertEquals(1, e.getLine());
		assertEquals(3, e.getColumn());
		assertTrue(syntaxError("lambda x, x: x").getCause() instanceof MalformedNodeException);
		assertTrue(syntaxError("f() = 1").getCause() instanceof MalformedNodeException);
	}

	@Test
	public void testRejectedConstructs() {
		assertTrue(syntaxError("a < b < c").getMessage().startsWith("Chained comparisons are not supported"));
		assertTrue(syntaxError("x = y = 1").getMessage().startsWith("Chained assignment is not supported"));
		assertTrue(syntaxError("{}").getMessage().startsWith("Dictionary displays are not supported"));
		syntaxError("class X:\n    pass\n");
		syntaxError("for x in y:\n    pass\n");
		assertTrue(syntaxError("(a, b) += 1").getCause() instanceof MalformedNodeException);
		assertTrue(syntaxError("x += y += 1").getMessage().startsWith("Chained assignment is not supported"));
		syntaxError("from import a");
		syntaxError("from m import");
		syntaxError("from m import a,");
		syntaxError("from m import *, a");
		syntaxError("from m import ()");
		syntaxError("f(y=1, x)");
		syntaxError("f(a=1, a=2)");
	}

	@Test
	public void testLexicalErrors() {
		assertTrue(syntaxError("9223372036854775808").getMessage().startsWith("Integer literal out of range"));
		assertTrue(syntaxError("1e999").getMessage().startsWith("Float literal out of range"));
		assertTrue(syntaxError("'abc").getMessage().startsWith("Unterminated string literal"));
		assertTrue(syntaxError("'abc\ndef'").getMessage().startsWith("Unterminated string literal"));
		assertTrue(syntaxError("x $ y").getMessage().startsWith("Unexpected character"));
		assertTrue(syntaxError("12abc").getMessage().startsWith("Invalid number literal"));
		assertTrue(syntaxError("'\\x4'").getMessage().startsWith("Invalid escape sequence"));
	}

	@Test
	public void testIndentationErrors() {
		syntaxError("  x = 1\n");
		syntaxError("if x:\nreturn\n");
		syntaxError("x = (\n");
		syntaxError("def f(:\n    pass\n");
	}
}
