package org.metricshub.jox;

import static org.junit.Assert.*;
import static org.metricshub.jox.sexpr.SExpressions.build;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.jox.ast.Atom;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.ast.UnaryOp;
import org.metricshub.jox.backend.EmitContext;
import org.metricshub.jox.backend.SourceEmitter;
import org.metricshub.jox.builder.NodeProxy;

public class SourceEmitterTest {

	private static Node n(String id) {
		return build("name", id);
	}

	private static String emit(Node node) {
		return SourceEmitter.emit(node);
	}

	@Test
	public void testPrecedence() {
		assertEquals("(2 + 3) * 4", emit(build("*", build("+", 2, 3), 4)));
		assertEquals("2 + 3 * 4", emit(build("+", 2, build("*", 3, 4))));
		assertEquals("2 * 3 + 4", emit(build("+", build("*", 2, 3), 4)));
		assertEquals("a | b & c", emit(build("|", n("a"), build("&", n("b"), n("c")))));
		assertEquals("(a | b) & c", emit(build("&", build("|", n("a"), n("b")), n("c"))));
		assertEquals("a + b << c", emit(build("<<", build("+", n("a"), n("b")), n("c"))));
		assertEquals("a < b + c", emit(build("<", n("a"), build("+", n("b"), n("c")))));
	}

	@Test
	public void testProxyGrouping() {
		NodeProxy two = NodeProxy.lift(2);
		assertEquals("(2 + 3) * 4", emit(NodeProxy.unwrap(two.add(3).mul(4))));
		assertEquals("2 + 3 * 4", emit(NodeProxy.unwrap(two.add(NodeProxy.lift(3).mul(4)))));
	}

	@Test
	public void testAssociativity() {
		assertEquals("a - b - c", emit(build("-", n("a"), n("b"), n("c"))));
		assertEquals("a - (b - c)", emit(build("-", n("a"), build("-", n("b"), n("c")))));
		assertEquals("a / (b * c)", emit(build("/", n("a"), build("*", n("b"), n("c")))));
		assertEquals("a ** b ** c", emit(build("**", n("a"), n("b"), n("c"))));
		assertEquals("(a ** b) ** c", emit(build("**", build("**", n("a"), n("b")), n("c"))));
		assertEquals("a or b or c", emit(build("or", n("a"), n("b"), n("c"))));
		assertEquals("(a or b) or c", emit(build("or", build("or", n("a"), n("b")), n("c"))));
		assertEquals("a and b or c", emit(build("or", build("and", n("a"), n("b")), n("c"))));
		assertEquals("a and (b or c)", emit(build("and", n("a"), build("or", n("b"), n("c")))));
	}

	@Test
	public void testComparisonsDoNotChain() {
		assertEquals("(a < b) < c", emit(build("<", build("<", n("a"), n("b")), n("c"))));
		assertEquals("a < (b < c)", emit(build("<", n("a"), build("<", n("b"), n("c")))));
		assertEquals("a is not b", emit(build("is not", n("a"), n("b"))));
		assertEquals("a not in b", emit(build("not in", n("a"), n("b"))));
	}

	@Test
	public void testUnaryOperators() {
		assertEquals("-x", emit(build("-", n("x"))));
		assertEquals("--x", emit(build("-", build("-", n("x")))));
		assertEquals("-(5)", emit(build("-", 5)));
		assertEquals("-(1.5)", emit(build("-", 1.5)));
		assertEquals("--5", emit(new UnaryOp("-", new Atom(-5))));
		assertEquals("+5", emit(build("+", 5)));
		assertEquals("~x", emit(build("~", n("x"))));
		assertEquals("-(a + b)", emit(build("-", build("+", n("a"), n("b")))));
		assertEquals("not a == b", emit(build("not", build("==", n("a"), n("b")))));
		assertEquals("(not a) == b", emit(build("==", build("not", n("a")), n("b"))));
		assertEquals("not (a and b)", emit(build("not", build("and", n("a"), n("b")))));
		assertEquals("a and not b", emit(build("and", n("a"), build("not", n("b")))));
	}

	@Test
	public void testPower() {
		assertEquals("-a ** b", emit(build("-", build("**", n("a"), n("b")))));
		assertEquals("(-a) ** b", emit(build("**", build("-", n("a")), n("b"))));
		assertEquals("a ** -b", emit(build("**", n("a"), build("-", n("b")))));
		assertEquals("2 ** -1", emit(build("**", 2, -1)));
		assertEquals("(-5) ** 2", emit(build("**", -5, 2)));
	}

	@Test
	public void testNegativeLiterals() {
		assertEquals("-5", emit(new Atom(-5)));
		assertEquals("x - -5", emit(build("-", n("x"), -5)));
		assertEquals("-5 * x", emit(build("*", -5, n("x"))));
		assertEquals("(-5).real", emit(build("attr", -5, "real")));
		assertEquals("-0.0", emit(new Atom(-0.0)));
	}

	@Test
	public void testConditionalAndLambda() {
		assertEquals("x if c else y", emit(build("ifexpr", n("c"), n("x"), n("y"))));
		assertEquals(
				"(a if d else b) if c else e",
				emit(build("ifexpr", n("c"), build("ifexpr", n("d"), n("a"), n("b")), n("e"))));
		assertEquals(
				"a if c else b if d else e",
				emit(build("ifexpr", n("c"), n("a"), build("ifexpr", n("d"), n("b"), n("e")))));
		assertEquals("(x if c else y) + 1", emit(build("+", build("ifexpr", n("c"), n("x"), n("y")), 1)));
		assertEquals("lambda x, y: x + y", emit(build("lambda", Arrays.asList("x", "y"), build("+", n("x"), n("y")))));
		assertEquals("lambda: 1", emit(build("lambda", Collections.emptyList(), 1)));
		assertEquals("(lambda: 1)()", emit(build("call", build("lambda", Collections.emptyList(), 1))));
		assertEquals("(lambda: 1) + 1", emit(build("+", build("lambda", Collections.emptyList(), 1), 1)));
	}

	@Test
	public void testPostfix() {
		Map<String, Object> kwargs = new LinkedHashMap<String, Object>();
		kwargs.put("y", 42);
		assertEquals("fn(x, y=42)", emit(build("call", n("fn"), n("x"), kwargs)));
		assertEquals("(42).y", emit(build("attr", 42, "y")));
		assertEquals("1.5.real", emit(build("attr", 1.5, "real")));
		assertEquals("'s'.upper()", emit(build("call", build("attr", "s", "upper"))));
		assertEquals("(a + b).c", emit(build("attr", build("+", n("a"), n("b")), "c")));
		assertEquals("x.f()[0]", emit(build("index", build("call", build("attr", n("x"), "f")), 0)));
		assertEquals("a[(1, 2)]", emit(build("index", n("a"), build("tuple", 1, 2))));
		assertEquals("a[b + 1]", emit(build("index", n("a"), build("+", n("b"), 1))));
	}

	@Test
	public void testSequences() {
		assertEquals("[]", emit(build("list")));
		assertEquals("[1, 2]", emit(build("list", 1, 2)));
		assertEquals("()", emit(build("tuple")));
		assertEquals("(1,)", emit(build("tuple", 1)));
		assertEquals("(1, 2)", emit(build("tuple", 1, 2)));
		assertEquals("{1, 'a'}", emit(build("set", 1, "a")));
		assertEquals("[lambda: 1, x if c else y]",
				emit(build("list", build("lambda", Collections.emptyList(), 1), build("ifexpr", n("c"), n("x"), n("y")))));
	}

	@Test
	public void testLiterals() {
		assertEquals("True", emit(new Atom(true)));
		assertEquals("False", emit(new Atom(false)));
		assertEquals("None", emit(new Atom(null)));
		assertEquals("1.5", emit(new Atom(1.5)));
		assertEquals("1.0E-5", emit(new Atom(1e-5)));
		assertEquals("'it\\'s\\n'", emit(new Atom("it's\n")));
		assertEquals("'a\\\\b'", emit(new Atom("a\\b")));
		assertEquals("'\\x01\\t'", emit(new Atom("\u0001\t")));
		assertEquals("'\u00e9'", emit(new Atom("\u00e9")));
	}

	@Test
	public void testSimpleStatements() {
		assertEquals("x = 1\n", emit(build("=", n("x"), 1)));
		assertEquals("(a, b) = (b, a)\n", emit(build("=", build("tuple", n("a"), n("b")), build("tuple", n("b"), n("a")))));
		assertEquals("return\n", emit(build("return")));
		assertEquals("return x\n", emit(build("return", n("x"))));
		assertEquals("import os.path\n", emit(build("import", "os.path")));
		assertEquals("import numpy as np\n", emit(build("import", "numpy", "np")));
		assertEquals("del a, b[0]\n", emit(build("del", n("a"), build("index", n("b"), 0))));
		assertEquals("break\n", emit(build("break")));
		assertEquals("continue\n", emit(build("continue")));
		assertEquals("x = 1\ny = 2\n", emit(build("do", build("=", n("x"), 1), build("=", n("y"), 2))));
		assertEquals("", emit(build("do")));
	}

	@Test
	public void testAugmentedAssignment() {
		assertEquals("x += 1\n", emit(build("+=", n("x"), 1)));
		assertEquals("a[i] //= 2 ** n\n", emit(build("//=", build("index", n("a"), n("i")), build("**", 2, n("n")))));
		assertEquals("o.mask |= (1, 2)\n", emit(build("|=", build("attr", n("o"), "mask"), build("tuple", 1, 2))));
		assertEquals("x @= y if c else z\n", emit(build("@=", n("x"), build("ifexpr", n("c"), n("y"), n("z")))));
	}

	@Test
	public void testWhileElse() {
		Node loop = build("while", n("c"), build("break"), build("=", n("x"), 1));
		assertEquals("while c:\n    break\nelse:\n    x = 1\n", emit(loop));
		assertEquals("while c:\n    pass\n", emit(build("while", n("c"), Collections.emptyList(), Collections.emptyList())));
	}

	@Test
	public void testImportFrom() {
		Map<String, String> alias = Collections.singletonMap("exists", "present");
		assertEquals("from os.path import join, exists as present\n", emit(build("from", "os.path", "join", alias)));
		assertEquals("from .. import a\n", emit(build("from", "..", "a")));
		assertEquals("from .pkg import *\n", emit(build("from", ".pkg", "*")));
	}

	@Test
	public void testYield() {
		assertEquals("(yield)", emit(build("yield")));
		assertEquals("(yield x + 1)", emit(build("yield", build("+", n("x"), 1))));
		assertEquals("(yield from gen)", emit(build("yield from", n("gen"))));
		assertEquals("y = (yield x)\n", emit(build("=", n("y"), build("yield", n("x")))));
		assertEquals("(yield x).send(1)", emit(build("call", build("attr", build("yield", n("x")), "send"), 1)));
		assertEquals("-(yield)", emit(build("-", build("yield"))));
		assertEquals("(yield)\n", emit(build("do", build("yield"), build("do"))));
	}

	@Test
	public void testFunctionDefinition() {
		Node calc = build("def", "calc", Arrays.asList("x"), build("return", build("+", 42, n("x"))));
		assertEquals("def calc(x):\n    return 42 + x\n", emit(calc));
		assertEquals("def f():\n    pass\n", emit(build("def", "f", Collections.emptyList(), Collections.emptyList())));
	}

	@Test
	public void testIfElifElse() {
		Node node = build(
				"if",
				n("a"),
				build("=", n("x"), 1),
				build("if", n("b"), build("=", n("x"), 2), build("=", n("x"), 3)));
		assertEquals("if a:\n    x = 1\nelif b:\n    x = 2\nelse:\n    x = 3\n", emit(node));

		Node nested = build("if", n("a"), build("if", n("b"), build("break")), build("continue"));
		assertEquals("if a:\n    if b:\n        break\nelse:\n    continue\n", emit(nested));

		assertEquals("if a:\n    pass\n", emit(build("if", n("a"), Collections.emptyList())));
	}

	@Test
	public void testNestedIndentation() {
		Node loop = build(
				"while",
				true,
				Arrays.asList(
						build("def", "g", Arrays.asList("n"), build("return", n("n"))),
						build("if", build(">", n("i"), 0), build("break"))));
		String expected = "while True:\n"
				+ "    def g(n):\n"
				+ "        return n\n"
				+ "    if i > 0:\n"
				+ "        break\n";
		assertEquals(expected, emit(loop));
		assertEquals(expected.replace("    ", "  "), SourceEmitter.emit(loop, EmitContext.withIndentWidth(2)));
		assertEquals(expected.replace("    ", "\t"), SourceEmitter.emit(loop, new EmitContext("\t")));
	}

	@Test
	public void testDeterminism() {
		Node node = build("def", "f", Arrays.asList("a"), build("return", build("*", build("+", n("a"), 1), 2)));
		assertEquals(emit(node), emit(node));
	}

	@Test
	public void testEmitContext() {
		EmitContext context = new EmitContext();
		assertEquals(0, context.getLevel());
		assertThrows(IllegalStateException.class, context::dedent);
		context.indent();
		context.line("x");
		context.dedent();
		context.line("y");
		assertEquals("    x\ny\n", context.getText());
		assertThrows(IllegalArgumentException.class, () -> new EmitContext("x"));
		assertThrows(IllegalArgumentException.class, () -> new EmitContext(""));
		assertThrows(IllegalArgumentException.class, () -> EmitContext.withIndentWidth(0));
	}
}
