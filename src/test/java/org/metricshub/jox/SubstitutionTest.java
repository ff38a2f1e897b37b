package org.metricshub.jox;

import static org.junit.Assert.*;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.jox.analysis.Simplifier;
import org.metricshub.jox.analysis.Substitution;
import org.metricshub.jox.ast.Atom;
import org.metricshub.jox.ast.Name;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.ast.Return;
import org.metricshub.jox.frontend.SourceReader;

public class SubstitutionTest {

	private static Map<String, Node> with(Object... pairs) {
		Map<String, Node> map = new LinkedHashMap<String, Node>();
		for (int i = 0; i < pairs.length; i += 2) {
			Object value = pairs[i + 1];
			map.put((String) pairs[i], value instanceof Node ? (Node) value : new Atom(value));
		}
		return map;
	}

	private static void assertSubstitutes(String source, Map<String, Node> replacements, String expected) {
		assertEquals(
				source,
				SourceReader.parseModule(expected),
				Substitution.substitute(SourceReader.parseModule(source), replacements));
	}

	@Test
	public void testReplacesFreeNames() {
		assertSubstitutes("x + y", with("x", 1), "1 + y");
		assertSubstitutes("f(x, k=x)", with("x", new Name("z")), "f(z, k=z)");
		assertSubstitutes("x.x", with("x", "s"), "'s'.x");
	}

	@Test
	public void testReplacementIsInsertedAsOneOperand() {
		Node sum = SourceReader.parseExpression("a + b");
		Node result = Substitution.substitute(SourceReader.parseExpression("x * 2"), Collections.singletonMap("x", sum));
		assertEquals(SourceReader.parseExpression("(a + b) * 2"), result);
	}

	@Test
	public void testLambdaParametersAreNotReplaced() {
		assertSubstitutes("lambda x: x + y", with("x", 1, "y", 2), "lambda x: x + 2");
		assertSubstitutes("(lambda x: x)(x)", with("x", 1), "(lambda x: x)(1)");
	}

	@Test
	public void testAssignedNamesAreBoundAfterwards() {
		Node module = SourceReader.parseModule("x = 1\nx + z\n");
		assertSame(module, Substitution.substitute(module, with("x", 5)));
		assertSubstitutes("y = x\nx = 2\nx\n", with("x", 9), "y = 9\nx = 2\nx\n");
		assertSubstitutes("x = x + 1\n", with("x", 9), "x = 9 + 1\n");
	}

	@Test
	public void testTargetsAreNeverReplaced() {
		assertSubstitutes("obj.attr = v\n", with("obj", new Name("o2"), "v", 1), "o2.attr = 1\n");
		assertSubstitutes("a[i] = 0\n", with("a", new Name("b"), "i", 3), "b[3] = 0\n");
		assertSubstitutes("(a, b) = c\n", with("a", 1, "b", 2, "c", 3), "(a, b) = 3\n");
		assertSubstitutes("del x\n", with("x", 1), "del x\n");
	}

	@Test
	public void testFunctionDefinition() {
		assertSubstitutes(
				"def f(a):\n    return a + b\nf(b)\n",
				with("a", 1, "b", 2, "f", 3),
				"def f(a):\n    return a + 2\nf(2)\n");
	}

	@Test
	public void testNestedBodiesDoNotLeak() {
		assertSubstitutes("if c:\n    x = 1\nx\n", with("x", 5), "if c:\n    x = 1\n5\n");
		assertSubstitutes("while x:\n    x = 1\n    x\n", with("x", 5), "while 5:\n    x = 1\n    x\n");
	}

	@Test
	public void testImportBindsName() {
		Node module = SourceReader.parseModule("import os\nos.name\n");
		assertSame(module, Substitution.substitute(module, with("os", 1)));
		assertSubstitutes("import numpy as np\nnumpy\n", with("numpy", 1), "import numpy as np\n1\n");
	}

	@Test
	public void testAugmentedAssignment() {
		assertSubstitutes("x += y\nx\n", with("x", 1, "y", 2), "x += 2\nx\n");
		assertSubstitutes("a[i] += 1\n", with("a", new Name("b"), "i", 0), "b[0] += 1\n");
		assertSubstitutes("o.n -= k\n", with("o", new Name("p"), "k", 3), "p.n -= 3\n");
		assertSubstitutes("if c:\n    x *= 2\nx\n", with("x", 5), "if c:\n    x *= 2\n5\n");
	}

	@Test
	public void testWhileElse() {
		assertSubstitutes(
				"while x:\n    pass\nelse:\n    y = x\n    x = 0\n    x\nx\n",
				with("x", 7),
				"while 7:\n    pass\nelse:\n    y = 7\n    x = 0\n    x\n7\n");
	}

	@Test
	public void testImportFromBindsNames() {
		assertSubstitutes(
				"from m import a, b as c\na + b + c\n",
				with("a", 1, "b", 2, "c", 3),
				"from m import a, b as c\na + 2 + c\n");
		assertSubstitutes("from m import *\na\n", with("a", 1), "from m import *\n1\n");
	}

	@Test
	public void testYield() {
		assertSubstitutes("(yield x)\n(yield from y)\n", with("x", 1, "y", new Name("z")), "(yield 1)\n(yield from z)\n");
		Node bare = SourceReader.parseExpression("(yield)");
		assertSame(bare, Substitution.substitute(bare, with("x", 1)));
	}

	@Test
	public void testNamesMayBeCaptured() {
		assertSubstitutes("lambda y: x", with("x", new Name("y")), "lambda y: y");
	}

	@Test
	public void testUnchangedTreeIsReturnedAsIs() {
		Node node = SourceReader.parseExpression("a + b");
		assertSame(node, Substitution.substitute(node, with("x", 1)));
		assertSame(node, Substitution.substitute(node, Collections.<String, Node>emptyMap()));
	}

	@Test
	public void testReplacementsMustBeExpressions() {
		Node node = new Name("x");
		assertThrows(IllegalArgumentException.class, () -> Substitution.substitute(node, with("x", new Return())));
		Map<String, Node> missing = new LinkedHashMap<String, Node>();
		missing.put("x", null);
		assertThrows(IllegalArgumentException.class, () -> Substitution.substitute(node, missing));
	}

	@Test
	public void testSubstituteThenSimplify() {
		Node node = SourceReader.parseExpression("x + 2");
		assertEquals(new Atom(42), Simplifier.simplify(Substitution.substitute(node, with("x", 40))));
	}
}
