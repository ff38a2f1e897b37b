package org.metricshub.jox;

import static org.junit.Assert.*;
import static org.metricshub.jox.sexpr.SExpressions.build;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.junit.Test;
import org.metricshub.jox.analysis.FreeVariables;
import org.metricshub.jox.analysis.Scope;
import org.metricshub.jox.ast.Atom;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.frontend.SourceReader;

public class FreeVariablesTest {

	private static Node n(String id) {
		return build("name", id);
	}

	private static Set<String> names(String... ids) {
		return new LinkedHashSet<String>(Arrays.asList(ids));
	}

	private static Set<String> freeIn(String source) {
		return FreeVariables.of(SourceReader.parseModule(source));
	}

	@Test
	public void testExpression() {
		assertEquals(names("x", "y"), FreeVariables.of(build("+", n("x"), build("*", n("y"), n("x")))));
		assertEquals(names(), FreeVariables.of(new Atom(42)));
		assertEquals(names("x"), FreeVariables.of(build("attr", n("x"), "y")));
	}

	@Test
	public void testFirstOccurrenceOrder() {
		assertEquals(Arrays.asList("b", "a", "c"), new ArrayList<String>(freeIn("b + a * b + c")));
	}

	@Test
	public void testLambdaBindsParameters() {
		assertEquals(names("y"), FreeVariables.of(build("lambda", Arrays.asList("x"), build("+", n("x"), n("y")))));
		assertEquals(names("x"), FreeVariables.of(build("+", build("lambda", Arrays.asList("x"), n("x")), n("x"))));
		assertEquals(names(), FreeVariables.of(build("lambda", Arrays.asList("x"), build("lambda", Arrays.asList("y"), build("+", n("x"), n("y"))))));
	}

	@Test
	public void testAssignmentBindsFollowingStatements() {
		assertEquals(names("y"), freeIn("x = 1\nx + y\n"));
		assertEquals(names("x"), freeIn("y = x + 1\n"));
		assertEquals(names("x"), freeIn("x = x + 1\n"));
		assertEquals(names("x"), freeIn("x\nx = 1\n"));
		assertEquals(names("c"), freeIn("(a, b) = (1, 2)\na + b + c\n"));
		assertEquals(names("c"), freeIn("[a, (b, d)] = c\na + b + d\n"));
	}

	@Test
	public void testAttributeAndSubscriptTargetsAreReferences() {
		assertEquals(names("v", "obj"), freeIn("obj.field = v\n"));
		assertEquals(names("a", "i"), freeIn("a[i] = 1\n"));
		assertEquals(names("a"), freeIn("a.b.c = 1\n"));
	}

	@Test
	public void testFunctionDefinition() {
		assertEquals(names("b"), freeIn("def f(a):\n    return a + b\n"));
		assertEquals(names(), freeIn("def fact(n):\n    return fact(n - 1)\n"));
		assertEquals(names(), freeIn("def f():\n    return 1\nf()\n"));
		assertEquals(names("z"), freeIn("def f():\n    z = 1\nz\n"));
		assertEquals(names("a"), freeIn("def f(a):\n    return a\na\n"));
	}

	@Test
	public void testNestedBodiesDoNotLeak() {
		assertEquals(names("c", "a"), freeIn("if c:\n    a = 1\na\n"));
		assertEquals(names("c", "a"), freeIn("while c:\n    a = 1\na\n"));
		assertEquals(names("c"), freeIn("if c:\n    a = 1\n    a\nelse:\n    b = 2\n    b\n"));
		assertEquals(names("c", "b"), freeIn("if c:\n    b = 1\nelse:\n    b\n"));
	}

	@Test
	public void testImportBindsName() {
		assertEquals(names(), freeIn("import os.path\nos.getcwd()\n"));
		assertEquals(names("x", "numpy"), freeIn("import numpy as np\nnp.array(x)\nnumpy\n"));
	}

	@Test
	public void testAugmentedAssignmentReadsItsTarget() {
		assertEquals(names("x"), freeIn("x += 1\n"));
		assertEquals(names("y", "x"), freeIn("x -= y\nx\n"));
		assertEquals(names(), freeIn("x = 0\nx += 1\nx\n"));
		assertEquals(Arrays.asList("v", "a", "i"), new ArrayList<String>(freeIn("a[i] *= v\n")));
		assertEquals(names("obj"), freeIn("obj.count += 1\n"));
		assertEquals(names("n"), freeIn("def f():\n    n += 1\n"));
	}

	@Test
	public void testWhileElseIsANestedBody() {
		assertEquals(names("c", "b", "a"), freeIn("while c:\n    pass\nelse:\n    a = 1\n    a\n    b\na\n"));
		assertEquals(names("c", "x", "a"), freeIn("while c:\n    x\nelse:\n    a = 1\na\n"));
	}

	@Test
	public void testImportFromBindsNames() {
		assertEquals(names(), freeIn("from os.path import join, exists as present\njoin(present)\n"));
		assertEquals(names("exists"), freeIn("from os.path import exists as present\nexists\n"));
		assertEquals(names("x"), freeIn("from m import *\nx\n"));
		assertEquals(names(), freeIn("from . import sibling\nsibling\n"));
	}

	@Test
	public void testYieldValues() {
		assertEquals(names("x"), freeIn("(yield x)\n"));
		assertEquals(names("gen"), freeIn("y = (yield from gen)\ny\n"));
		assertEquals(names(), freeIn("(yield)\n"));
	}

	@Test
	public void testOtherStatements() {
		assertEquals(names("x"), freeIn("del x\n"));
		assertEquals(names("a", "i"), freeIn("del a[i]\n"));
		assertEquals(names("f", "b"), freeIn("f(a=b)\n"));
		assertEquals(names("x"), freeIn("return x\n"));
		assertEquals(names("c"), freeIn("while c:\n    break\n    continue\n"));
	}

	@Test
	public void testEnclosingScope() {
		assertEquals(names("y"), FreeVariables.of(build("+", n("x"), n("y")), Scope.of("x")));
		assertEquals(names(), FreeVariables.of(build("+", n("x"), n("y")), Scope.empty().bindAll(Arrays.asList("x", "y"))));
	}

	@Test
	public void testResultIsUnmodifiable() {
		Set<String> free = FreeVariables.of(n("x"));
		assertThrows(UnsupportedOperationException.class, () -> free.add("y"));
	}

	@Test
	public void testScope() {
		Scope scope = Scope.of("a");
		assertSame(scope, scope.bind("a"));
		assertTrue(scope.bind("b").isBound("b"));
		assertFalse(scope.isBound("b"));
		assertSame(Scope.empty(), Scope.empty().bindAll(Collections.<String>emptyList()));
		assertEquals("Scope[b, a]", scope.bind("b").toString());
	}
}
