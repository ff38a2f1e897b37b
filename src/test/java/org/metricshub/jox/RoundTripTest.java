package org.metricshub.jox;

import static org.junit.Assert.assertEquals;
import static org.metricshub.jox.sexpr.SExpressions.build;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.metricshub.jox.ast.Atom;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.ast.NodeKind;
import org.metricshub.jox.ast.UnaryOp;
import org.metricshub.jox.backend.SourceEmitter;
import org.metricshub.jox.frontend.SourceReader;

/**
 * Every tree of the table is emitted, read back, and compared with the
 * original tree. The emitted text must also be stable: emitting the tree
 * read back gives the same text.
 */
@RunWith(Parameterized.class)
public class RoundTripTest {

	private static Node n(String id) {
		return build("name", id);
	}

	private static List<Object[]> cases;

	private static void add(String name, Node node) {
		cases.add(new Object[] { name, node });
	}

	/**
	 * @return the trees to check, with a display name
	 */
	@Parameters(name = "{0}")
	public static Iterable<Object[]> trees() {
		cases = new ArrayList<Object[]>();

		// literals
		add("integer", new Atom(42));
		add("negative integer", new Atom(-5));
		add("min long", new Atom(Long.MIN_VALUE));
		add("float", new Atom(1.5));
		add("small float", new Atom(1e-5));
		add("large float", new Atom(1.7976931348623157E308));
		add("negative zero", new Atom(-0.0));
		add("booleans and none", build("tuple", true, false, null));
		add("string escapes", new Atom("it's \"quoted\"\n\t\\ \0\177"));
		add("unicode string", new Atom("\u00e9\u4e2d\ud83d\ude00"));
		add("empty string", new Atom(""));

		// operators
		add("sum then product", build("*", build("+", 2, 3), 4));
		add("product then sum", build("+", 2, build("*", 3, 4)));
		add("left nested minus", build("-", build("-", n("a"), n("b")), n("c")));
		add("right nested minus", build("-", n("a"), build("-", n("b"), n("c"))));
		add("right nested power", build("**", n("a"), build("**", n("b"), n("c"))));
		add("left nested power", build("**", build("**", n("a"), n("b")), n("c")));
		add("bit operators", build("|", build("^", n("a"), build("&", n("b"), build("<<", n("c"), 1))), build(">>", n("d"), 2)));
		add("all arithmetic", build("-", build("+", build("%", build("//", build("/", build("*", n("a"), n("b")), n("c")), n("d")), n("e")), build("@", n("f"), n("g"))), n("h")));
		add("nested or", build("or", build("or", n("a"), n("b")), n("c")));
		add("and inside or", build("or", build("and", n("a"), n("b")), build("and", n("c"), n("d"))));
		add("or inside and", build("and", build("or", n("a"), n("b")), n("c")));
		for (String op : new String[] { "==", "!=", "<", "<=", ">", ">=", "is", "is not", "in", "not in" }) {
			add("comparison " + op, build(op, n("a"), n("b")));
		}
		add("left nested comparison", build("<", build("<", n("a"), n("b")), n("c")));
		add("right nested comparison", build("==", n("a"), build("==", n("b"), n("c"))));
		add("not of comparison", build("not", build("in", n("a"), n("b"))));
		add("comparison of not", build("==", build("not", n("a")), n("b")));
		add("not not", build("not", build("not", n("a"))));

		// unary and negative literals
		add("neg of name", build("-", n("x")));
		add("neg of literal", build("-", 5));
		add("neg of float literal", build("-", 2.5));
		add("neg of negative literal", new UnaryOp("-", new Atom(-5)));
		add("pos of negative literal", new UnaryOp("+", new Atom(-5)));
		add("invert of negative literal", new UnaryOp("~", new Atom(-5)));
		add("neg of power", build("-", build("**", 5, n("x"))));
		add("power of neg", build("**", build("-", n("a")), n("b")));
		add("power of negative literal", build("**", -5, 2));
		add("negative exponent", build("**", 2, -1));
		add("neg exponent of neg literal", build("**", 2, build("-", 5)));
		add("power chain with negative base", build("**", 2, build("**", -5, 3)));
		add("minus negative literal", build("-", n("x"), -5));
		add("negative literal times", build("*", -5, n("x")));
		add("double neg", build("-", build("-", n("x"))));
		add("neg of sum", build("-", build("+", n("a"), n("b"))));
		add("negative literal call", build("call", -5));

		// postfix
		Map<String, Object> kwargs = new LinkedHashMap<String, Object>();
		kwargs.put("y", 42);
		kwargs.put("z", build("lambda", Collections.emptyList(), 1));
		add("call with keywords", build("call", n("fn"), n("x"), build("ifexpr", n("c"), 1, 2), kwargs));
		add("call without arguments", build("call", n("fn")));
		add("attribute of integer", build("attr", 42, "y"));
		add("attribute of negative integer", build("attr", -42, "y"));
		add("attribute of float", build("attr", 1.5, "real"));
		add("attribute of string", build("attr", "s", "upper"));
		add("attribute of sum", build("attr", build("+", n("a"), n("b")), "c"));
		add("method chain", build("index", build("call", build("attr", n("x"), "f"), 1), build("tuple", 1, 2)));
		add("index by empty tuple", build("index", n("a"), build("tuple")));
		add("call of lambda", build("call", build("lambda", Arrays.asList("x"), n("x")), 1));
		add("call of conditional", build("call", build("ifexpr", n("c"), n("f"), n("g"))));

		// displays
		add("empty list", build("list"));
		add("empty tuple", build("tuple"));
		add("single tuple", build("tuple", 1));
		add("nested displays", build("list", build("tuple", 1), build("set", n("a"), build("list")), build("tuple", build("tuple"))));

		// conditional and lambda
		add("conditional", build("ifexpr", n("c"), n("x"), n("y")));
		add("conditional in then", build("ifexpr", n("c"), build("ifexpr", n("d"), n("a"), n("b")), n("e")));
		add("conditional in test", build("ifexpr", build("ifexpr", n("d"), n("a"), n("b")), n("x"), n("y")));
		add("conditional in else", build("ifexpr", n("c"), n("a"), build("ifexpr", n("d"), n("b"), n("e"))));
		add("lambda in else", build("ifexpr", n("c"), n("a"), build("lambda", Arrays.asList("x"), n("x"))));
		add("lambda in then", build("ifexpr", n("c"), build("lambda", Collections.emptyList(), 1), n("a")));
		add("conditional operand", build("+", build("ifexpr", n("c"), 1, 2), 3));
		add("lambda", build("lambda", Arrays.asList("x", "y"), build("+", n("x"), n("y"))));
		add("lambda returning conditional", build("lambda", Arrays.asList("x"), build("ifexpr", n("x"), 1, 2)));
		add("lambda returning lambda", build("lambda", Arrays.asList("x"), build("lambda", Arrays.asList("y"), n("x"))));
		add("lambda operand", build("or", build("lambda", Collections.emptyList(), 1), n("a")));
		add("lambdas in tuple", build("tuple", build("lambda", Arrays.asList("x", "y"), n("x")), 2));

		// statements
		add("assign", build("=", n("x"), 1));
		add("assign tuple", build("=", build("tuple", n("a"), n("b")), build("tuple", n("b"), n("a"))));
		add("assign nested target", build("=", build("list", n("a"), build("tuple", n("b"), n("c"))), n("d")));
		add("assign attribute", build("=", build("attr", n("obj"), "field"), build("-", 5)));
		add("assign subscript", build("=", build("index", n("a"), build("+", n("i"), 1)), build("list")));
		add("expression statement", build("call", build("attr", n("os"), "getcwd")));
		add("conditional statement", build("ifexpr", n("c"), n("a"), n("b")));
		add("lambda statement", build("lambda", Collections.emptyList(), 1));
		add("return", build("return"));
		add("return value", build("return", build("tuple", 1, 2)));
		add("import", build("import", "os.path"));
		add("import alias", build("import", "numpy", "np"));
		add("delete", build("del", n("a"), build("index", n("b"), 0), build("attr", n("c"), "d")));
		add("delete tuple", build("del", build("tuple", n("a"), n("b"))));
		add("calc", build("def", "calc", Arrays.asList("x"), build("return", build("+", 42, n("x")))));
		add("empty function", build("def", "f", Collections.emptyList(), Collections.emptyList()));
		add("if", build("if", n("a"), build("=", n("x"), 1)));
		add("if with empty body", build("if", n("a"), Collections.emptyList(), build("break")));
		add("if elif else", build("if", n("a"), n("x"), build("if", n("b"), n("y"), build("if", n("c"), n("z"), n("w")))));
		add("if else if", build("if", n("a"), n("x"), Arrays.asList(build("if", n("b"), n("y")), n("z"))));
		add("nested if with else", build("if", n("a"), build("if", n("b"), n("x")), n("y")));
		add("while", build("while", build("<", n("i"), 10), Arrays.asList(
				build("=", n("i"), build("+", n("i"), 1)),
				build("if", build("==", build("%", n("i"), 2), 0), build("continue")),
				build("break"))));
		add("while else", build("while", n("c"), build("break"), Arrays.asList(build("=", n("x"), 1), build("return", n("x")))));
		add("while else inside if else", build("if", n("a"), build("while", n("b"), n("x"), n("y")), n("z")));
		add("augmented assign", build("+=", n("x"), 1));
		add("augmented assign subscript", build("**=", build("index", n("a"), n("i")), build("-", 2)));
		add("augmented assign attribute", build(">>=", build("attr", n("o"), "bits"), build("tuple", 1, 2)));
		add("augmented assign conditional", build("%=", n("x"), build("ifexpr", n("c"), 2, 3)));
		add("import from", build("from", "os.path", "join", Collections.singletonMap("exists", "present")));
		add("relative import", build("from", "..pkg", "a"));
		add("relative import of package", build("from", ".", "sibling"));
		add("wildcard import", build("from", "m", "*"));
		add("yield", build("yield"));
		add("yield value", build("yield", build("tuple", 1, 2)));
		add("yield from", build("yield from", build("call", n("gen"))));
		add("yield operand", build("+", build("yield", n("x")), build("-", build("yield from", n("g")))));
		add("yield assigned", build("=", n("y"), build("yield", build("lambda", Collections.emptyList(), 1))));
		add("generator", build("def", "count", Arrays.asList("n"), Arrays.asList(
				build("=", n("i"), 0),
				build("while", build("<", n("i"), n("n")), Arrays.asList(build("yield", n("i")), build("+=", n("i"), 1)), build("return", n("i"))))));
		add("nested definitions", build("def", "outer", Arrays.asList("a", "b"), Arrays.asList(
				build("import", "math"),
				build("def", "inner", Arrays.asList("c"), build("return", build("*", n("a"), n("c")))),
				build("while", true, build("return", build("call", n("inner"), n("b")))))));
		add("module", build("do",
				build("import", "numpy", "np"),
				build("=", n("x"), build("call", build("attr", n("np"), "zeros"), 3)),
				build("def", "f", Arrays.asList("y"), build("return", build("-", n("y")))),
				build("call", n("f"), n("x"))));
		add("single statement module", build("do", build("=", n("x"), 1)));
		add("empty module", build("do"));
		return cases;
	}

	/** Name of the case */
	@Parameter(0)
	public String name;

	/** Tree to emit and read back */
	@Parameter(1)
	public Node node;

	private static Node read(Node original, String text) {
		// a one-statement module reads back as its statement
		return original.kind() == NodeKind.BLOCK ? SourceReader.parseModule(text) : SourceReader.parse(text);
	}

	@Test
	public void test() {
		String text = SourceEmitter.emit(node);
		Node read = read(node, text);
		assertEquals(text, node, read);
		assertEquals(text, SourceEmitter.emit(read));
	}
}
