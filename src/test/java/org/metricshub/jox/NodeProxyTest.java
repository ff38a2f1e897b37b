package org.metricshub.jox;

import static org.junit.Assert.*;
import static org.metricshub.jox.builder.NodeProxy.unwrap;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.metricshub.jox.ast.Atom;
import org.metricshub.jox.ast.Attribute;
import org.metricshub.jox.ast.BinOp;
import org.metricshub.jox.ast.Call;
import org.metricshub.jox.ast.Conditional;
import org.metricshub.jox.ast.Name;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.ast.Return;
import org.metricshub.jox.ast.Sequence;
import org.metricshub.jox.ast.SequenceKind;
import org.metricshub.jox.ast.Subscript;
import org.metricshub.jox.ast.UnaryOp;
import org.metricshub.jox.builder.NodeProxy;

public class NodeProxyTest {

	private static final Node X = new Name("x");
	private static final Node Y = new Name("y");

	private static List<Node> nodes(Node... nodes) {
		return Arrays.asList(nodes);
	}

	@Test
	public void testArithmetic() {
		NodeProxy x = NodeProxy.name("x");
		assertEquals(new BinOp("+", X, new Atom(1)), unwrap(x.add(1)));
		assertEquals(new BinOp("*", new BinOp("+", X, new Atom(1)), new Atom(2)), unwrap(x.add(1).mul(2)));
		assertEquals(new BinOp("-", X, Y), unwrap(x.sub(NodeProxy.name("y"))));
		assertEquals(new BinOp("/", X, Y), unwrap(x.div(Y)));
		assertEquals(new BinOp("//", X, new Atom(2)), unwrap(x.floorDiv(2)));
		assertEquals(new BinOp("%", X, new Atom(2)), unwrap(x.mod(2)));
		assertEquals(new BinOp("**", X, new Atom(2)), unwrap(x.pow(2)));
		assertEquals(new BinOp("@", X, Y), unwrap(x.matMul(Y)));
	}

	@Test
	public void testBitwiseAndComparisons() {
		NodeProxy x = NodeProxy.name("x");
		assertEquals(new BinOp("<<", X, new Atom(1)), unwrap(x.lshift(1)));
		assertEquals(new BinOp(">>", X, new Atom(1)), unwrap(x.rshift(1)));
		assertEquals(new BinOp("&", X, new Atom(1)), unwrap(x.bitAnd(1)));
		assertEquals(new BinOp("|", X, new Atom(1)), unwrap(x.bitOr(1)));
		assertEquals(new BinOp("^", X, new Atom(1)), unwrap(x.bitXor(1)));
		assertEquals(new BinOp("==", X, new Atom(1)), unwrap(x.eq(1)));
		assertEquals(new BinOp("!=", X, new Atom(1)), unwrap(x.ne(1)));
		assertEquals(new BinOp("<", X, new Atom(1)), unwrap(x.lt(1)));
		assertEquals(new BinOp("<=", X, new Atom(1)), unwrap(x.le(1)));
		assertEquals(new BinOp(">", X, new Atom(1)), unwrap(x.gt(1)));
		assertEquals(new BinOp(">=", X, new Atom(1)), unwrap(x.ge(1)));
	}

	@Test
	public void testReflectedOperators() {
		NodeProxy x = NodeProxy.name("x");
		assertEquals(new BinOp("+", new Atom(1), X), unwrap(x.radd(1)));
		assertEquals(new BinOp("-", new Atom(1), X), unwrap(x.rsub(1)));
		assertEquals(new BinOp("*", new Atom(2), X), unwrap(x.rmul(2)));
		assertEquals(new BinOp("/", new Atom(1), X), unwrap(x.rdiv(1)));
		assertEquals(new BinOp("**", new Atom(2), X), unwrap(x.rpow(2)));
		assertEquals(new BinOp("%", new Atom(7), X), unwrap(x.rbinary("%", 7)));
	}

	@Test
	public void testUnaryOperators() {
		NodeProxy x = NodeProxy.name("x");
		assertEquals(new UnaryOp("-", X), unwrap(x.neg()));
		assertEquals(new UnaryOp("+", X), unwrap(x.pos()));
		assertEquals(new UnaryOp("~", X), unwrap(x.invert()));
		assertEquals(new UnaryOp("-", new UnaryOp("-", X)), unwrap(x.neg().neg()));
	}

	@Test
	public void testAttributeCallAndIndex() {
		NodeProxy x = NodeProxy.name("x");
		assertEquals(
				new Call(new Attribute(X, "y"), nodes(new Atom(1), new Atom(2))),
				unwrap(x.attr("y").call(1, 2)));
		assertEquals(new Call(X, nodes()), unwrap(x.call()));
		assertEquals(new Subscript(X, new Atom("k")), unwrap(x.index("k")));

		Map<String, Object> kwargs = new LinkedHashMap<String, Object>();
		kwargs.put("y", 42);
		Map<String, Node> expected = Collections.<String, Node>singletonMap("y", new Atom(42));
		NodeProxy fn = NodeProxy.name("fn");
		assertEquals(new Call(new Name("fn"), nodes(X), expected), unwrap(fn.call(Arrays.asList(x), kwargs)));
		assertThrows(MalformedNodeException.class, () -> x.attr("1abc"));
	}

	@Test
	public void testReservedWordOperatorsAreUnavailable() {
		NodeProxy x = NodeProxy.name("x");
		for (String op : new String[] { "and", "or", "is", "is not", "in", "not in" }) {
			UnsupportedProxyOperationException e = assertThrows(
					op,
					UnsupportedProxyOperationException.class,
					() -> x.binary(op, Y));
			assertEquals(op, e.getOperator());
		}
		assertThrows(UnsupportedProxyOperationException.class, () -> x.rbinary("in", Y));
		assertEquals("not", assertThrows(UnsupportedProxyOperationException.class, () -> x.unary("not")).getOperator());
	}

	@Test
	public void testUnknownOperators() {
		NodeProxy x = NodeProxy.name("x");
		assertThrows(MalformedNodeException.class, () -> x.binary("<>", 1));
		assertThrows(MalformedNodeException.class, () -> x.unary("!"));
	}

	@Test
	public void testLift() {
		NodeProxy x = NodeProxy.name("x");
		assertSame(x, NodeProxy.lift(x));
		assertEquals(new Atom(1), unwrap(NodeProxy.lift(1)));
		assertEquals(new Atom(null), unwrap(NodeProxy.lift(null)));
		assertEquals(
				new Sequence(SequenceKind.LIST, nodes(new Atom(1), X)),
				unwrap(NodeProxy.lift(Arrays.asList(1, x))));
		assertThrows(MalformedNodeException.class, () -> NodeProxy.lift(new Object()));
		assertThrows(MalformedNodeException.class, () -> NodeProxy.lift(new Return()));
		assertThrows(MalformedNodeException.class, () -> NodeProxy.form("return", 1));
	}

	@Test
	public void testForm() {
		NodeProxy cond = NodeProxy.form("ifexpr", Y, 1, 0);
		assertEquals(new Conditional(Y, new Atom(1), new Atom(0)), unwrap(cond));
		assertEquals(new BinOp("+", new Conditional(Y, new Atom(1), new Atom(0)), X), unwrap(cond.add(X)));
	}

	@Test
	public void testProxiesAreImmutable() {
		NodeProxy x = NodeProxy.name("x");
		x.add(1);
		x.neg();
		assertEquals(X, unwrap(x));
	}

	@Test
	public void testEqualityComparesWrappedNodes() {
		assertEquals(NodeProxy.name("x").add(1), NodeProxy.name("x").add(1));
		assertEquals(NodeProxy.name("x").add(1).hashCode(), NodeProxy.name("x").add(1).hashCode());
		assertNotEquals(NodeProxy.name("x"), NodeProxy.name("y"));
		assertNotEquals(NodeProxy.name("x"), X);
		assertEquals("NodeProxy(BinOp(+, Name(x), Atom(1)))", NodeProxy.name("x").add(1).toString());
	}
}
