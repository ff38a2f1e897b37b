package org.metricshub.jox.builder;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jox
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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jox.MalformedNodeException;
import org.metricshub.jox.UnsupportedProxyOperationException;
import org.metricshub.jox.ast.Attribute;
import org.metricshub.jox.ast.BinOp;
import org.metricshub.jox.ast.BinaryOperator;
import org.metricshub.jox.ast.Call;
import org.metricshub.jox.ast.Name;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.ast.NodeKind;
import org.metricshub.jox.ast.Subscript;
import org.metricshub.jox.ast.UnaryOp;
import org.metricshub.jox.ast.UnaryOperator;
import org.metricshub.jox.sexpr.SExpressions;

/**
 * Builder proxy: wraps exactly one expression node and turns method calls
 * standing in for operators into new nodes.
 *
 * <pre>
 * NodeProxy x = NodeProxy.name("x");
 * Node n = NodeProxy.unwrap(x.add(1).mul(2));   // (x + 1) * 2
 * </pre>
 *
 * Every operation returns a new proxy; the wrapped node is never modified.
 * {@link #equals(Object)} compares the wrapped nodes and does not build an
 * equality node: use {@link #eq(Object)} for that.
 */
public final class NodeProxy implements ExpressionOperations<NodeProxy> {

	private final Node node;

	private NodeProxy(Node node) {
		this.node = node;
	}

	/**
	 * Wraps a value. Nodes are wrapped as is, proxies are returned unchanged,
	 * Java lists become list displays and other values are lifted to atoms.
	 *
	 * @param value a node, a proxy, a list, a number, a string, a boolean or {@code null}
	 * @return the proxy
	 * @throws MalformedNodeException if the value cannot be lifted, or if it is a statement
	 */
	public static NodeProxy lift(Object value) {
		if (value instanceof NodeProxy) {
			return (NodeProxy) value;
		}
		Node lifted = SExpressions.expression(value);
		if (lifted.isStatement()) {
			throw new MalformedNodeException(lifted.kind(), "only expressions can be wrapped in a builder proxy");
		}
		return new NodeProxy(lifted);
	}

	/**
	 * @param id identifier
	 * @return a proxy wrapping {@code Name(id)}
	 */
	public static NodeProxy name(String id) {
		return new NodeProxy(new Name(id));
	}

	/**
	 * Builds a node with {@link SExpressions#build(String, Object...)} and wraps it.
	 *
	 * @param head form head
	 * @param args form arguments
	 * @return the proxy
	 */
	public static NodeProxy form(String head, Object... args) {
		return lift(SExpressions.build(head, args));
	}

	/**
	 * @param proxy a proxy
	 * @return the wrapped node
	 */
	public static Node unwrap(NodeProxy proxy) {
		return proxy.node;
	}

	/**
	 * Builds {@code this symbol other} for an overloadable binary operator.
	 *
	 * @param symbol operator symbol
	 * @param other right operand
	 * @return the proxy wrapping the new node
	 * @throws UnsupportedProxyOperationException for operators spelled as reserved words
	 */
	public NodeProxy binary(String symbol, Object other) {
		return new NodeProxy(new BinOp(overloadable(symbol), node, unwrap(lift(other))));
	}

	/**
	 * Builds {@code other symbol this}, the reflected form of {@link #binary(String, Object)}.
	 *
	 * @param symbol operator symbol
	 * @param other left operand
	 * @return the proxy wrapping the new node
	 */
	public NodeProxy rbinary(String symbol, Object other) {
		return new NodeProxy(new BinOp(overloadable(symbol), unwrap(lift(other)), node));
	}

	/**
	 * @param symbol one of {@code - + ~}
	 * @return the proxy wrapping the new node
	 * @throws UnsupportedProxyOperationException for {@code not}
	 */
	public NodeProxy unary(String symbol) {
		UnaryOperator op = UnaryOperator.fromSymbol(symbol);
		if (op == null) {
			throw new MalformedNodeException(NodeKind.UNARY_OP, "unknown unary operator " + symbol);
		}
		if (op.isReservedWord()) {
			throw new UnsupportedProxyOperationException(symbol);
		}
		return new NodeProxy(new UnaryOp(op, node));
	}

	private static BinaryOperator overloadable(String symbol) {
		BinaryOperator op = BinaryOperator.fromSymbol(symbol);
		if (op == null) {
			throw new MalformedNodeException(NodeKind.BIN_OP, "unknown binary operator " + symbol);
		}
		if (op.isReservedWord()) {
			throw new UnsupportedProxyOperationException(symbol);
		}
		return op;
	}

	@Override
	public NodeProxy add(Object other) {
		return binary("+", other);
	}

	@Override
	public NodeProxy sub(Object other) {
		return binary("-", other);
	}

	@Override
	public NodeProxy mul(Object other) {
		return binary("*", other);
	}

	@Override
	public NodeProxy div(Object other) {
		return binary("/", other);
	}

	@Override
	public NodeProxy floorDiv(Object other) {
		return binary("//", other);
	}

	@Override
	public NodeProxy mod(Object other) {
		return binary("%", other);
	}

	@Override
	public NodeProxy pow(Object other) {
		return binary("**", other);
	}

	@Override
	public NodeProxy matMul(Object other) {
		return binary("@", other);
	}

	@Override
	public NodeProxy lshift(Object other) {
		return binary("<<", other);
	}

	@Override
	public NodeProxy rshift(Object other) {
		return binary(">>", other);
	}

	@Override
	public NodeProxy bitAnd(Object other) {
		return binary("&", other);
	}

	@Override
	public NodeProxy bitOr(Object other) {
		return binary("|", other);
	}

	@Override
	public NodeProxy bitXor(Object other) {
		return binary("^", other);
	}

	@Override
	public NodeProxy eq(Object other) {
		return binary("==", other);
	}

	@Override
	public NodeProxy ne(Object other) {
		return binary("!=", other);
	}

	@Override
	public NodeProxy lt(Object other) {
		return binary("<", other);
	}

	@Override
	public NodeProxy le(Object other) {
		return binary("<=", other);
	}

	@Override
	public NodeProxy gt(Object other) {
		return binary(">", other);
	}

	@Override
	public NodeProxy ge(Object other) {
		return binary(">=", other);
	}

	@Override
	public NodeProxy radd(Object other) {
		return rbinary("+", other);
	}

	@Override
	public NodeProxy rsub(Object other) {
		return rbinary("-", other);
	}

	@Override
	public NodeProxy rmul(Object other) {
		return rbinary("*", other);
	}

	@Override
	public NodeProxy rdiv(Object other) {
		return rbinary("/", other);
	}

	@Override
	public NodeProxy rpow(Object other) {
		return rbinary("**", other);
	}

	@Override
	public NodeProxy neg() {
		return unary("-");
	}

	@Override
	public NodeProxy pos() {
		return unary("+");
	}

	@Override
	public NodeProxy invert() {
		return unary("~");
	}

	@Override
	public NodeProxy attr(String field) {
		return new NodeProxy(new Attribute(node, field));
	}

	@Override
	public NodeProxy call(Object... args) {
		List<Object> positional = new ArrayList<Object>();
		if (args != null) {
			Collections.addAll(positional, args);
		}
		return call(positional, Collections.<String, Object>emptyMap());
	}

	@Override
	public NodeProxy call(List<?> args, Map<String, ?> kwargs) {
		List<Node> positional = new ArrayList<Node>(args.size());
		for (Object arg : args) {
			positional.add(unwrap(lift(arg)));
		}
		Map<String, Node> keywords = new LinkedHashMap<String, Node>();
		for (Map.Entry<String, ?> entry : kwargs.entrySet()) {
			keywords.put(entry.getKey(), unwrap(lift(entry.getValue())));
		}
		return new NodeProxy(new Call(node, positional, keywords));
	}

	@Override
	public NodeProxy index(Object index) {
		return new NodeProxy(new Subscript(node, unwrap(lift(index))));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof NodeProxy && node.equals(((NodeProxy) o).node);
	}

	@Override
	public int hashCode() {
		return node.hashCode();
	}

	@Override
	public String toString() {
		return "NodeProxy(" + node + ")";
	}
}
