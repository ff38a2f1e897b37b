package org.metricshub.jox.ast;

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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.metricshub.jox.MalformedNodeException;

/**
 * Infix operator applied to two operands. Boolean operators and comparisons
 * are binary operations too.
 */
public final class BinOp extends Node {

	private final BinaryOperator operator;
	private final Node left;
	private final Node right;

	public BinOp(BinaryOperator operator, Node left, Node right) {
		super(NodeKind.BIN_OP);
		if (operator == null) {
			throw new MalformedNodeException(NodeKind.BIN_OP, "operator must not be null");
		}
		this.operator = operator;
		this.left = requireExpression(NodeKind.BIN_OP, "left operand", left);
		this.right = requireExpression(NodeKind.BIN_OP, "right operand", right);
	}

	/**
	 * @param symbol the operator as written in source, e.g. {@code "+"} or {@code "not in"}
	 * @param left left operand
	 * @param right right operand
	 */
	public BinOp(String symbol, Node left, Node right) {
		this(lookup(symbol), left, right);
	}

	private static BinaryOperator lookup(String symbol) {
		BinaryOperator op = BinaryOperator.fromSymbol(symbol);
		if (op == null) {
			throw new MalformedNodeException(NodeKind.BIN_OP, "unknown binary operator " + symbol);
		}
		return op;
	}

	public BinaryOperator getOperator() {
		return operator;
	}

	public Node getLeft() {
		return left;
	}

	public Node getRight() {
		return right;
	}

	@Override
	public List<Node> children() {
		return Collections.unmodifiableList(Arrays.asList(left, right));
	}

	@Override
	protected String dumpLabel() {
		return "BinOp " + operator.symbol();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof BinOp)) {
			return false;
		}
		BinOp other = (BinOp) o;
		return operator == other.operator && left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.BIN_OP, operator, left, right);
	}

	@Override
	public String toString() {
		return "BinOp(" + operator.symbol() + ", " + left + ", " + right + ")";
	}
}
