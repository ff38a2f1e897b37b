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

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.metricshub.jox.MalformedNodeException;

/**
 * Prefix operator applied to one operand.
 */
public final class UnaryOp extends Node {

	private final UnaryOperator operator;
	private final Node operand;

	public UnaryOp(UnaryOperator operator, Node operand) {
		super(NodeKind.UNARY_OP);
		if (operator == null) {
			throw new MalformedNodeException(NodeKind.UNARY_OP, "operator must not be null");
		}
		this.operator = operator;
		this.operand = requireExpression(NodeKind.UNARY_OP, "operand", operand);
	}

	/**
	 * @param symbol one of {@code not - + ~}
	 * @param operand the operand expression
	 */
	public UnaryOp(String symbol, Node operand) {
		this(lookup(symbol), operand);
	}

	private static UnaryOperator lookup(String symbol) {
		UnaryOperator op = UnaryOperator.fromSymbol(symbol);
		if (op == null) {
			throw new MalformedNodeException(NodeKind.UNARY_OP, "unknown unary operator " + symbol);
		}
		return op;
	}

	public UnaryOperator getOperator() {
		return operator;
	}

	public Node getOperand() {
		return operand;
	}

	@Override
	public List<Node> children() {
		return Collections.singletonList(operand);
	}

	@Override
	protected String dumpLabel() {
		return "UnaryOp " + operator.symbol();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof UnaryOp)) {
			return false;
		}
		UnaryOp other = (UnaryOp) o;
		return operator == other.operator && operand.equals(other.operand);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.UNARY_OP, operator, operand);
	}

	@Override
	public String toString() {
		return "UnaryOp(" + operator.symbol() + ", " + operand + ")";
	}
}
