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
 * Augmented assignment statement {@code target op= value}, e.g.
 * {@code x += 1}. The operator is an arithmetic or bitwise operator and the
 * target a name, an attribute or a subscript.
 */
public final class Inplace extends Node {

	private final BinaryOperator operator;
	private final Node target;
	private final Node value;

	public Inplace(BinaryOperator operator, Node target, Node value) {
		super(NodeKind.INPLACE);
		if (operator == null) {
			throw new MalformedNodeException(NodeKind.INPLACE, "operator must not be null");
		}
		if (!operator.isAugmentable()) {
			throw new MalformedNodeException(NodeKind.INPLACE, "no augmented assignment for operator " + operator.symbol());
		}
		if (target != null && target.kind() == NodeKind.SEQUENCE) {
			throw new MalformedNodeException(NodeKind.INPLACE, "cannot target a sequence display");
		}
		this.operator = operator;
		this.target = requireTarget(NodeKind.INPLACE, target);
		this.value = requireExpression(NodeKind.INPLACE, "value", value);
	}

	public BinaryOperator getOperator() {
		return operator;
	}

	public Node getTarget() {
		return target;
	}

	public Node getValue() {
		return value;
	}

	/**
	 * @return the statement symbol, e.g. {@code "+="}
	 */
	public String symbol() {
		return operator.symbol() + "=";
	}

	@Override
	public List<Node> children() {
		return Collections.unmodifiableList(Arrays.asList(target, value));
	}

	@Override
	protected String dumpLabel() {
		return "Inplace " + symbol();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Inplace)) {
			return false;
		}
		Inplace other = (Inplace) o;
		return operator == other.operator && target.equals(other.target) && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.INPLACE, operator, target, value);
	}

	@Override
	public String toString() {
		return "Inplace(" + symbol() + ", " + target + ", " + value + ")";
	}
}
