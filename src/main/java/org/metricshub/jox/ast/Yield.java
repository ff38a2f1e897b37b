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

/**
 * Yield expression {@code (yield value)}, or {@code (yield)} without a value.
 */
public final class Yield extends Node {

	private final Node value;

	public Yield() {
		this(null);
	}

	public Yield(Node value) {
		super(NodeKind.YIELD);
		this.value = value == null ? null : requireExpression(NodeKind.YIELD, "value", value);
	}

	/**
	 * @return the yielded expression, {@code null} for a bare {@code yield}
	 */
	public Node getValue() {
		return value;
	}

	@Override
	public List<Node> children() {
		return value == null ? Collections.<Node>emptyList() : Collections.singletonList(value);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof Yield && Objects.equals(value, ((Yield) o).value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.YIELD, value);
	}

	@Override
	public String toString() {
		return value == null ? "Yield()" : "Yield(" + value + ")";
	}
}
