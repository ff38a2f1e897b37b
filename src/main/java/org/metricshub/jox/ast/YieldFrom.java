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
 * Delegating yield expression {@code (yield from value)}.
 */
public final class YieldFrom extends Node {

	private final Node value;

	public YieldFrom(Node value) {
		super(NodeKind.YIELD_FROM);
		this.value = requireExpression(NodeKind.YIELD_FROM, "value", value);
	}

	public Node getValue() {
		return value;
	}

	@Override
	public List<Node> children() {
		return Collections.singletonList(value);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof YieldFrom && value.equals(((YieldFrom) o).value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.YIELD_FROM, value);
	}

	@Override
	public String toString() {
		return "YieldFrom(" + value + ")";
	}
}
