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

/**
 * Assignment statement {@code target = value}. The target is a name, an
 * attribute, a subscript, or a list or tuple of targets to unpack into.
 */
public final class Assign extends Node {

	private final Node target;
	private final Node value;

	public Assign(Node target, Node value) {
		super(NodeKind.ASSIGN);
		this.target = requireTarget(NodeKind.ASSIGN, target);
		this.value = requireExpression(NodeKind.ASSIGN, "value", value);
	}

	public Node getTarget() {
		return target;
	}

	public Node getValue() {
		return value;
	}

	@Override
	public List<Node> children() {
		return Collections.unmodifiableList(Arrays.asList(target, value));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Assign)) {
			return false;
		}
		Assign other = (Assign) o;
		return target.equals(other.target) && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.ASSIGN, target, value);
	}

	@Override
	public String toString() {
		return "Assign(" + target + ", " + value + ")";
	}
}
