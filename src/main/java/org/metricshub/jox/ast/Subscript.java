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
 * Index access {@code target[index]}.
 */
public final class Subscript extends Node {

	private final Node target;
	private final Node index;

	public Subscript(Node target, Node index) {
		super(NodeKind.SUBSCRIPT);
		this.target = requireExpression(NodeKind.SUBSCRIPT, "target", target);
		this.index = requireExpression(NodeKind.SUBSCRIPT, "index", index);
	}

	public Node getTarget() {
		return target;
	}

	public Node getIndex() {
		return index;
	}

	@Override
	public List<Node> children() {
		return Collections.unmodifiableList(Arrays.asList(target, index));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Subscript)) {
			return false;
		}
		Subscript other = (Subscript) o;
		return target.equals(other.target) && index.equals(other.index);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.SUBSCRIPT, target, index);
	}

	@Override
	public String toString() {
		return "Subscript(" + target + ", " + index + ")";
	}
}
