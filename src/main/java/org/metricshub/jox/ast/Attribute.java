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
 * Attribute access {@code target.field}.
 */
public final class Attribute extends Node {

	private final Node target;
	private final String field;

	public Attribute(Node target, String field) {
		super(NodeKind.ATTRIBUTE);
		this.target = requireExpression(NodeKind.ATTRIBUTE, "target", target);
		this.field = requireIdentifier(NodeKind.ATTRIBUTE, "field", field);
	}

	public Node getTarget() {
		return target;
	}

	public String getField() {
		return field;
	}

	@Override
	public List<Node> children() {
		return Collections.singletonList(target);
	}

	@Override
	protected String dumpLabel() {
		return "Attribute ." + field;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Attribute)) {
			return false;
		}
		Attribute other = (Attribute) o;
		return field.equals(other.field) && target.equals(other.target);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.ATTRIBUTE, target, field);
	}

	@Override
	public String toString() {
		return "Attribute(" + target + ", " + field + ")";
	}
}
