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
 * Reference to a variable. The node carries the identifier only; whether it
 * is bound is decided by the enclosing scopes at analysis time.
 */
public final class Name extends Node {

	private final String id;

	public Name(String id) {
		super(NodeKind.NAME);
		this.id = requireIdentifier(NodeKind.NAME, "name", id);
	}

	public String getId() {
		return id;
	}

	@Override
	public List<Node> children() {
		return Collections.emptyList();
	}

	@Override
	protected String dumpLabel() {
		return "Name " + id;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof Name && id.equals(((Name) o).id);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.NAME, id);
	}

	@Override
	public String toString() {
		return "Name(" + id + ")";
	}
}
