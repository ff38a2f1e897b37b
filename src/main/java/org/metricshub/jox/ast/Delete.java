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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.metricshub.jox.MalformedNodeException;

/**
 * Deletion statement {@code del target, ...}.
 */
public final class Delete extends Node {

	private final List<Node> targets;

	public Delete(List<? extends Node> targets) {
		super(NodeKind.DELETE);
		if (targets == null || targets.isEmpty()) {
			throw new MalformedNodeException(NodeKind.DELETE, "at least one target is required");
		}
		List<Node> copy = new ArrayList<Node>(targets.size());
		for (Node target : targets) {
			copy.add(requireTarget(NodeKind.DELETE, target));
		}
		this.targets = Collections.unmodifiableList(copy);
	}

	public List<Node> getTargets() {
		return targets;
	}

	@Override
	public List<Node> children() {
		return targets;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof Delete && targets.equals(((Delete) o).targets);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.DELETE, targets);
	}

	@Override
	public String toString() {
		return "Delete(" + join(targets) + ")";
	}
}
