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
 * Conditional expression {@code then if test else otherwise}.
 */
public final class Conditional extends Node {

	private final Node test;
	private final Node then;
	private final Node otherwise;

	public Conditional(Node test, Node then, Node otherwise) {
		super(NodeKind.CONDITIONAL);
		this.test = requireExpression(NodeKind.CONDITIONAL, "test", test);
		this.then = requireExpression(NodeKind.CONDITIONAL, "then branch", then);
		this.otherwise = requireExpression(NodeKind.CONDITIONAL, "else branch", otherwise);
	}

	public Node getTest() {
		return test;
	}

	public Node getThen() {
		return then;
	}

	public Node getOtherwise() {
		return otherwise;
	}

	@Override
	public List<Node> children() {
		return Collections.unmodifiableList(Arrays.asList(test, then, otherwise));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Conditional)) {
			return false;
		}
		Conditional other = (Conditional) o;
		return test.equals(other.test) && then.equals(other.then) && otherwise.equals(other.otherwise);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.CONDITIONAL, test, then, otherwise);
	}

	@Override
	public String toString() {
		return "Conditional(" + test + ", " + then + ", " + otherwise + ")";
	}
}
