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

/**
 * Conditional statement. An {@code elif} chain is an {@code If} whose else
 * branch holds a single {@code If}.
 */
public final class If extends Node {

	private final Node test;
	private final List<Node> then;
	private final List<Node> otherwise;

	public If(Node test, List<? extends Node> then) {
		this(test, then, Collections.<Node>emptyList());
	}

	public If(Node test, List<? extends Node> then, List<? extends Node> otherwise) {
		super(NodeKind.IF);
		this.test = requireExpression(NodeKind.IF, "test", test);
		this.then = requireBody(NodeKind.IF, "then branch", then);
		this.otherwise = requireBody(NodeKind.IF, "else branch", otherwise);
	}

	public Node getTest() {
		return test;
	}

	public List<Node> getThen() {
		return then;
	}

	/**
	 * @return the else branch, empty when there is none
	 */
	public List<Node> getOtherwise() {
		return otherwise;
	}

	@Override
	public List<Node> children() {
		List<Node> children = new ArrayList<Node>(1 + then.size() + otherwise.size());
		children.add(test);
		children.addAll(then);
		children.addAll(otherwise);
		return Collections.unmodifiableList(children);
	}

	@Override
	protected String dumpLabel() {
		return "If then=" + then.size() + " else=" + otherwise.size();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof If)) {
			return false;
		}
		If other = (If) o;
		return test.equals(other.test) && then.equals(other.then) && otherwise.equals(other.otherwise);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.IF, test, then, otherwise);
	}

	@Override
	public String toString() {
		return "If(" + test + ", " + join(then) + ", " + join(otherwise) + ")";
	}
}
