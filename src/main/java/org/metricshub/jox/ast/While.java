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
 * Loop statement {@code while test: body}, with an optional {@code else}
 * body run when the test turns false.
 */
public final class While extends Node {

	private final Node test;
	private final List<Node> body;
	private final List<Node> otherwise;

	public While(Node test, List<? extends Node> body) {
		this(test, body, Collections.<Node>emptyList());
	}

	public While(Node test, List<? extends Node> body, List<? extends Node> otherwise) {
		super(NodeKind.WHILE);
		this.test = requireExpression(NodeKind.WHILE, "test", test);
		this.body = requireBody(NodeKind.WHILE, "body", body);
		this.otherwise = requireBody(NodeKind.WHILE, "else body", otherwise);
	}

	public Node getTest() {
		return test;
	}

	public List<Node> getBody() {
		return body;
	}

	/**
	 * @return the {@code else} body, empty when there is none
	 */
	public List<Node> getOtherwise() {
		return otherwise;
	}

	@Override
	public List<Node> children() {
		List<Node> children = new ArrayList<Node>(1 + body.size() + otherwise.size());
		children.add(test);
		children.addAll(body);
		children.addAll(otherwise);
		return Collections.unmodifiableList(children);
	}

	@Override
	protected String dumpLabel() {
		return otherwise.isEmpty() ? "While" : "While body=" + body.size() + " else=" + otherwise.size();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof While)) {
			return false;
		}
		While other = (While) o;
		return test.equals(other.test) && body.equals(other.body) && otherwise.equals(other.otherwise);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.WHILE, test, body, otherwise);
	}

	@Override
	public String toString() {
		if (otherwise.isEmpty()) {
			return "While(" + test + ", " + join(body) + ")";
		}
		return "While(" + test + ", " + join(body) + ", " + join(otherwise) + ")";
	}
}
