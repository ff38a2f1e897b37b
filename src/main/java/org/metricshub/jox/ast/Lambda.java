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
 * Anonymous function {@code lambda params: body}.
 */
public final class Lambda extends Node {

	private final List<String> params;
	private final Node body;

	public Lambda(List<String> params, Node body) {
		super(NodeKind.LAMBDA);
		this.params = requireParameters(NodeKind.LAMBDA, params);
		this.body = requireExpression(NodeKind.LAMBDA, "body", body);
	}

	public List<String> getParams() {
		return params;
	}

	public Node getBody() {
		return body;
	}

	@Override
	public List<Node> children() {
		return Collections.singletonList(body);
	}

	@Override
	protected String dumpLabel() {
		return "Lambda " + params;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Lambda)) {
			return false;
		}
		Lambda other = (Lambda) o;
		return params.equals(other.params) && body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.LAMBDA, params, body);
	}

	@Override
	public String toString() {
		return "Lambda(" + params + ", " + body + ")";
	}
}
