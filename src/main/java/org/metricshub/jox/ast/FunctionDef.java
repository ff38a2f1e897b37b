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

import java.util.List;
import java.util.Objects;

/**
 * Function definition {@code def name(params): body}.
 */
public final class FunctionDef extends Node {

	private final String name;
	private final List<String> params;
	private final List<Node> body;

	public FunctionDef(String name, List<String> params, List<? extends Node> body) {
		super(NodeKind.FUNCTION_DEF);
		this.name = requireIdentifier(NodeKind.FUNCTION_DEF, "function name", name);
		this.params = requireParameters(NodeKind.FUNCTION_DEF, params);
		this.body = requireBody(NodeKind.FUNCTION_DEF, "body", body);
	}

	public String getName() {
		return name;
	}

	public List<String> getParams() {
		return params;
	}

	public List<Node> getBody() {
		return body;
	}

	@Override
	public List<Node> children() {
		return body;
	}

	@Override
	protected String dumpLabel() {
		return "FunctionDef " + name + params;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FunctionDef)) {
			return false;
		}
		FunctionDef other = (FunctionDef) o;
		return name.equals(other.name) && params.equals(other.params) && body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.FUNCTION_DEF, name, params, body);
	}

	@Override
	public String toString() {
		return "FunctionDef(" + name + ", " + params + ", " + join(body) + ")";
	}
}
