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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.metricshub.jox.MalformedNodeException;

/**
 * Function call with positional arguments followed by keyword arguments.
 * Keyword arguments keep their insertion order, which is part of the
 * node's identity: {@code f(a=1, b=2)} and {@code f(b=2, a=1)} differ.
 */
public final class Call extends Node {

	private final Node callee;
	private final List<Node> args;
	private final Map<String, Node> kwargs;

	public Call(Node callee, List<? extends Node> args) {
		this(callee, args, Collections.<String, Node>emptyMap());
	}

	public Call(Node callee, List<? extends Node> args, Map<String, ? extends Node> kwargs) {
		super(NodeKind.CALL);
		this.callee = requireExpression(NodeKind.CALL, "callee", callee);
		this.args = requireExpressions(NodeKind.CALL, "argument", args);
		if (kwargs == null) {
			throw new MalformedNodeException(NodeKind.CALL, "keyword arguments must not be null");
		}
		Map<String, Node> copy = new LinkedHashMap<String, Node>();
		for (Map.Entry<String, ? extends Node> entry : kwargs.entrySet()) {
			requireIdentifier(NodeKind.CALL, "keyword", entry.getKey());
			copy.put(entry.getKey(), requireExpression(NodeKind.CALL, "keyword argument " + entry.getKey(), entry.getValue()));
		}
		this.kwargs = Collections.unmodifiableMap(copy);
	}

	public Node getCallee() {
		return callee;
	}

	public List<Node> getArgs() {
		return args;
	}

	/**
	 * @return the keyword arguments, in insertion order
	 */
	public Map<String, Node> getKwargs() {
		return kwargs;
	}

	@Override
	public List<Node> children() {
		List<Node> children = new ArrayList<Node>(1 + args.size() + kwargs.size());
		children.add(callee);
		children.addAll(args);
		children.addAll(kwargs.values());
		return Collections.unmodifiableList(children);
	}

	@Override
	protected String dumpLabel() {
		return kwargs.isEmpty() ? "Call" : "Call " + kwargs.keySet();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Call)) {
			return false;
		}
		Call other = (Call) o;
		return callee.equals(other.callee)
				&& args.equals(other.args)
				&& new ArrayList<Map.Entry<String, Node>>(kwargs.entrySet())
						.equals(new ArrayList<Map.Entry<String, Node>>(other.kwargs.entrySet()));
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.CALL, callee, args, kwargs);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("Call(").append(callee).append(", ").append(join(args));
		if (!kwargs.isEmpty()) {
			sb.append(", {");
			boolean first = true;
			for (Map.Entry<String, Node> entry : kwargs.entrySet()) {
				if (!first) {
					sb.append(", ");
				}
				first = false;
				sb.append(entry.getKey()).append('=').append(entry.getValue());
			}
			sb.append('}');
		}
		return sb.append(')').toString();
	}
}
