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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.jox.MalformedNodeException;

/**
 * Immutable tree node.
 * <p>
 * The set of subclasses is closed (the constructor is package-private) and
 * every subclass is tagged by one {@link NodeKind}. Nodes only hold other
 * nodes and scalars, never references to a parent, so a tree built from them
 * is always a strict tree and sub-trees can be shared freely.
 * <p>
 * Equality is structural: two nodes are equal when they have the same kind
 * and equal payloads.
 */
public abstract class Node {

	private final NodeKind kind;

	Node(NodeKind kind) {
		this.kind = kind;
	}

	/**
	 * @return the variant tag of this node
	 */
	public final NodeKind kind() {
		return kind;
	}

	public final boolean isStatement() {
		return kind.isStatement();
	}

	public final boolean isExpression() {
		return !kind.isStatement();
	}

	/**
	 * @return the direct child nodes, in source order
	 */
	public abstract List<Node> children();

	/**
	 * Text shown for this node on its line of a {@link #dump(PrintStream)}.
	 * Children are not included.
	 *
	 * @return the kind label followed by the scalar payload, if any
	 */
	protected String dumpLabel() {
		return kind.label();
	}

	/**
	 * Dump a text representation of this tree to the print stream, one node
	 * per line, each line indented by the depth of the node.
	 *
	 * @param ps The print stream to dump the text representation.
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int lvl) {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < lvl; i++) {
			spaces.append(' ');
		}
		ps.println(spaces + dumpLabel());
		for (Node child : children()) {
			child.dump(ps, lvl + 1);
		}
	}

	static Node requireExpression(NodeKind owner, String role, Node node) {
		if (node == null) {
			throw new MalformedNodeException(owner, role + " must not be null");
		}
		if (node.isStatement()) {
			throw new MalformedNodeException(owner, role + " must be an expression, got " + node.kind().label());
		}
		return node;
	}

	static List<Node> requireExpressions(NodeKind owner, String role, List<? extends Node> nodes) {
		if (nodes == null) {
			throw new MalformedNodeException(owner, role + " must not be null");
		}
		List<Node> copy = new ArrayList<Node>(nodes.size());
		for (Node node : nodes) {
			copy.add(requireExpression(owner, role, node));
		}
		return Collections.unmodifiableList(copy);
	}

	/**
	 * Copies a statement body. Nested {@link Block}s are spliced in place so
	 * that a body is always a flat sequence.
	 */
	static List<Node> requireBody(NodeKind owner, String role, List<? extends Node> statements) {
		if (statements == null) {
			throw new MalformedNodeException(owner, role + " must not be null");
		}
		List<Node> copy = new ArrayList<Node>(statements.size());
		for (Node statement : statements) {
			if (statement == null) {
				throw new MalformedNodeException(owner, role + " must not contain null");
			}
			if (statement instanceof Block) {
				copy.addAll(((Block) statement).getStatements());
			} else {
				copy.add(statement);
			}
		}
		return Collections.unmodifiableList(copy);
	}

	static String requireIdentifier(NodeKind owner, String role, String id) {
		if (!Identifiers.isValid(id)) {
			throw new MalformedNodeException(owner, role + " is not a valid identifier: " + id);
		}
		return id;
	}

	static List<String> requireParameters(NodeKind owner, List<String> params) {
		if (params == null) {
			throw new MalformedNodeException(owner, "parameter list must not be null");
		}
		Set<String> seen = new HashSet<String>();
		List<String> copy = new ArrayList<String>(params.size());
		for (String param : params) {
			requireIdentifier(owner, "parameter", param);
			if (!seen.add(param)) {
				throw new MalformedNodeException(owner, "duplicate parameter " + param);
			}
			copy.add(param);
		}
		return Collections.unmodifiableList(copy);
	}

	/**
	 * Checks that {@code target} can appear on the left of an assignment or
	 * in a {@code del} statement.
	 */
	static Node requireTarget(NodeKind owner, Node target) {
		if (target == null) {
			throw new MalformedNodeException(owner, "target must not be null");
		}
		switch (target.kind()) {
		case NAME:
		case ATTRIBUTE:
		case SUBSCRIPT:
			return target;
		case SEQUENCE:
			Sequence sequence = (Sequence) target;
			if (sequence.getSequenceKind() == SequenceKind.SET) {
				throw new MalformedNodeException(owner, "cannot target a set display");
			}
			for (Node element : sequence.getElements()) {
				requireTarget(owner, element);
			}
			return target;
		default:
			throw new MalformedNodeException(owner, "cannot target " + target.kind().label());
		}
	}

	static String join(List<?> items) {
		StringBuilder sb = new StringBuilder("[");
		for (int i = 0; i < items.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(items.get(i));
		}
		return sb.append(']').toString();
	}
}
