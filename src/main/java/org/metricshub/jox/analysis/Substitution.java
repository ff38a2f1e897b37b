package org.metricshub.jox.analysis;

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
import org.metricshub.jox.ast.Assign;
import org.metricshub.jox.ast.FunctionDef;
import org.metricshub.jox.ast.Import;
import org.metricshub.jox.ast.ImportFrom;
import org.metricshub.jox.ast.Inplace;
import org.metricshub.jox.ast.Lambda;
import org.metricshub.jox.ast.Name;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.ast.NodeKind;
import org.metricshub.jox.ast.Sequence;
import org.metricshub.jox.util.JoxLogger;
import org.slf4j.Logger;

/**
 * Replaces free names by expressions.
 * <p>
 * A name is replaced only where it is free, with the scoping rules of
 * {@link FreeVariables}. Binding occurrences (assignment, augmented
 * assignment and deletion targets, parameters, function names) are never
 * replaced. Replacement
 * expressions are inserted as they are: names free in a replacement may be
 * captured by a binding around the insertion point.
 */
public final class Substitution extends NodeTransformer {

	private static final Logger LOG = JoxLogger.getLogger(Substitution.class);

	private final Map<String, Node> replacements;
	private Scope scope;

	private Substitution(Map<String, Node> replacements, Scope scope) {
		this.replacements = replacements;
		this.scope = scope;
	}

	/**
	 * @param node the tree to rewrite
	 * @param replacements expression to insert for each free name
	 * @return the rewritten tree, {@code node} itself if no name was replaced
	 */
	public static Node substitute(Node node, Map<String, ? extends Node> replacements) {
		Map<String, Node> copy = new LinkedHashMap<String, Node>();
		for (Map.Entry<String, ? extends Node> entry : replacements.entrySet()) {
			if (entry.getValue() == null) {
				throw new IllegalArgumentException("No replacement given for " + entry.getKey());
			}
			if (entry.getValue().isStatement()) {
				throw new IllegalArgumentException(
						"Replacement for " + entry.getKey() + " must be an expression, got " + entry.getValue().kind().label());
			}
			copy.put(entry.getKey(), entry.getValue());
		}
		if (copy.isEmpty()) {
			return node;
		}
		return new Substitution(Collections.unmodifiableMap(copy), Scope.empty()).transformAny(node);
	}

	@Override
	protected Node transform(Name node) {
		Node replacement = replacements.get(node.getId());
		if (replacement == null || scope.isBound(node.getId())) {
			return node;
		}
		LOG.debug("Substituting {} with {}", node.getId(), replacement);
		return replacement;
	}

	@Override
	protected List<Node> transformBody(List<Node> body) {
		Scope saved = scope;
		try {
			return super.transformBody(body);
		} finally {
			scope = saved;
		}
	}

	@Override
	protected Node transformTarget(Node target) {
		if (target.kind() == NodeKind.NAME) {
			return target;
		}
		if (target.kind() == NodeKind.SEQUENCE) {
			List<Node> elements = ((Sequence) target).getElements();
			List<Node> transformed = null;
			for (int index = 0; index < elements.size(); index++) {
				Node element = transformTarget(elements.get(index));
				if (transformed == null && element != elements.get(index)) {
					transformed = new ArrayList<Node>(elements.subList(0, index));
				}
				if (transformed != null) {
					transformed.add(element);
				}
			}
			return transformed == null ? target : new Sequence(((Sequence) target).getSequenceKind(), transformed);
		}
		return transformAny(target);
	}

	@Override
	protected Node transform(Assign node) {
		Node result = super.transform(node);
		bind(node.getTarget());
		return result;
	}

	@Override
	protected Node transform(Inplace node) {
		Node result = super.transform(node);
		bind(node.getTarget());
		return result;
	}

	@Override
	protected Node transform(Lambda node) {
		Scope saved = scope;
		scope = scope.bindAll(node.getParams());
		try {
			return super.transform(node);
		} finally {
			scope = saved;
		}
	}

	@Override
	protected Node transform(FunctionDef node) {
		scope = scope.bind(node.getName());
		Scope outer = scope;
		scope = scope.bindAll(node.getParams());
		try {
			return super.transform(node);
		} finally {
			scope = outer;
		}
	}

	@Override
	protected Node transform(Import node) {
		scope = scope.bind(node.boundName());
		return node;
	}

	@Override
	protected Node transform(ImportFrom node) {
		scope = scope.bindAll(node.boundNames());
		return node;
	}

	private void bind(Node target) {
		if (target.kind() == NodeKind.NAME) {
			scope = scope.bind(((Name) target).getId());
		} else if (target.kind() == NodeKind.SEQUENCE) {
			for (Node element : ((Sequence) target).getElements()) {
				bind(element);
			}
		}
	}
}
