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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.jox.ast.Assign;
import org.metricshub.jox.ast.Attribute;
import org.metricshub.jox.ast.Block;
import org.metricshub.jox.ast.Delete;
import org.metricshub.jox.ast.FunctionDef;
import org.metricshub.jox.ast.If;
import org.metricshub.jox.ast.Import;
import org.metricshub.jox.ast.ImportFrom;
import org.metricshub.jox.ast.Inplace;
import org.metricshub.jox.ast.Lambda;
import org.metricshub.jox.ast.Name;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.ast.NodeKind;
import org.metricshub.jox.ast.Sequence;
import org.metricshub.jox.ast.Subscript;
import org.metricshub.jox.ast.While;

/**
 * Computes the names a tree references without binding them.
 * <p>
 * Scoping rules:
 * <ul>
 * <li>lambda and function parameters are bound in the body;</li>
 * <li>an assignment binds the names of its target for the statements that
 * follow it in the same body, after its value has been analyzed, so
 * {@code x = x + 1} has {@code x} free;</li>
 * <li>an augmented assignment reads its target before binding it, so
 * {@code x += 1} has {@code x} free unless an earlier statement bound it;</li>
 * <li>a function definition binds its name for the statements that follow
 * and inside its own body;</li>
 * <li>an import binds its alias, or the first component of the module name;
 * {@code from m import a as b} binds {@code b} and a wildcard import binds nothing;</li>
 * <li>every body is a nested scope whose bindings do not leak out.</li>
 * </ul>
 * Attribute fields are not names, and attribute or subscript targets are
 * references to their base expression.
 */
public final class FreeVariables {

	private final Set<String> free = new LinkedHashSet<String>();

	private FreeVariables() {}

	/**
	 * @param node the tree to analyze
	 * @return the free names, in order of first occurrence
	 */
	public static Set<String> of(Node node) {
		return of(node, Scope.empty());
	}

	/**
	 * @param node the tree to analyze
	 * @param scope names already bound around the tree
	 * @return the free names, in order of first occurrence
	 */
	public static Set<String> of(Node node, Scope scope) {
		FreeVariables analysis = new FreeVariables();
		analysis.visit(node, scope);
		return Collections.unmodifiableSet(analysis.free);
	}

	/**
	 * Visits one node.
	 *
	 * @return the scope in effect after the node, for the statements that follow it
	 */
	private Scope visit(Node node, Scope scope) {
		switch (node.kind()) {
		case NAME:
			String id = ((Name) node).getId();
			if (!scope.isBound(id)) {
				free.add(id);
			}
			return scope;
		case LAMBDA:
			Lambda lambda = (Lambda) node;
			visit(lambda.getBody(), scope.bindAll(lambda.getParams()));
			return scope;
		case ASSIGN:
			Assign assign = (Assign) node;
			visit(assign.getValue(), scope);
			return bindTarget(assign.getTarget(), scope);
		case INPLACE:
			Inplace inplace = (Inplace) node;
			visit(inplace.getValue(), scope);
			visit(inplace.getTarget(), scope);
			return bindNames(inplace.getTarget(), scope);
		case IF:
			If ifNode = (If) node;
			visit(ifNode.getTest(), scope);
			visitBody(ifNode.getThen(), scope);
			visitBody(ifNode.getOtherwise(), scope);
			return scope;
		case WHILE:
			While loop = (While) node;
			visit(loop.getTest(), scope);
			visitBody(loop.getBody(), scope);
			visitBody(loop.getOtherwise(), scope);
			return scope;
		case FUNCTION_DEF:
			FunctionDef def = (FunctionDef) node;
			Scope outer = scope.bind(def.getName());
			visitBody(def.getBody(), outer.bindAll(def.getParams()));
			return outer;
		case BLOCK:
			visitBody(((Block) node).getStatements(), scope);
			return scope;
		case IMPORT:
			return scope.bind(((Import) node).boundName());
		case IMPORT_FROM:
			return scope.bindAll(((ImportFrom) node).boundNames());
		case DELETE:
			for (Node target : ((Delete) node).getTargets()) {
				visit(target, scope);
			}
			return scope;
		default:
			for (Node child : node.children()) {
				visit(child, scope);
			}
			return scope;
		}
	}

	private void visitBody(List<Node> body, Scope enclosing) {
		Scope scope = enclosing;
		for (Node statement : body) {
			scope = visit(statement, scope);
		}
	}

	/**
	 * Visits the expressions an assignment target reads, then binds the names it assigns.
	 */
	private Scope bindTarget(Node target, Scope scope) {
		visitTargetReferences(target, scope);
		return bindNames(target, scope);
	}

	private void visitTargetReferences(Node target, Scope scope) {
		switch (target.kind()) {
		case SEQUENCE:
			for (Node element : ((Sequence) target).getElements()) {
				visitTargetReferences(element, scope);
			}
			break;
		case ATTRIBUTE:
			visit(((Attribute) target).getTarget(), scope);
			break;
		case SUBSCRIPT:
			Subscript subscript = (Subscript) target;
			visit(subscript.getTarget(), scope);
			visit(subscript.getIndex(), scope);
			break;
		default:
			break;
		}
	}

	private static Scope bindNames(Node target, Scope scope) {
		if (target.kind() == NodeKind.NAME) {
			return scope.bind(((Name) target).getId());
		}
		Scope result = scope;
		if (target.kind() == NodeKind.SEQUENCE) {
			for (Node element : ((Sequence) target).getElements()) {
				result = bindNames(element, result);
			}
		}
		return result;
	}
}
