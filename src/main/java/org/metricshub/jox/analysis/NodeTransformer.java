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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jox.ast.Assign;
import org.metricshub.jox.ast.Atom;
import org.metricshub.jox.ast.Attribute;
import org.metricshub.jox.ast.BinOp;
import org.metricshub.jox.ast.Block;
import org.metricshub.jox.ast.Break;
import org.metricshub.jox.ast.Call;
import org.metricshub.jox.ast.Conditional;
import org.metricshub.jox.ast.Continue;
import org.metricshub.jox.ast.Delete;
import org.metricshub.jox.ast.FunctionDef;
import org.metricshub.jox.ast.If;
import org.metricshub.jox.ast.Import;
import org.metricshub.jox.ast.ImportFrom;
import org.metricshub.jox.ast.Inplace;
import org.metricshub.jox.ast.Lambda;
import org.metricshub.jox.ast.Name;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.ast.Return;
import org.metricshub.jox.ast.Sequence;
import org.metricshub.jox.ast.Subscript;
import org.metricshub.jox.ast.UnaryOp;
import org.metricshub.jox.ast.While;
import org.metricshub.jox.ast.Yield;
import org.metricshub.jox.ast.YieldFrom;

/**
 * Bottom-up tree rewriter. The base implementation is the identity: every
 * {@code transform} method rebuilds its node from the transformed children,
 * and returns the original instance when no child changed.
 * <p>
 * Subclasses override the {@code transform} method of the kinds they rewrite
 * and usually call the inherited one first to get the children transformed.
 * Statement bodies go through {@link #transformBody(List)} and assignment or
 * deletion targets through {@link #transformTarget(Node)}, so that a
 * subclass can track scopes.
 */
public class NodeTransformer {

	public Node transformAny(Node node) {
		switch (node.kind()) {
		case ATOM:
			return transform((Atom) node);
		case NAME:
			return transform((Name) node);
		case UNARY_OP:
			return transform((UnaryOp) node);
		case BIN_OP:
			return transform((BinOp) node);
		case CALL:
			return transform((Call) node);
		case ATTRIBUTE:
			return transform((Attribute) node);
		case SUBSCRIPT:
			return transform((Subscript) node);
		case SEQUENCE:
			return transform((Sequence) node);
		case CONDITIONAL:
			return transform((Conditional) node);
		case LAMBDA:
			return transform((Lambda) node);
		case YIELD:
			return transform((Yield) node);
		case YIELD_FROM:
			return transform((YieldFrom) node);
		case ASSIGN:
			return transform((Assign) node);
		case INPLACE:
			return transform((Inplace) node);
		case IF:
			return transform((If) node);
		case WHILE:
			return transform((While) node);
		case FUNCTION_DEF:
			return transform((FunctionDef) node);
		case BLOCK:
			return transform((Block) node);
		case IMPORT:
			return transform((Import) node);
		case IMPORT_FROM:
			return transform((ImportFrom) node);
		case RETURN:
			return transform((Return) node);
		case DELETE:
			return transform((Delete) node);
		case BREAK:
			return transform((Break) node);
		case CONTINUE:
			return transform((Continue) node);
		default:
			throw new IllegalStateException("Unexpected node kind " + node.kind());
		}
	}

	/**
	 * Transforms each element of a list.
	 *
	 * @return {@code list} itself when no element changed
	 */
	protected List<Node> transformList(List<Node> list) {
		List<Node> result = null;
		for (int index = 0; index < list.size(); index++) {
			Node element = list.get(index);
			Node transformed = transformAny(element);
			if (result == null && transformed != element) {
				result = new ArrayList<Node>(list.subList(0, index));
			}
			if (result != null) {
				result.add(transformed);
			}
		}
		return result == null ? list : result;
	}

	/**
	 * Transforms a statement body, in order.
	 */
	protected List<Node> transformBody(List<Node> body) {
		return transformList(body);
	}

	/**
	 * Transforms the target of an assignment, an augmented assignment or a deletion.
	 */
	protected Node transformTarget(Node target) {
		return transformAny(target);
	}

	protected Node transform(Atom node) {
		return node;
	}

	protected Node transform(Name node) {
		return node;
	}

	protected Node transform(UnaryOp node) {
		Node operand = transformAny(node.getOperand());
		if (operand == node.getOperand()) {
			return node;
		}
		return new UnaryOp(node.getOperator(), operand);
	}

	protected Node transform(BinOp node) {
		Node left = transformAny(node.getLeft());
		Node right = transformAny(node.getRight());
		if (left == node.getLeft() && right == node.getRight()) {
			return node;
		}
		return new BinOp(node.getOperator(), left, right);
	}

	protected Node transform(Call node) {
		Node callee = transformAny(node.getCallee());
		List<Node> args = transformList(node.getArgs());
		Map<String, Node> kwargs = null;
		for (Map.Entry<String, Node> entry : node.getKwargs().entrySet()) {
			Node value = transformAny(entry.getValue());
			if (kwargs == null && value != entry.getValue()) {
				kwargs = new LinkedHashMap<String, Node>();
				for (Map.Entry<String, Node> previous : node.getKwargs().entrySet()) {
					if (previous.getKey().equals(entry.getKey())) {
						break;
					}
					kwargs.put(previous.getKey(), previous.getValue());
				}
			}
			if (kwargs != null) {
				kwargs.put(entry.getKey(), value);
			}
		}
		if (callee == node.getCallee() && args == node.getArgs() && kwargs == null) {
			return node;
		}
		return new Call(callee, args, kwargs == null ? node.getKwargs() : kwargs);
	}

	protected Node transform(Attribute node) {
		Node target = transformAny(node.getTarget());
		if (target == node.getTarget()) {
			return node;
		}
		return new Attribute(target, node.getField());
	}

	protected Node transform(Subscript node) {
		Node target = transformAny(node.getTarget());
		Node index = transformAny(node.getIndex());
		if (target == node.getTarget() && index == node.getIndex()) {
			return node;
		}
		return new Subscript(target, index);
	}

	protected Node transform(Sequence node) {
		List<Node> elements = transformList(node.getElements());
		if (elements == node.getElements()) {
			return node;
		}
		return new Sequence(node.getSequenceKind(), elements);
	}

	protected Node transform(Conditional node) {
		Node test = transformAny(node.getTest());
		Node then = transformAny(node.getThen());
		Node otherwise = transformAny(node.getOtherwise());
		if (test == node.getTest() && then == node.getThen() && otherwise == node.getOtherwise()) {
			return node;
		}
		return new Conditional(test, then, otherwise);
	}

	protected Node transform(Lambda node) {
		Node body = transformAny(node.getBody());
		if (body == node.getBody()) {
			return node;
		}
		return new Lambda(node.getParams(), body);
	}

	protected Node transform(Assign node) {
		Node value = transformAny(node.getValue());
		Node target = transformTarget(node.getTarget());
		if (target == node.getTarget() && value == node.getValue()) {
			return node;
		}
		return new Assign(target, value);
	}

	protected Node transform(Yield node) {
		if (node.getValue() == null) {
			return node;
		}
		Node value = transformAny(node.getValue());
		if (value == node.getValue()) {
			return node;
		}
		return new Yield(value);
	}

	protected Node transform(YieldFrom node) {
		Node value = transformAny(node.getValue());
		if (value == node.getValue()) {
			return node;
		}
		return new YieldFrom(value);
	}

	protected Node transform(Inplace node) {
		Node value = transformAny(node.getValue());
		Node target = transformTarget(node.getTarget());
		if (target == node.getTarget() && value == node.getValue()) {
			return node;
		}
		return new Inplace(node.getOperator(), target, value);
	}

	protected Node transform(If node) {
		Node test = transformAny(node.getTest());
		List<Node> then = transformBody(node.getThen());
		List<Node> otherwise = transformBody(node.getOtherwise());
		if (test == node.getTest() && then == node.getThen() && otherwise == node.getOtherwise()) {
			return node;
		}
		return new If(test, then, otherwise);
	}

	protected Node transform(While node) {
		Node test = transformAny(node.getTest());
		List<Node> body = transformBody(node.getBody());
		List<Node> otherwise = transformBody(node.getOtherwise());
		if (test == node.getTest() && body == node.getBody() && otherwise == node.getOtherwise()) {
			return node;
		}
		return new While(test, body, otherwise);
	}

	protected Node transform(FunctionDef node) {
		List<Node> body = transformBody(node.getBody());
		if (body == node.getBody()) {
			return node;
		}
		return new FunctionDef(node.getName(), node.getParams(), body);
	}

	protected Node transform(Block node) {
		List<Node> statements = transformBody(node.getStatements());
		if (statements == node.getStatements()) {
			return node;
		}
		return new Block(statements);
	}

	protected Node transform(Import node) {
		return node;
	}

	protected Node transform(ImportFrom node) {
		return node;
	}

	protected Node transform(Return node) {
		if (node.getValue() == null) {
			return node;
		}
		Node value = transformAny(node.getValue());
		if (value == node.getValue()) {
			return node;
		}
		return new Return(value);
	}

	protected Node transform(Delete node) {
		List<Node> targets = null;
		for (int index = 0; index < node.getTargets().size(); index++) {
			Node target = node.getTargets().get(index);
			Node transformed = transformTarget(target);
			if (targets == null && transformed != target) {
				targets = new ArrayList<Node>(node.getTargets().subList(0, index));
			}
			if (targets != null) {
				targets.add(transformed);
			}
		}
		if (targets == null) {
			return node;
		}
		return new Delete(targets);
	}

	protected Node transform(Break node) {
		return node;
	}

	protected Node transform(Continue node) {
		return node;
	}
}
