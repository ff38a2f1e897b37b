package org.metricshub.jox.backend;

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
import java.util.List;
import java.util.Map;
import org.metricshub.jox.ast.Assign;
import org.metricshub.jox.ast.Associativity;
import org.metricshub.jox.ast.Atom;
import org.metricshub.jox.ast.Attribute;
import org.metricshub.jox.ast.BinOp;
import org.metricshub.jox.ast.Block;
import org.metricshub.jox.ast.Call;
import org.metricshub.jox.ast.Conditional;
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
import org.metricshub.jox.ast.Precedence;
import org.metricshub.jox.ast.Return;
import org.metricshub.jox.ast.Sequence;
import org.metricshub.jox.ast.SequenceKind;
import org.metricshub.jox.ast.Subscript;
import org.metricshub.jox.ast.UnaryOp;
import org.metricshub.jox.ast.UnaryOperator;
import org.metricshub.jox.ast.While;
import org.metricshub.jox.ast.Yield;
import org.metricshub.jox.ast.YieldFrom;

/**
 * Renders trees as source text.
 * <p>
 * Expressions are rendered without a trailing newline; statements end with
 * one and their bodies are indented through the {@link EmitContext}.
 * Parentheses are inserted exactly where reading the text back would
 * otherwise group the operands differently, using the precedence and
 * associativity of each operator.
 */
public final class SourceEmitter {

	private final EmitContext context;

	public SourceEmitter(EmitContext context) {
		this.context = context;
	}

	/**
	 * @param node the tree to render
	 * @return its source text, indented with four spaces per level
	 */
	public static String emit(Node node) {
		return emit(node, new EmitContext());
	}

	/**
	 * @param node the tree to render
	 * @param context where to write, with its indentation settings
	 * @return the text of {@code context} once the node has been written
	 */
	public static String emit(Node node, EmitContext context) {
		new SourceEmitter(context).write(node);
		return context.getText();
	}

	/**
	 * Writes a node to the context: a statement as indented lines, an
	 * expression as bare text.
	 */
	public void write(Node node) {
		if (node.isStatement()) {
			statement(node);
		} else {
			context.append(expression(node));
		}
	}

	/**
	 * @return the binding strength of the text {@link #expression(Node)} produces for {@code node}
	 */
	static int precedence(Node node) {
		switch (node.kind()) {
		case ATOM:
			return ((Atom) node).isNegative() ? Precedence.UNARY : Precedence.ATOM;
		case UNARY_OP:
			return ((UnaryOp) node).getOperator().precedence();
		case BIN_OP:
			return ((BinOp) node).getOperator().precedence();
		case CALL:
		case ATTRIBUTE:
		case SUBSCRIPT:
			return Precedence.POSTFIX;
		case CONDITIONAL:
			return Precedence.CONDITIONAL;
		case LAMBDA:
			return Precedence.LAMBDA;
		default:
			return Precedence.ATOM;
		}
	}

	private static String parenthesize(String text, boolean needed) {
		return needed ? "(" + text + ")" : text;
	}

	/**
	 * @param node an expression
	 * @return its source text
	 */
	public String expression(Node node) {
		switch (node.kind()) {
		case ATOM:
			return Atom.repr(((Atom) node).getValue());
		case NAME:
			return ((Name) node).getId();
		case UNARY_OP:
			return unaryOp((UnaryOp) node);
		case BIN_OP:
			return binOp((BinOp) node);
		case CALL:
			return call((Call) node);
		case ATTRIBUTE:
			Attribute attribute = (Attribute) node;
			Node target = attribute.getTarget();
			boolean integerTarget = target.kind() == NodeKind.ATOM && ((Atom) target).getValue() instanceof Long;
			return postfixTarget(target, integerTarget) + "." + attribute.getField();
		case SUBSCRIPT:
			Subscript subscript = (Subscript) node;
			return postfixTarget(subscript.getTarget(), false) + "[" + expression(subscript.getIndex()) + "]";
		case SEQUENCE:
			return sequence((Sequence) node);
		case CONDITIONAL:
			Conditional conditional = (Conditional) node;
			return parenthesize(expression(conditional.getThen()), precedence(conditional.getThen()) < Precedence.OR)
					+ " if "
					+ parenthesize(expression(conditional.getTest()), precedence(conditional.getTest()) < Precedence.OR)
					+ " else "
					+ expression(conditional.getOtherwise());
		case LAMBDA:
			Lambda lambda = (Lambda) node;
			if (lambda.getParams().isEmpty()) {
				return "lambda: " + expression(lambda.getBody());
			}
			return "lambda " + String.join(", ", lambda.getParams()) + ": " + expression(lambda.getBody());
		case YIELD:
			// always parenthesized, so a yield reads as an atom wherever it appears
			Node yielded = ((Yield) node).getValue();
			return yielded == null ? "(yield)" : "(yield " + expression(yielded) + ")";
		case YIELD_FROM:
			return "(yield from " + expression(((YieldFrom) node).getValue()) + ")";
		default:
			throw new IllegalArgumentException(node.kind().label() + " is not an expression");
		}
	}

	private String postfixTarget(Node target, boolean forceParentheses) {
		return parenthesize(expression(target), forceParentheses || precedence(target) < Precedence.POSTFIX);
	}

	private String unaryOp(UnaryOp node) {
		UnaryOperator op = node.getOperator();
		Node operand = node.getOperand();
		boolean parens = precedence(operand) < op.precedence();
		if (op == UnaryOperator.NEG && operand.kind() == NodeKind.ATOM && ((Atom) operand).isNumber()) {
			// "-5" would read back as a negative literal
			parens = !((Atom) operand).isNegative();
		}
		String text = parenthesize(expression(operand), parens);
		return op == UnaryOperator.NOT ? "not " + text : op.symbol() + text;
	}

	private String binOp(BinOp node) {
		int p = node.getOperator().precedence();
		Associativity associativity = node.getOperator().associativity();

		Node left = node.getLeft();
		int leftPrecedence = precedence(left);
		boolean leftParens = leftPrecedence < p || leftPrecedence == p && associativity != Associativity.LEFT;

		Node right = node.getRight();
		int rightPrecedence = precedence(right);
		boolean rightParens = rightPrecedence < p || rightPrecedence == p && associativity != Associativity.RIGHT;
		if (node.getOperator().precedence() == Precedence.POWER && rightPrecedence == Precedence.UNARY) {
			// the exponent is read as a unary expression
			rightParens = false;
		}

		return parenthesize(expression(left), leftParens)
				+ " "
				+ node.getOperator().symbol()
				+ " "
				+ parenthesize(expression(right), rightParens);
	}

	private String call(Call node) {
		List<String> args = new ArrayList<String>();
		for (Node arg : node.getArgs()) {
			args.add(expression(arg));
		}
		for (Map.Entry<String, Node> kwarg : node.getKwargs().entrySet()) {
			args.add(kwarg.getKey() + "=" + expression(kwarg.getValue()));
		}
		return postfixTarget(node.getCallee(), false) + "(" + String.join(", ", args) + ")";
	}

	private String sequence(Sequence node) {
		List<String> elements = new ArrayList<String>();
		for (Node element : node.getElements()) {
			elements.add(expression(element));
		}
		String text = String.join(", ", elements);
		if (node.getSequenceKind() == SequenceKind.TUPLE && elements.size() == 1) {
			text += ",";
		}
		return node.getSequenceKind().open() + text + node.getSequenceKind().close();
	}

	/**
	 * Writes a statement, or an expression statement, as indented lines.
	 */
	public void statement(Node node) {
		switch (node.kind()) {
		case ASSIGN:
			Assign assign = (Assign) node;
			context.line(expression(assign.getTarget()) + " = " + expression(assign.getValue()));
			break;
		case INPLACE:
			Inplace inplace = (Inplace) node;
			context.line(expression(inplace.getTarget()) + " " + inplace.symbol() + " " + expression(inplace.getValue()));
			break;
		case IF:
			ifStatement((If) node, "if ");
			break;
		case WHILE:
			While loop = (While) node;
			context.line("while " + expression(loop.getTest()) + ":");
			body(loop.getBody());
			if (!loop.getOtherwise().isEmpty()) {
				context.line("else:");
				body(loop.getOtherwise());
			}
			break;
		case FUNCTION_DEF:
			FunctionDef def = (FunctionDef) node;
			context.line("def " + def.getName() + "(" + String.join(", ", def.getParams()) + "):");
			body(def.getBody());
			break;
		case BLOCK:
			for (Node statement : ((Block) node).getStatements()) {
				statement(statement);
			}
			break;
		case IMPORT:
			Import imp = (Import) node;
			context.line(imp.getAlias() == null ? "import " + imp.getModule() : "import " + imp.getModule() + " as " + imp.getAlias());
			break;
		case IMPORT_FROM:
			ImportFrom from = (ImportFrom) node;
			List<String> members = new ArrayList<String>();
			for (ImportFrom.Member member : from.getMembers()) {
				members.add(member.toString());
			}
			context.line("from " + from.getModule() + " import " + String.join(", ", members));
			break;
		case RETURN:
			Node value = ((Return) node).getValue();
			context.line(value == null ? "return" : "return " + expression(value));
			break;
		case DELETE:
			List<String> targets = new ArrayList<String>();
			for (Node target : ((Delete) node).getTargets()) {
				targets.add(expression(target));
			}
			context.line("del " + String.join(", ", targets));
			break;
		case BREAK:
			context.line("break");
			break;
		case CONTINUE:
			context.line("continue");
			break;
		default:
			context.line(expression(node));
		}
	}

	private void ifStatement(If node, String keyword) {
		context.line(keyword + expression(node.getTest()) + ":");
		body(node.getThen());
		List<Node> otherwise = node.getOtherwise();
		if (otherwise.size() == 1 && otherwise.get(0).kind() == NodeKind.IF) {
			ifStatement((If) otherwise.get(0), "elif ");
		} else if (!otherwise.isEmpty()) {
			context.line("else:");
			body(otherwise);
		}
	}

	private void body(List<Node> statements) {
		context.indent();
		if (statements.isEmpty()) {
			context.line("pass");
		}
		for (Node statement : statements) {
			statement(statement);
		}
		context.dedent();
	}
}
