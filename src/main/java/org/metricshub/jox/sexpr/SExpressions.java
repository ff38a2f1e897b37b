package org.metricshub.jox.sexpr;

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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.metricshub.jox.MalformedNodeException;
import org.metricshub.jox.UnknownFormException;
import org.metricshub.jox.ast.Assign;
import org.metricshub.jox.ast.Associativity;
import org.metricshub.jox.ast.Atom;
import org.metricshub.jox.ast.Attribute;
import org.metricshub.jox.ast.BinOp;
import org.metricshub.jox.ast.BinaryOperator;
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
import org.metricshub.jox.ast.NodeKind;
import org.metricshub.jox.ast.Return;
import org.metricshub.jox.ast.Sequence;
import org.metricshub.jox.ast.SequenceKind;
import org.metricshub.jox.ast.Subscript;
import org.metricshub.jox.ast.UnaryOp;
import org.metricshub.jox.ast.UnaryOperator;
import org.metricshub.jox.ast.While;
import org.metricshub.jox.ast.Yield;
import org.metricshub.jox.ast.YieldFrom;
import org.metricshub.jox.builder.NodeProxy;
import org.metricshub.jox.util.JoxLogger;
import org.slf4j.Logger;

/**
 * S-expression constructor: builds a node from a head symbol followed by
 * its arguments.
 * <p>
 * The head selects a form in a fixed shape table which knows the accepted
 * number of arguments. Arguments are coerced before the node constructor
 * sees them: a {@link Node} is used as is, a {@link NodeProxy} is unwrapped,
 * a {@link List} becomes a list display and any other value is lifted to an
 * {@link Atom}. Statement bodies accept either a list of statements or a
 * single statement.
 *
 * <pre>
 * build("+", 1, 2, 3)                     // (1 + 2) + 3
 * build("**", 2, 3, 4)                    // 2 ** (3 ** 4)
 * build("def", "calc", asList("x"), build("return", build("+", 42, build("name", "x"))))
 * build("+=", build("name", "n"), 1)      // n += 1
 * build("from", "os.path", "join", singletonMap("exists", "present"))
 * </pre>
 */
public final class SExpressions {

	private static final Logger LOG = JoxLogger.getLogger(SExpressions.class);

	/** Arity upper bound of variadic forms */
	private static final int ANY = Integer.MAX_VALUE;

	/**
	 * Accepted argument counts of one head.
	 */
	private static final class Form {
		private final int min;
		private final int max;

		private Form(int min, int max) {
			this.min = min;
			this.max = max;
		}

		private boolean accepts(int arity) {
			return arity >= min && arity <= max;
		}

		private String describe() {
			if (min == max) {
				return String.valueOf(min);
			}
			return max == ANY ? "at least " + min : min + " to " + max;
		}
	}

	private static final Map<String, Form> FORMS;

	static {
		Map<String, Form> forms = new TreeMap<String, Form>();
		for (BinaryOperator op : BinaryOperator.values()) {
			forms.put(op.symbol(), new Form(2, ANY));
		}
		forms.put("-", new Form(1, ANY));
		forms.put("+", new Form(1, ANY));
		forms.put("not", new Form(1, 1));
		forms.put("~", new Form(1, 1));
		forms.put("atom", new Form(1, 1));
		forms.put("name", new Form(1, 1));
		forms.put("attr", new Form(2, 2));
		forms.put("call", new Form(1, ANY));
		forms.put("index", new Form(2, 2));
		for (SequenceKind kind : SequenceKind.values()) {
			forms.put(kind.head(), new Form(0, ANY));
		}
		forms.put("ifexpr", new Form(3, 3));
		forms.put("lambda", new Form(2, 2));
		forms.put("yield", new Form(0, 1));
		forms.put("yield from", new Form(1, 1));
		forms.put("=", new Form(2, 2));
		for (BinaryOperator op : BinaryOperator.values()) {
			if (op.isAugmentable()) {
				forms.put(op.symbol() + "=", new Form(2, 2));
			}
		}
		forms.put("if", new Form(2, 3));
		forms.put("while", new Form(2, 3));
		forms.put("def", new Form(3, 3));
		forms.put("do", new Form(0, ANY));
		forms.put("import", new Form(1, 2));
		forms.put("from", new Form(2, ANY));
		forms.put("return", new Form(0, 1));
		forms.put("del", new Form(1, ANY));
		forms.put("break", new Form(0, 0));
		forms.put("continue", new Form(0, 0));
		FORMS = Collections.unmodifiableMap(forms);
	}

	private SExpressions() {}

	/**
	 * @return every head symbol understood by {@link #build(String, Object...)}, sorted
	 */
	public static Set<String> heads() {
		return FORMS.keySet();
	}

	/**
	 * Builds the node described by {@code head} and {@code args}.
	 *
	 * @param head form selector, e.g. {@code "+"}, {@code "call"}, {@code "def"}
	 * @param args the arguments of the form
	 * @return the new node
	 * @throws UnknownFormException if the head is unknown or the number of arguments does not fit it
	 * @throws MalformedNodeException if an argument does not fit the node being built
	 */
	public static Node build(String head, Object... args) {
		Object[] arguments = args == null ? new Object[0] : args;
		Form form = head == null ? null : FORMS.get(head);
		if (form == null) {
			throw new UnknownFormException(head, arguments.length, "Unknown form head '" + head + "'");
		}
		if (!form.accepts(arguments.length)) {
			throw new UnknownFormException(
					head,
					arguments.length,
					"Form '" + head + "' expects " + form.describe() + " argument(s), got " + arguments.length);
		}
		Node node = construct(head, arguments);
		if (LOG.isTraceEnabled()) {
			LOG.trace("build({}) -> {}", head, node);
		}
		return node;
	}

	private static Node construct(String head, Object[] args) {
		BinaryOperator augmented = augmentedOperator(head);
		if (augmented != null) {
			return new Inplace(augmented, expression(args[0]), expression(args[1]));
		}
		switch (head) {
		case "-":
		case "+":
			if (args.length == 1) {
				return new UnaryOp(UnaryOperator.fromSymbol(head), expression(args[0]));
			}
			return binary(BinaryOperator.fromSymbol(head), args);
		case "not":
		case "~":
			return new UnaryOp(UnaryOperator.fromSymbol(head), expression(args[0]));
		case "atom":
			return new Atom(args[0] instanceof NodeProxy ? NodeProxy.unwrap((NodeProxy) args[0]) : args[0]);
		case "name":
			return args[0] instanceof Name ? (Name) args[0] : new Name(identifier(NodeKind.NAME, args[0]));
		case "attr":
			return new Attribute(expression(args[0]), identifier(NodeKind.ATTRIBUTE, args[1]));
		case "call":
			return call(args);
		case "index":
			return new Subscript(expression(args[0]), expression(args[1]));
		case "list":
			return new Sequence(SequenceKind.LIST, expressions(Arrays.asList(args)));
		case "tuple":
			return new Sequence(SequenceKind.TUPLE, expressions(Arrays.asList(args)));
		case "set":
			return new Sequence(SequenceKind.SET, expressions(Arrays.asList(args)));
		case "ifexpr":
			return new Conditional(expression(args[0]), expression(args[1]), expression(args[2]));
		case "lambda":
			return new Lambda(parameters(NodeKind.LAMBDA, args[0]), expression(args[1]));
		case "yield":
			return args.length == 0 ? new Yield() : new Yield(expression(args[0]));
		case "yield from":
			return new YieldFrom(expression(args[0]));
		case "=":
			return new Assign(expression(args[0]), expression(args[1]));
		case "if":
			return args.length == 2
					? new If(expression(args[0]), body(args[1]))
					: new If(expression(args[0]), body(args[1]), body(args[2]));
		case "while":
			return args.length == 2
					? new While(expression(args[0]), body(args[1]))
					: new While(expression(args[0]), body(args[1]), body(args[2]));
		case "def":
			return new FunctionDef(
					identifier(NodeKind.FUNCTION_DEF, args[0]),
					parameters(NodeKind.FUNCTION_DEF, args[1]),
					body(args[2]));
		case "do":
			return new Block(body(Arrays.asList(args)));
		case "import":
			return new Import(
					identifier(NodeKind.IMPORT, args[0]),
					args.length == 2 && args[1] != null ? identifier(NodeKind.IMPORT, args[1]) : null);
		case "from":
			List<ImportFrom.Member> members = new ArrayList<ImportFrom.Member>(args.length - 1);
			for (int i = 1; i < args.length; i++) {
				members.add(member(args[i]));
			}
			return new ImportFrom(identifier(NodeKind.IMPORT_FROM, args[0]), members);
		case "return":
			return args.length == 0 ? new Return() : new Return(expression(args[0]));
		case "del":
			return new Delete(expressions(Arrays.asList(args)));
		case "break":
			return new Break();
		case "continue":
			return new Continue();
		default:
			return binary(BinaryOperator.fromSymbol(head), args);
		}
	}

	/**
	 * @return the operator of an augmented assignment head such as {@code "+="}, or {@code null}
	 */
	private static BinaryOperator augmentedOperator(String head) {
		if (head.length() < 2 || !head.endsWith("=")) {
			return null;
		}
		BinaryOperator op = BinaryOperator.fromSymbol(head.substring(0, head.length() - 1));
		return op != null && op.isAugmentable() ? op : null;
	}

	/**
	 * Folds a variadic operator application into nested binary nodes, to the
	 * right for right-associative operators and to the left otherwise.
	 */
	private static Node binary(BinaryOperator op, Object[] args) {
		if (op.associativity() == Associativity.RIGHT) {
			Node result = expression(args[args.length - 1]);
			for (int i = args.length - 2; i >= 0; i--) {
				result = new BinOp(op, expression(args[i]), result);
			}
			return result;
		}
		Node result = expression(args[0]);
		for (int i = 1; i < args.length; i++) {
			result = new BinOp(op, result, expression(args[i]));
		}
		return result;
	}

	private static Node call(Object[] args) {
		int end = args.length;
		Map<String, Node> kwargs = new LinkedHashMap<String, Node>();
		if (end > 1 && args[end - 1] instanceof Map) {
			end--;
			for (Map.Entry<?, ?> entry : ((Map<?, ?>) args[end]).entrySet()) {
				kwargs.put(identifier(NodeKind.CALL, entry.getKey()), expression(entry.getValue()));
			}
		}
		List<Node> positional = expressions(Arrays.asList(args).subList(1, end));
		return new Call(expression(args[0]), positional, kwargs);
	}

	/**
	 * Coerces one argument to a node.
	 *
	 * @param arg a node, a proxy, a list or a literal value
	 * @return the corresponding node
	 */
	public static Node expression(Object arg) {
		if (arg instanceof Node) {
			return (Node) arg;
		}
		if (arg instanceof NodeProxy) {
			return NodeProxy.unwrap((NodeProxy) arg);
		}
		if (arg instanceof List) {
			return new Sequence(SequenceKind.LIST, expressions((List<?>) arg));
		}
		return new Atom(arg);
	}

	private static List<Node> expressions(List<?> args) {
		List<Node> nodes = new ArrayList<Node>(args.size());
		for (Object arg : args) {
			nodes.add(expression(arg));
		}
		return nodes;
	}

	/**
	 * A body is a list of statements, or a single statement. A {@link Block}
	 * is spliced by the node constructors.
	 */
	private static List<Node> body(Object arg) {
		if (arg instanceof List) {
			return expressions((List<?>) arg);
		}
		return Collections.singletonList(expression(arg));
	}

	private static String identifier(NodeKind kind, Object arg) {
		if (arg instanceof String) {
			return (String) arg;
		}
		if (arg instanceof Name) {
			return ((Name) arg).getId();
		}
		if (arg instanceof NodeProxy && NodeProxy.unwrap((NodeProxy) arg) instanceof Name) {
			return ((Name) NodeProxy.unwrap((NodeProxy) arg)).getId();
		}
		throw new MalformedNodeException(kind, "expected an identifier, got " + arg);
	}

	/**
	 * An imported name is an identifier, {@code "*"}, or a single-entry map
	 * from the name to its alias.
	 */
	private static ImportFrom.Member member(Object arg) {
		if (arg instanceof Map) {
			Map<?, ?> map = (Map<?, ?>) arg;
			if (map.size() != 1) {
				throw new MalformedNodeException(NodeKind.IMPORT_FROM, "expected a single name to alias mapping, got " + arg);
			}
			Map.Entry<?, ?> entry = map.entrySet().iterator().next();
			String alias = entry.getValue() == null ? null : identifier(NodeKind.IMPORT_FROM, entry.getValue());
			return new ImportFrom.Member(identifier(NodeKind.IMPORT_FROM, entry.getKey()), alias);
		}
		return new ImportFrom.Member(identifier(NodeKind.IMPORT_FROM, arg));
	}

	private static List<String> parameters(NodeKind kind, Object arg) {
		if (!(arg instanceof List)) {
			throw new MalformedNodeException(kind, "expected a parameter list, got " + arg);
		}
		List<String> params = new ArrayList<String>();
		for (Object param : (List<?>) arg) {
			params.add(identifier(kind, param));
		}
		return params;
	}
}
