package org.metricshub.jox;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.jox.analysis.FreeVariables;
import org.metricshub.jox.analysis.Simplifier;
import org.metricshub.jox.analysis.Substitution;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.backend.EmitContext;
import org.metricshub.jox.backend.SourceEmitter;
import org.metricshub.jox.builder.NodeProxy;
import org.metricshub.jox.frontend.SourceReader;
import org.metricshub.jox.sexpr.SExpressions;
import org.metricshub.jox.util.JoxLogger;
import org.metricshub.jox.util.JoxSettings;
import org.metricshub.jox.util.SourceInput;
import org.slf4j.Logger;

/**
 * Entry point to the tree engine.
 * <p>
 * The static methods give direct access to each operation. An instance runs
 * the whole pipeline configured by a {@link JoxSettings}: read the sources,
 * substitute the variables, simplify, and write the result.
 *
 * <pre>
 * Node calc = Jox.build("def", "calc", Arrays.asList("x"),
 * 		Jox.build("return", Jox.build("+", 42, Jox.build("name", "x"))));
 * Jox.emit(calc);   // "def calc(x):\n    return 42 + x\n"
 * </pre>
 */
public class Jox {

	private static final Logger LOG = JoxLogger.getLogger(Jox.class);

	private final JoxSettings settings;

	private Node lastTree;

	public Jox() {
		this(new JoxSettings());
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Jox(JoxSettings settings) {
		this.settings = settings;
	}

	/**
	 * @see SExpressions#build(String, Object...)
	 */
	public static Node build(String head, Object... args) {
		return SExpressions.build(head, args);
	}

	/**
	 * @see FreeVariables#of(Node)
	 */
	public static Set<String> freeVars(Node node) {
		return FreeVariables.of(node);
	}

	/**
	 * @see Simplifier#simplify(Node)
	 */
	public static Node simplify(Node node) {
		return Simplifier.simplify(node);
	}

	/**
	 * @see Substitution#substitute(Node, Map)
	 */
	public static Node substitute(Node node, Map<String, ? extends Node> replacements) {
		return Substitution.substitute(node, replacements);
	}

	/**
	 * @see SourceEmitter#emit(Node)
	 */
	public static String emit(Node node) {
		return SourceEmitter.emit(node);
	}

	/**
	 * @see SourceReader#parse(String)
	 */
	public static Node parse(String text) {
		return SourceReader.parse(text);
	}

	/**
	 * Reads the sources and transforms the tree as the settings say.
	 * The sources are joined, in order, into one text.
	 *
	 * @param sources the texts to read
	 * @return the transformed tree
	 * @throws IOException if a source cannot be read
	 * @throws org.metricshub.jox.frontend.SourceSyntaxException if the text cannot be parsed
	 */
	public Node transform(List<SourceInput> sources) throws IOException {
		StringBuilder text = new StringBuilder();
		for (SourceInput source : sources) {
			LOG.debug("Reading {}", source.getDescription());
			text.append(source.readText());
			if (!settings.isExpressionMode() && text.length() > 0 && text.charAt(text.length() - 1) != '\n') {
				text.append('\n');
			}
		}
		Node tree = settings.isExpressionMode()
				? SourceReader.parseExpression(text.toString().trim())
				: SourceReader.parse(text.toString());
		JoxLogger.traceTree(LOG, "Parsed", tree);

		if (!settings.getVariables().isEmpty()) {
			Map<String, Node> replacements = new LinkedHashMap<String, Node>();
			for (Map.Entry<String, Object> variable : settings.getVariables().entrySet()) {
				replacements.put(variable.getKey(), NodeProxy.unwrap(NodeProxy.lift(variable.getValue())));
			}
			tree = Substitution.substitute(tree, replacements);
			JoxLogger.traceTree(LOG, "Substituted", tree);
		}
		if (settings.isSimplify()) {
			tree = Simplifier.simplify(tree);
			JoxLogger.traceTree(LOG, "Simplified", tree);
		}
		lastTree = tree;
		return tree;
	}

	/**
	 * Writes a tree to the output stream of the settings: its dump, its free
	 * variables one per line, or its source text.
	 *
	 * @param tree the tree to write
	 */
	public void invoke(Node tree) {
		if (settings.isDumpSyntaxTree()) {
			tree.dump(settings.getOutputStream());
		} else if (settings.isPrintFreeVariables()) {
			for (String name : FreeVariables.of(tree)) {
				settings.getOutputStream().println(name);
			}
		} else {
			String source = SourceEmitter.emit(tree, EmitContext.withIndentWidth(settings.getIndentWidth()));
			if (tree.isStatement()) {
				settings.getOutputStream().print(source);
			} else {
				settings.getOutputStream().println(source);
			}
		}
		settings.getOutputStream().flush();
	}

	/**
	 * @return the tree produced by the last call to {@link #transform(List)}, or {@code null}
	 */
	public Node getLastTree() {
		return lastTree;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JoxSettings getSettings() {
		return settings;
	}
}
