package org.metricshub.jox.util;

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
import java.io.PrintStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A simple container for the parameters of a single Jox run.
 * These values have defaults, which may be changed through command line
 * arguments, or from Java code when Jox is used as a library.
 */
public class JoxSettings {

	/**
	 * Values to substitute for free names before simplifying
	 * ({@code -v} assignments). The values may be of type {@code Long},
	 * {@code Double} or {@code String}, or any value a builder proxy can lift.
	 */
	private Map<String, Object> variables = new LinkedHashMap<String, Object>();

	/**
	 * Number of spaces per indentation level in the emitted source;
	 * 4 by default.
	 */
	private int indentWidth = 4;

	/**
	 * Whether constant folding runs before output;
	 * <code>true</code> by default.
	 */
	private boolean simplify = true;

	/**
	 * Whether the source is a single expression rather than a module.
	 */
	private boolean expressionMode = false;

	/**
	 * Whether to print the tree dump instead of the emitted source.
	 */
	private boolean dumpSyntaxTree = false;

	/**
	 * Whether to print the free variables instead of the emitted source.
	 */
	private boolean printFreeVariables = false;

	/**
	 * Output stream;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("variables = ").append(getVariables()).append(newLine);
		desc.append("indentWidth = ").append(getIndentWidth()).append(newLine);
		desc.append("simplify = ").append(isSimplify()).append(newLine);
		desc.append("expressionMode = ").append(isExpressionMode()).append(newLine);
		desc.append("dumpSyntaxTree = ").append(isDumpSyntaxTree()).append(newLine);
		desc.append("printFreeVariables = ").append(isPrintFreeVariables()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return the variable assignments, in the order they were given
	 */
	public Map<String, Object> getVariables() {
		return Collections.unmodifiableMap(variables);
	}

	/**
	 * @param name free name to replace
	 * @param value the value to put in its place
	 */
	public void putVariable(String name, Object value) {
		variables.put(name, value);
	}

	public int getIndentWidth() {
		return indentWidth;
	}

	/**
	 * @param indentWidth number of spaces per indentation level, at least 1
	 */
	public void setIndentWidth(int indentWidth) {
		if (indentWidth < 1) {
			throw new IllegalArgumentException("Indentation width must be positive: " + indentWidth);
		}
		this.indentWidth = indentWidth;
	}

	public boolean isSimplify() {
		return simplify;
	}

	public void setSimplify(boolean simplify) {
		this.simplify = simplify;
	}

	public boolean isExpressionMode() {
		return expressionMode;
	}

	public void setExpressionMode(boolean expressionMode) {
		this.expressionMode = expressionMode;
	}

	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	public void setDumpSyntaxTree(boolean dumpSyntaxTree) {
		this.dumpSyntaxTree = dumpSyntaxTree;
	}

	public boolean isPrintFreeVariables() {
		return printFreeVariables;
	}

	public void setPrintFreeVariables(boolean printFreeVariables) {
		this.printFreeVariables = printFreeVariables;
	}

	/**
	 * @return the stream receiving the output
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * @param outputStream the stream receiving the output
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}
}
