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

/**
 * State of one emission job: the text produced so far and the current
 * indentation level of statement lines.
 */
public class EmitContext {

	/** Four spaces, the conventional indentation unit */
	public static final String DEFAULT_INDENTATION = "    ";

	private final StringBuilder out = new StringBuilder();
	private final String indentation;
	private int level;

	public EmitContext() {
		this(DEFAULT_INDENTATION);
	}

	/**
	 * @param indentation text written once per indentation level at the start of a line
	 */
	public EmitContext(String indentation) {
		if (indentation == null || indentation.isEmpty() || indentation.trim().length() > 0) {
			throw new IllegalArgumentException("Indentation must be made of blanks: '" + indentation + "'");
		}
		this.indentation = indentation;
	}

	/**
	 * @param width number of spaces per indentation level
	 * @return a context indenting with {@code width} spaces
	 */
	public static EmitContext withIndentWidth(int width) {
		if (width < 1) {
			throw new IllegalArgumentException("Indentation width must be positive: " + width);
		}
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < width; i++) {
			sb.append(' ');
		}
		return new EmitContext(sb.toString());
	}

	public String getIndentation() {
		return indentation;
	}

	public int getLevel() {
		return level;
	}

	public void indent() {
		level++;
	}

	/**
	 * @throws IllegalStateException when already at the outermost level
	 */
	public void dedent() {
		if (level == 0) {
			throw new IllegalStateException("Cannot dedent below level 0");
		}
		level--;
	}

	/**
	 * @return the indentation for the current level
	 */
	public String startLine() {
		StringBuilder sb = new StringBuilder(indentation.length() * level);
		for (int i = 0; i < level; i++) {
			sb.append(indentation);
		}
		return sb.toString();
	}

	/**
	 * Writes one indented line.
	 *
	 * @param text line contents, without the newline
	 */
	public void line(String text) {
		out.append(startLine()).append(text).append('\n');
	}

	public void append(String text) {
		out.append(text);
	}

	/**
	 * @return everything written so far
	 */
	public String getText() {
		return out.toString();
	}
}
