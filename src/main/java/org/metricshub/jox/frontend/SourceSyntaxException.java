package org.metricshub.jox.frontend;

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

import org.metricshub.jox.JoxException;

/**
 * Thrown by {@link SourceReader} when the text does not follow the grammar,
 * with the position where reading stopped.
 */
public class SourceSyntaxException extends JoxException {

	private static final long serialVersionUID = 1L;

	private final int line;
	private final int column;

	/**
	 * @param message what was wrong
	 * @param line 1-based line number
	 * @param column 1-based column number
	 */
	public SourceSyntaxException(String message, int line, int column) {
		super(message + " (line " + line + ", column " + column + ")");
		this.line = line;
		this.column = column;
	}

	/**
	 * @param message what was wrong
	 * @param line 1-based line number
	 * @param column 1-based column number
	 * @param cause the error that made the text unreadable
	 */
	public SourceSyntaxException(String message, int line, int column, Throwable cause) {
		super(message + " (line " + line + ", column " + column + ")", cause);
		this.line = line;
		this.column = column;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}
}
