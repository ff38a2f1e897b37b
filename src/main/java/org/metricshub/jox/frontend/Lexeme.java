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

/**
 * One token read from the source, with its text and position.
 */
final class Lexeme {

	private final Token token;
	private final String text;
	private final int line;
	private final int column;

	Lexeme(Token token, String text, int line, int column) {
		this.token = token;
		this.text = text;
		this.line = line;
		this.column = column;
	}

	Token getToken() {
		return token;
	}

	/**
	 * @return the token text; for a string literal, its decoded value
	 */
	String getText() {
		return text;
	}

	int getLine() {
		return line;
	}

	int getColumn() {
		return column;
	}

	@Override
	public String toString() {
		switch (token) {
		case NEWLINE:
		case INDENT:
		case DEDENT:
		case EOF:
			return token.name();
		default:
			return "'" + text + "'";
		}
	}
}
