package org.metricshub.jox.ast;

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
import java.util.List;
import java.util.Objects;
import org.metricshub.jox.MalformedNodeException;

/**
 * Literal constant: an integer ({@link Long}), a finite float
 * ({@link Double}), a {@link String}, a {@link Boolean} or {@code null}
 * standing for {@code None}.
 * <p>
 * {@link Integer}, {@link Short} and {@link Byte} values are widened to
 * {@link Long}, and {@link Float} to {@link Double}, so that equal literals
 * always compare equal.
 */
public final class Atom extends Node {

	private final Object value;

	public Atom(Object value) {
		super(NodeKind.ATOM);
		this.value = normalize(value);
	}

	private static Object normalize(Object value) {
		if (value == null || value instanceof Long || value instanceof String || value instanceof Boolean) {
			return value;
		}
		if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return Long.valueOf(((Number) value).longValue());
		}
		if (value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				throw new MalformedNodeException(NodeKind.ATOM, "float literal must be finite, got " + d);
			}
			return Double.valueOf(d);
		}
		throw new MalformedNodeException(NodeKind.ATOM, "unsupported literal type " + value.getClass().getName());
	}

	/**
	 * @return the literal value, {@code null} for {@code None}
	 */
	public Object getValue() {
		return value;
	}

	public boolean isNone() {
		return value == null;
	}

	/**
	 * @return {@code true} for integer and float literals (booleans are not numbers)
	 */
	public boolean isNumber() {
		return value instanceof Long || value instanceof Double;
	}

	/**
	 * @return {@code true} for a number literal below zero
	 */
	public boolean isNegative() {
		if (value instanceof Long) {
			return (Long) value < 0;
		}
		if (value instanceof Double) {
			double d = (Double) value;
			return d < 0 || (d == 0 && 1 / d < 0);
		}
		return false;
	}

	@Override
	public List<Node> children() {
		return Collections.emptyList();
	}

	@Override
	protected String dumpLabel() {
		return "Atom " + repr(value);
	}

	/**
	 * Literal representation of a value as it would be read in source.
	 *
	 * @param value an atom value
	 * @return {@code None}, {@code True}, {@code 42}, {@code 1.5} or a quoted string
	 */
	public static String repr(Object value) {
		if (value == null) {
			return "None";
		}
		if (value instanceof Boolean) {
			return (Boolean) value ? "True" : "False";
		}
		if (value instanceof String) {
			return quote((String) value);
		}
		return value.toString();
	}

	/**
	 * Single-quotes a string, escaping backslashes, quotes and control characters.
	 */
	static String quote(String s) {
		StringBuilder sb = new StringBuilder(s.length() + 2);
		sb.append('\'');
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
			case '\\':
				sb.append("\\\\");
				break;
			case '\'':
				sb.append("\\'");
				break;
			case '\n':
				sb.append("\\n");
				break;
			case '\r':
				sb.append("\\r");
				break;
			case '\t':
				sb.append("\\t");
				break;
			default:
				if (c < 0x20 || c == 0x7f) {
					sb.append(String.format("\\x%02x", (int) c));
				} else {
					sb.append(c);
				}
			}
		}
		return sb.append('\'').toString();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Atom)) {
			return false;
		}
		return Objects.equals(value, ((Atom) o).value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.ATOM, value);
	}

	@Override
	public String toString() {
		return "Atom(" + repr(value) + ")";
	}
}
