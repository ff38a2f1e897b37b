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

/**
 * Thrown by {@link org.metricshub.jox.builder.NodeProxy} when asked for an
 * operator that the target language spells as a reserved word (for instance
 * {@code and}, {@code or}, {@code is}). Such operators cannot be trapped by
 * operator overloading in the target language, so they are not offered by the
 * proxy either: build them with
 * {@link org.metricshub.jox.sexpr.SExpressions#build(String, Object...)}.
 */
public class UnsupportedProxyOperationException extends JoxException {

	private static final long serialVersionUID = 1L;

	private final String operator;

	/**
	 * @param operator the operator symbol that was requested
	 */
	public UnsupportedProxyOperationException(String operator) {
		super("Operator '" + operator + "' cannot be expressed through the builder proxy; use SExpressions.build(\""
				+ operator + "\", ...) instead");
		this.operator = operator;
	}

	/**
	 * @return the rejected operator symbol
	 */
	public String getOperator() {
		return operator;
	}
}
