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
 * Thrown by the S-expression constructor when the head symbol is not in the
 * shape table, or when the number of arguments does not match the arity
 * expected for that head.
 */
public class UnknownFormException extends JoxException {

	private static final long serialVersionUID = 1L;

	private final String head;

	private final int arity;

	/**
	 * @param head the head symbol that was requested
	 * @param arity the number of arguments that were supplied
	 * @param message description of the mismatch
	 */
	public UnknownFormException(String head, int arity, String message) {
		super(message);
		this.head = head;
		this.arity = arity;
	}

	/**
	 * @return the offending head symbol
	 */
	public String getHead() {
		return head;
	}

	/**
	 * @return the number of arguments supplied with the head
	 */
	public int getArity() {
		return arity;
	}
}
