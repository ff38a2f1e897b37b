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

import org.metricshub.jox.ast.NodeKind;

/**
 * Thrown when a node constructor receives a payload that violates the shape
 * of its variant. Nothing is constructed and no state is left behind, so the
 * caller may recover and retry with a corrected payload.
 */
public class MalformedNodeException extends JoxException {

	private static final long serialVersionUID = 1L;

	private final NodeKind kind;

	/**
	 * Creates a new exception for the specified node kind.
	 *
	 * @param kind the variant whose constructor rejected the payload
	 * @param message what is wrong with the payload
	 */
	public MalformedNodeException(NodeKind kind, String message) {
		super(kind.label() + ": " + message);
		this.kind = kind;
	}

	/**
	 * @return the variant whose constructor rejected the payload
	 */
	public NodeKind getKind() {
		return kind;
	}
}
