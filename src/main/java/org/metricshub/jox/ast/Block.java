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

import java.util.List;
import java.util.Objects;

/**
 * Sequence of statements. Blocks nested in the statement list are spliced
 * in, so a block never directly contains another block.
 */
public final class Block extends Node {

	private final List<Node> statements;

	public Block(List<? extends Node> statements) {
		super(NodeKind.BLOCK);
		this.statements = requireBody(NodeKind.BLOCK, "statements", statements);
	}

	public List<Node> getStatements() {
		return statements;
	}

	@Override
	public List<Node> children() {
		return statements;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof Block && statements.equals(((Block) o).statements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.BLOCK, statements);
	}

	@Override
	public String toString() {
		return "Block(" + join(statements) + ")";
	}
}
