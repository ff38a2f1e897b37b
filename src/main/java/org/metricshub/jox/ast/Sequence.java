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
import org.metricshub.jox.MalformedNodeException;

/**
 * List, tuple or set display. A set needs at least one element since
 * {@code {}} reads as an empty dictionary.
 */
public final class Sequence extends Node {

	private final SequenceKind sequenceKind;
	private final List<Node> elements;

	public Sequence(SequenceKind sequenceKind, List<? extends Node> elements) {
		super(NodeKind.SEQUENCE);
		if (sequenceKind == null) {
			throw new MalformedNodeException(NodeKind.SEQUENCE, "sequence kind must not be null");
		}
		this.sequenceKind = sequenceKind;
		this.elements = requireExpressions(NodeKind.SEQUENCE, "element", elements);
		if (sequenceKind == SequenceKind.SET && this.elements.isEmpty()) {
			throw new MalformedNodeException(NodeKind.SEQUENCE, "a set display needs at least one element");
		}
	}

	public SequenceKind getSequenceKind() {
		return sequenceKind;
	}

	public List<Node> getElements() {
		return elements;
	}

	@Override
	public List<Node> children() {
		return elements;
	}

	@Override
	protected String dumpLabel() {
		return "Sequence " + sequenceKind.head();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Sequence)) {
			return false;
		}
		Sequence other = (Sequence) o;
		return sequenceKind == other.sequenceKind && elements.equals(other.elements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.SEQUENCE, sequenceKind, elements);
	}

	@Override
	public String toString() {
		return "Sequence(" + sequenceKind.head() + ", " + join(elements) + ")";
	}
}
