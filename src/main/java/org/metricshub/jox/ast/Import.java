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
 * Import statement {@code import module [as alias]}.
 */
public final class Import extends Node {

	private final String module;
	private final String alias;

	public Import(String module) {
		this(module, null);
	}

	/**
	 * @param module dotted module name
	 * @param alias local name, or {@code null} to bind the first component of the module name
	 */
	public Import(String module, String alias) {
		super(NodeKind.IMPORT);
		if (!Identifiers.isValidDotted(module)) {
			throw new MalformedNodeException(NodeKind.IMPORT, "invalid module name " + module);
		}
		this.module = module;
		this.alias = alias == null ? null : requireIdentifier(NodeKind.IMPORT, "alias", alias);
	}

	public String getModule() {
		return module;
	}

	/**
	 * @return the alias, or {@code null} when there is none
	 */
	public String getAlias() {
		return alias;
	}

	/**
	 * @return the name this statement binds in the enclosing scope
	 */
	public String boundName() {
		if (alias != null) {
			return alias;
		}
		int dot = module.indexOf('.');
		return dot < 0 ? module : module.substring(0, dot);
	}

	@Override
	public List<Node> children() {
		return Collections.emptyList();
	}

	@Override
	protected String dumpLabel() {
		return alias == null ? "Import " + module : "Import " + module + " as " + alias;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Import)) {
			return false;
		}
		Import other = (Import) o;
		return module.equals(other.module) && Objects.equals(alias, other.alias);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.IMPORT, module, alias);
	}

	@Override
	public String toString() {
		return alias == null ? "Import(" + module + ")" : "Import(" + module + ", " + alias + ")";
	}
}
