package org.metricshub.jox.analysis;

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

import java.util.Collection;

/**
 * Immutable chain of bound names.
 * <p>
 * Binding a name never modifies a scope: it returns a new scope layered over
 * the current one. A nested body therefore starts from its enclosing scope,
 * and whatever it binds is dropped once the walker returns to the enclosing
 * scope object.
 */
public final class Scope {

	private static final Scope EMPTY = new Scope(null, null);

	private final Scope parent;
	private final String name;

	private Scope(Scope parent, String name) {
		this.parent = parent;
		this.name = name;
	}

	/**
	 * @return the scope in which no name is bound
	 */
	public static Scope empty() {
		return EMPTY;
	}

	/**
	 * @param names names to bind
	 * @return a scope binding exactly {@code names}
	 */
	public static Scope of(String... names) {
		Scope scope = EMPTY;
		for (String n : names) {
			scope = scope.bind(n);
		}
		return scope;
	}

	/**
	 * @param id name to bind
	 * @return a new scope where {@code id} is bound in addition to the names bound here
	 */
	public Scope bind(String id) {
		if (isBound(id)) {
			return this;
		}
		return new Scope(this, id);
	}

	public Scope bindAll(Collection<String> ids) {
		Scope scope = this;
		for (String id : ids) {
			scope = scope.bind(id);
		}
		return scope;
	}

	public boolean isBound(String id) {
		for (Scope s = this; s != EMPTY; s = s.parent) {
			if (s.name.equals(id)) {
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("Scope[");
		for (Scope s = this; s != EMPTY; s = s.parent) {
			sb.append(s.name);
			if (s.parent != EMPTY) {
				sb.append(", ");
			}
		}
		return sb.append(']').toString();
	}
}
