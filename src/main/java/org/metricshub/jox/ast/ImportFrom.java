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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.metricshub.jox.MalformedNodeException;

/**
 * Import statement {@code from module import name [as alias], ...}.
 * <p>
 * The module may start with dots for a relative import ({@code "."},
 * {@code "..pkg"}). The single member {@code *} imports every public name
 * of the module and binds nothing that can be tracked.
 */
public final class ImportFrom extends Node {

	/** Member name of {@code from module import *} */
	public static final String WILDCARD = "*";

	/**
	 * One imported name with its optional alias.
	 */
	public static final class Member {

		private final String name;
		private final String alias;

		public Member(String name) {
			this(name, null);
		}

		public Member(String name, String alias) {
			this.name = name;
			this.alias = alias;
		}

		public String getName() {
			return name;
		}

		/**
		 * @return the alias, or {@code null} when there is none
		 */
		public String getAlias() {
			return alias;
		}

		/**
		 * @return the name this member binds in the enclosing scope
		 */
		public String boundName() {
			return alias != null ? alias : name;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (!(o instanceof Member)) {
				return false;
			}
			Member other = (Member) o;
			return Objects.equals(name, other.name) && Objects.equals(alias, other.alias);
		}

		@Override
		public int hashCode() {
			return Objects.hash(name, alias);
		}

		@Override
		public String toString() {
			return alias == null ? name : name + " as " + alias;
		}
	}

	private final String module;
	private final int level;
	private final List<Member> members;

	/**
	 * @param module dotted module name, optionally preceded by dots
	 * @param members imported names, in order
	 */
	public ImportFrom(String module, List<Member> members) {
		super(NodeKind.IMPORT_FROM);
		this.module = requireModule(module);
		this.level = leadingDots(module);
		if (members == null || members.isEmpty()) {
			throw new MalformedNodeException(NodeKind.IMPORT_FROM, "at least one imported name is required");
		}
		List<Member> copy = new ArrayList<Member>(members.size());
		for (Member member : members) {
			if (member == null) {
				throw new MalformedNodeException(NodeKind.IMPORT_FROM, "imported names must not contain null");
			}
			if (WILDCARD.equals(member.getName())) {
				if (members.size() != 1 || member.getAlias() != null) {
					throw new MalformedNodeException(NodeKind.IMPORT_FROM, "'*' must be the only imported name, without alias");
				}
			} else {
				requireIdentifier(NodeKind.IMPORT_FROM, "imported name", member.getName());
				if (member.getAlias() != null) {
					requireIdentifier(NodeKind.IMPORT_FROM, "alias", member.getAlias());
				}
			}
			copy.add(member);
		}
		this.members = Collections.unmodifiableList(copy);
	}

	private static String requireModule(String module) {
		if (module == null) {
			throw new MalformedNodeException(NodeKind.IMPORT_FROM, "module must not be null");
		}
		int dots = leadingDots(module);
		String name = module.substring(dots);
		if (name.isEmpty() ? dots == 0 : !Identifiers.isValidDotted(name)) {
			throw new MalformedNodeException(NodeKind.IMPORT_FROM, "invalid module name " + module);
		}
		return module;
	}

	private static int leadingDots(String module) {
		int dots = 0;
		while (dots < module.length() && module.charAt(dots) == '.') {
			dots++;
		}
		return dots;
	}

	/**
	 * @return the module, with its leading dots
	 */
	public String getModule() {
		return module;
	}

	/**
	 * @return the number of leading dots of the module, 0 for an absolute import
	 */
	public int getLevel() {
		return level;
	}

	public List<Member> getMembers() {
		return members;
	}

	public boolean isWildcard() {
		return WILDCARD.equals(members.get(0).getName());
	}

	/**
	 * @return the names this statement binds in the enclosing scope, empty for a wildcard import
	 */
	public List<String> boundNames() {
		if (isWildcard()) {
			return Collections.emptyList();
		}
		List<String> names = new ArrayList<String>(members.size());
		for (Member member : members) {
			names.add(member.boundName());
		}
		return Collections.unmodifiableList(names);
	}

	@Override
	public List<Node> children() {
		return Collections.emptyList();
	}

	@Override
	protected String dumpLabel() {
		return "ImportFrom " + module + " " + join(members);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ImportFrom)) {
			return false;
		}
		ImportFrom other = (ImportFrom) o;
		return module.equals(other.module) && members.equals(other.members);
	}

	@Override
	public int hashCode() {
		return Objects.hash(NodeKind.IMPORT_FROM, module, members);
	}

	@Override
	public String toString() {
		return "ImportFrom(" + module + ", " + join(members) + ")";
	}
}
