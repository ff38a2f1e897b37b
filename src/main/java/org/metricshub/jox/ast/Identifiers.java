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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Identifier rules of the target language.
 * <p>
 * Reserved words cannot be used as names, parameters, attribute fields or
 * keyword-argument names.
 */
public final class Identifiers {

	/**
	 * Reserved words of the target language.
	 */
	public static final Set<String> KEYWORDS = Collections
			.unmodifiableSet(
					new HashSet<String>(
							Arrays
									.asList(
											"False",
											"None",
											"True",
											"and",
											"as",
											"assert",
											"async",
											"await",
											"break",
											"class",
											"continue",
											"def",
											"del",
											"elif",
											"else",
											"except",
											"finally",
											"for",
											"from",
											"global",
											"if",
											"import",
											"in",
											"is",
											"lambda",
											"nonlocal",
											"not",
											"or",
											"pass",
											"raise",
											"return",
											"try",
											"while",
											"with",
											"yield")));

	private Identifiers() {}

	public static boolean isIdentifierStart(int c) {
		return c == '_' || Character.isLetter(c);
	}

	public static boolean isIdentifierPart(int c) {
		return c == '_' || Character.isLetterOrDigit(c);
	}

	/**
	 * @param id candidate identifier
	 * @return {@code true} if {@code id} is a well-formed identifier and not a reserved word
	 */
	public static boolean isValid(String id) {
		if (id == null || id.isEmpty() || KEYWORDS.contains(id)) {
			return false;
		}
		if (!isIdentifierStart(id.charAt(0))) {
			return false;
		}
		for (int i = 1; i < id.length(); i++) {
			if (!isIdentifierPart(id.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @param name candidate dotted name such as {@code os.path}
	 * @return {@code true} if every component is a valid identifier
	 */
	public static boolean isValidDotted(String name) {
		if (name == null || name.isEmpty() || name.startsWith(".") || name.endsWith(".")) {
			return false;
		}
		for (String part : name.split("\\.", -1)) {
			if (!isValid(part)) {
				return false;
			}
		}
		return true;
	}
}
