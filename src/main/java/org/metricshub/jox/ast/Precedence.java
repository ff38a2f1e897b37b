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

/**
 * Binding strength of each syntactic level of the target grammar.
 * Higher values bind tighter.
 */
public final class Precedence {

	public static final int LAMBDA = 0;
	public static final int CONDITIONAL = 1;
	public static final int OR = 2;
	public static final int AND = 3;
	public static final int NOT = 4;
	public static final int COMPARISON = 5;
	public static final int BIT_OR = 6;
	public static final int BIT_XOR = 7;
	public static final int BIT_AND = 8;
	public static final int SHIFT = 9;
	public static final int ARITHMETIC = 10;
	public static final int TERM = 11;
	public static final int UNARY = 12;
	public static final int POWER = 13;
	public static final int POSTFIX = 14;
	public static final int ATOM = 15;

	private Precedence() {}
}
