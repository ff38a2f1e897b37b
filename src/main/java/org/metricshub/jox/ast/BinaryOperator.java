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
import java.util.HashMap;
import java.util.Map;

/**
 * Binary operators of the target language, by increasing precedence.
 * <p>
 * Each constant carries its source symbol, its precedence level (see
 * {@link Precedence}) and its associativity. {@code and} and {@code or} are
 * grouped to the right: {@code a or b or c} is {@code a or (b or c)}.
 */
public enum BinaryOperator {
	OR("or", Precedence.OR, Associativity.RIGHT),
	AND("and", Precedence.AND, Associativity.RIGHT),

	EQ("==", Precedence.COMPARISON, Associativity.NONE),
	NE("!=", Precedence.COMPARISON, Associativity.NONE),
	LT("<", Precedence.COMPARISON, Associativity.NONE),
	LE("<=", Precedence.COMPARISON, Associativity.NONE),
	GT(">", Precedence.COMPARISON, Associativity.NONE),
	GE(">=", Precedence.COMPARISON, Associativity.NONE),
	IS("is", Precedence.COMPARISON, Associativity.NONE),
	IS_NOT("is not", Precedence.COMPARISON, Associativity.NONE),
	IN("in", Precedence.COMPARISON, Associativity.NONE),
	NOT_IN("not in", Precedence.COMPARISON, Associativity.NONE),

	BIT_OR("|", Precedence.BIT_OR, Associativity.LEFT),
	BIT_XOR("^", Precedence.BIT_XOR, Associativity.LEFT),
	BIT_AND("&", Precedence.BIT_AND, Associativity.LEFT),
	LSHIFT("<<", Precedence.SHIFT, Associativity.LEFT),
	RSHIFT(">>", Precedence.SHIFT, Associativity.LEFT),

	ADD("+", Precedence.ARITHMETIC, Associativity.LEFT),
	SUB("-", Precedence.ARITHMETIC, Associativity.LEFT),

	MUL("*", Precedence.TERM, Associativity.LEFT),
	DIV("/", Precedence.TERM, Associativity.LEFT),
	FLOOR_DIV("//", Precedence.TERM, Associativity.LEFT),
	MOD("%", Precedence.TERM, Associativity.LEFT),
	MAT_MUL("@", Precedence.TERM, Associativity.LEFT),

	POW("**", Precedence.POWER, Associativity.RIGHT);

	private static final Map<String, BinaryOperator> BY_SYMBOL;

	static {
		Map<String, BinaryOperator> map = new HashMap<String, BinaryOperator>();
		for (BinaryOperator op : values()) {
			map.put(op.symbol, op);
		}
		BY_SYMBOL = Collections.unmodifiableMap(map);
	}

	private final String symbol;
	private final int precedence;
	private final Associativity associativity;

	BinaryOperator(String symbol, int precedence, Associativity associativity) {
		this.symbol = symbol;
		this.precedence = precedence;
		this.associativity = associativity;
	}

	/**
	 * Look up an operator by its source symbol.
	 *
	 * @param symbol the operator as written in source, e.g. {@code "//"} or {@code "not in"}
	 * @return the operator, or {@code null} if the symbol is not a binary operator
	 */
	public static BinaryOperator fromSymbol(String symbol) {
		return symbol == null ? null : BY_SYMBOL.get(symbol);
	}

	public String symbol() {
		return symbol;
	}

	public int precedence() {
		return precedence;
	}

	public Associativity associativity() {
		return associativity;
	}

	/**
	 * @return {@code true} if the operator is spelled with reserved words
	 */
	public boolean isReservedWord() {
		return Character.isLetter(symbol.charAt(0));
	}

	public boolean isComparison() {
		return precedence == Precedence.COMPARISON;
	}

	/**
	 * @return {@code true} if the operator has an augmented assignment form, e.g. {@code +=}
	 */
	public boolean isAugmentable() {
		return precedence > Precedence.COMPARISON;
	}

	@Override
	public String toString() {
		return symbol;
	}
}
