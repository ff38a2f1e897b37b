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
 * Prefix operators of the target language.
 */
public enum UnaryOperator {
	NOT("not", Precedence.NOT),
	NEG("-", Precedence.UNARY),
	POS("+", Precedence.UNARY),
	INVERT("~", Precedence.UNARY);

	private static final Map<String, UnaryOperator> BY_SYMBOL;

	static {
		Map<String, UnaryOperator> map = new HashMap<String, UnaryOperator>();
		for (UnaryOperator op : values()) {
			map.put(op.symbol, op);
		}
		BY_SYMBOL = Collections.unmodifiableMap(map);
	}

	private final String symbol;
	private final int precedence;

	UnaryOperator(String symbol, int precedence) {
		this.symbol = symbol;
		this.precedence = precedence;
	}

	/**
	 * @param symbol the operator as written in source
	 * @return the operator, or {@code null} if the symbol is not a prefix operator
	 */
	public static UnaryOperator fromSymbol(String symbol) {
		return symbol == null ? null : BY_SYMBOL.get(symbol);
	}

	public String symbol() {
		return symbol;
	}

	public int precedence() {
		return precedence;
	}

	public boolean isReservedWord() {
		return this == NOT;
	}

	@Override
	public String toString() {
		return symbol;
	}
}
