package org.metricshub.jox.sexpr;

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
import java.util.List;
import org.metricshub.jox.ast.Associativity;
import org.metricshub.jox.ast.BinaryOperator;
import org.metricshub.jox.ast.Node;

/**
 * Reduces a flat operator chain such as {@code [a, "+", b, "*", c]} to a tree
 * of binary operations, following the precedence and associativity of each
 * operator.
 * <p>
 * The operator with the highest precedence is joined first: the leftmost one
 * for left-associative operators, the rightmost one for right-associative
 * operators. So {@code [a, "+", b, "*", c]} gives {@code a + (b * c)} and
 * {@code [a, "**", b, "**", c]} gives {@code a ** (b ** c)}.
 */
public final class OperatorChain {

	private OperatorChain() {}

	/**
	 * @param chain alternating operands and operators, starting and ending
	 *        with an operand. Operators are {@link BinaryOperator} constants or
	 *        their symbols; operands are anything
	 *        {@link SExpressions#expression(Object)} accepts.
	 * @return the reduced tree
	 * @throws IllegalArgumentException if the chain does not alternate properly
	 */
	public static Node reduce(List<?> chain) {
		if (chain == null || chain.size() < 3 || chain.size() % 2 == 0) {
			throw new IllegalArgumentException("Operator chain must have an odd length of at least 3: " + chain);
		}
		List<Node> operands = new ArrayList<Node>();
		List<BinaryOperator> operators = new ArrayList<BinaryOperator>();
		for (int i = 0; i < chain.size(); i++) {
			if (i % 2 == 0) {
				operands.add(SExpressions.expression(chain.get(i)));
			} else {
				operators.add(operator(chain.get(i)));
			}
		}

		while (!operators.isEmpty()) {
			int pos = strongest(operators);
			BinaryOperator op = operators.remove(pos);
			Node joined = SExpressions.build(op.symbol(), operands.get(pos), operands.get(pos + 1));
			operands.set(pos, joined);
			operands.remove(pos + 1);
		}
		return operands.get(0);
	}

	private static int strongest(List<BinaryOperator> operators) {
		int best = 0;
		for (int i = 1; i < operators.size(); i++) {
			BinaryOperator candidate = operators.get(i);
			int precedence = candidate.precedence();
			int bestPrecedence = operators.get(best).precedence();
			if (precedence > bestPrecedence
					|| (precedence == bestPrecedence && candidate.associativity() == Associativity.RIGHT)) {
				best = i;
			}
		}
		return best;
	}

	private static BinaryOperator operator(Object item) {
		if (item instanceof BinaryOperator) {
			return (BinaryOperator) item;
		}
		BinaryOperator op = item instanceof String ? BinaryOperator.fromSymbol((String) item) : null;
		if (op == null) {
			throw new IllegalArgumentException("Not a binary operator: " + item);
		}
		return op;
	}
}
