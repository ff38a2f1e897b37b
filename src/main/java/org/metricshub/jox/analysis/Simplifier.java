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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import org.metricshub.jox.ast.Atom;
import org.metricshub.jox.ast.BinOp;
import org.metricshub.jox.ast.BinaryOperator;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.ast.NodeKind;
import org.metricshub.jox.ast.UnaryOp;
import org.metricshub.jox.util.JoxLogger;
import org.slf4j.Logger;

/**
 * Constant folding.
 * <p>
 * Operators applied to literal operands are replaced by their result, bottom
 * up, so a single pass reaches a fixed point. Arithmetic follows the target
 * language: integers stay integers except for {@code /} and negative
 * exponents, any float operand makes the result a float, and booleans are not
 * numbers. An operation is left alone when evaluating it would fail or
 * leave the 64-bit integer range, when the result is not a finite float, and
 * for {@code is}, {@code in}, {@code not in}, {@code is not} and {@code @}.
 */
public final class Simplifier extends NodeTransformer {

	private static final Logger LOG = JoxLogger.getLogger(Simplifier.class);

	private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
	private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

	/** Integers up to this magnitude convert to {@code double} exactly */
	private static final long EXACT_DOUBLE_LIMIT = 1L << 53;

	/**
	 * Enough digits that rounding a quotient of two longs to this precision
	 * can never land on a tie between two doubles.
	 */
	private static final MathContext QUOTIENT_CONTEXT = new MathContext(128, RoundingMode.HALF_EVEN);

	private Simplifier() {}

	/**
	 * @param node the tree to fold
	 * @return the folded tree, {@code node} itself when nothing could be folded
	 */
	public static Node simplify(Node node) {
		return new Simplifier().transformAny(node);
	}

	@Override
	protected Node transform(BinOp node) {
		Node result = super.transform(node);
		if (result.kind() != NodeKind.BIN_OP) {
			return result;
		}
		BinOp op = (BinOp) result;
		if (op.getLeft().kind() != NodeKind.ATOM || op.getRight().kind() != NodeKind.ATOM) {
			return result;
		}
		Atom folded = foldBinary(op, ((Atom) op.getLeft()).getValue(), ((Atom) op.getRight()).getValue());
		if (folded == null) {
			return result;
		}
		LOG.debug("Folded {} into {}", op, folded);
		return folded;
	}

	@Override
	protected Node transform(UnaryOp node) {
		Node result = super.transform(node);
		if (result.kind() != NodeKind.UNARY_OP) {
			return result;
		}
		UnaryOp op = (UnaryOp) result;
		if (op.getOperand().kind() != NodeKind.ATOM) {
			return result;
		}
		Atom folded = foldUnary(op, ((Atom) op.getOperand()).getValue());
		if (folded == null) {
			return result;
		}
		LOG.debug("Folded {} into {}", op, folded);
		return folded;
	}

	/**
	 * @return the folded literal, or {@code null} when the operation must stay
	 */
	private static Atom foldUnary(UnaryOp op, Object value) {
		switch (op.getOperator()) {
		case NOT:
			return value instanceof Boolean ? new Atom(!(Boolean) value) : null;
		case NEG:
			if (value instanceof Long) {
				long l = (Long) value;
				return l == Long.MIN_VALUE ? null : new Atom(-l);
			}
			return value instanceof Double ? new Atom(-(Double) value) : null;
		case POS:
			return value instanceof Long || value instanceof Double ? new Atom(value) : null;
		case INVERT:
			return value instanceof Long ? new Atom(~(Long) value) : null;
		default:
			return null;
		}
	}

	/**
	 * @return the folded literal, or {@code null} when the operation must stay
	 */
	private static Atom foldBinary(BinOp op, Object left, Object right) {
		switch (op.getOperator()) {
		case AND:
			if (left instanceof Boolean && right instanceof Boolean) {
				return new Atom((Boolean) left && (Boolean) right);
			}
			return null;
		case OR:
			if (left instanceof Boolean && right instanceof Boolean) {
				return new Atom((Boolean) left || (Boolean) right);
			}
			return null;
		case EQ:
		case NE:
			Boolean equal = literalEquals(left, right);
			if (equal == null) {
				return null;
			}
			return new Atom(op.getOperator() == BinaryOperator.EQ ? equal : !equal);
		case LT:
		case LE:
		case GT:
		case GE:
			Integer cmp = compare(left, right);
			if (cmp == null) {
				return null;
			}
			return new Atom(ordering(op, cmp));
		case ADD:
			if (left instanceof String && right instanceof String) {
				return new Atom((String) left + (String) right);
			}
			return arithmetic(op, left, right);
		case SUB:
		case MUL:
		case DIV:
		case FLOOR_DIV:
		case MOD:
		case POW:
			return arithmetic(op, left, right);
		case BIT_AND:
		case BIT_OR:
		case BIT_XOR:
		case LSHIFT:
		case RSHIFT:
			if (left instanceof Long && right instanceof Long) {
				return bitwise(op, (Long) left, (Long) right);
			}
			return null;
		default:
			// is, is not, in, not in, @
			return null;
		}
	}

	private static boolean ordering(BinOp op, int cmp) {
		switch (op.getOperator()) {
		case LT:
			return cmp < 0;
		case LE:
			return cmp <= 0;
		case GT:
			return cmp > 0;
		default:
			return cmp >= 0;
		}
	}

	private static boolean isNumber(Object value) {
		return value instanceof Long || value instanceof Double;
	}

	/**
	 * @return whether two literals are equal, or {@code null} if that depends on
	 *         rules the folder does not model (booleans against numbers)
	 */
	private static Boolean literalEquals(Object left, Object right) {
		if (left == null || right == null) {
			return left == right;
		}
		if (isNumber(left) && isNumber(right)) {
			return compare(left, right) == 0;
		}
		if (left instanceof String && right instanceof String || left instanceof Boolean && right instanceof Boolean) {
			return left.equals(right);
		}
		if (left instanceof String || right instanceof String) {
			return Boolean.FALSE;
		}
		return null;
	}

	private static Integer compare(Object left, Object right) {
		if (left instanceof Long && right instanceof Long) {
			return Long.compare((Long) left, (Long) right);
		}
		if (isNumber(left) && isNumber(right)) {
			return decimal(left).compareTo(decimal(right));
		}
		if (left instanceof String && right instanceof String) {
			return compareCodePoints((String) left, (String) right);
		}
		return null;
	}

	/**
	 * Orders strings by code point, not by UTF-16 unit: a character beyond
	 * U+FFFF sorts after every character of the basic plane.
	 */
	static int compareCodePoints(String left, String right) {
		int i = 0;
		int j = 0;
		while (i < left.length() && j < right.length()) {
			int a = left.codePointAt(i);
			int b = right.codePointAt(j);
			if (a != b) {
				return a < b ? -1 : 1;
			}
			i += Character.charCount(a);
			j += Character.charCount(b);
		}
		boolean leftDone = i >= left.length();
		boolean rightDone = j >= right.length();
		return leftDone == rightDone ? 0 : leftDone ? -1 : 1;
	}

	private static BigDecimal decimal(Object number) {
		if (number instanceof Long) {
			return BigDecimal.valueOf((Long) number);
		}
		return new BigDecimal((Double) number);
	}

	private static Atom arithmetic(BinOp op, Object left, Object right) {
		if (left instanceof Long && right instanceof Long) {
			return integerArithmetic(op, (Long) left, (Long) right);
		}
		if (isNumber(left) && isNumber(right)) {
			return floatArithmetic(op, ((Number) left).doubleValue(), ((Number) right).doubleValue());
		}
		return null;
	}

	private static Atom integerArithmetic(BinOp op, long a, long b) {
		BigInteger x = BigInteger.valueOf(a);
		BigInteger y = BigInteger.valueOf(b);
		switch (op.getOperator()) {
		case ADD:
			return integer(x.add(y));
		case SUB:
			return integer(x.subtract(y));
		case MUL:
			return integer(x.multiply(y));
		case DIV:
			return trueDivide(a, b);
		case FLOOR_DIV:
			if (b == 0) {
				return null;
			}
			BigInteger[] qr = x.divideAndRemainder(y);
			BigInteger q = qr[0];
			if (qr[1].signum() != 0 && qr[1].signum() != y.signum()) {
				q = q.subtract(BigInteger.ONE);
			}
			return integer(q);
		case MOD:
			if (b == 0) {
				return null;
			}
			return new Atom(Math.floorMod(a, b));
		case POW:
			if (b < 0) {
				return floatArithmetic(op, a, b);
			}
			return integer(power(x, b));
		default:
			return null;
		}
	}

	/**
	 * @return {@code x ** exponent}, or {@code null} if the result cannot fit in 64 bits
	 */
	private static BigInteger power(BigInteger x, long exponent) {
		if (exponent == 0) {
			return BigInteger.ONE;
		}
		if (x.signum() == 0 || x.equals(BigInteger.ONE)) {
			return x;
		}
		if (x.equals(BigInteger.ONE.negate())) {
			return exponent % 2 == 0 ? BigInteger.ONE : x;
		}
		if (exponent > 63) {
			return null;
		}
		return x.pow((int) exponent);
	}

	/**
	 * Integer true division, rounded once to the nearest double.
	 */
	private static Atom trueDivide(long a, long b) {
		if (b == 0) {
			return null;
		}
		if (Math.abs(a) <= EXACT_DOUBLE_LIMIT && Math.abs(b) <= EXACT_DOUBLE_LIMIT) {
			return new Atom((double) a / (double) b);
		}
		BigDecimal quotient = BigDecimal.valueOf(a).divide(BigDecimal.valueOf(b), QUOTIENT_CONTEXT);
		return new Atom(quotient.doubleValue());
	}

	private static Atom integer(BigInteger value) {
		if (value == null || value.compareTo(LONG_MIN) < 0 || value.compareTo(LONG_MAX) > 0) {
			return null;
		}
		return new Atom(value.longValue());
	}

	private static Atom floatArithmetic(BinOp op, double a, double b) {
		double result;
		switch (op.getOperator()) {
		case ADD:
			result = a + b;
			break;
		case SUB:
			result = a - b;
			break;
		case MUL:
			result = a * b;
			break;
		case DIV:
			if (b == 0) {
				return null;
			}
			result = a / b;
			break;
		case FLOOR_DIV:
			if (b == 0) {
				return null;
			}
			result = floorDivide(a, b);
			break;
		case MOD:
			if (b == 0) {
				return null;
			}
			result = floorModulo(a, b);
			break;
		case POW:
			if (a == 0 && b < 0 || a < 0 && b != Math.rint(b)) {
				return null;
			}
			result = Math.pow(a, b);
			break;
		default:
			return null;
		}
		if (Double.isNaN(result) || Double.isInfinite(result)) {
			return null;
		}
		return new Atom(result);
	}

	/**
	 * Remainder with the sign of the divisor. A zero remainder takes the sign
	 * of the divisor too.
	 */
	private static double floorModulo(double a, double b) {
		double mod = a % b;
		if (mod != 0) {
			if ((b < 0) != (mod < 0)) {
				mod += b;
			}
		} else {
			mod = Math.copySign(0.0, b);
		}
		return mod;
	}

	/**
	 * Floor division derived from the exact remainder, so that
	 * {@code a == b * (a // b) + a % b} holds as closely as doubles allow.
	 * {@code Math.floor(a / b)} differs when the quotient rounds up to an
	 * integer, e.g. {@code 1 // 0.1}.
	 */
	private static double floorDivide(double a, double b) {
		double mod = a % b;
		double div = (a - mod) / b;
		if (mod != 0 && (b < 0) != (mod < 0)) {
			div -= 1.0;
		}
		if (div == 0) {
			return Math.copySign(0.0, a / b);
		}
		double floorDiv = Math.floor(div);
		if (div - floorDiv > 0.5) {
			floorDiv += 1.0;
		}
		return floorDiv;
	}

	private static Atom bitwise(BinOp op, long a, long b) {
		switch (op.getOperator()) {
		case BIT_AND:
			return new Atom(a & b);
		case BIT_OR:
			return new Atom(a | b);
		case BIT_XOR:
			return new Atom(a ^ b);
		case LSHIFT:
			if (b < 0) {
				return null;
			}
			if (a == 0) {
				return new Atom(0L);
			}
			return b > 63 ? null : integer(BigInteger.valueOf(a).shiftLeft((int) b));
		case RSHIFT:
			if (b < 0) {
				return null;
			}
			return new Atom(a >> Math.min(b, 63));
		default:
			return null;
		}
	}
}
