package org.metricshub.jox.builder;

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
import java.util.Map;

/**
 * Operations that build a larger expression from the receiver, one per
 * operator the target language lets objects overload. Operands are lifted
 * with {@link NodeProxy#lift(Object)}.
 * <p>
 * Operators spelled as reserved words ({@code and}, {@code or}, {@code not},
 * {@code is}, {@code in}) cannot be overloaded and are deliberately absent.
 *
 * @param <P> the type wrapping the built expression
 */
public interface ExpressionOperations<P> {

	P add(Object other);

	P sub(Object other);

	P mul(Object other);

	P div(Object other);

	P floorDiv(Object other);

	P mod(Object other);

	P pow(Object other);

	P matMul(Object other);

	P lshift(Object other);

	P rshift(Object other);

	P bitAnd(Object other);

	P bitOr(Object other);

	P bitXor(Object other);

	P eq(Object other);

	P ne(Object other);

	P lt(Object other);

	P le(Object other);

	P gt(Object other);

	P ge(Object other);

	/** {@code other + this} */
	P radd(Object other);

	/** {@code other - this} */
	P rsub(Object other);

	/** {@code other * this} */
	P rmul(Object other);

	/** {@code other / this} */
	P rdiv(Object other);

	/** {@code other ** this} */
	P rpow(Object other);

	P neg();

	P pos();

	P invert();

	/**
	 * @param field attribute name
	 * @return {@code this.field}
	 */
	P attr(String field);

	/**
	 * @param args positional arguments
	 * @return {@code this(args...)}
	 */
	P call(Object... args);

	/**
	 * @param args positional arguments
	 * @param kwargs keyword arguments, in the order they must appear
	 * @return {@code this(args..., key=value...)}
	 */
	P call(List<?> args, Map<String, ?> kwargs);

	/**
	 * @param index subscript
	 * @return {@code this[index]}
	 */
	P index(Object index);
}
