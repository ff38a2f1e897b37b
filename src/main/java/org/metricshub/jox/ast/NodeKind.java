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
 * Variant tags of the {@link Node} model. The set is closed: every
 * {@link Node} subclass corresponds to exactly one constant, which lets the
 * algorithms dispatch with an exhaustive {@code switch}.
 */
public enum NodeKind {
	ATOM("Atom", false),
	NAME("Name", false),
	UNARY_OP("UnaryOp", false),
	BIN_OP("BinOp", false),
	CALL("Call", false),
	ATTRIBUTE("Attribute", false),
	SUBSCRIPT("Subscript", false),
	SEQUENCE("Sequence", false),
	CONDITIONAL("Conditional", false),
	LAMBDA("Lambda", false),
	YIELD("Yield", false),
	YIELD_FROM("YieldFrom", false),

	ASSIGN("Assign", true),
	INPLACE("Inplace", true),
	IF("If", true),
	WHILE("While", true),
	FUNCTION_DEF("FunctionDef", true),
	BLOCK("Block", true),
	IMPORT("Import", true),
	IMPORT_FROM("ImportFrom", true),
	RETURN("Return", true),
	DELETE("Delete", true),
	BREAK("Break", true),
	CONTINUE("Continue", true);

	private final String label;
	private final boolean statement;

	NodeKind(String label, boolean statement) {
		this.label = label;
		this.statement = statement;
	}

	/**
	 * @return the name used for this kind in dumps and error messages
	 */
	public String label() {
		return label;
	}

	/**
	 * @return {@code true} if nodes of this kind may only appear in a statement body
	 */
	public boolean isStatement() {
		return statement;
	}
}
