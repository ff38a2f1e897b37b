package org.metricshub.jox.frontend;

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
 * Lexer token values.
 */
enum Token {
	EOF,
	NEWLINE,
	INDENT,
	DEDENT,
	NAME,
	INTEGER,
	FLOAT,
	STRING,

	OPEN_PAREN,
	CLOSE_PAREN,
	OPEN_BRACKET,
	CLOSE_BRACKET,
	OPEN_BRACE,
	CLOSE_BRACE,
	COMMA,
	COLON,
	SEMICOLON,
	DOT,
	EQUALS,
	// augmented assignment, the text is the symbol, e.g. "+="
	AUGMENTED,

	PLUS,
	MINUS,
	STAR,
	SLASH,
	DOUBLE_SLASH,
	PERCENT,
	AT,
	DOUBLE_STAR,
	LSHIFT,
	RSHIFT,
	AMPERSAND,
	PIPE,
	CARET,
	TILDE,
	EQ,
	NE,
	LT,
	LE,
	GT,
	GE,

	KW_DEF,
	KW_RETURN,
	KW_IF,
	KW_ELIF,
	KW_ELSE,
	KW_WHILE,
	KW_IMPORT,
	KW_FROM,
	KW_AS,
	KW_DEL,
	KW_PASS,
	KW_BREAK,
	KW_CONTINUE,
	KW_LAMBDA,
	KW_YIELD,
	KW_NOT,
	KW_AND,
	KW_OR,
	KW_IS,
	KW_IN,
	KW_TRUE,
	KW_FALSE,
	KW_NONE,
	// reserved words the reader does not support
	KW_OTHER
}
