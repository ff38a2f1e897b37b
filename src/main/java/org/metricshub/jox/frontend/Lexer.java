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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jox.ast.Identifiers;

/**
 * Splits source text into tokens.
 * <p>
 * Indentation is turned into {@link Token#INDENT} and {@link Token#DEDENT}
 * tokens and the end of each logical line into a {@link Token#NEWLINE}.
 * Blank lines, comment lines and line breaks inside brackets do not end a
 * logical line.
 */
final class Lexer {

	private static final int TAB_SIZE = 8;

	/**
	 * Reserved words, mapped to their token.
	 */
	private static final Map<String, Token> KEYWORDS = new HashMap<String, Token>();

	static {
		// statements
		KEYWORDS.put("def", Token.KW_DEF);
		KEYWORDS.put("return", Token.KW_RETURN);
		KEYWORDS.put("if", Token.KW_IF);
		KEYWORDS.put("elif", Token.KW_ELIF);
		KEYWORDS.put("else", Token.KW_ELSE);
		KEYWORDS.put("while", Token.KW_WHILE);
		KEYWORDS.put("import", Token.KW_IMPORT);
		KEYWORDS.put("from", Token.KW_FROM);
		KEYWORDS.put("as", Token.KW_AS);
		KEYWORDS.put("del", Token.KW_DEL);
		KEYWORDS.put("pass", Token.KW_PASS);
		KEYWORDS.put("break", Token.KW_BREAK);
		KEYWORDS.put("continue", Token.KW_CONTINUE);

		// expressions
		KEYWORDS.put("lambda", Token.KW_LAMBDA);
		KEYWORDS.put("yield", Token.KW_YIELD);
		KEYWORDS.put("not", Token.KW_NOT);
		KEYWORDS.put("and", Token.KW_AND);
		KEYWORDS.put("or", Token.KW_OR);
		KEYWORDS.put("is", Token.KW_IS);
		KEYWORDS.put("in", Token.KW_IN);
		KEYWORDS.put("True", Token.KW_TRUE);
		KEYWORDS.put("False", Token.KW_FALSE);
		KEYWORDS.put("None", Token.KW_NONE);

		for (String keyword : Identifiers.KEYWORDS) {
			if (!KEYWORDS.containsKey(keyword)) {
				KEYWORDS.put(keyword, Token.KW_OTHER);
			}
		}
	}

	private final String source;
	private final List<Lexeme> lexemes = new ArrayList<Lexeme>();
	private final Deque<Integer> indents = new ArrayDeque<Integer>();

	private int pos;
	private int line = 1;
	private int lineStart;
	private int depth;

	Lexer(String source) {
		this.source = source;
		indents.push(0);
	}

	/**
	 * @return every token of the source, ending with {@link Token#EOF}
	 * @throws SourceSyntaxException on characters that start no token
	 */
	List<Lexeme> tokenize() {
		boolean atLineStart = true;
		while (true) {
			if (atLineStart && depth == 0) {
				if (!indentation()) {
					break;
				}
				atLineStart = false;
			}
			if (pos >= source.length()) {
				break;
			}
			char c = source.charAt(pos);
			if (c == ' ' || c == '\t' || c == '\f') {
				pos++;
			} else if (c == '#') {
				while (pos < source.length() && source.charAt(pos) != '\n') {
					pos++;
				}
			} else if (c == '\\' && pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
				pos += 2;
				newLine();
			} else if (c == '\r') {
				pos++;
			} else if (c == '\n') {
				if (depth == 0) {
					add(Token.NEWLINE, "\n", pos);
					atLineStart = true;
				}
				pos++;
				newLine();
			} else {
				token(c);
			}
		}
		int end = pos;
		if (!lexemes.isEmpty() && lastToken() != Token.NEWLINE && lastToken() != Token.DEDENT) {
			add(Token.NEWLINE, "\n", end);
		}
		while (indents.peek() > 0) {
			indents.pop();
			add(Token.DEDENT, "", end);
		}
		add(Token.EOF, "", end);
		return lexemes;
	}

	/**
	 * Measures the indentation of the next non-blank line and emits the
	 * matching INDENT or DEDENT tokens.
	 *
	 * @return {@code false} when the end of the source is reached
	 */
	private boolean indentation() {
		while (pos < source.length()) {
			int width = 0;
			int start = pos;
			while (pos < source.length() && (source.charAt(pos) == ' ' || source.charAt(pos) == '\t' || source.charAt(pos) == '\f')) {
				if (source.charAt(pos) == '\t') {
					width = (width / TAB_SIZE + 1) * TAB_SIZE;
				} else if (source.charAt(pos) == ' ') {
					width++;
				}
				pos++;
			}
			if (pos < source.length() && source.charAt(pos) == '\r') {
				pos++;
			}
			if (pos >= source.length()) {
				return false;
			}
			char c = source.charAt(pos);
			if (c == '\n') {
				pos++;
				newLine();
				continue;
			}
			if (c == '#') {
				while (pos < source.length() && source.charAt(pos) != '\n') {
					pos++;
				}
				continue;
			}
			if (width > indents.peek()) {
				indents.push(width);
				add(Token.INDENT, source.substring(start, pos), start);
			} else {
				while (width < indents.peek()) {
					indents.pop();
					add(Token.DEDENT, "", pos);
				}
				if (width != indents.peek()) {
					throw error("Unindent does not match any outer indentation level", pos);
				}
			}
			return true;
		}
		return false;
	}

	private void token(char c) {
		int start = pos;
		if (Identifiers.isIdentifierStart(c)) {
			while (pos < source.length() && Identifiers.isIdentifierPart(source.charAt(pos))) {
				pos++;
			}
			String word = source.substring(start, pos);
			Token keyword = KEYWORDS.get(word);
			add(keyword == null ? Token.NAME : keyword, word, start);
			return;
		}
		if (isDigit(c) || c == '.' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1))) {
			number();
			return;
		}
		if (c == '\'' || c == '"') {
			string(c);
			return;
		}
		String three = pos + 2 < source.length() ? source.substring(pos, pos + 3) : "";
		if (isAugmented(three)) {
			pos += 3;
			add(Token.AUGMENTED, three, start);
			return;
		}
		String two = pos + 1 < source.length() ? source.substring(pos, pos + 2) : "";
		Token pair = pair(two);
		if (pair != null) {
			pos += 2;
			add(pair, two, start);
			return;
		}
		if (isAugmented(two)) {
			pos += 2;
			add(Token.AUGMENTED, two, start);
			return;
		}
		Token single = single(c);
		if (single == null) {
			throw error("Unexpected character '" + c + "'", start);
		}
		pos++;
		switch (single) {
		case OPEN_PAREN:
		case OPEN_BRACKET:
		case OPEN_BRACE:
			depth++;
			break;
		case CLOSE_PAREN:
		case CLOSE_BRACKET:
		case CLOSE_BRACE:
			if (depth > 0) {
				depth--;
			}
			break;
		default:
			break;
		}
		add(single, String.valueOf(c), start);
	}

	private static boolean isAugmented(String text) {
		switch (text) {
		case "+=":
		case "-=":
		case "*=":
		case "/=":
		case "%=":
		case "@=":
		case "&=":
		case "|=":
		case "^=":
		case "**=":
		case "//=":
		case "<<=":
		case ">>=":
			return true;
		default:
			return false;
		}
	}

	private static Token pair(String text) {
		switch (text) {
		case "**":
			return Token.DOUBLE_STAR;
		case "//":
			return Token.DOUBLE_SLASH;
		case "<<":
			return Token.LSHIFT;
		case ">>":
			return Token.RSHIFT;
		case "<=":
			return Token.LE;
		case ">=":
			return Token.GE;
		case "==":
			return Token.EQ;
		case "!=":
			return Token.NE;
		default:
			return null;
		}
	}

	private static Token single(char c) {
		switch (c) {
		case '(':
			return Token.OPEN_PAREN;
		case ')':
			return Token.CLOSE_PAREN;
		case '[':
			return Token.OPEN_BRACKET;
		case ']':
			return Token.CLOSE_BRACKET;
		case '{':
			return Token.OPEN_BRACE;
		case '}':
			return Token.CLOSE_BRACE;
		case ',':
			return Token.COMMA;
		case ':':
			return Token.COLON;
		case ';':
			return Token.SEMICOLON;
		case '.':
			return Token.DOT;
		case '=':
			return Token.EQUALS;
		case '+':
			return Token.PLUS;
		case '-':
			return Token.MINUS;
		case '*':
			return Token.STAR;
		case '/':
			return Token.SLASH;
		case '%':
			return Token.PERCENT;
		case '@':
			return Token.AT;
		case '&':
			return Token.AMPERSAND;
		case '|':
			return Token.PIPE;
		case '^':
			return Token.CARET;
		case '~':
			return Token.TILDE;
		case '<':
			return Token.LT;
		case '>':
			return Token.GT;
		default:
			return null;
		}
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	/**
	 * Reads an integer or a float: digits, an optional fraction and an
	 * optional exponent.
	 */
	private void number() {
		int start = pos;
		boolean isFloat = false;
		while (pos < source.length() && isDigit(source.charAt(pos))) {
			pos++;
		}
		if (pos < source.length() && source.charAt(pos) == '.') {
			isFloat = true;
			pos++;
			while (pos < source.length() && isDigit(source.charAt(pos))) {
				pos++;
			}
		}
		if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
			int mark = pos;
			pos++;
			if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
				pos++;
			}
			if (pos < source.length() && isDigit(source.charAt(pos))) {
				isFloat = true;
				while (pos < source.length() && isDigit(source.charAt(pos))) {
					pos++;
				}
			} else {
				pos = mark;
			}
		}
		if (pos < source.length() && Identifiers.isIdentifierStart(source.charAt(pos))) {
			throw error("Invalid number literal", start);
		}
		add(isFloat ? Token.FLOAT : Token.INTEGER, source.substring(start, pos), start);
	}

	/**
	 * Reads a quoted string and handles all escape codes.
	 */
	private void string(char quote) {
		int start = pos;
		StringBuilder sb = new StringBuilder();
		pos++;
		while (true) {
			if (pos >= source.length() || source.charAt(pos) == '\n') {
				throw error("Unterminated string literal", start);
			}
			char c = source.charAt(pos);
			if (c == quote) {
				pos++;
				break;
			}
			if (c != '\\') {
				sb.append(c);
				pos++;
				continue;
			}
			pos++;
			if (pos >= source.length()) {
				throw error("Unterminated string literal", start);
			}
			char e = source.charAt(pos);
			pos++;
			switch (e) {
			case 'n':
				sb.append('\n');
				break;
			case 't':
				sb.append('\t');
				break;
			case 'r':
				sb.append('\r');
				break;
			case '0':
				sb.append('\0');
				break;
			case '\\':
			case '\'':
			case '"':
				sb.append(e);
				break;
			case '\n':
				// line continuation inside the literal
				newLine();
				break;
			case 'x':
				sb.append(hex(2, start));
				break;
			case 'u':
				sb.append(hex(4, start));
				break;
			default:
				// unknown escapes keep their backslash
				sb.append('\\').append(e);
				break;
			}
		}
		add(Token.STRING, sb.toString(), start);
	}

	private char hex(int digits, int start) {
		if (pos + digits > source.length()) {
			throw error("Truncated escape sequence", start);
		}
		int value = 0;
		for (int i = 0; i < digits; i++) {
			int d = Character.digit(source.charAt(pos + i), 16);
			if (d < 0) {
				throw error("Invalid escape sequence", start);
			}
			value = (value << 4) + d;
		}
		pos += digits;
		return (char) value;
	}

	private void newLine() {
		line++;
		lineStart = pos;
	}

	private Token lastToken() {
		return lexemes.get(lexemes.size() - 1).getToken();
	}

	private void add(Token token, String text, int offset) {
		lexemes.add(new Lexeme(token, text, line, column(offset)));
	}

	private int column(int offset) {
		return Math.max(offset - lineStart, 0) + 1;
	}

	private SourceSyntaxException error(String message, int offset) {
		return new SourceSyntaxException(message, line, column(offset));
	}
}
