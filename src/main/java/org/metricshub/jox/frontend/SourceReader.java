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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jox.MalformedNodeException;
import org.metricshub.jox.ast.Block;
import org.metricshub.jox.ast.ImportFrom;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.sexpr.OperatorChain;
import org.metricshub.jox.sexpr.SExpressions;
import org.metricshub.jox.util.JoxLogger;
import org.slf4j.Logger;

/**
 * Recursive-descent reader for the source text {@link org.metricshub.jox.backend.SourceEmitter}
 * produces. Every node is built through {@link SExpressions#build(String, Object...)}.
 * <p>
 * The grammar methods are named after the rule they read. {@code pass}
 * statements are dropped, so an empty body reads back as an empty list.
 */
public final class SourceReader {

	private static final Logger LOG = JoxLogger.getLogger(SourceReader.class);

	private final List<Lexeme> lexemes;
	private int index;
	private Lexeme lexeme;

	private SourceReader(String text) {
		if (text == null) {
			throw new IllegalArgumentException("Source text must not be null");
		}
		this.lexemes = new Lexer(text).tokenize();
		this.lexeme = lexemes.get(0);
	}

	/**
	 * Reads a module. A module holding exactly one statement reads as that
	 * statement (or expression); any other module reads as a {@link Block}.
	 *
	 * @param text source text
	 * @return the tree
	 * @throws SourceSyntaxException if the text cannot be read
	 */
	public static Node parse(String text) {
		Block module = parseModule(text);
		if (module.getStatements().size() == 1) {
			return module.getStatements().get(0);
		}
		return module;
	}

	/**
	 * @param text source text
	 * @return all the statements of the text, as a block
	 * @throws SourceSyntaxException if the text cannot be read
	 */
	public static Block parseModule(String text) {
		SourceReader reader = new SourceReader(text);
		Block module = reader.MODULE();
		LOG.debug("Read {} statement(s)", module.getStatements().size());
		return module;
	}

	/**
	 * @param text source text of exactly one statement
	 * @return the statement
	 * @throws SourceSyntaxException if the text does not hold exactly one statement
	 */
	public static Node parseStatement(String text) {
		SourceReader reader = new SourceReader(text);
		Block module = reader.MODULE();
		if (module.getStatements().size() != 1) {
			throw new SourceSyntaxException(
					"Expected exactly one statement, found " + module.getStatements().size(),
					1,
					1);
		}
		return module.getStatements().get(0);
	}

	/**
	 * @param text source text of one expression
	 * @return the expression
	 * @throws SourceSyntaxException if the text is not a single expression
	 */
	public static Node parseExpression(String text) {
		SourceReader reader = new SourceReader(text);
		Node expression = reader.EXPRESSION_LIST();
		while (reader.token() == Token.NEWLINE) {
			reader.next();
		}
		reader.expect(Token.EOF, "end of expression");
		return expression;
	}

	// ----------------------------------------------------------------------
	// token handling

	private Token token() {
		return lexeme.getToken();
	}

	private Token peek(int offset) {
		int i = Math.min(index + offset, lexemes.size() - 1);
		return lexemes.get(i).getToken();
	}

	private Lexeme next() {
		Lexeme current = lexeme;
		if (index < lexemes.size() - 1) {
			index++;
			lexeme = lexemes.get(index);
		}
		return current;
	}

	private boolean accept(Token t) {
		if (token() == t) {
			next();
			return true;
		}
		return false;
	}

	private Lexeme expect(Token t, String what) {
		if (token() != t) {
			throw syntaxError("Expected " + what + " but found " + lexeme);
		}
		return next();
	}

	private SourceSyntaxException syntaxError(String message) {
		return new SourceSyntaxException(message, lexeme.getLine(), lexeme.getColumn());
	}

	/**
	 * Builds a node, reporting a shape error as a syntax error at the current position.
	 */
	private Node node(Lexeme at, String head, Object... args) {
		try {
			return SExpressions.build(head, args);
		} catch (MalformedNodeException e) {
			throw new SourceSyntaxException(e.getMessage(), at.getLine(), at.getColumn(), e);
		}
	}

	// ----------------------------------------------------------------------
	// statements

	// MODULE = { NEWLINE | STATEMENT } EOF
	Block MODULE() {
		List<Node> statements = new ArrayList<Node>();
		while (token() != Token.EOF) {
			if (accept(Token.NEWLINE)) {
				continue;
			}
			if (token() == Token.INDENT) {
				throw syntaxError("Unexpected indent");
			}
			statements.addAll(STATEMENT());
		}
		return (Block) node(lexeme, "do", statements.toArray());
	}

	// STATEMENT = IF_STATEMENT | WHILE_STATEMENT | FUNCTION_DEF | SIMPLE_LINE
	List<Node> STATEMENT() {
		switch (token()) {
		case KW_IF:
			return Collections.singletonList(IF_STATEMENT());
		case KW_WHILE:
			return Collections.singletonList(WHILE_STATEMENT());
		case KW_DEF:
			return Collections.singletonList(FUNCTION_DEF());
		default:
			return SIMPLE_LINE();
		}
	}

	// SIMPLE_LINE = SIMPLE_STATEMENT { ';' SIMPLE_STATEMENT } [ ';' ] NEWLINE
	List<Node> SIMPLE_LINE() {
		List<Node> statements = new ArrayList<Node>();
		Node statement = SIMPLE_STATEMENT();
		if (statement != null) {
			statements.add(statement);
		}
		while (accept(Token.SEMICOLON)) {
			if (token() == Token.NEWLINE) {
				break;
			}
			statement = SIMPLE_STATEMENT();
			if (statement != null) {
				statements.add(statement);
			}
		}
		expect(Token.NEWLINE, "end of line");
		return statements;
	}

	/**
	 * @return the statement, or {@code null} for {@code pass}
	 */
	Node SIMPLE_STATEMENT() {
		Lexeme start = lexeme;
		switch (token()) {
		case KW_PASS:
			next();
			return null;
		case KW_BREAK:
			next();
			return node(start, "break");
		case KW_CONTINUE:
			next();
			return node(start, "continue");
		case KW_RETURN:
			next();
			if (token() == Token.NEWLINE || token() == Token.SEMICOLON) {
				return node(start, "return");
			}
			return node(start, "return", EXPRESSION_LIST());
		case KW_DEL:
			next();
			List<Node> targets = new ArrayList<Node>();
			targets.add(EXPRESSION());
			while (accept(Token.COMMA)) {
				if (token() == Token.NEWLINE || token() == Token.SEMICOLON) {
					break;
				}
				targets.add(EXPRESSION());
			}
			return node(start, "del", targets.toArray());
		case KW_IMPORT:
			return IMPORT_STATEMENT();
		case KW_FROM:
			return IMPORT_FROM_STATEMENT();
		case KW_YIELD:
			return YIELD_EXPRESSION();
		case KW_OTHER:
			throw syntaxError("Unsupported statement " + lexeme);
		default:
			return EXPRESSION_STATEMENT();
		}
	}

	// IMPORT_STATEMENT = 'import' NAME { '.' NAME } [ 'as' NAME ]
	Node IMPORT_STATEMENT() {
		Lexeme start = expect(Token.KW_IMPORT, "'import'");
		StringBuilder module = new StringBuilder(expect(Token.NAME, "module name").getText());
		while (accept(Token.DOT)) {
			module.append('.').append(expect(Token.NAME, "module name").getText());
		}
		if (accept(Token.KW_AS)) {
			return node(start, "import", module.toString(), expect(Token.NAME, "alias").getText());
		}
		return node(start, "import", module.toString());
	}

	// IMPORT_FROM_STATEMENT = 'from' { '.' } [ NAME { '.' NAME } ] 'import' ( '*' | '(' MEMBERS ')' | MEMBERS )
	// MEMBERS = MEMBER { ',' MEMBER }, with a trailing ',' only inside parentheses
	// MEMBER = NAME [ 'as' NAME ]
	Node IMPORT_FROM_STATEMENT() {
		Lexeme start = expect(Token.KW_FROM, "'from'");
		StringBuilder module = new StringBuilder();
		while (accept(Token.DOT)) {
			module.append('.');
		}
		if (token() == Token.NAME) {
			module.append(next().getText());
			while (accept(Token.DOT)) {
				module.append('.').append(expect(Token.NAME, "module name").getText());
			}
		}
		if (module.length() == 0) {
			throw syntaxError("Expected module name but found " + lexeme);
		}
		expect(Token.KW_IMPORT, "'import'");
		List<Object> args = new ArrayList<Object>();
		args.add(module.toString());
		if (accept(Token.STAR)) {
			args.add(ImportFrom.WILDCARD);
			return node(start, "from", args.toArray());
		}
		boolean parenthesized = accept(Token.OPEN_PAREN);
		do {
			if (parenthesized && token() == Token.CLOSE_PAREN) {
				break;
			}
			String name = expect(Token.NAME, "imported name").getText();
			if (accept(Token.KW_AS)) {
				args.add(Collections.singletonMap(name, expect(Token.NAME, "alias").getText()));
			} else {
				args.add(name);
			}
		} while (accept(Token.COMMA));
		if (parenthesized) {
			expect(Token.CLOSE_PAREN, "')'");
		}
		if (args.size() == 1) {
			throw syntaxError("Expected imported name but found " + lexeme);
		}
		return node(start, "from", args.toArray());
	}

	// EXPRESSION_STATEMENT = EXPRESSION_LIST [ ( '=' | AUGMENTED ) ( YIELD_EXPRESSION | EXPRESSION_LIST ) ]
	Node EXPRESSION_STATEMENT() {
		Node expression = EXPRESSION_LIST();
		if (token() != Token.EQUALS && token() != Token.AUGMENTED) {
			return expression;
		}
		Lexeme operator = next();
		Node value = token() == Token.KW_YIELD ? YIELD_EXPRESSION() : EXPRESSION_LIST();
		if (token() == Token.EQUALS || token() == Token.AUGMENTED) {
			throw syntaxError("Chained assignment is not supported");
		}
		return node(operator, operator.getText(), expression, value);
	}

	// YIELD_EXPRESSION = 'yield' 'from' EXPRESSION | 'yield' [ EXPRESSION_LIST ]
	Node YIELD_EXPRESSION() {
		Lexeme start = expect(Token.KW_YIELD, "'yield'");
		if (accept(Token.KW_FROM)) {
			return node(start, "yield from", EXPRESSION());
		}
		if (startsExpression(token())) {
			return node(start, "yield", EXPRESSION_LIST());
		}
		return node(start, "yield");
	}

	// IF_STATEMENT = 'if' EXPRESSION ':' SUITE { 'elif' EXPRESSION ':' SUITE } [ 'else' ':' SUITE ]
	Node IF_STATEMENT() {
		Lexeme start = next();
		Node test = EXPRESSION();
		expect(Token.COLON, "':'");
		List<Node> then = SUITE();
		List<Node> otherwise = Collections.emptyList();
		if (token() == Token.KW_ELIF) {
			otherwise = Collections.singletonList(IF_STATEMENT());
		} else if (accept(Token.KW_ELSE)) {
			expect(Token.COLON, "':'");
			otherwise = SUITE();
		}
		return node(start, "if", test, then, otherwise);
	}

	// WHILE_STATEMENT = 'while' EXPRESSION ':' SUITE [ 'else' ':' SUITE ]
	Node WHILE_STATEMENT() {
		Lexeme start = next();
		Node test = EXPRESSION();
		expect(Token.COLON, "':'");
		List<Node> body = SUITE();
		if (accept(Token.KW_ELSE)) {
			expect(Token.COLON, "':'");
			return node(start, "while", test, body, SUITE());
		}
		return node(start, "while", test, body);
	}

	// FUNCTION_DEF = 'def' NAME '(' [ NAME { ',' NAME } [ ',' ] ] ')' ':' SUITE
	Node FUNCTION_DEF() {
		Lexeme start = next();
		String name = expect(Token.NAME, "function name").getText();
		expect(Token.OPEN_PAREN, "'('");
		List<String> params = new ArrayList<String>();
		while (token() != Token.CLOSE_PAREN) {
			params.add(expect(Token.NAME, "parameter name").getText());
			if (!accept(Token.COMMA)) {
				break;
			}
		}
		expect(Token.CLOSE_PAREN, "')'");
		expect(Token.COLON, "':'");
		return node(start, "def", name, params, SUITE());
	}

	// SUITE = SIMPLE_LINE | NEWLINE INDENT STATEMENT { STATEMENT } DEDENT
	List<Node> SUITE() {
		if (!accept(Token.NEWLINE)) {
			return SIMPLE_LINE();
		}
		expect(Token.INDENT, "an indented block");
		List<Node> statements = new ArrayList<Node>();
		while (!accept(Token.DEDENT)) {
			if (token() == Token.EOF) {
				throw syntaxError("Unexpected end of input in indented block");
			}
			if (token() == Token.INDENT) {
				throw syntaxError("Unexpected indent");
			}
			statements.addAll(STATEMENT());
		}
		return statements;
	}

	// ----------------------------------------------------------------------
	// expressions

	// EXPRESSION_LIST = EXPRESSION { ',' EXPRESSION } [ ',' ]
	Node EXPRESSION_LIST() {
		Lexeme start = lexeme;
		Node first = EXPRESSION();
		if (token() != Token.COMMA) {
			return first;
		}
		List<Node> elements = new ArrayList<Node>();
		elements.add(first);
		while (accept(Token.COMMA)) {
			if (!startsExpression(token())) {
				break;
			}
			elements.add(EXPRESSION());
		}
		return node(start, "tuple", elements.toArray());
	}

	private static boolean startsExpression(Token t) {
		switch (t) {
		case NAME:
		case INTEGER:
		case FLOAT:
		case STRING:
		case OPEN_PAREN:
		case OPEN_BRACKET:
		case OPEN_BRACE:
		case PLUS:
		case MINUS:
		case TILDE:
		case KW_NOT:
		case KW_LAMBDA:
		case KW_TRUE:
		case KW_FALSE:
		case KW_NONE:
			return true;
		default:
			return false;
		}
	}

	// EXPRESSION = LAMBDA | OR_TEST [ 'if' OR_TEST 'else' EXPRESSION ]
	Node EXPRESSION() {
		if (token() == Token.KW_LAMBDA) {
			return LAMBDA();
		}
		Node then = OR_TEST();
		if (token() != Token.KW_IF) {
			return then;
		}
		Lexeme start = next();
		Node test = OR_TEST();
		expect(Token.KW_ELSE, "'else'");
		Node otherwise = EXPRESSION();
		return node(start, "ifexpr", test, then, otherwise);
	}

	// LAMBDA = 'lambda' [ NAME { ',' NAME } ] ':' EXPRESSION
	Node LAMBDA() {
		Lexeme start = next();
		List<String> params = new ArrayList<String>();
		while (token() != Token.COLON) {
			params.add(expect(Token.NAME, "parameter name").getText());
			if (!accept(Token.COMMA)) {
				break;
			}
		}
		expect(Token.COLON, "':'");
		return node(start, "lambda", params, EXPRESSION());
	}

	// OR_TEST = AND_TEST [ 'or' OR_TEST ]
	Node OR_TEST() {
		Node left = AND_TEST();
		if (token() == Token.KW_OR) {
			Lexeme op = next();
			return node(op, "or", left, OR_TEST());
		}
		return left;
	}

	// AND_TEST = NOT_TEST [ 'and' AND_TEST ]
	Node AND_TEST() {
		Node left = NOT_TEST();
		if (token() == Token.KW_AND) {
			Lexeme op = next();
			return node(op, "and", left, AND_TEST());
		}
		return left;
	}

	// NOT_TEST = 'not' NOT_TEST | COMPARISON
	Node NOT_TEST() {
		if (token() == Token.KW_NOT) {
			Lexeme op = next();
			return node(op, "not", NOT_TEST());
		}
		return COMPARISON();
	}

	// COMPARISON = BINARY_EXPRESSION [ COMPARISON_OPERATOR BINARY_EXPRESSION ]
	Node COMPARISON() {
		Node left = BINARY_EXPRESSION();
		Lexeme start = lexeme;
		String op = COMPARISON_OPERATOR();
		if (op == null) {
			return left;
		}
		Node right = BINARY_EXPRESSION();
		if (COMPARISON_OPERATOR() != null) {
			throw syntaxError("Chained comparisons are not supported; use parentheses");
		}
		return node(start, op, left, right);
	}

	/**
	 * Consumes a comparison operator.
	 *
	 * @return its symbol, or {@code null} when the current token is not a comparison operator
	 */
	private String COMPARISON_OPERATOR() {
		switch (token()) {
		case EQ:
		case NE:
		case LT:
		case LE:
		case GT:
		case GE:
			return next().getText();
		case KW_IN:
			next();
			return "in";
		case KW_IS:
			next();
			return accept(Token.KW_NOT) ? "is not" : "is";
		case KW_NOT:
			if (peek(1) == Token.KW_IN) {
				next();
				next();
				return "not in";
			}
			return null;
		default:
			return null;
		}
	}

	private static boolean isBinaryOperator(Token t) {
		switch (t) {
		case PIPE:
		case CARET:
		case AMPERSAND:
		case LSHIFT:
		case RSHIFT:
		case PLUS:
		case MINUS:
		case STAR:
		case SLASH:
		case DOUBLE_SLASH:
		case PERCENT:
		case AT:
			return true;
		default:
			return false;
		}
	}

	// BINARY_EXPRESSION = FACTOR { BINARY_OPERATOR FACTOR }
	// with BINARY_OPERATOR one of | ^ & << >> + - * / // % @, grouped by precedence
	Node BINARY_EXPRESSION() {
		Lexeme start = lexeme;
		List<Object> chain = new ArrayList<Object>();
		chain.add(FACTOR());
		while (isBinaryOperator(token())) {
			chain.add(next().getText());
			chain.add(FACTOR());
		}
		if (chain.size() == 1) {
			return (Node) chain.get(0);
		}
		try {
			return OperatorChain.reduce(chain);
		} catch (MalformedNodeException e) {
			throw new SourceSyntaxException(e.getMessage(), start.getLine(), start.getColumn(), e);
		}
	}

	// FACTOR = ( '-' | '+' | '~' ) FACTOR | POWER
	Node FACTOR() {
		Lexeme start = lexeme;
		switch (token()) {
		case MINUS:
			if ((peek(1) == Token.INTEGER || peek(1) == Token.FLOAT) && !isTrailerOrPower(peek(2))) {
				next();
				return number(next(), true);
			}
			next();
			return node(start, "-", FACTOR());
		case PLUS:
			next();
			return node(start, "+", FACTOR());
		case TILDE:
			next();
			return node(start, "~", FACTOR());
		default:
			return POWER();
		}
	}

	private static boolean isTrailerOrPower(Token t) {
		return t == Token.DOUBLE_STAR || t == Token.OPEN_PAREN || t == Token.OPEN_BRACKET || t == Token.DOT;
	}

	// POWER = PRIMARY [ '**' FACTOR ]
	Node POWER() {
		Node base = PRIMARY();
		if (token() == Token.DOUBLE_STAR) {
			Lexeme op = next();
			return node(op, "**", base, FACTOR());
		}
		return base;
	}

	// PRIMARY = ATOM { '(' ARGUMENTS ')' | '[' EXPRESSION_LIST ']' | '.' NAME }
	Node PRIMARY() {
		Node primary = ATOM();
		while (true) {
			Lexeme start = lexeme;
			if (accept(Token.OPEN_PAREN)) {
				primary = ARGUMENTS(start, primary);
			} else if (accept(Token.OPEN_BRACKET)) {
				Node index = EXPRESSION_LIST();
				expect(Token.CLOSE_BRACKET, "']'");
				primary = node(start, "index", primary, index);
			} else if (accept(Token.DOT)) {
				primary = node(start, "attr", primary, expect(Token.NAME, "attribute name").getText());
			} else {
				return primary;
			}
		}
	}

	// ARGUMENTS = [ ARGUMENT { ',' ARGUMENT } [ ',' ] ] ')'
	// ARGUMENT = NAME '=' EXPRESSION | EXPRESSION
	private Node ARGUMENTS(Lexeme start, Node callee) {
		List<Object> args = new ArrayList<Object>();
		args.add(callee);
		Map<String, Node> kwargs = new LinkedHashMap<String, Node>();
		while (token() != Token.CLOSE_PAREN) {
			if (token() == Token.NAME && peek(1) == Token.EQUALS) {
				String key = next().getText();
				next();
				if (kwargs.containsKey(key)) {
					throw syntaxError("Keyword argument repeated: " + key);
				}
				kwargs.put(key, EXPRESSION());
			} else {
				if (!kwargs.isEmpty()) {
					throw syntaxError("Positional argument follows keyword argument");
				}
				args.add(EXPRESSION());
			}
			if (!accept(Token.COMMA)) {
				break;
			}
		}
		expect(Token.CLOSE_PAREN, "')'");
		if (!kwargs.isEmpty()) {
			args.add(kwargs);
		}
		return node(start, "call", args.toArray());
	}

	// ATOM = '(' [ EXPRESSION_LIST | YIELD_EXPRESSION ] ')' | '[' [ ELEMENTS ] ']' | '{' ELEMENTS '}'
	// | NAME | NUMBER | STRING { STRING } | 'True' | 'False' | 'None'
	Node ATOM() {
		Lexeme start = lexeme;
		switch (token()) {
		case NAME:
			return node(start, "name", next().getText());
		case INTEGER:
		case FLOAT:
			return number(next(), false);
		case STRING:
			StringBuilder sb = new StringBuilder();
			while (token() == Token.STRING) {
				sb.append(next().getText());
			}
			return node(start, "atom", sb.toString());
		case KW_TRUE:
			next();
			return node(start, "atom", Boolean.TRUE);
		case KW_FALSE:
			next();
			return node(start, "atom", Boolean.FALSE);
		case KW_NONE:
			next();
			return node(start, "atom", (Object) null);
		case OPEN_PAREN:
			next();
			if (accept(Token.CLOSE_PAREN)) {
				return node(start, "tuple");
			}
			if (token() == Token.KW_YIELD) {
				Node yield = YIELD_EXPRESSION();
				expect(Token.CLOSE_PAREN, "')'");
				return yield;
			}
			Node first = EXPRESSION();
			if (accept(Token.CLOSE_PAREN)) {
				return first;
			}
			List<Node> elements = new ArrayList<Node>();
			elements.add(first);
			while (accept(Token.COMMA)) {
				if (token() == Token.CLOSE_PAREN) {
					break;
				}
				elements.add(EXPRESSION());
			}
			expect(Token.CLOSE_PAREN, "')'");
			return node(start, "tuple", elements.toArray());
		case OPEN_BRACKET:
			next();
			List<Node> items = ELEMENTS(Token.CLOSE_BRACKET);
			expect(Token.CLOSE_BRACKET, "']'");
			return node(start, "list", items.toArray());
		case OPEN_BRACE:
			next();
			List<Node> members = ELEMENTS(Token.CLOSE_BRACE);
			if (members.isEmpty()) {
				throw syntaxError("Dictionary displays are not supported");
			}
			expect(Token.CLOSE_BRACE, "'}'");
			return node(start, "set", members.toArray());
		case KW_OTHER:
			throw syntaxError("Unsupported reserved word " + lexeme);
		default:
			throw syntaxError("Unexpected " + lexeme);
		}
	}

	// ELEMENTS = [ EXPRESSION { ',' EXPRESSION } [ ',' ] ]
	private List<Node> ELEMENTS(Token close) {
		List<Node> elements = new ArrayList<Node>();
		while (token() != close) {
			elements.add(EXPRESSION());
			if (!accept(Token.COMMA)) {
				break;
			}
		}
		return elements;
	}

	/**
	 * Converts a number token to an atom, negated when it followed a unary minus.
	 */
	private Node number(Lexeme literal, boolean negative) {
		String text = negative ? "-" + literal.getText() : literal.getText();
		if (literal.getToken() == Token.INTEGER) {
			BigInteger value = new BigInteger(text);
			if (value.bitLength() > 63) {
				throw new SourceSyntaxException("Integer literal out of range: " + text, literal.getLine(), literal.getColumn());
			}
			return node(literal, "atom", Long.valueOf(value.longValue()));
		}
		double value = Double.parseDouble(text);
		if (Double.isInfinite(value)) {
			throw new SourceSyntaxException("Float literal out of range: " + text, literal.getLine(), literal.getColumn());
		}
		return node(literal, "atom", Double.valueOf(value));
	}
}
