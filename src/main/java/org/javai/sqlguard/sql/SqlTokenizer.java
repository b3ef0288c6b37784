package org.javai.sqlguard.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Hand-rolled lexer for the SELECT dialect the guard accepts.
 *
 * <p>Comments are dropped. Identifiers are lower-cased like catalog names; double-quoted and
 * backtick identifiers lose their quotes. String literals come in three forms, all reported as
 * {@link SqlTokenKind#STRING}: standard {@code '...'} with doubled quotes, escape strings
 * {@code E'...'} where a backslash escapes the next character, and dollar-quoted
 * {@code $tag$...$tag$} bodies. Only words that can never be column names
 * are reported as {@link SqlTokenKind#KEYWORD}: a non-reserved word such as {@code first} or
 * {@code partition} comes out as an identifier so that it is still checked as a potential column
 * reference.</p>
 */
public final class SqlTokenizer {

	static final Set<String> KEYWORDS = Set.of(
			"SELECT", "FROM", "WHERE", "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "OUTER", "CROSS", "NATURAL",
			"ON", "USING", "AS", "AND", "OR", "NOT", "IN", "IS", "NULL", "LIKE", "ILIKE", "SIMILAR", "BETWEEN",
			"EXISTS", "GROUP", "BY", "ORDER", "HAVING", "LIMIT", "OFFSET", "FETCH", "DISTINCT", "ALL", "ANY",
			"SOME", "CASE", "WHEN", "THEN", "ELSE", "END", "ASC", "DESC", "UNION", "INTERSECT", "EXCEPT",
			"WITH", "LATERAL", "WINDOW", "TRUE", "FALSE", "INTO", "ONLY", "COLLATE", "CAST", "ARRAY");

	private static final String OPERATOR_CHARS = "<>=!~^&|%+-/@#:?";

	private SqlTokenizer() {
	}

	/**
	 * @throws StatementParseException on an unterminated string, quoted identifier or block comment
	 */
	public static List<SqlToken> tokenize(String sql) {
		List<SqlToken> tokens = new ArrayList<>();
		if (sql == null) {
			return tokens;
		}
		int length = sql.length();
		int i = 0;
		while (i < length) {
			char c = sql.charAt(i);
			if (Character.isWhitespace(c)) {
				i++;
			}
			else if (c == '-' && peek(sql, i + 1) == '-') {
				i = skipLineComment(sql, i);
			}
			else if (c == '/' && peek(sql, i + 1) == '*') {
				i = skipBlockComment(sql, i);
			}
			else if (c == '\'') {
				int end = closeQuoted(sql, i, '\'', "Unterminated string literal");
				tokens.add(new SqlToken(SqlTokenKind.STRING, sql.substring(i, end), i, end));
				i = end;
			}
			else if (c == '"' || c == '`') {
				int end = closeQuoted(sql, i, c, "Unterminated quoted identifier");
				String name = sql.substring(i + 1, end - 1).replace(String.valueOf(c) + c, String.valueOf(c))
						.toLowerCase(Locale.ROOT);
				tokens.add(new SqlToken(SqlTokenKind.IDENTIFIER, name, i, end));
				i = end;
			}
			else if ((c == 'e' || c == 'E') && peek(sql, i + 1) == '\'') {
				int end = closeEscapeString(sql, i + 1);
				tokens.add(new SqlToken(SqlTokenKind.STRING, sql.substring(i, end), i, end));
				i = end;
			}
			else if (c == '$' && dollarTagEnd(sql, i) > 0) {
				int end = closeDollarQuoted(sql, i, dollarTagEnd(sql, i));
				tokens.add(new SqlToken(SqlTokenKind.STRING, sql.substring(i, end), i, end));
				i = end;
			}
			else if (Character.isLetter(c) || c == '_') {
				int end = i + 1;
				while (end < length && isIdentifierPart(sql.charAt(end))) {
					end++;
				}
				String word = sql.substring(i, end);
				String upper = word.toUpperCase(Locale.ROOT);
				if (KEYWORDS.contains(upper)) {
					tokens.add(new SqlToken(SqlTokenKind.KEYWORD, upper, i, end));
				}
				else {
					tokens.add(new SqlToken(SqlTokenKind.IDENTIFIER, word.toLowerCase(Locale.ROOT), i, end));
				}
				i = end;
			}
			else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(sql, i + 1)) && !followsOperand(tokens))) {
				int end = scanNumber(sql, i);
				tokens.add(new SqlToken(SqlTokenKind.NUMBER, sql.substring(i, end), i, end));
				i = end;
			}
			else if (c == '$' && Character.isDigit(peek(sql, i + 1))) {
				int end = i + 1;
				while (end < length && Character.isDigit(sql.charAt(end))) {
					end++;
				}
				tokens.add(new SqlToken(SqlTokenKind.PARAMETER, sql.substring(i, end), i, end));
				i = end;
			}
			else if (c == '?') {
				tokens.add(new SqlToken(SqlTokenKind.PARAMETER, "?", i, i + 1));
				i++;
			}
			else if (c == ',') {
				tokens.add(new SqlToken(SqlTokenKind.COMMA, ",", i, i + 1));
				i++;
			}
			else if (c == '.') {
				tokens.add(new SqlToken(SqlTokenKind.DOT, ".", i, i + 1));
				i++;
			}
			else if (c == '*') {
				tokens.add(new SqlToken(SqlTokenKind.STAR, "*", i, i + 1));
				i++;
			}
			else if (c == '(') {
				tokens.add(new SqlToken(SqlTokenKind.LEFT_PAREN, "(", i, i + 1));
				i++;
			}
			else if (c == ')') {
				tokens.add(new SqlToken(SqlTokenKind.RIGHT_PAREN, ")", i, i + 1));
				i++;
			}
			else if (c == ';') {
				tokens.add(new SqlToken(SqlTokenKind.SEMICOLON, ";", i, i + 1));
				i++;
			}
			else if (OPERATOR_CHARS.indexOf(c) >= 0) {
				int end = i + 1;
				while (end < length && OPERATOR_CHARS.indexOf(sql.charAt(end)) >= 0 && !startsComment(sql, end)) {
					end++;
				}
				tokens.add(new SqlToken(SqlTokenKind.OPERATOR, sql.substring(i, end), i, end));
				i = end;
			}
			else {
				tokens.add(new SqlToken(SqlTokenKind.OPERATOR, String.valueOf(c), i, i + 1));
				i++;
			}
		}
		return tokens;
	}

	/**
	 * Splits a token stream on top-level semicolons, dropping empty statements.
	 */
	public static List<List<SqlToken>> splitStatements(List<SqlToken> tokens) {
		List<List<SqlToken>> statements = new ArrayList<>();
		List<SqlToken> current = new ArrayList<>();
		for (SqlToken token : tokens) {
			if (token.is(SqlTokenKind.SEMICOLON)) {
				if (!current.isEmpty()) {
					statements.add(current);
				}
				current = new ArrayList<>();
			}
			else {
				current.add(token);
			}
		}
		if (!current.isEmpty()) {
			statements.add(current);
		}
		return statements;
	}

	private static char peek(String sql, int index) {
		return index < sql.length() ? sql.charAt(index) : '\0';
	}

	private static boolean isIdentifierPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '$';
	}

	private static boolean startsComment(String sql, int index) {
		char c = sql.charAt(index);
		char next = peek(sql, index + 1);
		return (c == '-' && next == '-') || (c == '/' && next == '*');
	}

	private static boolean followsOperand(List<SqlToken> tokens) {
		if (tokens.isEmpty()) {
			return false;
		}
		SqlTokenKind last = tokens.get(tokens.size() - 1).kind();
		return last == SqlTokenKind.IDENTIFIER || last == SqlTokenKind.RIGHT_PAREN;
	}

	private static int skipLineComment(String sql, int start) {
		int end = sql.indexOf('\n', start);
		return end < 0 ? sql.length() : end + 1;
	}

	private static int skipBlockComment(String sql, int start) {
		int end = sql.indexOf("*/", start + 2);
		if (end < 0) {
			throw new StatementParseException("Unterminated block comment", start);
		}
		return end + 2;
	}

	/**
	 * @return the offset just past the closing quote; a doubled quote is an escaped quote
	 */
	private static int closeQuoted(String sql, int start, char quote, String error) {
		int i = start + 1;
		while (i < sql.length()) {
			if (sql.charAt(i) == quote) {
				if (peek(sql, i + 1) == quote) {
					i += 2;
					continue;
				}
				return i + 1;
			}
			i++;
		}
		throw new StatementParseException(error, start);
	}

	/**
	 * Scans a backslash-escaped literal whose opening quote is at {@code quote}.
	 */
	private static int closeEscapeString(String sql, int quote) {
		int i = quote + 1;
		while (i < sql.length()) {
			char c = sql.charAt(i);
			if (c == '\\') {
				i += 2;
			}
			else if (c == '\'') {
				if (peek(sql, i + 1) == '\'') {
					i += 2;
					continue;
				}
				return i + 1;
			}
			else {
				i++;
			}
		}
		throw new StatementParseException("Unterminated string literal", quote - 1);
	}

	/**
	 * @return the offset just past the opening {@code $tag$} delimiter starting at {@code start},
	 *         or -1 when the text there is not a dollar-quote opener
	 */
	private static int dollarTagEnd(String sql, int start) {
		int i = start + 1;
		if (i < sql.length() && (Character.isLetter(sql.charAt(i)) || sql.charAt(i) == '_')) {
			while (i < sql.length() && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '_')) {
				i++;
			}
		}
		return peek(sql, i) == '$' ? i + 1 : -1;
	}

	private static int closeDollarQuoted(String sql, int start, int bodyStart) {
		String delimiter = sql.substring(start, bodyStart);
		int close = sql.indexOf(delimiter, bodyStart);
		if (close < 0) {
			throw new StatementParseException("Unterminated dollar-quoted string", start);
		}
		return close + delimiter.length();
	}

	private static int scanNumber(String sql, int start) {
		int i = start;
		while (i < sql.length() && Character.isDigit(sql.charAt(i))) {
			i++;
		}
		if (peek(sql, i) == '.' && Character.isDigit(peek(sql, i + 1))) {
			i++;
			while (i < sql.length() && Character.isDigit(sql.charAt(i))) {
				i++;
			}
		}
		char e = peek(sql, i);
		if (e == 'e' || e == 'E') {
			int exponent = i + 1;
			if (peek(sql, exponent) == '+' || peek(sql, exponent) == '-') {
				exponent++;
			}
			if (Character.isDigit(peek(sql, exponent))) {
				i = exponent;
				while (i < sql.length() && Character.isDigit(sql.charAt(i))) {
					i++;
				}
			}
		}
		return i;
	}
}
