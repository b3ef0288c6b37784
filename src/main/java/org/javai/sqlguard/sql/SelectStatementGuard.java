package org.javai.sqlguard.sql;

import java.util.List;
import java.util.Optional;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;

/**
 * Structural check that a statement is exactly one {@code SELECT}.
 *
 * <p>A single trailing semicolon is tolerated. The statement is parsed with JSqlParser; text
 * that does not parse, or parses to anything other than a {@link Select}, is a violation.</p>
 */
public final class SelectStatementGuard {

	/**
	 * @return a description of the violation, or empty if the statement is a single SELECT
	 */
	public Optional<String> violation(String sql) {
		if (sql == null || sql.isBlank()) {
			return Optional.of("Empty statement");
		}
		List<SqlToken> tokens;
		try {
			tokens = SqlTokenizer.tokenize(sql);
		}
		catch (StatementParseException e) {
			return Optional.of("Malformed statement: " + e.getMessage());
		}
		if (SqlTokenizer.splitStatements(tokens).size() != 1) {
			return Optional.of("Exactly one statement is allowed");
		}
		String body = stripTrailingSemicolon(sql, tokens);

		Statement stmt;
		try {
			stmt = CCJSqlParserUtil.parse(body);
		}
		catch (JSQLParserException e) {
			return Optional.of("Invalid SQL syntax: " + firstLine(e.getMessage()));
		}
		if (!(stmt instanceof Select)) {
			return Optional.of("Only SELECT statements are allowed, got: " + stmt.getClass().getSimpleName());
		}
		return Optional.empty();
	}

	public boolean isSingleSelect(String sql) {
		return violation(sql).isEmpty();
	}

	/**
	 * Removes trailing semicolons, leaving everything before the last significant token.
	 */
	static String stripTrailingSemicolon(String sql, List<SqlToken> tokens) {
		int last = tokens.size() - 1;
		while (last >= 0 && tokens.get(last).is(SqlTokenKind.SEMICOLON)) {
			last--;
		}
		if (last < 0) {
			return "";
		}
		return sql.substring(0, tokens.get(last).end());
	}

	private static String firstLine(String message) {
		if (message == null) {
			return "unknown error";
		}
		int newline = message.indexOf('\n');
		return newline < 0 ? message : message.substring(0, newline);
	}
}
