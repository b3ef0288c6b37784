package org.javai.sqlguard.sql;

/**
 * A lexical token with its location in the statement text.
 *
 * @param kind lexical class
 * @param text normalized text: upper case for keywords, unquoted lower-case name for
 *        identifiers, raw text otherwise
 * @param start offset of the first character in the statement
 * @param end offset one past the last character
 */
public record SqlToken(SqlTokenKind kind, String text, int start, int end) {

	public boolean is(SqlTokenKind other) {
		return kind == other;
	}

	public boolean isKeyword(String keyword) {
		return kind == SqlTokenKind.KEYWORD && text.equals(keyword);
	}

	public boolean isKeywordIn(java.util.Set<String> keywords) {
		return kind == SqlTokenKind.KEYWORD && keywords.contains(text);
	}

	/**
	 * Token equality that ignores location; used to compare token sequences from different
	 * statements.
	 */
	public boolean sameAs(SqlToken other) {
		return other != null && kind == other.kind && text.equals(other.text);
	}
}
