package org.javai.sqlguard.sql;

/**
 * Lexical classes produced by {@link SqlTokenizer}.
 */
public enum SqlTokenKind {
	/** A reserved word that drives clause structure (SELECT, FROM, JOIN, WHERE, AS, ...). */
	KEYWORD,
	/** A bare or quoted name: table, column, alias, function or type. */
	IDENTIFIER,
	STRING,
	NUMBER,
	OPERATOR,
	PARAMETER,
	COMMA,
	DOT,
	STAR,
	LEFT_PAREN,
	RIGHT_PAREN,
	SEMICOLON
}
