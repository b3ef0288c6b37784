package org.javai.sqlguard.sql;

/**
 * Thrown when statement text cannot be tokenized (unterminated literal, identifier or comment).
 */
public class StatementParseException extends RuntimeException {

	private final int position;

	public StatementParseException(String message, int position) {
		super(message + " at offset " + position);
		this.position = position;
	}

	public int position() {
		return position;
	}
}
