package org.javai.sqlguard.exec;

/**
 * A statement that passed authorization failed in the database. Never retried.
 */
public class QueryExecutionException extends RuntimeException {

	public enum Kind {
		/** The driver or the database rejected or aborted the statement. */
		DRIVER_ERROR,
		/** The configured query timeout elapsed. */
		TIMEOUT,
		/** The request was cancelled while the statement was running. */
		CANCELLED
	}

	private final Kind kind;
	private final String statement;

	public QueryExecutionException(Kind kind, String statement, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.statement = statement;
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * @return the statement that failed, as sent to the database
	 */
	public String statement() {
		return statement;
	}
}
