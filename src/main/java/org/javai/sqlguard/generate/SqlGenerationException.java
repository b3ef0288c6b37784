package org.javai.sqlguard.generate;

/**
 * The model could not be reached or answered with neither SQL, a clarification nor a refusal.
 */
public class SqlGenerationException extends RuntimeException {

	public SqlGenerationException(String message) {
		super(message);
	}

	public SqlGenerationException(String message, Throwable cause) {
		super(message, cause);
	}
}
