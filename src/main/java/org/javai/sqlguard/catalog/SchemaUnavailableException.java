package org.javai.sqlguard.catalog;

/**
 * Thrown when the schema catalog cannot be read from the database.
 *
 * <p>This is a startup condition only: without an accurate catalog no authorization decision
 * can be made, so the service must not become ready.</p>
 */
public class SchemaUnavailableException extends RuntimeException {

	public SchemaUnavailableException(String message) {
		super(message);
	}

	public SchemaUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
