package org.javai.sqlguard.config;

/**
 * Thrown when the guard configuration is missing, unreadable or invalid.
 */
public class GuardConfigException extends RuntimeException {

	public GuardConfigException(String message) {
		super(message);
	}

	public GuardConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
