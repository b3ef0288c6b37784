package org.javai.sqlguard.authz;

/**
 * Why a candidate statement was rejected. Every reason is terminal for the request.
 */
public enum DenialReason {

	FORBIDDEN_QUERY_TYPE("ForbiddenQueryType", "Forbidden query type. Only single SELECT statements are allowed."),
	INJECTION_SUSPECTED("InjectionSuspected", "Potential SQL injection detected."),
	UNAUTHORIZED_TABLE("UnauthorizedTable", "Unauthorized access to table"),
	UNAUTHORIZED_COLUMN("UnauthorizedColumn", "Unauthorized access to column");

	private final String wireName;
	private final String message;

	DenialReason(String wireName, String message) {
		this.wireName = wireName;
		this.message = message;
	}

	/**
	 * @return the stable name used in results and logs, e.g. {@code UnauthorizedColumn}
	 */
	public String wireName() {
		return wireName;
	}

	/**
	 * @return a user-facing message; table and column reasons append the offending name
	 */
	public String describe(String detail) {
		if (detail == null || detail.isEmpty() || this == FORBIDDEN_QUERY_TYPE || this == INJECTION_SUSPECTED) {
			return message;
		}
		return message + ": " + detail;
	}
}
