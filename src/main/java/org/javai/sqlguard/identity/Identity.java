package org.javai.sqlguard.identity;

import java.util.Objects;

/**
 * The caller on whose behalf a statement is authorized, as supplied by the external
 * authentication provider. Never persisted by the guard.
 *
 * @param role the RBAC/RLS role name
 * @param subjectId the caller's identifier (customer id, employee id, ...); may be numeric or textual
 * @param displayName a human-readable name used only in logs
 */
public record Identity(String role, String subjectId, String displayName) {

	public Identity {
		Objects.requireNonNull(role, "role must not be null");
		displayName = displayName != null ? displayName : "guest";
	}

	public static Identity of(String role, Object subjectId, String displayName) {
		return new Identity(role, subjectId != null ? String.valueOf(subjectId) : null, displayName);
	}

	public boolean hasSubjectId() {
		return subjectId != null && !subjectId.isBlank();
	}

	/**
	 * @return true when the subject id is a plain integer and must be rendered unquoted in SQL
	 */
	public boolean isNumericSubject() {
		if (!hasSubjectId()) {
			return false;
		}
		String id = subjectId.trim();
		int start = id.startsWith("-") ? 1 : 0;
		if (start == id.length()) {
			return false;
		}
		for (int i = start; i < id.length(); i++) {
			char c = id.charAt(i);
			if (c < '0' || c > '9') {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return a compact description for log records, e.g. {@code Maggie (role=admin, id=4)}
	 */
	public String describe() {
		return "%s (role=%s, id=%s)".formatted(displayName, role, subjectId);
	}
}
