package org.javai.sqlguard.authz;

import java.util.Objects;

/**
 * Outcome of authorizing one candidate statement for one identity.
 */
public sealed interface AuthorizationVerdict {

	static AuthorizationVerdict authorized() {
		return Authorized.INSTANCE;
	}

	static AuthorizationVerdict denied(DenialReason reason, String detail) {
		return new Denied(reason, detail);
	}

	default boolean isAuthorized() {
		return this instanceof Authorized;
	}

	record Authorized() implements AuthorizationVerdict {
		private static final Authorized INSTANCE = new Authorized();
	}

	/**
	 * @param reason the failed check
	 * @param detail the offending table or column, or a short explanation; never null
	 */
	record Denied(DenialReason reason, String detail) implements AuthorizationVerdict {

		public Denied {
			Objects.requireNonNull(reason, "reason must not be null");
			detail = detail != null ? detail : "";
		}

		public String message() {
			return reason.describe(detail);
		}
	}
}
