package org.javai.sqlguard.catalog;

import java.util.Locale;

/**
 * Normalization of SQL identifiers used as catalog and policy keys.
 *
 * <p>Unquoted identifiers are case-insensitive in the databases this guard targets, so every
 * table and column name is compared in lower case.</p>
 */
public final class Identifiers {

	private Identifiers() {
	}

	/**
	 * @return the identifier trimmed and lower-cased, or an empty string for {@code null}
	 */
	public static String normalize(String identifier) {
		if (identifier == null) {
			return "";
		}
		return identifier.trim().toLowerCase(Locale.ROOT);
	}
}
