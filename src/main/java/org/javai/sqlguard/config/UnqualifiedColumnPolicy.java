package org.javai.sqlguard.config;

/**
 * How an unqualified column reference (no table prefix) is authorized.
 */
public enum UnqualifiedColumnPolicy {

	/**
	 * Allowed when any table the role may read allows the column, even a table the statement
	 * does not reference. Permissive; kept as the default and flagged for review in the
	 * security log whenever it is the only reason a column passes.
	 */
	ANY_ALLOWED_TABLE,

	/**
	 * Allowed only when one of the statement's own tables allows the column.
	 */
	REFERENCED_TABLES;

	public static UnqualifiedColumnPolicy fromConfig(String value) {
		if (value == null || value.isBlank()) {
			return ANY_ALLOWED_TABLE;
		}
		return switch (value.trim().toLowerCase(java.util.Locale.ROOT)) {
			case "any-allowed-table", "any_allowed_table" -> ANY_ALLOWED_TABLE;
			case "referenced-tables", "referenced_tables" -> REFERENCED_TABLES;
			default -> throw new GuardConfigException("Unknown unqualified-columns policy: " + value);
		};
	}
}
