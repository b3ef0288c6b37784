package org.javai.sqlguard.sql;

import org.javai.sqlguard.catalog.Identifiers;

/**
 * A column read by a statement.
 *
 * @param table the resolved table, or an empty string for an unqualified reference
 * @param column the column name
 */
public record ColumnReference(String table, String column) {

	public ColumnReference {
		table = Identifiers.normalize(table);
		column = Identifiers.normalize(column);
	}

	public static ColumnReference unqualified(String column) {
		return new ColumnReference("", column);
	}

	public boolean isQualified() {
		return !table.isEmpty();
	}

	/**
	 * @return {@code table.column}, or just the column name when unqualified
	 */
	public String qualifiedName() {
		return isQualified() ? table + "." + column : column;
	}

	@Override
	public String toString() {
		return qualifiedName();
	}
}
