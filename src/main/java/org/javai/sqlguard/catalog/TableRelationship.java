package org.javai.sqlguard.catalog;

/**
 * A single-column foreign key between two catalog tables.
 *
 * <p>Multi-column keys are represented by their first column pair only.</p>
 *
 * @param fromTable the child table holding the foreign key
 * @param fromColumn the foreign key column
 * @param toTable the referenced parent table
 * @param toColumn the referenced column (typically the primary key)
 */
public record TableRelationship(
		String fromTable,
		String fromColumn,
		String toTable,
		String toColumn
) {

	public TableRelationship {
		fromTable = Identifiers.normalize(fromTable);
		fromColumn = Identifiers.normalize(fromColumn);
		toTable = Identifiers.normalize(toTable);
		toColumn = Identifiers.normalize(toColumn);
	}

	/**
	 * Creates a join clause suggestion for SQL.
	 *
	 * @return a string like "JOIN toTable ON fromTable.fromColumn = toTable.toColumn"
	 */
	public String joinHint() {
		return "JOIN %s ON %s.%s = %s.%s".formatted(
				toTable, fromTable, fromColumn, toTable, toColumn);
	}

	/**
	 * @return a string like "fromTable.fromColumn -> toTable.toColumn"
	 */
	public String describe() {
		return "%s.%s -> %s.%s".formatted(fromTable, fromColumn, toTable, toColumn);
	}
}
