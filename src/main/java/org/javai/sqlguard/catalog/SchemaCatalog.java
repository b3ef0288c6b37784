package org.javai.sqlguard.catalog;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the target database schema: tables, their ordered columns and the
 * foreign keys between them.
 *
 * <p>A catalog is built once (see {@link JdbcSchemaCatalogLoader}) and is shared by every
 * request without copying. Implementations must be immutable. All names are normalized with
 * {@link Identifiers#normalize(String)}; lookups normalize their arguments the same way.</p>
 */
public interface SchemaCatalog {

	/**
	 * @return map of table name to its ordered column names (non-null, unmodifiable)
	 */
	Map<String, List<String>> tables();

	/**
	 * @return foreign key relationships between catalog tables (non-null, unmodifiable)
	 */
	List<TableRelationship> relationships();

	default boolean hasTable(String table) {
		return tables().containsKey(Identifiers.normalize(table));
	}

	/**
	 * @return the ordered columns of the table, or an empty list if the table is unknown
	 */
	default List<String> columns(String table) {
		return tables().getOrDefault(Identifiers.normalize(table), List.of());
	}

	default boolean hasColumn(String table, String column) {
		return columns(table).contains(Identifiers.normalize(column));
	}

	/**
	 * Returns whether any table in the catalog declares the given column.
	 */
	default boolean columnExistsAnywhere(String column) {
		String normalized = Identifiers.normalize(column);
		return tables().values().stream().anyMatch(columns -> columns.contains(normalized));
	}

	/**
	 * Looks up the foreign key linking a child table to a parent table.
	 */
	default Optional<TableRelationship> relationship(String childTable, String parentTable) {
		String child = Identifiers.normalize(childTable);
		String parent = Identifiers.normalize(parentTable);
		return relationships().stream()
				.filter(r -> r.fromTable().equals(child) && r.toTable().equals(parent))
				.findFirst();
	}

	default boolean isEmpty() {
		return tables().isEmpty();
	}
}
