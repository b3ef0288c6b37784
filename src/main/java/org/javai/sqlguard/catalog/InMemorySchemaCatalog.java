package org.javai.sqlguard.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable {@link SchemaCatalog} held entirely in memory.
 *
 * <p>Instances are produced by {@link JdbcSchemaCatalogLoader} from a live database, or built
 * fluently for tests and static configurations:</p>
 *
 * <pre>{@code
 * SchemaCatalog catalog = InMemorySchemaCatalog.builder()
 *     .addTable("orders", "id", "customer_id", "total")
 *     .addTable("customers", "id", "name")
 *     .addRelationship("orders", "customer_id", "customers", "id")
 *     .build();
 * }</pre>
 */
public final class InMemorySchemaCatalog implements SchemaCatalog {

	private static final InMemorySchemaCatalog EMPTY = new InMemorySchemaCatalog(Map.of(), List.of());

	private final Map<String, List<String>> tables;
	private final List<TableRelationship> relationships;

	private InMemorySchemaCatalog(Map<String, List<String>> tables, List<TableRelationship> relationships) {
		this.tables = tables;
		this.relationships = relationships;
	}

	public static InMemorySchemaCatalog empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Map<String, List<String>> tables() {
		return tables;
	}

	@Override
	public List<TableRelationship> relationships() {
		return relationships;
	}

	@Override
	public String toString() {
		return "InMemorySchemaCatalog" + tables.keySet();
	}

	public static final class Builder {

		private final Map<String, List<String>> tables = new LinkedHashMap<>();
		private final Map<String, TableRelationship> relationships = new LinkedHashMap<>();

		private Builder() {
		}

		/**
		 * Adds a table, or appends columns to a table that was added before. Duplicate
		 * columns are ignored.
		 */
		public Builder addTable(String table, String... columns) {
			String name = Identifiers.normalize(table);
			if (name.isEmpty()) {
				return this;
			}
			List<String> existing = tables.computeIfAbsent(name, t -> new ArrayList<>());
			if (columns != null) {
				for (String column : columns) {
					addColumnTo(existing, column);
				}
			}
			return this;
		}

		public Builder addColumn(String table, String column) {
			String name = Identifiers.normalize(table);
			if (name.isEmpty()) {
				return this;
			}
			addColumnTo(tables.computeIfAbsent(name, t -> new ArrayList<>()), column);
			return this;
		}

		/**
		 * Records the foreign key between a child and a parent table. The first relationship
		 * registered for a (child, parent) pair wins.
		 */
		public Builder addRelationship(String fromTable, String fromColumn, String toTable, String toColumn) {
			TableRelationship relationship = new TableRelationship(fromTable, fromColumn, toTable, toColumn);
			relationships.putIfAbsent(relationship.fromTable() + "->" + relationship.toTable(), relationship);
			return this;
		}

		public InMemorySchemaCatalog build() {
			Map<String, List<String>> copy = new LinkedHashMap<>();
			tables.forEach((table, columns) -> copy.put(table, List.copyOf(columns)));
			return new InMemorySchemaCatalog(
					Collections.unmodifiableMap(copy),
					List.copyOf(relationships.values()));
		}

		private static void addColumnTo(List<String> columns, String column) {
			String name = Identifiers.normalize(column);
			if (!name.isEmpty() && !columns.contains(name)) {
				columns.add(name);
			}
		}
	}
}
