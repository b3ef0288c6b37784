package org.javai.sqlguard.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.sqlguard.catalog.Identifiers;
import org.javai.sqlguard.catalog.InMemorySchemaCatalog;
import org.javai.sqlguard.catalog.SchemaCatalog;
import org.javai.sqlguard.catalog.TableRelationship;

/**
 * Role-based table and column allow-lists.
 *
 * <p>A role maps to the tables it may read, and each table to the set of readable columns.
 * A role that is absent from the policy has no access at all. The policy is immutable and is
 * shared by all requests.</p>
 */
public final class RbacPolicy {

	private final Map<String, Map<String, Set<String>>> rules;

	private RbacPolicy(Map<String, Map<String, Set<String>>> rules) {
		this.rules = rules;
	}

	/**
	 * Builds a policy from raw role → table → columns rules. Names are normalized and the
	 * result is deeply unmodifiable.
	 */
	public static RbacPolicy of(Map<String, ? extends Map<String, ? extends Iterable<String>>> rules) {
		Map<String, Map<String, Set<String>>> copy = new LinkedHashMap<>();
		if (rules != null) {
			rules.forEach((role, tables) -> {
				Map<String, Set<String>> tableCopy = new LinkedHashMap<>();
				if (tables != null) {
					tables.forEach((table, columns) -> {
						Set<String> columnCopy = new LinkedHashSet<>();
						if (columns != null) {
							columns.forEach(column -> columnCopy.add(Identifiers.normalize(column)));
						}
						tableCopy.merge(Identifiers.normalize(table), columnCopy, (a, b) -> {
							a.addAll(b);
							return a;
						});
					});
				}
				Map<String, Set<String>> frozen = new LinkedHashMap<>();
				tableCopy.forEach((table, columns) -> frozen.put(table, Collections.unmodifiableSet(columns)));
				copy.put(Identifiers.normalize(role), Collections.unmodifiableMap(frozen));
			});
		}
		return new RbacPolicy(Collections.unmodifiableMap(copy));
	}

	public static RbacPolicy empty() {
		return of(Map.of());
	}

	public boolean hasRole(String role) {
		return rules.containsKey(Identifiers.normalize(role));
	}

	public Set<String> roles() {
		return rules.keySet();
	}

	/**
	 * @return table → allowed columns for the role; empty when the role is unknown
	 */
	public Map<String, Set<String>> allowedTables(String role) {
		return rules.getOrDefault(Identifiers.normalize(role), Map.of());
	}

	public boolean isTableAllowed(String role, String table) {
		return allowedTables(role).containsKey(Identifiers.normalize(table));
	}

	public boolean isColumnAllowed(String role, String table, String column) {
		Set<String> columns = allowedTables(role).get(Identifiers.normalize(table));
		return columns != null && columns.contains(Identifiers.normalize(column));
	}

	/**
	 * @return the allowed tables of the role whose allow-list contains the column
	 */
	public List<String> tablesAllowingColumn(String role, String column) {
		String normalized = Identifiers.normalize(column);
		return allowedTables(role).entrySet().stream()
				.filter(e -> e.getValue().contains(normalized))
				.map(Map.Entry::getKey)
				.toList();
	}

	/**
	 * Restricts a catalog to what the role may see: allowed tables that exist in the catalog,
	 * with only their allowed columns (catalog order preserved), and the relationships between
	 * visible columns.
	 */
	public SchemaCatalog filter(String role, SchemaCatalog catalog) {
		Map<String, Set<String>> allowed = allowedTables(role);
		if (allowed.isEmpty()) {
			return InMemorySchemaCatalog.empty();
		}
		InMemorySchemaCatalog.Builder builder = InMemorySchemaCatalog.builder();
		catalog.tables().forEach((table, columns) -> {
			Set<String> allowedColumns = allowed.get(table);
			if (allowedColumns != null) {
				builder.addTable(table, columns.stream().filter(allowedColumns::contains).toArray(String[]::new));
			}
		});
		for (TableRelationship r : catalog.relationships()) {
			if (isColumnAllowed(role, r.fromTable(), r.fromColumn()) && isColumnAllowed(role, r.toTable(), r.toColumn())) {
				builder.addRelationship(r.fromTable(), r.fromColumn(), r.toTable(), r.toColumn());
			}
		}
		return builder.build();
	}
}
