package org.javai.sqlguard.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.javai.sqlguard.catalog.Identifiers;

/**
 * Table → columns whose reads must be recorded in the data access audit.
 */
public final class SensitiveColumns {

	private final Map<String, Set<String>> columns;

	private SensitiveColumns(Map<String, Set<String>> columns) {
		this.columns = columns;
	}

	public static SensitiveColumns of(Map<String, ? extends Iterable<String>> raw) {
		Map<String, Set<String>> copy = new LinkedHashMap<>();
		if (raw != null) {
			raw.forEach((table, cols) -> {
				Set<String> set = new LinkedHashSet<>();
				if (cols != null) {
					cols.forEach(c -> set.add(Identifiers.normalize(c)));
				}
				copy.put(Identifiers.normalize(table), Collections.unmodifiableSet(set));
			});
		}
		return new SensitiveColumns(Collections.unmodifiableMap(copy));
	}

	public static SensitiveColumns none() {
		return of(Map.of());
	}

	public boolean isSensitive(String table, String column) {
		Set<String> set = columns.get(Identifiers.normalize(table));
		return set != null && set.contains(Identifiers.normalize(column));
	}

	public boolean isEmpty() {
		return columns.isEmpty();
	}

	public Map<String, Set<String>> asMap() {
		return columns;
	}
}
