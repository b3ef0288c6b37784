package org.javai.sqlguard.sql;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tables and columns a statement reads, in order of first appearance.
 *
 * <p>Tables include every name found in table position, whether or not the catalog knows it.
 * Unqualified columns carry an empty table and must be matched against any allowed table.</p>
 */
public record ExtractedReferences(Set<String> tables, Set<ColumnReference> columns) {

	public ExtractedReferences {
		tables = Collections.unmodifiableSet(new LinkedHashSet<>(tables));
		columns = Collections.unmodifiableSet(new LinkedHashSet<>(columns));
	}

	public static ExtractedReferences empty() {
		return new ExtractedReferences(Set.of(), Set.of());
	}

	public Set<ColumnReference> qualifiedColumns() {
		return filter(true);
	}

	public Set<ColumnReference> unqualifiedColumns() {
		return filter(false);
	}

	private Set<ColumnReference> filter(boolean qualified) {
		Set<ColumnReference> result = new LinkedHashSet<>();
		for (ColumnReference column : columns) {
			if (column.isQualified() == qualified) {
				result.add(column);
			}
		}
		return result;
	}
}
