package org.javai.sqlguard.sql;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.sqlguard.catalog.SchemaCatalog;
import org.javai.sqlguard.sql.ReferenceClassifier.Classification;
import org.javai.sqlguard.sql.ReferenceClassifier.NameReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers the tables and columns a statement reads.
 *
 * <p>Classification (see {@link ReferenceClassifier}) is followed by resolution against the
 * schema catalog:</p>
 * <ul>
 *   <li>a qualifier is looked up as an alias and as a catalog table; the column is recorded
 *       against every candidate table that declares it;</li>
 *   <li>a qualifier that resolves to nothing (a derived table alias, a misspelling) degrades to
 *       an unqualified reference;</li>
 *   <li>an unqualified name is recorded as {@code ("", column)} when any catalog table declares
 *       it; other bare names (output labels, keywords of other dialects) are dropped;</li>
 *   <li>{@code *} and {@code t.*} expand to every catalog column of the tables they cover.</li>
 * </ul>
 *
 * <p>Ambiguity always resolves towards recording more references, never fewer. A single
 * statement is also read through its JSqlParser tree ({@link ParseTreeReferences}); tables,
 * aliases and columns found there are added to those of the token scan.</p>
 */
public final class StatementExtractor {

	private static final Logger logger = LoggerFactory.getLogger(StatementExtractor.class);

	/**
	 * @throws StatementParseException if the text cannot be tokenized
	 */
	public ExtractedReferences extract(String sql, SchemaCatalog catalog) {
		Set<String> tables = new LinkedHashSet<>();
		Set<ColumnReference> columns = new LinkedHashSet<>();
		List<List<SqlToken>> statements = SqlTokenizer.splitStatements(SqlTokenizer.tokenize(sql));
		for (List<SqlToken> statement : statements) {
			Classification classification = ReferenceClassifier.classify(statement);
			if (statements.size() == 1) {
				String body = sql.substring(statement.get(0).start(), statement.get(statement.size() - 1).end());
				classification = withParseTree(classification, body, catalog);
			}
			tables.addAll(classification.tables());
			resolve(classification, catalog, columns);
		}
		ExtractedReferences references = new ExtractedReferences(tables, columns);
		logger.debug("Extracted references: tables={}, columns={}", references.tables(), references.columns());
		return references;
	}

	private Classification withParseTree(Classification classification, String sql, SchemaCatalog catalog) {
		Optional<ParseTreeReferences> parsed = ParseTreeReferences.of(sql);
		if (parsed.isEmpty()) {
			return classification;
		}
		ParseTreeReferences tree = parsed.get();

		Set<String> tables = new LinkedHashSet<>(classification.tables());
		List<NameReference> columns = new ArrayList<>(classification.columns());
		Map<String, Set<String>> aliases = new LinkedHashMap<>();
		classification.aliases().forEach((alias, targets) -> aliases.put(alias, new LinkedHashSet<>(targets)));
		tree.aliases().forEach((alias, targets) -> aliases.computeIfAbsent(alias, k -> new LinkedHashSet<>()).addAll(targets));

		List<String> missedTables = new ArrayList<>();
		for (String table : tree.tables()) {
			if (tables.add(table)) {
				missedTables.add(table);
			}
		}
		List<NameReference> missedColumns = new ArrayList<>();
		for (NameReference column : tree.columns()) {
			if (!columns.contains(column)) {
				columns.add(column);
				if (catalog.columnExistsAnywhere(column.name())) {
					missedColumns.add(column);
				}
			}
		}
		if (!missedTables.isEmpty() || !missedColumns.isEmpty()) {
			logger.warn("Parse tree holds references the token scan missed: tables={}, columns={}", missedTables, missedColumns);
		}
		return new Classification(tables, aliases, columns, classification.qualifiedWildcards(),
				classification.wildcardTables());
	}

	private void resolve(Classification classification, SchemaCatalog catalog, Set<ColumnReference> columns) {
		Map<String, Set<String>> aliases = classification.aliases();
		for (NameReference reference : classification.columns()) {
			String column = reference.name();
			boolean recorded = false;
			if (reference.qualifier() != null) {
				for (String table : qualifierTargets(reference.qualifier(), aliases, catalog)) {
					if (catalog.hasColumn(table, column)) {
						columns.add(new ColumnReference(table, column));
						recorded = true;
					}
				}
			}
			if (!recorded && catalog.columnExistsAnywhere(column)) {
				columns.add(ColumnReference.unqualified(column));
			}
		}

		for (String table : classification.wildcardTables()) {
			expand(table, catalog, columns);
		}
		for (String qualifier : classification.qualifiedWildcards()) {
			Set<String> targets = qualifierTargets(qualifier, aliases, catalog);
			if (targets.isEmpty() && !aliases.containsKey(qualifier)) {
				// unknown qualifier: cover every table the statement names
				targets = classification.tables();
			}
			targets.forEach(table -> expand(table, catalog, columns));
		}
	}

	private Set<String> qualifierTargets(String qualifier, Map<String, Set<String>> aliases, SchemaCatalog catalog) {
		Set<String> targets = new LinkedHashSet<>(aliases.getOrDefault(qualifier, Set.of()));
		if (catalog.hasTable(qualifier)) {
			targets.add(qualifier);
		}
		return targets;
	}

	private void expand(String table, SchemaCatalog catalog, Set<ColumnReference> columns) {
		for (String column : catalog.columns(table)) {
			columns.add(new ColumnReference(table, column));
		}
	}
}
