package org.javai.sqlguard.catalog;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeMap;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Introspects a live database through {@link DatabaseMetaData} and produces an immutable
 * {@link SchemaCatalog}.
 *
 * <p>Only tables and views of a single schema are read: the configured one, or the
 * connection's current schema when none is configured. Any failure is fatal and surfaces as
 * {@link SchemaUnavailableException}; there is no degraded mode.</p>
 */
public final class JdbcSchemaCatalogLoader {

	private static final Logger logger = LoggerFactory.getLogger(JdbcSchemaCatalogLoader.class);

	private static final Set<String> RELATION_TYPES = Set.of(
			"TABLE", "BASE TABLE", "VIEW", "PARTITIONED TABLE");

	private final String schema;

	/**
	 * @param schema the schema to introspect, or {@code null} for the connection's current schema
	 */
	public JdbcSchemaCatalogLoader(String schema) {
		this.schema = schema != null && !schema.isBlank() ? schema : null;
	}

	public JdbcSchemaCatalogLoader() {
		this(null);
	}

	public SchemaCatalog load(DataSource dataSource) {
		try (Connection connection = dataSource.getConnection()) {
			return load(connection);
		}
		catch (SQLException e) {
			throw new SchemaUnavailableException("Database unreachable while loading schema: " + e.getMessage(), e);
		}
	}

	public SchemaCatalog load(Connection connection) {
		try {
			DatabaseMetaData metaData = connection.getMetaData();
			String catalogName = connection.getCatalog();
			String schemaPattern = schema != null ? schema : connection.getSchema();

			InMemorySchemaCatalog.Builder builder = InMemorySchemaCatalog.builder();
			List<String> tableNames = readTableNames(metaData, catalogName, schemaPattern);
			for (String table : tableNames) {
				builder.addTable(table);
				readColumns(metaData, catalogName, schemaPattern, table).forEach(column -> builder.addColumn(table, column));
			}
			for (String table : tableNames) {
				readForeignKeys(metaData, catalogName, schemaPattern, table, builder);
			}

			SchemaCatalog catalog = builder.build();
			logger.info("Loaded schema catalog from schema '{}': {} tables, {} relationships",
					schemaPattern, catalog.tables().size(), catalog.relationships().size());
			if (catalog.isEmpty()) {
				logger.warn("Schema '{}' contains no tables; every statement will be denied", schemaPattern);
			}
			return catalog;
		}
		catch (SQLException e) {
			throw new SchemaUnavailableException("Failed to read schema metadata: " + e.getMessage(), e);
		}
	}

	private List<String> readTableNames(DatabaseMetaData metaData, String catalogName, String schemaPattern)
			throws SQLException {
		List<String> names = new ArrayList<>();
		try (ResultSet rs = metaData.getTables(catalogName, schemaPattern, "%", null)) {
			while (rs.next()) {
				String type = rs.getString("TABLE_TYPE");
				if (type != null && RELATION_TYPES.contains(type.toUpperCase(Locale.ROOT))) {
					names.add(rs.getString("TABLE_NAME"));
				}
			}
		}
		return names;
	}

	private List<String> readColumns(DatabaseMetaData metaData, String catalogName, String schemaPattern,
			String table) throws SQLException {
		TreeMap<Integer, String> byPosition = new TreeMap<>();
		try (ResultSet rs = metaData.getColumns(catalogName, schemaPattern, table, "%")) {
			while (rs.next()) {
				byPosition.put(rs.getInt("ORDINAL_POSITION"), rs.getString("COLUMN_NAME"));
			}
		}
		return new ArrayList<>(byPosition.values());
	}

	private void readForeignKeys(DatabaseMetaData metaData, String catalogName, String schemaPattern,
			String table, InMemorySchemaCatalog.Builder builder) throws SQLException {
		try (ResultSet rs = metaData.getImportedKeys(catalogName, schemaPattern, table)) {
			while (rs.next()) {
				if (rs.getInt("KEY_SEQ") != 1) {
					continue;
				}
				builder.addRelationship(
						rs.getString("FKTABLE_NAME"),
						rs.getString("FKCOLUMN_NAME"),
						rs.getString("PKTABLE_NAME"),
						rs.getString("PKCOLUMN_NAME"));
			}
		}
	}
}
