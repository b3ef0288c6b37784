package org.javai.sqlguard.audit;

import java.util.ArrayList;
import java.util.List;
import org.javai.sqlguard.catalog.SchemaCatalog;
import org.javai.sqlguard.identity.Identity;
import org.javai.sqlguard.policy.SensitiveColumns;
import org.javai.sqlguard.sql.ColumnReference;
import org.javai.sqlguard.sql.ExtractedReferences;
import org.javai.sqlguard.sql.StatementExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports reads of sensitive columns in a statement that is about to run.
 *
 * <p>Best-effort: any failure is logged on the diagnostics channel and the statement proceeds.</p>
 */
public class SensitiveAccessAuditor {

	private static final Logger diagnostics = LoggerFactory.getLogger(AuditTrail.DIAGNOSTICS_CHANNEL);

	private final SchemaCatalog catalog;
	private final SensitiveColumns sensitiveColumns;
	private final StatementExtractor extractor;
	private final AuditTrail auditTrail;

	public SensitiveAccessAuditor(SchemaCatalog catalog, SensitiveColumns sensitiveColumns, StatementExtractor extractor,
			AuditTrail auditTrail) {
		this.catalog = catalog;
		this.sensitiveColumns = sensitiveColumns;
		this.extractor = extractor;
		this.auditTrail = auditTrail;
	}

	/**
	 * @return the sensitive columns the statement reads, as {@code table.column}; empty when none
	 *         or when the audit itself failed
	 */
	public List<String> audit(String sql, Identity identity) {
		if (sensitiveColumns.isEmpty()) {
			return List.of();
		}
		try {
			List<String> accessed = sensitiveReads(extractor.extract(sql, catalog));
			if (!accessed.isEmpty()) {
				auditTrail.submit(AuditRecord.dataAccess(identity, sql, accessed));
			}
			return accessed;
		}
		catch (RuntimeException e) {
			diagnostics.error("Sensitive column audit failed for {}: {}", identity.describe(), e.getMessage(), e);
			return List.of();
		}
	}

	private List<String> sensitiveReads(ExtractedReferences references) {
		List<String> accessed = new ArrayList<>();
		for (ColumnReference column : references.columns()) {
			if (column.isQualified()) {
				if (sensitiveColumns.isSensitive(column.table(), column.column())) {
					add(accessed, column.qualifiedName());
				}
				continue;
			}
			for (String table : references.tables()) {
				if (catalog.hasColumn(table, column.column()) && sensitiveColumns.isSensitive(table, column.column())) {
					add(accessed, table + "." + column.column());
				}
			}
		}
		return accessed;
	}

	private static void add(List<String> accessed, String column) {
		if (!accessed.contains(column)) {
			accessed.add(column);
		}
	}
}
