package org.javai.sqlguard.authz;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.javai.sqlguard.catalog.SchemaCatalog;
import org.javai.sqlguard.config.GuardConfig;
import org.javai.sqlguard.config.UnqualifiedColumnPolicy;
import org.javai.sqlguard.identity.Identity;
import org.javai.sqlguard.policy.RbacPolicy;
import org.javai.sqlguard.screen.InjectionScreener;
import org.javai.sqlguard.sql.ColumnReference;
import org.javai.sqlguard.sql.ExtractedReferences;
import org.javai.sqlguard.sql.SelectStatementGuard;
import org.javai.sqlguard.sql.StatementExtractor;
import org.javai.sqlguard.sql.StatementParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a candidate statement stays inside an identity's authorization envelope.
 *
 * <p>Checks run in a fixed order and stop at the first failure:</p>
 * <ol>
 *   <li>the statement must start with {@code SELECT};</li>
 *   <li>no injection pattern may match;</li>
 *   <li>the statement must parse as exactly one SELECT;</li>
 *   <li>every referenced table must be allowed for the role, and at least one table must be
 *       referenced;</li>
 *   <li>every table-qualified column must be allowed on its table;</li>
 *   <li>every unqualified column must be allowed on some allowed table (or, under
 *       {@link UnqualifiedColumnPolicy#REFERENCED_TABLES}, on a table the statement reads).</li>
 * </ol>
 *
 * <p>Every denial is written to the security log before the verdict is returned. Instances are
 * immutable and safe to share between concurrent requests.</p>
 */
public class AuthorizationValidator {

	private static final Logger logger = LoggerFactory.getLogger(AuthorizationValidator.class);

	private static final Pattern LEADING_SELECT = Pattern.compile("^\\s*SELECT\\b", Pattern.CASE_INSENSITIVE);

	static final String NO_TABLE_DETAIL = "<no table referenced>";

	private final SchemaCatalog catalog;
	private final RbacPolicy rbac;
	private final UnqualifiedColumnPolicy unqualifiedColumns;
	private final InjectionScreener screener;
	private final SelectStatementGuard selectGuard;
	private final StatementExtractor extractor;
	private final SecurityEventLogger securityLog;

	public AuthorizationValidator(SchemaCatalog catalog, GuardConfig config) {
		this(catalog, config.rbac(), config.unqualifiedColumns(), InjectionScreener.of(config.injectionPatterns()),
				new SelectStatementGuard(), new StatementExtractor(), new SecurityEventLogger());
	}

	public AuthorizationValidator(SchemaCatalog catalog, RbacPolicy rbac, UnqualifiedColumnPolicy unqualifiedColumns,
			InjectionScreener screener, SelectStatementGuard selectGuard, StatementExtractor extractor,
			SecurityEventLogger securityLog) {
		this.catalog = catalog;
		this.rbac = rbac;
		this.unqualifiedColumns = unqualifiedColumns;
		this.screener = screener;
		this.selectGuard = selectGuard;
		this.extractor = extractor;
		this.securityLog = securityLog;
	}

	public AuthorizationVerdict authorize(String sql, Identity identity) {
		if (sql == null || !LEADING_SELECT.matcher(sql).find()) {
			return deny(identity, sql, DenialReason.FORBIDDEN_QUERY_TYPE, "statement is not a SELECT");
		}

		Optional<InjectionScreener.InjectionMatch> injection = screener.firstMatch(sql);
		if (injection.isPresent()) {
			return deny(identity, sql, DenialReason.INJECTION_SUSPECTED, injection.get().matchedText());
		}

		Optional<String> violation = selectGuard.violation(sql);
		if (violation.isPresent()) {
			return deny(identity, sql, DenialReason.FORBIDDEN_QUERY_TYPE, violation.get());
		}

		ExtractedReferences references;
		try {
			references = extractor.extract(sql, catalog);
		}
		catch (StatementParseException e) {
			return deny(identity, sql, DenialReason.FORBIDDEN_QUERY_TYPE, e.getMessage());
		}

		String role = identity.role();
		Map<String, Set<String>> allowedTables = rbac.allowedTables(role);

		if (references.tables().isEmpty()) {
			return deny(identity, sql, DenialReason.UNAUTHORIZED_TABLE, NO_TABLE_DETAIL);
		}
		for (String table : references.tables()) {
			if (!allowedTables.containsKey(table)) {
				return deny(identity, sql, DenialReason.UNAUTHORIZED_TABLE, table);
			}
		}

		for (ColumnReference column : references.qualifiedColumns()) {
			if (!rbac.isColumnAllowed(role, column.table(), column.column())) {
				return deny(identity, sql, DenialReason.UNAUTHORIZED_COLUMN, column.qualifiedName());
			}
		}

		for (ColumnReference column : references.unqualifiedColumns()) {
			if (!isUnqualifiedColumnAllowed(identity, sql, column.column(), references.tables())) {
				return deny(identity, sql, DenialReason.UNAUTHORIZED_COLUMN, describeUnqualified(column.column(), references));
			}
		}

		logger.debug("Statement authorized for {}", identity.describe());
		return AuthorizationVerdict.authorized();
	}

	private boolean isUnqualifiedColumnAllowed(Identity identity, String sql, String column, Set<String> referencedTables) {
		String role = identity.role();
		boolean allowedOnReferencedTable = referencedTables.stream()
				.anyMatch(table -> rbac.isColumnAllowed(role, table, column));
		if (allowedOnReferencedTable) {
			return true;
		}
		if (unqualifiedColumns == UnqualifiedColumnPolicy.REFERENCED_TABLES) {
			return false;
		}
		List<String> allowingTables = rbac.tablesAllowingColumn(role, column);
		if (allowingTables.isEmpty()) {
			return false;
		}
		securityLog.logPermissiveColumnMatch(identity, sql, column, allowingTables);
		return true;
	}

	/**
	 * Names the column against the first table the statement reads that declares it, so the
	 * denial points at the concrete column; falls back to the bare name.
	 */
	private String describeUnqualified(String column, ExtractedReferences references) {
		return references.tables().stream()
				.filter(table -> catalog.hasColumn(table, column))
				.findFirst()
				.map(table -> table + "." + column)
				.orElse(column);
	}

	private AuthorizationVerdict deny(Identity identity, String sql, DenialReason reason, String detail) {
		securityLog.logDenial(identity, sql, reason, detail);
		return AuthorizationVerdict.denied(reason, detail);
	}
}
