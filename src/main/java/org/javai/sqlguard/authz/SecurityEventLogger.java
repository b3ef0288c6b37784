package org.javai.sqlguard.authz;

import java.util.List;
import org.javai.sqlguard.audit.AuditTrail;
import org.javai.sqlguard.identity.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes security events to the {@value #CHANNEL} logger.
 *
 * <p>A logging failure must never change an authorization outcome, so failures are reported on
 * the {@value AuditTrail#DIAGNOSTICS_CHANNEL} logger and otherwise dropped.</p>
 */
public class SecurityEventLogger {

	public static final String CHANNEL = "sqlguard.security";

	private final Logger logger;
	private final Logger diagnostics;

	public SecurityEventLogger() {
		this(LoggerFactory.getLogger(CHANNEL), LoggerFactory.getLogger(AuditTrail.DIAGNOSTICS_CHANNEL));
	}

	SecurityEventLogger(Logger logger, Logger diagnostics) {
		this.logger = logger;
		this.diagnostics = diagnostics;
	}

	public void logDenial(Identity identity, String sql, DenialReason reason, String detail) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		try {
			logger.warn("[SECURITY ALERT] Unauthorized query attempt: user={} reason={} detail='{}' sql='{}'",
					describe(identity), reason.wireName(), detail, summarize(sql));
		}
		catch (RuntimeException e) {
			diagnostics.error("Failed to record security event {} for {}", reason.wireName(), describe(identity), e);
		}
	}

	/**
	 * Records that an unqualified column was accepted only because a table the statement does not
	 * read allows a column of the same name.
	 */
	public void logPermissiveColumnMatch(Identity identity, String sql, String column, List<String> allowingTables) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		try {
			logger.warn("[REVIEW] Unqualified column '{}' authorized via unreferenced table(s) {}: user={} sql='{}'",
					column, allowingTables, describe(identity), summarize(sql));
		}
		catch (RuntimeException e) {
			diagnostics.error("Failed to record review event for column {}", column, e);
		}
	}

	private String describe(Identity identity) {
		return identity == null ? "n/a" : identity.describe();
	}

	private String summarize(String sql) {
		if (sql == null || sql.isBlank()) {
			return "";
		}
		String normalized = sql.replaceAll("\\s+", " ").trim();
		int maxLength = 512;
		return normalized.length() <= maxLength ? normalized : normalized.substring(0, maxLength - 3) + "...";
	}
}
