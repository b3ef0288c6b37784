package org.javai.sqlguard.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import org.javai.sqlguard.identity.Identity;

/**
 * One structured audit entry.
 *
 * @param timestamp ISO-8601 instant
 * @param type {@value #QUERY} for statement outcomes, {@value #DATA_ACCESS} for sensitive reads
 * @param user display name of the caller
 * @param role caller role
 * @param subjectId caller id
 * @param question the natural-language question, when the statement was generated from one
 * @param statement the statement as authorized or executed
 * @param outcome {@code ok}, {@code denied}, {@code failed} or {@code accessed}
 * @param reason denial reason or failure kind
 * @param elapsedMillis execution time, when the statement ran
 * @param columns sensitive columns read, for data access entries
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditRecord(
		String timestamp,
		String type,
		String user,
		String role,
		String subjectId,
		String question,
		String statement,
		String outcome,
		String reason,
		Long elapsedMillis,
		List<String> columns
) {

	public static final String QUERY = "QUERY";
	public static final String DATA_ACCESS = "DATA_ACCESS";

	public static AuditRecord query(Identity identity, String question, String statement, String outcome,
			String reason, Long elapsedMillis) {
		return new AuditRecord(Instant.now().toString(), QUERY, identity.displayName(), identity.role(),
				identity.subjectId(), question, statement, outcome, reason, elapsedMillis, null);
	}

	public static AuditRecord dataAccess(Identity identity, String statement, List<String> columns) {
		return new AuditRecord(Instant.now().toString(), DATA_ACCESS, identity.displayName(), identity.role(),
				identity.subjectId(), null, statement, "accessed", null, null, List.copyOf(columns));
	}
}
