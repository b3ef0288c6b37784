package org.javai.sqlguard.pipeline;

import java.util.Optional;
import org.javai.sqlguard.audit.AuditRecord;
import org.javai.sqlguard.audit.AuditTrail;
import org.javai.sqlguard.audit.SensitiveAccessAuditor;
import org.javai.sqlguard.authz.AuthorizationValidator;
import org.javai.sqlguard.authz.AuthorizationVerdict;
import org.javai.sqlguard.authz.DenialReason;
import org.javai.sqlguard.authz.SecurityEventLogger;
import org.javai.sqlguard.exec.CancellationToken;
import org.javai.sqlguard.exec.ExecutionResult;
import org.javai.sqlguard.exec.QueryExecutionException;
import org.javai.sqlguard.exec.QueryExecutor;
import org.javai.sqlguard.identity.Identity;
import org.javai.sqlguard.rls.RowFilterRewriter;
import org.javai.sqlguard.sql.SelectStatementGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a candidate statement through authorization, row filtering, auditing and execution.
 *
 * <p>A denial short-circuits before anything reaches the database. The rewritten statement is
 * checked again to be a single SELECT before it runs. The sensitive-column audit is
 * best-effort. Every outcome except a caller-side rejection produces a query audit record.</p>
 */
public class GuardedQueryPipeline {

	private static final Logger logger = LoggerFactory.getLogger(GuardedQueryPipeline.class);

	private final AuthorizationValidator validator;
	private final RowFilterRewriter rewriter;
	private final SelectStatementGuard selectGuard;
	private final SensitiveAccessAuditor sensitiveAccessAuditor;
	private final QueryExecutor executor;
	private final AuditTrail auditTrail;
	private final SecurityEventLogger securityLog;

	public GuardedQueryPipeline(AuthorizationValidator validator, RowFilterRewriter rewriter,
			SensitiveAccessAuditor sensitiveAccessAuditor, QueryExecutor executor, AuditTrail auditTrail) {
		this(validator, rewriter, new SelectStatementGuard(), sensitiveAccessAuditor, executor, auditTrail,
				new SecurityEventLogger());
	}

	public GuardedQueryPipeline(AuthorizationValidator validator, RowFilterRewriter rewriter,
			SelectStatementGuard selectGuard, SensitiveAccessAuditor sensitiveAccessAuditor, QueryExecutor executor,
			AuditTrail auditTrail, SecurityEventLogger securityLog) {
		this.validator = validator;
		this.rewriter = rewriter;
		this.selectGuard = selectGuard;
		this.sensitiveAccessAuditor = sensitiveAccessAuditor;
		this.executor = executor;
		this.auditTrail = auditTrail;
		this.securityLog = securityLog;
	}

	public PipelineResult processCandidate(String sql, Identity identity) {
		return processCandidate(sql, identity, null, CancellationToken.create());
	}

	public PipelineResult processCandidate(String sql, Identity identity, CancellationToken cancellation) {
		return processCandidate(sql, identity, null, cancellation);
	}

	/**
	 * @param question the question the statement was generated from, recorded in the audit log; may be null
	 */
	public PipelineResult processCandidate(String sql, Identity identity, String question, CancellationToken cancellation) {
		AuthorizationVerdict verdict = validator.authorize(sql, identity);
		if (verdict instanceof AuthorizationVerdict.Denied denied) {
			audit(identity, question, sql, "denied", denied.reason().wireName(), null);
			return new PipelineResult.Denied(denied.reason(), denied.detail(), denied.message());
		}

		String finalSql;
		try {
			finalSql = rewriter.applyRowFilter(sql, identity);
		}
		catch (IllegalArgumentException e) {
			logger.warn("Row filter could not be applied for {}: {}", identity.describe(), e.getMessage());
			return new PipelineResult.Rejected(e.getMessage());
		}

		Optional<String> violation = selectGuard.violation(finalSql);
		if (violation.isPresent()) {
			securityLog.logDenial(identity, finalSql, DenialReason.FORBIDDEN_QUERY_TYPE, violation.get());
			audit(identity, question, finalSql, "denied", DenialReason.FORBIDDEN_QUERY_TYPE.wireName(), null);
			return new PipelineResult.Denied(DenialReason.FORBIDDEN_QUERY_TYPE, violation.get(),
					DenialReason.FORBIDDEN_QUERY_TYPE.describe(violation.get()));
		}

		sensitiveAccessAuditor.audit(finalSql, identity);

		try {
			ExecutionResult result = executor.execute(finalSql, cancellation);
			audit(identity, question, finalSql, "ok", null, result.elapsedMillis());
			return new PipelineResult.Ok(finalSql, result.columns(), result.rows(), result.rowCount(), result.elapsedMillis());
		}
		catch (QueryExecutionException e) {
			audit(identity, question, finalSql, "failed", e.kind().name(), null);
			return new PipelineResult.Failed(failureKind(e.kind()), e.getMessage());
		}
	}

	private static PipelineResult.FailureKind failureKind(QueryExecutionException.Kind kind) {
		return switch (kind) {
			case TIMEOUT -> PipelineResult.FailureKind.EXECUTION_TIMEOUT;
			case CANCELLED -> PipelineResult.FailureKind.EXECUTION_CANCELLED;
			case DRIVER_ERROR -> PipelineResult.FailureKind.EXECUTION_ERROR;
		};
	}

	private void audit(Identity identity, String question, String sql, String outcome, String reason, Long elapsedMillis) {
		auditTrail.submit(AuditRecord.query(identity, question, sql, outcome, reason, elapsedMillis));
	}
}
