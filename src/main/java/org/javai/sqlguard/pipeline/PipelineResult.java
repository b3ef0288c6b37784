package org.javai.sqlguard.pipeline;

import java.util.List;
import java.util.Map;
import org.javai.sqlguard.authz.DenialReason;

/**
 * Outcome of one request, as handed to the boundary layer.
 */
public sealed interface PipelineResult {

	/**
	 * @return a stable lower-case tag: {@code ok}, {@code denied}, {@code failed},
	 *         {@code clarification}, {@code refused} or {@code rejected}
	 */
	String status();

	/**
	 * @param executedSql the statement as run, row filter included
	 */
	record Ok(String executedSql, List<String> columns, List<Map<String, Object>> rows, int rowCount,
			long elapsedMillis) implements PipelineResult {

		public Ok {
			columns = List.copyOf(columns);
			rows = List.copyOf(rows);
		}

		@Override
		public String status() {
			return "ok";
		}
	}

	/**
	 * The statement left the caller's authorization envelope.
	 */
	record Denied(DenialReason reason, String detail, String message) implements PipelineResult {

		@Override
		public String status() {
			return "denied";
		}
	}

	record Failed(FailureKind kind, String message) implements PipelineResult {

		@Override
		public String status() {
			return "failed";
		}
	}

	record ClarificationNeeded(String question) implements PipelineResult {

		@Override
		public String status() {
			return "clarification";
		}
	}

	record Refused(String message) implements PipelineResult {

		@Override
		public String status() {
			return "refused";
		}
	}

	/**
	 * The request itself was unusable, e.g. the caller carries no subject id.
	 */
	record Rejected(String message) implements PipelineResult {

		@Override
		public String status() {
			return "rejected";
		}
	}

	enum FailureKind {
		EXECUTION_ERROR, EXECUTION_TIMEOUT, EXECUTION_CANCELLED, GENERATION_ERROR;

		public boolean isExecutionFailure() {
			return this != GENERATION_ERROR;
		}
	}
}
