package org.javai.sqlguard.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import org.javai.sqlguard.testsupport.Fixtures;
import org.javai.sqlguard.testsupport.LogCapture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Audit Trail Tests")
class AuditTrailTest {

	private final AuditRecord record = AuditRecord.query(Fixtures.employee(), "my orders", "SELECT id FROM orders",
			"ok", null, 3L);

	@Nested
	@DisplayName("Delivery")
	class DeliveryTests {

		@Test
		@DisplayName("Should deliver records to the sink")
		void shouldDeliver() {
			List<AuditRecord> delivered = new ArrayList<>();
			new AuditTrail(delivered::add).submit(record);
			assertThat(delivered).containsExactly(record);
		}

		@Test
		@DisplayName("Should contain a failing sink")
		void shouldContainSinkFailure() {
			AuditTrail trail = new AuditTrail(r -> {
				throw new IllegalStateException("disk full");
			});
			try (LogCapture diagnostics = LogCapture.of(AuditTrail.DIAGNOSTICS_CHANNEL)) {
				assertThatCode(() -> trail.submit(record)).doesNotThrowAnyException();
				assertThat(diagnostics.messages()).anyMatch(msg -> msg.contains("disk full"));
			}
		}

		@Test
		@DisplayName("Should contain a rejecting executor")
		void shouldContainRejection() {
			AuditTrail trail = new AuditTrail(r -> {
			}, task -> {
				throw new RejectedExecutionException("shutting down");
			});
			try (LogCapture diagnostics = LogCapture.of(AuditTrail.DIAGNOSTICS_CHANNEL)) {
				assertThatCode(() -> trail.submit(record)).doesNotThrowAnyException();
				assertThat(diagnostics.messages()).anyMatch(msg -> msg.startsWith("Audit record dropped"));
			}
		}
	}

	@Nested
	@DisplayName("JSON sink")
	class LoggingSinkTests {

		@Test
		@DisplayName("Should write one JSON line per record without null fields")
		void shouldWriteJson() {
			try (LogCapture audit = LogCapture.of(LoggingAuditSink.CHANNEL)) {
				new LoggingAuditSink().record(record);

				assertThat(audit.messages()).singleElement().satisfies(json -> {
					assertThat(json).startsWith("{").endsWith("}");
					assertThat(json).contains("\"type\":\"QUERY\"", "\"role\":\"employee\"", "\"subjectId\":\"8\"",
							"\"outcome\":\"ok\"", "\"elapsedMillis\":3");
					assertThat(json).doesNotContain("\"reason\"", "\"columns\"");
				});
			}
		}

		@Test
		@DisplayName("Should list the columns of a data access record")
		void shouldWriteDataAccessColumns() {
			try (LogCapture audit = LogCapture.of(LoggingAuditSink.CHANNEL)) {
				new LoggingAuditSink().record(AuditRecord.dataAccess(Fixtures.admin(), "SELECT salary FROM employees",
						List.of("employees.salary")));

				assertThat(audit.messages()).singleElement().satisfies(json -> assertThat(json)
						.contains("\"type\":\"DATA_ACCESS\"", "\"outcome\":\"accessed\"", "\"columns\":[\"employees.salary\"]"));
			}
		}
	}
}
