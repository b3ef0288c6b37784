package org.javai.sqlguard.sql;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Select Statement Guard Tests")
class SelectStatementGuardTest {

	private final SelectStatementGuard guard = new SelectStatementGuard();

	@Nested
	@DisplayName("Accepted statements")
	class AcceptedTests {

		@Test
		@DisplayName("Should accept a single SELECT")
		void shouldAcceptSelect() {
			assertThat(guard.violation("SELECT id FROM orders WHERE total > 10")).isEmpty();
		}

		@Test
		@DisplayName("Should accept a trailing semicolon")
		void shouldAcceptTrailingSemicolon() {
			assertThat(guard.isSingleSelect("SELECT id FROM orders;")).isTrue();
		}

		@Test
		@DisplayName("Should accept a common table expression")
		void shouldAcceptWithQuery() {
			assertThat(guard.isSingleSelect(
					"WITH big AS (SELECT id FROM orders WHERE total > 100) SELECT id FROM big")).isTrue();
		}
	}

	@Nested
	@DisplayName("Rejected statements")
	class RejectedTests {

		@Test
		@DisplayName("Should reject an empty statement")
		void shouldRejectEmpty() {
			assertThat(guard.violation("   ")).contains("Empty statement");
		}

		@Test
		@DisplayName("Should reject stacked statements")
		void shouldRejectStackedStatements() {
			assertThat(guard.violation("SELECT 1; SELECT 2")).contains("Exactly one statement is allowed");
		}

		@Test
		@DisplayName("Should reject a statement that is not a SELECT")
		void shouldRejectNonSelect() {
			assertThat(guard.violation("DELETE FROM orders")).hasValueSatisfying(
					message -> assertThat(message).startsWith("Only SELECT statements are allowed"));
		}

		@Test
		@DisplayName("Should reject text that does not parse")
		void shouldRejectInvalidSyntax() {
			assertThat(guard.violation("SELECT id FROM orders WHERE (")).hasValueSatisfying(
					message -> assertThat(message).startsWith("Invalid SQL syntax"));
		}

		@Test
		@DisplayName("Should reject an unterminated literal")
		void shouldRejectMalformed() {
			assertThat(guard.violation("SELECT 'open")).hasValueSatisfying(
					message -> assertThat(message).startsWith("Malformed statement"));
		}
	}

	@Test
	@DisplayName("Should strip only trailing semicolons")
	void shouldStripTrailingSemicolons() {
		String sql = "SELECT ';' FROM orders ;;";
		assertThat(SelectStatementGuard.stripTrailingSemicolon(sql, SqlTokenizer.tokenize(sql)))
				.isEqualTo("SELECT ';' FROM orders");
	}
}
