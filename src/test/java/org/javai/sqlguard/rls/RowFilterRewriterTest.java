package org.javai.sqlguard.rls;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.javai.sqlguard.identity.Identity;
import org.javai.sqlguard.testsupport.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Row Filter Rewriter Tests")
class RowFilterRewriterTest {

	private final RowFilterRewriter rewriter = new RowFilterRewriter(Fixtures.rls());
	private final Identity employee = Fixtures.employee();

	@Nested
	@DisplayName("Inserting the filter")
	class InsertionTests {

		@Test
		@DisplayName("Should add a WHERE clause to an unfiltered statement")
		void shouldAddWhereClause() {
			assertThat(rewriter.applyRowFilter("SELECT id FROM orders", employee))
					.isEqualTo("SELECT id FROM orders WHERE orders.employee_id = 8");
		}

		@Test
		@DisplayName("Should AND the filter onto an existing condition")
		void shouldAndExistingCondition() {
			assertThat(rewriter.applyRowFilter("SELECT id FROM orders WHERE total > 100", employee))
					.isEqualTo("SELECT id FROM orders WHERE total > 100 AND orders.employee_id = 8");
		}

		@Test
		@DisplayName("Should parenthesise a condition with a top-level OR")
		void shouldWrapOrCondition() {
			assertThat(rewriter.applyRowFilter("SELECT id FROM orders WHERE status = 'open' OR total > 100", employee))
					.isEqualTo("SELECT id FROM orders WHERE (status = 'open' OR total > 100) AND orders.employee_id = 8");
		}

		@Test
		@DisplayName("Should not let an OR branch bypass an existing filter")
		void shouldWrapOrAroundExistingFilter() {
			assertThat(rewriter.applyRowFilter("SELECT id FROM orders WHERE orders.employee_id = 8 OR total > 0", employee))
					.isEqualTo("SELECT id FROM orders WHERE (orders.employee_id = 8 OR total > 0) AND orders.employee_id = 8");
		}

		@Test
		@DisplayName("Should insert the WHERE clause before ORDER BY and LIMIT")
		void shouldInsertBeforeTail() {
			assertThat(rewriter.applyRowFilter("SELECT id FROM orders ORDER BY total DESC LIMIT 5", employee))
					.isEqualTo("SELECT id FROM orders WHERE orders.employee_id = 8 ORDER BY total DESC LIMIT 5");
		}

		@Test
		@DisplayName("Should extend an existing WHERE that is followed by GROUP BY")
		void shouldExtendWhereBeforeGroupBy() {
			assertThat(rewriter.applyRowFilter(
					"SELECT status, COUNT(*) FROM orders WHERE total > 1 GROUP BY status", employee))
					.isEqualTo("SELECT status, COUNT(*) FROM orders WHERE total > 1 AND orders.employee_id = 8 GROUP BY status");
		}

		@Test
		@DisplayName("Should leave subqueries in the condition intact")
		void shouldKeepSubqueries() {
			assertThat(rewriter.applyRowFilter(
					"SELECT id FROM orders WHERE id IN (SELECT order_id FROM invoices WHERE total > 5)", employee))
					.isEqualTo("SELECT id FROM orders WHERE id IN (SELECT order_id FROM invoices WHERE total > 5)"
							+ " AND orders.employee_id = 8");
		}

		@Test
		@DisplayName("Should drop a trailing semicolon")
		void shouldDropTrailingSemicolon() {
			assertThat(rewriter.applyRowFilter("SELECT id FROM orders;", employee))
					.isEqualTo("SELECT id FROM orders WHERE orders.employee_id = 8");
		}
	}

	@Nested
	@DisplayName("Aliases and set operations")
	class AliasTests {

		@Test
		@DisplayName("Should qualify the filter with the table alias")
		void shouldUseAlias() {
			assertThat(rewriter.applyRowFilter("SELECT o.id FROM orders o", employee))
					.isEqualTo("SELECT o.id FROM orders o WHERE o.employee_id = 8");
		}

		@Test
		@DisplayName("Should qualify the filter with an AS alias in a join")
		void shouldUseAsAliasInJoin() {
			assertThat(rewriter.applyRowFilter(
					"SELECT o.id, c.name FROM orders AS o JOIN customers c ON o.customer_id = c.id", employee))
					.isEqualTo("SELECT o.id, c.name FROM orders AS o JOIN customers c ON o.customer_id = c.id"
							+ " WHERE o.employee_id = 8");
		}

		@Test
		@DisplayName("Should filter every branch of a UNION")
		void shouldFilterUnionBranches() {
			assertThat(rewriter.applyRowFilter(
					"SELECT id FROM orders WHERE status = 'open' UNION SELECT id FROM orders WHERE total > 100", employee))
					.isEqualTo("SELECT id FROM orders WHERE status = 'open' AND orders.employee_id = 8"
							+ " UNION SELECT id FROM orders WHERE total > 100 AND orders.employee_id = 8");
		}
	}

	@Nested
	@DisplayName("Repeated tables and subqueries")
	class OccurrenceTests {

		@Test
		@DisplayName("Should filter both sides of a self-join")
		void shouldFilterSelfJoin() {
			assertThat(rewriter.applyRowFilter("SELECT b.id FROM orders a CROSS JOIN orders b", employee))
					.isEqualTo("SELECT b.id FROM orders a CROSS JOIN orders b WHERE a.employee_id = 8 AND b.employee_id = 8");
		}

		@Test
		@DisplayName("Should filter a table listed twice in FROM")
		void shouldFilterRepeatedTable() {
			assertThat(rewriter.applyRowFilter("SELECT o2.id FROM orders, orders o2", employee))
					.isEqualTo("SELECT o2.id FROM orders, orders o2 WHERE orders.employee_id = 8 AND o2.employee_id = 8");
		}

		@Test
		@DisplayName("Should add only the occurrence whose filter is missing")
		void shouldAddMissingOccurrenceOnly() {
			assertThat(rewriter.applyRowFilter(
					"SELECT b.id FROM orders a JOIN orders b ON a.id = b.id WHERE a.employee_id = 8", employee))
					.isEqualTo("SELECT b.id FROM orders a JOIN orders b ON a.id = b.id"
							+ " WHERE a.employee_id = 8 AND b.employee_id = 8");
		}

		@Test
		@DisplayName("Should not accept the unqualified filter for a table read twice")
		void shouldRejectAmbiguousUnqualifiedFilter() {
			assertThat(rewriter.applyRowFilter("SELECT b.id FROM orders a, orders b WHERE employee_id = 8", employee))
					.isEqualTo("SELECT b.id FROM orders a, orders b WHERE employee_id = 8"
							+ " AND a.employee_id = 8 AND b.employee_id = 8");
		}

		@Test
		@DisplayName("Should filter a scalar subquery as well as the outer query")
		void shouldFilterScalarSubquery() {
			assertThat(rewriter.applyRowFilter(
					"SELECT id, (SELECT SUM(o2.total) FROM orders o2) AS s FROM orders ORDER BY id", employee))
					.isEqualTo("SELECT id, (SELECT SUM(o2.total) FROM orders o2 WHERE o2.employee_id = 8) AS s"
							+ " FROM orders WHERE orders.employee_id = 8 ORDER BY id");
		}

		@Test
		@DisplayName("Should filter inside a derived table")
		void shouldFilterDerivedTable() {
			assertThat(rewriter.applyRowFilter("SELECT x.id FROM (SELECT id FROM orders) x", employee))
					.isEqualTo("SELECT x.id FROM (SELECT id FROM orders WHERE orders.employee_id = 8) x");
		}

		@Test
		@DisplayName("Should filter inside a common table expression")
		void shouldFilterCommonTableExpression() {
			assertThat(rewriter.applyRowFilter("WITH mine AS (SELECT id FROM orders) SELECT id FROM mine", employee))
					.isEqualTo("WITH mine AS (SELECT id FROM orders WHERE orders.employee_id = 8) SELECT id FROM mine");
		}

		@Test
		@DisplayName("Should filter a subquery in the WHERE condition")
		void shouldFilterConditionSubquery() {
			assertThat(rewriter.applyRowFilter(
					"SELECT name FROM customers WHERE id IN (SELECT customer_id FROM orders)", employee))
					.isEqualTo("SELECT name FROM customers WHERE id IN"
							+ " (SELECT customer_id FROM orders WHERE orders.employee_id = 8)");
		}

		@Test
		@DisplayName("Should fail closed on a statement that never reads the table")
		void shouldFailClosedWithoutTable() {
			assertThat(rewriter.applyRowFilter("SELECT name FROM customers", employee))
					.isEqualTo("SELECT name FROM customers WHERE orders.employee_id = 8");
		}
	}

	@Nested
	@DisplayName("Idempotence")
	class IdempotenceTests {

		@ParameterizedTest
		@ValueSource(strings = {
				"SELECT id FROM orders",
				"SELECT id FROM orders WHERE total > 100",
				"SELECT id FROM orders WHERE status = 'open' OR total > 100",
				"SELECT o.id FROM orders o ORDER BY o.total",
				"SELECT id FROM orders UNION SELECT id FROM orders WHERE total > 1",
				"SELECT b.id FROM orders a CROSS JOIN orders b",
				"SELECT o2.id FROM orders, orders o2 WHERE o2.total > 1",
				"SELECT id, (SELECT MAX(o2.total) FROM orders o2) AS best FROM orders",
				"SELECT x.id FROM (SELECT id FROM orders) x"
		})
		@DisplayName("Should leave its own output unchanged")
		void shouldBeIdempotent(String sql) {
			String once = rewriter.applyRowFilter(sql, employee);
			assertThat(rewriter.applyRowFilter(once, employee)).isEqualTo(once);
		}

		@Test
		@DisplayName("Should recognise an unqualified copy of the filter")
		void shouldRecognizeUnqualifiedFilter() {
			String sql = "SELECT id FROM orders WHERE employee_id = 8";
			assertThat(rewriter.applyRowFilter(sql, employee)).isSameAs(sql);
		}

		@Test
		@DisplayName("Should not be fooled by the filter text inside a string literal")
		void shouldIgnoreFilterInsideLiteral() {
			assertThat(rewriter.applyRowFilter("SELECT id FROM orders WHERE status = 'orders.employee_id = 8'", employee))
					.isEqualTo("SELECT id FROM orders WHERE status = 'orders.employee_id = 8' AND orders.employee_id = 8");
		}

		@Test
		@DisplayName("Should not treat a different caller's filter as present")
		void shouldNotMatchOtherSubject() {
			assertThat(rewriter.applyRowFilter("SELECT id FROM orders WHERE orders.employee_id = 7", employee))
					.isEqualTo("SELECT id FROM orders WHERE orders.employee_id = 7 AND orders.employee_id = 8");
		}

		@Test
		@DisplayName("Should not be fooled by the filter text inside a dollar-quoted literal")
		void shouldIgnoreFilterInsideDollarQuotes() {
			assertThat(rewriter.applyRowFilter("SELECT id FROM orders WHERE status = $$orders.employee_id = 8$$", employee))
					.isEqualTo("SELECT id FROM orders WHERE status = $$orders.employee_id = 8$$ AND orders.employee_id = 8");
		}
	}

	@Nested
	@DisplayName("Caller handling")
	class CallerTests {

		@Test
		@DisplayName("Should return the statement unchanged for a role without a filter")
		void shouldSkipUnfilteredRole() {
			String sql = "SELECT id FROM orders";
			assertThat(rewriter.applyRowFilter(sql, Fixtures.admin())).isSameAs(sql);
		}

		@Test
		@DisplayName("Should quote a textual subject id")
		void shouldQuoteTextualId() {
			Identity customer = Identity.of("customer", "C-17", "Carla");
			String once = rewriter.applyRowFilter("SELECT id, total FROM orders", customer);
			assertThat(once).isEqualTo("SELECT id, total FROM orders WHERE orders.customer_id = 'C-17'");
			assertThat(rewriter.applyRowFilter(once, customer)).isEqualTo(once);
		}

		@Test
		@DisplayName("Should escape quotes in a textual subject id")
		void shouldEscapeQuotes() {
			Identity customer = Identity.of("customer", "o'brien", null);
			assertThat(rewriter.applyRowFilter("SELECT id FROM orders", customer))
					.isEqualTo("SELECT id FROM orders WHERE orders.customer_id = 'o''brien'");
		}

		@Test
		@DisplayName("Should refuse a filtered role without a subject id")
		void shouldRefuseMissingSubject() {
			assertThatThrownBy(() -> rewriter.applyRowFilter("SELECT id FROM orders", Identity.of("employee", null, null)))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("subject id");
		}
	}
}
