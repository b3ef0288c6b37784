package org.javai.sqlguard.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.javai.sqlguard.catalog.SchemaCatalog;
import org.javai.sqlguard.testsupport.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Statement Extractor Tests")
class StatementExtractorTest {

	private final SchemaCatalog catalog = Fixtures.catalog();
	private final StatementExtractor extractor = new StatementExtractor();

	private ExtractedReferences extract(String sql) {
		return extractor.extract(sql, catalog);
	}

	private static ColumnReference column(String table, String column) {
		return new ColumnReference(table, column);
	}

	@Nested
	@DisplayName("Tables")
	class TableTests {

		@Test
		@DisplayName("Should find tables in FROM and JOIN")
		void shouldFindJoinedTables() {
			ExtractedReferences refs = extract(
					"SELECT o.id, c.name FROM orders o JOIN customers c ON o.customer_id = c.id");
			assertThat(refs.tables()).containsExactly("orders", "customers");
		}

		@Test
		@DisplayName("Should find tables in a comma-separated FROM list")
		void shouldFindCommaSeparatedTables() {
			ExtractedReferences refs = extract("SELECT o.id FROM orders o, customers c WHERE o.customer_id = c.id");
			assertThat(refs.tables()).containsExactly("orders", "customers");
		}

		@Test
		@DisplayName("Should find tables inside subqueries")
		void shouldFindSubqueryTables() {
			ExtractedReferences refs = extract(
					"SELECT name FROM customers WHERE id IN (SELECT customer_id FROM orders)");
			assertThat(refs.tables()).containsExactlyInAnyOrder("customers", "orders");
		}

		@Test
		@DisplayName("Should report tables missing from the catalog")
		void shouldReportUnknownTables() {
			ExtractedReferences refs = extract("SELECT secret FROM payroll");
			assertThat(refs.tables()).containsExactly("payroll");
			assertThat(refs.columns()).isEmpty();
		}

		@Test
		@DisplayName("Should not treat EXTRACT(... FROM ...) as a table reference")
		void shouldIgnoreFromInsideFunctions() {
			ExtractedReferences refs = extract("SELECT EXTRACT(YEAR FROM status) FROM orders");
			assertThat(refs.tables()).containsExactly("orders");
			assertThat(refs.columns()).contains(ColumnReference.unqualified("status"));
		}

		@Test
		@DisplayName("Should not treat IS DISTINCT FROM as a table reference")
		void shouldIgnoreDistinctFrom() {
			ExtractedReferences refs = extract("SELECT id FROM orders WHERE status IS DISTINCT FROM total");
			assertThat(refs.tables()).containsExactly("orders");
		}

		@Test
		@DisplayName("Should record a table-valued function as a table")
		void shouldRecordTableFunctions() {
			ExtractedReferences refs = extract("SELECT * FROM generate_series(1, 3)");
			assertThat(refs.tables()).contains("generate_series");
		}
	}

	@Nested
	@DisplayName("Columns")
	class ColumnTests {

		@Test
		@DisplayName("Should resolve alias-qualified columns to their tables")
		void shouldResolveAliases() {
			ExtractedReferences refs = extract(
					"SELECT o.id, c.name FROM orders o JOIN customers c ON o.customer_id = c.id");
			assertThat(refs.columns()).containsExactlyInAnyOrder(
					column("orders", "id"),
					column("customers", "name"),
					column("orders", "customer_id"),
					column("customers", "id"));
		}

		@Test
		@DisplayName("Should record bare columns as unqualified")
		void shouldRecordBareColumns() {
			ExtractedReferences refs = extract("SELECT id, total FROM orders");
			assertThat(refs.columns()).containsExactly(
					ColumnReference.unqualified("id"), ColumnReference.unqualified("total"));
			assertThat(refs.unqualifiedColumns()).hasSize(2);
			assertThat(refs.qualifiedColumns()).isEmpty();
		}

		@Test
		@DisplayName("Should ignore COUNT(*) and function names")
		void shouldIgnoreFunctions() {
			ExtractedReferences refs = extract("SELECT COUNT(*), SUM(total) FROM orders");
			assertThat(refs.columns()).containsExactly(ColumnReference.unqualified("total"));
		}

		@Test
		@DisplayName("Should ignore output labels and cast types")
		void shouldIgnoreLabelsAndTypes() {
			ExtractedReferences refs = extract("SELECT total::text AS id FROM orders");
			assertThat(refs.columns()).containsExactly(ColumnReference.unqualified("total"));
		}

		@Test
		@DisplayName("Should degrade a column of a derived table to an unqualified reference")
		void shouldDegradeDerivedAliasColumns() {
			ExtractedReferences refs = extract("SELECT t.total FROM (SELECT total FROM orders) t");
			assertThat(refs.tables()).containsExactly("orders");
			assertThat(refs.columns()).containsExactly(ColumnReference.unqualified("total"));
		}

		@Test
		@DisplayName("Should keep a column the qualifying table lacks as unqualified")
		void shouldKeepMisqualifiedColumns() {
			ExtractedReferences refs = extract("SELECT orders.email FROM orders");
			assertThat(refs.columns()).containsExactly(ColumnReference.unqualified("email"));
		}
	}

	@Nested
	@DisplayName("Wildcards")
	class WildcardTests {

		@Test
		@DisplayName("Should expand a bare star to every column of the table")
		void shouldExpandBareStar() {
			ExtractedReferences refs = extract("SELECT * FROM customers");
			assertThat(refs.columns()).containsExactly(
					column("customers", "id"),
					column("customers", "name"),
					column("customers", "email"),
					column("customers", "region"));
		}

		@Test
		@DisplayName("Should expand a qualified star only over its table")
		void shouldExpandQualifiedStar() {
			ExtractedReferences refs = extract(
					"SELECT c.* FROM customers c JOIN orders o ON o.customer_id = c.id");
			assertThat(refs.columns())
					.contains(column("customers", "email"))
					.doesNotContain(column("orders", "total"), column("orders", "status"));
		}

		@Test
		@DisplayName("Should treat a star after an operand as multiplication")
		void shouldTreatStarAsMultiplication() {
			ExtractedReferences refs = extract("SELECT total * 2 FROM orders");
			assertThat(refs.columns()).containsExactly(ColumnReference.unqualified("total"));
		}
	}

	@Nested
	@DisplayName("Literals")
	class LiteralTests {

		@Test
		@DisplayName("Should see columns between dollar-quoted literals")
		void shouldSeeColumnsBetweenDollarQuotes() {
			ExtractedReferences refs = extract("SELECT id, $$'$$ AS a, employee_id, customer_id, $$'$$ AS b FROM orders");
			assertThat(refs.columns()).contains(
					ColumnReference.unqualified("id"),
					ColumnReference.unqualified("employee_id"),
					ColumnReference.unqualified("customer_id"));
		}

		@Test
		@DisplayName("Should see columns between tagged dollar quotes")
		void shouldSeeColumnsBetweenTaggedDollarQuotes() {
			ExtractedReferences refs = extract("SELECT $q$ $$ $q$, email FROM customers");
			assertThat(refs.columns()).contains(ColumnReference.unqualified("email"));
		}

		@Test
		@DisplayName("Should see columns between escape strings")
		void shouldSeeColumnsBetweenEscapeStrings() {
			ExtractedReferences refs = extract("SELECT name, E'\\'', email, E'\\'' FROM customers");
			assertThat(refs.columns()).contains(
					ColumnReference.unqualified("name"),
					ColumnReference.unqualified("email"));
		}

		@Test
		@DisplayName("Should not read names inside a dollar-quoted literal")
		void shouldIgnoreDollarQuotedText() {
			ExtractedReferences refs = extract("SELECT id FROM orders WHERE status = $$ salary $$");
			assertThat(refs.columns()).contains(
					ColumnReference.unqualified("id"),
					ColumnReference.unqualified("status"));
			assertThat(refs.columns()).doesNotContain(ColumnReference.unqualified("salary"));
		}
	}

	@Nested
	@DisplayName("Parse tree")
	class ParseTreeTests {

		@Test
		@DisplayName("Should resolve aliases of a table named twice")
		void shouldResolveRepeatedTableAliases() {
			ExtractedReferences refs = extract("SELECT a.id, b.employee_id FROM orders a CROSS JOIN orders b");
			assertThat(refs.tables()).containsExactly("orders");
			assertThat(refs.columns()).contains(
					new ColumnReference("orders", "id"),
					new ColumnReference("orders", "employee_id"));
		}

		@Test
		@DisplayName("Should record columns of CASE and subquery expressions")
		void shouldRecordNestedColumns() {
			ExtractedReferences refs = extract("SELECT CASE WHEN total > 1 THEN (SELECT MAX(salary) FROM employees) END"
					+ " FROM orders");
			assertThat(refs.tables()).containsExactlyInAnyOrder("orders", "employees");
			assertThat(refs.columns()).contains(
					ColumnReference.unqualified("total"),
					ColumnReference.unqualified("salary"));
		}
	}

	@Test
	@DisplayName("Should propagate tokenizer failures")
	void shouldPropagateTokenizerFailures() {
		assertThatThrownBy(() -> extract("SELECT 'unterminated FROM orders"))
				.isInstanceOf(StatementParseException.class);
	}
}
