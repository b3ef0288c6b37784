package org.javai.sqlguard.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.javai.sqlguard.identity.Identity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Row Filter Template Tests")
class RowFilterTemplateTest {

	@Nested
	@DisplayName("Parsing")
	class ParseTests {

		@Test
		@DisplayName("Should parse a qualified template")
		void shouldParseQualified() {
			RowFilterTemplate template = RowFilterTemplate.parse("Orders.Employee_ID = {user_id}");
			assertThat(template.table()).isEqualTo("orders");
			assertThat(template.column()).isEqualTo("employee_id");
		}

		@Test
		@DisplayName("Should parse an unqualified template with a quoted placeholder")
		void shouldParseUnqualifiedQuoted() {
			RowFilterTemplate template = RowFilterTemplate.parse("customer_id = '{user_id}'");
			assertThat(template.table()).isEmpty();
			assertThat(template.column()).isEqualTo("customer_id");
		}

		@ParameterizedTest
		@ValueSource(strings = {
				"orders.employee_id = 8",
				"orders.employee_id > {user_id}",
				"orders.employee_id = {user_id} OR 1 = 1",
				"lower(name) = {user_id}"
		})
		@DisplayName("Should reject anything but a single equality on the placeholder")
		void shouldRejectMalformed(String raw) {
			assertThatThrownBy(() -> RowFilterTemplate.parse(raw)).isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Nested
	@DisplayName("Binding")
	class BindTests {

		private final RowFilterTemplate template = RowFilterTemplate.parse("orders.customer_id = {user_id}");

		@Test
		@DisplayName("Should leave an integer id bare")
		void shouldBindIntegerBare() {
			assertThat(template.bind(Identity.of("customer", 42, null)).render()).isEqualTo("orders.customer_id = 42");
		}

		@Test
		@DisplayName("Should quote a textual id")
		void shouldQuoteTextualId() {
			RowFilterPredicate predicate = template.bind(Identity.of("customer", "ALFKI", null));
			assertThat(predicate.render()).isEqualTo("orders.customer_id = 'ALFKI'");
			assertThat(predicate.unqualified()).isEqualTo("customer_id = 'ALFKI'");
		}

		@Test
		@DisplayName("Should quote an id with non-ASCII digits")
		void shouldQuoteNonAsciiDigits() {
			assertThat(template.bind(Identity.of("customer", "٤٢", null)).valueLiteral())
					.startsWith("'");
		}

		@Test
		@DisplayName("Should refuse an identity without a subject id")
		void shouldRefuseBlankSubject() {
			assertThatThrownBy(() -> template.bind(Identity.of("customer", " ", null)))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Test
	@DisplayName("Should parse every template of a policy eagerly")
	void shouldParsePolicyEagerly() {
		assertThatThrownBy(() -> RlsPolicy.of(Map.of("customer", "customer_id = 7")))
				.isInstanceOf(IllegalArgumentException.class);
		assertThat(RlsPolicy.of(Map.of("Customer", "customer_id = {user_id}")).templateFor("customer")).isPresent();
	}
}
