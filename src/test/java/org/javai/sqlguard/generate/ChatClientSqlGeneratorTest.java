package org.javai.sqlguard.generate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.javai.sqlguard.testsupport.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.chat.client.ChatClient;

@DisplayName("ChatClient SQL Generator Tests")
class ChatClientSqlGeneratorTest {

	private ChatClient chatClient;
	private ChatClientSqlGenerator generator;

	@BeforeEach
	void setUp() {
		chatClient = Mockito.mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
		generator = new ChatClientSqlGenerator(chatClient);
	}

	private GenerationRequest request() {
		return new GenerationRequest("total of my orders", Fixtures.customer(),
				Fixtures.rbac().filter("customer", Fixtures.catalog()), null);
	}

	@Test
	@DisplayName("Should return the SQL the model produced")
	void shouldReturnSql() {
		when(chatClient.prompt().call().content()).thenReturn("```sql\nSELECT SUM(total) FROM orders\n```");

		assertThat(generator.generate(request())).isEqualTo(new GenerationOutcome.Sql("SELECT SUM(total) FROM orders"));
	}

	@Test
	@DisplayName("Should send the schema as system message and the question as user message")
	void shouldSendPrompts() {
		when(chatClient.prompt().call().content()).thenReturn("SELECT id FROM orders");

		generator.generate(request());

		ChatClient.ChatClientRequestSpec prompt = chatClient.prompt();
		verify(prompt).system(argThat((String text) -> text.contains("- orders: id, total")));
		verify(prompt).user("User request: total of my orders");
	}

	@Test
	@DisplayName("Should pass refusals through")
	void shouldPassRefusals() {
		when(chatClient.prompt().call().content()).thenReturn("Access Denied.");

		assertThat(generator.generate(request())).isInstanceOf(GenerationOutcome.Refusal.class);
	}

	@Test
	@DisplayName("Should wrap a failing model call")
	void shouldWrapModelFailure() {
		when(chatClient.prompt().call()).thenThrow(new IllegalStateException("quota exceeded"));

		assertThatThrownBy(() -> generator.generate(request()))
				.isInstanceOf(SqlGenerationException.class)
				.hasMessageContaining("quota exceeded")
				.hasCauseInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("Should report an empty model response")
	void shouldReportEmptyResponse() {
		when(chatClient.prompt().call().content()).thenReturn(null);

		assertThatThrownBy(() -> generator.generate(request())).isInstanceOf(SqlGenerationException.class);
	}
}
