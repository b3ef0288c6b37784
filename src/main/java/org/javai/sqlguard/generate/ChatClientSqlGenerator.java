package org.javai.sqlguard.generate;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link SqlGenerator} backed by a Spring AI {@link ChatClient}. Model and temperature are the
 * client's default options.
 */
public class ChatClientSqlGenerator implements SqlGenerator {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientSqlGenerator.class);

	private final ChatClient chatClient;
	private final GenerationPromptBuilder promptBuilder;
	private final SqlResponseExtractor responseExtractor;

	public ChatClientSqlGenerator(ChatClient chatClient) {
		this(chatClient, new GenerationPromptBuilder(), new SqlResponseExtractor());
	}

	public ChatClientSqlGenerator(ChatClient chatClient, GenerationPromptBuilder promptBuilder,
			SqlResponseExtractor responseExtractor) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.promptBuilder = promptBuilder;
		this.responseExtractor = responseExtractor;
	}

	@Override
	public GenerationOutcome generate(GenerationRequest request) {
		String system = promptBuilder.systemPrompt(request);
		String user = promptBuilder.userPrompt(request);
		logger.debug("System prompt:\n{}", system);
		logger.debug("User message:\n{}", user);

		String content;
		try {
			ChatClient.ChatClientRequestSpec prompt = chatClient.prompt();
			prompt.system(system);
			prompt.user(user);
			content = prompt.call().content();
		}
		catch (RuntimeException e) {
			throw new SqlGenerationException("Model invocation failed: " + e.getMessage(), e);
		}
		logger.info("Model response for {}:\n{}", request.identity().describe(), content);
		return responseExtractor.extract(content);
	}
}
