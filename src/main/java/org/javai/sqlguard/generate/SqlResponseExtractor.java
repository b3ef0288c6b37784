package org.javai.sqlguard.generate;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interprets raw model output.
 *
 * <p>Reasoning blocks ({@code <think>...</think>}) are dropped first. A fenced {@code ```sql}
 * block wins, then the first {@code SELECT} to the end of the text. Without SQL, the text is
 * read as a refusal or a clarification request. Anything else is an error.</p>
 */
public class SqlResponseExtractor {

	private static final Logger logger = LoggerFactory.getLogger(SqlResponseExtractor.class);

	private static final Pattern THINK_BLOCK = Pattern.compile("<think>.*?</think>", Pattern.DOTALL);
	private static final Pattern SQL_BLOCK = Pattern.compile("```sql(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
	private static final Pattern BARE_SELECT = Pattern.compile("\\bSELECT\\b\\s+.*", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
	private static final Pattern CLARIFY_PREFIX = Pattern.compile("CLARIFY:", Pattern.CASE_INSENSITIVE);

	private static final List<String> VAGUE_PHRASES = List.of(
			"please provide more details", "could you clarify", "what do you mean", "can you specify",
			"your request is not clear");

	static final String ACCESS_DENIED_MESSAGE = "You do not have permission to perform this operation.";
	static final String OFF_TOPIC_MESSAGE = "I will only answer questions about the database I'm connected to.";
	static final String NOT_AUTHORIZED_MESSAGE = "Your role does not allow this action.";
	static final String GENERIC_CLARIFICATION = "I need more details to generate a useful query. Can you specify?";

	/**
	 * @throws SqlGenerationException if the text holds no SQL, refusal or clarification
	 */
	public GenerationOutcome extract(String response) {
		if (response == null || response.isBlank()) {
			throw new SqlGenerationException("Model returned an empty response");
		}
		String text = THINK_BLOCK.matcher(response).replaceAll("").trim();

		Matcher block = SQL_BLOCK.matcher(text);
		if (block.find()) {
			String sql = block.group(1).trim();
			logger.debug("SQL extracted from fenced block");
			return new GenerationOutcome.Sql(sql);
		}
		Matcher select = BARE_SELECT.matcher(text);
		if (select.find()) {
			String sql = stripClosingFence(select.group().trim());
			logger.debug("Direct SQL response detected");
			return new GenerationOutcome.Sql(sql);
		}

		String lower = text.toLowerCase(Locale.ROOT);
		if (lower.contains("access denied")) {
			logger.warn("Model response indicates access is denied");
			return new GenerationOutcome.Refusal(ACCESS_DENIED_MESSAGE);
		}
		if (lower.contains("i don't know")) {
			logger.warn("Model declined a question unrelated to the database");
			return new GenerationOutcome.Refusal(OFF_TOPIC_MESSAGE);
		}
		if (lower.contains("not authorized")) {
			logger.warn("Model response indicates an authorization issue");
			return new GenerationOutcome.Refusal(NOT_AUTHORIZED_MESSAGE);
		}
		if (lower.contains("clarify:")) {
			String question = CLARIFY_PREFIX.matcher(text).replaceAll("").trim();
			return new GenerationOutcome.Clarification(question.isEmpty() ? GENERIC_CLARIFICATION : question);
		}
		if (VAGUE_PHRASES.stream().anyMatch(lower::contains)) {
			return new GenerationOutcome.Clarification(GENERIC_CLARIFICATION);
		}
		logger.error("No valid SQL query found in model response: {}", abbreviate(text));
		throw new SqlGenerationException("No valid SQL query found in model response");
	}

	private static String stripClosingFence(String sql) {
		int fence = sql.indexOf("```");
		return fence >= 0 ? sql.substring(0, fence).trim() : sql;
	}

	private static String abbreviate(String text) {
		return text.length() <= 200 ? text : text.substring(0, 200) + "...";
	}
}
