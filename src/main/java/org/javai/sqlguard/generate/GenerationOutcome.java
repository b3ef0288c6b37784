package org.javai.sqlguard.generate;

/**
 * What the generator produced for a question. Only {@link Sql} enters the authorization pipeline.
 */
public sealed interface GenerationOutcome {

	/**
	 * @param sql the candidate statement; untrusted until authorized
	 */
	record Sql(String sql) implements GenerationOutcome {
	}

	/**
	 * @param question what the model needs to know before it can answer
	 */
	record Clarification(String question) implements GenerationOutcome {
	}

	/**
	 * @param message user-facing explanation of why the model declined
	 */
	record Refusal(String message) implements GenerationOutcome {
	}
}
