package org.javai.sqlguard.generate;

/**
 * Turns a question into a candidate statement. Implementations talk to a language model; the
 * guard treats every statement they return as untrusted.
 */
public interface SqlGenerator {

	/**
	 * @throws SqlGenerationException if the model fails or returns nothing usable
	 */
	GenerationOutcome generate(GenerationRequest request);
}
