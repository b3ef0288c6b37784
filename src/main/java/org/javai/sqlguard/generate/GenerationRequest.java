package org.javai.sqlguard.generate;

import java.util.Objects;
import org.javai.sqlguard.catalog.SchemaCatalog;
import org.javai.sqlguard.identity.Identity;
import org.javai.sqlguard.policy.RowFilterPredicate;

/**
 * Everything a generator may see for one question.
 *
 * @param question the user's natural-language question
 * @param identity the caller
 * @param visibleSchema the catalog already restricted to the caller's role
 * @param rowFilter the caller's bound row filter, or null when the role is not row-filtered
 */
public record GenerationRequest(String question, Identity identity, SchemaCatalog visibleSchema,
		RowFilterPredicate rowFilter) {

	public GenerationRequest {
		Objects.requireNonNull(question, "question must not be null");
		Objects.requireNonNull(identity, "identity must not be null");
		Objects.requireNonNull(visibleSchema, "visibleSchema must not be null");
	}
}
