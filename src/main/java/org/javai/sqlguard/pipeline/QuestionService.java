package org.javai.sqlguard.pipeline;

import org.javai.sqlguard.catalog.SchemaCatalog;
import org.javai.sqlguard.exec.CancellationToken;
import org.javai.sqlguard.generate.GenerationOutcome;
import org.javai.sqlguard.generate.GenerationRequest;
import org.javai.sqlguard.generate.SqlGenerationException;
import org.javai.sqlguard.generate.SqlGenerator;
import org.javai.sqlguard.identity.Identity;
import org.javai.sqlguard.policy.RbacPolicy;
import org.javai.sqlguard.policy.RlsPolicy;
import org.javai.sqlguard.policy.RowFilterPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers a natural-language question: generate a statement, then run it through the
 * {@link GuardedQueryPipeline}. Clarifications and refusals from the model are returned as they
 * are and never touch the database.
 */
public class QuestionService {

	private static final Logger logger = LoggerFactory.getLogger(QuestionService.class);

	private final SchemaCatalog catalog;
	private final RbacPolicy rbac;
	private final RlsPolicy rls;
	private final SqlGenerator generator;
	private final GuardedQueryPipeline pipeline;

	public QuestionService(SchemaCatalog catalog, RbacPolicy rbac, RlsPolicy rls, SqlGenerator generator,
			GuardedQueryPipeline pipeline) {
		this.catalog = catalog;
		this.rbac = rbac;
		this.rls = rls;
		this.generator = generator;
		this.pipeline = pipeline;
	}

	public PipelineResult ask(String question, Identity identity) {
		return ask(question, identity, CancellationToken.create());
	}

	public PipelineResult ask(String question, Identity identity, CancellationToken cancellation) {
		if (identity == null || !identity.hasSubjectId()) {
			logger.warn("Rejected question from caller without a subject id");
			return new PipelineResult.Rejected("Caller identity has no subject id");
		}
		if (question == null || question.isBlank()) {
			return new PipelineResult.Rejected("Question is empty");
		}

		SchemaCatalog visibleSchema = rbac.filter(identity.role(), catalog);
		RowFilterPredicate rowFilter = rls.templateFor(identity.role())
				.map(template -> template.bind(identity))
				.orElse(null);

		GenerationOutcome outcome;
		try {
			outcome = generator.generate(new GenerationRequest(question, identity, visibleSchema, rowFilter));
		}
		catch (SqlGenerationException e) {
			logger.error("SQL generation failed for {}: {}", identity.describe(), e.getMessage(), e);
			return new PipelineResult.Failed(PipelineResult.FailureKind.GENERATION_ERROR, e.getMessage());
		}

		if (outcome instanceof GenerationOutcome.Clarification clarification) {
			return new PipelineResult.ClarificationNeeded(clarification.question());
		}
		if (outcome instanceof GenerationOutcome.Refusal refusal) {
			return new PipelineResult.Refused(refusal.message());
		}
		GenerationOutcome.Sql sql = (GenerationOutcome.Sql) outcome;
		logger.info("Generated statement for {}: {}", identity.describe(), sql.sql());
		return pipeline.processCandidate(sql.sql(), identity, question, cancellation);
	}
}
