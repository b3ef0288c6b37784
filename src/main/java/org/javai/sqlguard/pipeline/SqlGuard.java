package org.javai.sqlguard.pipeline;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import java.time.Duration;
import javax.sql.DataSource;
import org.javai.sqlguard.audit.AuditTrail;
import org.javai.sqlguard.audit.LoggingAuditSink;
import org.javai.sqlguard.audit.SensitiveAccessAuditor;
import org.javai.sqlguard.authz.AuthorizationValidator;
import org.javai.sqlguard.catalog.JdbcSchemaCatalogLoader;
import org.javai.sqlguard.catalog.SchemaCatalog;
import org.javai.sqlguard.catalog.SchemaUnavailableException;
import org.javai.sqlguard.config.DatabaseSettings;
import org.javai.sqlguard.config.GeneratorSettings;
import org.javai.sqlguard.config.GuardConfig;
import org.javai.sqlguard.config.GuardConfigException;
import org.javai.sqlguard.exec.CancellationToken;
import org.javai.sqlguard.exec.QueryExecutor;
import org.javai.sqlguard.generate.ChatClientSqlGenerator;
import org.javai.sqlguard.generate.SqlGenerator;
import org.javai.sqlguard.identity.Identity;
import org.javai.sqlguard.rls.RowFilterRewriter;
import org.javai.sqlguard.sql.StatementExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;

/**
 * Wires a ready-to-serve guard from a {@link GuardConfig}.
 *
 * <p>Startup loads the schema catalog once; if the database cannot be reached, whether while
 * opening the pool or while reading the catalog, startup fails with
 * {@link SchemaUnavailableException} and nothing is served.
 * The catalog, policies and every component are immutable afterwards and shared by all
 * requests. Closing the guard closes the connection pool it created.</p>
 *
 * <pre>{@code
 * try (SqlGuard guard = SqlGuard.start(new GuardConfigLoader().loadDefault())) {
 *     PipelineResult result = guard.ask("How many orders did I ship last month?", identity);
 * }
 * }</pre>
 */
public final class SqlGuard implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(SqlGuard.class);

	private final HikariDataSource ownedDataSource;
	private final SchemaCatalog catalog;
	private final AuthorizationValidator validator;
	private final RowFilterRewriter rewriter;
	private final GuardedQueryPipeline pipeline;
	private final QuestionService questionService;

	private SqlGuard(HikariDataSource ownedDataSource, SchemaCatalog catalog, AuthorizationValidator validator,
			RowFilterRewriter rewriter, GuardedQueryPipeline pipeline, QuestionService questionService) {
		this.ownedDataSource = ownedDataSource;
		this.catalog = catalog;
		this.validator = validator;
		this.rewriter = rewriter;
		this.pipeline = pipeline;
		this.questionService = questionService;
	}

	/**
	 * Creates a connection pool from {@code config.database()} and, when an API key is
	 * configured, an OpenAI-backed generator.
	 */
	public static SqlGuard start(GuardConfig config) {
		DatabaseSettings database = config.database();
		if (database == null) {
			throw new GuardConfigException("database settings are required to start the guard");
		}
		HikariDataSource dataSource = createPool(database);
		try {
			SqlGenerator generator = config.generator().hasApiKey() ? openAiGenerator(config.generator()) : null;
			return wire(config, dataSource, dataSource, generator);
		}
		catch (RuntimeException e) {
			dataSource.close();
			throw e;
		}
	}

	/**
	 * Starts against a caller-managed data source, which is not closed by {@link #close()}.
	 *
	 * @param generator the SQL generator, or null when only {@link #processCandidate} is used
	 */
	public static SqlGuard start(GuardConfig config, DataSource dataSource, SqlGenerator generator) {
		return wire(config, dataSource, null, generator);
	}

	private static SqlGuard wire(GuardConfig config, DataSource dataSource, HikariDataSource owned, SqlGenerator generator) {
		DatabaseSettings database = config.database();
		String schema = database != null ? database.schema() : null;
		Duration queryTimeout = database != null ? database.queryTimeout() : DatabaseSettings.DEFAULT_QUERY_TIMEOUT;

		SchemaCatalog catalog = new JdbcSchemaCatalogLoader(schema).load(dataSource);

		StatementExtractor extractor = new StatementExtractor();
		AuditTrail auditTrail = new AuditTrail(new LoggingAuditSink());
		AuthorizationValidator validator = new AuthorizationValidator(catalog, config);
		RowFilterRewriter rewriter = new RowFilterRewriter(config.rls());
		SensitiveAccessAuditor sensitiveAccessAuditor =
				new SensitiveAccessAuditor(catalog, config.sensitiveColumns(), extractor, auditTrail);
		QueryExecutor executor = new QueryExecutor(dataSource, queryTimeout);
		GuardedQueryPipeline pipeline =
				new GuardedQueryPipeline(validator, rewriter, sensitiveAccessAuditor, executor, auditTrail);
		QuestionService questionService = generator != null
				? new QuestionService(catalog, config.rbac(), config.rls(), generator, pipeline)
				: null;

		logger.info("SQL guard started: {} tables, roles={}, row-filtered roles={}, generator={}",
				catalog.tables().size(), config.rbac().roles(), config.rls().templates().keySet(),
				generator != null ? generator.getClass().getSimpleName() : "none");
		return new SqlGuard(owned, catalog, validator, rewriter, pipeline, questionService);
	}

	static HikariDataSource createPool(DatabaseSettings database) {
		HikariConfig hikari = new HikariConfig();
		hikari.setPoolName("sqlguard");
		hikari.setJdbcUrl(database.url());
		if (database.username() != null) {
			hikari.setUsername(database.username());
		}
		if (database.password() != null) {
			hikari.setPassword(database.password());
		}
		if (database.schema() != null && !database.schema().isBlank()) {
			hikari.setSchema(database.schema());
		}
		hikari.setMaximumPoolSize(database.poolSize());
		hikari.setReadOnly(true);
		try {
			return new HikariDataSource(hikari);
		}
		catch (HikariPool.PoolInitializationException e) {
			logger.error("Could not open a connection to {}: {}", database.url(), e.getMessage());
			throw new SchemaUnavailableException("Database unavailable at " + database.url(), e);
		}
		catch (RuntimeException e) {
			// driver lookup and URL errors surface as plain runtime exceptions
			logger.error("Could not create a connection pool for {}: {}", database.url(), e.getMessage());
			throw new SchemaUnavailableException("Cannot connect to " + database.url(), e);
		}
	}

	static SqlGenerator openAiGenerator(GeneratorSettings settings) {
		if (!"openai".equals(settings.provider())) {
			throw new GuardConfigException("Unsupported generator provider: " + settings.provider());
		}
		OpenAiApi.Builder api = OpenAiApi.builder().apiKey(settings.apiKey());
		if (settings.baseUrl() != null && !settings.baseUrl().isBlank()) {
			api.baseUrl(settings.baseUrl());
		}
		OpenAiChatModel chatModel = OpenAiChatModel.builder()
				.openAiApi(api.build())
				.build();
		OpenAiChatOptions options = OpenAiChatOptions.builder()
				.model(settings.model())
				.temperature(settings.temperature())
				.build();
		ChatClient client = ChatClient.builder(chatModel)
				.defaultOptions(options)
				.build();
		return new ChatClientSqlGenerator(client);
	}

	public PipelineResult processCandidate(String sql, Identity identity) {
		return pipeline.processCandidate(sql, identity);
	}

	public PipelineResult processCandidate(String sql, Identity identity, CancellationToken cancellation) {
		return pipeline.processCandidate(sql, identity, cancellation);
	}

	/**
	 * @throws IllegalStateException if the guard was started without a generator
	 */
	public PipelineResult ask(String question, Identity identity) {
		return requireQuestionService().ask(question, identity);
	}

	public PipelineResult ask(String question, Identity identity, CancellationToken cancellation) {
		return requireQuestionService().ask(question, identity, cancellation);
	}

	public SchemaCatalog catalog() {
		return catalog;
	}

	public AuthorizationValidator validator() {
		return validator;
	}

	public RowFilterRewriter rewriter() {
		return rewriter;
	}

	private QuestionService requireQuestionService() {
		if (questionService == null) {
			throw new IllegalStateException("No SQL generator configured; set generator.api-key");
		}
		return questionService;
	}

	@Override
	public void close() {
		if (ownedDataSource != null && !ownedDataSource.isClosed()) {
			ownedDataSource.close();
			logger.info("SQL guard connection pool closed");
		}
	}
}
