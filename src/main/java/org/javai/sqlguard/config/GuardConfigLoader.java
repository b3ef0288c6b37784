package org.javai.sqlguard.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.javai.sqlguard.policy.RbacPolicy;
import org.javai.sqlguard.policy.RlsPolicy;
import org.javai.sqlguard.policy.SensitiveColumns;
import org.javai.sqlguard.screen.InjectionScreener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads a {@link GuardConfig} from YAML.
 *
 * <p>String values may reference environment variables as {@code ${NAME}} or
 * {@code ${NAME:default}}. A variable without a default that is not set is a configuration
 * error. Every policy is validated while loading: malformed row filter templates and
 * injection patterns that do not compile are rejected here rather than at request time.</p>
 *
 * <pre>{@code
 * database:
 *   url: ${DATABASE_URL}
 *   query-timeout-seconds: 30
 * rbac:
 *   customer:
 *     orders: [order_id, customer_id, order_date]
 * rls:
 *   customer: "orders.customer_id = {user_id}"
 * }</pre>
 */
public class GuardConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(GuardConfigLoader.class);

	public static final String DEFAULT_RESOURCE = "sqlguard.yaml";

	private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::([^}]*))?}");

	private final Yaml yaml = new Yaml();
	private final Function<String, String> environment;

	public GuardConfigLoader() {
		this(System::getenv);
	}

	/**
	 * @param environment lookup used to resolve {@code ${...}} placeholders
	 */
	public GuardConfigLoader(Function<String, String> environment) {
		this.environment = environment;
	}

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath.
	 */
	public GuardConfig loadDefault() {
		InputStream stream = GuardConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
		if (stream == null) {
			throw new GuardConfigException("Config resource not found on classpath: " + DEFAULT_RESOURCE);
		}
		try (stream) {
			return load(stream);
		}
		catch (java.io.IOException e) {
			throw new GuardConfigException("Failed to read config resource " + DEFAULT_RESOURCE, e);
		}
	}

	public GuardConfig load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return load(reader);
		}
		catch (GuardConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new GuardConfigException("Failed to load config from path: " + path, e);
		}
	}

	public GuardConfig load(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildConfig(data);
		}
		catch (GuardConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new GuardConfigException("Failed to load config from input stream", e);
		}
	}

	public GuardConfig load(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildConfig(data);
		}
		catch (GuardConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new GuardConfigException("Failed to load config from reader", e);
		}
	}

	public GuardConfig loadString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildConfig(data);
		}
		catch (GuardConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new GuardConfigException("Failed to load config from string", e);
		}
	}

	private GuardConfig buildConfig(Map<String, Object> data) {
		if (data == null) {
			throw new GuardConfigException("Config is empty");
		}
		Map<String, Object> rbacSection = section(data, "rbac");
		if (rbacSection.isEmpty()) {
			logger.warn("Config has no rbac rules; every role will be denied");
		}

		GuardConfig config = GuardConfig.builder()
				.database(buildDatabase(section(data, "database")))
				.rbac(buildRbac(rbacSection))
				.rls(buildRls(section(data, "rls")))
				.injectionPatterns(buildInjectionPatterns(data.get("injection-patterns")))
				.sensitiveColumns(SensitiveColumns.of(tableColumns(section(data, "sensitive-columns"), "sensitive-columns")))
				.unqualifiedColumns(UnqualifiedColumnPolicy.fromConfig(string(data.get("unqualified-columns"))))
				.generator(buildGenerator(section(data, "generator")))
				.build();
		logger.debug("Configuration loaded: roles={}, rls={}, patterns={}, database={}",
				config.rbac().roles(), config.rls().templates().keySet(), config.injectionPatterns().size(), config.database());
		return config;
	}

	private DatabaseSettings buildDatabase(Map<String, Object> db) {
		if (db.isEmpty()) {
			return null;
		}
		String url = string(db.get("url"));
		if (url == null || url.isBlank()) {
			throw new GuardConfigException("database.url is missing");
		}
		Integer timeoutSeconds = integer(db.get("query-timeout-seconds"), "database.query-timeout-seconds");
		Integer poolSize = integer(db.get("pool-size"), "database.pool-size");
		return new DatabaseSettings(
				url,
				string(db.get("username")),
				string(db.get("password")),
				string(db.get("schema")),
				poolSize != null ? poolSize : DatabaseSettings.DEFAULT_POOL_SIZE,
				timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : DatabaseSettings.DEFAULT_QUERY_TIMEOUT);
	}

	private RbacPolicy buildRbac(Map<String, Object> rbac) {
		Map<String, Map<String, List<String>>> rules = new LinkedHashMap<>();
		rbac.forEach((role, tables) -> {
			if (!(tables instanceof Map<?, ?> tableMap)) {
				throw new GuardConfigException("rbac." + role + " must map tables to column lists");
			}
			rules.put(role, tableColumns(asStringMap(tableMap), "rbac." + role));
		});
		return RbacPolicy.of(rules);
	}

	private RlsPolicy buildRls(Map<String, Object> rls) {
		Map<String, String> templates = new LinkedHashMap<>();
		rls.forEach((role, template) -> templates.put(role, string(template)));
		try {
			return RlsPolicy.of(templates);
		}
		catch (IllegalArgumentException e) {
			throw new GuardConfigException("Invalid rls rule: " + e.getMessage(), e);
		}
	}

	private List<String> buildInjectionPatterns(Object raw) {
		if (raw == null) {
			return InjectionScreener.DEFAULT_PATTERNS;
		}
		List<String> patterns = stringList(raw, "injection-patterns");
		for (String pattern : patterns) {
			try {
				Pattern.compile(pattern);
			}
			catch (PatternSyntaxException e) {
				throw new GuardConfigException("Invalid injection pattern '" + pattern + "': " + e.getDescription(), e);
			}
		}
		return patterns;
	}

	private GeneratorSettings buildGenerator(Map<String, Object> generator) {
		if (generator.isEmpty()) {
			return GeneratorSettings.defaults();
		}
		Object temperature = generator.get("temperature");
		double temp;
		if (temperature == null) {
			temp = 0.0;
		}
		else if (temperature instanceof Number n) {
			temp = n.doubleValue();
		}
		else {
			try {
				temp = Double.parseDouble(string(temperature));
			}
			catch (NumberFormatException e) {
				throw new GuardConfigException("generator.temperature must be a number: " + temperature, e);
			}
		}
		return new GeneratorSettings(
				string(generator.get("provider")),
				string(generator.get("model")),
				temp,
				string(generator.get("api-key")),
				string(generator.get("base-url")));
	}

	private Map<String, List<String>> tableColumns(Map<String, Object> tables, String path) {
		Map<String, List<String>> result = new LinkedHashMap<>();
		tables.forEach((table, columns) -> result.put(table, stringList(columns, path + "." + table)));
		return result;
	}

	private Map<String, Object> section(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?> map)) {
			throw new GuardConfigException("'" + key + "' must be a mapping");
		}
		return asStringMap(map);
	}

	private Map<String, Object> asStringMap(Map<?, ?> map) {
		Map<String, Object> result = new LinkedHashMap<>();
		map.forEach((k, v) -> result.put(String.valueOf(k), v));
		return result;
	}

	private List<String> stringList(Object raw, String path) {
		if (raw == null) {
			return List.of();
		}
		if (!(raw instanceof List<?> list)) {
			throw new GuardConfigException("'" + path + "' must be a list");
		}
		List<String> result = new ArrayList<>();
		for (Object item : list) {
			if (item != null) {
				result.add(string(item));
			}
		}
		return result;
	}

	private Integer integer(Object raw, String path) {
		if (raw == null) {
			return null;
		}
		if (raw instanceof Number n) {
			return n.intValue();
		}
		try {
			return Integer.parseInt(string(raw).trim());
		}
		catch (NumberFormatException e) {
			throw new GuardConfigException("'" + path + "' must be an integer: " + raw, e);
		}
	}

	private String string(Object raw) {
		if (raw == null) {
			return null;
		}
		return resolvePlaceholders(String.valueOf(raw));
	}

	String resolvePlaceholders(String value) {
		Matcher matcher = PLACEHOLDER.matcher(value);
		StringBuilder sb = new StringBuilder();
		while (matcher.find()) {
			String name = matcher.group(1);
			String fallback = matcher.group(2);
			String resolved = environment.apply(name);
			if (resolved == null) {
				if (fallback == null) {
					throw new GuardConfigException("Environment variable " + name + " is not set");
				}
				resolved = fallback;
			}
			matcher.appendReplacement(sb, Matcher.quoteReplacement(resolved));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}
}
