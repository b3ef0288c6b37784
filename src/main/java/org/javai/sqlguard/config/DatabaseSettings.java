package org.javai.sqlguard.config;

import java.time.Duration;

/**
 * Connection settings for the target database.
 *
 * @param url JDBC url
 * @param username user name, may be null
 * @param password password, may be null
 * @param schema schema to introspect; null means the connection's current schema
 * @param poolSize maximum number of pooled connections
 * @param queryTimeout per-statement execution timeout
 */
public record DatabaseSettings(
		String url,
		String username,
		String password,
		String schema,
		int poolSize,
		Duration queryTimeout
) {

	public static final int DEFAULT_POOL_SIZE = 8;
	public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);

	public DatabaseSettings {
		poolSize = poolSize > 0 ? poolSize : DEFAULT_POOL_SIZE;
		queryTimeout = queryTimeout != null && !queryTimeout.isNegative() && !queryTimeout.isZero()
				? queryTimeout
				: DEFAULT_QUERY_TIMEOUT;
	}

	public static DatabaseSettings of(String url) {
		return new DatabaseSettings(url, null, null, null, DEFAULT_POOL_SIZE, DEFAULT_QUERY_TIMEOUT);
	}

	@Override
	public String toString() {
		return "DatabaseSettings[url=%s, username=%s, schema=%s, poolSize=%d, queryTimeout=%s]"
				.formatted(url, username, schema, poolSize, queryTimeout);
	}
}
