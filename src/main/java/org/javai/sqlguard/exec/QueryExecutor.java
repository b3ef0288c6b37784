package org.javai.sqlguard.exec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a final, authorized statement and materializes its rows.
 *
 * <p>Each call borrows one connection from the pool, marks it read-only, and returns it when
 * the call ends, whatever the outcome. Failures are logged with the statement and surface as
 * {@link QueryExecutionException}; they are never retried.</p>
 */
public class QueryExecutor {

	private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

	private final DataSource dataSource;
	private final Duration queryTimeout;

	/**
	 * @param queryTimeout per-statement limit; zero or negative disables it
	 */
	public QueryExecutor(DataSource dataSource, Duration queryTimeout) {
		this.dataSource = dataSource;
		this.queryTimeout = queryTimeout != null ? queryTimeout : Duration.ZERO;
	}

	public ExecutionResult execute(String sql) {
		return execute(sql, CancellationToken.create());
	}

	public ExecutionResult execute(String sql, CancellationToken cancellation) {
		if (cancellation.isCancelled()) {
			throw fail(QueryExecutionException.Kind.CANCELLED, sql, "Request cancelled before execution", null);
		}
		long started = System.nanoTime();
		try (Connection connection = dataSource.getConnection()) {
			connection.setReadOnly(true);
			try (Statement statement = connection.createStatement()) {
				statement.setQueryTimeout(timeoutSeconds());
				cancellation.attach(statement);
				try (ResultSet rs = statement.executeQuery(sql)) {
					ExecutionResult result = readRows(rs, started);
					logger.debug("Query returned {} rows in {} ms", result.rowCount(), result.elapsedMillis());
					return result;
				}
				finally {
					cancellation.detach();
				}
			}
		}
		catch (SQLException e) {
			if (cancellation.isCancelled()) {
				throw fail(QueryExecutionException.Kind.CANCELLED, sql, "Query cancelled", e);
			}
			if (e instanceof SQLTimeoutException) {
				throw fail(QueryExecutionException.Kind.TIMEOUT, sql,
						"Query exceeded timeout of " + queryTimeout.toSeconds() + "s", e);
			}
			throw fail(QueryExecutionException.Kind.DRIVER_ERROR, sql, "Query execution failed: " + e.getMessage(), e);
		}
	}

	private ExecutionResult readRows(ResultSet rs, long started) throws SQLException {
		ResultSetMetaData meta = rs.getMetaData();
		int columnCount = meta.getColumnCount();
		List<String> columns = new ArrayList<>(columnCount);
		for (int i = 1; i <= columnCount; i++) {
			columns.add(meta.getColumnLabel(i));
		}
		List<Map<String, Object>> rows = new ArrayList<>();
		while (rs.next()) {
			Map<String, Object> row = new LinkedHashMap<>();
			for (int i = 1; i <= columnCount; i++) {
				row.put(columns.get(i - 1), rs.getObject(i));
			}
			rows.add(row);
		}
		long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
		return new ExecutionResult(columns, rows, rows.size(), elapsed);
	}

	/**
	 * JDBC timeouts are whole seconds; round up so a sub-second timeout is not read as "none".
	 */
	int timeoutSeconds() {
		if (queryTimeout.isZero() || queryTimeout.isNegative()) {
			return 0;
		}
		long millis = queryTimeout.toMillis();
		return (int) Math.min(Integer.MAX_VALUE, (millis + 999) / 1000);
	}

	private QueryExecutionException fail(QueryExecutionException.Kind kind, String sql, String message, Throwable cause) {
		logger.error("{} ({}) for statement: {}", message, kind, sql);
		return new QueryExecutionException(kind, sql, message, cause);
	}
}
