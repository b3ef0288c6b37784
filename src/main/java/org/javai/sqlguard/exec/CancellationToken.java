package org.javai.sqlguard.exec;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lets another thread abort the statement a request is running, for example when the client
 * disconnects. A token belongs to a single request.
 */
public final class CancellationToken {

	private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

	private final AtomicBoolean cancelled = new AtomicBoolean();
	private final AtomicReference<Statement> active = new AtomicReference<>();

	public static CancellationToken create() {
		return new CancellationToken();
	}

	/**
	 * Marks the request cancelled and aborts the running statement, if any. Idempotent.
	 */
	public void cancel() {
		if (cancelled.compareAndSet(false, true)) {
			abort(active.get());
		}
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	void attach(Statement statement) {
		active.set(statement);
		if (cancelled.get()) {
			abort(statement);
		}
	}

	void detach() {
		active.set(null);
	}

	private void abort(Statement statement) {
		if (statement == null) {
			return;
		}
		try {
			statement.cancel();
		}
		catch (SQLException e) {
			logger.warn("Failed to cancel running statement: {}", e.getMessage(), e);
		}
	}
}
