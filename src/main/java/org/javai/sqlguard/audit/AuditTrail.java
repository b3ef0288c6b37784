package org.javai.sqlguard.audit;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fire-and-forget dispatch of audit records.
 *
 * <p>Records are handed to the executor (the calling thread by default). A sink failure or a
 * rejected submission is reported on the {@value #DIAGNOSTICS_CHANNEL} logger and goes no
 * further: auditing never blocks or fails a request.</p>
 */
public class AuditTrail {

	public static final String DIAGNOSTICS_CHANNEL = "sqlguard.diagnostics";

	private static final Logger diagnostics = LoggerFactory.getLogger(DIAGNOSTICS_CHANNEL);

	private final AuditSink sink;
	private final Executor executor;

	public AuditTrail(AuditSink sink) {
		this(sink, Runnable::run);
	}

	public AuditTrail(AuditSink sink, Executor executor) {
		this.sink = sink;
		this.executor = executor;
	}

	public void submit(AuditRecord record) {
		try {
			executor.execute(() -> deliver(record));
		}
		catch (RejectedExecutionException e) {
			diagnostics.error("Audit record dropped, executor rejected it: type={} outcome={}",
					record.type(), record.outcome(), e);
		}
	}

	private void deliver(AuditRecord record) {
		try {
			sink.record(record);
		}
		catch (RuntimeException e) {
			diagnostics.error("Audit sink failed for record type={} outcome={}: {}",
					record.type(), record.outcome(), e.getMessage(), e);
		}
	}
}
