package org.javai.sqlguard.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each record as one JSON line to the {@value #CHANNEL} logger.
 */
public class LoggingAuditSink implements AuditSink {

	public static final String CHANNEL = "sqlguard.audit";

	private static final ObjectMapper mapper = new ObjectMapper();

	private final Logger logger;

	public LoggingAuditSink() {
		this(LoggerFactory.getLogger(CHANNEL));
	}

	LoggingAuditSink(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void record(AuditRecord record) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		try {
			logger.info("{}", mapper.writeValueAsString(record));
		}
		catch (JsonProcessingException e) {
			throw new UncheckedIOException("Failed to serialize audit record", e);
		}
	}
}
