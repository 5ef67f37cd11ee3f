package org.javai.planning.diagnostics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sink that writes each message as JSON to an SLF4J logger at DEBUG.
 * <p>
 * Messages are only serialized when DEBUG is enabled for the target logger.
 */
public class LoggingDiagnosticSink implements DiagnosticSink {

	private final Logger logger;
	private final ObjectMapper mapper;

	public LoggingDiagnosticSink() {
		this(LoggerFactory.getLogger(LoggingDiagnosticSink.class));
	}

	public LoggingDiagnosticSink(Logger logger) {
		this.logger = Objects.requireNonNull(logger, "logger must not be null");
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
				.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
	}

	@Override
	public void publish(String channel, Object message) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug("[{}] {}", channel, toJson(message));
	}

	String toJson(Object message) {
		try {
			return mapper.writeValueAsString(message);
		}
		catch (JsonProcessingException e) {
			throw new DiagnosticPublishException("Failed to serialize "
					+ (message != null ? message.getClass().getSimpleName() : "null") + " message", e);
		}
	}
}
