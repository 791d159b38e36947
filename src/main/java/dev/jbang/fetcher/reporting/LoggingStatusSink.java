package dev.jbang.fetcher.reporting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StatusSink} that writes through the {@value #LOGGER_NAME} SLF4J logger. The logging
 * configuration sends that logger to the console and to the persistent log file; every appender
 * writes a whole event under its own lock, so lines from different workers never tear.
 */
public class LoggingStatusSink implements StatusSink {
	public static final String LOGGER_NAME = "status";

	private final Logger logger;

	public LoggingStatusSink() {
		this(LoggerFactory.getLogger(LOGGER_NAME));
	}

	public LoggingStatusSink(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void info(String message) {
		logger.info(message);
	}

	@Override
	public void error(String message) {
		logger.error(ERROR_PREFIX + message);
	}
}
