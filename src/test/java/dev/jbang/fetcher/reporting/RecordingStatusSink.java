package dev.jbang.fetcher.reporting;

import java.util.ArrayList;
import java.util.List;

/**
 * StatusSink for testing. Keeps every line in memory, error lines with their prefix, so tests can
 * count retry, success and failure entries.
 */
public class RecordingStatusSink implements StatusSink {
	private final List<String> lines = new ArrayList<>();

	@Override
	public synchronized void info(String message) {
		lines.add(message);
	}

	@Override
	public synchronized void error(String message) {
		lines.add(ERROR_PREFIX + message);
	}

	public synchronized List<String> lines() {
		return new ArrayList<>(lines);
	}

	public synchronized List<String> errors() {
		return lines.stream().filter(l -> l.startsWith(ERROR_PREFIX)).toList();
	}

	/** Lines starting with the given text, prefix included for error lines */
	public synchronized List<String> linesStartingWith(String start) {
		return lines.stream().filter(l -> l.startsWith(start)).toList();
	}
}
