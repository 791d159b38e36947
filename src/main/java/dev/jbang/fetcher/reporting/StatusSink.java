package dev.jbang.fetcher.reporting;

/**
 * Append-only destination for the status lines of a batch run (dispatch, retry, success and
 * failure). Implementations must be safe to call from several worker threads at once and must
 * never interleave two lines.
 */
public interface StatusSink {

	/**
	 * Append an informative line.
	 *
	 * @param message The line, without trailing newline
	 */
	void info(String message);

	/**
	 * Append an error line. The line is written with the {@link #ERROR_PREFIX} in front of it.
	 *
	 * @param message The line, without trailing newline and without prefix
	 */
	void error(String message);

	String ERROR_PREFIX = "ERROR: ";
}
