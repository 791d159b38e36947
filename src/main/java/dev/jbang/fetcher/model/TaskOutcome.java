package dev.jbang.fetcher.model;

/** Terminal result of executing a {@link FetchTask} */
public record TaskOutcome(FetchTask task, boolean success, int attempts, long bytesWritten, Exception error) {

	public static TaskOutcome success(FetchTask task, int attempts, long bytesWritten) {
		return new TaskOutcome(task, true, attempts, bytesWritten, null);
	}

	public static TaskOutcome failure(FetchTask task, int attempts, Exception error) {
		return new TaskOutcome(task, false, attempts, 0, error);
	}

	/** Human readable reason of a failure, or {@code null} for a successful outcome */
	public String reason() {
		if (success) {
			return null;
		}
		return error != null && error.getMessage() != null ? error.getMessage() : "Unknown error";
	}

	@Override
	public String toString() {
		return success
				? "SUCCESS (%d bytes after %d attempt(s))".formatted(bytesWritten, attempts)
				: "FAILED - %s".formatted(reason());
	}
}
