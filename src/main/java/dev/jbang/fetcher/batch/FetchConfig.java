package dev.jbang.fetcher.batch;

import dev.jbang.fetcher.fetch.FetchLimits;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a batch run. Encapsulates the output location, the pool size override, the
 * retry policy and the per-transfer limits.
 *
 * @param outputDir Directory the numbered files are written to
 * @param extension File extension of the written files, without dot
 * @param threads Fixed number of workers, or a value below 1 to size the pool from the batch
 * @param maxRetries Maximum number of attempts per task, at least 1
 * @param backoffBase Delay before the second attempt; later delays grow linearly with the attempt
 * @param limits Timeout and throughput limits of every transfer
 * @param pauseBetweenTasks Delay a worker waits after a task before taking the next one
 */
public record FetchConfig(
		Path outputDir,
		String extension,
		int threads,
		int maxRetries,
		Duration backoffBase,
		FetchLimits limits,
		Duration pauseBetweenTasks) {
	public static final String DEFAULT_EXTENSION = "html";
	public static final int DEFAULT_MAX_RETRIES = 3;
	public static final Duration DEFAULT_BACKOFF_BASE = Duration.ofMillis(100);
	public static final Duration DEFAULT_PAUSE_BETWEEN_TASKS = Duration.ofMillis(100);

	public FetchConfig {
		Objects.requireNonNull(outputDir, "outputDir");
		Objects.requireNonNull(extension, "extension");
		Objects.requireNonNull(backoffBase, "backoffBase");
		Objects.requireNonNull(limits, "limits");
		Objects.requireNonNull(pauseBetweenTasks, "pauseBetweenTasks");
		if (maxRetries < 1) {
			throw new IllegalArgumentException("maxRetries must be at least 1, got " + maxRetries);
		}
		if (extension.isBlank() || extension.contains("/") || extension.contains("\\")) {
			throw new IllegalArgumentException("Invalid file extension: '" + extension + "'");
		}
		if (backoffBase.isNegative() || pauseBetweenTasks.isNegative()) {
			throw new IllegalArgumentException("Delays must not be negative");
		}
	}

	/** Defaults matching the classic behaviour: html files, 3 attempts, 100ms backoff and pause */
	public static FetchConfig defaults(Path outputDir) {
		return new FetchConfig(
				outputDir,
				DEFAULT_EXTENSION,
				-1,
				DEFAULT_MAX_RETRIES,
				DEFAULT_BACKOFF_BASE,
				FetchLimits.defaults(),
				DEFAULT_PAUSE_BETWEEN_TASKS);
	}

	public FetchConfig withThreads(int threads) {
		return new FetchConfig(outputDir, extension, threads, maxRetries, backoffBase, limits, pauseBetweenTasks);
	}

	public FetchConfig withRetryPolicy(int maxRetries, Duration backoffBase) {
		return new FetchConfig(outputDir, extension, threads, maxRetries, backoffBase, limits, pauseBetweenTasks);
	}

	public FetchConfig withPauseBetweenTasks(Duration pauseBetweenTasks) {
		return new FetchConfig(outputDir, extension, threads, maxRetries, backoffBase, limits, pauseBetweenTasks);
	}
}
