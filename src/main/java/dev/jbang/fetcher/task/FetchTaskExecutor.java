package dev.jbang.fetcher.task;

import dev.jbang.fetcher.batch.FetchConfig;
import dev.jbang.fetcher.fetch.FetchLimits;
import dev.jbang.fetcher.fetch.FetchResourceException;
import dev.jbang.fetcher.fetch.Fetcher;
import dev.jbang.fetcher.fetch.TransportException;
import dev.jbang.fetcher.model.FetchTask;
import dev.jbang.fetcher.model.TaskOutcome;
import dev.jbang.fetcher.pool.TaskExecutor;
import dev.jbang.fetcher.reporting.StatusSink;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes a fetch task with retries. Every attempt rewrites the destination from empty. Transport
 * failures are retried after a delay of {@code backoffBase * attempt}; failing to open the
 * destination or to set up a transfer ends the task at once.
 */
public class FetchTaskExecutor implements TaskExecutor {
	private static final Logger logger = LoggerFactory.getLogger(FetchTaskExecutor.class);

	private final Fetcher fetcher;
	private final ProgressTracker progress;
	private final StatusSink sink;
	private final int maxRetries;
	private final Duration backoffBase;
	private final FetchLimits limits;

	public FetchTaskExecutor(Fetcher fetcher, ProgressTracker progress, StatusSink sink, FetchConfig config) {
		this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
		this.progress = Objects.requireNonNull(progress, "progress");
		this.sink = Objects.requireNonNull(sink, "sink");
		this.maxRetries = config.maxRetries();
		this.backoffBase = config.backoffBase();
		this.limits = config.limits();
	}

	@Override
	public TaskOutcome execute(FetchTask task) {
		String url = task.source().toString();
		IOException lastError = null;

		for (int attempt = 1; attempt <= maxRetries; attempt++) {
			OutputStream out;
			try {
				out = Files.newOutputStream(
						task.destination(),
						StandardOpenOption.CREATE,
						StandardOpenOption.TRUNCATE_EXISTING,
						StandardOpenOption.WRITE);
			} catch (IOException e) {
				sink.error("Error opening file: " + task.destination() + " for " + url + " (" + e + ")");
				return TaskOutcome.failure(task, attempt, e);
			}

			long written;
			try (out) {
				written = fetcher.fetch(task.source(), out, limits);
			} catch (FetchResourceException e) {
				sink.error("Error initializing transfer for " + url + ": " + e.getMessage());
				return TaskOutcome.failure(task, attempt, e);
			} catch (IOException e) {
				lastError = e;
				logger.debug("Attempt {} of {} failed for {}", attempt, maxRetries, url, e);
				if (attempt < maxRetries) {
					sink.info("Retrying " + url + " (" + attempt + "/" + maxRetries + "): " + e.getMessage());
					if (!backoff(attempt)) {
						return interrupted(task, attempt);
					}
				}
				continue;
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return interrupted(task, attempt);
			}

			int completed = progress.recordSuccess();
			sink.info("Downloaded " + progress.describe(completed) + ": " + url);
			return TaskOutcome.success(task, attempt, written);
		}

		sink.error("Download failed for " + url + ": " + describe(lastError));
		return TaskOutcome.failure(task, maxRetries, lastError);
	}

	/**
	 * Sleep before the next attempt.
	 *
	 * @return false if the thread was interrupted while sleeping
	 */
	private boolean backoff(int attempt) {
		long millis = backoffBase.toMillis() * attempt;
		if (millis <= 0) {
			return true;
		}
		try {
			Thread.sleep(millis);
			return true;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	private TaskOutcome interrupted(FetchTask task, int attempt) {
		InterruptedException error = new InterruptedException("Interrupted while fetching " + task.source());
		sink.error("Download interrupted for " + task.source());
		return TaskOutcome.failure(task, attempt, error);
	}

	private static String describe(IOException error) {
		if (error == null) {
			return "Unknown error";
		}
		if (error instanceof TransportException te) {
			return te.getMessage() + " [" + te.kind() + "]";
		}
		return String.valueOf(error.getMessage());
	}
}
