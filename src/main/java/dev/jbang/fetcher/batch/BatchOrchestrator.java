package dev.jbang.fetcher.batch;

import dev.jbang.fetcher.fetch.Fetcher;
import dev.jbang.fetcher.model.FetchTask;
import dev.jbang.fetcher.model.TaskOutcome;
import dev.jbang.fetcher.pool.DefaultWorkerPool;
import dev.jbang.fetcher.pool.PoolClosedException;
import dev.jbang.fetcher.pool.TaskExecutor;
import dev.jbang.fetcher.pool.WorkerPool;
import dev.jbang.fetcher.reporting.StatusSink;
import dev.jbang.fetcher.task.FetchTaskExecutor;
import dev.jbang.fetcher.task.ProgressTracker;
import dev.jbang.fetcher.util.FileUtils;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one batch: sizes a worker pool for the batch, submits one task per URL and blocks until
 * the pool has drained. Instances can run several batches; each run gets its own pool and
 * progress tracker.
 */
public class BatchOrchestrator {
	private static final Logger logger = LoggerFactory.getLogger(BatchOrchestrator.class);

	static final int MIN_POOL_SIZE = 4;
	static final int URLS_PER_WORKER = 5;

	private final FetchConfig config;
	private final Fetcher fetcher;
	private final StatusSink sink;
	private final int availableParallelism;
	private final WorkerPoolFactory poolFactory;

	/** Creates the pool used for one run */
	@FunctionalInterface
	public interface WorkerPoolFactory {
		WorkerPool create(int workers, TaskExecutor executor, StatusSink sink, FetchConfig config);
	}

	public BatchOrchestrator(FetchConfig config, Fetcher fetcher, StatusSink sink) {
		this(config, fetcher, sink, Runtime.getRuntime().availableProcessors());
	}

	public BatchOrchestrator(FetchConfig config, Fetcher fetcher, StatusSink sink, int availableParallelism) {
		this(config, fetcher, sink, availableParallelism, (workers, executor, s, c) ->
				new DefaultWorkerPool(workers, executor, s, c.pauseBetweenTasks()));
	}

	BatchOrchestrator(
			FetchConfig config,
			Fetcher fetcher,
			StatusSink sink,
			int availableParallelism,
			WorkerPoolFactory poolFactory) {
		this.config = Objects.requireNonNull(config, "config");
		this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
		this.sink = Objects.requireNonNull(sink, "sink");
		this.availableParallelism = Math.max(1, availableParallelism);
		this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory");
	}

	/**
	 * Number of workers for a batch: {@code clamp(max(4, urlCount / 5), 1, 2 * availableParallelism)}.
	 *
	 * @param urlCount Number of URLs in the batch
	 * @param availableParallelism Number of processors available to the JVM
	 * @return Pool size between 1 and {@code 2 * availableParallelism}
	 */
	public static int poolSize(int urlCount, int availableParallelism) {
		return clamp(Math.max(MIN_POOL_SIZE, urlCount / URLS_PER_WORKER), availableParallelism);
	}

	/** Limit a worker count to {@code [1, 2 * availableParallelism]} */
	static int clamp(int workers, int availableParallelism) {
		int ceiling = Math.max(1, 2 * availableParallelism);
		return Math.max(1, Math.min(workers, ceiling));
	}

	private int workerCount(int urlCount) {
		if (config.threads() < 1) {
			return poolSize(urlCount, availableParallelism);
		}
		int workers = clamp(config.threads(), availableParallelism);
		if (workers < config.threads()) {
			logger.warn(
					"Requested {} threads, limited to {} on {} processors",
					config.threads(),
					workers,
					availableParallelism);
		}
		return workers;
	}

	/**
	 * Fetch every URL into its numbered file and wait for all of them to finish.
	 *
	 * @param urls The accepted URLs, in input order
	 * @return The result, available only after every task reached a terminal outcome
	 * @throws IOException if the output directory cannot be created
	 * @throws InterruptedException if interrupted while waiting for the pool to drain
	 */
	public BatchResult run(List<URI> urls) throws IOException, InterruptedException {
		if (urls == null || urls.isEmpty()) {
			throw new IllegalArgumentException("A batch needs at least one URL");
		}
		FileUtils.ensureDirectory(config.outputDir());

		int workers = workerCount(urls.size());
		ProgressTracker progress = new ProgressTracker(urls.size());
		FetchTaskExecutor taskExecutor = new FetchTaskExecutor(fetcher, progress, sink, config);
		List<TaskOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
		TaskExecutor recording = task -> {
			TaskOutcome outcome;
			try {
				outcome = taskExecutor.execute(task);
			} catch (RuntimeException e) {
				// The pool logs the exception, the batch still needs a terminal outcome
				outcomes.add(TaskOutcome.failure(task, 1, e));
				throw e;
			}
			outcomes.add(outcome);
			return outcome;
		};

		logger.info("Fetching {} URLs with {} workers into {}", urls.size(), workers, config.outputDir());
		WorkerPool pool = poolFactory.create(workers, recording, sink, config);
		int dispatched = 0;
		int dropped = 0;
		pool.start();
		try {
			for (int i = 0; i < urls.size(); i++) {
				int index = i + 1;
				FetchTask task = new FetchTask(urls.get(i), destinationFor(index), index);
				try {
					pool.submit(task);
					dispatched++;
				} catch (PoolClosedException e) {
					dropped++;
					sink.error(e.getMessage());
				}
			}
		} finally {
			pool.shutdown();
			pool.awaitCompletion();
		}

		List<TaskOutcome> ordered;
		synchronized (outcomes) {
			ordered = new ArrayList<>(outcomes);
		}
		ordered.sort(Comparator.comparingInt(o -> o.task().sequenceIndex()));
		BatchResult result = new BatchResult(dispatched, progress.completed(), dropped, ordered);
		logger.info("Batch finished: {}", result);
		return result;
	}

	/**
	 * File a task writes to.
	 *
	 * @param index 1-based position among the accepted URLs
	 */
	public Path destinationFor(int index) {
		return config.outputDir().resolve(FileUtils.artifactName(index, config.extension()));
	}
}
