package dev.jbang.fetcher.pool;

import dev.jbang.fetcher.model.FetchTask;
import dev.jbang.fetcher.reporting.StatusSink;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default worker pool: a FIFO queue guarded by a single lock and condition, drained by a fixed
 * number of long-lived worker loops running on a fixed thread pool. The queue is unbounded. Every
 * task is either queued, owned by exactly one worker, or finished.
 */
public class DefaultWorkerPool implements WorkerPool {
	private static final Logger logger = LoggerFactory.getLogger(DefaultWorkerPool.class);
	private static final String THREAD_NAME_PREFIX = "fetch-worker-";

	private final int workerCount;
	private final TaskExecutor executor;
	private final StatusSink sink;
	private final Duration pauseBetweenTasks;

	private final ReentrantLock lock = new ReentrantLock();
	private final Condition workAvailable = lock.newCondition();

	// Guarded by lock
	private final Deque<FetchTask> queue = new ArrayDeque<>();
	private final Set<String> liveWorkers = new LinkedHashSet<>();
	private PoolState state = PoolState.CREATED;
	private int busyWorkers;
	private long executedTasks;
	private ExecutorService workerThreads;

	/**
	 * Create a new DefaultWorkerPool.
	 *
	 * @param workerCount Number of worker threads, at least 1
	 * @param executor Runs each dequeued task
	 * @param sink Receives a notice per queued task and error lines for tasks whose executor failed
	 *     unexpectedly
	 */
	public DefaultWorkerPool(int workerCount, TaskExecutor executor, StatusSink sink) {
		this(workerCount, executor, sink, Duration.ZERO);
	}

	/**
	 * Create a new DefaultWorkerPool.
	 *
	 * @param workerCount Number of worker threads, at least 1
	 * @param executor Runs each dequeued task
	 * @param sink Receives a notice per queued task and error lines for tasks whose executor failed
	 *     unexpectedly
	 * @param pauseBetweenTasks Time a worker waits after a task before taking the next one
	 */
	public DefaultWorkerPool(int workerCount, TaskExecutor executor, StatusSink sink, Duration pauseBetweenTasks) {
		if (workerCount < 1) {
			throw new IllegalArgumentException("workerCount must be at least 1, got " + workerCount);
		}
		this.workerCount = workerCount;
		this.executor = Objects.requireNonNull(executor, "executor");
		this.sink = Objects.requireNonNull(sink, "sink");
		this.pauseBetweenTasks = pauseBetweenTasks == null ? Duration.ZERO : pauseBetweenTasks;
	}

	@Override
	public void start() {
		lock.lock();
		try {
			if (state != PoolState.CREATED) {
				throw new IllegalStateException("Pool already started (state " + state + ")");
			}
			for (int i = 1; i <= workerCount; i++) {
				liveWorkers.add(THREAD_NAME_PREFIX + i);
			}
			workerThreads = Executors.newFixedThreadPool(workerCount, namedThreads());
			state = PoolState.RUNNING;
		} finally {
			lock.unlock();
		}
		logger.info("Starting worker pool with {} workers", workerCount);
		for (int i = 1; i <= workerCount; i++) {
			String name = THREAD_NAME_PREFIX + i;
			workerThreads.execute(() -> runWorker(name));
		}
	}

	private static ThreadFactory namedThreads() {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, THREAD_NAME_PREFIX + counter.incrementAndGet());
			thread.setDaemon(false);
			return thread;
		};
	}

	@Override
	public void submit(FetchTask task) {
		Objects.requireNonNull(task, "task");
		lock.lock();
		try {
			if (state == PoolState.DRAINING || state == PoolState.STOPPED) {
				throw new PoolClosedException(
						"Cannot submit " + task.source() + " after shutdown was requested, task dropped");
			}
			queue.addLast(task);
			// Under the lock so the notice precedes anything a worker reports for the task
			sink.info("Queued #" + task.sequenceIndex() + ": " + task.source());
			workAvailable.signal();
		} finally {
			lock.unlock();
		}
	}

	@Override
	public void shutdown() {
		lock.lock();
		try {
			switch (state) {
				case CREATED -> throw new IllegalStateException("Cannot shut down a pool that was never started");
				case RUNNING -> {
					state = PoolState.DRAINING;
					workAvailable.signalAll();
					logger.info("Shutting down worker pool, {} tasks still queued", queue.size());
				}
				default -> {
					// Already draining or stopped
				}
			}
		} finally {
			lock.unlock();
		}
	}

	@Override
	public void awaitCompletion() throws InterruptedException {
		lock.lock();
		try {
			if (state == PoolState.CREATED || state == PoolState.RUNNING) {
				throw new IllegalStateException("shutdown() must be called before awaiting completion");
			}
		} finally {
			lock.unlock();
		}

		// Null when a pool that was never started got closed
		if (workerThreads != null) {
			workerThreads.shutdown();
			while (!workerThreads.awaitTermination(1, TimeUnit.MINUTES)) {
				logger.info("Still waiting for {} workers to finish", getLiveWorkers().size());
			}
		}

		lock.lock();
		try {
			if (state != PoolState.STOPPED) {
				state = PoolState.STOPPED;
				logger.info("Worker pool stopped after executing {} tasks", executedTasks);
			}
		} finally {
			lock.unlock();
		}
	}

	@Override
	public void close() {
		lock.lock();
		try {
			if (state == PoolState.CREATED) {
				if (!queue.isEmpty()) {
					logger.warn("Closing a pool that was never started, discarding {} queued tasks", queue.size());
					queue.clear();
				}
				state = PoolState.STOPPED;
				return;
			}
		} finally {
			lock.unlock();
		}
		shutdown();
		try {
			awaitCompletion();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Interrupted while waiting for workers to finish");
		}
	}

	@Override
	public PoolState getState() {
		lock.lock();
		try {
			return state;
		} finally {
			lock.unlock();
		}
	}

	@Override
	public int getWorkerCount() {
		return workerCount;
	}

	@Override
	public int getQueuedCount() {
		lock.lock();
		try {
			return queue.size();
		} finally {
			lock.unlock();
		}
	}

	@Override
	public int getActiveCount() {
		lock.lock();
		try {
			return busyWorkers;
		} finally {
			lock.unlock();
		}
	}

	@Override
	public long getExecutedCount() {
		lock.lock();
		try {
			return executedTasks;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Get the names of the workers that have not exited yet.
	 *
	 * @return Snapshot of live worker names
	 */
	public Set<String> getLiveWorkers() {
		lock.lock();
		try {
			return Set.copyOf(liveWorkers);
		} finally {
			lock.unlock();
		}
	}

	/** Worker loop: take tasks until the pool drains */
	private void runWorker(String name) {
		logger.debug("Worker {} started", name);
		try {
			while (true) {
				FetchTask task = nextTask();
				if (task == null) {
					return;
				}
				try {
					executeTask(task);
				} finally {
					lock.lock();
					try {
						busyWorkers--;
						executedTasks++;
					} finally {
						lock.unlock();
					}
				}
				if (!pauseBetweenTasks.isZero() && !pauseBetweenTasks.isNegative()) {
					Thread.sleep(pauseBetweenTasks.toMillis());
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Worker {} interrupted, exiting", name);
		} finally {
			lock.lock();
			try {
				liveWorkers.remove(name);
			} finally {
				lock.unlock();
			}
			logger.debug("Worker {} exited", name);
		}
	}

	/**
	 * Block until a task is available or the pool is draining with an empty queue.
	 *
	 * @return The next task in submission order, or {@code null} when the worker should exit
	 */
	private FetchTask nextTask() throws InterruptedException {
		lock.lock();
		try {
			while (queue.isEmpty() && state == PoolState.RUNNING) {
				workAvailable.await();
			}
			FetchTask task = queue.pollFirst();
			if (task != null) {
				busyWorkers++;
			}
			return task;
		} finally {
			lock.unlock();
		}
	}

	private void executeTask(FetchTask task) {
		try {
			executor.execute(task);
		} catch (RuntimeException e) {
			logger.error("Unexpected failure executing task #{} for {}", task.sequenceIndex(), task.source(), e);
			sink.error("Unexpected failure for " + task.source() + ": " + e);
		}
	}
}
