package dev.jbang.fetcher.pool;

import dev.jbang.fetcher.model.FetchTask;

/**
 * Fixed set of workers executing queued tasks. Tasks are dequeued in submission order; the order
 * in which they complete is not defined.
 */
public interface WorkerPool extends AutoCloseable {

	/**
	 * Start the worker threads. Should be called once after construction.
	 *
	 * @throws IllegalStateException if the pool was already started
	 */
	void start();

	/**
	 * Queue a task for execution.
	 *
	 * @param task The task to execute
	 * @throws PoolClosedException if shutdown was already requested; the task is dropped
	 */
	void submit(FetchTask task);

	/**
	 * Signal that no more tasks will be submitted. Workers finish the queued tasks and exit.
	 */
	void shutdown();

	/**
	 * Wait until every worker has exited. Only valid after {@link #shutdown()}.
	 *
	 * @throws InterruptedException if interrupted while waiting
	 */
	void awaitCompletion() throws InterruptedException;

	PoolState getState();

	/**
	 * Get the number of worker threads.
	 *
	 * @return Fixed number of workers of this pool
	 */
	int getWorkerCount();

	/**
	 * Get the number of tasks waiting in the queue.
	 *
	 * @return Number of queued tasks
	 */
	int getQueuedCount();

	/**
	 * Get the number of tasks currently executing.
	 *
	 * @return Number of busy workers
	 */
	int getActiveCount();

	/**
	 * Get the number of tasks that reached a terminal outcome.
	 *
	 * @return Number of executed tasks
	 */
	long getExecutedCount();

	/** Shut down and wait for all workers to exit. */
	@Override
	void close();
}
