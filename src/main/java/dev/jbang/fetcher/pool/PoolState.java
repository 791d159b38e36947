package dev.jbang.fetcher.pool;

/**
 * Lifecycle of a {@link WorkerPool}. Transitions only go forward, {@link #STOPPED} is terminal.
 */
public enum PoolState {
	/** Constructed, accepting submissions, no workers yet */
	CREATED,
	/** Workers running, accepting submissions */
	RUNNING,
	/** Shutdown requested: no new submissions, queued tasks are still processed */
	DRAINING,
	/** All workers have exited */
	STOPPED
}
