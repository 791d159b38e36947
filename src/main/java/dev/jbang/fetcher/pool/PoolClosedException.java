package dev.jbang.fetcher.pool;

/** A task was submitted after the pool started shutting down. The task was not queued. */
public class PoolClosedException extends IllegalStateException {

	public PoolClosedException(String message) {
		super(message);
	}
}
