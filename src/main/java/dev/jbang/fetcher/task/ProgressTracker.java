package dev.jbang.fetcher.task;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts successfully completed tasks of one batch. The counter only moves up, one step per
 * success, and never passes the batch size. A new batch needs a new tracker.
 */
public class ProgressTracker {
	private final int total;
	private final AtomicInteger completed = new AtomicInteger(0);

	/**
	 * Create a new ProgressTracker.
	 *
	 * @param total Number of tasks in the batch, at least 1
	 */
	public ProgressTracker(int total) {
		if (total < 1) {
			throw new IllegalArgumentException("total must be at least 1, got " + total);
		}
		this.total = total;
	}

	/**
	 * Record one successful task.
	 *
	 * @return The number of completed tasks including this one
	 * @throws IllegalStateException if more successes are recorded than there are tasks
	 */
	public int recordSuccess() {
		while (true) {
			int current = completed.get();
			if (current >= total) {
				throw new IllegalStateException("More successes recorded than the " + total + " tasks of the batch");
			}
			if (completed.compareAndSet(current, current + 1)) {
				return current + 1;
			}
		}
	}

	public int completed() {
		return completed.get();
	}

	public int total() {
		return total;
	}

	/** Percentage of completed tasks, between 0 and 100 */
	public double percentage() {
		return percentageOf(completed.get());
	}

	/**
	 * Render a progress value, e.g. {@code 3/10 (30.00%)}.
	 *
	 * @param completedCount A value returned by {@link #recordSuccess()}
	 */
	public String describe(int completedCount) {
		return String.format(Locale.ROOT, "%d/%d (%.2f%%)", completedCount, total, percentageOf(completedCount));
	}

	private double percentageOf(int completedCount) {
		return 100.0 * completedCount / total;
	}

	@Override
	public String toString() {
		return describe(completed.get());
	}
}
