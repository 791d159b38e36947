package dev.jbang.fetcher.pool;

import dev.jbang.fetcher.model.FetchTask;
import dev.jbang.fetcher.model.TaskOutcome;

/** Runs one task to its terminal outcome. Called concurrently from all pool workers. */
@FunctionalInterface
public interface TaskExecutor {
	TaskOutcome execute(FetchTask task);
}
