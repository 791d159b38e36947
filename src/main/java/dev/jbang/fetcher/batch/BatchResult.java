package dev.jbang.fetcher.batch;

import dev.jbang.fetcher.model.RunReport;
import dev.jbang.fetcher.model.TaskOutcome;
import java.util.List;

/**
 * Result of a drained batch.
 *
 * @param dispatched Number of tasks accepted by the pool
 * @param succeeded Final value of the progress counter
 * @param dropped Number of tasks the pool refused because it was already shutting down
 * @param outcomes Terminal outcome of every executed task, ordered by sequence index
 */
public record BatchResult(int dispatched, int succeeded, int dropped, List<TaskOutcome> outcomes) {

	public BatchResult {
		outcomes = List.copyOf(outcomes);
	}

	public int failed() {
		return (int) outcomes.stream().filter(o -> !o.success()).count();
	}

	public RunReport toReport() {
		return new RunReport(
				dispatched,
				succeeded,
				failed(),
				dropped,
				outcomes.stream().map(RunReport.Entry::of).toList());
	}

	@Override
	public String toString() {
		return "%d/%d succeeded (%d failed, %d dropped)".formatted(succeeded, dispatched, failed(), dropped);
	}
}
