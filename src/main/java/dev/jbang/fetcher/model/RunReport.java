package dev.jbang.fetcher.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/** JSON summary of a finished batch, one entry per dispatched task */
@JsonPropertyOrder({"dispatched", "succeeded", "failed", "dropped", "tasks"})
public record RunReport(
		@JsonProperty("dispatched") int dispatched,
		@JsonProperty("succeeded") int succeeded,
		@JsonProperty("failed") int failed,
		@JsonProperty("dropped") int dropped,
		@JsonProperty("tasks") List<Entry> tasks) {

	@JsonPropertyOrder({"index", "url", "file", "success", "attempts", "bytes", "error"})
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record Entry(
			@JsonProperty("index") int index,
			@JsonProperty("url") String url,
			@JsonProperty("file") String file,
			@JsonProperty("success") boolean success,
			@JsonProperty("attempts") int attempts,
			@JsonProperty("bytes") long bytes,
			@JsonProperty("error") String error) {

		public static Entry of(TaskOutcome outcome) {
			FetchTask task = outcome.task();
			return new Entry(
					task.sequenceIndex(),
					task.source().toString(),
					task.destination().getFileName().toString(),
					outcome.success(),
					outcome.attempts(),
					outcome.bytesWritten(),
					outcome.reason());
		}
	}
}
