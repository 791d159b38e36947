package dev.jbang.fetcher.model;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A single unit of work: fetch {@code source} and store the bytes in {@code destination}.
 *
 * @param source The URL to fetch
 * @param destination The file the fetched bytes are written to
 * @param sequenceIndex 1-based position of the URL among the accepted URLs of the batch
 */
public record FetchTask(URI source, Path destination, int sequenceIndex) {

	public FetchTask {
		Objects.requireNonNull(source, "source");
		Objects.requireNonNull(destination, "destination");
		if (sequenceIndex < 1) {
			throw new IllegalArgumentException("sequenceIndex must be 1 or larger, got " + sequenceIndex);
		}
	}
}
