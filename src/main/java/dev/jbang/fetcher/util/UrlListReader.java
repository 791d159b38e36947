package dev.jbang.fetcher.util;

import dev.jbang.fetcher.reporting.StatusSink;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Reads a line-oriented URL list and filters out lines that are not http(s) URLs */
public class UrlListReader {

	/** {@code http(s)://host[.tld][:port][/path]} */
	public static final Pattern URL_PATTERN =
			Pattern.compile("https?://[a-zA-Z0-9-]+(\\.[a-zA-Z0-9-]+)*(:\\d{1,5})?(/\\S*)?");

	/**
	 * Accepted URLs, in input order, and the rejected lines.
	 *
	 * @param accepted Valid URLs
	 * @param rejected Trimmed lines that were not valid URLs
	 */
	public record UrlList(List<URI> accepted, List<String> rejected) {
		public UrlList {
			accepted = List.copyOf(accepted);
			rejected = List.copyOf(rejected);
		}
	}

	/**
	 * Read and validate a URL list file.
	 *
	 * @param file The file, one URL per line
	 * @param sink Receives one line per rejected entry
	 * @return The accepted and rejected entries
	 * @throws IOException if the file is missing or cannot be read
	 */
	public static UrlList read(Path file, StatusSink sink) throws IOException {
		List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
		return parse(lines, sink);
	}

	/**
	 * Validate URL candidates. Surrounding whitespace is trimmed and blank lines are ignored.
	 *
	 * @param lines The candidates
	 * @param sink Receives one line per rejected entry
	 * @return The accepted and rejected entries
	 */
	public static UrlList parse(List<String> lines, StatusSink sink) {
		List<URI> accepted = new ArrayList<>();
		List<String> rejected = new ArrayList<>();
		for (String line : lines) {
			String candidate = line.strip();
			if (candidate.isEmpty()) {
				continue;
			}
			URI uri = toUri(candidate);
			if (uri != null) {
				accepted.add(uri);
			} else {
				rejected.add(candidate);
				sink.info("Invalid URL skipped: " + candidate);
			}
		}
		return new UrlList(accepted, rejected);
	}

	/** Check a single candidate, returns null if it is not an acceptable URL */
	static URI toUri(String candidate) {
		if (!URL_PATTERN.matcher(candidate).matches()) {
			return null;
		}
		try {
			return URI.create(candidate);
		} catch (IllegalArgumentException e) {
			// Matches the pattern but contains characters URI does not allow, e.g. '|'
			return null;
		}
	}
}
