package dev.jbang.fetcher.fetch;

import java.io.IOException;

/** The fetcher could not set up a transfer at all. Retrying will not help. */
public class FetchResourceException extends IOException {

	public FetchResourceException(String message) {
		super(message);
	}

	public FetchResourceException(String message, Throwable cause) {
		super(message, cause);
	}
}
