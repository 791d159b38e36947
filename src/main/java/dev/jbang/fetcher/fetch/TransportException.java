package dev.jbang.fetcher.fetch;

import java.io.IOException;

/** A transfer failed in a way that may go away when it is attempted again */
public class TransportException extends IOException {

	public enum Kind {
		CONNECT,
		TIMEOUT,
		STALL,
		HTTP_STATUS,
		IO
	}

	private final Kind kind;

	public TransportException(Kind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public TransportException(Kind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public Kind kind() {
		return kind;
	}
}
