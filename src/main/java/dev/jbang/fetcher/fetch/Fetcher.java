package dev.jbang.fetcher.fetch;

import java.io.OutputStream;
import java.net.URI;

/**
 * Transport capability used by the task executor. An implementation performs one transfer per
 * call; retrying is the caller's business.
 */
public interface Fetcher extends AutoCloseable {

	/**
	 * Fetch the resource at {@code uri} and copy its body into {@code out}.
	 *
	 * @param uri The resource to fetch, redirects are followed
	 * @param out Destination of the body bytes, not closed by this method
	 * @param limits Timeout and throughput limits for this transfer
	 * @return The number of bytes written to {@code out}
	 * @throws TransportException if the transfer failed and may succeed when retried
	 * @throws FetchResourceException if no transfer could be set up at all
	 * @throws InterruptedException if the calling thread was interrupted
	 */
	long fetch(URI uri, OutputStream out, FetchLimits limits)
			throws TransportException, FetchResourceException, InterruptedException;

	/** Release the resources held by this fetcher. */
	@Override
	default void close() {}
}
