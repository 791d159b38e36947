package dev.jbang.fetcher.fetch;

import java.io.OutputStream;
import java.net.URI;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetcher that never touches the network. Every call succeeds without writing any bytes. Useful
 * for checking a URL list and the output layout.
 */
public class DryRunFetcher implements Fetcher {
	private static final Logger logger = LoggerFactory.getLogger(DryRunFetcher.class);

	private final AtomicInteger requests = new AtomicInteger(0);

	@Override
	public long fetch(URI uri, OutputStream out, FetchLimits limits) {
		requests.incrementAndGet();
		logger.debug("Ignoring fetch request for: {} (dry-run option specified)", uri);
		return 0;
	}

	/**
	 * Get the number of fetch requests received.
	 *
	 * @return Number of calls to {@link #fetch}
	 */
	public int getRequestCount() {
		return requests.get();
	}
}
