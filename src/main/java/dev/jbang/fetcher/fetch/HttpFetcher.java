package dev.jbang.fetcher.fetch;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Fetcher} backed by the JDK {@link HttpClient}. Redirects are followed, any status outside
 * the 2xx range is a failure, and a watchdog enforces the overall timeout and the stall window
 * while the body is copied.
 */
public class HttpFetcher implements Fetcher {
	private static final Logger logger = LoggerFactory.getLogger(HttpFetcher.class);
	private static final int BUFFER_SIZE = 8192;

	private final HttpClient httpClient;
	private final ScheduledExecutorService watchdogScheduler;
	private volatile boolean closed;

	public HttpFetcher() {
		this(FetchLimits.DEFAULT_TIMEOUT);
	}

	/**
	 * Create a new HttpFetcher.
	 *
	 * @param connectTimeout Maximum time to establish a connection
	 */
	public HttpFetcher(Duration connectTimeout) {
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(connectTimeout)
				.build();
		this.watchdogScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
			Thread thread = new Thread(r, "transfer-watchdog");
			thread.setDaemon(true);
			return thread;
		});
	}

	@Override
	public long fetch(URI uri, OutputStream out, FetchLimits limits)
			throws TransportException, FetchResourceException, InterruptedException {
		if (closed) {
			throw new FetchResourceException("Fetcher is closed, cannot fetch " + uri);
		}
		long startNanos = System.nanoTime();
		HttpRequest request = request(uri, limits).build();

		HttpResponse<InputStream> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
		} catch (HttpTimeoutException e) {
			throw new TransportException(TransportException.Kind.TIMEOUT, "Timeout waiting for " + uri, e);
		} catch (ConnectException e) {
			throw new TransportException(TransportException.Kind.CONNECT, "Could not connect to " + uri, e);
		} catch (IOException e) {
			throw new TransportException(TransportException.Kind.IO, "Failed to fetch " + uri + ": " + e, e);
		}

		int statusCode = response.statusCode();
		if (statusCode < 200 || statusCode >= 300) {
			closeQuietly(response.body());
			throw new TransportException(
					TransportException.Kind.HTTP_STATUS, "Failed to fetch " + uri + " - HTTP status: " + statusCode);
		}

		InputStream in = response.body();
		TransferWatchdog watchdog = TransferWatchdog.watch(watchdogScheduler, limits, startNanos, in);
		try (watchdog;
				in) {
			byte[] buffer = new byte[BUFFER_SIZE];
			long total = 0;
			int read;
			while ((read = in.read(buffer)) != -1) {
				failIfAborted(watchdog, uri, limits, null);
				out.write(buffer, 0, read);
				total += read;
				watchdog.transferred(read);
			}
			// Closing the stream on abort can end the loop like a regular end of body
			failIfAborted(watchdog, uri, limits, null);
			logger.debug("Fetched {} bytes from {}", total, uri);
			return total;
		} catch (TransportException e) {
			throw e;
		} catch (IOException e) {
			failIfAborted(watchdog, uri, limits, e);
			throw new TransportException(TransportException.Kind.IO, "Failed to read " + uri + ": " + e, e);
		}
	}

	/** Turn an abort by the watchdog into the matching failure */
	private static void failIfAborted(TransferWatchdog watchdog, URI uri, FetchLimits limits, IOException cause)
			throws TransportException {
		TransportException.Kind abortKind = watchdog.abortKind();
		if (abortKind == TransportException.Kind.TIMEOUT) {
			throw new TransportException(
					abortKind, "Transfer of " + uri + " exceeded " + limits.timeout().toSeconds() + "s", cause);
		} else if (abortKind == TransportException.Kind.STALL) {
			throw new TransportException(
					abortKind,
					"Transfer of " + uri + " stalled below " + limits.minBytesPerSecond() + " bytes/s for "
							+ limits.stallWindow().toSeconds() + "s",
					cause);
		}
	}

	private HttpRequest.Builder request(URI uri, FetchLimits limits) {
		return HttpRequest.newBuilder().uri(uri).timeout(limits.timeout()).GET();
	}

	private void closeQuietly(InputStream in) {
		try {
			in.close();
		} catch (IOException e) {
			logger.debug("Failed to close response body", e);
		}
	}

	@Override
	public void close() {
		closed = true;
		watchdogScheduler.shutdownNow();
	}
}
