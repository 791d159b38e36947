package dev.jbang.fetcher.fetch;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches one running transfer and aborts it when the overall deadline passes or when the
 * throughput stays below the floor for a whole stall window. Aborting closes the body stream and
 * interrupts the reading thread, so a blocked read fails; a read that still gets data returns
 * normally, so the copy loop must check {@link #abortKind()} after every read.
 */
final class TransferWatchdog implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(TransferWatchdog.class);
	static final Duration CHECK_INTERVAL = Duration.ofMillis(100);

	private final Thread reader;
	private final Closeable body;
	private final FetchLimits limits;
	private final long startNanos;
	private final AtomicLong transferred = new AtomicLong();
	private final Object lock = new Object();
	private final ScheduledFuture<?> check;

	// Only touched from the check task
	private long windowStartNanos;
	private long windowStartBytes;

	private TransportException.Kind abortKind;
	private boolean closed;

	private TransferWatchdog(
			ScheduledExecutorService scheduler, Thread reader, Closeable body, FetchLimits limits, long startNanos) {
		this.reader = reader;
		this.body = body;
		this.limits = limits;
		this.startNanos = startNanos;
		this.windowStartNanos = System.nanoTime();
		this.check = scheduler.scheduleWithFixedDelay(
				this::check, CHECK_INTERVAL.toMillis(), CHECK_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
	}

	/**
	 * Start watching a transfer performed by the current thread.
	 *
	 * @param scheduler Scheduler running the periodic checks
	 * @param limits Limits of the transfer
	 * @param startNanos {@link System#nanoTime()} at which the transfer started
	 * @param body Stream the current thread reads the transfer from, closed on abort
	 */
	static TransferWatchdog watch(
			ScheduledExecutorService scheduler, FetchLimits limits, long startNanos, Closeable body) {
		return new TransferWatchdog(scheduler, Thread.currentThread(), body, limits, startNanos);
	}

	/** Account for bytes that were just copied */
	void transferred(int bytes) {
		transferred.addAndGet(bytes);
	}

	/** Reason the transfer was aborted, or {@code null} if it was not */
	TransportException.Kind abortKind() {
		synchronized (lock) {
			return abortKind;
		}
	}

	private void check() {
		long now = System.nanoTime();
		if (now - startNanos >= limits.timeout().toNanos()) {
			abort(TransportException.Kind.TIMEOUT);
			return;
		}
		if (!limits.stallDetectionEnabled()) {
			return;
		}
		long windowNanos = now - windowStartNanos;
		if (windowNanos >= limits.stallWindow().toNanos()) {
			long bytes = transferred.get();
			double seconds = windowNanos / 1_000_000_000.0;
			if ((bytes - windowStartBytes) / seconds < limits.minBytesPerSecond()) {
				abort(TransportException.Kind.STALL);
				return;
			}
			windowStartNanos = now;
			windowStartBytes = bytes;
		}
	}

	private void abort(TransportException.Kind kind) {
		synchronized (lock) {
			if (closed || abortKind != null) {
				return;
			}
			abortKind = kind;
			reader.interrupt();
		}
		check.cancel(false);
		logger.debug("Aborting transfer: {}", kind);
		try {
			body.close();
		} catch (IOException e) {
			logger.debug("Failed to close aborted transfer", e);
		}
	}

	/** Stop watching. Must be called from the reading thread. */
	@Override
	public void close() {
		check.cancel(false);
		synchronized (lock) {
			closed = true;
			if (abortKind != null) {
				// The interrupt was ours, not the caller's
				Thread.interrupted();
			}
		}
	}
}
