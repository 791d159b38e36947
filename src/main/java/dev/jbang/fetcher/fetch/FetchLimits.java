package dev.jbang.fetcher.fetch;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits applied to a single transfer.
 *
 * @param timeout Maximum time for the whole transfer, headers and body
 * @param minBytesPerSecond Throughput floor; 0 disables stall detection
 * @param stallWindow How long the throughput may stay below the floor before the transfer is
 *     aborted as stalled
 */
public record FetchLimits(Duration timeout, long minBytesPerSecond, Duration stallWindow) {
	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
	public static final long DEFAULT_MIN_BYTES_PER_SECOND = 100;
	public static final Duration DEFAULT_STALL_WINDOW = Duration.ofSeconds(10);

	public FetchLimits {
		Objects.requireNonNull(timeout, "timeout");
		Objects.requireNonNull(stallWindow, "stallWindow");
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
		if (minBytesPerSecond < 0) {
			throw new IllegalArgumentException("minBytesPerSecond must not be negative");
		}
		if (minBytesPerSecond > 0 && (stallWindow.isNegative() || stallWindow.isZero())) {
			throw new IllegalArgumentException("stallWindow must be positive when a throughput floor is set");
		}
	}

	public static FetchLimits defaults() {
		return new FetchLimits(DEFAULT_TIMEOUT, DEFAULT_MIN_BYTES_PER_SECOND, DEFAULT_STALL_WINDOW);
	}

	public boolean stallDetectionEnabled() {
		return minBytesPerSecond > 0;
	}
}
