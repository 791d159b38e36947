package dev.jbang.fetcher.fetch;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetcher for testing. Plays back a script of steps per URL, one step per call; URLs without a
 * script, or whose script ran out, use the fallback step.
 */
public class ScriptedFetcher implements Fetcher {

	/** One scripted call */
	@FunctionalInterface
	public interface Step {
		long run(URI uri, OutputStream out) throws IOException, InterruptedException;
	}

	private final Map<URI, Deque<Step>> scripts = new ConcurrentHashMap<>();
	private final Map<URI, AtomicInteger> calls = new ConcurrentHashMap<>();
	private final AtomicInteger totalCalls = new AtomicInteger();
	private final Step fallback;

	public ScriptedFetcher() {
		this(echo());
	}

	public ScriptedFetcher(Step fallback) {
		this.fallback = fallback;
	}

	public ScriptedFetcher script(String uri, Step... steps) {
		scripts.put(URI.create(uri), new ConcurrentLinkedDeque<>(List.of(steps)));
		return this;
	}

	@Override
	public long fetch(URI uri, OutputStream out, FetchLimits limits) throws TransportException, FetchResourceException,
			InterruptedException {
		totalCalls.incrementAndGet();
		calls.computeIfAbsent(uri, k -> new AtomicInteger()).incrementAndGet();
		Deque<Step> steps = scripts.get(uri);
		Step step = steps != null ? steps.poll() : null;
		if (step == null) {
			step = fallback;
		}
		try {
			return step.run(uri, out);
		} catch (TransportException | FetchResourceException e) {
			throw e;
		} catch (IOException e) {
			throw new TransportException(TransportException.Kind.IO, e.getMessage(), e);
		}
	}

	public int callsFor(String uri) {
		AtomicInteger count = calls.get(URI.create(uri));
		return count == null ? 0 : count.get();
	}

	public int totalCalls() {
		return totalCalls.get();
	}

	/** Writes the URL itself as body */
	public static Step echo() {
		return (uri, out) -> write(out, uri.toString());
	}

	public static Step body(String content) {
		return (uri, out) -> write(out, content);
	}

	public static Step fail(TransportException.Kind kind) {
		return (uri, out) -> {
			throw new TransportException(kind, "Scripted " + kind + " for " + uri);
		};
	}

	/** Writes part of a body and then fails, like a dropped connection */
	public static Step partialThenFail(String content, TransportException.Kind kind) {
		return (uri, out) -> {
			write(out, content);
			throw new TransportException(kind, "Scripted " + kind + " after partial body for " + uri);
		};
	}

	public static Step resourceFailure() {
		return (uri, out) -> {
			throw new FetchResourceException("Scripted resource failure for " + uri);
		};
	}

	private static long write(OutputStream out, String content) throws IOException {
		byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
		out.write(bytes);
		return bytes.length;
	}
}
