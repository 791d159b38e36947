package dev.jbang.fetcher;

import dev.jbang.fetcher.batch.BatchOrchestrator;
import dev.jbang.fetcher.batch.BatchResult;
import dev.jbang.fetcher.batch.FetchConfig;
import dev.jbang.fetcher.fetch.DryRunFetcher;
import dev.jbang.fetcher.fetch.FetchLimits;
import dev.jbang.fetcher.fetch.Fetcher;
import dev.jbang.fetcher.fetch.HttpFetcher;
import dev.jbang.fetcher.model.TaskOutcome;
import dev.jbang.fetcher.reporting.LoggingStatusSink;
import dev.jbang.fetcher.reporting.StatusSink;
import dev.jbang.fetcher.util.ReportUtils;
import dev.jbang.fetcher.util.UrlListReader;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Fetch command to download every URL of a list into numbered files */
@Command(
		name = "fetch",
		description = "Fetch every URL of a list concurrently into page<N> files",
		mixinStandardHelpOptions = true)
public class FetchCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-i", "--input"},
			description = "File with one URL per line (default: urls.txt)",
			defaultValue = "urls.txt")
	private Path input;

	@Option(
			names = {"-o", "--output-dir"},
			description = "Directory to write the fetched pages to (default: current directory)",
			defaultValue = ".")
	private Path outputDir;

	@Option(
			names = {"-e", "--extension"},
			description = "File extension of the written pages (default: html)",
			defaultValue = FetchConfig.DEFAULT_EXTENSION)
	private String extension;

	@Option(
			names = {"-t", "--threads"},
			description = "Number of parallel fetch threads (default: derived from the number of URLs)",
			defaultValue = "-1")
	private int threads;

	@Option(
			names = {"--max-retries"},
			description = "Maximum number of attempts per URL (default: 3)",
			defaultValue = "3")
	private int maxRetries;

	@Option(
			names = {"--backoff"},
			description = "Delay in milliseconds before the second attempt, growing linearly (default: 100)",
			defaultValue = "100")
	private long backoffMillis;

	@Option(
			names = {"--timeout"},
			description = "Maximum time in seconds for a single transfer (default: 30)",
			defaultValue = "30")
	private long timeoutSeconds;

	@Option(
			names = {"--min-speed"},
			description = "Abort a transfer slower than this many bytes per second, 0 disables (default: 100)",
			defaultValue = "100")
	private long minBytesPerSecond;

	@Option(
			names = {"--stall-window"},
			description = "Seconds a transfer may stay below the minimum speed (default: 10)",
			defaultValue = "10")
	private long stallWindowSeconds;

	@Option(
			names = {"--pause"},
			description = "Milliseconds each thread waits between two URLs (default: 100)",
			defaultValue = "100")
	private long pauseMillis;

	@Option(
			names = {"--dry-run"},
			description = "Validate the list and create the pool, but do not fetch anything")
	private boolean dryRun;

	@Option(
			names = {"-r", "--report"},
			description = "Write a JSON report of all outcomes to this file")
	private Path reportFile;

	@Override
	public Integer call() {
		StatusSink sink = new LoggingStatusSink();

		List<URI> urls;
		try {
			urls = UrlListReader.read(input, sink).accepted();
		} catch (IOException e) {
			sink.error("Error opening file: " + input + " (" + e + ")");
			return 1;
		}
		if (urls.isEmpty()) {
			sink.error("No valid URLs found.");
			return 1;
		}

		FetchConfig config;
		try {
			config = buildConfig();
		} catch (IllegalArgumentException e) {
			sink.error("Invalid option: " + e.getMessage());
			return 1;
		}

		logger.info("Page Fetcher");
		logger.info("============");
		logger.info("URL list: {}", input.toAbsolutePath());
		logger.info("Output directory: {}", outputDir.toAbsolutePath());
		logger.info("URLs to fetch: {}", urls.size());
		if (dryRun) {
			logger.info("Dry-run mode enabled - nothing will be fetched");
		}
		logger.info("");

		long startTime = System.currentTimeMillis();
		BatchResult result;
		try (Fetcher fetcher = dryRun ? new DryRunFetcher() : new HttpFetcher(config.limits().timeout())) {
			result = new BatchOrchestrator(config, fetcher, sink).run(urls);
		} catch (IOException e) {
			sink.error("Cannot prepare output directory " + outputDir + " (" + e + ")");
			return 1;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			sink.error("Interrupted while waiting for downloads to complete");
			return 1;
		}

		printSummary(result, startTime);
		sink.info("Download complete! " + result.succeeded() + " pages downloaded.");

		if (reportFile != null) {
			try {
				ReportUtils.saveReport(reportFile, result.toReport());
				logger.info("Report written to {}", reportFile.toAbsolutePath());
			} catch (IOException e) {
				sink.error("Failed to write report " + reportFile + " (" + e + ")");
			}
		}

		// Individual failures do not change the exit code once something was dispatched
		return result.dispatched() > 0 ? 0 : 1;
	}

	private FetchConfig buildConfig() {
		FetchLimits limits = new FetchLimits(
				Duration.ofSeconds(timeoutSeconds), minBytesPerSecond, Duration.ofSeconds(stallWindowSeconds));
		return new FetchConfig(
				outputDir,
				extension,
				threads,
				maxRetries,
				Duration.ofMillis(backoffMillis),
				limits,
				Duration.ofMillis(pauseMillis));
	}

	private void printSummary(BatchResult result, long startTime) {
		logger.info("");
		logger.info("Execution Summary");
		logger.info("=================");
		for (TaskOutcome outcome : result.outcomes()) {
			if (!outcome.success()) {
				logger.info("  {} -> {}", outcome.task().source(), outcome);
			}
		}
		logger.info("Total dispatched: {}", result.dispatched());
		logger.info("Successful: {}", result.succeeded());
		logger.info("Failed: {}", result.failed());
		if (result.dropped() > 0) {
			logger.info("Dropped: {}", result.dropped());
		}
		var duration = (System.currentTimeMillis() - startTime) / 1000.0;
		logger.info("All downloads completed in {} seconds", duration);
	}
}
