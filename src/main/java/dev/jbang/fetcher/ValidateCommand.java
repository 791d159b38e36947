package dev.jbang.fetcher;

import dev.jbang.fetcher.reporting.LoggingStatusSink;
import dev.jbang.fetcher.reporting.StatusSink;
import dev.jbang.fetcher.util.UrlListReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Validate command to check a URL list without fetching anything */
@Command(
		name = "validate",
		description = "Check a URL list and report which lines would be fetched",
		mixinStandardHelpOptions = true)
public class ValidateCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-i", "--input"},
			description = "File with one URL per line (default: urls.txt)",
			defaultValue = "urls.txt")
	private Path input;

	@Option(
			names = {"-q", "--quiet"},
			description = "Only print the totals")
	private boolean quiet;

	@Override
	public Integer call() {
		StatusSink sink = new LoggingStatusSink();
		UrlListReader.UrlList urls;
		try {
			urls = UrlListReader.read(input, sink);
		} catch (IOException e) {
			sink.error("Error opening file: " + input + " (" + e + ")");
			return 1;
		}

		if (!quiet) {
			for (int i = 0; i < urls.accepted().size(); i++) {
				logger.info("  {}. {}", i + 1, urls.accepted().get(i));
			}
		}
		logger.info("Accepted: {}", urls.accepted().size());
		logger.info("Rejected: {}", urls.rejected().size());

		if (urls.accepted().isEmpty()) {
			sink.error("No valid URLs found.");
			return 1;
		}
		return 0;
	}
}
