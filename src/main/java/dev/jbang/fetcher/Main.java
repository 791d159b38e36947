package dev.jbang.fetcher;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "page-fetcher",
		version = "1.0.0",
		description = "Fetches a list of URLs concurrently into numbered files",
		mixinStandardHelpOptions = true,
		subcommands = {FetchCommand.class, ValidateCommand.class})
public class Main implements Callable<Integer> {

	@Spec
	CommandSpec spec;

	@Override
	public Integer call() {
		spec.commandLine().usage(System.out);
		return 0;
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
