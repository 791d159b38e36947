package dev.jbang.fetcher;

import static org.assertj.core.api.Assertions.*;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import dev.jbang.fetcher.model.RunReport;
import dev.jbang.fetcher.util.ReportUtils;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

@Timeout(60)
class FetchCommandTest {

	@TempDir
	Path tempDir;

	private HttpServer server;
	private ExecutorService serverExecutor;

	@BeforeEach
	void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
		serverExecutor = Executors.newCachedThreadPool();
		server.setExecutor(serverExecutor);
		server.createContext("/a", exchange -> respond(exchange, 200, "page a"));
		server.createContext("/b", exchange -> respond(exchange, 200, "page b"));
		server.createContext("/gone", exchange -> respond(exchange, 404, "gone"));
		server.start();
	}

	@AfterEach
	void tearDown() {
		server.stop(0);
		serverExecutor.shutdownNow();
	}

	@Test
	void testFetchWritesNumberedPages() throws Exception {
		// Given
		Path input = writeList(base() + "/a", "not a url", "", base() + "/gone", base() + "/b");
		Path outputDir = tempDir.resolve("out");
		Path report = tempDir.resolve("report.json");

		// When
		int exitCode = execute(
				"fetch", "-i", input.toString(), "-o", outputDir.toString(), "--backoff", "0", "--pause", "0", "-r",
				report.toString());

		// Then
		assertThat(exitCode).isEqualTo(0);
		assertThat(outputDir.resolve("page1.html")).hasContent("page a");
		assertThat(outputDir.resolve("page2.html")).exists();
		assertThat(outputDir.resolve("page3.html")).hasContent("page b");
		assertThat(outputDir.resolve("page4.html")).doesNotExist();

		RunReport runReport = ReportUtils.readReport(report);
		assertThat(runReport.dispatched()).isEqualTo(3);
		assertThat(runReport.succeeded()).isEqualTo(2);
		assertThat(runReport.failed()).isEqualTo(1);
		assertThat(runReport.tasks().get(1).success()).isFalse();
		assertThat(runReport.tasks().get(1).attempts()).isEqualTo(3);
		assertThat(runReport.tasks().get(1).error()).contains("404");
	}

	@Test
	void testCustomExtensionAndThreads() throws Exception {
		// Given
		Path input = writeList(base() + "/a", base() + "/b");

		// When
		int exitCode = execute(
				"fetch", "-i", input.toString(), "-o", tempDir.toString(), "-e", "txt", "-t", "1", "--backoff", "0",
				"--pause", "0");

		// Then
		assertThat(exitCode).isEqualTo(0);
		assertThat(tempDir.resolve("page1.txt")).hasContent("page a");
		assertThat(tempDir.resolve("page2.txt")).hasContent("page b");
	}

	@Test
	void testAllFailuresStillExitZero() throws Exception {
		Path input = writeList(base() + "/gone");

		int exitCode = execute(
				"fetch", "-i", input.toString(), "-o", tempDir.toString(), "--max-retries", "1", "--pause", "0");

		assertThat(exitCode).isEqualTo(0);
	}

	@Test
	void testMissingInputFile() {
		int exitCode = execute("fetch", "-i", tempDir.resolve("missing.txt").toString(), "-o", tempDir.toString());

		assertThat(exitCode).isEqualTo(1);
	}

	@Test
	void testNoValidUrls() throws Exception {
		Path input = writeList("not a url", "ftp://example.com/file");

		int exitCode = execute("fetch", "-i", input.toString(), "-o", tempDir.resolve("out").toString());

		assertThat(exitCode).isEqualTo(1);
		assertThat(tempDir.resolve("out")).doesNotExist();
	}

	@Test
	void testInvalidOption() throws Exception {
		Path input = writeList(base() + "/a");

		int exitCode = execute("fetch", "-i", input.toString(), "-o", tempDir.toString(), "--max-retries", "0");

		assertThat(exitCode).isEqualTo(1);
		assertThat(tempDir.resolve("page1.html")).doesNotExist();
	}

	@Test
	void testDryRun() throws Exception {
		// Given
		Path input = writeList(base() + "/a", base() + "/b");

		// When
		int exitCode = execute("fetch", "-i", input.toString(), "-o", tempDir.toString(), "--dry-run", "--pause", "0");

		// Then
		assertThat(exitCode).isEqualTo(0);
		assertThat(tempDir.resolve("page1.html")).isEmptyFile();
		assertThat(tempDir.resolve("page2.html")).isEmptyFile();
	}

	@Test
	void testValidateCommand() throws Exception {
		Path valid = writeList(base() + "/a", "nope");
		Path invalid = tempDir.resolve("invalid.txt");
		Files.writeString(invalid, "nope\n");

		assertThat(execute("validate", "-i", valid.toString())).isEqualTo(0);
		assertThat(execute("validate", "-i", valid.toString(), "-q")).isEqualTo(0);
		assertThat(execute("validate", "-i", invalid.toString())).isEqualTo(1);
		assertThat(execute("validate", "-i", tempDir.resolve("missing.txt").toString()))
				.isEqualTo(1);
	}

	@Test
	void testRootCommandPrintsUsage() {
		assertThat(execute()).isEqualTo(0);
	}

	private int execute(String... args) {
		return new CommandLine(new Main()).execute(args);
	}

	private String base() {
		return "http://127.0.0.1:" + server.getAddress().getPort();
	}

	private Path writeList(String... lines) throws IOException {
		Path file = tempDir.resolve("urls.txt");
		Files.write(file, List.of(lines), StandardCharsets.UTF_8);
		return file;
	}

	private static void respond(HttpExchange exchange, int status, String body) throws IOException {
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}
}
