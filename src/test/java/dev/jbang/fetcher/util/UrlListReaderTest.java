package dev.jbang.fetcher.util;

import static org.assertj.core.api.Assertions.*;

import dev.jbang.fetcher.reporting.RecordingStatusSink;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UrlListReaderTest {

	@TempDir
	Path tempDir;

	@Test
	void testAcceptsHttpAndHttpsUrls() {
		assertThat(UrlListReader.toUri("http://example.com")).isEqualTo(URI.create("http://example.com"));
		assertThat(UrlListReader.toUri("https://example.com/")).isNotNull();
		assertThat(UrlListReader.toUri("https://www.example.co.uk/a/b/c.html?x=1&y=2#top"))
				.isNotNull();
		assertThat(UrlListReader.toUri("https://a.test/x")).isNotNull();
		assertThat(UrlListReader.toUri("http://localhost:8080/status")).isNotNull();
		assertThat(UrlListReader.toUri("http://127.0.0.1:9000/")).isNotNull();
	}

	@Test
	void testRejectsEverythingElse() {
		assertThat(UrlListReader.toUri("not a url")).isNull();
		assertThat(UrlListReader.toUri("ftp://example.com/file")).isNull();
		assertThat(UrlListReader.toUri("https://")).isNull();
		assertThat(UrlListReader.toUri("https://exa mple.com")).isNull();
		assertThat(UrlListReader.toUri("example.com")).isNull();
		assertThat(UrlListReader.toUri("https://example.com/a|b")).isNull();
	}

	@Test
	void testParseTrimsAndSkipsInvalidLines() {
		// Given
		RecordingStatusSink sink = new RecordingStatusSink();
		List<String> lines = List.of("  https://a.test/x  ", "not a url", "", "   ", "\thttps://b.test/y");

		// When
		UrlListReader.UrlList urls = UrlListReader.parse(lines, sink);

		// Then
		assertThat(urls.accepted()).containsExactly(URI.create("https://a.test/x"), URI.create("https://b.test/y"));
		assertThat(urls.rejected()).containsExactly("not a url");
		assertThat(sink.lines()).containsExactly("Invalid URL skipped: not a url");
	}

	@Test
	void testReadFile() throws Exception {
		// Given
		Path file = tempDir.resolve("urls.txt");
		Files.writeString(file, "https://one.example.org/\nbroken\nhttps://two.example.org/page\n");
		RecordingStatusSink sink = new RecordingStatusSink();

		// When
		UrlListReader.UrlList urls = UrlListReader.read(file, sink);

		// Then
		assertThat(urls.accepted()).hasSize(2);
		assertThat(urls.rejected()).containsExactly("broken");
	}

	@Test
	void testMissingFile() {
		RecordingStatusSink sink = new RecordingStatusSink();

		assertThatThrownBy(() -> UrlListReader.read(tempDir.resolve("missing.txt"), sink))
				.isInstanceOf(IOException.class);
		assertThat(sink.lines()).isEmpty();
	}

	@Test
	void testOnlyInvalidLines() {
		RecordingStatusSink sink = new RecordingStatusSink();

		UrlListReader.UrlList urls = UrlListReader.parse(List.of("foo", "bar"), sink);

		assertThat(urls.accepted()).isEmpty();
		assertThat(urls.rejected()).hasSize(2);
	}
}
