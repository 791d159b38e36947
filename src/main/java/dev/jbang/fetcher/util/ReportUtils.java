package dev.jbang.fetcher.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.jbang.fetcher.model.RunReport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reading and writing of JSON run reports */
public class ReportUtils {

	private static final ObjectMapper readMapper = new ObjectMapper();

	private static final ObjectMapper writeMapper = JsonMapper.builder()
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.build();

	/** Save a run report, replacing an existing file */
	public static void saveReport(Path reportFile, RunReport report) throws IOException {
		Path parent = reportFile.toAbsolutePath().getParent();
		if (parent != null) {
			FileUtils.ensureDirectory(parent);
		}
		try (var writer = Files.newBufferedWriter(reportFile)) {
			writeMapper.writeValue(writer, report);
			writer.write("\n");
		}
	}

	/** Read a run report written by {@link #saveReport(Path, RunReport)} */
	public static RunReport readReport(Path reportFile) throws IOException {
		return readMapper.readValue(reportFile.toFile(), RunReport.class);
	}
}
