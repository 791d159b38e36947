package dev.jbang.fetcher.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Utility class for file operations */
public class FileUtils {

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/** Name of the file holding the n-th fetched page, e.g. {@code page3.html} */
	public static String artifactName(int index, String extension) {
		if (index < 1) {
			throw new IllegalArgumentException("index must be 1 or larger, got " + index);
		}
		return "page" + index + "." + extension;
	}
}
