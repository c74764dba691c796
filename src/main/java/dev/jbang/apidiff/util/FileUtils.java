package dev.jbang.apidiff.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utility class for file operations */
public class FileUtils {
	private static final Logger logger = LoggerFactory.getLogger(FileUtils.class);

	private FileUtils() {
		// Utility class
	}

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	// Recursively delete a directory and all its contents
	// ignoring any exceptions to ensure best effort cleanup
	public static void deleteDirectory(Path directory) {
		if (Files.exists(directory)) {
			try (Stream<Path> paths = Files.walk(directory)) {
				paths.sorted(Comparator.reverseOrder()) // delete children before parents
						.forEach(path -> {
							try {
								Files.delete(path);
							} catch (IOException e) {
								logger.debug("Could not delete {}: {}", path, e.getMessage());
							}
						});
			} catch (IOException e) {
				logger.debug("Could not walk {}: {}", directory, e.getMessage());
			}
		}
	}

	/**
	 * Delete the direct subdirectories of {@code root} last modified before {@code maxAge} ago.
	 *
	 * @return the number of directories removed
	 */
	public static int deleteStaleDirectories(Path root, Duration maxAge) {
		if (!Files.isDirectory(root)) {
			return 0;
		}
		Instant threshold = Instant.now().minus(maxAge);
		List<Path> stale;
		try (Stream<Path> children = Files.list(root)) {
			stale = children.filter(Files::isDirectory)
					.filter(dir -> isOlderThan(dir, threshold))
					.collect(Collectors.toList());
		} catch (IOException e) {
			logger.debug("Could not list {}: {}", root, e.getMessage());
			return 0;
		}
		stale.forEach(FileUtils::deleteDirectory);
		return stale.size();
	}

	private static boolean isOlderThan(Path path, Instant threshold) {
		try {
			FileTime modified = Files.getLastModifiedTime(path);
			return modified.toInstant().isBefore(threshold);
		} catch (IOException e) {
			// Treat unreadable entries as fresh, someone may still be using them
			return false;
		}
	}
}
