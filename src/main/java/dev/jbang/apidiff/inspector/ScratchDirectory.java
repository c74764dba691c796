package dev.jbang.apidiff.inspector;

import dev.jbang.apidiff.util.FileUtils;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A uniquely named directory owned by one call, removed (best effort) on close */
public final class ScratchDirectory implements Closeable {
	private static final Logger logger = LoggerFactory.getLogger(ScratchDirectory.class);

	/** Directories older than this are considered left over by a crashed process */
	public static final Duration STALE_AGE = Duration.ofDays(1);

	private final Path path;

	private ScratchDirectory(Path path) {
		this.path = path;
	}

	public static ScratchDirectory create(Path root, String label) throws IOException {
		FileUtils.ensureDirectory(root);
		String prefix = label.replaceAll("[^A-Za-z0-9._-]", "_") + "-";
		return new ScratchDirectory(Files.createTempDirectory(root, prefix).toAbsolutePath().normalize());
	}

	/** Remove scratch directories left behind by earlier runs */
	public static int pruneStale(Path root) {
		int removed = FileUtils.deleteStaleDirectories(root, STALE_AGE);
		if (removed > 0) {
			logger.info("Removed {} stale scratch director{} from {}", removed, removed == 1 ? "y" : "ies", root);
		}
		return removed;
	}

	public Path path() {
		return path;
	}

	/**
	 * Write a file below this directory.
	 *
	 * @param relativePath a relative path using {@code /} separators
	 * @throws IOException if the path would escape the directory or the write fails
	 */
	public Path write(String relativePath, byte[] content) throws IOException {
		Path target = path.resolve(relativePath).normalize();
		if (!target.startsWith(path) || target.equals(path)) {
			throw new IOException("Refusing to write outside the scratch directory: " + relativePath);
		}
		FileUtils.ensureDirectory(target.getParent());
		Files.write(target, content);
		return target;
	}

	@Override
	public void close() {
		FileUtils.deleteDirectory(path);
	}
}
