package dev.jbang.apidiff.util;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileUtilsTest {

	@TempDir
	Path tempDir;

	@Test
	void testDeleteDirectory() throws Exception {
		// Given
		Path dir = tempDir.resolve("scratch");
		Files.createDirectories(dir.resolve("com/example"));
		Files.writeString(dir.resolve("com/example/Widget.class"), "x");

		// When
		FileUtils.deleteDirectory(dir);

		// Then
		assertThat(dir).doesNotExist();
	}

	@Test
	void testDeleteMissingDirectoryIsNoOp() {
		// When/Then
		assertThatCode(() -> FileUtils.deleteDirectory(tempDir.resolve("missing")))
				.doesNotThrowAnyException();
	}

	@Test
	void testDeleteStaleDirectories() throws Exception {
		// Given
		Path stale = Files.createDirectory(tempDir.resolve("stale"));
		Path fresh = Files.createDirectory(tempDir.resolve("fresh"));
		Path file = Files.writeString(tempDir.resolve("old-file.txt"), "keep");
		FileTime twoDaysAgo = FileTime.from(Instant.now().minus(Duration.ofDays(2)));
		Files.setLastModifiedTime(stale, twoDaysAgo);
		Files.setLastModifiedTime(file, twoDaysAgo);

		// When
		int removed = FileUtils.deleteStaleDirectories(tempDir, Duration.ofDays(1));

		// Then
		assertThat(removed).isEqualTo(1);
		assertThat(stale).doesNotExist();
		assertThat(fresh).exists();
		assertThat(file).exists();
	}

	@Test
	void testDeleteStaleDirectoriesMissingRoot() {
		// When/Then
		assertThat(FileUtils.deleteStaleDirectories(tempDir.resolve("missing"), Duration.ofDays(1)))
				.isZero();
	}
}
