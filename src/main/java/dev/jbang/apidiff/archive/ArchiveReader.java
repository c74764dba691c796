package dev.jbang.apidiff.archive;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.jar.Manifest;

/** Read-only access to the entries of an in-memory archive */
public interface ArchiveReader {

	/** Names of all file entries, in archive order */
	List<String> listEntries(byte[] archive) throws IOException;

	/**
	 * Read the content of one entry.
	 *
	 * @return the entry bytes, or null when the archive has no such entry
	 */
	byte[] openEntry(byte[] archive, String path) throws IOException;

	/** Read the content of every file entry whose name matches, keyed by entry name */
	Map<String, byte[]> readEntries(byte[] archive, Predicate<String> filter) throws IOException;

	/**
	 * Read the jar manifest.
	 *
	 * @return the parsed {@code META-INF/MANIFEST.MF}, or null when the archive has none
	 */
	Manifest readManifest(byte[] archive) throws IOException;
}
