package dev.jbang.apidiff.archive;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.jar.JarFile;
import java.util.jar.Manifest;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads jar archives held in memory using Commons Compress */
public class JarArchiveReader implements ArchiveReader {
	private static final Logger logger = LoggerFactory.getLogger(JarArchiveReader.class);

	@Override
	public List<String> listEntries(byte[] archive) throws IOException {
		List<String> names = new ArrayList<>();
		try (ZipArchiveInputStream zis = open(archive)) {
			ZipArchiveEntry entry;
			while ((entry = zis.getNextEntry()) != null) {
				if (!entry.isDirectory()) {
					names.add(entry.getName());
				}
			}
		}
		return names;
	}

	@Override
	public byte[] openEntry(byte[] archive, String path) throws IOException {
		return readEntries(archive, path::equals).get(path);
	}

	@Override
	public Map<String, byte[]> readEntries(byte[] archive, Predicate<String> filter) throws IOException {
		Map<String, byte[]> result = new LinkedHashMap<>();
		try (ZipArchiveInputStream zis = open(archive)) {
			ZipArchiveEntry entry;
			while ((entry = zis.getNextEntry()) != null) {
				String name = entry.getName();
				if (entry.isDirectory() || !filter.test(name) || result.containsKey(name)) {
					continue;
				}
				if (!zis.canReadEntryData(entry)) {
					logger.warn("Unsupported compression for entry {}, skipping", name);
					continue;
				}
				result.put(name, zis.readAllBytes());
			}
		}
		return result;
	}

	@Override
	public Manifest readManifest(byte[] archive) throws IOException {
		byte[] content = openEntry(archive, JarFile.MANIFEST_NAME);
		if (content == null) {
			return null;
		}
		return new Manifest(new ByteArrayInputStream(content));
	}

	private static ZipArchiveInputStream open(byte[] archive) {
		return new ZipArchiveInputStream(
				new ByteArrayInputStream(archive), StandardCharsets.UTF_8.name(), true, true);
	}
}
