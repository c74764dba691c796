package dev.jbang.apidiff.inspect;

import java.io.IOException;
import java.net.URI;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The class files of the running JDK, read as bytes from the {@code jrt:/} file system. The
 * package index is computed once per process and never changes afterwards; class bytes are read on
 * demand and never cached here, every metadata context keeps its own parsed copies.
 */
public final class PlatformBaseline {
	private static final Logger logger = LoggerFactory.getLogger(PlatformBaseline.class);

	private static final PlatformBaseline EMPTY = new PlatformBaseline(null, Map.of());

	private final FileSystem fileSystem;
	// Internal package name (java/lang) -> system modules defining it
	private final Map<String, List<String>> packageIndex;

	private PlatformBaseline(FileSystem fileSystem, Map<String, List<String>> packageIndex) {
		this.fileSystem = fileSystem;
		this.packageIndex = packageIndex;
	}

	private static class Holder {
		static final PlatformBaseline INSTANCE = load();
	}

	/** The baseline of the running JDK, indexed on first use */
	public static PlatformBaseline system() {
		return Holder.INSTANCE;
	}

	/** A baseline that resolves nothing */
	public static PlatformBaseline empty() {
		return EMPTY;
	}

	private static PlatformBaseline load() {
		try {
			FileSystem jrt = FileSystems.getFileSystem(URI.create("jrt:/"));
			Map<String, List<String>> index = new HashMap<>();
			try (DirectoryStream<Path> packages = Files.newDirectoryStream(jrt.getPath("/packages"))) {
				for (Path pkg : packages) {
					List<String> modules = new ArrayList<>();
					try (DirectoryStream<Path> links = Files.newDirectoryStream(pkg)) {
						for (Path module : links) {
							modules.add(module.getFileName().toString());
						}
					}
					index.put(pkg.getFileName().toString().replace('.', '/'), List.copyOf(modules));
				}
			}
			logger.debug("Indexed {} platform packages", index.size());
			return new PlatformBaseline(jrt, Map.copyOf(index));
		} catch (IOException | RuntimeException e) {
			logger.warn("Platform class files are not available, references to JDK types stay unresolved: {}", e.getMessage());
			return EMPTY;
		}
	}

	/** True when the running JDK defines classes in the package of the given internal name */
	public boolean definesPackageOf(String internalName) {
		return packageIndex.containsKey(packageOf(internalName));
	}

	/**
	 * Read the class file of a platform type.
	 *
	 * @param internalName e.g. {@code java/util/concurrent/Future}
	 * @return the class bytes, or null when the JDK has no such class
	 */
	public byte[] read(String internalName) {
		List<String> modules = packageIndex.get(packageOf(internalName));
		if (modules == null || fileSystem == null) {
			return null;
		}
		for (String module : modules) {
			Path classFile = fileSystem.getPath("/modules", module, internalName + ".class");
			if (Files.isRegularFile(classFile)) {
				try {
					return Files.readAllBytes(classFile);
				} catch (IOException e) {
					logger.debug("Could not read platform class {}: {}", internalName, e.getMessage());
					return null;
				}
			}
		}
		return null;
	}

	private static String packageOf(String internalName) {
		int slash = internalName.lastIndexOf('/');
		return slash < 0 ? "" : internalName.substring(0, slash);
	}
}
