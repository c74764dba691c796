package dev.jbang.apidiff.archive;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.jar.Attributes;
import java.util.jar.Manifest;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the class files of a jar that make up its API, one per class name. When the jar is a
 * multi-release jar the entry from the highest release layer wins, optionally capped at a release
 * ceiling. Stateless and safe to share between threads.
 */
public class ArchiveExtractor {
	private static final Logger logger = LoggerFactory.getLogger(ArchiveExtractor.class);

	static final String CLASS_SUFFIX = ".class";
	static final String VERSIONS_PREFIX = "META-INF/versions/";
	private static final Attributes.Name MULTI_RELEASE = new Attributes.Name("Multi-Release");

	private final ArchiveReader reader;
	private final Integer releaseCeiling;

	public ArchiveExtractor(ArchiveReader reader) {
		this(reader, null);
	}

	/**
	 * @param reader Access to the jar entries
	 * @param releaseCeiling Highest multi-release layer to consider, or null for no limit
	 */
	public ArchiveExtractor(ArchiveReader reader, Integer releaseCeiling) {
		this.reader = reader;
		this.releaseCeiling = releaseCeiling;
	}

	/**
	 * List the class files to inspect, sorted by class name. A jar without classes yields an empty
	 * list.
	 */
	public List<ModuleCandidate> extract(byte[] jar) throws IOException {
		if (jar == null || jar.length == 0) {
			return List.of();
		}
		boolean multiRelease = isMultiRelease(reader.readManifest(jar));
		Map<String, ModuleCandidate> selected = new TreeMap<>();
		for (String entry : reader.listEntries(jar)) {
			ModuleCandidate candidate = classify(entry, multiRelease);
			if (candidate == null || !candidate.target().fitsCeiling(releaseCeiling)) {
				continue;
			}
			selected.merge(candidate.moduleName(), candidate, ArchiveExtractor::preferred);
		}
		logger.debug("Selected {} class module(s), multi-release: {}", selected.size(), multiRelease);
		return new ArrayList<>(selected.values());
	}

	/** Read the bytes of the given candidates, keyed by module name in candidate order */
	public Map<String, byte[]> read(byte[] jar, List<ModuleCandidate> candidates) throws IOException {
		Set<String> paths = candidates.stream().map(ModuleCandidate::entryPath).collect(Collectors.toSet());
		Map<String, byte[]> byPath = reader.readEntries(jar, paths::contains);
		Map<String, byte[]> result = new LinkedHashMap<>();
		for (ModuleCandidate candidate : candidates) {
			byte[] content = byPath.get(candidate.entryPath());
			if (content != null) {
				result.put(candidate.moduleName(), content);
			}
		}
		return result;
	}

	/**
	 * Decide whether a jar entry is a class module.
	 *
	 * @return the candidate, or null when the entry is not part of the API
	 */
	static ModuleCandidate classify(String entryPath, boolean multiRelease) {
		if (!entryPath.endsWith(CLASS_SUFFIX)) {
			return null;
		}
		String moduleName = entryPath;
		RuntimeTarget target = RuntimeTarget.BASE;
		if (entryPath.startsWith("META-INF/")) {
			if (!multiRelease || !entryPath.startsWith(VERSIONS_PREFIX)) {
				return null;
			}
			String rest = entryPath.substring(VERSIONS_PREFIX.length());
			int slash = rest.indexOf('/');
			if (slash <= 0) {
				return null;
			}
			int release;
			try {
				release = Integer.parseInt(rest.substring(0, slash));
			} catch (NumberFormatException e) {
				return null;
			}
			if (release < 9) {
				// Layers below 9 are not honoured by the JDK
				return null;
			}
			moduleName = rest.substring(slash + 1);
			target = new RuntimeTarget(release);
		}
		String simpleFile = moduleName.substring(moduleName.lastIndexOf('/') + 1);
		if (simpleFile.equals("module-info.class") || simpleFile.equals("package-info.class")) {
			return null;
		}
		return new ModuleCandidate(moduleName, entryPath, target);
	}

	static boolean isMultiRelease(Manifest manifest) {
		if (manifest == null) {
			return false;
		}
		String value = manifest.getMainAttributes().getValue(MULTI_RELEASE);
		return value != null && value.trim().equalsIgnoreCase("true");
	}

	private static ModuleCandidate preferred(ModuleCandidate a, ModuleCandidate b) {
		return Comparator.comparing(ModuleCandidate::target).compare(a, b) >= 0 ? a : b;
	}
}
