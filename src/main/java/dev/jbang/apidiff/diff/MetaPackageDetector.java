package dev.jbang.apidiff.diff;

import dev.jbang.apidiff.archive.ManifestReader;
import dev.jbang.apidiff.archive.ModuleCandidate;
import dev.jbang.apidiff.model.ChangeSet;
import dev.jbang.apidiff.model.SurfaceResult;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recognizes packages that ship no classes and only aggregate dependencies, such as BOM-like
 * {@code pom} artifacts or empty jars.
 */
public class MetaPackageDetector {
	private static final Logger logger = LoggerFactory.getLogger(MetaPackageDetector.class);

	private final ManifestReader manifestReader;

	public MetaPackageDetector(ManifestReader manifestReader) {
		this.manifestReader = manifestReader;
	}

	public boolean isMetaPackage(List<ModuleCandidate> candidates) {
		return candidates.isEmpty();
	}

	/**
	 * Classify a package version and, when it is a meta-package, record it and its dependencies in
	 * the change-set.
	 *
	 * @param candidates the class modules of the version
	 * @param manifest the version's POM
	 * @return true when the version is a meta-package and the type diff must be skipped
	 */
	public boolean detect(List<ModuleCandidate> candidates, byte[] manifest, ChangeSet changes) {
		if (!isMetaPackage(candidates)) {
			return false;
		}
		changes.metaPackage(true);
		try {
			changes.metaDependencies().addAll(dependencies(manifest));
		} catch (IOException e) {
			logger.warn("Could not read dependencies of meta-package: {}", e.getMessage());
			changes.appendComparisonError(dependencyError(e));
		}
		logger.info("Meta-package with {} dependencies", changes.metaDependencies().size());
		return true;
	}

	/**
	 * Same as {@link #detect(List, byte[], ChangeSet)} for a surface extracted earlier, which
	 * carries its own meta-package marker.
	 */
	public boolean detect(SurfaceResult surface, ChangeSet changes) {
		if (!surface.metaPackage()) {
			return false;
		}
		changes.metaPackage(true);
		changes.metaDependencies().addAll(surface.metaDependencies());
		logger.info("Meta-package with {} dependencies", changes.metaDependencies().size());
		return true;
	}

	/** The {@code groupId:artifactId} of every dependency the POM declares */
	public List<String> dependencies(byte[] manifest) throws IOException {
		return manifestReader.read(manifest).dependencies();
	}

	public static String dependencyError(IOException e) {
		return "Could not read package dependencies: " + e.getMessage();
	}
}
