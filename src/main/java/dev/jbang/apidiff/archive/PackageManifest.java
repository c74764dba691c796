package dev.jbang.apidiff.archive;

import java.util.List;

/**
 * The parts of a POM the inspector relies on.
 *
 * @param dependencies declared {@code groupId:artifactId} dependencies in declaration order,
 *     without duplicates and without test-scoped entries
 */
public record PackageManifest(
		String groupId, String artifactId, String version, String packaging, List<String> dependencies) {

	public PackageManifest {
		packaging = packaging == null ? "jar" : packaging;
		dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
	}
}
