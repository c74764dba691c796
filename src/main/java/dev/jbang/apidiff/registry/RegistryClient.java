package dev.jbang.apidiff.registry;

import dev.jbang.apidiff.model.PackageIdentity;
import dev.jbang.apidiff.model.VersionListing;
import java.io.IOException;

/**
 * Resolves package coordinates to downloadable bytes. Implementations must be safe to call from
 * several threads at once.
 */
public interface RegistryClient {

	/**
	 * Download a package version.
	 *
	 * @param identity The package id and version
	 * @return The buffered package archive
	 * @throws PackageNotFoundException if the registry has no such package version
	 * @throws IOException on transport failure
	 * @throws InterruptedException if interrupted while waiting for the registry
	 */
	PackageArchive resolve(PackageIdentity identity) throws IOException, InterruptedException;

	/**
	 * List the published versions of a package.
	 *
	 * @param packageId The {@code groupId:artifactId} coordinate
	 * @return The versions, newest first
	 * @throws PackageNotFoundException if the registry does not know the package
	 * @throws IOException on transport failure
	 * @throws InterruptedException if interrupted while waiting for the registry
	 */
	VersionListing listVersions(String packageId) throws IOException, InterruptedException;
}
