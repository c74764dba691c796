package dev.jbang.apidiff.archive;

import java.io.IOException;

/** Parses a package's dependency manifest */
public interface ManifestReader {

	/**
	 * @throws IOException if the manifest is not well-formed
	 */
	PackageManifest read(byte[] manifest) throws IOException;
}
