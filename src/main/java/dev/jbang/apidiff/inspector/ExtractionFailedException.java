package dev.jbang.apidiff.inspector;

import dev.jbang.apidiff.model.PackageIdentity;
import java.io.IOException;

/** A package version has class modules, but none of them could be loaded */
public class ExtractionFailedException extends IOException {
	private final PackageIdentity identity;

	public ExtractionFailedException(PackageIdentity identity, int moduleCount) {
		super("None of the %d class module(s) of %s could be loaded".formatted(moduleCount, identity));
		this.identity = identity;
	}

	public PackageIdentity identity() {
		return identity;
	}
}
