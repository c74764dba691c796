package dev.jbang.apidiff.registry;

import dev.jbang.apidiff.model.PackageIdentity;
import java.io.IOException;

/** The requested package or version does not exist in the registry */
public class PackageNotFoundException extends IOException {
	private final String packageId;
	private final String version;

	public PackageNotFoundException(PackageIdentity identity) {
		this(identity.id(), identity.version());
	}

	public PackageNotFoundException(String packageId, String version) {
		super(version == null
				? "Package not found: " + packageId
				: "Package version not found: " + packageId + ":" + version);
		this.packageId = packageId;
		this.version = version;
	}

	public String packageId() {
		return packageId;
	}

	public String version() {
		return version;
	}
}
