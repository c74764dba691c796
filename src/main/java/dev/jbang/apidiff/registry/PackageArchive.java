package dev.jbang.apidiff.registry;

import dev.jbang.apidiff.model.PackageIdentity;
import java.util.Objects;

/**
 * A downloaded package version, fully buffered in memory: the main jar (absent for {@code pom}
 * packaging) and the POM that declares the package's dependencies.
 */
public final class PackageArchive {
	public static final String PACKAGING_POM = "pom";

	private final PackageIdentity identity;
	private final String packaging;
	private final byte[] archiveBytes;
	private final byte[] manifestBytes;

	public PackageArchive(PackageIdentity identity, String packaging, byte[] archiveBytes, byte[] manifestBytes) {
		this.identity = Objects.requireNonNull(identity, "identity");
		this.packaging = packaging == null ? "jar" : packaging;
		this.archiveBytes = archiveBytes;
		this.manifestBytes = Objects.requireNonNull(manifestBytes, "manifestBytes");
	}

	public PackageIdentity identity() {
		return identity;
	}

	public String packaging() {
		return packaging;
	}

	/** True when the package ships a jar that can hold class modules */
	public boolean hasArchive() {
		return archiveBytes != null && archiveBytes.length > 0;
	}

	/** The jar bytes, or an empty array when the package has none */
	public byte[] archiveBytes() {
		return archiveBytes == null ? new byte[0] : archiveBytes;
	}

	public byte[] manifestBytes() {
		return manifestBytes;
	}

	@Override
	public String toString() {
		return "PackageArchive[" + identity + ", packaging=" + packaging + ", "
				+ (hasArchive() ? archiveBytes.length + " bytes" : "no jar") + "]";
	}
}
