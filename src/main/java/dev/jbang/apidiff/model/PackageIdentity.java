package dev.jbang.apidiff.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Registry lookup key: a {@code groupId:artifactId} coordinate plus a version */
@JsonPropertyOrder({"id", "version"})
public record PackageIdentity(@JsonProperty("id") String id, @JsonProperty("version") String version) {

	public PackageIdentity {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("Package id must not be blank");
		}
		if (version == null || version.isBlank()) {
			throw new IllegalArgumentException("Package version must not be blank");
		}
		id = id.trim();
		version = version.trim();
		String[] parts = id.split(":", -1);
		if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
			throw new IllegalArgumentException("Package id must have the form groupId:artifactId, got: " + id);
		}
	}

	public static PackageIdentity of(String id, String version) {
		return new PackageIdentity(id, version);
	}

	public String groupId() {
		return id.substring(0, id.indexOf(':'));
	}

	public String artifactId() {
		return id.substring(id.indexOf(':') + 1);
	}

	@Override
	public String toString() {
		return id + ":" + version;
	}
}
