package dev.jbang.apidiff.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Readable rendering of a package's classes, or the reason none could be produced */
@JsonPropertyOrder({"package_id", "version", "type_name", "source", "error"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecompileResult(
		@JsonProperty("package_id") String packageId,
		@JsonProperty("version") String version,
		@JsonProperty("type_name") String typeName,
		@JsonProperty("source") String source,
		@JsonProperty("error") String error) {

	public static DecompileResult success(PackageIdentity identity, String typeName, String source) {
		return new DecompileResult(identity.id(), identity.version(), typeName, source, null);
	}

	public static DecompileResult failure(PackageIdentity identity, String typeName, String error) {
		return new DecompileResult(identity.id(), identity.version(), typeName, null, error);
	}

	public boolean success() {
		return error == null;
	}
}
