package dev.jbang.apidiff.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/** Versions published for a package, newest first */
@JsonPropertyOrder({"package_id", "latest", "latest_stable", "versions"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VersionListing(
		@JsonProperty("package_id") String packageId,
		@JsonProperty("latest") String latest,
		@JsonProperty("latest_stable") String latestStable,
		@JsonProperty("versions") List<String> versions) {

	public VersionListing {
		versions = versions == null ? List.of() : List.copyOf(versions);
	}
}
