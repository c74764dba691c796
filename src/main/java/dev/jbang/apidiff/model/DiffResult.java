package dev.jbang.apidiff.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Result of comparing two versions of a package */
@JsonPropertyOrder({"package_id", "from_version", "to_version", "changes"})
public record DiffResult(
		@JsonProperty("package_id") String packageId,
		@JsonProperty("from_version") String fromVersion,
		@JsonProperty("to_version") String toVersion,
		@JsonProperty("changes") ChangeSet changeSet) {}
