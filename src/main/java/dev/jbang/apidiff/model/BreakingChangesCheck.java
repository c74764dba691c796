package dev.jbang.apidiff.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Short yes/no summary of a version comparison */
@JsonPropertyOrder({
	"package_id",
	"from_version",
	"to_version",
	"has_breaking_changes",
	"removed_types",
	"removed_methods",
	"async_migrations",
	"has_new_features",
	"added_types",
	"added_methods"
})
public record BreakingChangesCheck(
		@JsonProperty("package_id") String packageId,
		@JsonProperty("from_version") String fromVersion,
		@JsonProperty("to_version") String toVersion,
		@JsonProperty("has_breaking_changes") boolean hasBreakingChanges,
		@JsonProperty("removed_types") int removedTypesCount,
		@JsonProperty("removed_methods") int removedMethodsCount,
		@JsonProperty("async_migrations") int asyncMigrationsCount,
		@JsonProperty("has_new_features") boolean hasNewFeatures,
		@JsonProperty("added_types") int addedTypesCount,
		@JsonProperty("added_methods") int addedMethodsCount) {

	public static BreakingChangesCheck from(DiffResult result) {
		ChangeSet changes = result.changeSet();
		return new BreakingChangesCheck(
				result.packageId(),
				result.fromVersion(),
				result.toVersion(),
				changes.hasBreakingChanges(),
				changes.removedTypes().size(),
				changes.removedMethods().size(),
				changes.asyncMigrations().size(),
				changes.hasAdditions(),
				changes.addedTypes().size(),
				changes.addedMethods().size());
	}

	@Override
	public String toString() {
		return hasBreakingChanges
				? "BREAKING (%d types removed, %d methods removed, %d sync to async migrations)"
						.formatted(removedTypesCount, removedMethodsCount, asyncMigrationsCount)
				: "COMPATIBLE (%d types added, %d methods added)".formatted(addedTypesCount, addedMethodsCount);
	}
}
