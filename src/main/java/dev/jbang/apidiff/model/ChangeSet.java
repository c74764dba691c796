package dev.jbang.apidiff.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Mutable accumulator of API changes between two versions of a package. Buckets keep insertion
 * order and are independent evidence: the same type may show up in more than one of them.
 */
@JsonPropertyOrder({
	"has_breaking_changes",
	"has_additions",
	"removed_types",
	"added_types",
	"removed_methods",
	"added_methods",
	"removed_properties",
	"added_properties",
	"removed_interfaces",
	"added_interfaces",
	"base_class_changes",
	"obsolete_types",
	"obsolete_methods",
	"async_migrations",
	"namespace_changes",
	"meta_package",
	"meta_dependencies",
	"comparison_error"
})
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChangeSet {
	@JsonProperty("removed_types")
	private final List<String> removedTypes = new ArrayList<>();

	@JsonProperty("added_types")
	private final List<String> addedTypes = new ArrayList<>();

	@JsonProperty("removed_methods")
	private final List<String> removedMethods = new ArrayList<>();

	@JsonProperty("added_methods")
	private final List<String> addedMethods = new ArrayList<>();

	@JsonProperty("removed_properties")
	private final List<String> removedProperties = new ArrayList<>();

	@JsonProperty("added_properties")
	private final List<String> addedProperties = new ArrayList<>();

	@JsonProperty("removed_interfaces")
	private final List<String> removedInterfaces = new ArrayList<>();

	@JsonProperty("added_interfaces")
	private final List<String> addedInterfaces = new ArrayList<>();

	@JsonProperty("base_class_changes")
	private final List<String> baseClassChanges = new ArrayList<>();

	@JsonProperty("obsolete_types")
	private final List<String> obsoleteTypes = new ArrayList<>();

	@JsonProperty("obsolete_methods")
	private final List<String> obsoleteMethods = new ArrayList<>();

	@JsonProperty("async_migrations")
	private final List<String> asyncMigrations = new ArrayList<>();

	@JsonProperty("namespace_changes")
	private final List<String> namespaceChanges = new ArrayList<>();

	@JsonProperty("meta_package")
	private boolean metaPackage;

	@JsonProperty("meta_dependencies")
	private final List<String> metaDependencies = new ArrayList<>();

	@JsonProperty("comparison_error")
	private String comparisonError;

	public List<String> removedTypes() {
		return removedTypes;
	}

	public List<String> addedTypes() {
		return addedTypes;
	}

	public List<String> removedMethods() {
		return removedMethods;
	}

	public List<String> addedMethods() {
		return addedMethods;
	}

	public List<String> removedProperties() {
		return removedProperties;
	}

	public List<String> addedProperties() {
		return addedProperties;
	}

	public List<String> removedInterfaces() {
		return removedInterfaces;
	}

	public List<String> addedInterfaces() {
		return addedInterfaces;
	}

	public List<String> baseClassChanges() {
		return baseClassChanges;
	}

	public List<String> obsoleteTypes() {
		return obsoleteTypes;
	}

	public List<String> obsoleteMethods() {
		return obsoleteMethods;
	}

	public List<String> asyncMigrations() {
		return asyncMigrations;
	}

	public List<String> namespaceChanges() {
		return namespaceChanges;
	}

	public boolean isMetaPackage() {
		return metaPackage;
	}

	public ChangeSet metaPackage(boolean metaPackage) {
		this.metaPackage = metaPackage;
		return this;
	}

	public List<String> metaDependencies() {
		return metaDependencies;
	}

	public String comparisonError() {
		return comparisonError;
	}

	public ChangeSet comparisonError(String comparisonError) {
		this.comparisonError = comparisonError;
		return this;
	}

	/** Append an advisory error, keeping any message recorded before */
	public ChangeSet appendComparisonError(String message) {
		if (message == null || message.isBlank()) {
			return this;
		}
		this.comparisonError = comparisonError == null ? message : comparisonError + "; " + message;
		return this;
	}

	@JsonProperty(value = "has_breaking_changes", access = JsonProperty.Access.READ_ONLY)
	public boolean hasBreakingChanges() {
		return !removedTypes.isEmpty()
				|| !removedMethods.isEmpty()
				|| !removedProperties.isEmpty()
				|| !removedInterfaces.isEmpty()
				|| !baseClassChanges.isEmpty()
				|| !asyncMigrations.isEmpty();
	}

	@JsonProperty(value = "has_additions", access = JsonProperty.Access.READ_ONLY)
	public boolean hasAdditions() {
		return !addedTypes.isEmpty()
				|| !addedMethods.isEmpty()
				|| !addedProperties.isEmpty()
				|| !addedInterfaces.isEmpty();
	}

	public boolean hasDeprecations() {
		return !obsoleteTypes.isEmpty() || !obsoleteMethods.isEmpty();
	}

	/** True when no bucket holds an entry, the package is not a meta-package and no error was recorded */
	@JsonIgnore
	public boolean isEmpty() {
		return typeLevelBuckets().allMatch(List::isEmpty) && !metaPackage && comparisonError == null;
	}

	/** All buckets that describe type-level changes, in report order */
	public Stream<List<String>> typeLevelBuckets() {
		return Stream.of(
				removedTypes,
				addedTypes,
				removedMethods,
				addedMethods,
				removedProperties,
				addedProperties,
				removedInterfaces,
				addedInterfaces,
				baseClassChanges,
				obsoleteTypes,
				obsoleteMethods,
				asyncMigrations,
				namespaceChanges);
	}
}
