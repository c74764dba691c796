package dev.jbang.apidiff.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One visible type of a package version, flattened to plain data. Instances are created by the
 * surface extractor while the metadata context is still open and hold no reference to it.
 */
@JsonPropertyOrder({
	"full_name",
	"namespace",
	"simple_name",
	"kind",
	"public",
	"base_type",
	"interfaces",
	"deprecated",
	"obsolete_message",
	"methods",
	"properties"
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TypeSurface(
		@JsonProperty("full_name") String fullName,
		@JsonProperty("namespace") String namespace,
		@JsonProperty("simple_name") String simpleName,
		@JsonProperty("kind") TypeKind kind,
		@JsonProperty("public") boolean isPublic,
		@JsonProperty("base_type") String baseTypeName,
		@JsonProperty("interfaces") Set<String> interfaceNames,
		@JsonProperty("deprecated") boolean deprecated,
		@JsonProperty("obsolete_message") String obsoleteMessage,
		@JsonProperty("methods") List<MethodSurface> methods,
		@JsonProperty("properties") Set<String> propertyNames) {

	public TypeSurface {
		if (fullName == null || fullName.isBlank()) {
			throw new IllegalArgumentException("Type full name must not be blank");
		}
		namespace = namespace == null ? "" : namespace;
		interfaceNames = immutableSet(interfaceNames);
		methods = methods == null ? List.of() : List.copyOf(methods);
		propertyNames = immutableSet(propertyNames);
	}

	private static Set<String> immutableSet(Set<String> values) {
		if (values == null || values.isEmpty()) {
			return Set.of();
		}
		return Collections.unmodifiableSet(new LinkedHashSet<>(values));
	}
}
