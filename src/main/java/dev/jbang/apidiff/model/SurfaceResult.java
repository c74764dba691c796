package dev.jbang.apidiff.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Extracted API surface of one package version. A version without class modules is a
 * meta-package: it has no types and lists the dependencies it declares instead.
 */
@JsonPropertyOrder({"package_id", "version", "meta_package", "meta_dependencies", "types", "error"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SurfaceResult(
		@JsonProperty("package_id") String packageId,
		@JsonProperty("version") String version,
		@JsonProperty("meta_package") boolean metaPackage,
		@JsonProperty("meta_dependencies") List<String> metaDependencies,
		@JsonProperty("types") List<TypeSurface> types,
		@JsonProperty("error") String error) {

	public SurfaceResult {
		metaDependencies = metaDependencies == null ? List.of() : List.copyOf(metaDependencies);
		types = types == null ? List.of() : List.copyOf(types);
	}

	public SurfaceResult(String packageId, String version, List<TypeSurface> types, String error) {
		this(packageId, version, false, List.of(), types, error);
	}

	public static SurfaceResult success(PackageIdentity identity, List<TypeSurface> types) {
		return new SurfaceResult(identity.id(), identity.version(), types, null);
	}

	public static SurfaceResult partial(PackageIdentity identity, List<TypeSurface> types, String error) {
		return new SurfaceResult(identity.id(), identity.version(), types, error);
	}

	/**
	 * @param error why the dependencies could not be read, or null
	 */
	public static SurfaceResult metaPackage(PackageIdentity identity, List<String> dependencies, String error) {
		return new SurfaceResult(identity.id(), identity.version(), true, dependencies, List.of(), error);
	}
}
