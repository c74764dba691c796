package dev.jbang.apidiff.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;

/** Deprecated APIs of one package version */
@JsonPropertyOrder({"package_id", "version", "items", "error"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObsoleteApisResult(
		@JsonProperty("package_id") String packageId,
		@JsonProperty("version") String version,
		@JsonProperty("items") List<ObsoleteItem> items,
		@JsonProperty("error") String error) {

	public ObsoleteApisResult {
		items = items == null ? List.of() : List.copyOf(items);
	}

	/** Collect deprecated types first, then deprecated methods, in surface order */
	public static ObsoleteApisResult from(SurfaceResult surface) {
		List<ObsoleteItem> types = new ArrayList<>();
		List<ObsoleteItem> methods = new ArrayList<>();
		for (TypeSurface type : surface.types()) {
			if (type.deprecated()) {
				types.add(new ObsoleteItem(type.fullName(), ObsoleteItem.KIND_TYPE, type.obsoleteMessage()));
			}
			for (MethodSurface method : type.methods()) {
				if (method.deprecated()) {
					methods.add(new ObsoleteItem(
							type.fullName() + "." + method.signature(),
							ObsoleteItem.KIND_METHOD,
							method.obsoleteMessage()));
				}
			}
		}
		types.addAll(methods);
		return new ObsoleteApisResult(surface.packageId(), surface.version(), types, surface.error());
	}
}
