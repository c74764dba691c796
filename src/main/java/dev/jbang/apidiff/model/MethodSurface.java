package dev.jbang.apidiff.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * A method of an extracted type, flattened to plain data.
 *
 * <p>The {@link #signature()} is the method's identity when matching across versions. It contains
 * the name and the erased parameter types only, so two methods that differ in their return type
 * alone are considered the same method.
 */
@JsonPropertyOrder({
	"name",
	"signature",
	"return_type",
	"parameter_types",
	"static",
	"async",
	"deprecated",
	"obsolete_message"
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MethodSurface(
		@JsonProperty("name") String name,
		@JsonProperty("signature") String signature,
		@JsonProperty("return_type") String returnType,
		@JsonProperty("parameter_types") List<String> parameterTypes,
		@JsonProperty("static") boolean isStatic,
		@JsonProperty("async") boolean isAsync,
		@JsonProperty("deprecated") boolean deprecated,
		@JsonProperty("obsolete_message") String obsoleteMessage) {

	public MethodSurface {
		parameterTypes = parameterTypes == null ? List.of() : List.copyOf(parameterTypes);
		if (signature == null) {
			signature = signatureOf(name, parameterTypes);
		}
	}

	/** Build the identity string {@code name(type1,type2)} */
	public static String signatureOf(String name, List<String> parameterTypes) {
		return name + "(" + String.join(",", parameterTypes) + ")";
	}
}
