package dev.jbang.apidiff.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** A deprecated type or method, with its deprecation message when one was declared */
@JsonPropertyOrder({"name", "kind", "message"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObsoleteItem(
		@JsonProperty("name") String name,
		@JsonProperty("kind") String kind,
		@JsonProperty("message") String message) {

	public static final String KIND_TYPE = "type";
	public static final String KIND_METHOD = "method";
}
