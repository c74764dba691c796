package dev.jbang.apidiff.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Declaration kind of an extracted type */
public enum TypeKind {
	CLASS("class"),
	ABSTRACT_CLASS("abstract class"),
	FINAL_CLASS("final class"),
	INTERFACE("interface"),
	ENUM("enum"),
	RECORD("record"),
	ANNOTATION("annotation");

	private final String label;

	TypeKind(String label) {
		this.label = label;
	}

	@JsonValue
	public String label() {
		return label;
	}

	@JsonCreator
	public static TypeKind fromLabel(String label) {
		for (TypeKind kind : values()) {
			if (kind.label.equals(label)) {
				return kind;
			}
		}
		throw new IllegalArgumentException("Unknown type kind: " + label);
	}

	@Override
	public String toString() {
		return label;
	}
}
