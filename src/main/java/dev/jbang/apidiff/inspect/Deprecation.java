package dev.jbang.apidiff.inspect;

/**
 * Deprecation marker read from a class file, either the {@code Deprecated} attribute or the
 * {@code @java.lang.Deprecated} annotation with its optional elements.
 */
public record Deprecation(boolean deprecated, String since, boolean forRemoval) {
	public static final Deprecation NONE = new Deprecation(false, null, false);

	/** Human readable text composed from the annotation elements, or null when there are none */
	public String message() {
		if (!deprecated) {
			return null;
		}
		StringBuilder sb = new StringBuilder();
		if (since != null && !since.isBlank()) {
			sb.append("since ").append(since.trim());
		}
		if (forRemoval) {
			if (sb.length() > 0) {
				sb.append(", ");
			}
			sb.append("scheduled for removal");
		}
		return sb.length() == 0 ? null : sb.toString();
	}
}
