package dev.jbang.apidiff.inspector;

import dev.jbang.apidiff.registry.MavenRepositoryClient;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings of a {@link PackageInspector}.
 *
 * @param repositoryUrl base URL of the Maven repository
 * @param repositoryToken bearer token sent to the repository, or null
 * @param scratchRoot directory under which per-call scratch directories are created
 * @param releaseCeiling highest multi-release layer to inspect, or null for the highest present
 * @param connectTimeout HTTP connect timeout
 * @param requestTimeout HTTP request timeout
 * @param maxRetries attempts per download before giving up
 */
public record InspectorConfig(
		String repositoryUrl,
		String repositoryToken,
		Path scratchRoot,
		Integer releaseCeiling,
		Duration connectTimeout,
		Duration requestTimeout,
		int maxRetries) {

	public static final String REPOSITORY_PROPERTY = "apidiff.repository";
	public static final String TOKEN_PROPERTY = "apidiff.repository.token";
	public static final String SCRATCH_DIR_PROPERTY = "apidiff.scratch.dir";

	public InspectorConfig {
		if (repositoryUrl == null || repositoryUrl.isBlank()) {
			throw new IllegalArgumentException("Repository URL must not be blank");
		}
		if (scratchRoot == null) {
			throw new IllegalArgumentException("Scratch root must not be null");
		}
		if (releaseCeiling != null && releaseCeiling < 9) {
			throw new IllegalArgumentException("Release ceiling must be 9 or higher, got " + releaseCeiling);
		}
		if (maxRetries < 1) {
			throw new IllegalArgumentException("Max retries must be at least 1");
		}
	}

	/** Defaults, overridden by the {@code apidiff.*} system properties when set */
	public static InspectorConfig defaults() {
		String token = System.getProperty(TOKEN_PROPERTY);
		return new InspectorConfig(
				System.getProperty(REPOSITORY_PROPERTY, MavenRepositoryClient.MAVEN_CENTRAL),
				token == null || token.isBlank() ? null : token,
				Path.of(System.getProperty(
						SCRATCH_DIR_PROPERTY, Path.of(System.getProperty("java.io.tmpdir"), "pkg-inspector").toString())),
				null,
				Duration.ofSeconds(30),
				Duration.ofMinutes(2),
				3);
	}

	public InspectorConfig withRepositoryUrl(String repositoryUrl) {
		return new InspectorConfig(
				repositoryUrl, repositoryToken, scratchRoot, releaseCeiling, connectTimeout, requestTimeout, maxRetries);
	}

	public InspectorConfig withScratchRoot(Path scratchRoot) {
		return new InspectorConfig(
				repositoryUrl, repositoryToken, scratchRoot, releaseCeiling, connectTimeout, requestTimeout, maxRetries);
	}

	public InspectorConfig withReleaseCeiling(Integer releaseCeiling) {
		return new InspectorConfig(
				repositoryUrl, repositoryToken, scratchRoot, releaseCeiling, connectTimeout, requestTimeout, maxRetries);
	}

	@Override
	public String toString() {
		// Never print the token
		return "InspectorConfig[repositoryUrl=%s, token=%s, scratchRoot=%s, releaseCeiling=%s]"
				.formatted(repositoryUrl, repositoryToken == null ? "none" : "***", scratchRoot, releaseCeiling);
	}
}
