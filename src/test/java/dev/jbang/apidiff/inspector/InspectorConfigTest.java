package dev.jbang.apidiff.inspector;

import static org.assertj.core.api.Assertions.*;

import dev.jbang.apidiff.registry.MavenRepositoryClient;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class InspectorConfigTest {

	private static InspectorConfig config(String url, String token, Path scratch, Integer ceiling, int retries) {
		return new InspectorConfig(url, token, scratch, ceiling, Duration.ofSeconds(1), Duration.ofSeconds(1), retries);
	}

	@Test
	void testDefaults() {
		// When
		InspectorConfig config = InspectorConfig.defaults();

		// Then
		assertThat(config.repositoryUrl()).isEqualTo(MavenRepositoryClient.MAVEN_CENTRAL);
		assertThat(config.releaseCeiling()).isNull();
		assertThat(config.maxRetries()).isEqualTo(3);
		assertThat(config.scratchRoot()).isNotNull();
	}

	@Test
	void testValidation() {
		// Given
		Path scratch = Path.of("scratch");

		// When/Then
		assertThatThrownBy(() -> config(" ", null, scratch, null, 3))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Repository URL");
		assertThatThrownBy(() -> config("https://repo.example", null, null, null, 3))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> config("https://repo.example", null, scratch, 8, 3))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("9 or higher");
		assertThatThrownBy(() -> config("https://repo.example", null, scratch, null, 0))
				.isInstanceOf(IllegalArgumentException.class);
		assertThat(config("https://repo.example", null, scratch, 9, 1).releaseCeiling()).isEqualTo(9);
	}

	@Test
	void testWithers() {
		// Given
		InspectorConfig config = config("https://repo.example", "token", Path.of("scratch"), null, 3);

		// When
		InspectorConfig changed = config.withRepositoryUrl("https://other.example")
				.withScratchRoot(Path.of("other"))
				.withReleaseCeiling(17);

		// Then
		assertThat(changed.repositoryUrl()).isEqualTo("https://other.example");
		assertThat(changed.scratchRoot()).isEqualTo(Path.of("other"));
		assertThat(changed.releaseCeiling()).isEqualTo(17);
		assertThat(changed.repositoryToken()).isEqualTo("token");
		assertThat(config.releaseCeiling()).isNull();
	}

	@Test
	void testToStringHidesToken() {
		// Given
		InspectorConfig withToken = config("https://repo.example", "s3cr3t", Path.of("scratch"), null, 3);
		InspectorConfig withoutToken = config("https://repo.example", null, Path.of("scratch"), null, 3);

		// When/Then
		assertThat(withToken.toString()).contains("token=***").doesNotContain("s3cr3t");
		assertThat(withoutToken.toString()).contains("token=none");
	}
}
