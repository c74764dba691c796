package dev.jbang.apidiff.archive;

import static dev.jbang.apidiff.testing.ClassFileBuilder.publicClass;
import static dev.jbang.apidiff.testing.JarBuilder.jar;
import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ArchiveExtractorTest {

	private final ArchiveExtractor extractor = new ArchiveExtractor(new JarArchiveReader());

	@Test
	void testPlainJar() throws Exception {
		// Given
		byte[] jar = jar().addClass(publicClass("com/example/Widget").build())
				.addClass(publicClass("com/example/Gadget").build())
				.add("com/example/messages.properties", "a=b".getBytes(StandardCharsets.UTF_8))
				.add("module-info.class", publicClass("module-info").build())
				.add("com/example/package-info.class", publicClass("com/example/package-info").build())
				.build();

		// When
		List<ModuleCandidate> candidates = extractor.extract(jar);

		// Then
		assertThat(candidates)
				.extracting(ModuleCandidate::moduleName)
				.containsExactly("com/example/Gadget.class", "com/example/Widget.class");
		assertThat(candidates).allMatch(c -> c.target().isBase());
	}

	@Test
	void testMultiReleaseHighestLayerWins() throws Exception {
		// Given
		byte[] jar = jar().multiRelease()
				.addClass(publicClass("com/example/Widget").build())
				.addClass(11, publicClass("com/example/Widget").build())
				.addClass(17, publicClass("com/example/Widget").build())
				.addClass(11, publicClass("com/example/Gadget").build())
				.build();

		// When
		List<ModuleCandidate> candidates = extractor.extract(jar);

		// Then
		assertThat(candidates)
				.containsExactly(
						new ModuleCandidate(
								"com/example/Gadget.class",
								"META-INF/versions/11/com/example/Gadget.class",
								new RuntimeTarget(11)),
						new ModuleCandidate(
								"com/example/Widget.class",
								"META-INF/versions/17/com/example/Widget.class",
								new RuntimeTarget(17)));
	}

	@Test
	void testReleaseCeiling() throws Exception {
		// Given
		ArchiveExtractor capped = new ArchiveExtractor(new JarArchiveReader(), 11);
		byte[] jar = jar().multiRelease()
				.addClass(publicClass("com/example/Widget").build())
				.addClass(11, publicClass("com/example/Widget").build())
				.addClass(17, publicClass("com/example/Widget").build())
				.addClass(21, publicClass("com/example/Modern").build())
				.build();

		// When
		List<ModuleCandidate> candidates = capped.extract(jar);

		// Then
		assertThat(candidates).hasSize(1);
		assertThat(candidates.get(0).entryPath()).isEqualTo("META-INF/versions/11/com/example/Widget.class");
	}

	@Test
	void testVersionedEntriesIgnoredWithoutMultiReleaseAttribute() throws Exception {
		// Given
		byte[] jar = jar().addClass(publicClass("com/example/Widget").build())
				.addClass(17, publicClass("com/example/Widget").build())
				.build();

		// When
		List<ModuleCandidate> candidates = extractor.extract(jar);

		// Then
		assertThat(candidates).hasSize(1);
		assertThat(candidates.get(0).entryPath()).isEqualTo("com/example/Widget.class");
	}

	@Test
	void testEmptyJarHasNoCandidates() throws Exception {
		// When/Then
		assertThat(extractor.extract(jar().build())).isEmpty();
		assertThat(extractor.extract(new byte[0])).isEmpty();
		assertThat(extractor.extract(null)).isEmpty();
	}

	@Test
	void testReadCandidates() throws Exception {
		// Given
		byte[] base = publicClass("com/example/Widget").build();
		byte[] layered = publicClass("com/example/Widget").constructor().build();
		byte[] jar = jar().multiRelease().addClass(base).addClass(17, layered).build();
		List<ModuleCandidate> candidates = extractor.extract(jar);

		// When
		Map<String, byte[]> modules = extractor.read(jar, candidates);

		// Then
		assertThat(modules).containsOnlyKeys("com/example/Widget.class");
		assertThat(modules.get("com/example/Widget.class")).isEqualTo(layered);
	}

	@Test
	void testClassify() {
		// When/Then
		assertThat(ArchiveExtractor.classify("com/example/Widget.class", false))
				.isEqualTo(new ModuleCandidate("com/example/Widget.class", "com/example/Widget.class", RuntimeTarget.BASE));
		assertThat(ArchiveExtractor.classify("META-INF/versions/8/com/example/Widget.class", true))
				.isNull();
		assertThat(ArchiveExtractor.classify("META-INF/versions/x/com/example/Widget.class", true))
				.isNull();
		assertThat(ArchiveExtractor.classify("META-INF/versions/11/module-info.class", true))
				.isNull();
		assertThat(ArchiveExtractor.classify("META-INF/Shaded.class", true)).isNull();
		assertThat(ArchiveExtractor.classify("com/example/Widget.java", false)).isNull();
	}

	@Test
	void testRuntimeTarget() {
		// When/Then
		assertThat(RuntimeTarget.BASE).hasToString("base");
		assertThat(new RuntimeTarget(17)).hasToString("java17");
		assertThat(new RuntimeTarget(17).fitsCeiling(11)).isFalse();
		assertThat(new RuntimeTarget(11).fitsCeiling(11)).isTrue();
		assertThat(RuntimeTarget.BASE.fitsCeiling(9)).isTrue();
		assertThat(new RuntimeTarget(21).fitsCeiling(null)).isTrue();
		assertThatThrownBy(() -> new RuntimeTarget(-1)).isInstanceOf(IllegalArgumentException.class);
	}
}
