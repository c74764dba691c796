package dev.jbang.apidiff.diff;

import static org.assertj.core.api.Assertions.*;

import dev.jbang.apidiff.model.ChangeSet;
import dev.jbang.apidiff.model.MethodSurface;
import dev.jbang.apidiff.model.TypeKind;
import dev.jbang.apidiff.model.TypeSurface;
import dev.jbang.apidiff.util.CancellationSignal;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Test;

class DiffEngineTest {

	private final DiffEngine engine = new DiffEngine();

	private static MethodSurface method(String name, String returnType, String... parameterTypes) {
		return new MethodSurface(name, null, returnType, List.of(parameterTypes), false, false, false, null);
	}

	private static MethodSurface asyncMethod(String name, String... parameterTypes) {
		return new MethodSurface(
				name, null, "java.util.concurrent.CompletableFuture<T>", List.of(parameterTypes), false, true, false, null);
	}

	private static TypeSurface type(String fullName, MethodSurface... methods) {
		return type(fullName, null, Set.of(), Set.of(), methods);
	}

	private static TypeSurface type(
			String fullName, String baseType, Set<String> interfaces, Set<String> properties, MethodSurface... methods) {
		int dot = fullName.lastIndexOf('.');
		return new TypeSurface(
				fullName,
				fullName.substring(0, dot),
				fullName.substring(dot + 1),
				TypeKind.CLASS,
				true,
				baseType,
				interfaces,
				false,
				null,
				List.of(methods),
				properties);
	}

	@Test
	void testIdenticalSurfacesYieldEmptyChangeSet() {
		// Given
		List<TypeSurface> surface = List.of(
				type("com.example.Widget", "java.lang.Object", Set.of("java.io.Serializable"), Set.of("color"),
						method("getColor", "java.lang.String"), method("spin", "void", "int")),
				type("com.example.Gadget"));

		// When
		ChangeSet changes = engine.compare(surface, List.copyOf(surface));

		// Then
		assertThat(changes.isEmpty()).isTrue();
		assertThat(changes.hasBreakingChanges()).isFalse();
		assertThat(changes.hasAdditions()).isFalse();
	}

	@Test
	void testRemovedTypeHasNoMemberEntries() {
		// Given
		List<TypeSurface> oldSurface = List.of(
				type("ExamplePkg.Widget", "java.lang.Object", Set.of("java.io.Closeable"), Set.of("size"),
						method("spin", "void"), method("getSize", "int")),
				type("ExamplePkg.Common"));
		List<TypeSurface> newSurface = List.of(type("ExamplePkg.Common"), type("ExamplePkg.Gadget"));

		// When
		ChangeSet changes = engine.compare(oldSurface, newSurface);

		// Then
		assertThat(changes.removedTypes()).containsExactly("ExamplePkg.Widget");
		assertThat(changes.addedTypes()).containsExactly("ExamplePkg.Gadget");
		assertThat(changes.removedMethods()).isEmpty();
		assertThat(changes.removedProperties()).isEmpty();
		assertThat(changes.removedInterfaces()).isEmpty();
		assertThat(changes.hasBreakingChanges()).isTrue();
	}

	@Test
	void testAddedMethod() {
		// Given
		List<TypeSurface> oldSurface = List.of(type("com.example.Widget", method("spin", "void")));
		List<TypeSurface> newSurface =
				List.of(type("com.example.Widget", method("spin", "void"), method("turn", "void", "int")));

		// When
		ChangeSet changes = engine.compare(oldSurface, newSurface);

		// Then
		assertThat(changes.addedMethods()).containsExactly("com.example.Widget.turn(int)");
		assertThat(changes.hasAdditions()).isTrue();
		assertThat(changes.hasBreakingChanges()).isFalse();
	}

	@Test
	void testRemovedOverload() {
		// Given
		List<TypeSurface> oldSurface = List.of(
				type("com.example.Widget", method("spin", "void"), method("spin", "void", "int")));
		List<TypeSurface> newSurface = List.of(type("com.example.Widget", method("spin", "void")));

		// When
		ChangeSet changes = engine.compare(oldSurface, newSurface);

		// Then
		assertThat(changes.removedMethods()).containsExactly("com.example.Widget.spin(int)");
	}

	@Test
	void testReturnTypeOnlyChangeIsNotReported() {
		// Given
		List<TypeSurface> oldSurface = List.of(type("com.example.Widget", method("count", "int")));
		List<TypeSurface> newSurface = List.of(type("com.example.Widget", method("count", "long")));

		// When
		ChangeSet changes = engine.compare(oldSurface, newSurface);

		// Then
		assertThat(changes.isEmpty()).isTrue();
	}

	@Test
	void testAsyncMigration() {
		// Given
		List<TypeSurface> oldSurface = List.of(type("com.example.Client", method("Foo", "java.lang.String", "int")));
		List<TypeSurface> newSurface = List.of(type("com.example.Client", asyncMethod("FooAsync", "int")));

		// When
		ChangeSet changes = engine.compare(oldSurface, newSurface);

		// Then
		assertThat(changes.asyncMigrations())
				.containsExactly("com.example.Client.Foo(int) -> FooAsync (sync to async)");
		assertThat(changes.removedMethods()).isEmpty();
		assertThat(changes.addedMethods()).isEmpty();
		assertThat(changes.hasBreakingChanges()).isTrue();
	}

	@Test
	void testAsyncCounterpartMustBeAsyncShaped() {
		// Given
		List<TypeSurface> oldSurface = List.of(type("com.example.Client", method("load", "void")));
		List<TypeSurface> newSurface = List.of(type("com.example.Client", method("loadAsync", "void")));

		// When
		ChangeSet changes = engine.compare(oldSurface, newSurface);

		// Then
		assertThat(changes.asyncMigrations()).isEmpty();
		assertThat(changes.removedMethods()).containsExactly("com.example.Client.load()");
		assertThat(changes.addedMethods()).containsExactly("com.example.Client.loadAsync()");
	}

	@Test
	void testMigrationToAlreadyPublishedAsyncMethod() {
		// Given
		List<TypeSurface> oldSurface =
				List.of(type("com.example.Client", method("load", "void"), asyncMethod("loadAsync")));
		List<TypeSurface> newSurface = List.of(type("com.example.Client", asyncMethod("loadAsync")));

		// When
		ChangeSet changes = engine.compare(oldSurface, newSurface);

		// Then
		assertThat(changes.asyncMigrations()).containsExactly("com.example.Client.load() -> loadAsync (sync to async)");
		assertThat(changes.addedMethods()).isEmpty();
	}

	@Test
	void testInterfaceBaseClassAndPropertyChanges() {
		// Given
		List<TypeSurface> oldSurface = List.of(type(
				"com.example.Widget", "com.example.Base", Set.of("java.io.Serializable"), Set.of("color", "size")));
		List<TypeSurface> newSurface = List.of(type(
				"com.example.Widget", "com.example.NewBase", Set.of("java.io.Closeable"), Set.of("color", "weight")));

		// When
		ChangeSet changes = engine.compare(oldSurface, newSurface);

		// Then
		assertThat(changes.removedInterfaces())
				.containsExactly("com.example.Widget no longer implements java.io.Serializable");
		assertThat(changes.addedInterfaces()).containsExactly("com.example.Widget now implements java.io.Closeable");
		assertThat(changes.baseClassChanges())
				.containsExactly("com.example.Widget: com.example.Base -> com.example.NewBase");
		assertThat(changes.removedProperties()).containsExactly("com.example.Widget.size");
		assertThat(changes.addedProperties()).containsExactly("com.example.Widget.weight");
	}

	@Test
	void testBaseClassAppearingIsNotAChange() {
		// Given
		List<TypeSurface> oldSurface = List.of(type("com.example.Widget", null, Set.of(), Set.of()));
		List<TypeSurface> newSurface = List.of(type("com.example.Widget", "com.example.Base", Set.of(), Set.of()));

		// When
		ChangeSet changes = engine.compare(oldSurface, newSurface);

		// Then
		assertThat(changes.baseClassChanges()).isEmpty();
	}

	@Test
	void testNamespaceChange() {
		// Given
		TypeSurface oldType = new TypeSurface(
				"com.example.Widget", "com.example", "Widget", TypeKind.CLASS, true, null, Set.of(), false, null,
				List.of(), Set.of());
		TypeSurface newType = new TypeSurface(
				"com.example.Widget", "com.example.core", "Widget", TypeKind.CLASS, true, null, Set.of(), false, null,
				List.of(), Set.of());

		// When
		ChangeSet changes = engine.compare(List.of(oldType), List.of(newType));

		// Then
		assertThat(changes.namespaceChanges()).containsExactly("com.example.Widget -> com.example.core.Widget");
		assertThat(changes.hasBreakingChanges()).isFalse();
	}

	@Test
	void testObsoleteEntriesComeFromNewVersion() {
		// Given
		MethodSurface spin = new MethodSurface("spin", null, "void", List.of(), false, false, true, "since 2.0");
		MethodSurface turn = new MethodSurface("turn", null, "void", List.of(), false, false, true, null);
		TypeSurface newWidget = new TypeSurface(
				"com.example.Widget", "com.example", "Widget", TypeKind.CLASS, true, null, Set.of(), true,
				"scheduled for removal", List.of(spin, turn), Set.of());
		List<TypeSurface> oldSurface = List.of(type("com.example.Widget", method("spin", "void"), method("turn", "void")));

		// When
		ChangeSet changes = engine.compare(oldSurface, List.of(newWidget));

		// Then
		assertThat(changes.obsoleteTypes()).containsExactly("com.example.Widget: scheduled for removal");
		assertThat(changes.obsoleteMethods())
				.containsExactly("com.example.Widget.spin(): since 2.0", "com.example.Widget.turn()");
		assertThat(changes.hasBreakingChanges()).isFalse();
	}

	@Test
	void testDuplicateTypesFirstWins() {
		// Given
		List<TypeSurface> oldSurface = List.of(type("com.example.Widget", method("spin", "void")));
		List<TypeSurface> newSurface = List.of(
				type("com.example.Widget", method("spin", "void")), type("com.example.Widget", method("turn", "void")));

		// When
		ChangeSet changes = engine.compare(oldSurface, newSurface);

		// Then
		assertThat(changes.isEmpty()).isTrue();
	}

	@Test
	void testCustomMatcher() {
		// Given
		DiffEngine neverAsync = new DiffEngine((removed, newType) -> List.of());
		List<TypeSurface> oldSurface = List.of(type("com.example.Client", method("load", "void")));
		List<TypeSurface> newSurface = List.of(type("com.example.Client", asyncMethod("loadAsync")));

		// When
		ChangeSet changes = neverAsync.compare(oldSurface, newSurface);

		// Then
		assertThat(changes.asyncMigrations()).isEmpty();
		assertThat(changes.removedMethods()).containsExactly("com.example.Client.load()");
		assertThat(changes.addedMethods()).containsExactly("com.example.Client.loadAsync()");
	}

	@Test
	void testCancellation() {
		// Given
		CancellationSignal signal = CancellationSignal.create();
		signal.cancel();
		List<TypeSurface> surface = List.of(type("com.example.Widget"));

		// When/Then
		assertThatThrownBy(() -> engine.compare(surface, surface, signal)).isInstanceOf(CancellationException.class);
	}
}
