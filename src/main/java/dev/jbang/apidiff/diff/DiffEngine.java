package dev.jbang.apidiff.diff;

import dev.jbang.apidiff.model.ChangeSet;
import dev.jbang.apidiff.model.MethodSurface;
import dev.jbang.apidiff.model.TypeSurface;
import dev.jbang.apidiff.util.CancellationSignal;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compares two extracted surfaces of the same package. Pure and CPU bound: the only side effect is
 * filling the returned change-set.
 */
public class DiffEngine {
	private final AsyncCounterpartMatcher asyncMatcher;

	public DiffEngine() {
		this(AsyncCounterpartMatcher.nameSuffix());
	}

	public DiffEngine(AsyncCounterpartMatcher asyncMatcher) {
		this.asyncMatcher = asyncMatcher;
	}

	public ChangeSet compare(List<TypeSurface> oldTypes, List<TypeSurface> newTypes) {
		return compare(oldTypes, newTypes, CancellationSignal.none());
	}

	/**
	 * Compare two surfaces.
	 *
	 * @throws java.util.concurrent.CancellationException if the signal fires between two types
	 */
	public ChangeSet compare(List<TypeSurface> oldTypes, List<TypeSurface> newTypes, CancellationSignal signal) {
		ChangeSet changes = new ChangeSet();
		Map<String, TypeSurface> oldByName = index(oldTypes);
		Map<String, TypeSurface> newByName = index(newTypes);

		for (TypeSurface oldType : oldByName.values()) {
			signal.throwIfCancelled();
			TypeSurface newType = newByName.get(oldType.fullName());
			if (newType == null) {
				changes.removedTypes().add(oldType.fullName());
				continue;
			}
			compareType(oldType, newType, changes);
		}
		for (TypeSurface newType : newByName.values()) {
			signal.throwIfCancelled();
			if (!oldByName.containsKey(newType.fullName())) {
				changes.addedTypes().add(newType.fullName());
			}
		}
		return changes;
	}

	private void compareType(TypeSurface oldType, TypeSurface newType, ChangeSet changes) {
		String typeName = newType.fullName();

		for (String iface : oldType.interfaceNames()) {
			if (!newType.interfaceNames().contains(iface)) {
				changes.removedInterfaces().add(typeName + " no longer implements " + iface);
			}
		}
		for (String iface : newType.interfaceNames()) {
			if (!oldType.interfaceNames().contains(iface)) {
				changes.addedInterfaces().add(typeName + " now implements " + iface);
			}
		}

		if (oldType.baseTypeName() != null
				&& newType.baseTypeName() != null
				&& !oldType.baseTypeName().equals(newType.baseTypeName())) {
			changes.baseClassChanges().add(typeName + ": " + oldType.baseTypeName() + " -> " + newType.baseTypeName());
		}

		if (!Objects.equals(oldType.namespace(), newType.namespace())) {
			changes.namespaceChanges().add(qualified(oldType) + " -> " + qualified(newType));
		}

		compareMethods(oldType, newType, changes);

		for (String property : oldType.propertyNames()) {
			if (!newType.propertyNames().contains(property)) {
				changes.removedProperties().add(typeName + "." + property);
			}
		}
		for (String property : newType.propertyNames()) {
			if (!oldType.propertyNames().contains(property)) {
				changes.addedProperties().add(typeName + "." + property);
			}
		}

		if (newType.deprecated()) {
			changes.obsoleteTypes().add(withMessage(typeName, newType.obsoleteMessage()));
		}
		for (MethodSurface method : newType.methods()) {
			if (method.deprecated()) {
				changes.obsoleteMethods().add(withMessage(typeName + "." + method.signature(), method.obsoleteMessage()));
			}
		}
	}

	private void compareMethods(TypeSurface oldType, TypeSurface newType, ChangeSet changes) {
		String typeName = newType.fullName();
		Map<String, MethodSurface> oldMethods = indexMethods(oldType.methods());
		Map<String, MethodSurface> newMethods = indexMethods(newType.methods());
		Set<String> replacedByAsync = new HashSet<>();

		for (MethodSurface method : oldMethods.values()) {
			if (newMethods.containsKey(method.signature())) {
				continue;
			}
			List<MethodSurface> counterparts = asyncMatcher.counterparts(method, newType);
			if (counterparts.isEmpty()) {
				changes.removedMethods().add(typeName + "." + method.signature());
			} else {
				changes.asyncMigrations()
						.add(typeName + "." + method.signature() + " -> " + counterparts.get(0).name()
								+ " (sync to async)");
				counterparts.forEach(counterpart -> replacedByAsync.add(counterpart.signature()));
			}
		}
		for (MethodSurface method : newMethods.values()) {
			if (!oldMethods.containsKey(method.signature()) && !replacedByAsync.contains(method.signature())) {
				changes.addedMethods().add(typeName + "." + method.signature());
			}
		}
	}

	private static String qualified(TypeSurface type) {
		return type.namespace().isEmpty() ? type.simpleName() : type.namespace() + "." + type.simpleName();
	}

	private static String withMessage(String entry, String message) {
		return message == null || message.isBlank() ? entry : entry + ": " + message;
	}

	private static Map<String, TypeSurface> index(List<TypeSurface> types) {
		Map<String, TypeSurface> byName = new LinkedHashMap<>();
		for (TypeSurface type : types) {
			byName.putIfAbsent(type.fullName(), type);
		}
		return byName;
	}

	private static Map<String, MethodSurface> indexMethods(List<MethodSurface> methods) {
		Map<String, MethodSurface> bySignature = new LinkedHashMap<>();
		for (MethodSurface method : methods) {
			bySignature.putIfAbsent(method.signature(), method);
		}
		return bySignature;
	}
}
