package dev.jbang.apidiff.diff;

import dev.jbang.apidiff.model.MethodSurface;
import dev.jbang.apidiff.model.TypeSurface;
import java.util.List;

/**
 * Decides whether a removed synchronous method was replaced by asynchronous counterparts. This is a
 * naming heuristic, false positives are acceptable.
 */
@FunctionalInterface
public interface AsyncCounterpartMatcher {

	/**
	 * @param removed a method present in the old type but not in the new one
	 * @param newType the new version of the declaring type
	 * @return the async methods of {@code newType} that replace {@code removed}, empty when none
	 */
	List<MethodSurface> counterparts(MethodSurface removed, TypeSurface newType);

	/** Matches async-shaped methods named {@code {removedName}Async} */
	static AsyncCounterpartMatcher nameSuffix() {
		return (removed, newType) -> {
			if (removed.isAsync()) {
				return List.of();
			}
			String asyncName = removed.name() + "Async";
			return newType.methods().stream()
					.filter(m -> m.isAsync() && m.name().equals(asyncName))
					.toList();
		};
	}
}
