package dev.jbang.apidiff.archive;

/**
 * One class file inside a jar.
 *
 * @param moduleName the path of the class relative to its layer, e.g. {@code com/example/Widget.class}
 * @param entryPath the full path of the entry inside the jar
 * @param target the multi-release layer the entry belongs to
 */
public record ModuleCandidate(String moduleName, String entryPath, RuntimeTarget target) {}
