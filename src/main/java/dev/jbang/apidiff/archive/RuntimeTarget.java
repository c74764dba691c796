package dev.jbang.apidiff.archive;

/**
 * The multi-release layer a class file was found in. Release {@code 0} is the base layer of the
 * jar, any other value is the {@code N} of {@code META-INF/versions/N/}.
 */
public record RuntimeTarget(int release) implements Comparable<RuntimeTarget> {
	public static final RuntimeTarget BASE = new RuntimeTarget(0);

	public RuntimeTarget {
		if (release < 0) {
			throw new IllegalArgumentException("Release must not be negative: " + release);
		}
	}

	public boolean isBase() {
		return release == 0;
	}

	/** True when this layer may be selected under the given ceiling (null means no ceiling) */
	public boolean fitsCeiling(Integer ceiling) {
		return isBase() || ceiling == null || release <= ceiling;
	}

	@Override
	public int compareTo(RuntimeTarget other) {
		return Integer.compare(release, other.release);
	}

	@Override
	public String toString() {
		return isBase() ? "base" : "java" + release;
	}
}
