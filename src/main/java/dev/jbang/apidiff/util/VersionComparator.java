package dev.jbang.apidiff.util;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Orders Maven version strings. Numeric segments compare numerically, pre-release qualifiers
 * ({@code alpha}, {@code beta}, {@code milestone}, {@code rc}, {@code SNAPSHOT}) sort before the
 * release they precede and any other qualifier sorts after it.
 */
public class VersionComparator implements Comparator<String> {
	public static final Comparator<String> INSTANCE = new VersionComparator();

	private static final Pattern SEPARATORS = Pattern.compile("[.+_-]|(?<=\\d)(?=\\p{Alpha})|(?<=\\p{Alpha})(?=\\d)");

	// Rank of a missing segment, i.e. the plain release
	private static final int RELEASE = 0;

	@Override
	public int compare(String v1, String v2) {
		if (v1 == null && v2 == null) return 0;
		if (v1 == null) return -1;
		if (v2 == null) return 1;
		String[] parts1 = SEPARATORS.split(v1.trim());
		String[] parts2 = SEPARATORS.split(v2.trim());

		int length = Math.max(parts1.length, parts2.length);
		for (int i = 0; i < length; i++) {
			String s1 = i < parts1.length ? parts1[i] : null;
			String s2 = i < parts2.length ? parts2[i] : null;
			int cmp = compareSegment(s1, s2);
			if (cmp != 0) {
				return cmp;
			}
		}
		return 0;
	}

	/** True when the version carries a qualifier that marks it as not yet released */
	public static boolean isPreRelease(String version) {
		if (version == null) {
			return false;
		}
		for (String part : SEPARATORS.split(version.trim())) {
			if (!isNumber(part) && qualifierRank(part) < RELEASE) {
				return true;
			}
		}
		return false;
	}

	private static int compareSegment(String s1, String s2) {
		boolean n1 = s1 != null && isNumber(s1);
		boolean n2 = s2 != null && isNumber(s2);
		if (n1 && n2) {
			return new BigInteger(s1).compareTo(new BigInteger(s2));
		}
		if (n1) {
			// 1.0.0 == 1.0, 1.0.1 > 1.0, and a number beats any qualifier
			return s2 == null ? new BigInteger(s1).signum() : 1;
		}
		if (n2) {
			return -compareSegment(s2, s1);
		}
		int r1 = s1 == null ? RELEASE : qualifierRank(s1);
		int r2 = s2 == null ? RELEASE : qualifierRank(s2);
		if (r1 != r2) {
			return Integer.compare(r1, r2);
		}
		if (s1 == null || s2 == null) {
			return 0;
		}
		return s1.toLowerCase(Locale.ROOT).compareTo(s2.toLowerCase(Locale.ROOT));
	}

	private static int qualifierRank(String qualifier) {
		switch (qualifier.toLowerCase(Locale.ROOT)) {
			case "snapshot":
				return -5;
			case "alpha":
			case "a":
				return -4;
			case "beta":
			case "b":
				return -3;
			case "milestone":
			case "m":
				return -2;
			case "rc":
			case "cr":
				return -1;
			case "":
			case "ga":
			case "final":
			case "release":
				return RELEASE;
			case "sp":
				return 1;
			default:
				// Unknown qualifiers sort after the release, alphabetically among themselves
				return 2;
		}
	}

	private static boolean isNumber(String s) {
		if (s.isEmpty()) {
			return false;
		}
		for (int i = 0; i < s.length(); i++) {
			if (!Character.isDigit(s.charAt(i))) {
				return false;
			}
		}
		return true;
	}
}
