package dev.jbang.apidiff.util;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class VersionComparatorTest {

	private final VersionComparator comparator = new VersionComparator();

	@Test
	void testNumericSegmentsCompareNumerically() {
		// When/Then
		assertThat(comparator.compare("1.10.0", "1.9.0")).isPositive();
		assertThat(comparator.compare("2.0", "10.0")).isNegative();
		assertThat(comparator.compare("1.0.0", "1.0")).isZero();
		assertThat(comparator.compare("1.0.1", "1.0")).isPositive();
	}

	@Test
	void testPreReleaseSortsBeforeRelease() {
		// When/Then
		assertThat(comparator.compare("2.0.0-rc1", "2.0.0")).isNegative();
		assertThat(comparator.compare("2.0.0-beta", "2.0.0-rc1")).isNegative();
		assertThat(comparator.compare("2.0.0-alpha", "2.0.0-beta")).isNegative();
		assertThat(comparator.compare("2.0.0-SNAPSHOT", "2.0.0-alpha")).isNegative();
		assertThat(comparator.compare("2.0.0-M1", "2.0.0-RC1")).isNegative();
	}

	@Test
	void testReleaseQualifiersEqualPlainRelease() {
		// When/Then
		assertThat(comparator.compare("5.3.0.RELEASE", "5.3.0")).isZero();
		assertThat(comparator.compare("4.1.Final", "4.1")).isZero();
	}

	@Test
	void testUnknownQualifierSortsAfterRelease() {
		// When/Then
		assertThat(comparator.compare("33.0-jre", "33.0")).isPositive();
		assertThat(comparator.compare("1.0-sp1", "1.0")).isPositive();
		assertThat(comparator.compare("1.0.1", "1.0-jre")).isPositive();
	}

	@Test
	void testNullHandling() {
		// When/Then
		assertThat(comparator.compare(null, null)).isZero();
		assertThat(comparator.compare(null, "1.0")).isNegative();
		assertThat(comparator.compare("1.0", null)).isPositive();
	}

	@Test
	void testSorting() {
		// Given
		List<String> versions = new ArrayList<>(List.of("1.0", "2.0.0-rc1", "1.10", "2.0.0", "1.9", "1.0-alpha"));

		// When
		versions.sort(VersionComparator.INSTANCE);

		// Then
		assertThat(versions).containsExactly("1.0-alpha", "1.0", "1.9", "1.10", "2.0.0-rc1", "2.0.0");
	}

	@Test
	void testIsPreRelease() {
		// When/Then
		assertThat(VersionComparator.isPreRelease("1.0.0-SNAPSHOT")).isTrue();
		assertThat(VersionComparator.isPreRelease("2.0.0-rc1")).isTrue();
		assertThat(VersionComparator.isPreRelease("3.0.0-M2")).isTrue();
		assertThat(VersionComparator.isPreRelease("1.0.0")).isFalse();
		assertThat(VersionComparator.isPreRelease("33.0-jre")).isFalse();
		assertThat(VersionComparator.isPreRelease("5.3.0.RELEASE")).isFalse();
		assertThat(VersionComparator.isPreRelease(null)).isFalse();
	}
}
