package dev.jbang.apidiff.testing;

import java.nio.charset.StandardCharsets;

/** Minimal POM documents */
public class Poms {

	private Poms() {}

	/**
	 * @param packaging jar or pom
	 * @param dependencies {@code groupId:artifactId} coordinates, compile scope
	 */
	public static byte[] pom(String packageId, String version, String packaging, String... dependencies) {
		String[] coordinates = packageId.split(":");
		StringBuilder sb = new StringBuilder();
		sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
		sb.append("<project xmlns=\"http://maven.apache.org/POM/4.0.0\">\n");
		sb.append("  <modelVersion>4.0.0</modelVersion>\n");
		sb.append("  <groupId>").append(coordinates[0]).append("</groupId>\n");
		sb.append("  <artifactId>").append(coordinates[1]).append("</artifactId>\n");
		sb.append("  <version>").append(version).append("</version>\n");
		sb.append("  <packaging>").append(packaging).append("</packaging>\n");
		sb.append("  <dependencies>\n");
		for (String dependency : dependencies) {
			String[] dep = dependency.split(":");
			sb.append("    <dependency>\n");
			sb.append("      <groupId>").append(dep[0]).append("</groupId>\n");
			sb.append("      <artifactId>").append(dep[1]).append("</artifactId>\n");
			sb.append("      <version>1.0</version>\n");
			sb.append("    </dependency>\n");
		}
		sb.append("  </dependencies>\n");
		sb.append("</project>\n");
		return sb.toString().getBytes(StandardCharsets.UTF_8);
	}

	public static byte[] jarPom(String packageId, String version) {
		return pom(packageId, version, "jar");
	}
}
