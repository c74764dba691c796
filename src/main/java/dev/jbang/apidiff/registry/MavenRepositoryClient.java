package dev.jbang.apidiff.registry;

import dev.jbang.apidiff.archive.ManifestReader;
import dev.jbang.apidiff.archive.PackageManifest;
import dev.jbang.apidiff.archive.PomManifestReader;
import dev.jbang.apidiff.model.PackageIdentity;
import dev.jbang.apidiff.model.VersionListing;
import dev.jbang.apidiff.util.HttpStatusException;
import dev.jbang.apidiff.util.HttpUtils;
import dev.jbang.apidiff.util.VersionComparator;
import dev.jbang.apidiff.util.XmlUtils;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Fetches artifacts from a Maven repository using the standard layout
 * {@code {base}/{group path}/{artifactId}/{version}/{artifactId}-{version}.{ext}}.
 */
public class MavenRepositoryClient implements RegistryClient {
	private static final Logger logger = LoggerFactory.getLogger(MavenRepositoryClient.class);

	public static final String MAVEN_CENTRAL = "https://repo1.maven.org/maven2";

	private final String baseUrl;
	private final HttpUtils httpUtils;
	private final ManifestReader manifestReader;

	public MavenRepositoryClient(String baseUrl, HttpUtils httpUtils) {
		this(baseUrl, httpUtils, new PomManifestReader());
	}

	public MavenRepositoryClient(String baseUrl, HttpUtils httpUtils, ManifestReader manifestReader) {
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.httpUtils = httpUtils;
		this.manifestReader = manifestReader;
	}

	@Override
	public PackageArchive resolve(PackageIdentity identity) throws IOException, InterruptedException {
		String pomUrl = artifactUrl(identity, "pom");
		byte[] pom;
		try {
			pom = httpUtils.downloadBytes(pomUrl);
		} catch (HttpStatusException e) {
			if (e.isNotFound()) {
				throw new PackageNotFoundException(identity.id(), identity.version());
			}
			throw e;
		}

		String packaging = packagingOf(pom);
		if (PackageArchive.PACKAGING_POM.equals(packaging)) {
			logger.info("{} has pom packaging, no jar to download", identity);
			return new PackageArchive(identity, packaging, null, pom);
		}

		String jarUrl = artifactUrl(identity, "jar");
		byte[] jar = null;
		try {
			jar = httpUtils.downloadBytes(jarUrl);
			logger.info("Downloaded {} ({} bytes)", jarUrl, jar.length);
		} catch (HttpStatusException e) {
			if (!e.isNotFound()) {
				throw e;
			}
			// Relocation and aggregator POMs sometimes declare jar packaging without publishing one
			logger.info("No jar published for {}, treating it as dependency-only", identity);
		}
		return new PackageArchive(identity, packaging, jar, pom);
	}

	@Override
	public VersionListing listVersions(String packageId) throws IOException, InterruptedException {
		// Validates the coordinate form
		PackageIdentity artifact = PackageIdentity.of(packageId, "0");
		String url = baseUrl + "/" + groupPath(artifact) + "/" + artifact.artifactId() + "/maven-metadata.xml";
		byte[] metadata;
		try {
			metadata = httpUtils.downloadBytes(url);
		} catch (HttpStatusException e) {
			if (e.isNotFound()) {
				throw new PackageNotFoundException(artifact.id(), null);
			}
			throw e;
		}
		return parseMetadata(artifact.id(), metadata);
	}

	static VersionListing parseMetadata(String packageId, byte[] metadata) throws IOException {
		Element root = XmlUtils.parse(metadata).getDocumentElement();
		Element versioning = XmlUtils.child(root, "versioning");
		Set<String> unique = new LinkedHashSet<>();
		for (Element version : XmlUtils.children(XmlUtils.child(versioning, "versions"), "version")) {
			String text = version.getTextContent().trim();
			if (!text.isEmpty()) {
				unique.add(text);
			}
		}
		List<String> versions = new ArrayList<>(unique);
		versions.sort(Comparator.comparing((String v) -> v, VersionComparator.INSTANCE).reversed());
		String latest = versions.isEmpty() ? null : versions.get(0);
		String latestStable = versions.stream()
				.filter(v -> !VersionComparator.isPreRelease(v))
				.findFirst()
				.orElse(null);
		return new VersionListing(packageId, latest, latestStable, versions);
	}

	String artifactUrl(PackageIdentity identity, String extension) {
		return baseUrl + "/" + groupPath(identity) + "/" + identity.artifactId() + "/" + identity.version() + "/"
				+ identity.artifactId() + "-" + identity.version() + "." + extension;
	}

	private String packagingOf(byte[] pom) {
		try {
			PackageManifest manifest = manifestReader.read(pom);
			return manifest.packaging();
		} catch (IOException e) {
			// The POM is parsed again, and reported, by the meta-package detector
			logger.warn("Could not parse POM: {}", e.getMessage());
			return "jar";
		}
	}

	private static String groupPath(PackageIdentity identity) {
		return identity.groupId().replace('.', '/');
	}

	@Override
	public String toString() {
		return "MavenRepositoryClient[" + baseUrl + "]";
	}
}
