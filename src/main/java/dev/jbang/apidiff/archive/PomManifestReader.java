package dev.jbang.apidiff.archive;

import dev.jbang.apidiff.util.XmlUtils;
import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.w3c.dom.Element;

/**
 * Reads the coordinates and direct dependencies of a POM. Only properties defined in the POM
 * itself are interpolated, parent POMs are never fetched.
 */
public class PomManifestReader implements ManifestReader {
	private static final Pattern PROPERTY = Pattern.compile("\\$\\{([^}]+)}");

	@Override
	public PackageManifest read(byte[] manifest) throws IOException {
		Element project = XmlUtils.parse(manifest).getDocumentElement();
		if (project == null || !"project".equals(project.getNodeName())) {
			throw new IOException("Not a POM: root element is not <project>");
		}
		Element parent = XmlUtils.child(project, "parent");

		Map<String, String> properties = new HashMap<>();
		Element propertiesElement = XmlUtils.child(project, "properties");
		if (propertiesElement != null) {
			var nodes = propertiesElement.getChildNodes();
			for (int i = 0; i < nodes.getLength(); i++) {
				if (nodes.item(i) instanceof Element property) {
					properties.put(property.getNodeName(), property.getTextContent().trim());
				}
			}
		}

		String groupId = firstNonNull(XmlUtils.childText(project, "groupId"), XmlUtils.childText(parent, "groupId"));
		String artifactId = XmlUtils.childText(project, "artifactId");
		String version = firstNonNull(XmlUtils.childText(project, "version"), XmlUtils.childText(parent, "version"));
		putProjectProperty(properties, "groupId", groupId);
		putProjectProperty(properties, "artifactId", artifactId);
		putProjectProperty(properties, "version", version);
		if (parent != null) {
			properties.putIfAbsent("project.parent.groupId", XmlUtils.childText(parent, "groupId"));
			properties.putIfAbsent("project.parent.version", XmlUtils.childText(parent, "version"));
		}

		String packaging = XmlUtils.childText(project, "packaging");
		Set<String> dependencies = new LinkedHashSet<>();
		for (Element dependency : XmlUtils.children(XmlUtils.child(project, "dependencies"), "dependency")) {
			String scope = XmlUtils.childText(dependency, "scope");
			if ("test".equals(scope)) {
				continue;
			}
			String depGroup = interpolate(XmlUtils.childText(dependency, "groupId"), properties);
			String depArtifact = interpolate(XmlUtils.childText(dependency, "artifactId"), properties);
			if (depGroup != null && depArtifact != null) {
				dependencies.add(depGroup + ":" + depArtifact);
			}
		}

		return new PackageManifest(
				interpolate(groupId, properties),
				interpolate(artifactId, properties),
				interpolate(version, properties),
				interpolate(packaging, properties),
				List.copyOf(dependencies));
	}

	private static void putProjectProperty(Map<String, String> properties, String name, String value) {
		if (value != null) {
			properties.putIfAbsent("project." + name, value);
			properties.putIfAbsent("pom." + name, value);
			properties.putIfAbsent(name, value);
		}
	}

	/** Replace {@code ${name}} references; unknown references are kept as written */
	static String interpolate(String value, Map<String, String> properties) {
		if (value == null || !value.contains("${")) {
			return value;
		}
		String current = value;
		// Properties may refer to each other, but never more than a few levels deep
		for (int depth = 0; depth < 5 && current.contains("${"); depth++) {
			Matcher matcher = PROPERTY.matcher(current);
			StringBuilder sb = new StringBuilder();
			while (matcher.find()) {
				String replacement = properties.get(matcher.group(1));
				matcher.appendReplacement(
						sb, Matcher.quoteReplacement(replacement != null ? replacement : matcher.group()));
			}
			matcher.appendTail(sb);
			String next = sb.toString();
			if (next.equals(current)) {
				break;
			}
			current = next;
		}
		return current;
	}

	private static String firstNonNull(String first, String second) {
		return first != null ? first : second;
	}
}
