package dev.jbang.apidiff;

import dev.jbang.apidiff.inspector.InspectorConfig;
import dev.jbang.apidiff.inspector.PackageInspector;
import java.nio.file.Path;
import picocli.CommandLine.Option;

/** Options shared by every command that talks to a repository */
public class RepositoryOptions {

	@Option(
			names = {"-r", "--repository"},
			description = "Base URL of the Maven repository (default: Maven Central or -Dapidiff.repository)")
	String repositoryUrl;

	@Option(
			names = {"--token"},
			description = "Bearer token for the repository (default: -Dapidiff.repository.token)")
	String token;

	@Option(
			names = {"--scratch-dir"},
			description = "Directory for temporary files (default: ${java.io.tmpdir}/pkg-inspector)")
	Path scratchDir;

	@Option(
			names = {"--release"},
			description = "Highest multi-release layer to inspect, e.g. 17 (default: highest present)")
	Integer release;

	public InspectorConfig toConfig() {
		InspectorConfig defaults = InspectorConfig.defaults();
		return new InspectorConfig(
				repositoryUrl != null ? repositoryUrl : defaults.repositoryUrl(),
				token != null ? token : defaults.repositoryToken(),
				scratchDir != null ? scratchDir : defaults.scratchRoot(),
				release != null ? release : defaults.releaseCeiling(),
				defaults.connectTimeout(),
				defaults.requestTimeout(),
				defaults.maxRetries());
	}

	public PackageInspector createInspector() {
		return new PackageInspector(toConfig());
	}
}
