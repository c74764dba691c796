package dev.jbang.apidiff;

import dev.jbang.apidiff.inspector.ExtractionFailedException;
import dev.jbang.apidiff.inspector.PackageInspector;
import dev.jbang.apidiff.model.ObsoleteApisResult;
import dev.jbang.apidiff.model.ObsoleteItem;
import dev.jbang.apidiff.registry.PackageNotFoundException;
import dev.jbang.apidiff.util.CancellationSignal;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

/** Obsolete command to list deprecated APIs of a package version */
@Command(
		name = "obsolete",
		description = "List the deprecated types and methods of a package version",
		mixinStandardHelpOptions = true)
public class ObsoleteCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	RepositoryOptions repository;

	@Parameters(index = "0", description = "Package id as groupId:artifactId")
	String packageId;

	@Parameters(index = "1", description = "Package version")
	String version;

	@Override
	public Integer call() throws Exception {
		try (PackageInspector inspector = repository.createInspector()) {
			ObsoleteApisResult result = inspector.obsoleteApis(packageId, version, CancellationSignal.none());
			if (result.error() != null) {
				logger.warn("Warning: {}", result.error());
			}
			if (result.items().isEmpty()) {
				System.out.println("No deprecated APIs found in " + packageId + ":" + version);
				return 0;
			}
			System.out.println("Deprecated APIs in " + packageId + ":" + version + " (" + result.items().size() + ")");
			for (ObsoleteItem item : result.items()) {
				System.out.println("  [" + item.kind() + "] " + item.name()
						+ (item.message() != null ? " - " + item.message() : ""));
			}
			return 0;
		} catch (PackageNotFoundException | ExtractionFailedException | IllegalArgumentException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}
	}
}
