package dev.jbang.apidiff;

import dev.jbang.apidiff.inspector.PackageInspector;
import dev.jbang.apidiff.model.VersionListing;
import dev.jbang.apidiff.registry.PackageNotFoundException;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/** Versions command to list the published versions of a package */
@Command(
		name = "versions",
		description = "List the published versions of a package, newest first",
		mixinStandardHelpOptions = true)
public class VersionsCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	RepositoryOptions repository;

	@Parameters(index = "0", description = "Package id as groupId:artifactId")
	String packageId;

	@Option(
			names = {"-n", "--limit"},
			description = "Maximum number of versions to print (default: 20)",
			defaultValue = "20")
	int limit;

	@Override
	public Integer call() throws Exception {
		try (PackageInspector inspector = repository.createInspector()) {
			VersionListing listing = inspector.listVersions(packageId);
			System.out.println("Latest: " + (listing.latest() != null ? listing.latest() : "-"));
			System.out.println("Latest stable: " + (listing.latestStable() != null ? listing.latestStable() : "-"));
			System.out.println();
			listing.versions().stream().limit(limit).forEach(v -> System.out.println("  " + v));
			if (listing.versions().size() > limit) {
				System.out.println("  ... and " + (listing.versions().size() - limit) + " more");
			}
			return 0;
		} catch (PackageNotFoundException | IllegalArgumentException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}
	}
}
