package dev.jbang.apidiff;

import dev.jbang.apidiff.inspector.ExtractionFailedException;
import dev.jbang.apidiff.inspector.PackageInspector;
import dev.jbang.apidiff.model.BreakingChangesCheck;
import dev.jbang.apidiff.registry.PackageNotFoundException;
import dev.jbang.apidiff.util.CancellationSignal;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

/** Check command answering whether an upgrade is safe; exits with 2 on breaking changes */
@Command(
		name = "check",
		description = "Check whether upgrading between two versions breaks the API (exit code 2 when it does)",
		mixinStandardHelpOptions = true)
public class CheckCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	RepositoryOptions repository;

	@Parameters(index = "0", description = "Package id as groupId:artifactId")
	String packageId;

	@Parameters(index = "1", description = "Old version")
	String fromVersion;

	@Parameters(index = "2", description = "New version")
	String toVersion;

	@Override
	public Integer call() throws Exception {
		try (PackageInspector inspector = repository.createInspector()) {
			BreakingChangesCheck check =
					inspector.checkBreakingChanges(packageId, fromVersion, toVersion, CancellationSignal.none());
			System.out.println(packageId + " " + fromVersion + " -> " + toVersion + ": " + check);
			return check.hasBreakingChanges() ? Main.EXIT_BREAKING : 0;
		} catch (PackageNotFoundException | ExtractionFailedException | IllegalArgumentException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}
	}
}
