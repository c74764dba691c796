package dev.jbang.apidiff;

import dev.jbang.apidiff.inspector.ExtractionFailedException;
import dev.jbang.apidiff.inspector.PackageInspector;
import dev.jbang.apidiff.model.DiffResult;
import dev.jbang.apidiff.registry.PackageNotFoundException;
import dev.jbang.apidiff.report.ReportFormatter;
import dev.jbang.apidiff.util.CancellationSignal;
import dev.jbang.apidiff.util.JsonUtils;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/** Diff command to compare two versions of a package, or two saved surfaces */
@Command(
		name = "diff",
		description = "Compare the API of two package versions, or of two surface files written by 'surface'",
		mixinStandardHelpOptions = true)
public class DiffCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	RepositoryOptions repository;

	@Parameters(index = "0", arity = "0..1", description = "Package id as groupId:artifactId")
	String packageId;

	@Parameters(index = "1", arity = "0..1", description = "Old version")
	String fromVersion;

	@Parameters(index = "2", arity = "0..1", description = "New version")
	String toVersion;

	@Option(
			names = {"--old-surface"},
			description = "Surface file of the old version")
	Path oldSurface;

	@Option(
			names = {"--new-surface"},
			description = "Surface file of the new version")
	Path newSurface;

	@Option(
			names = {"--json"},
			description = "Print the diff as JSON instead of a Markdown report")
	boolean json;

	@Override
	public Integer call() throws Exception {
		boolean fromFiles = oldSurface != null || newSurface != null;
		if (fromFiles && (oldSurface == null || newSurface == null)) {
			logger.error("Error: --old-surface and --new-surface must be given together");
			return 1;
		}
		if (!fromFiles && (packageId == null || fromVersion == null || toVersion == null)) {
			logger.error("Error: expected <packageId> <fromVersion> <toVersion>, or --old-surface and --new-surface");
			return 1;
		}

		try (PackageInspector inspector = repository.createInspector()) {
			DiffResult result = fromFiles
					? inspector.compareSurfaces(
							JsonUtils.readSurfaceFile(oldSurface), JsonUtils.readSurfaceFile(newSurface))
					: inspector.compareVersions(packageId, fromVersion, toVersion, CancellationSignal.none());
			if (json) {
				JsonUtils.write(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), result);
			} else {
				System.out.print(new ReportFormatter().formatDiffReport(result));
			}
			return 0;
		} catch (PackageNotFoundException | ExtractionFailedException | IllegalArgumentException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}
	}
}
