package dev.jbang.apidiff;

import dev.jbang.apidiff.inspector.ExtractionFailedException;
import dev.jbang.apidiff.inspector.PackageInspector;
import dev.jbang.apidiff.model.SurfaceResult;
import dev.jbang.apidiff.registry.PackageNotFoundException;
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

/** Surface command to extract the API surface of one package version as JSON */
@Command(
		name = "surface",
		description = "Extract the API surface of a package version as JSON",
		mixinStandardHelpOptions = true)
public class SurfaceCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	RepositoryOptions repository;

	@Parameters(index = "0", description = "Package id as groupId:artifactId")
	String packageId;

	@Parameters(index = "1", description = "Package version")
	String version;

	@Option(
			names = {"--include-non-public"},
			description = "Also extract non-public types and members")
	boolean includeNonPublic;

	@Option(
			names = {"-o", "--output"},
			description = "Write the surface to this file instead of standard output")
	Path output;

	@Override
	public Integer call() throws Exception {
		try (PackageInspector inspector = repository.createInspector()) {
			SurfaceResult result =
					inspector.extractSurface(packageId, version, includeNonPublic, CancellationSignal.none());
			if (result.error() != null) {
				logger.warn("Warning: {}", result.error());
			}
			if (output != null) {
				JsonUtils.saveFile(output, result);
				logger.info("Wrote {} type(s) to {}", result.types().size(), output.toAbsolutePath());
			} else {
				JsonUtils.write(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), result);
			}
			return 0;
		} catch (PackageNotFoundException | ExtractionFailedException | IllegalArgumentException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}
	}
}
