package dev.jbang.apidiff;

import dev.jbang.apidiff.inspector.PackageInspector;
import dev.jbang.apidiff.model.DecompileResult;
import dev.jbang.apidiff.registry.PackageNotFoundException;
import dev.jbang.apidiff.util.CancellationSignal;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/** Decompile command to print the bytecode of a package version or one of its types */
@Command(
		name = "decompile",
		description = "Print a readable bytecode listing of a package version's classes",
		mixinStandardHelpOptions = true)
public class DecompileCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	RepositoryOptions repository;

	@Parameters(index = "0", description = "Package id as groupId:artifactId")
	String packageId;

	@Parameters(index = "1", description = "Package version")
	String version;

	@Option(
			names = {"-t", "--type"},
			description = "Binary name of a single type to print, e.g. com.example.Outer$Inner")
	String typeName;

	@Override
	public Integer call() throws Exception {
		try (PackageInspector inspector = repository.createInspector()) {
			DecompileResult result = inspector.decompile(packageId, version, typeName, CancellationSignal.none());
			if (!result.success()) {
				logger.error("Error: {}", result.error());
				return 1;
			}
			System.out.print(result.source());
			return 0;
		} catch (PackageNotFoundException | IllegalArgumentException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}
	}
}
