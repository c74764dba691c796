package dev.jbang.apidiff;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "package-api-diff",
		version = "1.0.0",
		description = "Extracts and compares the public API of published Maven artifacts",
		mixinStandardHelpOptions = true,
		subcommands = {
			SurfaceCommand.class,
			DiffCommand.class,
			CheckCommand.class,
			ObsoleteCommand.class,
			DecompileCommand.class,
			VersionsCommand.class
		})
public class Main implements Callable<Integer> {
	/** Exit code of {@code check} when breaking changes were found */
	public static final int EXIT_BREAKING = 2;

	@Spec
	CommandSpec spec;

	@Override
	public Integer call() {
		spec.commandLine().usage(System.out);
		return 0;
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
