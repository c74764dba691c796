package dev.jbang.apidiff.inspect;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Opens isolated metadata contexts over extracted class modules */
public class MetadataLoader {
	private static final Logger logger = LoggerFactory.getLogger(MetadataLoader.class);

	private final PlatformBaseline baseline;

	public MetadataLoader() {
		this(PlatformBaseline.system());
	}

	public MetadataLoader(PlatformBaseline baseline) {
		this.baseline = baseline;
	}

	/**
	 * Open a context over a closed set of class files. Files that cannot be read or parsed are
	 * skipped and listed in {@link MetadataContext#skippedModules()}. The caller owns the returned
	 * context and must close it.
	 */
	public MetadataContext open(List<Path> modulePaths) {
		MetadataContext context = new MetadataContext(baseline);
		for (Path modulePath : modulePaths) {
			byte[] bytes;
			try {
				bytes = Files.readAllBytes(modulePath);
			} catch (IOException e) {
				context.skipModule(modulePath.toString(), e.toString());
				continue;
			}
			context.addModule(modulePath.toString(), bytes);
		}
		logger.debug(
				"Loaded {} of {} module(s) into a new metadata context",
				context.size(),
				modulePaths.size());
		return context;
	}
}
