package dev.jbang.apidiff.inspect;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An isolated resolution universe: the class modules of one package version plus the platform
 * baseline. Classes are only ever parsed, never defined in a class loader, so two contexts holding
 * identically named classes cannot interfere. A context is owned by a single extraction and is not
 * thread-safe.
 */
public final class MetadataContext implements Closeable {
	private static final Logger logger = LoggerFactory.getLogger(MetadataContext.class);

	private final PlatformBaseline baseline;
	private final Map<String, ClassView> local = new LinkedHashMap<>();
	private final Map<String, Optional<ClassView>> platform = new HashMap<>();
	private final List<String> skippedModules = new ArrayList<>();
	private volatile boolean closed;

	MetadataContext(PlatformBaseline baseline) {
		this.baseline = baseline;
	}

	/** Parse and register one module; returns false when it was skipped */
	boolean addModule(String moduleName, byte[] bytes) {
		ensureOpen();
		ClassView view;
		try {
			view = ClassFileParser.parse(bytes, this);
		} catch (IllegalArgumentException e) {
			logger.warn("Skipping unreadable module {}: {}", moduleName, e.getMessage());
			skippedModules.add(moduleName + " (" + e.getMessage() + ")");
			return false;
		}
		String name = view.internalName();
		if (local.containsKey(name)) {
			logger.debug("Duplicate definition of {} in {}, keeping the first one", name, moduleName);
			return true;
		}
		local.put(name, view);
		return true;
	}

	void skipModule(String moduleName, String reason) {
		logger.warn("Skipping module {}: {}", moduleName, reason);
		skippedModules.add(moduleName + " (" + reason + ")");
	}

	/** The classes defined by the package, in module order */
	public List<ClassView> types() {
		ensureOpen();
		return Collections.unmodifiableList(new ArrayList<>(local.values()));
	}

	/** Look a class up in the package first, then in the platform baseline */
	public Optional<ClassView> resolve(String internalName) {
		ensureOpen();
		ClassView view = local.get(internalName);
		if (view != null) {
			return Optional.of(view);
		}
		return platform.computeIfAbsent(internalName, this::loadPlatformClass);
	}

	/** Look a class up in the package's own modules only */
	public Optional<ClassView> resolveLocal(String internalName) {
		ensureOpen();
		return Optional.ofNullable(local.get(internalName));
	}

	public boolean isLocal(String internalName) {
		ensureOpen();
		return local.containsKey(internalName);
	}

	/** Modules that could not be read, each with the reason */
	public List<String> skippedModules() {
		ensureOpen();
		return List.copyOf(skippedModules);
	}

	public int size() {
		ensureOpen();
		return local.size();
	}

	public boolean isOpen() {
		return !closed;
	}

	void ensureOpen() {
		if (closed) {
			throw new IllegalStateException("Metadata context has been closed");
		}
	}

	private Optional<ClassView> loadPlatformClass(String internalName) {
		byte[] bytes = baseline.read(internalName);
		if (bytes == null) {
			return Optional.empty();
		}
		try {
			return Optional.of(ClassFileParser.parse(bytes, this));
		} catch (IllegalArgumentException e) {
			logger.debug("Could not parse platform class {}: {}", internalName, e.getMessage());
			return Optional.empty();
		}
	}

	@Override
	public void close() {
		closed = true;
		local.clear();
		platform.clear();
	}
}
