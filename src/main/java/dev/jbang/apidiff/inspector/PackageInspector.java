package dev.jbang.apidiff.inspector;

import dev.jbang.apidiff.archive.ArchiveExtractor;
import dev.jbang.apidiff.archive.ArchiveReader;
import dev.jbang.apidiff.archive.JarArchiveReader;
import dev.jbang.apidiff.archive.ManifestReader;
import dev.jbang.apidiff.archive.ModuleCandidate;
import dev.jbang.apidiff.archive.PomManifestReader;
import dev.jbang.apidiff.decompile.Decompiler;
import dev.jbang.apidiff.decompile.TextifierDecompiler;
import dev.jbang.apidiff.diff.DiffEngine;
import dev.jbang.apidiff.diff.MetaPackageDetector;
import dev.jbang.apidiff.inspect.MetadataContext;
import dev.jbang.apidiff.inspect.MetadataLoader;
import dev.jbang.apidiff.inspect.SurfaceExtractor;
import dev.jbang.apidiff.model.BreakingChangesCheck;
import dev.jbang.apidiff.model.ChangeSet;
import dev.jbang.apidiff.model.DecompileResult;
import dev.jbang.apidiff.model.DiffResult;
import dev.jbang.apidiff.model.ObsoleteApisResult;
import dev.jbang.apidiff.model.PackageIdentity;
import dev.jbang.apidiff.model.SurfaceResult;
import dev.jbang.apidiff.model.TypeSurface;
import dev.jbang.apidiff.model.VersionListing;
import dev.jbang.apidiff.registry.MavenRepositoryClient;
import dev.jbang.apidiff.registry.PackageArchive;
import dev.jbang.apidiff.registry.PackageNotFoundException;
import dev.jbang.apidiff.registry.RegistryClient;
import dev.jbang.apidiff.report.ReportFormatter;
import dev.jbang.apidiff.util.CancellationSignal;
import dev.jbang.apidiff.util.HttpUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for callers: extracts API surfaces of published package versions, compares them and
 * renders their classes. Every call downloads and extracts afresh; nothing is cached between calls.
 *
 * <p>Each operation has a blocking form taking a {@link CancellationSignal} and an {@code Async}
 * form running on the inspector's executor. Cancelling a returned future cancels the work.
 */
public class PackageInspector implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(PackageInspector.class);

	private static final int MAX_SKIPPED_NAMES = 5;

	private final InspectorConfig config;
	private final RegistryClient registry;
	private final ArchiveExtractor archiveExtractor;
	private final MetadataLoader metadataLoader;
	private final SurfaceExtractor surfaceExtractor = new SurfaceExtractor();
	private final DiffEngine diffEngine;
	private final MetaPackageDetector metaPackageDetector;
	private final Decompiler decompiler;
	private final ReportFormatter reportFormatter = new ReportFormatter();
	private final ExecutorService executor;

	public PackageInspector(InspectorConfig config) {
		this(config, createRegistry(config));
	}

	public PackageInspector(InspectorConfig config, RegistryClient registry) {
		this(
				config,
				registry,
				new JarArchiveReader(),
				new PomManifestReader(),
				new MetadataLoader(),
				new DiffEngine(),
				new TextifierDecompiler());
	}

	public PackageInspector(
			InspectorConfig config,
			RegistryClient registry,
			ArchiveReader archiveReader,
			ManifestReader manifestReader,
			MetadataLoader metadataLoader,
			DiffEngine diffEngine,
			Decompiler decompiler) {
		this.config = config;
		this.registry = registry;
		this.archiveExtractor = new ArchiveExtractor(archiveReader, config.releaseCeiling());
		this.metadataLoader = metadataLoader;
		this.diffEngine = diffEngine;
		this.metaPackageDetector = new MetaPackageDetector(manifestReader);
		this.decompiler = decompiler;
		AtomicInteger threadCount = new AtomicInteger();
		// Unbounded: a comparison submits its old-version extraction from a worker thread
		this.executor = Executors.newCachedThreadPool(r -> {
			Thread thread = new Thread(r, "package-inspector-" + threadCount.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
		ScratchDirectory.pruneStale(config.scratchRoot());
	}

	private static RegistryClient createRegistry(InspectorConfig config) {
		HttpUtils httpUtils = new HttpUtils(
				config.connectTimeout(),
				config.requestTimeout(),
				config.maxRetries(),
				HttpUtils.DEFAULT_INITIAL_BACKOFF,
				config.repositoryToken());
		return new MavenRepositoryClient(config.repositoryUrl(), httpUtils);
	}

	public InspectorConfig config() {
		return config;
	}

	// ------------------------------------------------------------------ surface

	/**
	 * Extract the API surface of a package version.
	 *
	 * @param includeNonPublic also extract non-public types and members
	 * @return the surface; download problems and unreadable modules are reported in its error field
	 * @throws PackageNotFoundException if the registry has no such package version
	 * @throws ExtractionFailedException if the package has classes but none could be loaded
	 */
	public SurfaceResult extractSurface(
			String packageId, String version, boolean includeNonPublic, CancellationSignal signal)
			throws IOException, InterruptedException {
		PackageIdentity identity = PackageIdentity.of(packageId, version);
		logger.info("Extracting API surface of {}", identity);
		VersionSnapshot snapshot;
		try {
			snapshot = loadVersion(identity, includeNonPublic, signal);
		} catch (PackageNotFoundException | ExtractionFailedException e) {
			throw e;
		} catch (IOException e) {
			logger.warn("Could not extract {}: {}", identity, e.getMessage());
			return SurfaceResult.partial(identity, List.of(), e.getMessage());
		}
		if (metaPackageDetector.isMetaPackage(snapshot.candidates())) {
			return metaSurface(identity, snapshot.archive());
		}
		String error = snapshot.advisory();
		return error == null
				? SurfaceResult.success(identity, snapshot.types())
				: SurfaceResult.partial(identity, snapshot.types(), error);
	}

	public CompletableFuture<SurfaceResult> extractSurfaceAsync(
			String packageId, String version, boolean includeNonPublic) {
		return submit(signal -> extractSurface(packageId, version, includeNonPublic, signal));
	}

	// ------------------------------------------------------------------ compare

	/**
	 * Compare two versions of a package. The two versions are downloaded and extracted concurrently,
	 * each in its own metadata context.
	 *
	 * @return the diff; download problems and unreadable modules are reported as comparison error
	 * @throws PackageNotFoundException if either version does not exist
	 * @throws ExtractionFailedException if either version has classes but none could be loaded
	 */
	public DiffResult compareVersions(String packageId, String fromVersion, String toVersion, CancellationSignal signal)
			throws IOException, InterruptedException {
		PackageIdentity oldIdentity = PackageIdentity.of(packageId, fromVersion);
		PackageIdentity newIdentity = PackageIdentity.of(packageId, toVersion);
		logger.info("Comparing {} {} -> {}", oldIdentity.id(), oldIdentity.version(), newIdentity.version());

		CancellationSignal oldSignal = signal.child();
		CompletableFuture<VersionSnapshot> oldFuture = CompletableFuture.supplyAsync(
				() -> {
					try {
						return loadVersion(oldIdentity, false, oldSignal);
					} catch (IOException e) {
						throw new CompletionException(e);
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
						throw new CancellationException("Interrupted while loading " + oldIdentity);
					}
				},
				executor);

		ChangeSet changes;
		try {
			VersionSnapshot newSnapshot;
			try {
				newSnapshot = loadVersion(newIdentity, false, signal);
			} catch (PackageNotFoundException | ExtractionFailedException e) {
				throw e;
			} catch (IOException e) {
				logger.warn("Could not extract {}: {}", newIdentity, e.getMessage());
				changes = new ChangeSet().comparisonError(e.getMessage());
				// A missing old version still fails the whole comparison
				awaitOldVersion(oldFuture, oldIdentity, changes);
				return new DiffResult(packageId, fromVersion, toVersion, changes);
			}

			changes = new ChangeSet();
			if (metaPackageDetector.detect(
					newSnapshot.candidates(), newSnapshot.archive().manifestBytes(), changes)) {
				// The type diff is skipped, but a missing old version is still an error
				awaitOldVersion(oldFuture, oldIdentity, changes);
				return new DiffResult(packageId, fromVersion, toVersion, changes);
			}

			VersionSnapshot oldSnapshot = awaitOldVersion(oldFuture, oldIdentity, changes);
			if (oldSnapshot == null) {
				return new DiffResult(packageId, fromVersion, toVersion, changes);
			}

			changes = diffEngine.compare(oldSnapshot.types(), newSnapshot.types(), signal);
			changes.appendComparisonError(oldSnapshot.advisory());
			changes.appendComparisonError(newSnapshot.advisory());
		} finally {
			if (!oldFuture.isDone()) {
				oldSignal.cancel();
			}
		}
		logger.info(
				"Compared {} {} -> {}: breaking={}, additions={}",
				packageId,
				fromVersion,
				toVersion,
				changes.hasBreakingChanges(),
				changes.hasAdditions());
		return new DiffResult(packageId, fromVersion, toVersion, changes);
	}

	public CompletableFuture<DiffResult> compareVersionsAsync(String packageId, String fromVersion, String toVersion) {
		return submit(signal -> compareVersions(packageId, fromVersion, toVersion, signal));
	}

	/**
	 * Compare two surfaces that were extracted earlier, for instance read back from JSON. When the new
	 * surface is a meta-package the type diff is skipped, as in {@link #compareVersions}.
	 */
	public DiffResult compareSurfaces(SurfaceResult oldSurface, SurfaceResult newSurface) {
		ChangeSet changes = new ChangeSet();
		if (!metaPackageDetector.detect(newSurface, changes)) {
			changes = diffEngine.compare(oldSurface.types(), newSurface.types());
		}
		changes.appendComparisonError(oldSurface.error());
		changes.appendComparisonError(newSurface.error());
		return new DiffResult(newSurface.packageId(), oldSurface.version(), newSurface.version(), changes);
	}

	public BreakingChangesCheck checkBreakingChanges(
			String packageId, String fromVersion, String toVersion, CancellationSignal signal)
			throws IOException, InterruptedException {
		return BreakingChangesCheck.from(compareVersions(packageId, fromVersion, toVersion, signal));
	}

	public CompletableFuture<BreakingChangesCheck> checkBreakingChangesAsync(
			String packageId, String fromVersion, String toVersion) {
		return submit(signal -> checkBreakingChanges(packageId, fromVersion, toVersion, signal));
	}

	/** Compare two versions and render the result as a Markdown report */
	public String diffReport(String packageId, String fromVersion, String toVersion, CancellationSignal signal)
			throws IOException, InterruptedException {
		return reportFormatter.formatDiffReport(compareVersions(packageId, fromVersion, toVersion, signal));
	}

	public CompletableFuture<String> diffReportAsync(String packageId, String fromVersion, String toVersion) {
		return submit(signal -> diffReport(packageId, fromVersion, toVersion, signal));
	}

	// ------------------------------------------------------------------ obsolete

	/** List the deprecated types and methods of a package version */
	public ObsoleteApisResult obsoleteApis(String packageId, String version, CancellationSignal signal)
			throws IOException, InterruptedException {
		return ObsoleteApisResult.from(extractSurface(packageId, version, false, signal));
	}

	public CompletableFuture<ObsoleteApisResult> obsoleteApisAsync(String packageId, String version) {
		return submit(signal -> obsoleteApis(packageId, version, signal));
	}

	// ------------------------------------------------------------------ decompile

	/**
	 * Render the classes of a package version, or a single type of it, as text.
	 *
	 * @param typeName binary name of the type to render, or null for every class
	 * @throws PackageNotFoundException if the registry has no such package version
	 */
	public DecompileResult decompile(String packageId, String version, String typeName, CancellationSignal signal)
			throws IOException, InterruptedException {
		PackageIdentity identity = PackageIdentity.of(packageId, version);
		signal.throwIfCancelled();
		PackageArchive archive;
		List<ModuleCandidate> candidates;
		try {
			archive = registry.resolve(identity);
			candidates = archiveExtractor.extract(archive.archiveBytes());
		} catch (PackageNotFoundException e) {
			throw e;
		} catch (IOException e) {
			return DecompileResult.failure(identity, typeName, e.getMessage());
		}
		if (candidates.isEmpty()) {
			return DecompileResult.failure(identity, typeName, "No classes found in package");
		}
		signal.throwIfCancelled();
		try (ScratchDirectory scratch = ScratchDirectory.create(config.scratchRoot(), identity.toString())) {
			writeModules(scratch, archive, candidates);
			signal.throwIfCancelled();
			return DecompileResult.success(identity, typeName, decompiler.decompile(scratch.path(), typeName));
		} catch (IOException e) {
			logger.warn("Could not decompile {}: {}", identity, e.getMessage());
			return DecompileResult.failure(identity, typeName, e.getMessage());
		}
	}

	public CompletableFuture<DecompileResult> decompileAsync(String packageId, String version, String typeName) {
		return submit(signal -> decompile(packageId, version, typeName, signal));
	}

	// ------------------------------------------------------------------ versions

	public VersionListing listVersions(String packageId) throws IOException, InterruptedException {
		return registry.listVersions(packageId);
	}

	public CompletableFuture<VersionListing> listVersionsAsync(String packageId) {
		return submit(signal -> listVersions(packageId));
	}

	// ------------------------------------------------------------------ internals

	private SurfaceResult metaSurface(PackageIdentity identity, PackageArchive archive) {
		try {
			List<String> dependencies = metaPackageDetector.dependencies(archive.manifestBytes());
			logger.info("{} contains no classes, it declares {} dependencies", identity, dependencies.size());
			return SurfaceResult.metaPackage(identity, dependencies, null);
		} catch (IOException e) {
			logger.warn("Could not read dependencies of {}: {}", identity, e.getMessage());
			return SurfaceResult.metaPackage(identity, List.of(), MetaPackageDetector.dependencyError(e));
		}
	}

	/** Everything captured about one version before its metadata context is closed */
	private record VersionSnapshot(
			PackageArchive archive, List<ModuleCandidate> candidates, List<TypeSurface> types, String advisory) {}

	private VersionSnapshot loadVersion(PackageIdentity identity, boolean includeNonPublic, CancellationSignal signal)
			throws IOException, InterruptedException {
		signal.throwIfCancelled();
		PackageArchive archive = registry.resolve(identity);
		List<ModuleCandidate> candidates = archiveExtractor.extract(archive.archiveBytes());
		if (candidates.isEmpty()) {
			logger.info("{} contains no class modules", identity);
			return new VersionSnapshot(archive, candidates, List.of(), null);
		}
		signal.throwIfCancelled();
		try (ScratchDirectory scratch = ScratchDirectory.create(config.scratchRoot(), identity.toString())) {
			List<Path> modulePaths = writeModules(scratch, archive, candidates);
			signal.throwIfCancelled();
			try (MetadataContext context = metadataLoader.open(modulePaths)) {
				if (context.size() == 0) {
					throw new ExtractionFailedException(identity, candidates.size());
				}
				List<TypeSurface> types = surfaceExtractor.extract(context, includeNonPublic, signal);
				logger.info("Extracted {} type(s) from {} module(s) of {}", types.size(), context.size(), identity);
				return new VersionSnapshot(archive, candidates, types, skippedAdvisory(identity, context.skippedModules()));
			}
		}
	}

	private List<Path> writeModules(ScratchDirectory scratch, PackageArchive archive, List<ModuleCandidate> candidates)
			throws IOException {
		Map<String, byte[]> modules = archiveExtractor.read(archive.archiveBytes(), candidates);
		List<Path> paths = new ArrayList<>(modules.size());
		for (Map.Entry<String, byte[]> module : modules.entrySet()) {
			paths.add(scratch.write(module.getKey(), module.getValue()));
		}
		return paths;
	}

	private static String skippedAdvisory(PackageIdentity identity, List<String> skipped) {
		if (skipped.isEmpty()) {
			return null;
		}
		StringBuilder sb = new StringBuilder();
		sb.append("Skipped ")
				.append(skipped.size())
				.append(" unreadable module(s) in ")
				.append(identity.version())
				.append(": ");
		sb.append(String.join(", ", skipped.subList(0, Math.min(MAX_SKIPPED_NAMES, skipped.size()))));
		if (skipped.size() > MAX_SKIPPED_NAMES) {
			sb.append(", ...");
		}
		return sb.toString();
	}

	/**
	 * Wait for the old version. A transport failure is recorded in the change-set and yields null,
	 * a missing version or a total extraction failure is rethrown.
	 */
	private static VersionSnapshot awaitOldVersion(
			CompletableFuture<VersionSnapshot> future, PackageIdentity identity, ChangeSet changes)
			throws IOException, InterruptedException {
		try {
			return await(future);
		} catch (PackageNotFoundException | ExtractionFailedException e) {
			throw e;
		} catch (IOException e) {
			logger.warn("Could not extract {}: {}", identity, e.getMessage());
			changes.appendComparisonError(e.getMessage());
			return null;
		}
	}

	/** Wait for a version loaded on the executor, unwrapping its checked failure */
	private static VersionSnapshot await(CompletableFuture<VersionSnapshot> future)
			throws IOException, InterruptedException {
		try {
			return future.get();
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof CompletionException && cause.getCause() != null) {
				cause = cause.getCause();
			}
			if (cause instanceof IOException) {
				throw (IOException) cause;
			}
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			throw new IOException(cause);
		}
	}

	@FunctionalInterface
	private interface InspectorCall<T> {
		T call(CancellationSignal signal) throws Exception;
	}

	private <T> CompletableFuture<T> submit(InspectorCall<T> call) {
		CancellationSignal signal = CancellationSignal.create();
		CompletableFuture<T> future = new CompletableFuture<>() {
			@Override
			public boolean cancel(boolean mayInterruptIfRunning) {
				signal.cancel();
				return super.cancel(mayInterruptIfRunning);
			}
		};
		executor.execute(() -> {
			if (future.isDone()) {
				return;
			}
			try {
				future.complete(call.call(signal));
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				future.completeExceptionally(new CancellationException("Interrupted"));
			} catch (Exception e) {
				future.completeExceptionally(e);
			}
		});
		return future;
	}

	@Override
	public void close() {
		executor.shutdownNow();
	}
}
