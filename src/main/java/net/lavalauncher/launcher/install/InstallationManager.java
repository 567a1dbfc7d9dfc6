package net.lavalauncher.launcher.install;

import net.lavalauncher.launcher.downloads.DownloadProgressListener;
import net.lavalauncher.launcher.javaruntime.JavaRuntimeManager;
import net.lavalauncher.launcher.manifests.LauncherManifest;
import net.lavalauncher.launcher.store.InstallRecord;
import net.lavalauncher.launcher.store.InstallRecordStore;
import net.lavalauncher.launcher.store.InstallState;
import net.lavalauncher.launcher.utils.CancellationToken;
import net.lavalauncher.launcher.utils.FilenameUtil;
import net.lavalauncher.launcher.utils.LockManager;
import net.lavalauncher.launcher.utils.Logger;
import net.lavalauncher.launcher.utils.NamedThreadFactory;
import net.lavalauncher.launcher.utils.OperationCancelledException;
import net.lavalauncher.launcher.utils.StringUtil;
import net.lavalauncher.launcher.versions.ResolvedVersion;
import net.lavalauncher.launcher.versions.VersionDownloadListener;
import net.lavalauncher.launcher.versions.VersionManager;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Creates named instances of Minecraft versions.
 * <p>
 * An instance is recorded as {@link InstallState#INSTALLING} before anything is downloaded and only becomes
 * {@link InstallState#READY} once the game files and the Java runtime it needs are both in place. Failed
 * installations keep their record so they show up when listing instances.
 */
public class InstallationManager implements AutoCloseable {
    private static final Logger LOG = Logger.create();

    /**
     * Versions released before this are not offered for installation.
     */
    public static final Instant MINIMUM_RELEASE_TIME = Instant.parse("2020-06-23T00:00:00Z");

    private final Path instancesFolder;
    private final InstallRecordStore store;
    private final LockManager lockManager;
    private final VersionManager versionManager;
    private final JavaRuntimeManager javaRuntimeManager;
    private final ExecutorService executor = Executors.newCachedThreadPool(new NamedThreadFactory("install"));

    public InstallationManager(Path instancesFolder,
                               InstallRecordStore store,
                               LockManager lockManager,
                               VersionManager versionManager,
                               JavaRuntimeManager javaRuntimeManager) {
        this.instancesFolder = instancesFolder;
        this.store = store;
        this.lockManager = lockManager;
        this.versionManager = versionManager;
        this.javaRuntimeManager = javaRuntimeManager;
    }

    @Override
    public void close() throws InterruptedException {
        executor.shutdownNow();
        if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
            LOG.warn("Failed to wait for running installations to stop.");
        }
    }

    public Path getInstancesFolder() {
        return instancesFolder;
    }

    public Path getInstanceFolder(InstallRecord record) {
        return instancesFolder.resolve(record.folderName());
    }

    /**
     * Release versions that can be installed, newest first.
     */
    public List<LauncherManifest.Version> getAvailableVersions(boolean reload, CancellationToken cancellationToken) throws IOException {
        return versionManager.getReleaseVersions(reload, cancellationToken).stream()
                .filter(version -> version.getReleaseTime().isAfter(MINIMUM_RELEASE_TIME))
                .toList();
    }

    public List<InstallRecord> getInstances() throws IOException {
        return store.getAll();
    }

    @Nullable
    public InstallRecord getInstance(String name) throws IOException {
        return store.get(name);
    }

    /**
     * Installs {@code version} as a new instance called {@code name}.
     *
     * @param timeout if given, the installation is cancelled after this long
     * @return the record of the finished instance
     * @throws IllegalArgumentException        if the name is blank
     * @throws InstanceAlreadyExistsException  if an instance with this name exists
     * @throws InstallationFailedException     if resolving or downloading the version or Java runtime failed
     * @throws OperationCancelledException     if the token was cancelled or the timeout elapsed
     */
    public InstallRecord createInstance(LauncherManifest.Version version,
                                        String name,
                                        Consumer<InstallProgress> observer,
                                        CancellationToken cancellationToken,
                                        @Nullable Duration timeout) throws IOException {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("The instance name must not be blank");
        }
        if (store.exists(name)) {
            throw new InstanceAlreadyExistsException(name);
        }

        var start = System.nanoTime();

        InstallRecord record;
        try (var lock = lockManager.lock("instance-" + name)) {
            record = allocateInstance(version, name);
        }
        LOG.println("Installing Minecraft " + version.id() + " as '" + name + "' into " + instancesFolder.resolve(record.folderName()));

        var token = CancellationToken.linked(cancellationToken, timeout);
        try (token; var reporter = new InstallProgressReporter(name, observer)) {
            var resolved = versionManager.resolveVersion(version, token);
            record = record.withVersion(resolved.descriptor());
            store.update(record);

            reporter.reportStart();
            downloadFiles(resolved, reporter, token);
            reporter.reportFinished();

            store.setState(name, InstallState.READY);
        } catch (OperationCancelledException e) {
            LOG.error("Installation of '" + name + "' was stopped: " + e.getMessage());
            throw e;
        } catch (IOException | RuntimeException e) {
            if (token.isCancellationRequested()) {
                LOG.error("Installation of '" + name + "' was stopped: " + e.getMessage());
                var cancelled = new OperationCancelledException(token.getReason());
                cancelled.initCause(e);
                throw cancelled;
            }
            throw new InstallationFailedException(name, e);
        }

        var elapsed = Duration.ofNanos(System.nanoTime() - start);
        LOG.println("✓ Installed '" + name + "' in " + StringUtil.formatDuration(elapsed));
        return record.withState(InstallState.READY);
    }

    /**
     * Picks the game folder and creates the record. Must be called while holding the lock for the name.
     */
    private InstallRecord allocateInstance(LauncherManifest.Version version, String name) throws IOException {
        if (store.exists(name)) {
            throw new InstanceAlreadyExistsException(name);
        }

        Files.createDirectories(instancesFolder);
        List<String> existingFolders;
        try (var stream = Files.list(instancesFolder)) {
            existingFolders = stream.map(path -> path.getFileName().toString()).toList();
        }
        var folderName = FilenameUtil.getUniqueFolderName(name, existingFolders);

        var folder = instancesFolder.resolve(folderName);
        try {
            Files.createDirectory(folder);
        } catch (FileAlreadyExistsException e) {
            var conflict = new InstanceAlreadyExistsException(name, "The folder " + folderName + " for instance '" + name + "' already exists");
            conflict.initCause(e);
            throw conflict;
        }

        var record = InstallRecord.installing(name, version.id(), folderName);
        try {
            store.insert(record);
        } catch (FileAlreadyExistsException e) {
            // exists() skips records that cannot be read, but their file still takes the name
            var conflict = new InstanceAlreadyExistsException(name, "The install record of instance '" + name
                                                                     + "' cannot be read, remove " + e.getFile() + " to reuse the name");
            conflict.initCause(e);
            Files.delete(folder);
            throw conflict;
        } catch (IOException | RuntimeException e) {
            Files.delete(folder);
            throw e;
        }
        return record;
    }

    /**
     * Game files and Java runtime are downloaded concurrently. If one of them fails, the other is cancelled.
     */
    private void downloadFiles(ResolvedVersion resolved,
                               InstallProgressReporter reporter,
                               CancellationToken cancellationToken) throws IOException {
        try (var branchToken = CancellationToken.linked(cancellationToken, null)) {
            runDownloads(resolved, reporter, cancellationToken, branchToken);
        }
    }

    private void runDownloads(ResolvedVersion resolved,
                              InstallProgressReporter reporter,
                              CancellationToken cancellationToken,
                              CancellationToken branchToken) throws IOException {
        var manifest = resolved.manifest();
        var javaVersion = resolved.descriptor().requiredJavaVersion();
        var firstFailure = new AtomicReference<Throwable>();

        var listener = new VersionDownloadListener(
                toPercent(reporter::reportMinecraftProgress),
                toPercent(reporter::reportAssetsProgress),
                toPercent(reporter::reportLibrariesProgress)
        );
        // The failure is recorded before the future completes, so it is visible once allOf returns
        Consumer<Throwable> onFailure = error -> {
            if (firstFailure.compareAndSet(null, error)) {
                branchToken.cancel();
            }
        };
        var gameFiles = runAsync(() -> versionManager.downloadVersionFiles(manifest, listener, branchToken), onFailure);
        var javaRuntime = runAsync(() -> javaRuntimeManager.installJava(javaVersion, toPercent(reporter::reportJavaProgress), branchToken), onFailure);

        try {
            CompletableFuture.allOf(gameFiles, javaRuntime).join();
        } catch (CompletionException e) {
            // Reported through firstFailure
            LOG.debug("Download failed: " + e.getCause());
        }

        cancellationToken.throwIfCancellationRequested();
        var failure = firstFailure.get();
        if (failure instanceof IOException ioException) {
            throw ioException;
        } else if (failure instanceof RuntimeException runtimeException) {
            throw runtimeException;
        } else if (failure != null) {
            throw new IOException(failure.getMessage(), failure);
        }
    }

    private CompletableFuture<Void> runAsync(InstallStep step, Consumer<Throwable> onFailure) {
        return CompletableFuture.runAsync(() -> {
            try {
                step.run();
            } catch (Exception e) {
                onFailure.accept(e);
                throw e instanceof RuntimeException runtimeException ? runtimeException : new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Converts fractions to whole percentages, holding back 100 until the stream is complete.
     * Only percentages higher than any reported before are passed on.
     */
    static DownloadProgressListener toPercent(IntConsumer reporter) {
        var highest = new AtomicInteger(-1);
        return fraction -> {
            var percent = fraction < 1.0 ? Math.min((int) (fraction * 100), 99) : 100;
            if (highest.getAndAccumulate(percent, Math::max) < percent) {
                reporter.accept(percent);
            }
        };
    }

    @FunctionalInterface
    private interface InstallStep {
        void run() throws Exception;
    }
}
