package net.lavalauncher.launcher.versions;

import net.lavalauncher.launcher.downloads.AssetDownloader;
import net.lavalauncher.launcher.downloads.DownloadManager;
import net.lavalauncher.launcher.downloads.DownloadProgressListener;
import net.lavalauncher.launcher.downloads.DownloadSpec;
import net.lavalauncher.launcher.downloads.DownloadsFailedException;
import net.lavalauncher.launcher.downloads.LibraryDownloader;
import net.lavalauncher.launcher.manifests.LauncherManifest;
import net.lavalauncher.launcher.manifests.MinecraftLibrary;
import net.lavalauncher.launcher.manifests.MinecraftVersionManifest;
import net.lavalauncher.launcher.manifests.RuleContext;
import net.lavalauncher.launcher.utils.CancellationToken;
import net.lavalauncher.launcher.utils.FileUtil;
import net.lavalauncher.launcher.utils.Logger;
import net.lavalauncher.launcher.utils.NamedThreadFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Knows which Minecraft versions exist, where their files live on disk and how to download them.
 * <p>
 * Layout below the base directory:
 * <pre>
 * versions/version_manifest_v2.json   cached version catalog
 * versions/&lt;id&gt;/&lt;id&gt;.json             version details
 * versions/&lt;id&gt;/&lt;id&gt;.jar              client jar
 * versions/&lt;id&gt;/natives/             extracted native libraries
 * assets/                             shared by all versions
 * libraries/                          shared by all versions
 * </pre>
 */
public class VersionManager implements AutoCloseable {
    private static final Logger LOG = Logger.create();

    public static final List<URI> DEFAULT_CATALOG_URIS = List.of(
            URI.create("https://piston-meta.mojang.com/mc/game/version_manifest_v2.json"),
            URI.create("https://launchermeta.mojang.com/mc/game/version_manifest_v2.json")
    );

    static final String CATALOG_FILENAME = "version_manifest_v2.json";

    private final Path versionsFolder;
    private final Path assetsFolder;
    private final Path librariesFolder;
    private final DownloadManager downloadManager;
    private final List<URI> catalogUris;
    private final URI assetRepository;
    private final RuleContext ruleContext;
    private final AssetDownloader assetDownloader;
    private final LibraryDownloader libraryDownloader;
    private final ExecutorService executor = Executors.newFixedThreadPool(3, new NamedThreadFactory("version-download"));

    public VersionManager(Path baseDir,
                          DownloadManager downloadManager,
                          List<URI> catalogUris,
                          URI assetRepository,
                          int concurrentDownloads,
                          RuleContext ruleContext) {
        if (catalogUris.isEmpty()) {
            throw new IllegalArgumentException("At least one version catalog URI is required");
        }
        this.versionsFolder = baseDir.resolve("versions");
        this.assetsFolder = baseDir.resolve("assets");
        this.librariesFolder = baseDir.resolve("libraries");
        this.downloadManager = downloadManager;
        this.catalogUris = List.copyOf(catalogUris);
        this.assetRepository = assetRepository;
        this.ruleContext = ruleContext;
        this.assetDownloader = new AssetDownloader(downloadManager, assetsFolder, concurrentDownloads);
        this.libraryDownloader = new LibraryDownloader(downloadManager, librariesFolder, concurrentDownloads);
    }

    @Override
    public void close() throws InterruptedException {
        executor.shutdownNow();
        if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
            LOG.warn("Failed to wait for version downloads to finish.");
        }
    }

    public Path getAssetsFolder() {
        return assetsFolder;
    }

    public Path getLibrariesFolder() {
        return librariesFolder;
    }

    public Path getInstallationFolder(String versionId) {
        return versionsFolder.resolve(versionId);
    }

    public Path getClientJarPath(String versionId) {
        return getInstallationFolder(versionId).resolve(versionId + ".jar");
    }

    public Path getNativeLibrariesFolder(String versionId) {
        return getInstallationFolder(versionId).resolve("natives");
    }

    public RuleContext getRuleContext() {
        return ruleContext;
    }

    public boolean isVersionInstalled(String versionId) {
        return Files.isRegularFile(getClientJarPath(versionId));
    }

    /**
     * Release versions from the catalog, in catalog order (newest first).
     */
    public List<LauncherManifest.Version> getReleaseVersions(boolean reload, CancellationToken cancellationToken) throws IOException {
        return loadCatalog(reload, cancellationToken).versions().stream()
                .filter(LauncherManifest.Version::isRelease)
                .toList();
    }

    /**
     * Uses the cached catalog unless {@code reload} is set or the cache is missing or unreadable.
     * Otherwise the catalog URIs are tried in order until one of them works.
     */
    public LauncherManifest loadCatalog(boolean reload, CancellationToken cancellationToken) throws IOException {
        var cacheFile = versionsFolder.resolve(CATALOG_FILENAME);
        if (!reload && Files.isRegularFile(cacheFile)) {
            try {
                return LauncherManifest.from(cacheFile);
            } catch (IOException e) {
                LOG.warn("Cached version catalog " + cacheFile + " is unreadable, downloading it again: " + e.getMessage());
            }
        }

        var downloadedFile = versionsFolder.resolve(CATALOG_FILENAME + ".new");
        var errors = new ArrayList<IOException>();
        for (var catalogUri : catalogUris) {
            cancellationToken.throwIfCancellationRequested();
            try {
                downloadManager.download(DownloadSpec.of(catalogUri), downloadedFile, DownloadProgressListener.NONE, cancellationToken);
                var catalog = LauncherManifest.from(downloadedFile);
                FileUtil.atomicMove(downloadedFile, cacheFile);
                LOG.debug("Loaded version catalog with " + catalog.versions().size() + " versions from " + catalogUri);
                return catalog;
            } catch (IOException e) {
                LOG.warn("Failed to load version catalog from " + catalogUri + ": " + e.getMessage());
                errors.add(e);
            }
        }
        Files.deleteIfExists(downloadedFile);

        var failure = new IOException("Failed to load the version catalog from any of " + catalogUris);
        errors.forEach(failure::addSuppressed);
        throw failure;
    }

    /**
     * Downloads the details of a catalog entry, keeps them on disk and resolves them for this platform.
     */
    public ResolvedVersion resolveVersion(LauncherManifest.Version version, CancellationToken cancellationToken) throws IOException {
        var detailsFile = getDetailsFile(version.id());
        downloadManager.download(version, detailsFile, DownloadProgressListener.NONE, cancellationToken);
        var manifest = MinecraftVersionManifest.from(detailsFile);
        return new ResolvedVersion(manifest, describe(manifest));
    }

    /**
     * Re-reads the details of a version from disk, without any network access.
     */
    public ResolvedVersion getCachedVersion(String versionId) throws IOException {
        var manifest = MinecraftVersionManifest.from(getDetailsFile(versionId));
        return new ResolvedVersion(manifest, describe(manifest));
    }

    public VersionDescriptor describe(MinecraftVersionManifest manifest) throws IOException {
        var versionId = manifest.id();
        if (manifest.assetIndex() == null) {
            throw new IOException("Version " + versionId + " does not declare an asset index");
        }

        var classPath = LibraryDownloader.selectLibraries(manifest.libraries(), ruleContext).stream()
                .map(MinecraftLibrary::getArtifactDownload)
                .filter(Objects::nonNull)
                .map(download -> download.path())
                .filter(Objects::nonNull)
                .toList();

        return new VersionDescriptor(
                versionId,
                Objects.requireNonNullElse(manifest.type(), "release"),
                manifest.getJavaMajorVersion(),
                getClientJarPath(versionId),
                manifest.mainClass(),
                getInstallationFolder(versionId),
                assetsFolder,
                librariesFolder,
                getNativeLibrariesFolder(versionId),
                manifest.assetIndex().id(),
                classPath,
                manifest.getGameArguments(ruleContext),
                manifest.getJvmArguments(ruleContext)
        );
    }

    /**
     * Downloads client jar, assets and libraries of a version. The three run concurrently; if any of them
     * fails, the first failure is rethrown once all of them have stopped.
     */
    public void downloadVersionFiles(MinecraftVersionManifest manifest,
                                     VersionDownloadListener listener,
                                     CancellationToken cancellationToken) throws IOException, DownloadsFailedException {
        var versionId = manifest.id();
        var clientDownload = manifest.getClientDownload();
        if (clientDownload == null) {
            throw new IOException("Version " + versionId + " has no client download");
        }
        Files.createDirectories(getInstallationFolder(versionId));

        var futures = List.of(
                runAsync(() -> downloadManager.download(clientDownload, getClientJarPath(versionId), listener.clientJar(), cancellationToken)),
                runAsync(() -> assetDownloader.downloadAssets(manifest.assetIndex(), assetRepository, listener.assets(), cancellationToken)),
                runAsync(() -> libraryDownloader.downloadLibraries(manifest.libraries(), ruleContext,
                        getNativeLibrariesFolder(versionId), listener.libraries(), cancellationToken))
        );

        Throwable firstError = null;
        for (var future : futures) {
            try {
                future.join();
            } catch (CompletionException e) {
                if (firstError == null) {
                    firstError = e.getCause();
                }
            }
        }

        if (firstError instanceof IOException ioException) {
            throw ioException;
        } else if (firstError instanceof DownloadsFailedException downloadsFailedException) {
            throw downloadsFailedException;
        } else if (firstError instanceof RuntimeException runtimeException) {
            throw runtimeException;
        } else if (firstError != null) {
            throw new IOException("Failed to download files of version " + versionId, firstError);
        }
        LOG.println("✓ Downloaded files of Minecraft " + versionId);
    }

    private Path getDetailsFile(String versionId) {
        return getInstallationFolder(versionId).resolve(versionId + ".json");
    }

    private CompletableFuture<Void> runAsync(DownloadAction action) {
        return CompletableFuture.runAsync(() -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    @FunctionalInterface
    private interface DownloadAction {
        void run() throws Exception;
    }
}
