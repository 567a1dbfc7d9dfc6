package net.lavalauncher.launcher.downloads;

import net.lavalauncher.launcher.manifests.MinecraftLibrary;
import net.lavalauncher.launcher.manifests.RuleContext;
import net.lavalauncher.launcher.utils.ArchiveUtil;
import net.lavalauncher.launcher.utils.CancellationToken;
import net.lavalauncher.launcher.utils.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Downloads the libraries of a Minecraft version into the shared libraries folder.
 * <p>
 * Libraries that ship native code for the current OS have an additional classifier archive. That archive is
 * downloaded into the natives folder of the version, its native libraries are extracted next to it and the
 * archive itself is deleted afterwards.
 */
public class LibraryDownloader {
    private static final Logger LOG = Logger.create();

    private final DownloadManager downloadManager;
    private final Path librariesFolder;
    private final int concurrentDownloads;

    public LibraryDownloader(DownloadManager downloadManager, Path librariesFolder, int concurrentDownloads) {
        this.downloadManager = downloadManager;
        this.librariesFolder = librariesFolder;
        this.concurrentDownloads = concurrentDownloads;
    }

    /**
     * Only libraries whose rules match the context are downloaded, and every library name only once.
     */
    public static List<MinecraftLibrary> selectLibraries(List<MinecraftLibrary> libraries, RuleContext context) {
        var selected = new LinkedHashMap<String, MinecraftLibrary>();
        for (var library : libraries) {
            if (library.rulesMatch(context)) {
                selected.putIfAbsent(library.artifactId(), library);
            }
        }
        return List.copyOf(selected.values());
    }

    public void downloadLibraries(List<MinecraftLibrary> libraries,
                                  RuleContext context,
                                  Path nativesFolder,
                                  DownloadProgressListener progressListener,
                                  CancellationToken cancellationToken) throws IOException, DownloadsFailedException {
        var selected = selectLibraries(libraries, context);
        LOG.println("Downloading " + selected.size() + " libraries");
        Files.createDirectories(librariesFolder);

        try (var downloader = new ParallelDownloader(downloadManager, concurrentDownloads, librariesFolder,
                selected.size(), progressListener, cancellationToken)) {
            for (var library : selected) {
                downloader.submit(() -> downloadLibrary(library, context, nativesFolder, cancellationToken));
            }
        }
    }

    private void downloadLibrary(MinecraftLibrary library,
                                 RuleContext context,
                                 Path nativesFolder,
                                 CancellationToken cancellationToken) throws IOException {
        var artifact = library.getArtifactDownload();
        if (artifact != null) {
            if (artifact.path() == null) {
                throw new IOException("Library " + library + " has an artifact download without a path");
            }
            downloadManager.download(artifact, librariesFolder.resolve(artifact.path()), DownloadProgressListener.NONE, cancellationToken);
        }

        var nativesDownload = library.getNativesDownload(context);
        if (nativesDownload == null) {
            if (library.getNativesClassifier(context) != null) {
                LOG.warn("Library " + library + " declares natives for " + context.os().getManifestName()
                         + " but has no download for classifier " + library.getNativesClassifier(context));
            }
            return;
        }

        var archive = downloadManager.downloadToDirectory(nativesDownload, nativesFolder, DownloadProgressListener.NONE, cancellationToken);
        try {
            var extracted = ArchiveUtil.extractNativeLibraries(archive, nativesFolder, library.getExtractExcludes());
            LOG.debug("Extracted " + extracted + " from " + archive.getFileName());
        } catch (IOException e) {
            throw new IOException("Failed to extract native libraries of " + library + " from " + archive + ": " + e.getMessage(), e);
        } finally {
            Files.deleteIfExists(archive);
        }
    }
}
