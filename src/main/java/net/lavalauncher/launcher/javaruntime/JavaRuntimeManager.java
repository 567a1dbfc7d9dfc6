package net.lavalauncher.launcher.javaruntime;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import net.lavalauncher.launcher.downloads.DownloadManager;
import net.lavalauncher.launcher.downloads.DownloadProgressListener;
import net.lavalauncher.launcher.utils.ArchiveUtil;
import net.lavalauncher.launcher.utils.CancellationToken;
import net.lavalauncher.launcher.utils.FileUtil;
import net.lavalauncher.launcher.utils.LockManager;
import net.lavalauncher.launcher.utils.Logger;
import org.jetbrains.annotations.Nullable;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Installs Eclipse Temurin runtimes from the Adoptium API, one folder per major version and platform.
 */
public class JavaRuntimeManager {
    private static final Logger LOG = Logger.create();

    public static final int MINIMUM_JAVA_VERSION = 8;

    public static final URI DEFAULT_API_URI = URI.create("https://api.adoptium.net/v3/");

    private final Path installationsFolder;
    private final DownloadManager downloadManager;
    private final LockManager lockManager;
    private final URI apiUri;
    private final JavaPlatform platform;

    /**
     * @param apiUri Base URI of the Adoptium API, ending with a slash.
     */
    public JavaRuntimeManager(Path installationsFolder,
                              DownloadManager downloadManager,
                              LockManager lockManager,
                              URI apiUri,
                              JavaPlatform platform) {
        this.installationsFolder = installationsFolder;
        this.downloadManager = downloadManager;
        this.lockManager = lockManager;
        this.apiUri = apiUri;
        this.platform = platform;
    }

    public JavaPlatform getPlatform() {
        return platform;
    }

    public Path getInstallationFolder(int majorVersion) {
        return installationsFolder.resolve(platform.getInstallationName(majorVersion));
    }

    public boolean isInstalled(int majorVersion) {
        return getJavaExecutablePath(majorVersion) != null;
    }

    /**
     * macOS archives keep the runtime inside a bundle, so both layouts are checked.
     *
     * @return null if no runtime for that major version is installed
     */
    @Nullable
    public Path getJavaExecutablePath(int majorVersion) {
        var folder = getInstallationFolder(majorVersion);
        var executableName = platform.os().equals("windows") ? "java.exe" : "java";
        for (var candidate : List.of(folder.resolve("bin"), folder.resolve("Contents/Home/bin"))) {
            var executable = candidate.resolve(executableName);
            if (Files.isRegularFile(executable)) {
                return executable;
            }
        }
        return null;
    }

    /**
     * Makes sure a runtime for the given major version is installed.
     *
     * @throws UnsupportedPlatformException if Adoptium has no runtime for this version and platform
     * @throws IllegalArgumentException     if the major version is older than Java 8
     */
    public void installJava(int majorVersion, DownloadProgressListener progressListener, CancellationToken cancellationToken) throws IOException {
        if (majorVersion < MINIMUM_JAVA_VERSION) {
            throw new IllegalArgumentException("Java " + majorVersion + " is not supported, the minimum is " + MINIMUM_JAVA_VERSION);
        }

        if (isInstalled(majorVersion)) {
            reportAlreadyInstalled(majorVersion, progressListener);
            return;
        }

        // Installations of different instances share the runtime folder
        try (var lock = lockManager.lock("java-" + platform.getInstallationName(majorVersion))) {
            if (isInstalled(majorVersion)) {
                reportAlreadyInstalled(majorVersion, progressListener);
                return;
            }
            install(majorVersion, progressListener, cancellationToken);
        }
    }

    private void reportAlreadyInstalled(int majorVersion, DownloadProgressListener progressListener) {
        LOG.debug("Java " + majorVersion + " is already installed in " + getInstallationFolder(majorVersion));
        progressListener.onProgress(1.0);
    }

    private void install(int majorVersion, DownloadProgressListener progressListener, CancellationToken cancellationToken) throws IOException {
        var archiveSpec = findRelease(majorVersion, cancellationToken);
        LOG.println("Installing Java " + majorVersion + " (" + archiveSpec.name() + ")");

        var installationFolder = getInstallationFolder(majorVersion);
        var tempDir = Files.createTempDirectory("lava-java-" + majorVersion + "-");
        try {
            var archive = downloadManager.downloadToDirectory(archiveSpec, tempDir, progressListener.scaled(0, 0.95), cancellationToken);
            cancellationToken.throwIfCancellationRequested();

            // Anything left over is from an earlier, broken installation
            FileUtil.deleteRecursively(installationFolder);
            try {
                extract(archive, installationFolder);
                if (!isInstalled(majorVersion)) {
                    throw new IOException("Java archive " + archiveSpec.name() + " does not contain a Java executable");
                }
            } catch (IOException e) {
                try {
                    FileUtil.deleteRecursively(installationFolder);
                } catch (IOException cleanupError) {
                    e.addSuppressed(cleanupError);
                }
                throw e;
            }
            progressListener.onProgress(0.98);
        } finally {
            try {
                FileUtil.deleteRecursively(tempDir);
            } catch (IOException e) {
                LOG.warn("Failed to delete temporary directory " + tempDir + ": " + e.getMessage());
            }
        }

        progressListener.onProgress(1.0);
        LOG.println("✓ Installed Java " + majorVersion + " into " + installationFolder);
    }

    private void extract(Path archive, Path installationFolder) throws IOException {
        if (platform.archiveExtension().equals("zip")) {
            ArchiveUtil.extractZip(archive, installationFolder);
        } else {
            ArchiveUtil.extractTarGz(archive, installationFolder);
        }
        ArchiveUtil.flattenSingleRootDirectory(installationFolder);
    }

    private AdoptiumRelease.ReleasePackage findRelease(int majorVersion, CancellationToken cancellationToken) throws IOException {
        var uri = apiUri.resolve("assets/latest/" + majorVersion + "/hotspot?architecture=" + platform.arch()
                                 + "&image_type=jdk&os=" + platform.os() + "&vendor=eclipse");

        String json;
        try {
            json = downloadManager.downloadString(uri, cancellationToken);
        } catch (FileNotFoundException e) {
            throw new UnsupportedPlatformException(describeUnsupported(majorVersion), e);
        }

        AdoptiumRelease[] releases;
        try {
            releases = new Gson().fromJson(json, AdoptiumRelease[].class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed response from " + uri + ": " + e.getMessage(), e);
        }

        if (releases == null || releases.length == 0) {
            throw new UnsupportedPlatformException(describeUnsupported(majorVersion));
        }
        var binary = releases[0].binary();
        if (binary == null || binary.archive() == null || binary.archive().uri() == null) {
            throw new IOException("Response from " + uri + " does not contain a download link");
        }
        return binary.archive();
    }

    private String describeUnsupported(int majorVersion) {
        return "Java " + majorVersion + " is not available for " + platform.os() + " on " + platform.arch();
    }
}
