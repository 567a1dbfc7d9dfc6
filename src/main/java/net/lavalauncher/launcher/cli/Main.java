package net.lavalauncher.launcher.cli;

import net.lavalauncher.launcher.downloads.AssetDownloader;
import net.lavalauncher.launcher.downloads.DownloadManager;
import net.lavalauncher.launcher.install.InstallationManager;
import net.lavalauncher.launcher.utils.LockManager;
import net.lavalauncher.launcher.javaruntime.JavaPlatform;
import net.lavalauncher.launcher.javaruntime.JavaRuntimeManager;
import net.lavalauncher.launcher.manifests.RuleContext;
import net.lavalauncher.launcher.store.JsonInstallRecordStore;
import net.lavalauncher.launcher.utils.Logger;
import net.lavalauncher.launcher.utils.OsUtil;
import net.lavalauncher.launcher.versions.VersionManager;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;
import static picocli.CommandLine.ScopeType;

@Command(name = "lava-launcher", subcommands = {ListVersionsCommand.class, InstallCommand.class, ListInstancesCommand.class, LaunchCommand.class}, mixinStandardHelpOptions = true)
public class Main {
    @Option(names = "--home-dir", scope = ScopeType.INHERIT, defaultValue = "${env:LAVA_LAUNCHER_HOME}", description = "Where the launcher stores versions, instances and Java runtimes.")
    @Nullable
    Path homeDir;

    @Option(names = "--concurrent-downloads", scope = ScopeType.INHERIT, description = "How many files are downloaded at the same time.")
    int concurrentDownloads = DownloadManager.DEFAULT_CONCURRENT_DOWNLOADS;

    @Option(names = "--catalog-uri", arity = "1..*", scope = ScopeType.INHERIT, description = "Version catalogs to try, in order.")
    List<URI> catalogUris = new ArrayList<>(VersionManager.DEFAULT_CATALOG_URIS);

    @Option(names = "--asset-repository", scope = ScopeType.INHERIT, description = "Where game assets are downloaded from.")
    URI assetRepository = AssetDownloader.DEFAULT_ASSET_REPOSITORY;

    @Option(names = "--java-api-uri", scope = ScopeType.INHERIT, description = "Base URI of the Adoptium API used to download Java runtimes.")
    URI javaApiUri = JavaRuntimeManager.DEFAULT_API_URI;

    @Option(
            names = "--verbose",
            description = "Enable verbose output",
            scope = ScopeType.INHERIT,
            negatable = true,
            fallbackValue = "true"
    )
    boolean verbose;

    @Option(
            names = "--color",
            description = "Enable color console output",
            scope = ScopeType.INHERIT,
            negatable = true,
            fallbackValue = "true"
    )
    boolean color = shouldEnableColor();

    @Option(
            names = "--emojis",
            description = "Enable use of emojis in console output",
            scope = ScopeType.INHERIT,
            negatable = true,
            fallbackValue = "true"
    )
    boolean emojis = shouldEnableEmojis();

    /**
     * Windows console is sadly too finicky for now.
     */
    private boolean shouldEnableEmojis() {
        return OsUtil.isLinux() || OsUtil.isMac();
    }

    private static boolean shouldEnableColor() {
        return System.getenv("NO_COLOR") == null || System.getenv("NO_COLOR").isEmpty();
    }

    public Path getHomeDir() {
        return Objects.requireNonNullElseGet(homeDir, Main::getDefaultHomeDir);
    }

    public Path getInstancesFolder() {
        return getHomeDir().resolve("instances");
    }

    private static Path getDefaultHomeDir() {
        var userHomeDir = Paths.get(System.getProperty("user.home"));

        if (OsUtil.isLinux()) {
            var xdgDataHome = System.getenv("XDG_DATA_HOME");
            if (xdgDataHome != null && xdgDataHome.startsWith("/")) {
                return Paths.get(xdgDataHome).resolve("lavalauncher");
            } else {
                return userHomeDir.resolve(".local/share/lavalauncher");
            }
        } else if (OsUtil.isMac()) {
            return userHomeDir.resolve("Library/Application Support/LavaLauncher");
        }
        var appData = System.getenv("APPDATA");
        if (appData != null && !appData.isEmpty()) {
            return Paths.get(appData).resolve(".lavalauncher");
        }
        return userHomeDir.resolve(".lavalauncher");
    }

    public static void main(String... args) {
        var baseCommand = new Main();
        var commandLine = new CommandLine(baseCommand);
        commandLine.parseArgs(args);
        Logger.NO_COLOR = !baseCommand.color;
        Logger.NO_EMOJIS = !baseCommand.emojis;
        Logger.VERBOSE = baseCommand.verbose;
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    public DownloadManager createDownloadManager() {
        return new DownloadManager(concurrentDownloads);
    }

    public VersionManager createVersionManager(DownloadManager downloadManager) {
        return new VersionManager(
                getHomeDir(),
                downloadManager,
                catalogUris,
                assetRepository,
                concurrentDownloads,
                RuleContext.current()
        );
    }

    public JavaRuntimeManager createJavaRuntimeManager(DownloadManager downloadManager) throws IOException {
        return new JavaRuntimeManager(getHomeDir().resolve("java"), downloadManager, createLockManager(), javaApiUri, JavaPlatform.current());
    }

    public LockManager createLockManager() throws IOException {
        var lockManager = new LockManager(getHomeDir().resolve("locks"));
        lockManager.setVerbose(verbose);
        return lockManager;
    }

    public InstallationManager createInstallationManager(VersionManager versionManager,
                                                         JavaRuntimeManager javaRuntimeManager) throws IOException {
        return new InstallationManager(
                getInstancesFolder(),
                new JsonInstallRecordStore(getHomeDir().resolve("instances.d")),
                createLockManager(),
                versionManager,
                javaRuntimeManager
        );
    }
}
