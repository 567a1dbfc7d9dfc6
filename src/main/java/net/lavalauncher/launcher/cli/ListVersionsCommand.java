package net.lavalauncher.launcher.cli;

import net.lavalauncher.launcher.downloads.DownloadManager;
import net.lavalauncher.launcher.install.InstallationManager;
import net.lavalauncher.launcher.javaruntime.JavaRuntimeManager;
import net.lavalauncher.launcher.utils.AnsiColor;
import net.lavalauncher.launcher.utils.CancellationToken;
import net.lavalauncher.launcher.utils.Logger;
import net.lavalauncher.launcher.versions.VersionManager;
import picocli.CommandLine;

import java.io.IOException;
import java.time.ZoneOffset;

@CommandLine.Command(name = "versions", description = "List the Minecraft versions that can be installed")
public class ListVersionsCommand extends LauncherCommand {
    private static final Logger LOG = Logger.create();

    @CommandLine.Option(names = "--reload", description = "Download the version catalog again, even if it is cached")
    boolean reload;

    @CommandLine.Option(names = "--all", description = "Also list releases older than the oldest supported version")
    boolean all;

    @Override
    protected int runLauncherCommand(DownloadManager downloadManager,
                                     VersionManager versionManager,
                                     JavaRuntimeManager javaRuntimeManager,
                                     InstallationManager installationManager) {
        try {
            var versions = all
                    ? versionManager.getReleaseVersions(reload, CancellationToken.NONE)
                    : installationManager.getAvailableVersions(reload, CancellationToken.NONE);
            for (var version : versions) {
                var releaseDate = version.getReleaseTime().atOffset(ZoneOffset.UTC).toLocalDate();
                var line = version.id() + AnsiColor.MUTED.paint(" (" + releaseDate + ")");
                if (versionManager.isVersionInstalled(version.id())) {
                    line += AnsiColor.BRIGHT_GREEN.paint(" ✓");
                }
                LOG.println(line);
            }
            return 0;
        } catch (IOException e) {
            LOG.error("Failed to list versions", e);
            return 1;
        }
    }
}
