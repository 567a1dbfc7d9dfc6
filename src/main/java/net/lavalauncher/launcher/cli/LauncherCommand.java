package net.lavalauncher.launcher.cli;

import net.lavalauncher.launcher.downloads.DownloadManager;
import net.lavalauncher.launcher.install.InstallationManager;
import net.lavalauncher.launcher.javaruntime.JavaRuntimeManager;
import net.lavalauncher.launcher.versions.VersionManager;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Base class for commands that need the version, Java runtime and instance managers.
 */
public abstract class LauncherCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    Main commonOptions;

    @Override
    public Integer call() throws Exception {
        try (var downloadManager = commonOptions.createDownloadManager();
             var versionManager = commonOptions.createVersionManager(downloadManager)) {
            var javaRuntimeManager = commonOptions.createJavaRuntimeManager(downloadManager);
            try (var installationManager = commonOptions.createInstallationManager(versionManager, javaRuntimeManager)) {
                return runLauncherCommand(downloadManager, versionManager, javaRuntimeManager, installationManager);
            }
        }
    }

    protected abstract int runLauncherCommand(DownloadManager downloadManager,
                                              VersionManager versionManager,
                                              JavaRuntimeManager javaRuntimeManager,
                                              InstallationManager installationManager) throws Exception;
}
