package net.lavalauncher.launcher.cli;

import net.lavalauncher.launcher.downloads.DownloadManager;
import net.lavalauncher.launcher.install.InstallationManager;
import net.lavalauncher.launcher.javaruntime.JavaRuntimeManager;
import net.lavalauncher.launcher.store.InstallState;
import net.lavalauncher.launcher.utils.AnsiColor;
import net.lavalauncher.launcher.utils.Logger;
import net.lavalauncher.launcher.versions.VersionManager;
import picocli.CommandLine;

import java.io.IOException;

@CommandLine.Command(name = "instances", description = "List the installed instances")
public class ListInstancesCommand extends LauncherCommand {
    private static final Logger LOG = Logger.create();

    @Override
    protected int runLauncherCommand(DownloadManager downloadManager,
                                     VersionManager versionManager,
                                     JavaRuntimeManager javaRuntimeManager,
                                     InstallationManager installationManager) {
        try {
            var instances = installationManager.getInstances();
            if (instances.isEmpty()) {
                LOG.println("No instances installed.");
                return 0;
            }
            for (var instance : instances) {
                var stateColor = instance.state() == InstallState.READY ? AnsiColor.BRIGHT_GREEN : AnsiColor.YELLOW;
                LOG.println(instance.id()
                            + " " + AnsiColor.MUTED.paint("Minecraft " + instance.versionId())
                            + " " + stateColor.paint(instance.state())
                            + " " + AnsiColor.MUTED.paint(installationManager.getInstanceFolder(instance)));
            }
            return 0;
        } catch (IOException e) {
            LOG.error("Failed to list instances", e);
            return 1;
        }
    }
}
