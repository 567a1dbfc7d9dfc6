package net.lavalauncher.launcher.cli;

import net.lavalauncher.launcher.downloads.DownloadManager;
import net.lavalauncher.launcher.install.InstallProgress;
import net.lavalauncher.launcher.install.InstallationFailedException;
import net.lavalauncher.launcher.install.InstallationManager;
import net.lavalauncher.launcher.install.InstanceAlreadyExistsException;
import net.lavalauncher.launcher.javaruntime.JavaRuntimeManager;
import net.lavalauncher.launcher.utils.CancellationToken;
import net.lavalauncher.launcher.utils.Logger;
import net.lavalauncher.launcher.utils.OperationCancelledException;
import net.lavalauncher.launcher.versions.VersionManager;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

@CommandLine.Command(name = "install", description = "Install a Minecraft version as a new instance")
public class InstallCommand extends LauncherCommand {
    private static final Logger LOG = Logger.create();

    @CommandLine.Option(names = "--version", required = true, description = "The Minecraft version to install, or 'latest' for the newest release")
    String version;

    @CommandLine.Option(names = "--name", description = "Name of the new instance. Defaults to the version.")
    @Nullable
    String name;

    @CommandLine.Option(names = "--timeout", description = "Give up after this long, e.g. PT30M")
    @Nullable
    Duration timeout;

    @Override
    protected int runLauncherCommand(DownloadManager downloadManager,
                                     VersionManager versionManager,
                                     JavaRuntimeManager javaRuntimeManager,
                                     InstallationManager installationManager) throws IOException {
        var versions = installationManager.getAvailableVersions(false, CancellationToken.NONE);
        var catalogEntry = versions.stream()
                .filter(v -> version.equals("latest") || v.id().equals(version))
                .findFirst()
                .orElse(null);
        if (catalogEntry == null) {
            LOG.error("Minecraft " + version + " is not available for installation. Use 'versions --reload' to refresh the version list.");
            return 1;
        }

        var instanceName = Objects.requireNonNullElse(name, catalogEntry.id());
        try {
            installationManager.createInstance(catalogEntry, instanceName, new ProgressPrinter(), CancellationToken.NONE, timeout);
            return 0;
        } catch (InstanceAlreadyExistsException e) {
            LOG.error(e.getMessage());
            return 1;
        } catch (InstallationFailedException e) {
            LOG.error("Installation of '" + instanceName + "' failed", e.getCause());
            return 1;
        } catch (OperationCancelledException e) {
            LOG.error(e.isTimeout() ? "Installation of '" + instanceName + "' timed out after " + timeout : e.getMessage());
            return 1;
        }
    }

    /**
     * Prints a line whenever the overall progress passes another 10%.
     */
    private static class ProgressPrinter implements Consumer<InstallProgress> {
        private final AtomicInteger lastPrinted = new AtomicInteger(-1);

        @Override
        public void accept(InstallProgress progress) {
            var step = progress.getOverallProgress() / 10 * 10;
            if (lastPrinted.getAndAccumulate(step, Math::max) < step) {
                LOG.println("↓ " + step + "% (Minecraft " + progress.minecraftProgress() + "%, assets " + progress.assetsProgress()
                            + "%, libraries " + progress.librariesProgress() + "%, Java " + progress.javaProgress() + "%)");
            }
        }
    }
}
